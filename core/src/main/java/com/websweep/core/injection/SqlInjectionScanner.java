package com.websweep.core.injection;

import com.websweep.core.analyzer.AnalysisContext;
import com.websweep.core.model.Advice;
import com.websweep.core.model.Finding;
import com.websweep.core.model.FindingDetails;
import com.websweep.core.model.FindingType;
import com.websweep.core.model.HttpResponseData;
import com.websweep.core.model.ScanConfig;
import com.websweep.core.model.Severity;
import com.websweep.core.payload.PayloadStore;
import com.websweep.core.payload.SqlPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * SQL 인젝션 프로브.
 * 기준 응답을 받은 뒤 페이로드를 순서대로 넣어 보고, 첫 확인에서 해당 필드를 마친다.
 * 판정 순서: 오류 시그니처 → 기대 결과 문자열 → 길이 차이 → 응답 지연.
 */
public final class SqlInjectionScanner {
    private static final Logger LOG = LoggerFactory.getLogger(SqlInjectionScanner.class);

    public static final String ERROR_BASED = "Error based";
    public static final String RESULT_BASED = "Result based";
    public static final String LENGTH_BASED = "Length based";
    public static final String TIME_BASED = "Time based";

    static final Advice ADVICE = Advice.of(Severity.HIGH,
            "SQL injection vulnerability detected",
            "Use parameterized queries and input validation",
            "Without proper input validation, attackers could inject malicious SQL commands that might access, "
                    + "modify, or delete data in your database. This could lead to unauthorized access, data theft, "
                    + "data loss, or complete system compromise.");

    private final PayloadStore payloads;

    public SqlInjectionScanner(PayloadStore payloads) {
        this.payloads = Objects.requireNonNull(payloads, "payloads");
    }

    public Optional<Finding> scan(InjectionTarget target, AnalysisContext ctx) {
        HttpResponseData baseline = target.baseline(ctx.http());
        if (baseline.isTransportFailure()) {
            LOG.debug("sqli baseline failed for {} [{}]: {}", target.endpoint(), target.field(), baseline.getError());
            return Optional.empty();
        }
        ScanConfig.Injection settings = ctx.config().injection();
        Duration delay = Duration.ofMillis(settings.getPayloadDelayMs());

        boolean first = true;
        for (SqlPayload p : payloads.sqlPayloads()) {
            if (!first && !ctx.pause(delay)) return Optional.empty();
            first = false;
            try {
                HttpResponseData resp = target.inject(ctx.http(), p.payload());
                if (resp.isTransportFailure()) continue;
                Optional<String> method = detect(resp, p, baseline, settings);
                if (method.isPresent()) {
                    LOG.info("SQL injection at {} [{}] via {} ({})", target.endpoint(), target.field(), p.name(), method.get());
                    return Optional.of(finding(target, p, method.get()));
                }
            } catch (RuntimeException e) {
                PayloadFailures.record(ctx, "sqli", target, p.payload(), e);
            }
        }
        return Optional.empty();
    }

    /**
     * 첫 번째로 맞는 탐지 방식. 기대 결과 문자열은 기준 응답에 이미 있으면 쓰지 않는다.
     */
    public static Optional<String> detect(HttpResponseData resp, SqlPayload payload,
                                          HttpResponseData baseline, ScanConfig.Injection settings) {
        String body = resp.getBody();
        String base = baseline == null ? "" : baseline.getBody();

        if (SqlErrorSignatures.isVulnerableToSqlInjection(body, payload.payload())) return Optional.of(ERROR_BASED);
        if (payload.hasExpectedResult() && body.contains(payload.expectedResult())
                && !base.contains(payload.expectedResult())) {
            return Optional.of(RESULT_BASED);
        }
        if (Math.abs(body.length() - base.length()) > settings.getLengthDeltaThreshold()) return Optional.of(LENGTH_BASED);
        if (resp.getResponseTimeMs() > settings.getTimeThresholdMs()) return Optional.of(TIME_BASED);
        return Optional.empty();
    }

    /* --- 헬퍼 --- */

    private static Finding finding(InjectionTarget t, SqlPayload p, String detection) {
        FindingDetails.SqlInjection d = new FindingDetails.SqlInjection(ADVICE, t.form(), p.payload(), p.name(),
                t.method(), t.isForm() ? t.field() : null, t.isForm() ? null : t.field(), detection);
        return Finding.of(FindingType.SQL_INJECTION, t.pageUrl().toString(), d);
    }
}
