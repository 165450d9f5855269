package com.websweep.core.injection;

import com.websweep.core.analyzer.AnalysisContext;
import com.websweep.core.model.Advice;
import com.websweep.core.model.Finding;
import com.websweep.core.model.FindingDetails;
import com.websweep.core.model.FindingType;
import com.websweep.core.model.HttpResponseData;
import com.websweep.core.model.Severity;
import com.websweep.core.payload.PayloadStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * XSS 프로브.
 * 카탈로그 페이로드의 정확 반사를 먼저 보고, 없으면 임의 마커 페이로드 한 번으로 반사 위치를 확인한다.
 * 폼 필드는 xss, URL 파라미터는 reflected_xss.
 */
public final class XssScanner {
    private static final Logger LOG = LoggerFactory.getLogger(XssScanner.class);

    public static final String EXACT = "exact";
    public static final String MARKER = "marker";

    static final String DESCRIPTION = "Cross-site scripting (XSS) vulnerability detected";
    static final String CRITICAL_DESCRIPTION = "Critical XSS vulnerability - Direct script execution possible";
    static final String WAF_NOTE = "Web Application Firewall detected but not preventing the XSS attack";
    static final Advice ADVICE = Advice.of(Severity.HIGH, DESCRIPTION,
            "Implement proper output encoding and input validation",
            "Attackers can inject malicious JavaScript that executes in users' browsers, allowing them to steal "
                    + "cookies and session tokens, capture keystrokes, redirect users to fake websites, or perform "
                    + "actions on behalf of the victim. This could lead to account takeover, data theft, or spreading "
                    + "malware to your users.");

    private final PayloadStore payloads;

    public XssScanner(PayloadStore payloads) {
        this.payloads = Objects.requireNonNull(payloads, "payloads");
    }

    public Optional<Finding> scan(InjectionTarget target, AnalysisContext ctx) {
        HttpResponseData baseline = target.baseline(ctx.http());
        if (baseline.isTransportFailure()) {
            LOG.debug("xss baseline failed for {} [{}]: {}", target.endpoint(), target.field(), baseline.getError());
            return Optional.empty();
        }
        Duration delay = Duration.ofMillis(ctx.config().injection().getPayloadDelayMs());

        // ---- 1) 카탈로그 페이로드 정확 반사 ----
        boolean first = true;
        for (String payload : payloads.xssPayloads()) {
            if (baseline.getBody().contains(payload)) continue;
            if (!first && !ctx.pause(delay)) return Optional.empty();
            first = false;
            try {
                HttpResponseData resp = target.inject(ctx.http(), payload);
                if (resp.isTransportFailure()) continue;
                if (XssReflection.isReflectedExact(resp.getBody(), payload)) {
                    return Optional.of(finding(target, payload, EXACT, XssReflection.contexts(resp.getBody(), payload), resp));
                }
            } catch (RuntimeException e) {
                PayloadFailures.record(ctx, "xss", target, payload, e);
            }
        }

        // ---- 2) 마커 반사 ----
        if (!first && !ctx.pause(delay)) return Optional.empty();
        String marker = XssReflection.newMarker();
        String payload = XssReflection.markerPayload(marker);
        try {
            HttpResponseData resp = target.inject(ctx.http(), payload);
            if (!resp.isTransportFailure() && XssReflection.isMarkerReflected(resp.getBody(), marker)) {
                return Optional.of(finding(target, payload, MARKER, XssReflection.contexts(resp.getBody(), marker), resp));
            }
        } catch (RuntimeException e) {
            PayloadFailures.record(ctx, "xss", target, payload, e);
        }
        return Optional.empty();
    }

    /* --- 헬퍼 --- */

    private static Finding finding(InjectionTarget t, String payload, String reflection, List<String> contexts,
                                   HttpResponseData resp) {
        Advice advice = ADVICE;
        if (contexts.contains(XssReflection.CONTEXT_SCRIPT)) {
            advice = ADVICE.withSeverity(Severity.CRITICAL).withDescription(CRITICAL_DESCRIPTION);
        }
        boolean waf = XssReflection.isWafBlock(resp);
        FindingDetails.Xss d = new FindingDetails.Xss(advice, t.form(), payload, t.method(),
                t.isForm() ? t.field() : null, t.isForm() ? null : t.field(),
                XssReflection.xssType(payload), reflection, contexts, waf, waf ? WAF_NOTE : null);
        String type = t.isForm() ? FindingType.XSS : FindingType.REFLECTED_XSS;
        LOG.info("{} at {} [{}] ({} reflection, contexts={})", type, t.endpoint(), t.field(), reflection, contexts);
        return Finding.of(type, t.pageUrl().toString(), d);
    }
}
