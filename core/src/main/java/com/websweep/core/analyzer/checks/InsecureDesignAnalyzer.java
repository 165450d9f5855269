package com.websweep.core.analyzer.checks;

import com.websweep.core.analyzer.AnalysisContext;
import com.websweep.core.analyzer.HtmlSupport;
import com.websweep.core.analyzer.ResponseAnalyzer;
import com.websweep.core.analyzer.budget.ActiveProbeGate.Probe;
import com.websweep.core.crawler.Page;
import com.websweep.core.model.Advice;
import com.websweep.core.model.CheckCategory;
import com.websweep.core.model.Finding;
import com.websweep.core.model.FindingDetails;
import com.websweep.core.model.FindingType;
import com.websweep.core.model.Form;
import com.websweep.core.model.FormInput;
import com.websweep.core.model.HttpResponseData;
import com.websweep.core.model.Severity;
import com.websweep.core.util.UrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A04 안전하지 않은 설계: 폼별 CSRF 토큰 부재 + (능동) 레이트 리밋 부재.
 * 레이트 리밋 프로브는 POST 폼을 3회 제출해 429나 제한 문구가 없으면 보고한다.
 */
public final class InsecureDesignAnalyzer implements ResponseAnalyzer {
    private static final Logger LOG = LoggerFactory.getLogger(InsecureDesignAnalyzer.class);

    static final List<String> CSRF_FIELD_NAMES = List.of(
            "csrf", "csrf_token", "csrfmiddlewaretoken", "_csrf", "xsrf", "token", "_token",
            "authenticity_token", "csrf-token", "__requestverificationtoken");

    static final List<String> CSRF_HEADER_NAMES = List.of("x-csrf-token", "x-xsrf-token");

    static final List<String> RATE_LIMIT_TEXT = List.of(
            "rate limit", "too many requests", "try again later", "slow down", "too many attempts", "temporary block");

    static final int PROBE_SUBMISSIONS = 3;
    private static final Duration PROBE_GAP = Duration.ofSeconds(1);

    private static final Advice CSRF = Advice.of(Severity.MEDIUM,
            "Form missing CSRF protection",
            "Implement CSRF tokens for all state-changing forms",
            "Without CSRF protection, attackers can trick users into submitting unauthorized requests");

    private static final Advice NO_RATE_LIMIT = Advice.of(Severity.MEDIUM,
            "Form missing rate limiting protection",
            "Implement rate limiting for all forms to prevent abuse",
            "Without rate limiting, attackers can flood your application with requests, leading to DoS conditions or automated attacks");

    @Override
    public CheckCategory category() { return CheckCategory.INSECURE_DESIGN; }

    @Override
    public List<Finding> analyze(Page page, AnalysisContext ctx) {
        List<Finding> out = new ArrayList<>();
        String url = page.url().toString();
        for (Form form : page.forms()) {
            if (form.action().isEmpty()) continue;
            if (!hasCsrfProtection(form, page.document(), page.response().bodyLower())) {
                out.add(Finding.of(FindingType.INSECURE_DESIGN_CSRF, url,
                        new FindingDetails.FormCheck(CSRF, form.action(), form.method())));
            }
            if (lacksRateLimiting(form, ctx)) {
                out.add(Finding.of(FindingType.INSECURE_DESIGN_NO_RATE_LIMITING, url,
                        new FindingDetails.FormCheck(NO_RATE_LIMIT, form.action(), form.method())));
            }
        }
        return out;
    }

    /** 필드 이름, meta 태그, 본문 내 헤더 이름 중 하나라도 CSRF 흔적이 있으면 true */
    public static boolean hasCsrfProtection(Form form, Document doc, String lowerBody) {
        for (FormInput in : form.inputs()) {
            String n = in.name().toLowerCase(Locale.ROOT);
            if (CSRF_FIELD_NAMES.stream().anyMatch(n::contains)) return true;
        }
        if (doc != null) {
            for (Element meta : doc.select("meta[name]")) {
                if (meta.attr("name").toLowerCase(Locale.ROOT).contains("csrf")) return true;
            }
        }
        return HtmlSupport.containsAny(lowerBody, CSRF_HEADER_NAMES);
    }

    /**
     * 능동 프로브 결과 "레이트 리밋 없음"이면 true.
     * 프로브를 못 돌렸거나(비활성/예산/대상 아님) 도중 실패하면 false.
     */
    boolean lacksRateLimiting(Form form, AnalysisContext ctx) {
        if (!form.isPost() || form.inputs().isEmpty() || form.hasInputOfType("file")) return false;
        Map<String, String> data = probeData(form);
        if (data.isEmpty()) return false;
        URI action = UrlUtils.parse(form.action());
        if (action == null) return false;
        if (!ctx.reserve(Probe.RATE_LIMIT, PROBE_SUBMISSIONS, form.action())) return false;

        int accepted = 0;
        for (int i = 0; i < PROBE_SUBMISSIONS; i++) {
            if (!ctx.pace()) return false;
            HttpResponseData resp = ctx.http().postForm(action, data);
            if (resp.isTransportFailure()) {
                LOG.debug("rate-limit probe on {} aborted: {}", action, resp.getError());
                return false;
            }
            if (resp.getStatusCode() == 429) return false;
            if (resp.getStatusCode() < 400) accepted++;
            if (HtmlSupport.containsAny(resp.bodyLower(), RATE_LIMIT_TEXT)) return false;
            if (i + 1 < PROBE_SUBMISSIONS && !ctx.pause(PROBE_GAP)) return false;
        }
        return accepted == PROBE_SUBMISSIONS;
    }

    /* --- 헬퍼 --- */

    static Map<String, String> probeData(Form form) {
        long now = System.currentTimeMillis() / 1000;
        Map<String, String> data = new LinkedHashMap<>();
        for (FormInput in : form.fillableInputs()) {
            String v = switch (in.type()) {
                case "email" -> "test" + now + "@example.com";
                case "password" -> "TestPassword123!";
                case "number" -> "123";
                case "checkbox", "radio" -> in.value().isEmpty() ? "on" : in.value();
                default -> "Test value " + now;
            };
            data.put(in.name(), v);
        }
        return data;
    }
}
