package com.websweep.core.analyzer.checks;

import com.websweep.core.analyzer.AnalysisContext;
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
import com.websweep.core.util.Json;
import com.websweep.core.util.UrlParamUtil;
import com.websweep.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * A10 SSRF.
 * URL처럼 보이는 쿼리 파라미터, URL성 이름의 폼 입력, API 경로 하위 엔드포인트에 내부 대상 페이로드를 넣어 본다.
 * 모든 프로브 요청은 리다이렉트를 따르지 않으며 요청 하나당 예산 1을 쓴다.
 */
public final class SsrfAnalyzer implements ResponseAnalyzer {
    private static final Logger LOG = LoggerFactory.getLogger(SsrfAnalyzer.class);

    static final List<String> API_PATH_MARKERS = List.of("/api", "/v1", "/v2", "/rest", "/graphql");
    static final List<String> API_ENDPOINTS = List.of(
            "/fetch", "/proxy", "/import", "/export", "/load", "/url", "/preview", "/download", "/upload",
            "/webhook", "/callback");

    private static final Set<String> FORM_SKIP = Set.of("submit", "button", "image", "hidden");
    private static final Set<String> NOT_FILLED = Set.of("submit", "button", "image");
    private static final Duration PROBE_GAP = Duration.ofMillis(500);
    private static final int MAX_URL_LENGTH = 2000;

    private static final String RECOMMENDATION = "Implement URL validation and whitelist of allowed domains/IPs";
    private static final String CONSEQUENCES = "SSRF vulnerabilities can allow attackers to make requests to internal services, "
            + "access sensitive data, or use the server as a proxy for attacks on other systems.";

    @Override
    public CheckCategory category() { return CheckCategory.SSRF; }

    @Override
    public List<Finding> analyze(Page page, AnalysisContext ctx) {
        if (!ctx.gate().isEnabled(Probe.SSRF)) return List.of();
        List<Finding> out = new ArrayList<>();
        // ---- 1) URL 파라미터 ----
        for (Map.Entry<String, String> e : UrlParamUtil.parseQuery(page.url()).entrySet()) {
            if (!SsrfSignatures.isUrlish(e.getKey())) continue;
            Finding f = probeParameter(page.url(), e.getKey(), e.getValue(), ctx);
            if (f != null) out.add(f);
        }
        // ---- 2) 폼 입력 ----
        for (Form form : page.forms()) {
            out.addAll(probeForm(page.url(), form, ctx));
        }
        // ---- 3) API 엔드포인트 (origin 당 한 번) ----
        if (isApiPath(page.url()) && ctx.firstTime("ssrf-api:" + UrlUtils.origin(page.url()))) {
            out.addAll(probeApi(page.url(), ctx));
        }
        return out;
    }

    /** 값이 URL처럼 보이는 파라미터만. 첫 적중에서 멈춘다. */
    Finding probeParameter(URI url, String name, String original, AnalysisContext ctx) {
        if (!SsrfSignatures.looksLikeUrl(original)) return null;
        for (String target : SsrfSignatures.INTERNAL_TARGETS.subList(0, 3)) {
            for (String tpl : SsrfSignatures.PAYLOAD_TEMPLATES.subList(0, 3)) {
                String payload = SsrfSignatures.payload(tpl, target);
                URI probe = UrlParamUtil.replaceParam(url, name, payload);
                if (probe.toString().length() > MAX_URL_LENGTH) continue;
                if (!ctx.reserve(Probe.SSRF, 1, url.toString()) || !ctx.pace()) return null;

                HttpResponseData resp = ctx.http().get(probe, false);
                if (SsrfSignatures.isSuccessful(resp)) {
                    return paramFinding(url, name, payload, original, Severity.HIGH, resp.getStatusCode(), "response");
                }
                if (SsrfSignatures.isInternalRedirect(resp)) {
                    return paramFinding(url, name, payload, original, Severity.MEDIUM, resp.getStatusCode(), "redirect");
                }
                if (!ctx.pause(PROBE_GAP)) return null;
            }
        }
        return null;
    }

    List<Finding> probeForm(URI pageUrl, Form form, AnalysisContext ctx) {
        List<Finding> out = new ArrayList<>();
        URI action = form.action().isEmpty() ? pageUrl : UrlUtils.parse(form.action());
        if (action == null) return out;

        for (FormInput input : form.inputs()) {
            if (FORM_SKIP.contains(input.type()) || !SsrfSignatures.isUrlish(input.name())) continue;
            probing:
            for (String target : SsrfSignatures.INTERNAL_TARGETS.subList(0, 2)) {
                for (String tpl : SsrfSignatures.PAYLOAD_TEMPLATES.subList(0, 2)) {
                    String payload = SsrfSignatures.payload(tpl, target);
                    Map<String, String> data = new LinkedHashMap<>();
                    for (FormInput field : form.inputs()) {
                        if (field.name().isEmpty()) continue;
                        if (field.name().equals(input.name())) data.put(field.name(), payload);
                        else if (!NOT_FILLED.contains(field.type())) data.put(field.name(), "test");
                    }
                    if (!ctx.reserve(Probe.SSRF, 1, action.toString()) || !ctx.pace()) return out;

                    HttpResponseData resp = form.isPost()
                            ? ctx.http().postForm(action, data, false)
                            : ctx.http().get(UrlParamUtil.withQuery(action, data), false);
                    if (SsrfSignatures.isSuccessful(resp)) {
                        Advice a = advice(Severity.HIGH, "SSRF vulnerability detected in form input '" + input.name() + "'");
                        out.add(Finding.of(FindingType.SSRF_FORM_INPUT, pageUrl.toString(), new FindingDetails.Ssrf(
                                a, null, input.name(), payload, null, action.toString(), form.method(),
                                null, null, null, resp.getStatusCode(), "response")));
                        break probing;
                    }
                    if (!ctx.pause(PROBE_GAP)) return out;
                }
            }
        }
        return out;
    }

    List<Finding> probeApi(URI pageUrl, AnalysisContext ctx) {
        List<Finding> out = new ArrayList<>();
        for (String endpoint : API_ENDPOINTS) {
            URI endpointUrl = UrlUtils.withPath(pageUrl, endpoint);
            for (String target : SsrfSignatures.INTERNAL_TARGETS.subList(0, 2)) {
                String payload = SsrfSignatures.payload("http://{t}/", target);

                if (!ctx.reserve(Probe.SSRF, 1, endpointUrl.toString()) || !ctx.pace()) return out;
                HttpResponseData get = ctx.http().get(UrlParamUtil.withQuery(endpointUrl, Map.of("url", payload)), false);
                if (SsrfSignatures.isSuccessful(get)) {
                    out.add(apiFinding(pageUrl, endpoint, payload, "GET", null, get.getStatusCode()));
                    break;
                }

                if (!ctx.reserve(Probe.SSRF, 1, endpointUrl.toString()) || !ctx.pace()) return out;
                String json = Json.mapper().createObjectNode().put("url", payload).toString();
                HttpResponseData post = ctx.http().postJson(endpointUrl, json, false);
                if (SsrfSignatures.isSuccessful(post)) {
                    out.add(apiFinding(pageUrl, endpoint, payload, "POST", "application/json", post.getStatusCode()));
                    break;
                }
                if (!ctx.pause(PROBE_GAP)) return out;
            }
        }
        LOG.debug("api ssrf probe on {}: {} finding(s)", UrlUtils.origin(pageUrl), out.size());
        return out;
    }

    static boolean isApiPath(URI url) {
        String path = url.getPath() == null ? "" : url.getPath().toLowerCase(Locale.ROOT);
        for (String m : API_PATH_MARKERS) {
            if (path.contains(m)) return true;
        }
        return false;
    }

    /* --- 헬퍼 --- */

    private static Advice advice(Severity severity, String description) {
        return Advice.of(severity, description, RECOMMENDATION, CONSEQUENCES);
    }

    private static Finding paramFinding(URI url, String name, String payload, String original,
                                        Severity severity, int status, String detection) {
        Advice a = advice(severity, "SSRF vulnerability detected in URL parameter '" + name + "'");
        return Finding.of(FindingType.SSRF_URL_PARAMETER, url.toString(), new FindingDetails.Ssrf(
                a, name, null, payload, original, null, null, null, null, null, status, detection));
    }

    private static Finding apiFinding(URI pageUrl, String endpoint, String payload, String method,
                                      String contentType, int status) {
        Advice a = advice(Severity.HIGH, "SSRF vulnerability detected in API endpoint '" + endpoint + "'");
        return Finding.of(FindingType.SSRF_API_ENDPOINT, pageUrl.toString(), new FindingDetails.Ssrf(
                a, null, null, payload, null, null, null, endpoint, method, contentType, status, "response"));
    }
}
