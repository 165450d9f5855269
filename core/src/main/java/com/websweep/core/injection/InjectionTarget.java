package com.websweep.core.injection;

import com.websweep.core.api.IHttpClient;
import com.websweep.core.model.Form;
import com.websweep.core.model.HttpResponseData;
import com.websweep.core.util.UrlParamUtil;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 주입 대상 하나: 폼 필드 또는 URL 쿼리 파라미터.
 * 나머지 필드는 원래 값으로 고정하고 {@link #field()}만 바꿔 보낸다.
 *
 * @param pageUrl 폼/파라미터를 발견한 페이지
 * @param endpoint 요청 URL(폼 action 또는 페이지 URL)
 * @param method "get" | "post"
 * @param fields 원래 값 기준 필드 맵(URL 파라미터면 쿼리 전체)
 * @param field 주입할 필드 이름
 * @param form 폼 대상이면 원본 폼, URL 파라미터면 null
 */
public record InjectionTarget(URI pageUrl, URI endpoint, String method, Map<String, String> fields,
                              String field, Form form) {

    public InjectionTarget {
        Objects.requireNonNull(pageUrl, "pageUrl");
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(field, "field");
        method = "post".equalsIgnoreCase(method) ? "post" : "get";
        fields = (fields == null ? Map.of() : new LinkedHashMap<>(fields));
    }

    public static InjectionTarget formField(URI pageUrl, URI action, Form form, String field) {
        return new InjectionTarget(pageUrl, action, form.method(), form.defaultFields(), field, form);
    }

    public static InjectionTarget urlParameter(URI pageUrl, String parameter) {
        return new InjectionTarget(pageUrl, pageUrl, "get", UrlParamUtil.parseQuery(pageUrl), parameter, null);
    }

    public boolean isForm() { return form != null; }

    /** 원래 값 그대로 보낸 응답(비교 기준) */
    public HttpResponseData baseline(IHttpClient http) {
        return send(http, fields);
    }

    /** field 만 value 로 바꿔 보낸다 */
    public HttpResponseData inject(IHttpClient http, String value) {
        Map<String, String> data = new LinkedHashMap<>(fields);
        data.put(field, value);
        return send(http, data);
    }

    /** 주입된 요청 URL(GET이면 쿼리 포함) */
    public URI injectedUrl(String value) {
        if (!"get".equals(method)) return endpoint;
        Map<String, String> data = new LinkedHashMap<>(fields);
        data.put(field, value);
        return UrlParamUtil.withQuery(endpoint, data);
    }

    /* --- 헬퍼 --- */

    private HttpResponseData send(IHttpClient http, Map<String, String> data) {
        return http.submit(endpoint, method, data);
    }
}
