package com.websweep.core.api;

import com.websweep.core.model.HttpResponseData;
import com.websweep.core.util.UrlParamUtil;

import java.net.URI;
import java.util.Map;

/**
 * 모든 체크가 공유하는 HTTP 전송 계약.
 * 전송 실패는 예외 대신 status -1 응답으로 돌려준다.
 */
public interface IHttpClient extends AutoCloseable {

    /** 설정된 리다이렉트 정책으로 GET */
    HttpResponseData get(URI url);

    /** followRedirects=false 이면 3xx를 그대로 돌려준다(SSRF 프로브용) */
    HttpResponseData get(URI url, boolean followRedirects);

    HttpResponseData postForm(URI url, Map<String, String> form, boolean followRedirects);

    HttpResponseData postJson(URI url, String json, boolean followRedirects);

    default HttpResponseData get(URI url, Map<String, String> params) {
        return get(params == null || params.isEmpty() ? url : UrlParamUtil.withQuery(url, params));
    }

    default HttpResponseData postForm(URI url, Map<String, String> form) {
        return postForm(url, form, true);
    }

    /** 폼 method에 맞춰 전송(get이면 쿼리 교체, 그 외 post) */
    default HttpResponseData submit(URI action, String method, Map<String, String> data) {
        if ("post".equalsIgnoreCase(method)) return postForm(action, data);
        return get(action, data);
    }

    @Override default void close() {}
}
