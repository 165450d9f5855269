package com.websweep.core.model;

import java.net.URI;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * HTTP 응답 캡처(본문은 텍스트 기준).
 * 전송 실패는 예외 대신 statusCode -1 + error 분류로 표현한다.
 */
public final class HttpResponseData {
    private final URI url;
    private final String method;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final String body;
    private final String contentType;
    private final long responseTimeMs;
    private final String error;

    private HttpResponseData(Builder b) {
        this.url = b.url;
        this.method = (b.method == null ? "GET" : b.method);
        this.statusCode = b.statusCode;
        this.headers = (b.headers == null) ? Map.of() : Collections.unmodifiableMap(b.headers);
        this.body = (b.body == null) ? "" : b.body;
        this.contentType = b.contentType;
        this.responseTimeMs = b.responseTimeMs;
        this.error = b.error;
    }

    public URI getUrl() { return url; }
    public String getMethod() { return method; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public String getBody() { return body; }
    public String getContentType() { return contentType; }
    public long getResponseTimeMs() { return responseTimeMs; }

    /** 전송 실패 분류(timeout, connection_error, dns_error, tls_error, request_error, interrupted). 성공이면 null. */
    public String getError() { return error; }

    /** 네트워크/전송 단계 실패 여부 */
    public boolean isTransportFailure() { return statusCode < 0; }

    public boolean isOk() { return statusCode == 200; }

    /** Content-Type이 없으면 HTML로 간주(보수적) */
    public boolean isHtml() {
        if (contentType == null || contentType.isBlank()) return true;
        String ct = contentType.toLowerCase(Locale.ROOT);
        return ct.contains("text/html") || ct.contains("application/xhtml");
    }

    /** 소문자 본문(휴리스틱 매칭용) */
    public String bodyLower() { return body.toLowerCase(Locale.ROOT); }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        List<String> vs = headers(name);
        return vs.isEmpty() ? null : vs.get(0);
    }

    /** 모든 헤더 값(대소문자 무시). 없으면 빈 리스트. */
    public List<String> headers(String name) {
        if (name == null) return List.of();
        for (var e : headers.entrySet()) {
            final String k = e.getKey();
            if (k != null && k.equalsIgnoreCase(name)) {
                return (e.getValue() != null) ? e.getValue() : List.of();
            }
        }
        return List.of();
    }

    public boolean hasHeader(String name) {
        String v = header(name);
        return v != null && !v.isBlank();
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    /** 전송 실패 응답 */
    public static HttpResponseData failure(URI url, String method, String error, long elapsedMs) {
        return builder().url(url).method(method).statusCode(-1).error(error).responseTimeMs(elapsedMs).build();
    }

    public static final class Builder {
        private URI url;
        private String method;
        private int statusCode;
        private Map<String, List<String>> headers;
        private String body;
        private String contentType;
        private long responseTimeMs;
        private String error;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder method(String method) { this.method = method; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }
        public Builder error(String error) { this.error = error; return this; }

        public HttpResponseData build() {
            Objects.requireNonNull(url, "url");
            return new HttpResponseData(this);
        }
    }
}
