package com.websweep.core.testutil;

import com.websweep.core.api.IHttpClient;
import com.websweep.core.model.HttpResponseData;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/** 요청을 기록하고 responder 가 만든 응답을 돌려주는 가짜 HTTP 클라이언트 */
public final class FakeHttpClient implements IHttpClient {

    /** 기록된 요청. form/json 은 해당할 때만 채워진다. */
    public record Request(String method, URI url, Map<String, String> form, String json, boolean followRedirects) {}

    private final Function<Request, HttpResponseData> responder;
    private final List<Request> requests = new CopyOnWriteArrayList<>();

    public FakeHttpClient(Function<Request, HttpResponseData> responder) {
        this.responder = responder;
    }

    /** 모든 요청에 같은 상태/본문 */
    public static FakeHttpClient always(int status, String body) {
        return new FakeHttpClient(r -> response(r.url(), status, body));
    }

    public static HttpResponseData response(URI url, int status, String body) {
        return response(url, status, body, Map.of());
    }

    public static HttpResponseData response(URI url, int status, String body, Map<String, List<String>> headers) {
        return HttpResponseData.builder()
                .url(url)
                .statusCode(status)
                .body(body)
                .headers(headers)
                .contentType("text/html; charset=utf-8")
                .responseTimeMs(5)
                .build();
    }

    public List<Request> requests() { return requests; }

    @Override
    public HttpResponseData get(URI url) {
        return get(url, true);
    }

    @Override
    public HttpResponseData get(URI url, boolean followRedirects) {
        return record(new Request("GET", url, Map.of(), null, followRedirects));
    }

    @Override
    public HttpResponseData postForm(URI url, Map<String, String> form, boolean followRedirects) {
        return record(new Request("POST", url, new LinkedHashMap<>(form), null, followRedirects));
    }

    @Override
    public HttpResponseData postJson(URI url, String json, boolean followRedirects) {
        return record(new Request("POST", url, Map.of(), json, followRedirects));
    }

    private HttpResponseData record(Request r) {
        requests.add(r);
        return responder.apply(r);
    }
}
