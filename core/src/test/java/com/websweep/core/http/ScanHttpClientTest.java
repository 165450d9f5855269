package com.websweep.core.http;

import com.sun.net.httpserver.HttpServer;
import com.websweep.core.model.HttpResponseData;
import com.websweep.core.model.ScanConfig;
import com.websweep.core.util.Sleeper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.net.ssl.SSLHandshakeException;
import javax.net.ssl.SSLSession;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.ConnectException;
import java.net.InetSocketAddress;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ScanHttpClient — 응답 매핑, 전송 실패 분류, 재시도")
class ScanHttpClientTest {

    private static final URI URL = URI.create("https://t.test/page");

    /** sleep(Duration) 호출 기록 */
    static class RecordingSleeper implements Sleeper {
        final List<Duration> sleeps = new ArrayList<>();
        @Override public void sleep(Duration d) { sleeps.add(d); }
    }

    /** 테스트용 HttpResponse<String> */
    static class Resp implements HttpResponse<String> {
        final int code;
        final Map<String, List<String>> headers;
        final String body;

        Resp(int code, Map<String, List<String>> headers, String body) {
            this.code = code;
            this.headers = headers;
            this.body = body;
        }

        @Override public int statusCode() { return code; }
        @Override public HttpRequest request() { return null; }
        @Override public Optional<HttpResponse<String>> previousResponse() { return Optional.empty(); }
        @Override public HttpHeaders headers() { return HttpHeaders.of(headers, (a, b) -> true); }
        @Override public String body() { return body; }
        @Override public Optional<SSLSession> sslSession() { return Optional.empty(); }
        @Override public URI uri() { return URL; }
        @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
    }

    private static Resp html(int code, String body) {
        return new Resp(code, Map.of("Content-Type", List.of("text/html; charset=utf-8")), body);
    }

    @Test
    @DisplayName("응답을 상태/헤더/본문/Content-Type 으로 매핑하고 UA/커스텀 헤더를 붙인다")
    void mapsResponseAndSendsHeaders() {
        ScanConfig cfg = ScanConfig.defaults().setUserAgent("Sweep-Test/1")
                .setCustomHeaders(Map.of("X-Scan", "1"));
        List<HttpRequest> sent = new ArrayList<>();
        List<Boolean> follow = new ArrayList<>();
        ScanHttpClient http = new ScanHttpClient(cfg, (req, f) -> {
            sent.add(req);
            follow.add(f);
            return new Resp(200, Map.of("Content-Type", List.of("text/html"), "Set-Cookie", List.of("a=1", "b=2")), "<p>hi</p>");
        });

        HttpResponseData r = http.get(URL, false);

        assertEquals(200, r.getStatusCode());
        assertEquals("GET", r.getMethod());
        assertEquals("<p>hi</p>", r.getBody());
        assertTrue(r.isHtml());
        assertThat(r.headers("set-cookie")).containsExactly("a=1", "b=2");
        assertThat(sent.get(0).headers().firstValue("User-Agent")).contains("Sweep-Test/1");
        assertThat(sent.get(0).headers().firstValue("X-Scan")).contains("1");
        assertThat(follow).containsExactly(false);
    }

    @Test
    @DisplayName("POST 폼은 urlencoded 헤더와 함께 보낸다")
    void postForm() {
        List<HttpRequest> sent = new ArrayList<>();
        ScanHttpClient http = new ScanHttpClient(ScanConfig.defaults(), (req, f) -> {
            sent.add(req);
            return html(200, "ok");
        });

        HttpResponseData r = http.postForm(URL, Map.of("q", "a b"));

        assertEquals("POST", r.getMethod());
        assertEquals("POST", sent.get(0).method());
        assertThat(sent.get(0).headers().firstValue("Content-Type")).contains("application/x-www-form-urlencoded");
    }

    @Test
    @DisplayName("예외는 status -1 + 오류 분류로 바뀐다")
    void exceptionBecomesFailure() {
        ScanHttpClient http = new ScanHttpClient(ScanConfig.defaults(), (req, f) -> {
            throw new UnknownHostException("t.test");
        });

        HttpResponseData r = http.get(URL);

        assertTrue(r.isTransportFailure());
        assertEquals(-1, r.getStatusCode());
        assertEquals("dns_error", r.getError());
    }

    @Test
    @DisplayName("오류 분류: 원인 사슬까지 본다")
    void classify() {
        assertEquals("timeout", ScanHttpClient.classify(new HttpTimeoutException("slow")));
        assertEquals("timeout", ScanHttpClient.classify(new IOException("wrapped", new SocketTimeoutException("read"))));
        assertEquals("dns_error", ScanHttpClient.classify(new UnknownHostException("nope.test")));
        assertEquals("tls_error", ScanHttpClient.classify(new SSLHandshakeException("bad cert")));
        assertEquals("connection_error", ScanHttpClient.classify(new ConnectException("refused")));
        assertEquals("connection_error", ScanHttpClient.classify(new IOException("reset")));
        assertEquals("request_error", ScanHttpClient.classify(new IllegalArgumentException("bad header")));
    }

    @Test
    @DisplayName("전송 실패는 scan_delay 간격으로 재시도, 성공하면 그 응답")
    void retriesTransportFailures() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ScanHttpClient http = new ScanHttpClient(ScanConfig.defaults(), (req, f) -> {
            if (calls.incrementAndGet() < 3) throw new ConnectException("refused");
            return html(200, "ok");
        });
        CountingRetryPolicy policy = new CountingRetryPolicy(new TransportRetryPolicy(3, Duration.ofMillis(250)));
        RecordingSleeper sleeper = new RecordingSleeper();

        HttpResponseData r = http.fetchWithRetry(URL, policy, sleeper);

        assertEquals(200, r.getStatusCode());
        assertEquals(3, calls.get());
        assertThat(sleeper.sleeps).containsExactly(Duration.ofMillis(250), Duration.ofMillis(250));
        assertThat(policy.getRetriedErrors()).containsExactly("connection_error", "connection_error");
    }

    @Test
    @DisplayName("시도 횟수를 다 쓰면 마지막 실패를 돌려준다")
    void exhaustsAttempts() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ScanHttpClient http = new ScanHttpClient(ScanConfig.defaults(), (req, f) -> {
            calls.incrementAndGet();
            throw new HttpTimeoutException("slow");
        });

        HttpResponseData r = http.fetchWithRetry(URL, new TransportRetryPolicy(3, Duration.ZERO), Sleeper.NONE);

        assertEquals(3, calls.get());
        assertEquals("timeout", r.getError());
    }

    @Test
    @DisplayName("HTTP 상태 코드(5xx 포함)는 재시도하지 않는다")
    void httpErrorsAreNotRetried() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        ScanHttpClient http = new ScanHttpClient(ScanConfig.defaults(), (req, f) -> {
            calls.incrementAndGet();
            return html(503, "busy");
        });
        RecordingSleeper sleeper = new RecordingSleeper();

        HttpResponseData r = http.fetchWithRetry(URL, new TransportRetryPolicy(3, Duration.ofSeconds(1)), sleeper);

        assertEquals(503, r.getStatusCode());
        assertEquals(1, calls.get());
        assertThat(sleeper.sleeps).isEmpty();
        assertFalse(r.isTransportFailure());
    }

    @Test
    @DisplayName("Retry-After(초)는 30초 상한으로 존중, 형식이 다르면 정책 지연")
    void retryAfter() {
        Duration fallback = Duration.ofMillis(250);

        assertEquals(Duration.ofSeconds(5), ScanHttpClient.resolveRetryAfterOr(fallback, withRetryAfter("5")));
        assertEquals(Duration.ofSeconds(30), ScanHttpClient.resolveRetryAfterOr(fallback, withRetryAfter("120")));
        assertEquals(fallback, ScanHttpClient.resolveRetryAfterOr(fallback, withRetryAfter("Wed, 21 Oct 2015 07:28:00 GMT")));
    }

    private static HttpResponseData withRetryAfter(String v) {
        return HttpResponseData.builder().url(URL).statusCode(429)
                .headers(Map.of("Retry-After", List.of(v))).body("").build();
    }

    @Test
    @DisplayName("본문은 max_response_size_kb 까지만 읽는다")
    void boundedBody() throws Exception {
        byte[] big = "a".repeat(3000).getBytes(StandardCharsets.UTF_8);
        HttpServer server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/big", ex -> {
            ex.getResponseHeaders().add("Content-Type", "text/plain; charset=utf-8");
            ex.sendResponseHeaders(200, big.length);
            try (OutputStream os = ex.getResponseBody()) {
                os.write(big);
            }
        });
        server.start();
        try {
            ScanConfig cfg = ScanConfig.defaults().setMaxResponseSizeKb(1);
            URI url = URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/big");
            HttpResponseData r = new ScanHttpClient(cfg).get(url);
            assertEquals(200, r.getStatusCode());
            assertEquals(1024, r.getBody().length());
        } finally {
            server.stop(0);
        }
    }

    @Test
    @DisplayName("readBounded: 한도 이하는 그대로, 초과분은 잘라낸다")
    void readBounded() throws Exception {
        byte[] bytes = "hello world".getBytes(StandardCharsets.UTF_8);
        assertEquals("hello", ScanHttpClient.readBounded(new ByteArrayInputStream(bytes), 5, StandardCharsets.UTF_8, URL));
        assertEquals("hello world", ScanHttpClient.readBounded(new ByteArrayInputStream(bytes), 64, StandardCharsets.UTF_8, URL));
        assertEquals("", ScanHttpClient.readBounded(null, 64, StandardCharsets.UTF_8, URL));
    }

    @Test
    @DisplayName("charsetOf: Content-Type 의 charset, 없거나 모르면 UTF-8")
    void charsetOf() {
        assertThat(ScanHttpClient.charsetOf(headers("text/html; charset=ISO-8859-1")))
                .isEqualTo(StandardCharsets.ISO_8859_1);
        assertThat(ScanHttpClient.charsetOf(headers("text/html; Charset=\"utf-16\"")))
                .isEqualTo(StandardCharsets.UTF_16);
        assertThat(ScanHttpClient.charsetOf(headers("text/html"))).isEqualTo(StandardCharsets.UTF_8);
        assertThat(ScanHttpClient.charsetOf(headers("text/html; charset=x-bogus-9"))).isEqualTo(StandardCharsets.UTF_8);
    }

    private static HttpHeaders headers(String contentType) {
        return HttpHeaders.of(Map.of("Content-Type", List.of(contentType)), (a, b) -> true);
    }
}
