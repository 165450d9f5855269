package com.websweep.core.http;

import com.websweep.core.api.IHttpClient;
import com.websweep.core.model.HttpResponseData;
import com.websweep.core.model.ScanConfig;
import com.websweep.core.util.Sleeper;
import com.websweep.core.util.UrlParamUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.net.CookieManager;
import java.net.CookiePolicy;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.net.UnknownHostException;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 스캔 전체가 공유하는 HTTP 클라이언트.
 * 타임아웃, TLS 검증, 프록시, 리다이렉트, 커스텀 헤더, User-Agent를 한 곳에서 설정하고
 * 응답을 HttpResponseData로 매핑한다(예외 시 status -1 + error 분류).
 */
public class ScanHttpClient implements IHttpClient {
    private static final Logger LOG = LoggerFactory.getLogger(ScanHttpClient.class);

    /** Retry-After 상한 */
    private static final Duration MAX_RETRY_AFTER = Duration.ofSeconds(30);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req, boolean followRedirects) throws Exception;
    }

    private final ScanConfig config;
    private final HttpClient client;            // 설정된 리다이렉트 정책
    private final HttpClient noRedirectClient;  // 항상 NEVER
    private final HttpSender sender;            // 테스트 경로(있으면 이걸 사용)
    private final CookieManager cookies;
    private final Set<String> warnedHeaders = ConcurrentHashMap.newKeySet();

    public ScanHttpClient(ScanConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.cookies = new CookieManager(null, CookiePolicy.ACCEPT_ALL);
        this.client = build(config, config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER, cookies);
        this.noRedirectClient = build(config, HttpClient.Redirect.NEVER, cookies);
        this.sender = null;
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public ScanHttpClient(ScanConfig config, HttpSender testSender) {
        this.config = Objects.requireNonNull(config, "config");
        this.cookies = new CookieManager(null, CookiePolicy.ACCEPT_ALL);
        this.client = null;
        this.noRedirectClient = null;
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    // ---------------------------------------------------------------------
    // IHttpClient
    // ---------------------------------------------------------------------

    @Override
    public HttpResponseData get(URI url) {
        return get(url, config.isFollowRedirects());
    }

    @Override
    public HttpResponseData get(URI url, boolean followRedirects) {
        Objects.requireNonNull(url, "url");
        return exchange(url, "GET", () -> base(url).GET().build(), followRedirects);
    }

    @Override
    public HttpResponseData postForm(URI url, Map<String, String> form, boolean followRedirects) {
        Objects.requireNonNull(url, "url");
        String body = UrlParamUtil.encodeForm(form);
        return exchange(url, "POST", () -> base(url)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build(), followRedirects);
    }

    @Override
    public HttpResponseData postJson(URI url, String json, boolean followRedirects) {
        Objects.requireNonNull(url, "url");
        String body = (json == null ? "{}" : json);
        return exchange(url, "POST", () -> base(url)
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build(), followRedirects);
    }

    /**
     * 재시도 포함 GET. 정책이 허용하는 동안 다시 보내고 마지막 응답을 돌려준다.
     * 응답에 Retry-After(초)가 있으면 정책 지연 대신 사용(상한 30초).
     */
    public HttpResponseData fetchWithRetry(URI url, RetryPolicy policy, Sleeper sleeper) throws InterruptedException {
        int attempt = 1;
        while (true) {
            HttpResponseData data = get(url);
            if (!policy.shouldRetry(data, attempt)) {
                return data;
            }
            sleeper.sleep(resolveRetryAfterOr(policy.nextDelay(attempt), data));

            attempt++;
            if (attempt > policy.maxAttempts()) {
                return data;
            }
            LOG.debug("retry {} attempt={} lastError={}", url, attempt, data.getError());
        }
    }

    /** 스캔 세션 쿠키 저장소(Set-Cookie 누적) */
    public CookieManager cookies() { return cookies; }

    public ScanConfig config() { return config; }

    // ---------------------------------------------------------------------
    // 내부
    // ---------------------------------------------------------------------

    @FunctionalInterface
    private interface RequestFactory {
        HttpRequest create();
    }

    private HttpResponseData exchange(URI url, String method, RequestFactory factory, boolean follow) {
        long start = System.nanoTime();
        try {
            HttpRequest req = factory.create();
            int status;
            HttpHeaders hh;
            String body;
            if (sender != null) {
                HttpResponse<String> resp = sender.send(req, follow);
                status = resp.statusCode();
                hh = resp.headers();
                body = resp.body();
            } else {
                HttpResponse<InputStream> resp = (follow ? client : noRedirectClient)
                        .send(req, HttpResponse.BodyHandlers.ofInputStream());
                status = resp.statusCode();
                hh = resp.headers();
                body = readBounded(resp.body(), maxBodyBytes(), charsetOf(hh), url);
            }

            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            return HttpResponseData.builder()
                    .url(url)
                    .method(method)
                    .statusCode(status)
                    .headers(hh.map())
                    .body(body == null ? "" : body)
                    .contentType(hh.firstValue("Content-Type").orElse(null))
                    .responseTimeMs(elapsedMs)
                    .build();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return HttpResponseData.failure(url, method, "interrupted", elapsedSince(start));
        } catch (Exception e) {
            String kind = classify(e);
            LOG.debug("{} {} failed: {} ({})", method, url, kind, e.toString());
            return HttpResponseData.failure(url, method, kind, elapsedSince(start));
        }
    }

    private HttpRequest.Builder base(URI url) {
        HttpRequest.Builder b = HttpRequest.newBuilder(url)
                .timeout(config.getRequestTimeout())
                .header("User-Agent", config.getUserAgent());
        for (var h : config.getCustomHeaders().entrySet()) {
            try {
                b.setHeader(h.getKey(), h.getValue());
            } catch (IllegalArgumentException e) {
                // Host, Connection 등 HttpClient가 막는 헤더
                if (warnedHeaders.add(h.getKey())) {
                    LOG.warn("custom header '{}' is not allowed by the HTTP client; ignored", h.getKey());
                }
            }
        }
        return b;
    }

    /** 예외 → errors_by_type 분류 */
    public static String classify(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof HttpTimeoutException || t instanceof SocketTimeoutException) return "timeout";
            if (t instanceof UnknownHostException) return "dns_error";
            if (t instanceof SSLException) return "tls_error";
            if (t instanceof ConnectException) return "connection_error";
        }
        if (e instanceof IOException) return "connection_error";
        return "request_error";
    }

    private int maxBodyBytes() {
        return (int) Math.min(Integer.MAX_VALUE - 8L, config.getMaxResponseSizeKb() * 1024L);
    }

    /** 본문을 max 바이트까지만 읽고 나머지는 스트림을 닫아 버린다 */
    static String readBounded(InputStream in, int max, Charset charset, URI url) throws IOException {
        if (in == null) return "";
        try (InputStream is = in) {
            byte[] bytes = is.readNBytes(max + 1);
            if (bytes.length > max) {
                LOG.debug("response body of {} truncated at {} bytes", url, max);
                bytes = Arrays.copyOf(bytes, max);
            }
            return new String(bytes, charset);
        }
    }

    /** Content-Type 의 charset, 없거나 모르면 UTF-8 */
    static Charset charsetOf(HttpHeaders headers) {
        String ct = headers.firstValue("Content-Type").orElse("");
        for (String part : ct.split(";")) {
            String p = part.trim();
            if (p.regionMatches(true, 0, "charset=", 0, 8)) {
                String name = p.substring(8).replace("\"", "").trim();
                try {
                    return Charset.forName(name);
                } catch (IllegalArgumentException e) {
                    LOG.debug("unknown charset '{}'; using UTF-8", name);
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    private static long elapsedSince(long startNs) {
        return (System.nanoTime() - startNs) / 1_000_000;
    }

    /** Retry-After(초)를 존중하되 30초로 상한. HTTP-date 형식은 fallback. */
    static Duration resolveRetryAfterOr(Duration fallback, HttpResponseData data) {
        String v = data.header("Retry-After");
        if (v == null || v.isBlank()) return fallback;
        try {
            long sec = Long.parseLong(v.trim());
            if (sec < 0) return fallback;
            Duration d = Duration.ofSeconds(sec);
            return d.compareTo(MAX_RETRY_AFTER) > 0 ? MAX_RETRY_AFTER : d;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    private static HttpClient build(ScanConfig cfg, HttpClient.Redirect redirect, CookieManager cookies) {
        HttpClient.Builder b = HttpClient.newBuilder()
                .followRedirects(redirect)
                .connectTimeout(cfg.getRequestTimeout())
                .cookieHandler(cookies);

        if (cfg.isUseProxy()) {
            ProxySelector ps = proxySelector(cfg.getProxyUrl());
            if (ps != null) b.proxy(ps);
        }
        if (!cfg.isVerifySsl()) {
            b.sslContext(trustAllContext());
            SSLParameters params = new SSLParameters();
            params.setEndpointIdentificationAlgorithm(null);
            b.sslParameters(params);
        }
        return b.build();
    }

    private static ProxySelector proxySelector(String proxyUrl) {
        try {
            URI p = URI.create(proxyUrl.trim());
            if (p.getHost() == null) {
                LOG.warn("proxy_url '{}' has no host; proxy disabled", proxyUrl);
                return null;
            }
            int port = p.getPort() > 0 ? p.getPort() : 8080;
            return ProxySelector.of(new InetSocketAddress(p.getHost(), port));
        } catch (IllegalArgumentException e) {
            LOG.warn("invalid proxy_url '{}': {}; proxy disabled", proxyUrl, e.getMessage());
            return null;
        }
    }

    /** verify_ssl=false: 인증서/호스트명 검증 없음 */
    private static SSLContext trustAllContext() {
        TrustManager[] trustAll = { new X509TrustManager() {
            @Override public void checkClientTrusted(X509Certificate[] chain, String authType) {}
            @Override public void checkServerTrusted(X509Certificate[] chain, String authType) {}
            @Override public X509Certificate[] getAcceptedIssuers() { return new X509Certificate[0]; }
        }};
        try {
            SSLContext ctx = SSLContext.getInstance("TLS");
            ctx.init(null, trustAll, new SecureRandom());
            return ctx;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("cannot initialise TLS context", e);
        }
    }
}
