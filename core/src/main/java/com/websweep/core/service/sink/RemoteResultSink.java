package com.websweep.core.service.sink;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.websweep.core.model.ScanResultBundle;
import com.websweep.core.util.Json;
import com.websweep.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * 원격 문서 저장소 싱크(scan_id 키).
 * <ul>
 *   <li>결과: {@code PUT <endpoint>/scans/<scan_id>} (번들 JSON)</li>
 *   <li>진행률: {@code POST <endpoint>/scans/<scan_id>/progress}</li>
 * </ul>
 * 2xx 외 응답과 전송 오류는 모두 failed 로 보고한다. 보통 {@link FallbackResultSink}로 감싸서 쓴다.
 */
public class RemoteResultSink implements ResultSink {
    private static final Logger LOG = LoggerFactory.getLogger(RemoteResultSink.class);
    private static final StructuredLog SLOG = StructuredLog.get(RemoteResultSink.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(15);

    private final String endpoint;
    private final Duration timeout;
    private final HttpClient client;

    public RemoteResultSink(URI endpoint) {
        this(endpoint, DEFAULT_TIMEOUT);
    }

    public RemoteResultSink(URI endpoint, Duration timeout) {
        Objects.requireNonNull(endpoint, "endpoint");
        String s = endpoint.toString();
        this.endpoint = s.endsWith("/") ? s.substring(0, s.length() - 1) : s;
        this.timeout = (timeout == null || timeout.isZero() || timeout.isNegative()) ? DEFAULT_TIMEOUT : timeout;
        this.client = HttpClient.newBuilder()
                .connectTimeout(this.timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public SinkResult saveResults(String scanId, ScanResultBundle bundle) {
        URI uri = scanUri(scanId, "");
        try {
            String json = Json.mapper().writeValueAsString(bundle);
            HttpRequest req = request(uri)
                    .PUT(HttpRequest.BodyPublishers.ofString(json, StandardCharsets.UTF_8))
                    .build();
            return exchange(req, scanId, "save");
        } catch (JsonProcessingException e) {
            LOG.warn("Failed to serialize results for {}: {}", scanId, e.toString());
            return SinkResult.failed("Serialization failed: " + e.getOriginalMessage());
        }
    }

    @Override
    public SinkResult updateProgress(String scanId, int percent, String message) {
        ObjectNode body = Json.mapper().createObjectNode()
                .put("scan_id", scanId)
                .put("progress", percent)
                .put("message", message)
                .put("timestamp", Instant.now().toString());
        HttpRequest req = request(scanUri(scanId, "/progress"))
                .POST(HttpRequest.BodyPublishers.ofString(body.toString(), StandardCharsets.UTF_8))
                .build();
        return exchange(req, scanId, "progress");
    }

    /* --- 헬퍼 --- */

    private SinkResult exchange(HttpRequest req, String scanId, String op) {
        try {
            HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
            int sc = resp.statusCode();
            if (sc >= 200 && sc < 300) {
                LOG.debug("remote {} ok: scanId={} status={}", op, scanId, sc);
                return SinkResult.ok("Remote " + op + " ok (" + sc + ")");
            }
            LOG.warn("Remote {} rejected: scanId={} status={}", op, scanId, sc);
            SLOG.warn("remote-sink-rejected", "op", op, "scanId", scanId, "status", sc);
            return SinkResult.failed("Remote " + op + " returned HTTP " + sc);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SinkResult.failed("Remote " + op + " interrupted");
        } catch (IOException | RuntimeException e) {
            LOG.warn("Remote {} failed: scanId={} {}", op, scanId, e.toString());
            SLOG.error("remote-sink-failed", e, "op", op, "scanId", scanId);
            return SinkResult.failed("Remote " + op + " failed: " + e);
        }
    }

    private HttpRequest.Builder request(URI uri) {
        return HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json");
    }

    private URI scanUri(String scanId, String suffix) {
        return URI.create(endpoint + "/scans/" + URLEncoder.encode(scanId, StandardCharsets.UTF_8) + suffix);
    }
}
