package com.websweep.core.service.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.sun.net.httpserver.HttpServer;
import com.websweep.core.testutil.TestBundles;
import com.websweep.core.util.Json;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("RemoteResultSink — PUT /scans/{id}, POST /scans/{id}/progress")
class RemoteResultSinkTest {

    /** method path body */
    record Received(String method, String path, String body) {}

    private HttpServer server;
    private final Queue<Received> received = new ConcurrentLinkedQueue<>();
    private final AtomicInteger status = new AtomicInteger(200);

    @BeforeEach
    void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", ex -> {
            String body;
            try (InputStream in = ex.getRequestBody()) {
                body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            received.add(new Received(ex.getRequestMethod(), ex.getRequestURI().getRawPath(), body));
            ex.sendResponseHeaders(status.get(), -1);
            ex.close();
        });
        server.start();
    }

    @AfterEach
    void stop() {
        server.stop(0);
    }

    private RemoteResultSink sink() {
        return new RemoteResultSink(URI.create("http://127.0.0.1:" + server.getAddress().getPort() + "/api/"),
                Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("결과는 PUT 으로 번들 JSON 을 보낸다")
    void saveIsPut() throws Exception {
        SinkResult r = sink().saveResults("scan 1", TestBundles.sample("scan 1"));

        assertTrue(r.success(), r.message());
        Received req = received.peek();
        assertEquals("PUT", req.method());
        assertEquals("/api/scans/scan+1", req.path());
        JsonNode json = Json.mapper().readTree(req.body());
        assertEquals("scan 1", json.get("summary").get("scan_info").get("scan_id").asText());
        assertThat(json.has("vulnerabilities")).isTrue();
    }

    @Test
    @DisplayName("진행률은 POST, 본문에 scan_id/progress/message/timestamp")
    void progressIsPost() throws Exception {
        SinkResult r = sink().updateProgress("s-1", 42, "crawling");

        assertTrue(r.success());
        Received req = received.peek();
        assertEquals("POST", req.method());
        assertEquals("/api/scans/s-1/progress", req.path());
        JsonNode json = Json.mapper().readTree(req.body());
        assertEquals("s-1", json.get("scan_id").asText());
        assertEquals(42, json.get("progress").asInt());
        assertEquals("crawling", json.get("message").asText());
        assertThat(json.get("timestamp").asText()).isNotBlank();
    }

    @Test
    @DisplayName("2xx 가 아니면 failed")
    void non2xxFails() {
        status.set(503);

        SinkResult r = sink().saveResults("s-1", TestBundles.sample("s-1"));

        assertFalse(r.success());
        assertThat(r.message()).contains("503");
    }

    @Test
    @DisplayName("연결할 수 없으면 failed, 예외는 밖으로 나가지 않는다")
    void unreachable() throws IOException {
        int port;
        try (ServerSocket s = new ServerSocket(0)) {
            port = s.getLocalPort();
        }
        RemoteResultSink sink = new RemoteResultSink(URI.create("http://127.0.0.1:" + port), Duration.ofSeconds(2));

        SinkResult r = sink.updateProgress("s-1", 10, "x");

        assertFalse(r.success());
        assertThat(r.message()).startsWith("Remote progress failed");
    }
}
