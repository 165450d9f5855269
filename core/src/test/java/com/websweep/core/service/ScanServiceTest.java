package com.websweep.core.service;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.websweep.core.analyzer.AnalysisContext;
import com.websweep.core.analyzer.components.VulnerableLibraryTable;
import com.websweep.core.event.ScanEvent;
import com.websweep.core.model.Finding;
import com.websweep.core.model.ScanConfig;
import com.websweep.core.model.ScanResultBundle;
import com.websweep.core.model.ScanSummary;
import com.websweep.core.model.ScannedLink;
import com.websweep.core.service.sink.ResultSink;
import com.websweep.core.service.sink.SinkResult;
import com.websweep.core.util.Sleeper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("ScanService — 로컬 HTTP 서버 대상 종단 스캔")
class ScanServiceTest {

    @TempDir
    Path out;

    private HttpServer server;
    private ExecutorService serverPool;
    private String base;

    /** 저장/진행률 호출을 메모리에 남기는 싱크 */
    static final class MemorySink implements ResultSink {
        final Queue<ScanResultBundle> saved = new ConcurrentLinkedQueue<>();
        final Queue<Integer> progress = new ConcurrentLinkedQueue<>();

        @Override
        public SinkResult saveResults(String scanId, ScanResultBundle bundle) {
            saved.add(bundle);
            return SinkResult.ok("memory");
        }

        @Override
        public SinkResult updateProgress(String scanId, int percent, String message) {
            progress.add(percent);
            return SinkResult.ok("memory");
        }
    }

    @BeforeEach
    void startServer() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        serverPool = Executors.newFixedThreadPool(4);
        server.setExecutor(serverPool);
        server.start();
        base = "http://127.0.0.1:" + server.getAddress().getPort();
    }

    @AfterEach
    void stopServer() {
        server.stop(0);
        serverPool.shutdownNow();
    }

    /**
     * / → /about, /search?q=hello, 외부 링크 + 검색 폼
     * /search → q 를 이스케이프 없이 출력, 따옴표가 있으면 SQL 오류
     */
    private void handle(HttpExchange ex) throws IOException {
        String path = ex.getRequestURI().getPath();
        String html;
        int status = 200;
        switch (path) {
            case "/" -> html = "<html><head><title>Home</title></head><body>"
                    + "<a href=\"/about\">About</a> <a href=\"/search?q=hello\">Search</a>"
                    + "<a href=\"http://external.example/\">Elsewhere</a>"
                    + "<form action=\"/search\" method=\"get\"><input name=\"q\"></form>"
                    + "</body></html>";
            case "/about" -> html = "<html><body><p>About us</p><a href=\"/\">Home</a></body></html>";
            case "/search" -> {
                String q = query(ex.getRequestURI().getRawQuery()).getOrDefault("q", "");
                html = q.contains("'")
                        ? "<html><body>You have an error in your SQL syntax near '" + q + "'</body></html>"
                        : "<html><body>Results for " + q + "</body></html>";
            }
            default -> {
                status = 404;
                html = "<html><body>Not Found</body></html>";
            }
        }
        byte[] bytes = html.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", "text/html; charset=utf-8");
        ex.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = ex.getResponseBody()) {
            os.write(bytes);
        }
    }

    private ScanConfig config() {
        ScanConfig cfg = ScanConfig.defaults()
                .setMaxDepth(2)
                .setMaxPages(10)
                .setThreads(2)
                .setMaxRetries(1)
                .setRequestTimeout(Duration.ofSeconds(5))
                .setOutputDir(out);
        cfg.activeProbes().disableAll();
        return cfg;
    }

    private static ScanService service(ScanConfig cfg, MemorySink sink, Queue<ScanEvent> events) {
        return ScanService.builder(cfg)
                .sink(sink)
                .events(events::add)
                .sleeper(Sleeper.NONE)
                .tlsProbe((host, port) -> Optional.empty())
                .libraries(VulnerableLibraryTable.builtIn())
                .build();
    }

    @Test
    @DisplayName("크롤·주입·분석 결과가 번들 하나로 모이고 요약과 일치한다")
    void fullScan() throws Exception {
        MemorySink sink = new MemorySink();
        Queue<ScanEvent> events = new ConcurrentLinkedQueue<>();
        ScanService svc = service(config(), sink, events);

        String id = svc.startScan(base + "/", "scan-1");

        assertEquals("scan-1", id);
        assertEquals(ScanState.COMPLETED, svc.state());
        ScanResultBundle bundle = svc.getResults();
        assertThat(sink.saved).containsExactly(bundle);

        assertThat(bundle.scannedUrls()).containsExactlyInAnyOrder(
                base + "/", base + "/about", base + "/search?q=hello");
        assertThat(bundle.scannedLinks()).extracting(ScannedLink::targetUrl)
                .contains("http://external.example/", base + "/about");
        assertThat(bundle.scannedUrls()).noneMatch(u -> u.contains("external.example"));
        assertThat(bundle.scannedForms()).anySatisfy(f -> {
            assertThat(f.url()).isEqualTo(base + "/");
            assertThat(f.action()).isEqualTo(base + "/search");
        });

        List<String> types = bundle.vulnerabilities().stream().map(Finding::getType).toList();
        assertThat(types).contains("missing_content_security_policy", "sql_injection", "reflected_xss", "xss");

        ScanSummary.ScanInfo info = bundle.summary().scanInfo();
        assertEquals("scan-1", info.scanId());
        assertEquals("completed", info.state());
        assertEquals(3, info.totalUrlsScanned());
        assertEquals(bundle.vulnerabilities().size(), info.totalVulnerabilities());
        assertEquals(bundle.scannedLinks().size(), info.totalLinksScanned());
        assertEquals(bundle.scannedForms().size(), info.totalFormsScanned());
        assertEquals(info.totalVulnerabilities(),
                bundle.summary().vulnerabilitiesByType().values().stream().mapToLong(Long::longValue).sum());
        assertThat(bundle.summary().responseCodes()).containsKey(200);

        assertThat(events).extracting(ScanEvent::kind)
                .contains(ScanEvent.Kind.SCAN_STARTED, ScanEvent.Kind.PAGE_VISITED,
                        ScanEvent.Kind.FINDING_RECORDED, ScanEvent.Kind.SCAN_COMPLETED);
        assertThat(sink.progress).first().isEqualTo(0);
        assertThat(sink.progress).contains(ScanService.PROGRESS_ACCESS_DONE).last().isEqualTo(100);
        assertThat(sink.progress).allSatisfy(p -> assertThat(p).isBetween(0, 100));
    }

    @Test
    @DisplayName("max_depth=0 이면 시드만 방문")
    void depthZero() throws Exception {
        MemorySink sink = new MemorySink();
        ScanService svc = service(config().setMaxDepth(0), sink, new ConcurrentLinkedQueue<>());

        svc.startScan(base + "/", null);

        ScanResultBundle bundle = svc.getResults();
        assertThat(bundle.scannedUrls()).containsExactly(base + "/");
        assertThat(bundle.scanId()).isNotBlank();
        assertThat(bundle.scannedLinks()).isNotEmpty();
    }

    @Test
    @DisplayName("잘못된 시드는 ScanException + FAILED, 결과 없음")
    void invalidSeed() {
        MemorySink sink = new MemorySink();
        Queue<ScanEvent> events = new ConcurrentLinkedQueue<>();
        ScanService svc = service(config(), sink, events);

        assertThatThrownBy(() -> svc.startScan("ftp://files.test/", "bad"))
                .isInstanceOf(ScanException.class)
                .hasMessageContaining("ftp://files.test/");

        assertEquals(ScanState.FAILED, svc.state());
        assertThat(sink.saved).isEmpty();
        assertThat(events).extracting(ScanEvent::kind).containsExactly(ScanEvent.Kind.SCAN_FAILED);
        assertThatThrownBy(svc::getResults).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("도달할 수 없는 시드: FAILED 로 끝나지만 번들은 저장된다")
    void unreachableSeed() throws Exception {
        int closedPort;
        try (ServerSocket s = new ServerSocket(0)) {
            closedPort = s.getLocalPort();
        }
        MemorySink sink = new MemorySink();
        ScanService svc = service(config(), sink, new ConcurrentLinkedQueue<>());

        svc.startScan("http://127.0.0.1:" + closedPort + "/", "down");

        assertEquals(ScanState.FAILED, svc.state());
        ScanResultBundle bundle = sink.saved.peek();
        assertThat(bundle).isNotNull();
        assertEquals("failed", bundle.summary().scanInfo().state());
        assertThat(bundle.summary().errorsByType()).containsKey("connection_error");
        assertThat(bundle.scannedUrls()).containsExactly("http://127.0.0.1:" + closedPort + "/");
    }

    @Test
    @DisplayName("크롤 재시도는 retries_by_type 에 분류별로 남는다")
    void retriesRecordedInSummary() throws Exception {
        int closedPort;
        try (ServerSocket s = new ServerSocket(0)) {
            closedPort = s.getLocalPort();
        }
        MemorySink sink = new MemorySink();
        ScanService svc = service(config().setMaxRetries(3), sink, new ConcurrentLinkedQueue<>());

        svc.startScan("http://127.0.0.1:" + closedPort + "/", "retries");

        ScanSummary summary = svc.getResults().summary();
        assertEquals(2L, summary.retriesByType().get("connection_error"));
        assertEquals(1L, summary.errorsByType().get("connection_error"));
        assertEquals(0, summary.scanInfo().totalRequests());
    }

    @Test
    @DisplayName("스캔 중 취소: 진행 중 페이지를 마무리하고 결과를 저장한 뒤 awaitCompletion 이 풀린다")
    void cancelDrainsAndPersists() throws Exception {
        CountDownLatch firstPage = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        server.removeContext("/");
        // 시드("/") 응답만 release 까지 붙잡는다(접근 제어 스윕 경로는 그대로)
        server.createContext("/", ex -> {
            if ("/".equals(ex.getRequestURI().getPath())) {
                firstPage.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            handle(ex);
        });
        MemorySink sink = new MemorySink();
        Queue<ScanEvent> events = new ConcurrentLinkedQueue<>();
        ScanService svc = service(config(), sink, events);

        ExecutorService runner = Executors.newSingleThreadExecutor();
        try {
            Future<String> scan = runner.submit(() -> svc.startScan(base + "/", "cancel-me"));
            assertThat(firstPage.await(5, TimeUnit.SECONDS)).isTrue();

            svc.cancel();
            assertThat(svc.awaitCompletion(Duration.ofMillis(50))).isFalse();
            release.countDown();

            assertThat(svc.awaitCompletion(Duration.ofSeconds(20))).isTrue();
            assertEquals("cancel-me", scan.get(5, TimeUnit.SECONDS));
        } finally {
            release.countDown();
            runner.shutdownNow();
        }

        assertEquals(ScanState.COMPLETED, svc.state());
        ScanResultBundle bundle = sink.saved.peek();
        assertThat(bundle).isNotNull();
        assertThat(bundle.scannedUrls()).contains(base + "/");
        assertThat(events).anySatisfy(e -> {
            assertThat(e.kind()).isEqualTo(ScanEvent.Kind.SCAN_COMPLETED);
            assertThat(e.attributes()).containsEntry("cancelled", true);
        });
    }

    @Test
    @DisplayName("스캔이 없으면 awaitCompletion 은 바로 true")
    void awaitWithoutScan() throws Exception {
        ScanService svc = service(config(), new MemorySink(), new ConcurrentLinkedQueue<>());
        assertThat(svc.awaitCompletion(Duration.ZERO)).isTrue();
    }

    @Test
    @DisplayName("TLS 핸드셰이크 캐시는 스캔마다 새로 시작한다")
    void tlsCachePerScan() {
        AtomicInteger handshakes = new AtomicInteger();
        ScanService svc = ScanService.builder(config())
                .sink(new MemorySink())
                .sleeper(Sleeper.NONE)
                .tlsProbe((host, port) -> {
                    handshakes.incrementAndGet();
                    return Optional.of("TLSv1.3");
                })
                .libraries(VulnerableLibraryTable.builtIn())
                .build();

        AnalysisContext first = svc.newContext();
        first.tlsProbe().negotiatedProtocol("t.test", 443);
        first.tlsProbe().negotiatedProtocol("t.test", 443);
        svc.newContext().tlsProbe().negotiatedProtocol("t.test", 443);

        assertEquals(2, handshakes.get());
    }

    @Test
    @DisplayName("잘못된 설정은 생성 시점에 거부")
    void invalidConfig() {
        assertThatThrownBy(() -> new ScanService(ScanConfig.defaults().setMaxDepth(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /* --- 헬퍼 --- */

    private static Map<String, String> query(String raw) {
        if (raw == null || raw.isEmpty()) return Map.of();
        Map<String, String> m = new HashMap<>();
        for (String p : raw.split("&")) {
            int i = p.indexOf('=');
            String k = URLDecoder.decode(i < 0 ? p : p.substring(0, i), StandardCharsets.UTF_8);
            String v = i < 0 ? "" : URLDecoder.decode(p.substring(i + 1), StandardCharsets.UTF_8);
            m.put(k, v);
        }
        return m;
    }
}
