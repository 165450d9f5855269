package com.websweep.core.service;

import com.websweep.core.analyzer.AnalysisContext;
import com.websweep.core.analyzer.AnalyzerRegistry;
import com.websweep.core.analyzer.components.VulnerableLibraryTable;
import com.websweep.core.crawler.CrawlResult;
import com.websweep.core.crawler.Crawler;
import com.websweep.core.crawler.Page;
import com.websweep.core.crawler.PageFetcher;
import com.websweep.core.crawler.PageHandler;
import com.websweep.core.event.ScanEvent;
import com.websweep.core.event.ScanEventListener;
import com.websweep.core.event.StructuredLogEventListener;
import com.websweep.core.http.CachingTlsProbe;
import com.websweep.core.http.CountingRetryPolicy;
import com.websweep.core.http.ScanHttpClient;
import com.websweep.core.http.SocketTlsProbe;
import com.websweep.core.http.TlsProbe;
import com.websweep.core.http.TransportRetryPolicy;
import com.websweep.core.injection.InjectionRunner;
import com.websweep.core.model.Finding;
import com.websweep.core.model.Form;
import com.websweep.core.model.HttpResponseData;
import com.websweep.core.model.ScanConfig;
import com.websweep.core.model.ScanResultBundle;
import com.websweep.core.payload.PayloadStore;
import com.websweep.core.service.sink.LocalJsonResultSink;
import com.websweep.core.service.sink.ResultSink;
import com.websweep.core.service.sink.SinkResult;
import com.websweep.core.stats.StatsAggregator;
import com.websweep.core.stats.StatsSnapshot;
import com.websweep.core.util.DefaultSleeper;
import com.websweep.core.util.ProgressListener;
import com.websweep.core.util.Sleeper;
import com.websweep.core.util.StructuredLog;
import com.websweep.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 스캔 코디네이터:
 *  - 수명주기 CREATED → RUNNING → {COMPLETED | FAILED}
 *  - 접근 제어 스윕(고정 경로) → 동시 크롤(페이지마다 주입 + 분석) → 통계 확정 → 싱크 저장
 *  - findings/ledger 는 {@link ScanSession}, 카운터는 {@link StatsAggregator}(단일 writer)가 소유
 *  - 싱크/리스너/HTTP 는 생성 시 주입(테스트 대역 가능)
 *
 * 한 인스턴스에서 스캔은 한 번에 하나. startScan 은 호출 스레드에서 끝까지 돈다.
 */
public final class ScanService {

    private static final Logger LOG = LoggerFactory.getLogger(ScanService.class);
    private static final StructuredLog SLOG = StructuredLog.get(ScanService.class);

    static final int PROGRESS_ACCESS_DONE = 10;
    static final int PROGRESS_CRAWL_MAX = 95;

    private final ScanConfig config;
    private final ScanHttpClient http;
    private final AnalyzerRegistry registry;
    private final InjectionRunner injection;
    private final ResultSink sink;
    private final ScanEventListener events;
    private final ProgressListener progress;
    private final Sleeper sleeper;
    private final TlsProbe tlsProbe;
    private final VulnerableLibraryTable libraries;

    private final AtomicBoolean cancel = new AtomicBoolean(false);
    private volatile ScanState state = ScanState.CREATED;
    private volatile ScanResultBundle lastResults;
    private volatile String lastScanId;
    private volatile CountDownLatch finished = new CountDownLatch(0);
    private volatile Crawler crawler;

    /** 기본 구성: 실제 HTTP + 표준 체크 + output_dir 로컬 JSON 싱크 */
    public ScanService(ScanConfig config) {
        this(builder(config));
    }

    private ScanService(Builder b) {
        this.config = Objects.requireNonNull(b.config, "config");
        this.config.validate();
        this.events = (b.events != null) ? b.events : new StructuredLogEventListener();
        this.http = (b.http != null) ? b.http : new ScanHttpClient(config);
        this.registry = (b.registry != null) ? b.registry : AnalyzerRegistry.standard();
        this.injection = (b.injection != null) ? b.injection : new InjectionRunner(PayloadStore.from(config));
        this.sink = (b.sink != null) ? b.sink : new LocalJsonResultSink(config.getOutputDir());
        this.progress = (b.progress != null) ? b.progress : ProgressListener.NONE;
        this.sleeper = (b.sleeper != null) ? b.sleeper : DefaultSleeper.INSTANCE;
        this.tlsProbe = (b.tlsProbe != null) ? b.tlsProbe : new SocketTlsProbe();
        this.libraries = (b.libraries != null) ? b.libraries : VulnerableLibraryTable.load(config.getVulnerableLibrariesFile());
    }

    /* =========================
       실행 API
       ========================= */

    /**
     * 스캔을 끝까지 수행하고 scan ID를 돌려준다.
     * 도달 불가 시드는 FAILED 상태로 끝나지만 부분 결과는 저장된다.
     *
     * @param target 시드 URL (http/https 절대 URL)
     * @param scanId 없으면 UUID 생성
     * @throws ScanException 시드를 해석할 수 없거나 예기치 못한 오류로 스캔이 중단된 경우
     */
    public String startScan(String target, String scanId) throws ScanException {
        final CountDownLatch latch;
        synchronized (this) {
            if (state == ScanState.RUNNING) throw new IllegalStateException("scan already running");
            state = ScanState.RUNNING;
            latch = new CountDownLatch(1);
            finished = latch;
        }
        try {
            return execute(target, scanId);
        } finally {
            latch.countDown();
        }
    }

    public String startScan(String target) throws ScanException {
        return startScan(target, null);
    }

    /** 마지막 스캔의 결과 번들 */
    public ScanResultBundle getResults() {
        ScanResultBundle r = lastResults;
        if (r == null) throw new IllegalStateException("no results available (state=" + state + ")");
        return r;
    }

    /** 새 URL 수락을 멈추고 진행 중 페이지만 마무리하게 한다 */
    public void cancel() {
        cancel.set(true);
        Crawler c = crawler;
        if (c != null) c.cancel();
        LOG.info("Cancel requested for scan {}", lastScanId);
    }

    /**
     * 진행 중인 스캔이 결과 저장까지 마칠 때까지 기다린다.
     * 진행 중인 스캔이 없으면 바로 true, 시간 안에 끝나지 않으면 false.
     */
    public boolean awaitCompletion(Duration timeout) throws InterruptedException {
        long ms = (timeout == null) ? 0 : Math.max(0, timeout.toMillis());
        return finished.await(ms, TimeUnit.MILLISECONDS);
    }

    public ScanState state() { return state; }

    public ScanConfig config() { return config; }

    /* =========================
       내부
       ========================= */

    private String execute(String target, String scanId) throws ScanException {
        cancel.set(false);
        lastResults = null;

        URI seed = UrlUtils.parse(target);
        String id = (scanId == null || scanId.isBlank()) ? UUID.randomUUID().toString() : scanId.trim();
        lastScanId = id;
        if (seed == null) {
            state = ScanState.FAILED;
            LOG.error("Invalid target URL: {}", target);
            SLOG.warn("scan-rejected", "scanId", id, "target", String.valueOf(target));
            events.onEvent(ScanEvent.of(ScanEvent.Kind.SCAN_FAILED, "invalid target URL", "scanId", id, "target", String.valueOf(target)));
            throw new ScanException("Invalid target URL (http/https absolute URL required): " + target);
        }
        seed = UrlUtils.normalize(seed);

        ScanSession session = new ScanSession(id, seed, config, Instant.now());
        try (StatsAggregator stats = new StatsAggregator()) {
            return run(session, stats);
        } catch (RuntimeException e) {
            state = ScanState.FAILED;
            LOG.error("Scan {} aborted: {}", id, e.toString());
            SLOG.error("scan-aborted", e, "scanId", id);
            events.onEvent(ScanEvent.of(ScanEvent.Kind.SCAN_FAILED, e.toString(), "scanId", id));
            throw new ScanException("Scan aborted: " + e.getMessage(), e);
        }
    }

    private String run(ScanSession session, StatsAggregator stats) {
        final String id = session.scanId();
        final URI seed = session.target();
        final int maxPages = Math.max(1, config.getMaxPages());

        LOG.info("Scan start: id={}, target={}, maxDepth={}, maxPages={}, threads={}",
                id, seed, config.getMaxDepth(), maxPages, config.getThreads());
        SLOG.info("scan-start",
                "scanId", id,
                "target", seed.toString(),
                "maxDepth", config.getMaxDepth(),
                "maxPages", maxPages,
                "threads", config.getThreads());
        events.onEvent(ScanEvent.of(ScanEvent.Kind.SCAN_STARTED, "scan started", "scanId", id, "target", seed.toString()));
        report(id, 0, "access", 0, maxPages, "Scan started");

        AnalysisContext ctx = newContext();

        // ---- 1) 접근 제어 스윕(크롤 전, 고정 순서) ----
        if (!cancel.get()) {
            record(session, stats, registry.runSite(seed, ctx));
        }
        report(id, PROGRESS_ACCESS_DONE, "access", 0, maxPages, "Access control sweep completed");

        // ---- 2) 크롤 + 페이지 처리 ----
        Handler handler = new Handler(session, stats, ctx, maxPages);
        PageFetcher fetcher = url -> {
            CountingRetryPolicy policy = new CountingRetryPolicy(TransportRetryPolicy.from(config));
            HttpResponseData resp = http.fetchWithRetry(url, policy, sleeper);
            policy.getRetriedErrors().forEach(stats::retry);
            return resp;
        };
        Crawler c = new Crawler(config, fetcher, handler, cancel, sleeper);
        crawler = c;
        CrawlResult crawl;
        try {
            crawl = c.crawl(seed);
        } finally {
            crawler = null;
        }

        // ---- 3) 확정 + 저장 ----
        StatsSnapshot snap = stats.snapshot();
        boolean seedUnreachable = handler.seedUnreachable.get();
        ScanState end = seedUnreachable ? ScanState.FAILED : ScanState.COMPLETED;
        ScanResultBundle bundle = session.toBundle(snap, crawl.visited(), Instant.now(), end);
        lastResults = bundle;

        SinkResult saved = sink.saveResults(id, bundle);
        if (!saved.success()) {
            LOG.warn("Result sink reported failure for {}: {}", id, saved.message());
        }
        state = end;

        var info = bundle.summary().scanInfo();
        if (end == ScanState.FAILED) {
            LOG.error("Scan {} failed: target unreachable ({})", id, seed);
            events.onEvent(ScanEvent.of(ScanEvent.Kind.SCAN_FAILED, "target unreachable", "scanId", id, "target", seed.toString()));
            report(id, 100, "done", crawl.processed(), maxPages, "Scan failed: target unreachable");
        } else {
            events.onEvent(ScanEvent.of(ScanEvent.Kind.SCAN_COMPLETED, "scan completed",
                    "scanId", id, "vulnerabilities", info.totalVulnerabilities(), "cancelled", crawl.cancelled()));
            report(id, 100, "done", crawl.processed(), maxPages, "Scan completed");
        }

        LOG.info("Scan done. id={}, state={}, urls={}, requests={}, vulnerabilities={}, duration={}s",
                id, end, info.totalUrlsScanned(), info.totalRequests(), info.totalVulnerabilities(), info.duration());
        SLOG.info("scan-done",
                "scanId", id,
                "state", end.label(),
                "urls", info.totalUrlsScanned(),
                "requests", info.totalRequests(),
                "vulnerabilities", info.totalVulnerabilities(),
                "errors", snap.totalErrors(),
                "retries", snap.totalRetries(),
                "cancelled", crawl.cancelled(),
                "saved", saved.success());
        return id;
    }

    /** 스캔 한 번의 체크 컨텍스트. 1회성 키, 프로브 예산, TLS 캐시는 스캔마다 새로 만든다. */
    AnalysisContext newContext() {
        return AnalysisContext.builder(config, http)
                .sleeper(sleeper)
                .tlsProbe(new CachingTlsProbe(tlsProbe))
                .libraries(libraries)
                .events(events)
                .build();
    }

    /** 크롤러 콜백 → 세션/통계/체크 연결 */
    private final class Handler implements PageHandler {
        final ScanSession session;
        final StatsAggregator stats;
        final AnalysisContext ctx;
        final int maxPages;
        final AtomicInteger processed = new AtomicInteger();
        final AtomicBoolean seedUnreachable = new AtomicBoolean(false);

        Handler(ScanSession session, StatsAggregator stats, AnalysisContext ctx, int maxPages) {
            this.session = session;
            this.stats = stats;
            this.ctx = ctx;
            this.maxPages = maxPages;
        }

        @Override
        public void onVisit(URI url, int depth) {
            stats.urlScanned(url.toString());
            events.onEvent(ScanEvent.of(ScanEvent.Kind.PAGE_VISITED, "", "url", url.toString(), "depth", depth));
        }

        @Override
        public void onFetched(URI url, HttpResponseData response) {
            if (response.isTransportFailure()) {
                if (url.equals(session.target())) seedUnreachable.set(true);
                return;
            }
            stats.response(response.getStatusCode(), response.getResponseTimeMs());
        }

        @Override
        public void beforeLinks(Page page) {
            for (Form f : page.forms()) {
                session.addForm(page.url(), f);
                events.onEvent(ScanEvent.of(ScanEvent.Kind.FORM_FOUND, "",
                        "url", page.url().toString(), "action", f.action(), "method", f.method()));
            }
            record(session, stats, injection.run(page, ctx));
        }

        @Override
        public void onLink(URI source, URI target, boolean inScope) {
            session.addLink(source, target);
            events.onEvent(ScanEvent.of(ScanEvent.Kind.LINK_FOUND, "",
                    "source", source.toString(), "target", target.toString(), "inScope", inScope));
        }

        @Override
        public void afterLinks(Page page) {
            record(session, stats, registry.runPage(page, ctx));
            int done = processed.incrementAndGet();
            int pct = PROGRESS_ACCESS_DONE
                    + (int) ((PROGRESS_CRAWL_MAX - PROGRESS_ACCESS_DONE) * Math.min(1.0, (double) done / maxPages));
            report(session.scanId(), pct, "crawl", done, maxPages, "Scanned " + page.url());
        }

        @Override
        public void onErrorPage(Page page, String errorType) {
            failed(page.url(), errorType);
            record(session, stats, registry.runErrorPage(page, ctx));
        }

        @Override
        public void onFailed(URI url, int depth, String errorType) {
            failed(url, errorType);
        }

        private void failed(URI url, String errorType) {
            stats.error(errorType);
            events.onEvent(ScanEvent.of(ScanEvent.Kind.PAGE_FAILED, errorType, "url", url.toString(), "error", errorType));
        }
    }

    /* --- 헬퍼 --- */

    private void record(ScanSession session, StatsAggregator stats, List<Finding> found) {
        for (Finding f : found) {
            session.addFinding(f);
            stats.finding(f.getType());
            events.onEvent(ScanEvent.of(ScanEvent.Kind.FINDING_RECORDED, f.getType(),
                    "type", f.getType(), "url", f.getUrl(), "severity", f.getSeverity().label()));
        }
    }

    /** 진행률: 리스너 + 싱크. 둘 다 실패해도 스캔은 계속. */
    private void report(String scanId, int percent, String phase, long done, long total, String message) {
        try {
            progress.onProgress(percent, phase, done, total);
        } catch (RuntimeException e) {
            LOG.debug("progress listener failed: {}", e.toString());
        }
        SinkResult r = sink.updateProgress(scanId, percent, message);
        if (!r.success()) LOG.debug("progress not delivered: {}", r.message());
        events.onEvent(ScanEvent.of(ScanEvent.Kind.PROGRESS, message, "scanId", scanId, "percent", percent, "phase", phase));
    }

    public static Builder builder(ScanConfig config) {
        return new Builder(config);
    }

    /** DI/테스트용 조립기. 지정하지 않은 협력 객체는 기본 구현을 쓴다. */
    public static final class Builder {
        private final ScanConfig config;
        private ScanHttpClient http;
        private AnalyzerRegistry registry;
        private InjectionRunner injection;
        private ResultSink sink;
        private ScanEventListener events;
        private ProgressListener progress;
        private Sleeper sleeper;
        private TlsProbe tlsProbe;
        private VulnerableLibraryTable libraries;

        private Builder(ScanConfig config) {
            this.config = config;
        }

        public Builder http(ScanHttpClient http) { this.http = http; return this; }
        public Builder registry(AnalyzerRegistry registry) { this.registry = registry; return this; }
        public Builder injection(InjectionRunner injection) { this.injection = injection; return this; }
        public Builder sink(ResultSink sink) { this.sink = sink; return this; }
        public Builder events(ScanEventListener events) { this.events = events; return this; }
        public Builder progress(ProgressListener progress) { this.progress = progress; return this; }
        public Builder sleeper(Sleeper sleeper) { this.sleeper = sleeper; return this; }
        public Builder tlsProbe(TlsProbe tlsProbe) { this.tlsProbe = tlsProbe; return this; }
        public Builder libraries(VulnerableLibraryTable libraries) { this.libraries = libraries; return this; }

        public ScanService build() { return new ScanService(this); }
    }
}
