package com.websweep.core.crawler;

import com.websweep.core.api.ICrawler;
import com.websweep.core.model.Form;
import com.websweep.core.model.HttpResponseData;
import com.websweep.core.model.ScanConfig;
import com.websweep.core.util.NamedThreadFactory;
import com.websweep.core.util.Sleeper;
import com.websweep.core.util.StructuredLog;
import com.websweep.core.util.UrlExclusion;
import com.websweep.core.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 동시 BFS 크롤러.
 * - 워커 N개(threads)가 하나의 작업 큐를 공유
 * - 방문 판정은 {@link VisitFrontier}의 원자적 claim
 * - 같은 등록 도메인 + include/exclude 패턴을 통과한 링크만 depth+1로 enqueue
 * - pending(큐+진행 중) 카운터가 0이 되면 종료(wait-group)
 * - 취소 플래그 또는 max_scan_duration 초과 시 새 URL을 받지 않고 진행 중 작업만 마무리
 */
public class Crawler implements ICrawler {
    private static final Logger LOG = LoggerFactory.getLogger(Crawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(Crawler.class);

    private static final long DRAIN_TIMEOUT_S = 30;

    private final ScanConfig config;
    private final PageFetcher fetcher;
    private final PageHandler handler;
    private final LinkExtractor linkExtractor;
    private final FormExtractor formExtractor;
    private final AtomicBoolean cancel;
    private final Sleeper sleeper;
    private volatile Run current;

    public Crawler(ScanConfig config, PageFetcher fetcher, PageHandler handler,
                   AtomicBoolean cancel, Sleeper sleeper) {
        this(config, fetcher, handler, new JsoupLinkExtractor(), new JsoupFormExtractor(), cancel, sleeper);
    }

    public Crawler(ScanConfig config, PageFetcher fetcher, PageHandler handler,
                   LinkExtractor linkExtractor, FormExtractor formExtractor,
                   AtomicBoolean cancel, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.linkExtractor = Objects.requireNonNull(linkExtractor, "linkExtractor");
        this.formExtractor = Objects.requireNonNull(formExtractor, "formExtractor");
        this.cancel = (cancel == null ? new AtomicBoolean(false) : cancel);
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public CrawlResult crawl(URI seed) {
        URI start = UrlUtils.normalize(Objects.requireNonNull(seed, "seed"));
        int workers = Math.max(1, config.getThreads());
        LOG.info("Crawl start: seed={}, maxDepth={}, maxPages={}, threads={}",
                start, config.getMaxDepth(), config.getMaxPages(), workers);

        Run run = new Run(start, workers);
        current = run;
        boolean cancelled;
        try {
            run.offer(start, 0);
            cancelled = run.await();
        } finally {
            current = null;
        }

        CrawlResult result = new CrawlResult(run.frontier.visited(), run.processed.get(), run.failed.get(), cancelled);
        LOG.info("Crawl done: visited={}, processed={}, failed={}, cancelled={}",
                result.visited().size(), result.processed(), result.failed(), cancelled);
        SLOG.info("crawl-done",
                "visited", result.visited().size(),
                "processed", result.processed(),
                "failed", result.failed(),
                "cancelled", cancelled);
        return result;
    }

    /** 새 URL 수락을 멈추고 대기 중인 crawl()을 깨운다. 진행 중 페이지는 drain 단계에서 마무리된다. */
    public void cancel() {
        cancel.set(true);
        Run r = current;
        if (r != null) r.done.countDown();
    }

    /** 크롤 1회분 상태 */
    private final class Run {
        final URI seed;
        final VisitFrontier frontier = new VisitFrontier(config.getMaxDepth(), config.getMaxPages());
        final ExecutorService exec;
        final AtomicInteger pending = new AtomicInteger();
        final CountDownLatch done = new CountDownLatch(1);
        final AtomicInteger processed = new AtomicInteger();
        final AtomicInteger failed = new AtomicInteger();

        Run(URI seed, int workers) {
            this.seed = seed;
            this.exec = Executors.newFixedThreadPool(workers, new NamedThreadFactory("crawl-worker"));
        }

        void offer(URI url, int depth) {
            if (!frontier.offer(url, depth)) return;
            pending.incrementAndGet();
            try {
                exec.execute(() -> task(url, depth));
            } catch (RejectedExecutionException e) {
                finish();
            }
        }

        void task(URI url, int depth) {
            try {
                if (stopping()) return;
                visit(url, depth);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                failed.incrementAndGet();
                LOG.warn("Page task failed: {} ({})", url, e.toString());
                SLOG.error("page-failed", e, "url", String.valueOf(url));
                handler.onFailed(url, depth, "request_error");
            } finally {
                finish();
            }
        }

        void finish() {
            if (pending.decrementAndGet() == 0) done.countDown();
        }

        /**
         * pending 이 0이 되거나 {@link #cancel()}이 깨울 때까지 대기(기한이 있으면 그때까지).
         * 조기 종료면 true.
         */
        boolean await() {
            Duration limit = config.getMaxScanDuration();
            try {
                if (limit == null || limit.isZero()) {
                    done.await();
                } else if (!done.await(limit.toNanos(), TimeUnit.NANOSECONDS)) {
                    LOG.warn("max_scan_duration {} reached; draining workers", limit);
                    cancel.set(true);
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                cancel.set(true);
            } finally {
                exec.shutdown();
                try {
                    if (!exec.awaitTermination(DRAIN_TIMEOUT_S, TimeUnit.SECONDS)) exec.shutdownNow();
                } catch (InterruptedException ie) {
                    exec.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }
            return cancel.get();
        }

        void visit(URI url, int depth) throws InterruptedException {
            VisitFrontier.Claim claim = frontier.claim(url, depth);
            if (claim != VisitFrontier.Claim.ACCEPTED) {
                LOG.debug("skip {} ({})", url, claim);
                return;
            }
            handler.onVisit(url, depth);

            HttpResponseData resp = fetcher.fetch(url);
            handler.onFetched(url, resp);

            String error = errorType(resp);
            if (error != null) {
                failed.incrementAndGet();
                LOG.debug("failed {} -> {}", url, error);
                if (resp.getStatusCode() >= 400) {
                    Document errDoc = Jsoup.parse(resp.getBody(), url.toString());
                    handler.onErrorPage(new Page(url, depth, resp, errDoc, List.of(), List.of()), error);
                } else {
                    handler.onFailed(url, depth, error);
                }
                return;
            }

            Document doc = Jsoup.parse(resp.getBody(), url.toString());
            List<Form> forms = config.isScanForms() ? formExtractor.extract(doc, url) : List.of();
            List<URI> links = config.isScanLinks() ? linkExtractor.extract(doc) : List.of();
            Page page = new Page(url, depth, resp, doc, forms, links);

            handler.beforeLinks(page);
            for (URI raw : links) {
                URI n = UrlUtils.normalize(raw);
                if (n == null) continue;
                boolean inScope = inScope(n);
                handler.onLink(url, n, inScope);
                if (inScope && !stopping()) offer(n, depth + 1);
            }
            handler.afterLinks(page);
            processed.incrementAndGet();

            if (config.getRateLimit() > 0) {
                sleeper.sleep(Duration.ofMillis((long) (1000.0 / config.getRateLimit())));
            }
        }

        boolean inScope(URI link) {
            if (!UrlUtils.isHttp(link)) return false;
            if (!UrlUtils.sameRegistrableDomain(link, seed)) return false;
            return UrlExclusion.isAllowed(link, config.getIncludedPaths(), config.getExcludedPaths());
        }

        boolean stopping() {
            return cancel.get() || Thread.currentThread().isInterrupted();
        }
    }

    /** 처리 불가 응답의 errors_by_type 분류. 처리 가능하면 null. */
    static String errorType(HttpResponseData resp) {
        if (resp.isTransportFailure()) return resp.getError() == null ? "request_error" : resp.getError();
        int sc = resp.getStatusCode();
        if (sc >= 500) return "server_error";
        if (sc >= 400) return "client_error";
        if (!resp.isHtml()) return "non_html_content";
        return null;
    }
}
