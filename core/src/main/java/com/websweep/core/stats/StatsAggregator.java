package com.websweep.core.stats;

import com.websweep.core.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 스캔 통계 집계기.
 * 상태는 집계 스레드 하나만 바꾸고, 워커는 {@link StatsEvent}를 큐에 넣기만 한다.
 * 큐 크기는 {@code ws.stats.queue}(기본 10000). 가득 차면 생산자가 기다린다.
 */
public final class StatsAggregator implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(StatsAggregator.class);

    private static final long SNAPSHOT_TIMEOUT_S = 30;

    private final BlockingQueue<StatsEvent> queue;
    private final Thread worker;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    // ---- 집계 스레드 전용 상태 ----
    private final List<String> scannedUrls = new ArrayList<>();
    private final Map<String, Long> vulnerabilitiesByType = new LinkedHashMap<>();
    private final Map<String, Long> errorsByType = new LinkedHashMap<>();
    private final Map<String, Long> retriesByType = new LinkedHashMap<>();
    private final Map<Integer, Long> responseCodes = new LinkedHashMap<>();
    private long totalRequests;
    private long totalErrors;
    private long totalVulnerabilities;
    private long sumResponseMs;
    private long minResponseMs = Long.MAX_VALUE;
    private long maxResponseMs;

    public StatsAggregator() {
        this(sysInt("ws.stats.queue", 10_000));
    }

    public StatsAggregator(int capacity) {
        this.queue = new ArrayBlockingQueue<>(Math.max(16, capacity));
        this.worker = new NamedThreadFactory("ws-stats").newThread(this::loop);
        this.worker.start();
    }

    /* ===== 생산자 API (워커 스레드) ===== */

    public void urlScanned(String url) { submit(new StatsEvent.UrlScanned(url)); }

    public void response(int statusCode, long elapsedMs) { submit(new StatsEvent.ResponseObserved(statusCode, elapsedMs)); }

    public void error(String errorType) { submit(new StatsEvent.ErrorObserved(errorType)); }

    public void finding(String findingType) { submit(new StatsEvent.FindingObserved(findingType)); }

    public void retry(String errorType) { submit(new StatsEvent.RetryObserved(errorType)); }

    /** 앞서 넣은 갱신이 모두 반영된 스냅샷. 닫힌 뒤에는 마지막 상태. */
    public StatsSnapshot snapshot() {
        if (closed.get()) return lastSnapshot();
        CompletableFuture<StatsSnapshot> reply = new CompletableFuture<>();
        if (!submit(new StatsEvent.SnapshotRequest(reply))) return lastSnapshot();
        try {
            return reply.get(SNAPSHOT_TIMEOUT_S, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return lastSnapshot();
        } catch (ExecutionException | TimeoutException e) {
            LOG.warn("stats snapshot unavailable: {}", e.toString());
            return StatsSnapshot.empty();
        }
    }

    /** 남은 갱신을 모두 반영하고 집계 스레드를 멈춘다 */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            queue.put(new StatsEvent.Shutdown());
            worker.join(Duration.ofSeconds(SNAPSHOT_TIMEOUT_S).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            worker.interrupt();
        }
    }

    /* ===== 집계 스레드 ===== */

    private void loop() {
        while (true) {
            StatsEvent ev;
            try {
                ev = queue.take();
            } catch (InterruptedException e) {
                LOG.debug("stats aggregator interrupted");
                return;
            }
            if (ev instanceof StatsEvent.Shutdown) return;
            apply(ev);
        }
    }

    private void apply(StatsEvent ev) {
        if (ev instanceof StatsEvent.UrlScanned u) {
            scannedUrls.add(u.url());
        } else if (ev instanceof StatsEvent.ResponseObserved r) {
            totalRequests++;
            responseCodes.merge(r.statusCode(), 1L, Long::sum);
            long ms = Math.max(0, r.elapsedMs());
            sumResponseMs += ms;
            minResponseMs = Math.min(minResponseMs, ms);
            maxResponseMs = Math.max(maxResponseMs, ms);
        } else if (ev instanceof StatsEvent.ErrorObserved e) {
            totalErrors++;
            errorsByType.merge(e.errorType(), 1L, Long::sum);
        } else if (ev instanceof StatsEvent.FindingObserved f) {
            totalVulnerabilities++;
            vulnerabilitiesByType.merge(f.findingType(), 1L, Long::sum);
        } else if (ev instanceof StatsEvent.RetryObserved r) {
            retriesByType.merge(r.errorType(), 1L, Long::sum);
        } else if (ev instanceof StatsEvent.SnapshotRequest s) {
            s.reply().complete(build());
        }
    }

    /* --- 헬퍼 --- */

    private boolean submit(StatsEvent ev) {
        if (closed.get()) {
            LOG.debug("stats closed; dropped {}", ev);
            return false;
        }
        try {
            queue.put(ev);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.debug("interrupted; dropped {}", ev);
            return false;
        }
    }

    /** 집계 스레드가 끝난 뒤에만 호출(happens-before: join) */
    private StatsSnapshot lastSnapshot() {
        try {
            worker.join(Duration.ofSeconds(SNAPSHOT_TIMEOUT_S).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (worker.isAlive()) return StatsSnapshot.empty();
        return build();
    }

    private StatsSnapshot build() {
        double avg = totalRequests == 0 ? 0 : (sumResponseMs / (double) totalRequests) / 1000.0;
        double min = totalRequests == 0 ? 0 : minResponseMs / 1000.0;
        double max = totalRequests == 0 ? 0 : maxResponseMs / 1000.0;
        return new StatsSnapshot(scannedUrls.size(), totalRequests, totalErrors, totalVulnerabilities,
                vulnerabilitiesByType, errorsByType, retriesByType, responseCodes, avg, min, max, scannedUrls);
    }

    private static int sysInt(String key, int def) {
        try { return Integer.parseInt(System.getProperty(key, String.valueOf(def))); }
        catch (Exception e) { return def; }
    }
}
