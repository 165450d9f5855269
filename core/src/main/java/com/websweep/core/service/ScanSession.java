package com.websweep.core.service;

import com.websweep.core.model.Finding;
import com.websweep.core.model.Form;
import com.websweep.core.model.ScanConfig;
import com.websweep.core.model.ScanResultBundle;
import com.websweep.core.model.ScanSummary;
import com.websweep.core.model.ScannedForm;
import com.websweep.core.model.ScannedLink;
import com.websweep.core.stats.StatsSnapshot;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * 스캔 1회분의 가변 상태. 워커 스레드들이 동시에 append 하므로 lock-free 큐로만 보관하고,
 * 번들은 크롤이 끝난 뒤 한 번 만든다. 추가 순서는 보장하지 않는다.
 */
final class ScanSession {

    static final DateTimeFormatter LEDGER_TS = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String scanId;
    private final URI target;
    private final ScanConfig config;
    private final Instant startedAt;

    private final ConcurrentLinkedQueue<Finding> findings = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<ScannedLink> links = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<ScannedForm> forms = new ConcurrentLinkedQueue<>();

    ScanSession(String scanId, URI target, ScanConfig config, Instant startedAt) {
        this.scanId = Objects.requireNonNull(scanId, "scanId");
        this.target = Objects.requireNonNull(target, "target");
        this.config = Objects.requireNonNull(config, "config");
        this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
    }

    String scanId() { return scanId; }
    URI target() { return target; }
    Instant startedAt() { return startedAt; }

    void addFinding(Finding f) { findings.add(f); }

    void addLink(URI source, URI targetUrl) {
        links.add(new ScannedLink(source.toString(), targetUrl.toString(), now()));
    }

    void addForm(URI pageUrl, Form form) {
        forms.add(ScannedForm.of(pageUrl.toString(), form, now()));
    }

    int findingCount() { return findings.size(); }

    /** 최종 번들. scannedUrls 는 크롤러의 방문 순서 그대로. */
    ScanResultBundle toBundle(StatsSnapshot stats, List<String> scannedUrls, Instant endedAt, ScanState state) {
        List<Finding> vulns = new ArrayList<>(findings);
        List<ScannedLink> linkList = new ArrayList<>(links);
        List<ScannedForm> formList = new ArrayList<>(forms);

        double seconds = Duration.between(startedAt, endedAt).toMillis() / 1000.0;
        ScanSummary.ScanInfo info = new ScanSummary.ScanInfo(
                scanId,
                target.toString(),
                startedAt.toString(),
                endedAt.toString(),
                seconds,
                scannedUrls.size(),
                stats.totalRequests(),
                vulns.size(),
                linkList.size(),
                formList.size(),
                state.label());

        ScanSummary summary = new ScanSummary(
                info,
                stats.vulnerabilitiesByType(),
                stats.errorsByType(),
                stats.retriesByType(),
                stats.responseCodes(),
                new ScanSummary.PerformanceMetrics(stats.avgResponseTime(), stats.minResponseTime(), stats.maxResponseTime()));

        return new ScanResultBundle(summary, vulns, linkList, formList, scannedUrls, config);
    }

    /* --- 헬퍼 --- */

    private static String now() {
        return LocalDateTime.now().format(LEDGER_TS);
    }
}
