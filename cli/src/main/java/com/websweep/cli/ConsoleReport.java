package com.websweep.cli;

import com.websweep.core.model.ScanResultBundle;
import com.websweep.core.model.ScanSummary;

import java.io.PrintStream;
import java.util.Comparator;
import java.util.Locale;
import java.util.Map;

/** 스캔 종료 후 콘솔 요약(합계 + 유형별 표) */
public final class ConsoleReport {
    private ConsoleReport() {}

    public static void print(ScanResultBundle bundle, String outputLocation, PrintStream out) {
        ScanSummary s = bundle.summary();
        ScanSummary.ScanInfo info = s.scanInfo();

        out.println();
        out.println("==================== Scan Summary ====================");
        out.printf(Locale.ROOT, "Scan ID          : %s%n", info.scanId());
        out.printf(Locale.ROOT, "Target           : %s%n", info.targetUrl());
        out.printf(Locale.ROOT, "State            : %s%n", info.state());
        out.printf(Locale.ROOT, "Duration         : %.2f s%n", info.duration());
        out.printf(Locale.ROOT, "URLs scanned     : %d%n", info.totalUrlsScanned());
        out.printf(Locale.ROOT, "Requests         : %d%n", info.totalRequests());
        out.printf(Locale.ROOT, "Retries          : %d%n",
                s.retriesByType().values().stream().mapToLong(Long::longValue).sum());
        out.printf(Locale.ROOT, "Links recorded   : %d%n", info.totalLinksScanned());
        out.printf(Locale.ROOT, "Forms recorded   : %d%n", info.totalFormsScanned());
        out.printf(Locale.ROOT, "Vulnerabilities  : %d%n", info.totalVulnerabilities());

        if (!s.vulnerabilitiesByType().isEmpty()) {
            out.println();
            table(out, "Vulnerability type", s.vulnerabilitiesByType());
        }
        if (!s.errorsByType().isEmpty()) {
            out.println();
            table(out, "Error type", s.errorsByType());
        }

        ScanSummary.PerformanceMetrics pm = s.performanceMetrics();
        out.println();
        out.printf(Locale.ROOT, "Response time    : avg %.3f s / min %.3f s / max %.3f s%n",
                pm.avgResponseTime(), pm.minResponseTime(), pm.maxResponseTime());
        if (outputLocation != null && !outputLocation.isBlank()) {
            out.printf(Locale.ROOT, "Results          : %s%n", outputLocation);
        }
        out.println("======================================================");
    }

    /* --- 헬퍼 --- */

    private static void table(PrintStream out, String title, Map<String, Long> counts) {
        int width = Math.max(title.length(), counts.keySet().stream().mapToInt(String::length).max().orElse(0));
        String fmt = "  %-" + width + "s  %6s%n";
        out.printf(Locale.ROOT, fmt, title, "count");
        out.printf(Locale.ROOT, fmt, "-".repeat(width), "------");
        counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .forEach(e -> out.printf(Locale.ROOT, fmt, e.getKey(), e.getValue()));
    }
}
