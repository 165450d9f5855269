package com.websweep.core.stats;

import java.util.List;
import java.util.Map;

/**
 * 집계 시점의 불변 스냅샷. 응답 시간은 초 단위, 관측값이 없으면 0.
 */
public record StatsSnapshot(long totalUrlsScanned,
                            long totalRequests,
                            long totalErrors,
                            long totalVulnerabilities,
                            Map<String, Long> vulnerabilitiesByType,
                            Map<String, Long> errorsByType,
                            Map<String, Long> retriesByType,
                            Map<Integer, Long> responseCodes,
                            double avgResponseTime,
                            double minResponseTime,
                            double maxResponseTime,
                            List<String> scannedUrls) {

    public StatsSnapshot {
        vulnerabilitiesByType = Map.copyOf(vulnerabilitiesByType);
        errorsByType = Map.copyOf(errorsByType);
        retriesByType = Map.copyOf(retriesByType);
        responseCodes = Map.copyOf(responseCodes);
        scannedUrls = List.copyOf(scannedUrls);
    }

    public long totalRetries() {
        return retriesByType.values().stream().mapToLong(Long::longValue).sum();
    }

    public static StatsSnapshot empty() {
        return new StatsSnapshot(0, 0, 0, 0, Map.of(), Map.of(), Map.of(), Map.of(), 0, 0, 0, List.of());
    }
}
