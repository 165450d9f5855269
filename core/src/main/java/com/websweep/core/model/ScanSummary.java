package com.websweep.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** 결과 번들의 summary 블록. */
public record ScanSummary(@JsonProperty("scan_info") ScanInfo scanInfo,
                          @JsonProperty("vulnerabilities_by_type") Map<String, Long> vulnerabilitiesByType,
                          @JsonProperty("errors_by_type") Map<String, Long> errorsByType,
                          @JsonProperty("retries_by_type") Map<String, Long> retriesByType,
                          @JsonProperty("response_codes") Map<Integer, Long> responseCodes,
                          @JsonProperty("performance_metrics") PerformanceMetrics performanceMetrics) {

    public record ScanInfo(@JsonProperty("scan_id") String scanId,
                           @JsonProperty("target_url") String targetUrl,
                           @JsonProperty("start_time") String startTime,
                           @JsonProperty("end_time") String endTime,
                           double duration,
                           @JsonProperty("total_urls_scanned") long totalUrlsScanned,
                           @JsonProperty("total_requests") long totalRequests,
                           @JsonProperty("total_vulnerabilities") long totalVulnerabilities,
                           @JsonProperty("total_links_scanned") long totalLinksScanned,
                           @JsonProperty("total_forms_scanned") long totalFormsScanned,
                           String state) {}

    /** 응답 시간(초). 관측값이 없으면 0. */
    public record PerformanceMetrics(@JsonProperty("avg_response_time") double avgResponseTime,
                                     @JsonProperty("min_response_time") double minResponseTime,
                                     @JsonProperty("max_response_time") double maxResponseTime) {}
}
