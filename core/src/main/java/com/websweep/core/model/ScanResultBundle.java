package com.websweep.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/** 코어의 출력 계약: 싱크에 넘기는 전체 결과 번들(JSON 직렬화 가능). */
@JsonPropertyOrder({"summary", "vulnerabilities", "scanned_links", "scanned_forms", "scanned_urls"})
public record ScanResultBundle(ScanSummary summary,
                               List<Finding> vulnerabilities,
                               @JsonProperty("scanned_links") List<ScannedLink> scannedLinks,
                               @JsonProperty("scanned_forms") List<ScannedForm> scannedForms,
                               @JsonProperty("scanned_urls") List<String> scannedUrls,
                               @JsonIgnore ScanConfig config) {

    public ScanResultBundle {
        vulnerabilities = List.copyOf(vulnerabilities);
        scannedLinks = List.copyOf(scannedLinks);
        scannedForms = List.copyOf(scannedForms);
        scannedUrls = List.copyOf(scannedUrls);
    }

    @JsonIgnore
    public String scanId() { return summary.scanInfo().scanId(); }
}
