package com.websweep.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** 추출된 링크 기록. 스코프 밖 링크도 기록된다. */
public record ScannedLink(@JsonProperty("source_url") String sourceUrl,
                          @JsonProperty("target_url") String targetUrl,
                          String timestamp) {}
