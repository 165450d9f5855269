package com.websweep.core.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * 단일 취약점 결과. 고정 envelope(type, url, timestamp) + type별 details.
 * 생성 후 변경되지 않는다.
 */
@JsonPropertyOrder({"type", "url", "timestamp", "details"})
public final class Finding {
    private final String type;
    private final String url;
    private final LocalDateTime timestamp;
    private final FindingDetails details;

    private Finding(Builder b) {
        this.type = b.type;
        this.url = b.url;
        this.timestamp = (b.timestamp == null ? LocalDateTime.now() : b.timestamp).truncatedTo(ChronoUnit.SECONDS);
        this.details = b.details;
    }

    public String getType() { return type; }
    public String getUrl() { return url; }

    @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd HH:mm:ss")
    public LocalDateTime getTimestamp() { return timestamp; }

    public FindingDetails getDetails() { return details; }

    @JsonIgnore
    public Severity getSeverity() { return details.severity(); }

    @Override
    public String toString() {
        return type + " @ " + url + " [" + details.severity().label() + "]";
    }

    public static Builder builder() { return new Builder(); }

    public static Finding of(String type, String url, FindingDetails details) {
        return builder().type(type).url(url).details(details).build();
    }

    public static final class Builder {
        private String type;
        private String url;
        private LocalDateTime timestamp;
        private FindingDetails details;

        public Builder type(String type) { this.type = type; return this; }
        public Builder url(String url) { this.url = url; return this; }
        public Builder timestamp(LocalDateTime timestamp) { this.timestamp = timestamp; return this; }
        public Builder details(FindingDetails details) { this.details = details; return this; }

        public Finding build() {
            Objects.requireNonNull(type, "type");
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(details, "details");
            return new Finding(this);
        }
    }
}
