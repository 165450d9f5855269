package com.websweep.core.event;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** 스캔 중 발생한 구조화 이벤트. attributes는 삽입 순서를 유지한다. */
public record ScanEvent(Kind kind, String message, Map<String, Object> attributes, Instant at) {

    public enum Kind {
        SCAN_STARTED,
        PAGE_VISITED,
        PAGE_FAILED,
        FORM_FOUND,
        LINK_FOUND,
        FINDING_RECORDED,
        CHECK_FAILED,
        PROBE_SKIPPED,
        PROGRESS,
        SINK_FALLBACK,
        SCAN_COMPLETED,
        SCAN_FAILED
    }

    public ScanEvent {
        Objects.requireNonNull(kind, "kind");
        message = (message == null ? "" : message);
        attributes = (attributes == null) ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        at = (at == null ? Instant.now() : at);
    }

    /** of(kind, msg, "url", u, "depth", 2) */
    public static ScanEvent of(Kind kind, String message, Object... kvs) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                attrs.put(String.valueOf(kvs[i]), kvs[i + 1]);
            }
        }
        return new ScanEvent(kind, message, attrs, Instant.now());
    }

    public Object attr(String key) { return attributes.get(key); }
}
