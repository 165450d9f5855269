package com.websweep.core.event;

import com.websweep.core.util.StructuredLog;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.logging.Level;

/** 기본 옵저버: 이벤트를 JSON 라인으로 흘려보낸다. 빈번한 이벤트는 FINE. */
public final class StructuredLogEventListener implements ScanEventListener {
    private static final StructuredLog SLOG = StructuredLog.get(StructuredLogEventListener.class);

    @Override
    public void onEvent(ScanEvent event) {
        Map<String, Object> attrs = new LinkedHashMap<>();
        if (!event.message().isEmpty()) attrs.put("message", event.message());
        attrs.putAll(event.attributes());
        SLOG.event(levelOf(event.kind()), eventName(event.kind()), attrs);
    }

    /* --- 헬퍼 --- */

    static String eventName(ScanEvent.Kind kind) {
        return kind.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    private static Level levelOf(ScanEvent.Kind kind) {
        return switch (kind) {
            case PAGE_VISITED, FORM_FOUND, LINK_FOUND, PROGRESS -> Level.FINE;
            case CHECK_FAILED, PAGE_FAILED, SINK_FALLBACK, PROBE_SKIPPED -> Level.WARNING;
            case SCAN_FAILED -> Level.SEVERE;
            default -> Level.INFO;
        };
    }
}
