package com.websweep.core.injection;

import com.websweep.core.analyzer.AnalysisContext;
import com.websweep.core.event.ScanEvent;
import com.websweep.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** 페이로드 하나가 던진 RuntimeException 기록. 해당 페이로드만 "취약하지 않음"으로 처리된다. */
final class PayloadFailures {
    private static final Logger LOG = LoggerFactory.getLogger(PayloadFailures.class);
    private static final StructuredLog SLOG = StructuredLog.get(PayloadFailures.class);

    private PayloadFailures() {}

    static void record(AnalysisContext ctx, String scanner, InjectionTarget t, String payload, RuntimeException e) {
        String url = t.endpoint().toString();
        LOG.warn("{} payload failed on {} [{}]: {}", scanner, url, t.field(), e.toString());
        SLOG.error("payload-failed", e, "scanner", scanner, "url", url, "field", t.field(), "payload", payload);
        ctx.events().onEvent(ScanEvent.of(ScanEvent.Kind.CHECK_FAILED, e.toString(),
                "check", scanner, "url", url, "field", t.field()));
    }
}
