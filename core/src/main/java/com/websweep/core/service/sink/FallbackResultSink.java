package com.websweep.core.service.sink;

import com.websweep.core.event.ScanEvent;
import com.websweep.core.event.ScanEventListener;
import com.websweep.core.model.ScanResultBundle;
import com.websweep.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * primary 가 실패(또는 예외)하면 secondary(보통 로컬 JSON)로 넘긴다.
 * 결과는 마지막으로 시도한 싱크의 것을 돌려준다.
 */
public class FallbackResultSink implements ResultSink {
    private static final Logger LOG = LoggerFactory.getLogger(FallbackResultSink.class);
    private static final StructuredLog SLOG = StructuredLog.get(FallbackResultSink.class);

    private final ResultSink primary;
    private final ResultSink secondary;
    private final ScanEventListener events;

    public FallbackResultSink(ResultSink primary, ResultSink secondary) {
        this(primary, secondary, ScanEventListener.NONE);
    }

    public FallbackResultSink(ResultSink primary, ResultSink secondary, ScanEventListener events) {
        this.primary = Objects.requireNonNull(primary, "primary");
        this.secondary = Objects.requireNonNull(secondary, "secondary");
        this.events = (events == null ? ScanEventListener.NONE : events);
    }

    @Override
    public SinkResult saveResults(String scanId, ScanResultBundle bundle) {
        SinkResult first = attempt(() -> primary.saveResults(scanId, bundle));
        if (first.success()) return first;

        fallback("save", scanId, first.message());
        SinkResult second = secondary.saveResults(scanId, bundle);
        return second.success()
                ? SinkResult.ok(second.message() + " (fallback: " + first.message() + ")")
                : second;
    }

    @Override
    public SinkResult updateProgress(String scanId, int percent, String message) {
        SinkResult first = attempt(() -> primary.updateProgress(scanId, percent, message));
        if (first.success()) return first;

        LOG.debug("progress fallback scanId={}: {}", scanId, first.message());
        return secondary.updateProgress(scanId, percent, message);
    }

    /* --- 헬퍼 --- */

    private interface Call {
        SinkResult run();
    }

    private static SinkResult attempt(Call call) {
        try {
            SinkResult r = call.run();
            return r != null ? r : SinkResult.failed("sink returned no result");
        } catch (RuntimeException e) {
            LOG.warn("Primary sink threw: {}", e.toString());
            return SinkResult.failed(e.toString());
        }
    }

    private void fallback(String op, String scanId, String reason) {
        LOG.warn("Primary sink {} failed for {}: {}; falling back", op, scanId, reason);
        SLOG.warn("sink-fallback", "op", op, "scanId", scanId, "reason", reason);
        events.onEvent(ScanEvent.of(ScanEvent.Kind.SINK_FALLBACK, reason, "op", op, "scanId", scanId));
    }
}
