package com.websweep.core.http;

import com.websweep.core.model.HttpResponseData;
import com.websweep.core.model.ScanConfig;

import java.time.Duration;
import java.util.Objects;

/**
 * 전송 실패(status -1)만 재시도한다. HTTP 상태 코드는 응답으로 보고 그대로 돌려준다.
 * 지연은 scan_delay 고정, 시도 횟수는 max_retries.
 * interrupted 는 재시도하지 않는다.
 */
public final class TransportRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final Duration delay;

    public TransportRetryPolicy(int maxAttempts, Duration delay) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.delay = Objects.requireNonNullElse(delay, Duration.ZERO);
    }

    public static TransportRetryPolicy from(ScanConfig cfg) {
        return new TransportRetryPolicy(cfg.getMaxRetries(), cfg.getScanDelay());
    }

    @Override
    public boolean shouldRetry(HttpResponseData last, int attempt) {
        if (last == null || !last.isTransportFailure()) return false;
        if ("interrupted".equals(last.getError())) return false;
        return attempt < maxAttempts;
    }

    @Override
    public Duration nextDelay(int attempt) { return delay; }

    @Override
    public int maxAttempts() { return maxAttempts; }
}
