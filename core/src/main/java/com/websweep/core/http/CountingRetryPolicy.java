package com.websweep.core.http;

import com.websweep.core.model.HttpResponseData;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * RetryPolicy 데코레이터: 재시도 횟수와 재시도를 유발한 오류 분류를 기록한다.
 * fetch 한 건마다 새로 만든다.
 */
public final class CountingRetryPolicy implements RetryPolicy {
    private final RetryPolicy delegate;
    private final List<String> retriedErrors = new ArrayList<>();

    public CountingRetryPolicy(RetryPolicy delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public boolean shouldRetry(HttpResponseData last, int attempt) {
        boolean retry = delegate.shouldRetry(last, attempt);
        if (retry) retriedErrors.add(last.getError() == null ? "status_" + last.getStatusCode() : last.getError());
        return retry;
    }

    @Override
    public Duration nextDelay(int attempt) { return delegate.nextDelay(attempt); }

    @Override
    public int maxAttempts() { return delegate.maxAttempts(); }

    public int getRetryCount() { return retriedErrors.size(); }

    /** 재시도마다 직전 실패의 분류(timeout, connection_error ...) */
    public List<String> getRetriedErrors() { return Collections.unmodifiableList(retriedErrors); }
}
