package com.websweep.core.http;

import com.websweep.core.model.HttpResponseData;

import java.time.Duration;

/** 페이지 fetch 재시도 조건/지연을 결정하는 정책 */
public interface RetryPolicy {
    /** attempt는 1부터(방금 끝난 시도 번호). true면 지연 후 재시도. */
    boolean shouldRetry(HttpResponseData last, int attempt);

    /** attempt 직후 다음 시도까지의 지연 */
    Duration nextDelay(int attempt);

    /** 최대 시도 횟수(첫 시도 포함) */
    int maxAttempts();
}
