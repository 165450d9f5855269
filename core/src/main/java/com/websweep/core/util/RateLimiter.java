package com.websweep.core.util;

/**
 * 토큰 버킷. permitsPerSecond <= 0 이면 무제한(acquire 즉시 반환).
 * 소수 rps(예: 0.5 = 2초에 1회)도 허용.
 */
public final class RateLimiter {
    private final double capacity;
    private final double refillPerSecond;
    private double tokens;
    private long lastNs;

    public RateLimiter(double capacity, double refillPerSecond) {
        this.capacity = Math.max(1.0, capacity);
        this.refillPerSecond = refillPerSecond;
        this.tokens = this.capacity;
        this.lastNs = System.nanoTime();
    }

    /** 버스트 1, 초당 rps 토큰 */
    public static RateLimiter perSecond(double rps) {
        return new RateLimiter(1.0, rps);
    }

    public static RateLimiter unlimited() {
        return new RateLimiter(1.0, 0.0);
    }

    public boolean isUnlimited() { return refillPerSecond <= 0; }

    public synchronized void acquire() throws InterruptedException {
        if (isUnlimited()) return;
        for (;;) {
            refill();
            if (tokens >= 1.0) { tokens -= 1.0; return; }
            this.wait(5);
        }
    }

    /** 대기 없이 토큰 하나 시도 */
    public synchronized boolean tryAcquire() {
        if (isUnlimited()) return true;
        refill();
        if (tokens >= 1.0) { tokens -= 1.0; return true; }
        return false;
    }

    private void refill() {
        long now = System.nanoTime();
        double add = (now - lastNs) / 1_000_000_000.0 * refillPerSecond;
        if (add > 0) {
            tokens = Math.min(capacity, tokens + add);
            lastNs = now;
        }
    }
}
