package com.websweep.core.analyzer.budget;

import com.websweep.core.model.ScanConfig;
import com.websweep.core.util.RateLimiter;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 능동 프로브(대상에 실제 요청을 더 보내는 체크) 게이트.
 * 프로브별 on/off + 스캔 전체 요청 예산(max_requests) + 전용 RPS.
 * 예산은 프로브 단위로 한 번에 예약한다(중간에 끊긴 프로브가 반쪽 결론을 내지 않도록).
 */
public final class ActiveProbeGate {

    public enum Probe { RATE_LIMIT, BRUTE_FORCE, LOGIN_MONITORING, BURST, SSRF }

    private final ScanConfig.ActiveProbes cfg;
    private final RateLimiter limiter;
    private final AtomicInteger used = new AtomicInteger();
    private final AtomicInteger paced = new AtomicInteger();

    public ActiveProbeGate(ScanConfig.ActiveProbes cfg) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.limiter = RateLimiter.perSecond(Math.max(1, cfg.getRps()));
    }

    public static ActiveProbeGate from(ScanConfig config) {
        return new ActiveProbeGate(config.activeProbes());
    }

    public boolean isEnabled(Probe p) {
        return switch (p) {
            case RATE_LIMIT -> cfg.isRateLimitProbe();
            case BRUTE_FORCE -> cfg.isBruteForceProbe();
            case LOGIN_MONITORING -> cfg.isLoginMonitoringProbe();
            case BURST -> cfg.isBurstProbe();
            case SSRF -> cfg.isSsrfProbes();
        };
    }

    /** 요청 n개 예약. 남은 예산이 부족하면 아무것도 소모하지 않고 false. */
    public boolean tryReserve(int n) {
        if (n <= 0) return true;
        int max = cfg.getMaxRequests();
        for (;;) {
            int cur = used.get();
            if (cur + n > max) return false;
            if (used.compareAndSet(cur, cur + n)) return true;
        }
    }

    /** 능동 요청 직전 호출(전용 RPS) */
    public void pace() throws InterruptedException {
        limiter.acquire();
        paced.incrementAndGet();
    }

    public int used() { return used.get(); }

    /** RPS 제한을 거쳐 나간 능동 요청 수 */
    public int paced() { return paced.get(); }

    public int remaining() { return Math.max(0, cfg.getMaxRequests() - used.get()); }
}
