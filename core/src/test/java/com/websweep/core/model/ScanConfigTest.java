package com.websweep.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("ScanConfig")
class ScanConfigTest {

    @Test
    @DisplayName("기본값은 유효하다")
    void defaultsAreValid() {
        ScanConfig cfg = ScanConfig.defaults();
        assertThatCode(cfg::validate).doesNotThrowAnyException();
        assertEquals(3, cfg.getMaxDepth());
        assertEquals(100, cfg.getMaxPages());
        assertEquals(4, cfg.getThreads());
        assertEquals(30_000, cfg.getRequestTimeoutMs());
        assertEquals(5 * 1024, cfg.getMaxResponseSizeKb());
        for (CheckCategory c : CheckCategory.values()) assertTrue(cfg.isEnabled(c), c.name());
    }

    @Test
    @DisplayName("max_depth=0 은 허용(시드만)")
    void zeroDepthAllowed() {
        assertThatCode(() -> ScanConfig.defaults().setMaxDepth(0).validate()).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("범위를 벗어난 값은 IllegalArgumentException")
    void invalidValues() {
        assertInvalid(c -> c.setMaxDepth(-1), "maxDepth");
        assertInvalid(c -> c.setMaxPages(0), "maxPages");
        assertInvalid(c -> c.setThreads(0), "threads");
        assertInvalid(c -> c.setMaxRetries(0), "maxRetries");
        assertInvalid(c -> c.setRequestTimeout(Duration.ZERO), "requestTimeout");
        assertInvalid(c -> c.setRateLimit(-1), "rateLimit");
        assertInvalid(c -> c.setMaxResponseSizeKb(0), "maxResponseSizeKb");
        assertInvalid(c -> c.setUseProxy(true), "proxyUrl");
        assertInvalid(c -> c.activeProbes().setRps(0), "rps");
        assertInvalid(c -> c.activeProbes().setMaxRequests(-1), "maxRequests");
    }

    @Test
    @DisplayName("disableAll 은 능동 프로브만 끈다")
    void disableAllProbes() {
        ScanConfig cfg = ScanConfig.defaults();
        cfg.activeProbes().disableAll();
        assertTrue(!cfg.activeProbes().isSsrfProbes() && !cfg.activeProbes().isBurstProbe());
        assertTrue(cfg.isEnabled(CheckCategory.SSRF));
    }

    /* --- 헬퍼 --- */

    private static void assertInvalid(Consumer<ScanConfig> mutate, String messagePart) {
        ScanConfig cfg = ScanConfig.defaults();
        mutate.accept(cfg);
        assertThatThrownBy(cfg::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(messagePart);
    }
}
