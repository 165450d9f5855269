package com.websweep.core.util;

import java.time.Duration;

/** 대기 추상화(테스트에서 실제로 잠들지 않도록 교체) */
@FunctionalInterface
public interface Sleeper {
    void sleep(Duration d) throws InterruptedException;

    Sleeper NONE = d -> {};
}
