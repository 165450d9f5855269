package com.websweep.core.service;

import java.util.Locale;

/** 스캔 수명주기: CREATED → RUNNING → {COMPLETED | FAILED} */
public enum ScanState {
    CREATED,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** scan_info.state 표기 */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
