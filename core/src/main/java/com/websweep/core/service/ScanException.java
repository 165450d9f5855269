package com.websweep.core.service;

/**
 * 스캔을 시작조차 할 수 없는 치명적 오류(해석 불가/비 HTTP 시드 등).
 * 페이지 단위 실패는 여기로 오지 않고 errors_by_type 으로 집계된다.
 */
public class ScanException extends Exception {

    public ScanException(String message) {
        super(message);
    }

    public ScanException(String message, Throwable cause) {
        super(message, cause);
    }
}
