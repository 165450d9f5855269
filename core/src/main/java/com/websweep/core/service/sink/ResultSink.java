package com.websweep.core.service.sink;

import com.websweep.core.model.ScanResultBundle;

/**
 * 결과 영속화 대상. 스캔 코디네이터 생성 시 한 번 주입된다.
 * 구현은 예외를 던지지 말고 {@link SinkResult#failed}로 보고해야 한다.
 */
public interface ResultSink {

    SinkResult saveResults(String scanId, ScanResultBundle bundle);

    /** percent: 0~100 */
    SinkResult updateProgress(String scanId, int percent, String message);
}
