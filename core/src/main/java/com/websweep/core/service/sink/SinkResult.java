package com.websweep.core.service.sink;

/** 싱크 호출 결과 {success, message} */
public record SinkResult(boolean success, String message) {

    public SinkResult {
        message = (message == null ? "" : message);
    }

    public static SinkResult ok(String message) {
        return new SinkResult(true, message);
    }

    public static SinkResult failed(String message) {
        return new SinkResult(false, message);
    }
}
