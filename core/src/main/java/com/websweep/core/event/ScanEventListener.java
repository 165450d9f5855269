package com.websweep.core.event;

import java.util.List;

/**
 * 스캔 이벤트 옵저버. 여러 워커 스레드에서 동시에 호출되므로 구현은 스레드 세이프해야 한다.
 * 리스너 예외는 스캔을 중단시키지 않는다({@link #composite} 참고).
 */
@FunctionalInterface
public interface ScanEventListener {

    void onEvent(ScanEvent event);

    ScanEventListener NONE = e -> {};

    static ScanEventListener composite(List<ScanEventListener> listeners) {
        List<ScanEventListener> copy = List.copyOf(listeners);
        return e -> {
            for (ScanEventListener l : copy) {
                try {
                    l.onEvent(e);
                } catch (RuntimeException ex) {
                    org.slf4j.LoggerFactory.getLogger(ScanEventListener.class)
                            .warn("Event listener failed on {}: {}", e.kind(), ex.toString());
                }
            }
        };
    }
}
