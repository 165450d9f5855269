package com.websweep.core.stats;

import java.util.concurrent.CompletableFuture;

/** 집계기로 보내는 갱신 메시지. */
public sealed interface StatsEvent {

    /** 크롤러가 claim 한 URL(scanned_urls) */
    record UrlScanned(String url) implements StatsEvent {}

    /** 크롤 응답 하나. elapsedMs 는 재시도 제외 마지막 시도 기준. */
    record ResponseObserved(int statusCode, long elapsedMs) implements StatsEvent {}

    /** errors_by_type 분류 하나 */
    record ErrorObserved(String errorType) implements StatsEvent {}

    record FindingObserved(String findingType) implements StatsEvent {}

    /** 크롤 재시도 한 번. errorType 은 재시도를 부른 직전 실패 분류. */
    record RetryObserved(String errorType) implements StatsEvent {}

    /** 큐에 앞서 들어온 갱신이 모두 반영된 뒤 스냅샷을 돌려받는다 */
    record SnapshotRequest(CompletableFuture<StatsSnapshot> reply) implements StatsEvent {}

    /** 집계 스레드 종료 신호 */
    record Shutdown() implements StatsEvent {}
}
