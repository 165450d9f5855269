package com.websweep.core.crawler;

import java.util.List;

/**
 * 크롤 종료 요약.
 *
 * @param visited   방문(claim)한 정규화 URL, 방문 순서
 * @param processed HTML로 처리까지 끝난 페이지 수
 * @param failed    전송 실패/에러 상태/비 HTML 페이지 수
 * @param cancelled 취소 또는 max_scan_duration 으로 조기 종료했는가
 */
public record CrawlResult(List<String> visited, int processed, int failed, boolean cancelled) {

    public CrawlResult {
        visited = (visited == null ? List.of() : List.copyOf(visited));
    }
}
