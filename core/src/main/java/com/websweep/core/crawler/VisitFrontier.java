package com.websweep.core.crawler;

import com.websweep.core.util.UrlUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 방문 상태 머신의 공유 상태: 예약(queued) 집합 + 방문(visited) 집합.
 * <p>
 * URL 당 상태는 {@code Queued → Fetching → Processed | Skipped | Failed} 로만 흐르고,
 * {@link #offer}와 {@link #claim}은 한 모니터 아래 원자적으로 test-and-insert 한다.
 * 따라서 정규화 URL 하나는 최대 한 번만 claim 된다.
 */
public final class VisitFrontier {

    /** claim 결과 */
    public enum Claim {
        ACCEPTED,
        ALREADY_VISITED,
        TOO_DEEP,
        PAGE_BUDGET_EXHAUSTED
    }

    private final int maxDepth;
    private final int maxPages;
    private final Set<String> queued = new HashSet<>();
    private final Set<String> visited = new LinkedHashSet<>();

    public VisitFrontier(int maxDepth, int maxPages) {
        this.maxDepth = Math.max(0, maxDepth);
        this.maxPages = Math.max(1, maxPages);
    }

    /**
     * 큐에 넣을 자격이 있으면 예약하고 true. 이미 예약/방문했거나 깊이를 넘으면 false.
     */
    public synchronized boolean offer(URI url, int depth) {
        String key = key(url);
        if (key == null || depth > maxDepth) return false;
        if (visited.size() >= maxPages) return false;
        return queued.add(key);
    }

    /** Fetching 진입 직전 판정. ACCEPTED면 visited에 기록된다. */
    public synchronized Claim claim(URI url, int depth) {
        String key = key(url);
        if (key == null || visited.contains(key)) return Claim.ALREADY_VISITED;
        if (depth > maxDepth) return Claim.TOO_DEEP;
        if (visited.size() >= maxPages) return Claim.PAGE_BUDGET_EXHAUSTED;
        queued.add(key);
        visited.add(key);
        return Claim.ACCEPTED;
    }

    public synchronized boolean isVisited(URI url) {
        String key = key(url);
        return key != null && visited.contains(key);
    }

    public synchronized int visitedCount() { return visited.size(); }

    /** 방문 순서대로 스냅샷 */
    public synchronized List<String> visited() { return new ArrayList<>(visited); }

    public int maxPages() { return maxPages; }

    private static String key(URI url) {
        URI n = UrlUtils.normalize(url);
        return n == null ? null : n.toString();
    }
}
