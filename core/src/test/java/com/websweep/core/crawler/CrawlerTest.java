package com.websweep.core.crawler;

import com.websweep.core.model.HttpResponseData;
import com.websweep.core.model.ScanConfig;
import com.websweep.core.testutil.FakeHttpClient;
import com.websweep.core.util.Sleeper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("Crawler — 방문 1회 보장, 깊이/페이지 상한, 도메인 범위")
class CrawlerTest {

    private static final URI SEED = URI.create("http://t.test/");

    /** 경로 → HTML. 없는 경로는 404. */
    private static final Map<String, String> SITE = Map.of(
            "/", links("/a", "/a/", "/b#frag", "http://external.example/x", "mailto:someone@t.test"),
            "/a", links("/", "/c"),
            "/b", links("/a", "/missing"),
            "/c", links("/d"),
            "/d", links());

    /** 경로별 fetch 횟수를 세는 가짜 사이트 */
    private static class FakeSite implements PageFetcher {
        final Map<String, String> pages;
        final Map<String, AtomicInteger> fetches = new ConcurrentHashMap<>();

        FakeSite(Map<String, String> pages) { this.pages = pages; }

        @Override
        public HttpResponseData fetch(URI url) {
            fetches.computeIfAbsent(url.toString(), k -> new AtomicInteger()).incrementAndGet();
            String html = pages.get(url.getPath());
            return html == null
                    ? FakeHttpClient.response(url, 404, "<html><body>Not Found</body></html>")
                    : FakeHttpClient.response(url, 200, html);
        }
    }

    /** 콜백을 스레드 안전하게 기록 */
    private static final class Recorder implements PageHandler {
        final Queue<String> visits = new ConcurrentLinkedQueue<>();
        final Queue<String> outOfScope = new ConcurrentLinkedQueue<>();
        final Queue<String> inScope = new ConcurrentLinkedQueue<>();
        final Queue<String> errorPages = new ConcurrentLinkedQueue<>();
        final Queue<String> analyzed = new ConcurrentLinkedQueue<>();

        @Override public void onVisit(URI url, int depth) { visits.add(url.toString()); }
        @Override public void onLink(URI source, URI target, boolean scope) {
            (scope ? inScope : outOfScope).add(target.toString());
        }
        @Override public void afterLinks(Page page) { analyzed.add(page.url().toString()); }
        @Override public void onErrorPage(Page page, String errorType) {
            errorPages.add(page.url() + " " + errorType);
        }
    }

    private static ScanConfig config(int depth, int pages, int threads) {
        return ScanConfig.defaults().setMaxDepth(depth).setMaxPages(pages).setThreads(threads);
    }

    private static CrawlResult crawl(ScanConfig cfg, PageFetcher fetcher, PageHandler handler) {
        return new Crawler(cfg, fetcher, handler, new AtomicBoolean(false), Sleeper.NONE).crawl(SEED);
    }

    @Test
    @DisplayName("8 워커에서도 URL 은 한 번씩만 방문, 끝 슬래시/fragment 변형은 같은 URL")
    void visitsEachUrlOnce() {
        FakeSite site = new FakeSite(SITE);
        Recorder rec = new Recorder();

        CrawlResult r = crawl(config(3, 100, 8), site, rec);

        assertThat(r.visited()).containsExactlyInAnyOrder(
                "http://t.test/", "http://t.test/a", "http://t.test/b", "http://t.test/c",
                "http://t.test/d", "http://t.test/missing");
        assertThat(site.fetches.values()).allSatisfy(c -> assertEquals(1, c.get()));
        assertThat(rec.visits).hasSize(6).doesNotHaveDuplicates();
        assertFalse(r.cancelled());
    }

    @Test
    @DisplayName("외부 도메인 링크는 기록만 하고 방문하지 않는다")
    void externalLinkRecordedNotVisited() {
        FakeSite site = new FakeSite(SITE);
        Recorder rec = new Recorder();

        CrawlResult r = crawl(config(3, 100, 2), site, rec);

        assertThat(rec.outOfScope).containsExactly("http://external.example/x");
        assertThat(r.visited()).noneMatch(u -> u.contains("external.example"));
        assertThat(site.fetches).doesNotContainKey("http://external.example/x");
    }

    @Test
    @DisplayName("max_depth=0 이면 시드만")
    void depthZero() {
        FakeSite site = new FakeSite(SITE);
        Recorder rec = new Recorder();

        CrawlResult r = crawl(config(0, 100, 4), site, rec);

        assertThat(r.visited()).containsExactly("http://t.test/");
        assertEquals(1, site.fetches.size());
        // 링크는 기록된다
        assertThat(rec.inScope).isNotEmpty();
    }

    @Test
    @DisplayName("max_pages=N 이면 방문 수는 N 이하")
    void pageBudget() {
        Map<String, String> mesh = mesh(40);
        for (int threads : new int[]{1, 8}) {
            FakeSite site = new FakeSite(mesh);
            CrawlResult r = crawl(config(5, 7, threads), site, new Recorder());

            assertThat(r.visited()).hasSizeLessThanOrEqualTo(7).hasSize(7);
            assertThat(site.fetches.values()).allSatisfy(c -> assertEquals(1, c.get()));
        }
    }

    @Test
    @DisplayName("모든 페이지가 서로 링크된 사이트에서도 중복 방문 없음")
    void denseMesh_noDuplicates() {
        FakeSite site = new FakeSite(mesh(60));
        Recorder rec = new Recorder();

        CrawlResult r = crawl(config(3, 1000, 8), site, rec);

        assertThat(r.visited()).hasSize(61);
        assertThat(site.fetches).hasSize(61);
        assertThat(site.fetches.values()).allSatisfy(c -> assertEquals(1, c.get()));
        assertThat(rec.analyzed).hasSize(61).doesNotHaveDuplicates();
    }

    @Test
    @DisplayName("4xx 응답은 onErrorPage 로, 실패 수에 포함")
    void errorPage() {
        Recorder rec = new Recorder();

        CrawlResult r = crawl(config(3, 100, 2), new FakeSite(SITE), rec);

        assertThat(rec.errorPages).containsExactly("http://t.test/missing client_error");
        assertEquals(1, r.failed());
        assertEquals(5, r.processed());
    }

    @Test
    @DisplayName("exclude 패턴에 걸린 링크는 범위 밖")
    void excludedPath() {
        FakeSite site = new FakeSite(SITE);
        ScanConfig cfg = config(3, 100, 2).setExcludedPaths(List.of("/c"));

        CrawlResult r = crawl(cfg, site, new Recorder());

        assertThat(r.visited()).doesNotContain("http://t.test/c", "http://t.test/d");
    }

    @Test
    @DisplayName("시작 전에 취소되면 아무것도 방문하지 않고 cancelled")
    void cancelledBeforeStart() {
        FakeSite site = new FakeSite(SITE);

        CrawlResult r = new Crawler(config(3, 100, 2), site, new Recorder(), new AtomicBoolean(true), Sleeper.NONE)
                .crawl(SEED);

        assertTrue(r.cancelled());
        assertThat(r.visited()).isEmpty();
        assertThat(site.fetches).isEmpty();
    }

    @Test
    @DisplayName("cancel() 은 대기 중인 crawl 을 깨우고, 진행 중 페이지만 마무리한다")
    void cancelWakesAndDrains() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        FakeSite site = new FakeSite(SITE) {
            @Override
            public HttpResponseData fetch(URI url) {
                started.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.fetch(url);
            }
        };
        Recorder rec = new Recorder();
        Crawler crawler = new Crawler(config(3, 100, 2), site, rec, new AtomicBoolean(false), Sleeper.NONE);

        ExecutorService runner = Executors.newSingleThreadExecutor();
        try {
            Future<CrawlResult> running = runner.submit(() -> crawler.crawl(SEED));
            assertTrue(started.await(5, TimeUnit.SECONDS));

            crawler.cancel();
            release.countDown();
            CrawlResult r = running.get(10, TimeUnit.SECONDS);

            assertTrue(r.cancelled());
            assertThat(r.visited()).containsExactly("http://t.test/");
            assertEquals(1, r.processed());
            assertThat(rec.analyzed).containsExactly("http://t.test/");
        } finally {
            release.countDown();
            runner.shutdownNow();
        }
    }

    @Test
    @DisplayName("max_scan_duration 이 지나면 새 URL 없이 끝나고 cancelled")
    void deadlineStopsCrawl() {
        PageFetcher slow = new FakeSite(mesh(30)) {
            @Override
            public HttpResponseData fetch(URI url) {
                try {
                    Thread.sleep(100);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.fetch(url);
            }
        };
        ScanConfig cfg = config(3, 100, 1).setMaxScanDuration(Duration.ofMillis(250));

        CrawlResult r = crawl(cfg, slow, new Recorder());

        assertTrue(r.cancelled());
        assertThat(r.visited().size()).isBetween(1, 10);
    }

    @Test
    @DisplayName("errorType 분류")
    void errorType() {
        URI u = URI.create("http://t.test/x");
        assertEquals("timeout", Crawler.errorType(HttpResponseData.failure(u, "GET", "timeout", 30_000)));
        assertEquals("server_error", Crawler.errorType(FakeHttpClient.response(u, 503, "")));
        assertEquals("client_error", Crawler.errorType(FakeHttpClient.response(u, 403, "")));
        assertEquals("non_html_content", Crawler.errorType(HttpResponseData.builder().url(u).statusCode(200)
                .body("{}").contentType("application/json").build()));
        assertNull(Crawler.errorType(FakeHttpClient.response(u, 200, "<html></html>")));
    }

    /* --- 헬퍼 --- */

    private static String links(String... hrefs) {
        StringBuilder sb = new StringBuilder("<html><body>");
        for (String h : hrefs) sb.append("<a href=\"").append(h).append("\">x</a>");
        return sb.append("</body></html>").toString();
    }

    /** "/" 와 /p0../p{n-1} 이 서로 모두 링크된 사이트 */
    private static Map<String, String> mesh(int n) {
        String[] all = new String[n + 1];
        all[0] = "/";
        for (int i = 0; i < n; i++) all[i + 1] = "/p" + i;
        String html = links(all);
        Map<String, String> m = new HashMap<>();
        for (String p : all) m.put(p, html);
        return m;
    }
}
