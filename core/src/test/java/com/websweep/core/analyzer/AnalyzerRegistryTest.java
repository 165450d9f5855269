package com.websweep.core.analyzer;

import com.websweep.core.analyzer.checks.SecurityHeadersAnalyzer;
import com.websweep.core.analyzer.components.VulnerableLibraryTable;
import com.websweep.core.crawler.Page;
import com.websweep.core.event.ScanEvent;
import com.websweep.core.model.CheckCategory;
import com.websweep.core.model.Finding;
import com.websweep.core.model.FindingType;
import com.websweep.core.model.ScanConfig;
import com.websweep.core.testutil.FakeHttpClient;
import com.websweep.core.testutil.TestPages;
import com.websweep.core.util.Sleeper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("AnalyzerRegistry")
class AnalyzerRegistryTest {

    private final List<ScanEvent> events = new CopyOnWriteArrayList<>();

    private AnalysisContext context(ScanConfig cfg) {
        cfg.activeProbes().disableAll();
        return AnalysisContext.builder(cfg, FakeHttpClient.always(404, "not found"))
                .sleeper(Sleeper.NONE)
                .tlsProbe((host, port) -> Optional.empty())
                .libraries(VulnerableLibraryTable.builtIn())
                .events(events::add)
                .build();
    }

    private List<ScanEvent> checkFailures() {
        return events.stream().filter(e -> e.kind() == ScanEvent.Kind.CHECK_FAILED).toList();
    }

    @Test
    @DisplayName("체크 하나가 예외를 던져도 나머지는 계속, CHECK_FAILED 이벤트")
    void throwingCheckIsolated() {
        ResponseAnalyzer boom = new ResponseAnalyzer() {
            @Override public CheckCategory category() { return CheckCategory.INSECURE_DESIGN; }
            @Override public String name() { return "boom"; }
            @Override public List<Finding> analyze(Page page, AnalysisContext ctx) {
                throw new IllegalStateException("kaboom");
            }
        };
        AnalyzerRegistry registry = new AnalyzerRegistry(List.of(), List.of(boom, new SecurityHeadersAnalyzer()));

        List<Finding> out = registry.runPage(TestPages.page("http://t.test/", "<html></html>"), context(ScanConfig.defaults()));

        assertEquals(6, out.size());
        assertThat(checkFailures()).singleElement().satisfies(e -> {
            assertThat(e.attr("check")).isEqualTo("boom");
            assertThat(e.attr("category")).isEqualTo("scan_insecure_design");
            assertThat(e.attr("url")).isEqualTo("http://t.test/");
            assertThat(e.message()).contains("kaboom");
        });
    }

    @Test
    @DisplayName("사이트 체크 예외도 격리")
    void throwingSiteCheckIsolated() {
        SiteCheck boom = new SiteCheck() {
            @Override public CheckCategory category() { return CheckCategory.BROKEN_ACCESS; }
            @Override public List<Finding> run(URI target, AnalysisContext ctx) {
                throw new IllegalArgumentException("bad");
            }
        };
        AnalyzerRegistry registry = new AnalyzerRegistry(List.of(boom), List.of());

        List<Finding> out = registry.runSite(URI.create("http://t.test/"), context(ScanConfig.defaults()));

        assertTrue(out.isEmpty());
        assertEquals(1, checkFailures().size());
    }

    @Test
    @DisplayName("꺼진 카테고리는 실행하지 않는다")
    void disabledCategorySkipped() {
        ScanConfig cfg = ScanConfig.defaults().setEnabled(CheckCategory.SECURITY_HEADERS, false);

        List<Finding> out = AnalyzerRegistry.standard()
                .runPage(TestPages.page("http://t.test/", "<html><body>hi</body></html>"), context(cfg));

        assertThat(out).extracting(Finding::getType).noneMatch(t -> t.startsWith("missing_"));
    }

    @Test
    @DisplayName("에러 페이지는 상세 에러 노출만 검사")
    void errorPageOnlyMisconfig() {
        Page page = TestPages.page("http://t.test/broken", 500,
                "<html><body><h1>Uncaught exception</h1><pre>at app.main()</pre></body></html>", Map.of());

        List<Finding> out = AnalyzerRegistry.standard().runErrorPage(page, context(ScanConfig.defaults()));

        assertThat(out).extracting(Finding::getType).containsExactly(FindingType.MISCONFIG_VERBOSE_ERRORS);

        ScanConfig off = ScanConfig.defaults().setEnabled(CheckCategory.SECURITY_MISCONFIGURATIONS, false);
        assertThat(AnalyzerRegistry.standard().runErrorPage(page, context(off))).isEmpty();
    }

    @Test
    @DisplayName("잘리거나 깨진 HTML 도 모든 체크가 예외 없이 통과")
    void gracefulOnTruncatedHtml() {
        List<String> bodies = List.of(
                "",
                "<html><head><title>Sho",
                "<form action='/login' method='post'><input type='password' name='pa",
                "<script src=\"http://cdn.x.org/jquery-1.9.1.min.js\"",
                "<<<>>> not html at all &&& <a href='http://[bad'>x</a>",
                "<table><tr><td><textarea>unterminated");
        AnalyzerRegistry registry = AnalyzerRegistry.standard();

        for (String body : bodies) {
            AnalysisContext ctx = context(ScanConfig.defaults());
            assertThatCode(() -> registry.runPage(TestPages.page("http://t.test/p", body), ctx))
                    .as(body).doesNotThrowAnyException();
        }
        assertThat(checkFailures()).isEmpty();
    }
}
