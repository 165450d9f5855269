package com.websweep.core.analyzer;

import com.websweep.core.analyzer.checks.AuthFailuresAnalyzer;
import com.websweep.core.analyzer.checks.BrokenAccessCheck;
import com.websweep.core.analyzer.checks.ComponentsAnalyzer;
import com.websweep.core.analyzer.checks.CryptoFailuresAnalyzer;
import com.websweep.core.analyzer.checks.InsecureDesignAnalyzer;
import com.websweep.core.analyzer.checks.IntegrityFailuresAnalyzer;
import com.websweep.core.analyzer.checks.LoggingMonitoringAnalyzer;
import com.websweep.core.analyzer.checks.MisconfigAnalyzer;
import com.websweep.core.analyzer.checks.SecurityHeadersAnalyzer;
import com.websweep.core.analyzer.checks.SsrfAnalyzer;
import com.websweep.core.crawler.Page;
import com.websweep.core.event.ScanEvent;
import com.websweep.core.model.CheckCategory;
import com.websweep.core.model.Finding;
import com.websweep.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 항상 링크되는 체크 목록. 활성화 여부는 카테고리 설정 플래그로만 결정한다.
 * 체크 하나가 던진 RuntimeException은 여기서 잡아 CHECK_FAILED로 남기고 다른 체크는 계속 돈다.
 */
public final class AnalyzerRegistry {
    private static final Logger LOG = LoggerFactory.getLogger(AnalyzerRegistry.class);
    private static final StructuredLog SLOG = StructuredLog.get(AnalyzerRegistry.class);

    private final List<SiteCheck> siteChecks;
    private final List<ResponseAnalyzer> pageAnalyzers;
    private final MisconfigAnalyzer errorPageAnalyzer;

    public AnalyzerRegistry(List<SiteCheck> siteChecks, List<ResponseAnalyzer> pageAnalyzers) {
        this.siteChecks = List.copyOf(siteChecks);
        this.pageAnalyzers = List.copyOf(pageAnalyzers);
        this.errorPageAnalyzer = pageAnalyzers.stream()
                .filter(MisconfigAnalyzer.class::isInstance)
                .map(MisconfigAnalyzer.class::cast)
                .findFirst().orElse(null);
    }

    /** 기본 구성: 접근 제어 스윕 + 페이지 체크 9종 */
    public static AnalyzerRegistry standard() {
        return new AnalyzerRegistry(
                List.of(new BrokenAccessCheck()),
                List.of(
                        new SecurityHeadersAnalyzer(),
                        new CryptoFailuresAnalyzer(),
                        new MisconfigAnalyzer(),
                        new ComponentsAnalyzer(),
                        new InsecureDesignAnalyzer(),
                        new AuthFailuresAnalyzer(),
                        new IntegrityFailuresAnalyzer(),
                        new LoggingMonitoringAnalyzer(),
                        new SsrfAnalyzer()
                ));
    }

    public List<SiteCheck> siteChecks() { return siteChecks; }
    public List<ResponseAnalyzer> pageAnalyzers() { return pageAnalyzers; }

    /** 크롤 전 사이트 단위 체크 */
    public List<Finding> runSite(URI target, AnalysisContext ctx) {
        List<Finding> out = new ArrayList<>();
        for (SiteCheck c : siteChecks) {
            if (!ctx.config().isEnabled(c.category())) continue;
            try {
                out.addAll(c.run(target, ctx));
            } catch (RuntimeException e) {
                failed(ctx, c.name(), c.category(), String.valueOf(target), e);
            }
        }
        return out;
    }

    /** 정상 페이지 하나에 활성 체크 전부 */
    public List<Finding> runPage(Page page, AnalysisContext ctx) {
        Objects.requireNonNull(page, "page");
        List<Finding> out = new ArrayList<>();
        for (ResponseAnalyzer a : pageAnalyzers) {
            if (!ctx.config().isEnabled(a.category())) continue;
            if (Thread.currentThread().isInterrupted()) break;
            try {
                out.addAll(a.analyze(page, ctx));
            } catch (RuntimeException e) {
                failed(ctx, a.name(), a.category(), String.valueOf(page.url()), e);
            }
        }
        return out;
    }

    /** 4xx/5xx 페이지: 상세 에러 노출만 본다 */
    public List<Finding> runErrorPage(Page page, AnalysisContext ctx) {
        if (errorPageAnalyzer == null || !ctx.config().isEnabled(errorPageAnalyzer.category())) return List.of();
        try {
            return errorPageAnalyzer.analyzeErrorPage(page);
        } catch (RuntimeException e) {
            failed(ctx, errorPageAnalyzer.name(), errorPageAnalyzer.category(), String.valueOf(page.url()), e);
            return List.of();
        }
    }

    /* --- 헬퍼 --- */

    private static void failed(AnalysisContext ctx, String check, CheckCategory cat, String url, RuntimeException e) {
        LOG.warn("Check {} failed on {}: {}", check, url, e.toString());
        SLOG.error("check-failed", e, "check", check, "url", url);
        ctx.events().onEvent(ScanEvent.of(ScanEvent.Kind.CHECK_FAILED, e.toString(),
                "check", check, "category", cat.configKey(), "url", url));
    }
}
