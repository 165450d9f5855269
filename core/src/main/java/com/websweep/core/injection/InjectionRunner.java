package com.websweep.core.injection;

import com.websweep.core.analyzer.AnalysisContext;
import com.websweep.core.crawler.Page;
import com.websweep.core.model.Finding;
import com.websweep.core.model.Form;
import com.websweep.core.model.FormInput;
import com.websweep.core.model.ScanConfig;
import com.websweep.core.payload.PayloadStore;
import com.websweep.core.util.UrlParamUtil;
import com.websweep.core.util.UrlUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 페이지 단위 주입 실행.
 * 폼(scan_forms)의 입력 필드마다, 그리고 페이지 URL의 쿼리 파라미터마다 SQLi(scan_sqli)와 XSS(scan_xss)를 돌린다.
 */
public final class InjectionRunner {

    private final SqlInjectionScanner sqli;
    private final XssScanner xss;

    public InjectionRunner(PayloadStore payloads) {
        this(new SqlInjectionScanner(payloads), new XssScanner(payloads));
    }

    public InjectionRunner(SqlInjectionScanner sqli, XssScanner xss) {
        this.sqli = Objects.requireNonNull(sqli, "sqli");
        this.xss = Objects.requireNonNull(xss, "xss");
    }

    public List<Finding> run(Page page, AnalysisContext ctx) {
        ScanConfig cfg = ctx.config();
        if (!cfg.isScanSqli() && !cfg.isScanXss()) return List.of();
        List<Finding> out = new ArrayList<>();
        for (InjectionTarget t : targets(page, cfg)) {
            if (Thread.currentThread().isInterrupted()) break;
            if (cfg.isScanSqli()) sqli.scan(t, ctx).ifPresent(out::add);
            if (cfg.isScanXss()) xss.scan(t, ctx).ifPresent(out::add);
        }
        return out;
    }

    /** 폼 필드(중복 이름 제외) 다음 URL 쿼리 파라미터 순서 */
    public static List<InjectionTarget> targets(Page page, ScanConfig cfg) {
        List<InjectionTarget> out = new ArrayList<>();
        if (cfg.isScanForms()) {
            for (Form form : page.forms()) {
                URI action = form.action().isEmpty() ? page.url() : UrlUtils.parse(form.action());
                if (action == null) continue;
                Set<String> seen = new LinkedHashSet<>();
                for (FormInput in : form.fillableInputs()) {
                    if (seen.add(in.name())) out.add(InjectionTarget.formField(page.url(), action, form, in.name()));
                }
            }
        }
        for (String param : UrlParamUtil.parseQuery(page.url()).keySet()) {
            out.add(InjectionTarget.urlParameter(page.url(), param));
        }
        return out;
    }
}
