package com.websweep.core.analyzer.checks;

import com.websweep.core.analyzer.AnalysisContext;
import com.websweep.core.analyzer.HtmlSupport;
import com.websweep.core.analyzer.SiteCheck;
import com.websweep.core.model.Advice;
import com.websweep.core.model.CheckCategory;
import com.websweep.core.model.Finding;
import com.websweep.core.model.FindingDetails;
import com.websweep.core.model.FindingType;
import com.websweep.core.model.HttpResponseData;
import com.websweep.core.model.ScanConfig.AccessStrictness;
import com.websweep.core.model.Severity;
import com.websweep.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * A01 접근 제어: 흔히 인증이 필요한 경로에 인증 없이 GET.
 * ANY_OK(기본)는 200이면 보고, CONTENT는 관리자 키워드가 있고 로그인 폼이 없을 때만 보고.
 */
public final class BrokenAccessCheck implements SiteCheck {
    private static final Logger LOG = LoggerFactory.getLogger(BrokenAccessCheck.class);

    public static final List<String> RESTRICTED_PATHS = List.of(
            "/admin", "/dashboard", "/config", "/settings", "/hidden", "/administrator", "/admin-panel",
            "/backend", "/cp", "/management", "/moderator", "/webadmin", "/control", "/superuser",
            "/supervisor", "/wp-admin", "/adminpanel", "/admin-dashboard", "/manager", "/panel",
            "/admin.php", "/admin/index.php", "/login.php?admin=true");

    static final List<String> ADMIN_KEYWORDS = List.of(
            "admin", "dashboard", "manage", "control panel", "settings", "configuration", "config",
            "setup", "administrator", "superuser", "moderator");

    private static final Advice ADVICE = Advice.of(Severity.HIGH,
            "Unrestricted access to restricted endpoint",
            "Implement proper authentication and authorization checks for restricted areas",
            "Unauthorized access to admin or restricted functionality, potentially leading to data breach or system compromise");

    @Override
    public CheckCategory category() { return CheckCategory.BROKEN_ACCESS; }

    @Override
    public List<Finding> run(URI target, AnalysisContext ctx) {
        AccessStrictness strictness = ctx.config().getBrokenAccessStrictness();
        List<Finding> out = new ArrayList<>();
        for (String path : RESTRICTED_PATHS) {
            if (Thread.currentThread().isInterrupted()) break;
            URI url = UrlUtils.withPath(target, path);
            HttpResponseData resp = ctx.http().get(url);
            if (resp.isTransportFailure()) {
                LOG.debug("access sweep {} -> {}", url, resp.getError());
                continue;
            }
            Finding f = judge(url.toString(), path, resp, strictness);
            if (f != null) out.add(f);
        }
        LOG.info("Access sweep on {}: {} restricted path(s) reachable", UrlUtils.origin(target), out.size());
        return out;
    }

    /** 판정만(요청 없음) */
    public static Finding judge(String url, String path, HttpResponseData resp, AccessStrictness strictness) {
        int sc = resp.getStatusCode();
        if (sc != 200) return null;
        String body = resp.bodyLower();
        boolean adminContent = HtmlSupport.containsAny(body, ADMIN_KEYWORDS);
        boolean loginForm = body.contains("login") && (body.contains("password") || body.contains("username"));
        boolean granted = adminContent && !loginForm;
        if (strictness == AccessStrictness.CONTENT && !granted) return null;

        Advice advice = ADVICE.withDescription("Unrestricted access to " + path + " endpoint");
        return Finding.of(FindingType.BROKEN_ACCESS_CONTROL, url, new FindingDetails.Access(advice, sc, granted));
    }
}
