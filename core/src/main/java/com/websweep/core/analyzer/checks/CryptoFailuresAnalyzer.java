package com.websweep.core.analyzer.checks;

import com.websweep.core.analyzer.AnalysisContext;
import com.websweep.core.analyzer.ResponseAnalyzer;
import com.websweep.core.crawler.Page;
import com.websweep.core.http.SetCookie;
import com.websweep.core.http.TlsProbe;
import com.websweep.core.model.Advice;
import com.websweep.core.model.CheckCategory;
import com.websweep.core.model.Finding;
import com.websweep.core.model.FindingDetails;
import com.websweep.core.model.FindingType;
import com.websweep.core.model.HttpResponseData;
import com.websweep.core.model.Severity;
import com.websweep.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * A02 암호화 실패: 평문 HTTP, 쿠키 보안 속성, 협상된 TLS 버전.
 * TLS 결과는 host:port 당 한 번만 보고한다.
 */
public final class CryptoFailuresAnalyzer implements ResponseAnalyzer {
    private static final Logger LOG = LoggerFactory.getLogger(CryptoFailuresAnalyzer.class);

    static final Set<String> OUTDATED_PROTOCOLS = Set.of("TLSv1", "TLSv1.1", "SSLv3", "SSLv2", "SSLv2Hello", TlsProbe.LEGACY_ONLY);

    private static final Advice NO_HTTPS = Advice.of(Severity.HIGH,
            "Site is not using HTTPS encryption",
            "Implement HTTPS for all web traffic",
            "Data transmitted in plaintext can be intercepted, read, or modified by attackers");

    private static final Advice INSECURE_COOKIES = Advice.of(Severity.MEDIUM,
            "Cookies with missing security attributes",
            "Set Secure, HttpOnly, and SameSite attributes on cookies",
            "Cookies may be stolen via XSS attacks or transmitted over unencrypted connections");

    private static final Advice OUTDATED_TLS = Advice.of(Severity.MEDIUM,
            "Outdated TLS version",
            "Upgrade to TLS 1.2 or later",
            "Known vulnerabilities in older TLS versions could lead to man-in-the-middle attacks or information disclosure");

    @Override
    public CheckCategory category() { return CheckCategory.CRYPTO_FAILURES; }

    @Override
    public List<Finding> analyze(Page page, AnalysisContext ctx) {
        URI url = page.url();
        String u = url.toString();
        List<Finding> out = new ArrayList<>();

        boolean https = "https".equalsIgnoreCase(url.getScheme());
        if (!https) {
            out.add(Finding.of(FindingType.CRYPTO_NO_HTTPS, u, new FindingDetails.General(NO_HTTPS)));
        }

        if (ctx.config().isScanCookies()) {
            Finding cookies = cookieFinding(page.response(), u);
            if (cookies != null) out.add(cookies);
        }

        if (https) {
            String host = UrlUtils.hostOf(url);
            int port = (url.getPort() > 0 ? url.getPort() : 443);
            if (ctx.firstTime("tls:" + host + ":" + port)) {
                outdatedTls(ctx.tlsProbe(), host, port, u).ifPresent(out::add);
            }
        }
        return out;
    }

    /** Set-Cookie 헤더 기준 속성 점검. 문제 없는 쿠키만 있으면 null. */
    public static Finding cookieFinding(HttpResponseData resp, String url) {
        List<FindingDetails.CookieIssue> issues = new ArrayList<>();
        for (SetCookie c : SetCookie.parseAll(resp.headers("Set-Cookie"))) {
            List<String> problems = new ArrayList<>();
            if (!c.secure()) problems.add("Missing Secure flag");
            if (!c.httpOnly()) problems.add("Missing HttpOnly flag");
            if (c.sameSite() == null) {
                problems.add("Missing SameSite attribute");
            } else if (c.sameSite().isBlank() || c.sameSite().toLowerCase(Locale.ROOT).equals("none")) {
                problems.add("Weak SameSite policy");
            }
            if (!problems.isEmpty()) issues.add(new FindingDetails.CookieIssue(c.name(), problems));
        }
        if (issues.isEmpty()) return null;
        return Finding.of(FindingType.CRYPTO_INSECURE_COOKIES, url,
                new FindingDetails.InsecureCookies(INSECURE_COOKIES, issues));
    }

    /** 핸드셰이크 실패는 로그만 남기고 결과 없음 */
    static Optional<Finding> outdatedTls(TlsProbe probe, String host, int port, String url) {
        Optional<String> proto = probe.negotiatedProtocol(host, port);
        if (proto.isEmpty()) {
            LOG.debug("TLS version unknown for {}:{}", host, port);
            return Optional.empty();
        }
        String v = proto.get();
        if (!OUTDATED_PROTOCOLS.contains(v)) return Optional.empty();
        Advice advice = OUTDATED_TLS.withDescription("Outdated TLS version: " + v);
        return Optional.of(Finding.of(FindingType.CRYPTO_OUTDATED_TLS, url, new FindingDetails.OutdatedTls(advice, v)));
    }
}
