package com.websweep.core.analyzer.checks;

import com.websweep.core.analyzer.AnalysisContext;
import com.websweep.core.analyzer.components.VulnerableLibraryTable;
import com.websweep.core.http.TlsProbe;
import com.websweep.core.model.Finding;
import com.websweep.core.model.FindingDetails;
import com.websweep.core.model.FindingType;
import com.websweep.core.model.ScanConfig;
import com.websweep.core.testutil.FakeHttpClient;
import com.websweep.core.testutil.TestPages;
import com.websweep.core.util.Sleeper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

@DisplayName("CryptoFailuresAnalyzer")
class CryptoFailuresAnalyzerTest {

    private final AtomicInteger handshakes = new AtomicInteger();

    private AnalysisContext context(ScanConfig cfg, String tlsVersion) {
        return AnalysisContext.builder(cfg, FakeHttpClient.always(404, ""))
                .sleeper(Sleeper.NONE)
                .tlsProbe((host, port) -> {
                    handshakes.incrementAndGet();
                    return Optional.ofNullable(tlsVersion);
                })
                .libraries(VulnerableLibraryTable.builtIn())
                .build();
    }

    @Test
    @DisplayName("http 페이지는 no_https")
    void plainHttp() {
        List<Finding> out = new CryptoFailuresAnalyzer()
                .analyze(TestPages.page("http://t.test/", "<p>x</p>"), context(ScanConfig.defaults(), null));

        assertThat(out).extracting(Finding::getType).containsExactly(FindingType.CRYPTO_NO_HTTPS);
        assertEquals(0, handshakes.get());
    }

    @Test
    @DisplayName("쿠키 속성 누락/약한 SameSite 를 쿠키별로 모은다")
    void insecureCookies() {
        Map<String, List<String>> headers = Map.of("Set-Cookie", List.of(
                "sid=abc; Path=/",
                "ok=1; Secure; HttpOnly; SameSite=Strict",
                "pref=dark; Secure; HttpOnly; SameSite=None"));
        var page = TestPages.page("https://t.test/", 200, "<p>x</p>", headers);

        Finding f = CryptoFailuresAnalyzer.cookieFinding(page.response(), "https://t.test/");

        assertEquals(FindingType.CRYPTO_INSECURE_COOKIES, f.getType());
        List<FindingDetails.CookieIssue> issues = ((FindingDetails.InsecureCookies) f.getDetails()).cookies();
        assertThat(issues).extracting(FindingDetails.CookieIssue::name).containsExactly("sid", "pref");
        assertThat(issues.get(0).issues()).containsExactly(
                "Missing Secure flag", "Missing HttpOnly flag", "Missing SameSite attribute");
        assertThat(issues.get(1).issues()).containsExactly("Weak SameSite policy");
    }

    @Test
    @DisplayName("안전한 쿠키만 있으면 없음, scan_cookies=false 면 검사 안 함")
    void secureCookiesOrDisabled() {
        Map<String, List<String>> ok = Map.of("Set-Cookie", List.of("a=1; Secure; HttpOnly; SameSite=Lax"));
        assertNull(CryptoFailuresAnalyzer.cookieFinding(
                TestPages.page("https://t.test/", 200, "", ok).response(), "https://t.test/"));

        Map<String, List<String>> bad = Map.of("Set-Cookie", List.of("b=2"));
        List<Finding> out = new CryptoFailuresAnalyzer().analyze(TestPages.page("https://t.test/", 200, "", bad),
                context(ScanConfig.defaults().setScanCookies(false), "TLSv1.3"));
        assertThat(out).isEmpty();
    }

    @Test
    @DisplayName("오래된 TLS 는 host:port 당 한 번만 확인/보고")
    void outdatedTlsOncePerHost() {
        AnalysisContext ctx = context(ScanConfig.defaults(), "TLSv1");
        CryptoFailuresAnalyzer a = new CryptoFailuresAnalyzer();

        List<Finding> first = a.analyze(TestPages.page("https://t.test/", "<p>1</p>"), ctx);
        List<Finding> second = a.analyze(TestPages.page("https://t.test/other", "<p>2</p>"), ctx);
        List<Finding> otherPort = a.analyze(TestPages.page("https://t.test:8443/", "<p>3</p>"), ctx);

        assertThat(first).singleElement().satisfies(f -> {
            assertThat(f.getType()).isEqualTo(FindingType.CRYPTO_OUTDATED_TLS);
            assertThat(((FindingDetails.OutdatedTls) f.getDetails()).tlsVersion()).isEqualTo("TLSv1");
        });
        assertThat(second).isEmpty();
        assertThat(otherPort).hasSize(1);
        assertEquals(2, handshakes.get());
    }

    @Test
    @DisplayName("최신 TLS 나 핸드셰이크 실패는 보고하지 않는다")
    void modernOrUnknownTls() {
        assertThat(new CryptoFailuresAnalyzer().analyze(TestPages.page("https://a.test/", "x"),
                context(ScanConfig.defaults(), "TLSv1.3"))).isEmpty();
        assertThat(new CryptoFailuresAnalyzer().analyze(TestPages.page("https://b.test/", "x"),
                context(ScanConfig.defaults(), null))).isEmpty();
    }

    @Test
    @DisplayName("TLSv1.2 이상을 거부하는 서버는 오래된 TLS 로 보고")
    void legacyOnlyServer() {
        List<Finding> out = new CryptoFailuresAnalyzer().analyze(TestPages.page("https://legacy.test/", "x"),
                context(ScanConfig.defaults(), TlsProbe.LEGACY_ONLY));

        assertThat(out).singleElement().satisfies(f -> {
            assertThat(f.getType()).isEqualTo(FindingType.CRYPTO_OUTDATED_TLS);
            assertThat(((FindingDetails.OutdatedTls) f.getDetails()).tlsVersion()).isEqualTo(TlsProbe.LEGACY_ONLY);
        });
    }
}
