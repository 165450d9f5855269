package com.websweep.core.analyzer.checks;

import com.websweep.core.analyzer.AnalysisContext;
import com.websweep.core.model.Finding;
import com.websweep.core.model.FindingDetails;
import com.websweep.core.model.FindingType;
import com.websweep.core.testutil.FakeHttpClient;
import com.websweep.core.testutil.TestPages;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("AuthFailuresAnalyzer — 로그인 폼 패시브 점검과 관리자 경로 스윕")
class AuthFailuresAnalyzerTest {

    private static final String BARE_LOGIN = "<html><body><h1>Sign in</h1>"
            + "<form action=\"/login\" method=\"post\">"
            + "<input type=\"text\" name=\"user\"><input type=\"password\" name=\"pass\">"
            + "<input type=\"submit\" value=\"Go\"></form></body></html>";

    private final AuthFailuresAnalyzer analyzer = new AuthFailuresAnalyzer();

    @Test
    @DisplayName("보호 장치 없는 로그인 폼: CAPTCHA/2FA/비밀번호 정책 3건")
    void bareLoginForm() {
        FakeHttpClient http = FakeHttpClient.always(404, "not found");
        AnalysisContext ctx = TestPages.passive(http);

        List<Finding> out = analyzer.analyze(TestPages.page("http://t.test/signin", BARE_LOGIN), ctx);

        assertThat(out).extracting(Finding::getType).containsExactlyInAnyOrder(
                FindingType.AUTH_NO_CAPTCHA, FindingType.AUTH_NO_2FA, FindingType.AUTH_WEAK_PASSWORD_POLICY);
        assertThat(out).allSatisfy(f -> {
            FindingDetails.FormCheck d = (FindingDetails.FormCheck) f.getDetails();
            assertThat(d.formAction()).isEqualTo("http://t.test/login");
            assertThat(d.formMethod()).isEqualToIgnoringCase("post");
        });
        // 브루트포스 프로브가 꺼져 있으면 로그인 POST 는 없다
        assertThat(http.requests()).noneMatch(r -> r.method().equals("POST"));
    }

    @Test
    @DisplayName("CAPTCHA 필드, 2FA 안내, 비밀번호 정책이 있으면 보고 없음")
    void protectedLoginForm() {
        String html = "<html><body><p>Use your authenticator app after signing in.</p>"
                + "<p>Password must contain a digit.</p>"
                + "<form action=\"/login\" method=\"post\">"
                + "<input type=\"text\" name=\"user\"><input type=\"password\" name=\"pass\">"
                + "<input type=\"hidden\" name=\"g-recaptcha-response\">"
                + "</form></body></html>";

        List<Finding> out = analyzer.analyze(TestPages.page("http://t.test/signin", html),
                TestPages.passive(FakeHttpClient.always(404, "")));

        assertThat(out).isEmpty();
    }

    @Test
    @DisplayName("비밀번호 필드가 없는 폼은 로그인 폼이 아니다")
    void nonLoginForm() {
        String html = "<html><body><form action=\"/search\"><input name=\"q\"></form></body></html>";

        List<Finding> out = analyzer.analyze(TestPages.page("http://t.test/", html),
                TestPages.passive(FakeHttpClient.always(404, "")));

        assertThat(out).isEmpty();
    }

    @Test
    @DisplayName("관리자 경로 스윕은 origin 당 한 번, 로그인 화면이 뜨는 경로만 보고")
    void adminSweep_oncePerOrigin() {
        FakeHttpClient http = new FakeHttpClient(r -> r.url().getPath().equals("/admin")
                ? FakeHttpClient.response(r.url(), 200, BARE_LOGIN)
                : FakeHttpClient.response(r.url(), 404, "nope"));
        AnalysisContext ctx = TestPages.passive(http);
        String plain = "<html><body>hello</body></html>";

        List<Finding> first = analyzer.analyze(TestPages.page("http://t.test/", plain), ctx);
        int requestsAfterFirst = http.requests().size();
        List<Finding> second = analyzer.analyze(TestPages.page("http://t.test/other", plain), ctx);

        assertThat(first).singleElement().satisfies(f -> {
            assertThat(f.getType()).isEqualTo(FindingType.AUTH_DEFAULT_LOGIN_PAGE);
            assertThat(f.getUrl()).isEqualTo("http://t.test/admin");
        });
        assertThat(requestsAfterFirst).isEqualTo(AuthFailuresAnalyzer.ADMIN_LOGIN_PATHS.size());
        assertThat(second).isEmpty();
        assertThat(http.requests()).hasSize(requestsAfterFirst);
    }

    @Test
    @DisplayName("CAPTCHA 표식은 name/id 어느 쪽이든, textarea 도 인정")
    void hasCaptcha() {
        Element byId = Jsoup.parse("<form><input id=\"cf-turnstile-token\"></form>").selectFirst("form");
        Element textarea = Jsoup.parse("<form><textarea name=\"h-captcha-response\"></textarea></form>").selectFirst("form");
        Element none = Jsoup.parse("<form><input name=\"user\"></form>").selectFirst("form");

        assertTrue(AuthFailuresAnalyzer.hasCaptcha(byId));
        assertTrue(AuthFailuresAnalyzer.hasCaptcha(textarea));
        assertFalse(AuthFailuresAnalyzer.hasCaptcha(none));
    }

    @Test
    @DisplayName("로그인 화면 판정: 200 + 로그인 문구 + 폼 + 비밀번호 필드")
    void isLoginPage() {
        URI u = URI.create("http://t.test/admin");
        assertTrue(AuthFailuresAnalyzer.isLoginPage(FakeHttpClient.response(u, 200, BARE_LOGIN)));
        assertFalse(AuthFailuresAnalyzer.isLoginPage(FakeHttpClient.response(u, 403, BARE_LOGIN)));
        assertFalse(AuthFailuresAnalyzer.isLoginPage(FakeHttpClient.response(u, 200, "<p>Login disabled</p>")));
    }
}
