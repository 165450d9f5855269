package com.websweep.core.analyzer.checks;

import com.websweep.core.analyzer.AnalysisContext;
import com.websweep.core.analyzer.HtmlSupport;
import com.websweep.core.analyzer.ResponseAnalyzer;
import com.websweep.core.analyzer.budget.ActiveProbeGate.Probe;
import com.websweep.core.crawler.JsoupFormExtractor;
import com.websweep.core.crawler.Page;
import com.websweep.core.model.Advice;
import com.websweep.core.model.CheckCategory;
import com.websweep.core.model.Finding;
import com.websweep.core.model.FindingDetails;
import com.websweep.core.model.FindingType;
import com.websweep.core.model.Form;
import com.websweep.core.model.FormInput;
import com.websweep.core.model.HttpResponseData;
import com.websweep.core.model.Severity;
import com.websweep.core.util.UrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * A07 인증 실패.
 * 비밀번호 필드가 있는 폼마다 CAPTCHA/2FA/비밀번호 정책 흔적을 보고, 능동 프로브로 무차별 대입 방어를 확인한다.
 * 기본 관리자 로그인 경로 스윕은 origin 당 한 번.
 */
public final class AuthFailuresAnalyzer implements ResponseAnalyzer {
    private static final Logger LOG = LoggerFactory.getLogger(AuthFailuresAnalyzer.class);
    private static final SecureRandom RND = new SecureRandom();

    public static final List<String> ADMIN_LOGIN_PATHS = List.of(
            "/admin", "/admin/login", "/administrator", "/administrator/login", "/login", "/wp-admin",
            "/wp-login", "/wp-login.php", "/admin.php", "/adminlogin", "/admin/login.php", "/admin/login.html",
            "/admin/index.php", "/panel", "/cpanel", "/dashboard", "/moderator", "/webadmin", "/adminarea",
            "/bb-admin", "/adminLogin", "/admin_area", "/panel-administracion", "/instadmin", "/memberadmin",
            "/administratorlogin", "/adm", "/account/login", "/admin/account", "/admin_login", "/siteadmin",
            "/siteadmin/login", "/admin/admin", "/moderator/admin", "/user/admin", "/adminpanel", "/super-admin");

    static final List<String> CAPTCHA_MARKERS = List.of("captcha", "recaptcha", "g-recaptcha", "h-captcha", "cf-turnstile");

    static final List<String> TWO_FACTOR_TEXT = List.of(
            "two-factor", "two factor", "2fa", "second factor", "authentication app", "authenticator app",
            "google authenticator", "authy", "verification code", "security code", "one-time password",
            "one time password", "otp", "two-step", "two step", "multi-factor", "multi factor", "mfa");

    static final List<String> STRONG_POLICY_TEXT = List.of(
            "password must contain", "password requirements", "password should include", "password must include",
            "password must be at least", "minimum of", "at least one uppercase", "at least one lowercase",
            "at least one number", "at least one special", "password strength", "strong password");

    static final List<String> PROTECTION_TEXT = List.of(
            "too many attempts", "too many login attempts", "account locked", "account has been locked",
            "try again later", "temporary lockout", "captcha", "recaptcha", "too many failed", "rate limit",
            "wait before trying", "wait for", "locked for", "security measure");

    static final List<String> LOGIN_PAGE_TEXT = List.of(
            "login", "sign in", "username", "password", "admin", "administrator", "log in", "signin", "auth",
            "authentication", "credentials");

    private static final Set<String> NOT_SUBMITTED = Set.of("submit", "button", "image", "reset", "file");
    static final int BRUTE_FORCE_ATTEMPTS = 3;
    private static final Duration ATTEMPT_GAP = Duration.ofSeconds(1);

    private static final Advice NO_CAPTCHA = Advice.of(Severity.MEDIUM,
            "Login form without CAPTCHA protection",
            "Implement CAPTCHA or other anti-automation measures to prevent brute force attacks",
            "Without CAPTCHA, attackers can automate brute force attacks against user accounts");
    private static final Advice NO_2FA = Advice.of(Severity.MEDIUM,
            "No indication of two-factor authentication",
            "Implement two-factor authentication for sensitive accounts",
            "Without 2FA, compromised credentials can immediately lead to account takeover");
    private static final Advice WEAK_POLICY = Advice.of(Severity.MEDIUM,
            "Weak or non-existent password policy",
            "Implement a strong password policy requiring a minimum length and complexity",
            "Weak passwords are more susceptible to brute force and dictionary attacks");
    private static final Advice NO_BRUTE_FORCE = Advice.of(Severity.HIGH,
            "No brute force protection detected",
            "Implement account lockout or rate limiting after multiple failed login attempts",
            "Without brute force protection, attackers can attempt unlimited password guesses");
    private static final Advice DEFAULT_LOGIN = Advice.of(Severity.MEDIUM,
            "Default admin login page found",
            "Change the default admin login URL to a custom path",
            "Default login pages are prime targets for brute force and credential stuffing attacks");

    /** 무차별 대입 프로브 결론. UNKNOWN이면 보고하지 않는다. */
    enum ProbeOutcome { PROTECTED, UNPROTECTED, UNKNOWN }

    @Override
    public CheckCategory category() { return CheckCategory.AUTH_FAILURES; }

    @Override
    public List<Finding> analyze(Page page, AnalysisContext ctx) {
        List<Finding> out = new ArrayList<>();
        String url = page.url().toString();
        Document doc = page.document();
        String body = page.response().bodyLower();

        if (doc != null) {
            for (Element formEl : loginForms(doc)) {
                Form form = JsoupFormExtractor.toForm(formEl, page.url());
                if (!hasCaptcha(formEl)) out.add(formFinding(FindingType.AUTH_NO_CAPTCHA, url, NO_CAPTCHA, form));
                if (!HtmlSupport.containsAny(body, TWO_FACTOR_TEXT)) out.add(formFinding(FindingType.AUTH_NO_2FA, url, NO_2FA, form));
                if (!HtmlSupport.containsAny(body, STRONG_POLICY_TEXT)) out.add(formFinding(FindingType.AUTH_WEAK_PASSWORD_POLICY, url, WEAK_POLICY, form));
                if (bruteForceProbe(form, ctx) == ProbeOutcome.UNPROTECTED) {
                    out.add(formFinding(FindingType.AUTH_NO_BRUTE_FORCE_PROTECTION, url, NO_BRUTE_FORCE, form));
                }
            }
        }

        if (ctx.firstTime("admin-login-sweep:" + UrlUtils.origin(page.url()))) {
            out.addAll(sweepDefaultLogins(page.url(), ctx));
        }
        return out;
    }

    /** 잘 알려진 관리자 로그인 경로 스윕: 200 + 로그인 문구 + 폼 + 비밀번호 필드 */
    public List<Finding> sweepDefaultLogins(URI base, AnalysisContext ctx) {
        List<Finding> out = new ArrayList<>();
        for (String path : ADMIN_LOGIN_PATHS) {
            if (Thread.currentThread().isInterrupted()) break;
            URI admin = UrlUtils.withPath(base, path);
            HttpResponseData resp = ctx.http().get(admin);
            if (isLoginPage(resp)) {
                Advice a = DEFAULT_LOGIN.withDescription("Default admin login page found at " + path);
                out.add(Finding.of(FindingType.AUTH_DEFAULT_LOGIN_PAGE, admin.toString(), new FindingDetails.General(a)));
            }
        }
        LOG.debug("admin login sweep on {}: {} hit(s)", UrlUtils.origin(base), out.size());
        return out;
    }

    static boolean isLoginPage(HttpResponseData resp) {
        if (resp.getStatusCode() != 200) return false;
        if (!HtmlSupport.containsAny(resp.bodyLower(), LOGIN_PAGE_TEXT)) return false;
        Document d = HtmlSupport.parse(resp.getBody(), resp.getUrl());
        return !d.select("form").isEmpty() && !d.select("input[type=password]").isEmpty();
    }

    static List<Element> loginForms(Document doc) {
        List<Element> out = new ArrayList<>();
        for (Element f : doc.select("form")) {
            if (!f.select("input[type=password]").isEmpty()) out.add(f);
        }
        return out;
    }

    /** input/textarea 의 name 또는 id 에 CAPTCHA 표식 */
    static boolean hasCaptcha(Element form) {
        for (Element in : form.select("input, textarea")) {
            String name = in.attr("name").toLowerCase(Locale.ROOT);
            String id = in.id().toLowerCase(Locale.ROOT);
            for (String m : CAPTCHA_MARKERS) {
                if (name.contains(m) || id.contains(m)) return true;
            }
        }
        return false;
    }

    /** 틀린 자격증명 3회 제출. 사용자명/비밀번호 필드가 없거나 프로브를 못 돌리면 UNKNOWN. */
    ProbeOutcome bruteForceProbe(Form form, AnalysisContext ctx) {
        String userField = null;
        String passField = null;
        for (FormInput in : form.inputs()) {
            if (in.type().equals("text") || in.type().equals("email")) userField = in.name();
            else if (in.type().equals("password")) passField = in.name();
        }
        if (userField == null || passField == null) return ProbeOutcome.UNKNOWN;
        URI action = UrlUtils.parse(form.action());
        if (action == null) return ProbeOutcome.UNKNOWN;
        if (!ctx.reserve(Probe.BRUTE_FORCE, BRUTE_FORCE_ATTEMPTS, form.action())) return ProbeOutcome.UNKNOWN;

        String user = randomString("abcdefghijklmnopqrstuvwxyz", 8) + "@example.com";
        String pass = randomString("ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789", 10);

        for (int i = 0; i < BRUTE_FORCE_ATTEMPTS; i++) {
            Map<String, String> data = new LinkedHashMap<>();
            for (FormInput in : form.inputs()) {
                if (in.name().equals(userField)) data.put(in.name(), user);
                else if (in.name().equals(passField)) data.put(in.name(), pass + i);
                else if (!NOT_SUBMITTED.contains(in.type())) data.put(in.name(), in.value());
            }
            if (!ctx.pace()) return ProbeOutcome.UNKNOWN;
            HttpResponseData resp = ctx.http().submit(action, form.method(), data);
            if (resp.isTransportFailure()) {
                LOG.debug("brute-force probe on {} aborted: {}", action, resp.getError());
                return ProbeOutcome.UNKNOWN;
            }
            if (resp.getStatusCode() == 429) return ProbeOutcome.PROTECTED;
            if (HtmlSupport.containsAny(resp.bodyLower(), PROTECTION_TEXT)) return ProbeOutcome.PROTECTED;
            if (i + 1 < BRUTE_FORCE_ATTEMPTS && !ctx.pause(ATTEMPT_GAP)) return ProbeOutcome.UNKNOWN;
        }
        return ProbeOutcome.UNPROTECTED;
    }

    /* --- 헬퍼 --- */

    private static Finding formFinding(String type, String url, Advice advice, Form form) {
        return Finding.of(type, url, new FindingDetails.FormCheck(advice, form.action(), form.method()));
    }

    private static String randomString(String alphabet, int len) {
        StringBuilder sb = new StringBuilder(len);
        for (int i = 0; i < len; i++) sb.append(alphabet.charAt(RND.nextInt(alphabet.length())));
        return sb.toString();
    }
}
