package com.websweep.core.analyzer.checks;

import com.websweep.core.analyzer.AnalysisContext;
import com.websweep.core.analyzer.HtmlSupport;
import com.websweep.core.analyzer.ResponseAnalyzer;
import com.websweep.core.analyzer.budget.ActiveProbeGate.Probe;
import com.websweep.core.crawler.Page;
import com.websweep.core.model.Advice;
import com.websweep.core.model.CheckCategory;
import com.websweep.core.model.Finding;
import com.websweep.core.model.FindingDetails;
import com.websweep.core.model.FindingType;
import com.websweep.core.model.Form;
import com.websweep.core.model.HttpResponseData;
import com.websweep.core.model.Severity;
import com.websweep.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * A09 로깅/모니터링 실패.
 * <ul>
 *   <li>로그인 폼 페이지: 실패 로그인 5회 후 잠금/모니터링 문구 확인(능동)</li>
 *   <li>감사 로그 흔적, 관리자 페이지 로깅 흔적, 중앙 로깅 헤더/문구(수동)</li>
 *   <li>의심 활동 모니터링: 짧은 버스트 후 경고 문구 확인(능동, origin 당 한 번)</li>
 * </ul>
 */
public final class LoggingMonitoringAnalyzer implements ResponseAnalyzer {
    private static final Logger LOG = LoggerFactory.getLogger(LoggingMonitoringAnalyzer.class);

    static final List<Pattern> LOCKOUT = List.of(
            HtmlSupport.ci("account.*lock|lock.*account"),
            HtmlSupport.ci("too many attempts|maximum attempts"),
            HtmlSupport.ci("temporarily disabled|temporarily blocked"),
            HtmlSupport.ci("try again later|wait \\d+ minute"));

    static final List<Pattern> LOGIN_MONITORING = List.of(
            HtmlSupport.ci("unusual activity|suspicious activity"),
            HtmlSupport.ci("security alert|security notification"),
            HtmlSupport.ci("multiple failed attempts|repeated failed"));

    static final List<Pattern> AUDIT_TRAIL = List.of(
            HtmlSupport.ci("audit log|audit trail"),
            HtmlSupport.ci("user activity|activity log"),
            HtmlSupport.ci("last login|previous login"),
            HtmlSupport.ci("session history|login history"));

    static final List<String> ADMIN_URL_MARKERS = List.of(
            "/admin", "/administrator", "/manage", "/dashboard", "/control", "/panel", "/console");

    static final List<Pattern> ADMIN_CONTENT = List.of(
            HtmlSupport.ci("admin dashboard|admin panel"),
            HtmlSupport.ci("control panel|management console"),
            HtmlSupport.ci("administrative tools|admin tools"),
            HtmlSupport.ci("manage users|user management"),
            HtmlSupport.ci("site administration|website admin"));

    static final List<Pattern> PROPER_LOGGING = List.of(
            HtmlSupport.ci("activity log|action log"),
            HtmlSupport.ci("audit trail|audit log"),
            HtmlSupport.ci("logging enabled|logs enabled"),
            HtmlSupport.ci("event tracking|event logging"));

    static final List<String> CORRELATION_HEADERS = List.of("x-request-id", "x-correlation-id", "x-transaction-id");

    static final List<Pattern> CENTRALIZED_LOGGING = List.of(
            HtmlSupport.ci("log aggregation|log collection"),
            HtmlSupport.ci("centralized logging|unified logging"),
            HtmlSupport.ci("log management|log system"));

    static final List<Pattern> SUSPICIOUS_ACTIVITY = List.of(
            HtmlSupport.ci("unusual activity|suspicious activity"),
            HtmlSupport.ci("security alert|security warning"),
            HtmlSupport.ci("abnormal behavior|anomalous behavior"),
            HtmlSupport.ci("activity monitoring|behavior monitoring"));

    static final List<String> SENSITIVE_ENDPOINTS = List.of("/admin", "/config", "/settings", "/users", "/api/users", "/api/config");

    static final int LOGIN_ATTEMPTS = 5;
    static final int BURST_REQUESTS = 10;
    private static final Duration LOGIN_GAP = Duration.ofMillis(500);
    private static final Duration BURST_GAP = Duration.ofMillis(100);

    private static final Advice NO_LOCKOUT = Advice.of(Severity.HIGH,
            "No account lockout after multiple failed login attempts",
            "Implement account lockout policies after a certain number of failed login attempts",
            "Without account lockout, attackers can perform unlimited brute force attacks on user accounts");
    private static final Advice NO_LOGIN_MONITORING = Advice.of(Severity.MEDIUM,
            "No evidence of monitoring for failed login attempts",
            "Implement monitoring and alerting for repeated failed login attempts",
            "Without monitoring for failed logins, brute force attacks may go undetected");
    private static final Advice NO_AUDIT = Advice.of(Severity.HIGH,
            "No evidence of audit logging found",
            "Implement audit logging for all authentication and authorization events",
            "Without proper audit trails, security incidents may go undetected and uninvestigated");
    private static final Advice ADMIN_LOGGING = Advice.of(Severity.HIGH,
            "Admin interface with insufficient logging detected",
            "Implement detailed logging for all admin actions",
            "Admin actions could be performed without proper audit trails, making it difficult to detect and investigate malicious activities");
    private static final Advice NO_SUSPICIOUS_MONITORING = Advice.of(Severity.MEDIUM,
            "No monitoring for suspicious activity detected",
            "Implement monitoring and alerting for suspicious activity patterns such as multiple failed logins",
            "Without monitoring for suspicious patterns, attacks such as brute force or account enumeration can go undetected");
    private static final Advice NO_CENTRALIZED = Advice.of(Severity.MEDIUM,
            "No evidence of centralized logging found",
            "Implement centralized logging for all application components",
            "Without centralized logging, security events across different components may be difficult to correlate and analyze");

    /** 로그인 실패 프로브 결과. responses == 0 이면 판단 불가. */
    record LoginProbe(int responses, boolean lockout, boolean monitoring) {}

    @Override
    public CheckCategory category() { return CheckCategory.LOGGING_MONITORING; }

    @Override
    public List<Finding> analyze(Page page, AnalysisContext ctx) {
        List<Finding> out = new ArrayList<>();
        String url = page.url().toString();
        HttpResponseData resp = page.response();
        String body = resp.getBody();

        // ---- 1) 로그인 실패 처리 ----
        Optional<Form> login = page.forms().stream().filter(Form::isLoginForm).findFirst();
        if (login.isPresent()) {
            LoginProbe probe = probeLoginFailures(login.get(), ctx);
            if (probe.responses() > 0) {
                if (!probe.lockout()) out.add(general(FindingType.LOGGING_NO_ACCOUNT_LOCKOUT, url, NO_LOCKOUT));
                if (!probe.monitoring()) out.add(general(FindingType.LOGGING_NO_LOGIN_FAILURE_MONITORING, url, NO_LOGIN_MONITORING));
            }
        }

        // ---- 2) 감사 로그 ----
        if (!HtmlSupport.anyMatch(AUDIT_TRAIL, body)) {
            out.add(general(FindingType.LOGGING_NO_AUDIT_TRAIL, url, NO_AUDIT));
        }

        // ---- 3) 관리자 페이지 로깅 ----
        if (isAdminPage(page.url(), body) && !HtmlSupport.anyMatch(PROPER_LOGGING, body)) {
            out.add(general(FindingType.LOGGING_INSUFFICIENT_ADMIN_LOGGING, url, ADMIN_LOGGING));
        }

        // ---- 4) 의심 활동 모니터링 (origin 당 한 번) ----
        if (ctx.firstTime("burst:" + UrlUtils.origin(page.url())) && lacksSuspiciousActivityMonitoring(page.url(), ctx)) {
            out.add(general(FindingType.LOGGING_NO_SUSPICIOUS_ACTIVITY_MONITORING, url, NO_SUSPICIOUS_MONITORING));
        }

        // ---- 5) 중앙 로깅 ----
        if (!hasCentralizedLogging(resp)) {
            out.add(general(FindingType.LOGGING_NO_CENTRALIZED_LOGGING, url, NO_CENTRALIZED));
        }
        return out;
    }

    /** 같은 임의 자격증명으로 최대 5회 실패 로그인. 잠금 문구가 보이면 중단. */
    LoginProbe probeLoginFailures(Form form, AnalysisContext ctx) {
        URI action = UrlUtils.parse(form.action());
        if (action == null) return new LoginProbe(0, false, false);
        if (!ctx.reserve(Probe.LOGIN_MONITORING, LOGIN_ATTEMPTS, form.action())) return new LoginProbe(0, false, false);

        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        String user = "test_user_" + rnd.nextInt(1000, 10000);
        String pass = "test_pass_" + rnd.nextInt(1000, 10000);
        Map<String, String> data = new LinkedHashMap<>();
        data.put("username", user);
        data.put("email", user + "@example.com");
        data.put("user", user);
        data.put("login", user);
        data.put("password", pass);
        data.put("pass", pass);
        data.put("pwd", pass);

        int responses = 0;
        boolean lockout = false;
        boolean monitoring = false;
        for (int i = 0; i < LOGIN_ATTEMPTS; i++) {
            if (!ctx.pace()) break;
            HttpResponseData r = ctx.http().postForm(action, data);
            if (r.isTransportFailure()) {
                LOG.debug("login monitoring probe on {} stopped: {}", action, r.getError());
                break;
            }
            responses++;
            lockout = HtmlSupport.anyMatch(LOCKOUT, r.getBody());
            monitoring = HtmlSupport.anyMatch(LOGIN_MONITORING, r.getBody());
            if (lockout) break;
            if (!ctx.pause(LOGIN_GAP)) break;
        }
        return new LoginProbe(responses, lockout, monitoring);
    }

    /** 짧은 버스트와 민감 경로 접근 뒤 마지막 응답에 경고 문구가 없으면 true. 프로브를 못 돌리면 false. */
    boolean lacksSuspiciousActivityMonitoring(URI pageUrl, AnalysisContext ctx) {
        int total = BURST_REQUESTS + SENSITIVE_ENDPOINTS.size() + 1;
        if (!ctx.reserve(Probe.BURST, total, pageUrl.toString())) return false;

        for (int i = 0; i < BURST_REQUESTS; i++) {
            if (!ctx.pace()) return false;
            ctx.http().get(pageUrl);
            if (!ctx.pause(BURST_GAP)) return false;
        }
        for (String ep : SENSITIVE_ENDPOINTS) {
            if (!ctx.pace()) return false;
            ctx.http().get(UrlUtils.withPath(pageUrl, ep));
        }
        if (!ctx.pace()) return false;
        HttpResponseData last = ctx.http().get(pageUrl);
        // 응답을 못 받아도 모니터링 흔적이 없는 것으로 본다
        return last.isTransportFailure() || !HtmlSupport.anyMatch(SUSPICIOUS_ACTIVITY, last.getBody());
    }

    static boolean isAdminPage(URI url, String body) {
        String u = url.toString().toLowerCase(Locale.ROOT);
        for (String m : ADMIN_URL_MARKERS) {
            if (u.contains(m)) return true;
        }
        return HtmlSupport.anyMatch(ADMIN_CONTENT, body);
    }

    static boolean hasCentralizedLogging(HttpResponseData resp) {
        for (String h : CORRELATION_HEADERS) {
            if (resp.hasHeader(h)) return true;
        }
        return HtmlSupport.anyMatch(CENTRALIZED_LOGGING, resp.getBody());
    }

    /* --- 헬퍼 --- */

    private static Finding general(String type, String url, Advice advice) {
        return Finding.of(type, url, new FindingDetails.General(advice));
    }
}
