package com.websweep.core.model;

import java.util.Locale;

/**
 * Finding 판별자(type) 태그 모음.
 * 체크 하나당 태그 하나. 헤더 누락은 {@link #missingHeader(String)}로 동적 생성.
 */
public final class FindingType {
    private FindingType() {}

    // ===== 인젝션 =====
    public static final String SQL_INJECTION = "sql_injection";
    public static final String XSS = "xss";
    public static final String REFLECTED_XSS = "reflected_xss";

    // ===== A01 접근 제어 =====
    public static final String BROKEN_ACCESS_CONTROL = "broken_access_control";

    // ===== A02 암호화 =====
    public static final String CRYPTO_NO_HTTPS = "crypto_failure_no_https";
    public static final String CRYPTO_INSECURE_COOKIES = "crypto_failure_insecure_cookies";
    public static final String CRYPTO_OUTDATED_TLS = "crypto_failure_outdated_tls";

    // ===== A04 설계 =====
    public static final String INSECURE_DESIGN_CSRF = "insecure_design_csrf";
    public static final String INSECURE_DESIGN_NO_RATE_LIMITING = "insecure_design_no_rate_limiting";

    // ===== A05 설정 =====
    public static final String MISCONFIG_DIRECTORY_LISTING = "security_misconfiguration_directory_listing";
    public static final String MISCONFIG_VERBOSE_ERRORS = "security_misconfiguration_verbose_errors";
    public static final String MISCONFIG_DEFAULT_CONFIGS = "security_misconfiguration_default_configs";

    // ===== A06 컴포넌트 =====
    public static final String VULNERABLE_COMPONENT = "vulnerable_component";

    // ===== A07 인증 =====
    public static final String AUTH_NO_CAPTCHA = "auth_failure_no_captcha";
    public static final String AUTH_NO_2FA = "auth_failure_no_2fa";
    public static final String AUTH_WEAK_PASSWORD_POLICY = "auth_failure_weak_password_policy";
    public static final String AUTH_NO_BRUTE_FORCE_PROTECTION = "auth_failure_no_brute_force_protection";
    public static final String AUTH_DEFAULT_LOGIN_PAGE = "auth_failure_default_login_page";

    // ===== A08 무결성 =====
    public static final String INTEGRITY_MISSING_SRI = "integrity_failure_missing_sri";
    public static final String INTEGRITY_INSECURE_SCRIPT = "integrity_failure_insecure_script";
    public static final String INTEGRITY_INSECURE_PACKAGE_SOURCE = "integrity_failure_insecure_package_source";
    public static final String INTEGRITY_INSECURE_DESERIALIZATION = "integrity_failure_insecure_deserialization";

    // ===== A09 로깅/모니터링 =====
    public static final String LOGGING_NO_ACCOUNT_LOCKOUT = "logging_monitoring_no_account_lockout";
    public static final String LOGGING_NO_LOGIN_FAILURE_MONITORING = "logging_monitoring_no_login_failure_monitoring";
    public static final String LOGGING_NO_AUDIT_TRAIL = "logging_monitoring_no_audit_trail";
    public static final String LOGGING_INSUFFICIENT_ADMIN_LOGGING = "logging_monitoring_insufficient_admin_logging";
    public static final String LOGGING_NO_SUSPICIOUS_ACTIVITY_MONITORING = "logging_monitoring_no_suspicious_activity_monitoring";
    public static final String LOGGING_NO_CENTRALIZED_LOGGING = "logging_monitoring_no_centralized_logging";

    // ===== A10 SSRF =====
    public static final String SSRF_URL_PARAMETER = "ssrf_url_parameter";
    public static final String SSRF_FORM_INPUT = "ssrf_form_input";
    public static final String SSRF_API_ENDPOINT = "ssrf_api_endpoint";

    /** "X-Frame-Options" → "missing_x_frame_options" */
    public static String missingHeader(String headerName) {
        String h = (headerName == null ? "" : headerName.trim());
        return "missing_" + h.toLowerCase(Locale.ROOT).replace('-', '_');
    }
}
