package com.websweep.core.model;

/** 카테고리별 활성화 플래그. configKey는 scan.yml / SCANNER_* 키와 동일. */
public enum CheckCategory {
    SECURITY_HEADERS("scan_headers"),
    BROKEN_ACCESS("scan_broken_access"),
    CRYPTO_FAILURES("scan_crypto_failures"),
    INSECURE_DESIGN("scan_insecure_design"),
    SECURITY_MISCONFIGURATIONS("scan_security_misconfigurations"),
    VULNERABLE_COMPONENTS("scan_vulnerable_components"),
    AUTH_FAILURES("scan_auth_failures"),
    INTEGRITY_FAILURES("scan_integrity_failures"),
    LOGGING_MONITORING("scan_logging_monitoring"),
    SSRF("scan_ssrf");

    private final String configKey;

    CheckCategory(String configKey) { this.configKey = configKey; }

    public String configKey() { return configKey; }
}
