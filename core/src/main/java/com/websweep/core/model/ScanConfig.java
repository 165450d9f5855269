package com.websweep.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 스캔 설정 (scan.yml / 환경변수 / CLI 매핑 대상).
 * startScan 이전에만 변경하고 스캔 중에는 읽기 전용으로 다룬다.
 * scan_config.json 으로도 직렬화된다.
 */
public final class ScanConfig {

    /** 접근 제어 스윕 판정 정책 */
    public enum AccessStrictness {
        /** 제한 경로에서 200이면 무조건 보고(기본) */
        ANY_OK,
        /** 관리자 키워드가 있고 로그인 폼이 없을 때만 보고 */
        CONTENT
    }

    /** 인젝션 판정 임계값: YAML `injection:` 섹션 */
    public static final class Injection {
        private int lengthDeltaThreshold = 100;
        private long timeThresholdMs = 2000;
        private long payloadDelayMs = 500;

        @JsonProperty("length_delta_threshold")
        public int getLengthDeltaThreshold() { return lengthDeltaThreshold; }
        public Injection setLengthDeltaThreshold(int v) { this.lengthDeltaThreshold = v; return this; }

        @JsonProperty("time_threshold_ms")
        public long getTimeThresholdMs() { return timeThresholdMs; }
        public Injection setTimeThresholdMs(long v) { this.timeThresholdMs = v; return this; }

        @JsonProperty("payload_delay_ms")
        public long getPayloadDelayMs() { return payloadDelayMs; }
        public Injection setPayloadDelayMs(long v) { this.payloadDelayMs = Math.max(0, v); return this; }
    }

    /** 능동 프로브(대상에 실제 공격성 요청을 보내는 체크) 토글 + 상한: YAML `active_probes:` */
    public static final class ActiveProbes {
        private boolean rateLimitProbe = true;
        private boolean bruteForceProbe = true;
        private boolean loginMonitoringProbe = true;
        private boolean burstProbe = true;
        private boolean ssrfProbes = true;
        private int rps = 5;
        private int maxRequests = 500;

        @JsonProperty("rate_limit_probe")
        public boolean isRateLimitProbe() { return rateLimitProbe; }
        public ActiveProbes setRateLimitProbe(boolean v) { this.rateLimitProbe = v; return this; }

        @JsonProperty("brute_force_probe")
        public boolean isBruteForceProbe() { return bruteForceProbe; }
        public ActiveProbes setBruteForceProbe(boolean v) { this.bruteForceProbe = v; return this; }

        @JsonProperty("login_monitoring_probe")
        public boolean isLoginMonitoringProbe() { return loginMonitoringProbe; }
        public ActiveProbes setLoginMonitoringProbe(boolean v) { this.loginMonitoringProbe = v; return this; }

        @JsonProperty("burst_probe")
        public boolean isBurstProbe() { return burstProbe; }
        public ActiveProbes setBurstProbe(boolean v) { this.burstProbe = v; return this; }

        @JsonProperty("ssrf_probes")
        public boolean isSsrfProbes() { return ssrfProbes; }
        public ActiveProbes setSsrfProbes(boolean v) { this.ssrfProbes = v; return this; }

        public int getRps() { return rps; }
        public ActiveProbes setRps(int v) { this.rps = v; return this; }

        @JsonProperty("max_requests")
        public int getMaxRequests() { return maxRequests; }
        public ActiveProbes setMaxRequests(int v) { this.maxRequests = v; return this; }

        /** 전부 끄기(패시브 전용 스캔) */
        public ActiveProbes disableAll() {
            rateLimitProbe = bruteForceProbe = loginMonitoringProbe = burstProbe = ssrfProbes = false;
            return this;
        }
    }

    // ---------- 크롤 범위 ----------
    private String target;
    private int maxDepth = 3;
    private int maxPages = 100;
    private int threads = 4;
    private List<String> excludedPaths = List.of();
    private List<String> includedPaths = List.of();

    // ---------- 전송 ----------
    private Duration requestTimeout = Duration.ofSeconds(30);
    private Duration scanDelay = Duration.ofSeconds(1);
    private int maxRetries = 3;
    private String userAgent = "WebSweep/0.5";
    private boolean verifySsl = true;
    private boolean followRedirects = true;
    private Map<String, String> customHeaders = Map.of();
    private boolean useProxy = false;
    private String proxyUrl;
    private double rateLimit = 0.0;          // 초당 요청 수, 0 = 무제한
    private Duration maxScanDuration = Duration.ZERO; // 0 = 무제한
    private int maxResponseSizeKb = 5 * 1024;        // 응답 본문 상한(초과분은 버림)

    // ---------- 체크 토글 ----------
    private boolean scanForms = true;
    private boolean scanLinks = true;
    private boolean scanCookies = true;
    private boolean scanXss = true;
    private boolean scanSqli = true;
    private final EnumSet<CheckCategory> enabledCategories = EnumSet.allOf(CheckCategory.class);
    private AccessStrictness brokenAccessStrictness = AccessStrictness.ANY_OK;

    // ---------- 페이로드/데이터 ----------
    private List<String> sqlPayloads;        // null → PayloadStore 사용
    private List<String> xssPayloads;        // null → PayloadStore 사용
    private Path payloadDir;
    private Path vulnerableLibrariesFile;

    // ---------- 출력 ----------
    private Path outputDir = Path.of("scan_results");

    private final Injection injection = new Injection();
    private final ActiveProbes activeProbes = new ActiveProbes();

    // ---------- getters ----------
    public String getTarget() { return target; }
    @JsonProperty("max_depth") public int getMaxDepth() { return maxDepth; }
    @JsonProperty("max_pages") public int getMaxPages() { return maxPages; }
    public int getThreads() { return threads; }
    @JsonProperty("excluded_paths") public List<String> getExcludedPaths() { return excludedPaths; }
    @JsonProperty("included_paths") public List<String> getIncludedPaths() { return includedPaths; }

    @JsonIgnore public Duration getRequestTimeout() { return requestTimeout; }
    @JsonIgnore public Duration getScanDelay() { return scanDelay; }
    @JsonProperty("max_retries") public int getMaxRetries() { return maxRetries; }
    @JsonProperty("user_agent") public String getUserAgent() { return userAgent; }
    @JsonProperty("verify_ssl") public boolean isVerifySsl() { return verifySsl; }
    @JsonProperty("follow_redirects") public boolean isFollowRedirects() { return followRedirects; }
    @JsonProperty("custom_headers") public Map<String, String> getCustomHeaders() { return customHeaders; }
    @JsonProperty("use_proxy") public boolean isUseProxy() { return useProxy; }
    @JsonProperty("proxy_url") public String getProxyUrl() { return proxyUrl; }
    @JsonProperty("rate_limit") public double getRateLimit() { return rateLimit; }
    @JsonIgnore public Duration getMaxScanDuration() { return maxScanDuration; }
    @JsonProperty("max_response_size_kb") public int getMaxResponseSizeKb() { return maxResponseSizeKb; }

    @JsonProperty("scan_forms") public boolean isScanForms() { return scanForms; }
    @JsonProperty("scan_links") public boolean isScanLinks() { return scanLinks; }
    @JsonProperty("scan_cookies") public boolean isScanCookies() { return scanCookies; }
    @JsonProperty("scan_xss") public boolean isScanXss() { return scanXss; }
    @JsonProperty("scan_sqli") public boolean isScanSqli() { return scanSqli; }
    @JsonProperty("broken_access_strictness") public AccessStrictness getBrokenAccessStrictness() { return brokenAccessStrictness; }

    @JsonProperty("sql_payloads") public List<String> getSqlPayloads() { return sqlPayloads; }
    @JsonProperty("xss_payloads") public List<String> getXssPayloads() { return xssPayloads; }
    @JsonIgnore public Path getPayloadDir() { return payloadDir; }
    @JsonIgnore public Path getVulnerableLibrariesFile() { return vulnerableLibrariesFile; }
    @JsonIgnore public Path getOutputDir() { return outputDir; }

    public Injection injection() { return injection; }
    public ActiveProbes activeProbes() { return activeProbes; }

    public boolean isEnabled(CheckCategory c) { return enabledCategories.contains(c); }

    @JsonIgnore
    public Set<CheckCategory> getEnabledCategories() { return EnumSet.copyOf(enabledCategories); }

    // 직렬화 전용(scan_config.json) 보조 게터
    @JsonProperty("request_timeout") double requestTimeoutSeconds() { return requestTimeout.toMillis() / 1000.0; }
    @JsonProperty("scan_delay") double scanDelaySeconds() { return scanDelay.toMillis() / 1000.0; }
    @JsonProperty("output_dir") String outputDirString() { return String.valueOf(outputDir); }
    @JsonProperty("max_scan_duration_s") long maxScanDurationSeconds() { return maxScanDuration.toSeconds(); }
    @JsonProperty("injection") Injection injectionSection() { return injection; }
    @JsonProperty("active_probes") ActiveProbes activeProbesSection() { return activeProbes; }
    @JsonProperty("categories") Map<String, Boolean> categoryFlags() {
        Map<String, Boolean> m = new LinkedHashMap<>();
        for (CheckCategory c : CheckCategory.values()) m.put(c.configKey(), isEnabled(c));
        return m;
    }

    // ---------- fluent setters ----------
    public ScanConfig setTarget(String target) { this.target = target; return this; }
    public ScanConfig setMaxDepth(int maxDepth) { this.maxDepth = maxDepth; return this; }
    public ScanConfig setMaxPages(int maxPages) { this.maxPages = maxPages; return this; }
    public ScanConfig setThreads(int threads) { this.threads = threads; return this; }
    public ScanConfig setExcludedPaths(List<String> v) { this.excludedPaths = (v == null ? List.of() : List.copyOf(v)); return this; }
    public ScanConfig setIncludedPaths(List<String> v) { this.includedPaths = (v == null ? List.of() : List.copyOf(v)); return this; }

    public ScanConfig setRequestTimeout(Duration d) { this.requestTimeout = d; return this; }
    public ScanConfig setScanDelay(Duration d) { this.scanDelay = d; return this; }
    public ScanConfig setMaxRetries(int n) { this.maxRetries = n; return this; }
    public ScanConfig setUserAgent(String ua) { if (ua != null && !ua.isBlank()) this.userAgent = ua; return this; }
    public ScanConfig setVerifySsl(boolean v) { this.verifySsl = v; return this; }
    public ScanConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public ScanConfig setCustomHeaders(Map<String, String> h) {
        this.customHeaders = (h == null ? Map.of() : Map.copyOf(h));
        return this;
    }
    public ScanConfig setUseProxy(boolean v) { this.useProxy = v; return this; }
    public ScanConfig setProxyUrl(String v) { this.proxyUrl = v; return this; }
    public ScanConfig setRateLimit(double v) { this.rateLimit = v; return this; }
    public ScanConfig setMaxScanDuration(Duration d) { this.maxScanDuration = (d == null ? Duration.ZERO : d); return this; }
    public ScanConfig setMaxResponseSizeKb(int kb) { this.maxResponseSizeKb = kb; return this; }

    public ScanConfig setScanForms(boolean v) { this.scanForms = v; return this; }
    public ScanConfig setScanLinks(boolean v) { this.scanLinks = v; return this; }
    public ScanConfig setScanCookies(boolean v) { this.scanCookies = v; return this; }
    public ScanConfig setScanXss(boolean v) { this.scanXss = v; return this; }
    public ScanConfig setScanSqli(boolean v) { this.scanSqli = v; return this; }
    public ScanConfig setBrokenAccessStrictness(AccessStrictness s) {
        this.brokenAccessStrictness = (s == null ? AccessStrictness.ANY_OK : s);
        return this;
    }

    public ScanConfig setEnabled(CheckCategory c, boolean on) {
        if (on) enabledCategories.add(c); else enabledCategories.remove(c);
        return this;
    }

    /** 카테고리 전부 끄기(특정 체크만 켜서 테스트할 때) */
    public ScanConfig disableAllCategories() { enabledCategories.clear(); return this; }

    public ScanConfig setSqlPayloads(List<String> p) { this.sqlPayloads = (p == null ? null : List.copyOf(p)); return this; }
    public ScanConfig setXssPayloads(List<String> p) { this.xssPayloads = (p == null ? null : List.copyOf(p)); return this; }
    public ScanConfig setPayloadDir(Path p) { this.payloadDir = p; return this; }
    public ScanConfig setVulnerableLibrariesFile(Path p) { this.vulnerableLibrariesFile = p; return this; }
    public ScanConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }

    // ---------- validate ----------
    public void validate() {
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0");
        if (maxPages < 1) throw new IllegalArgumentException("maxPages must be >= 1");
        if (threads < 1) throw new IllegalArgumentException("threads must be >= 1");
        if (maxRetries < 1) throw new IllegalArgumentException("maxRetries must be >= 1");
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero())
            throw new IllegalArgumentException("requestTimeout must be > 0");
        if (scanDelay == null || scanDelay.isNegative())
            throw new IllegalArgumentException("scanDelay must be >= 0");
        if (rateLimit < 0) throw new IllegalArgumentException("rateLimit must be >= 0");
        if (maxScanDuration.isNegative()) throw new IllegalArgumentException("maxScanDuration must be >= 0");
        if (maxResponseSizeKb < 1) throw new IllegalArgumentException("maxResponseSizeKb must be >= 1");
        if (useProxy && (proxyUrl == null || proxyUrl.isBlank()))
            throw new IllegalArgumentException("proxyUrl is required when useProxy=true");
        Objects.requireNonNull(outputDir, "outputDir");

        if (injection.getLengthDeltaThreshold() < 0)
            throw new IllegalArgumentException("injection.lengthDeltaThreshold must be >= 0");
        if (injection.getTimeThresholdMs() < 1)
            throw new IllegalArgumentException("injection.timeThresholdMs must be >= 1");
        if (activeProbes.getRps() < 1)
            throw new IllegalArgumentException("activeProbes.rps must be >= 1");
        if (activeProbes.getMaxRequests() < 0)
            throw new IllegalArgumentException("activeProbes.maxRequests must be >= 0");
    }

    // ---------- helpers ----------
    public static ScanConfig defaults() { return new ScanConfig(); }

    @JsonIgnore
    public long getRequestTimeoutMs() { return requestTimeout.toMillis(); }
}
