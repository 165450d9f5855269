package com.websweep.core.util;

import com.websweep.core.model.CheckCategory;
import com.websweep.core.model.ScanConfig;
import com.websweep.core.model.ScanConfig.AccessStrictness;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.*;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;

/**
 * scan.yml(또는 JSON 설정, SCANNER_* 환경변수)을 ScanConfig에 반영.
 * 값 오류는 경고만 남기고 기존 값 유지(치명적이지 않음).
 *
 * 예상 YAML 키:
 * target: "https://example.com"
 * max_depth: 3
 * max_pages: 100
 * threads: 4
 * scan_delay: 1.0          # 초
 * request_timeout: 30      # 초
 * max_retries: 3
 * user_agent: "WebSweep/0.5"
 * verify_ssl: true
 * follow_redirects: true
 * scan_forms / scan_links / scan_cookies / scan_xss / scan_sqli: true
 * scan_headers / scan_broken_access / ... / scan_ssrf: true
 * custom_headers: { X-Test: "1" }
 * use_proxy: false
 * proxy_url: "http://127.0.0.1:8080"
 * rate_limit: 0
 * output_dir: "scan_results"
 * excluded_paths: ["/logout"]
 * included_paths: []
 * payload_dir: "payloads"
 * vulnerable_libraries_file: "data/vulnerable_libraries.json"
 * broken_access_strictness: ANY_OK | CONTENT
 * max_scan_duration_s: 0
 * max_response_size_kb: 5120
 * injection:
 *   length_delta_threshold: 100
 *   time_threshold_ms: 2000
 *   payload_delay_ms: 500
 * active_probes:
 *   rate_limit_probe: true
 *   brute_force_probe: true
 *   login_monitoring_probe: true
 *   burst_probe: true
 *   ssrf_probes: true
 *   rps: 5
 *   max_requests: 500
 */
public final class YamlConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(YamlConfigLoader.class);

    static final String ENV_PREFIX = "SCANNER_";

    private static final List<String> TOP_LEVEL_KEYS = List.of(
            "target", "max_depth", "max_pages", "threads", "max_threads", "scan_delay", "request_timeout",
            "max_retries", "user_agent", "verify_ssl", "follow_redirects",
            "scan_forms", "scan_links", "scan_cookies", "scan_xss", "scan_sqli",
            "custom_headers", "use_proxy", "proxy_url", "rate_limit", "output_dir",
            "excluded_paths", "included_paths", "sql_payloads", "xss_payloads",
            "payload_dir", "vulnerable_libraries_file", "broken_access_strictness", "max_scan_duration_s",
            "max_response_size_kb");

    private static final List<String> INJECTION_KEYS = List.of(
            "length_delta_threshold", "time_threshold_ms", "payload_delay_ms");

    private static final List<String> ACTIVE_KEYS = List.of(
            "rate_limit_probe", "brute_force_probe", "login_monitoring_probe", "burst_probe",
            "ssrf_probes", "rps", "max_requests");

    private YamlConfigLoader() {}

    public static ScanConfig loadDefault() throws IOException {
        return load(Path.of("scan.yml"));
    }

    /** 파일이 없으면 IOException. 문법 오류는 경고 후 기본값. */
    public static ScanConfig load(Path yamlPath) throws IOException {
        ScanConfig cfg = ScanConfig.defaults();
        applyYaml(yamlPath, cfg);
        return cfg;
    }

    public static void applyYaml(Path yamlPath, ScanConfig cfg) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("config not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root = yaml.load(in);
            if (root instanceof Map<?, ?> map) {
                apply(map, cfg);
            } else if (root != null) {
                LOG.warn("Config {} is not a mapping; defaults kept", yamlPath);
            }
        } catch (YAMLException e) {
            LOG.warn("Malformed YAML config {}: {}; defaults kept", yamlPath, e.getMessage());
        }
    }

    /** JSON 설정 파일(원래 도구의 config.json 형식과 동일 키) */
    public static void applyJson(Path jsonPath, ScanConfig cfg) throws IOException {
        Objects.requireNonNull(jsonPath, "jsonPath");
        if (!Files.exists(jsonPath)) {
            throw new IOException("config not found at: " + jsonPath.toAbsolutePath());
        }
        try {
            Map<?, ?> map = Json.mapper().readValue(jsonPath.toFile(), Map.class);
            if (map != null) apply(map, cfg);
        } catch (com.fasterxml.jackson.core.JacksonException e) {
            LOG.warn("Malformed JSON config {}: {}; defaults kept", jsonPath, e.getOriginalMessage());
        }
    }

    /** 확장자(.json / 그 외 YAML)에 따라 분기 */
    public static void applyFile(Path path, ScanConfig cfg) throws IOException {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) applyJson(path, cfg); else applyYaml(path, cfg);
    }

    /** SCANNER_MAX_DEPTH, SCANNER_ACTIVE_PROBES_RPS 같은 환경변수 반영 */
    public static void applyEnvironment(ScanConfig cfg, Map<String, String> env) {
        if (env == null || env.isEmpty()) return;
        Map<String, Object> root = new LinkedHashMap<>();
        for (String key : TOP_LEVEL_KEYS) putEnv(env, ENV_PREFIX, key, root);
        for (CheckCategory c : CheckCategory.values()) putEnv(env, ENV_PREFIX, c.configKey(), root);

        Map<String, Object> inj = new LinkedHashMap<>();
        for (String key : INJECTION_KEYS) putEnv(env, ENV_PREFIX + "INJECTION_", key, inj);
        if (!inj.isEmpty()) root.put("injection", inj);

        Map<String, Object> act = new LinkedHashMap<>();
        for (String key : ACTIVE_KEYS) putEnv(env, ENV_PREFIX + "ACTIVE_PROBES_", key, act);
        if (!act.isEmpty()) root.put("active_probes", act);

        if (!root.isEmpty()) {
            LOG.debug("Applying {} config value(s) from environment", root.size());
            apply(root, cfg);
        }
    }

    private static void putEnv(Map<String, String> env, String prefix, String key, Map<String, Object> out) {
        String v = env.get(prefix + key.toUpperCase(Locale.ROOT));
        if (v != null && !v.isBlank()) out.put(key, v.trim());
    }

    /** 맵(YAML/JSON/환경변수 공통 형태)을 cfg에 반영 */
    public static void apply(Map<?, ?> map, ScanConfig cfg) {
        setString(map, "target", cfg::setTarget);
        setInt(map, "max_depth", cfg::setMaxDepth);
        setInt(map, "max_pages", cfg::setMaxPages);
        setInt(map, "max_threads", cfg::setThreads);
        setInt(map, "threads", cfg::setThreads);
        setSecondsAsDuration(map, "scan_delay", cfg::setScanDelay);
        setSecondsAsDuration(map, "request_timeout", cfg::setRequestTimeout);
        setInt(map, "max_retries", cfg::setMaxRetries);
        setInt(map, "max_response_size_kb", cfg::setMaxResponseSizeKb);
        setString(map, "user_agent", cfg::setUserAgent);
        setBoolean(map, "verify_ssl", cfg::setVerifySsl);
        setBoolean(map, "follow_redirects", cfg::setFollowRedirects);

        setBoolean(map, "scan_forms", cfg::setScanForms);
        setBoolean(map, "scan_links", cfg::setScanLinks);
        setBoolean(map, "scan_cookies", cfg::setScanCookies);
        setBoolean(map, "scan_xss", cfg::setScanXss);
        setBoolean(map, "scan_sqli", cfg::setScanSqli);
        for (CheckCategory c : CheckCategory.values()) {
            setBoolean(map, c.configKey(), b -> cfg.setEnabled(c, b));
        }

        setStringMap(map, "custom_headers", cfg::setCustomHeaders);
        setBoolean(map, "use_proxy", cfg::setUseProxy);
        setString(map, "proxy_url", cfg::setProxyUrl);
        setDouble(map, "rate_limit", cfg::setRateLimit);
        setPath(map, "output_dir", cfg::setOutputDir);
        setStringList(map, "excluded_paths", cfg::setExcludedPaths);
        setStringList(map, "included_paths", cfg::setIncludedPaths);
        setStringList(map, "sql_payloads", cfg::setSqlPayloads);
        setStringList(map, "xss_payloads", cfg::setXssPayloads);
        setPath(map, "payload_dir", cfg::setPayloadDir);
        setPath(map, "vulnerable_libraries_file", cfg::setVulnerableLibrariesFile);
        setEnum(map, "broken_access_strictness", AccessStrictness.class, cfg::setBrokenAccessStrictness);
        setSecondsAsDuration(map, "max_scan_duration_s", cfg::setMaxScanDuration);

        Map<String, Object> inj = getMap(map, "injection");
        if (inj != null) {
            var i = cfg.injection();
            setInt(inj, "length_delta_threshold", i::setLengthDeltaThreshold);
            setLong(inj, "time_threshold_ms", i::setTimeThresholdMs);
            setLong(inj, "payload_delay_ms", i::setPayloadDelayMs);
        }

        Map<String, Object> act = getMap(map, "active_probes");
        if (act != null) {
            var a = cfg.activeProbes();
            setBoolean(act, "rate_limit_probe", a::setRateLimitProbe);
            setBoolean(act, "brute_force_probe", a::setBruteForceProbe);
            setBoolean(act, "login_monitoring_probe", a::setLoginMonitoringProbe);
            setBoolean(act, "burst_probe", a::setBurstProbe);
            setBoolean(act, "ssrf_probes", a::setSsrfProbes);
            setInt(act, "rps", a::setRps);
            setInt(act, "max_requests", a::setMaxRequests);
        }
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        if (v != null) warn(key, v, "mapping");
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof List<?> list) {
            List<String> out = new ArrayList<>();
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
            setter.accept(List.copyOf(out));
            return;
        }
        // "a,b,c" 형태 지원
        String s = String.valueOf(v).trim();
        List<String> out = new ArrayList<>();
        if (!s.isEmpty()) {
            for (String p : s.split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    /** 맵 또는 "K:V,K2:V2" 문자열 */
    private static void setStringMap(Map<?, ?> map, String key, Consumer<Map<String, String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        Map<String, String> out = new LinkedHashMap<>();
        if (v instanceof Map<?, ?> m) {
            m.forEach((k, val) -> { if (k != null && val != null) out.put(String.valueOf(k), String.valueOf(val)); });
        } else {
            for (String pair : String.valueOf(v).split(",")) {
                int i = pair.indexOf(':');
                if (i <= 0) {
                    if (!pair.isBlank()) warn(key, pair, "Name:Value");
                    continue;
                }
                out.put(pair.substring(0, i).trim(), pair.substring(i + 1).trim());
            }
        }
        setter.accept(out);
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof Boolean b) { setter.accept(b); return; }
        String s = String.valueOf(v).trim().toLowerCase(Locale.ROOT);
        switch (s) {
            case "1", "true", "on", "yes", "y" -> setter.accept(true);
            case "0", "false", "off", "no", "n" -> setter.accept(false);
            default -> warn(key, v, "boolean");
        }
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof Number n) { setter.accept(n.intValue()); return; }
        try {
            setter.accept(Integer.parseInt(String.valueOf(v).trim()));
        } catch (NumberFormatException e) {
            warn(key, v, "integer");
        }
    }

    private static void setLong(Map<?, ?> map, String key, Consumer<Long> setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof Number n) { setter.accept(n.longValue()); return; }
        try {
            setter.accept(Long.parseLong(String.valueOf(v).trim()));
        } catch (NumberFormatException e) {
            warn(key, v, "integer");
        }
    }

    private static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        Object v = map.get(key);
        if (v == null) return;
        if (v instanceof Number n) { setter.accept(n.doubleValue()); return; }
        try {
            setter.accept(Double.parseDouble(String.valueOf(v).trim()));
        } catch (NumberFormatException e) {
            warn(key, v, "number");
        }
    }

    /** 초 단위(소수 허용) → Duration */
    private static void setSecondsAsDuration(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        try {
            double sec = (v instanceof Number n) ? n.doubleValue() : Double.parseDouble(String.valueOf(v).trim());
            if (sec < 0 || Double.isNaN(sec) || Double.isInfinite(sec)) {
                warn(key, v, "non-negative number of seconds");
                return;
            }
            setter.accept(Duration.ofMillis(Math.round(sec * 1000)));
        } catch (NumberFormatException e) {
            warn(key, v, "number of seconds");
        }
    }

    private static void setPath(Map<?, ?> map, String key, Consumer<Path> setter) {
        Object v = map.get(key);
        if (v == null) return;
        try {
            setter.accept(Path.of(String.valueOf(v)));
        } catch (java.nio.file.InvalidPathException e) {
            warn(key, v, "path");
        }
    }

    private static <E extends Enum<E>> void setEnum(Map<?, ?> map, String key, Class<E> type, Consumer<E> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim();
        for (E e : type.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(s)) {
                setter.accept(e);
                return;
            }
        }
        warn(key, v, "one of " + Arrays.toString(type.getEnumConstants()));
    }

    private static void warn(String key, Object value, String expected) {
        LOG.warn("Invalid config value {}={} (expected {}); keeping previous value", key, value, expected);
    }
}
