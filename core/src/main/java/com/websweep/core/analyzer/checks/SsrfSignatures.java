package com.websweep.core.analyzer.checks;

import com.websweep.core.analyzer.HtmlSupport;
import com.websweep.core.model.HttpResponseData;
import com.websweep.core.util.UrlUtils;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** SSRF 프로브 대상/페이로드와 응답 판정. */
public final class SsrfSignatures {
    private SsrfSignatures() {}

    public static final List<String> INTERNAL_TARGETS = List.of(
            "127.0.0.1", "0.0.0.0", "10.0.0.1", "172.16.0.1", "192.168.0.1", "169.254.169.254",
            "localhost", "metadata.google.internal", "metadata", "instance-data", "::1");

    /** {t} 자리에 내부 대상이 들어간다 */
    public static final List<String> PAYLOAD_TEMPLATES = List.of(
            "http://{t}/", "https://{t}/", "http://{t}:22/", "http://{t}:3306/", "http://{t}:5432/",
            "http://{t}:6379/", "http://{t}:8080/", "http://{t}:8443/", "file:///etc/passwd",
            "dict://{t}:11211/", "ftp://{t}/");

    /** 이름에 부분 일치하면 URL을 받는 파라미터로 본다 */
    public static final List<String> URLISH_PARAMETERS = List.of(
            "url", "uri", "link", "src", "source", "redirect", "redirect_to", "return", "return_to", "callback",
            "endpoint", "dest", "destination", "load", "open", "fetch", "share", "preview", "view", "goto", "go",
            "next", "api", "resource", "file", "data", "path", "image", "img", "download", "upload", "proxy",
            "feed", "host", "hostname", "server", "target", "address", "domain");

    static final List<Pattern> SUCCESS_INDICATORS = List.of(
            // 클라우드 메타데이터
            HtmlSupport.ci("ami-id|instance-id|instance-type"),
            HtmlSupport.ci("availability-zone|region"),
            HtmlSupport.ci("security-credentials"),
            HtmlSupport.ci("project-id|numeric-project-id"),
            HtmlSupport.ci("instance/service-accounts"),
            HtmlSupport.ci("compute.internal|metadata.azure.com"),
            HtmlSupport.ci("metadata/instance"),
            // 내부 관리 화면
            HtmlSupport.ci("<title>.*(dashboard|admin|console)"),
            HtmlSupport.ci("<h1>.*(dashboard|admin|console)"),
            // DB
            HtmlSupport.ci("mysql|postgresql|oracle|mongodb|redis"),
            HtmlSupport.ci("database error|db error|connection error"),
            // file://
            HtmlSupport.ci("root:|nobody:|daemon:|bin:|sys:"),
            HtmlSupport.ci("home/[^/]+:|usr/[^/]+:"),
            // 내부 연결 오류
            HtmlSupport.ci("internal server error.*url|request to.*failed"),
            HtmlSupport.ci("could not connect to|connection refused"),
            HtmlSupport.ci("no route to host|host unreachable"),
            // 포트별 서비스 배너
            HtmlSupport.ci("ssh-.*key-exchange|protocol mismatch"),
            HtmlSupport.ci("mysql handshake|sql server"),
            HtmlSupport.ci("memcached|redis"));

    public static String payload(String template, String target) {
        String host = target.contains(":") ? "[" + target + "]" : target;
        return template.replace("{t}", host);
    }

    public static boolean isUrlish(String parameterName) {
        if (parameterName == null) return false;
        String n = parameterName.toLowerCase(Locale.ROOT);
        for (String p : URLISH_PARAMETERS) {
            if (n.contains(p)) return true;
        }
        return false;
    }

    public static boolean looksLikeUrl(String value) {
        return value != null && (value.startsWith("http://") || value.startsWith("https://") || value.startsWith("//"));
    }

    /** 200/201/202 이면서 본문이 내부 응답 시그니처와 일치 */
    public static boolean isSuccessful(HttpResponseData resp) {
        if (resp == null) return false;
        int s = resp.getStatusCode();
        if (s != 200 && s != 201 && s != 202) return false;
        return HtmlSupport.anyMatch(SUCCESS_INDICATORS, resp.getBody());
    }

    /** 3xx 의 Location 이 내부 대상을 가리키는가 */
    public static boolean isInternalRedirect(HttpResponseData resp) {
        if (resp == null) return false;
        int s = resp.getStatusCode();
        if (s < 300 || s >= 400) return false;
        String loc = resp.header("Location");
        if (loc == null || loc.isBlank()) return false;
        String lower = loc.trim().toLowerCase(Locale.ROOT);
        if (lower.startsWith("file:") || lower.startsWith("dict:")) return true;
        try {
            URI u = resp.getUrl() == null ? URI.create(loc.trim()) : resp.getUrl().resolve(loc.trim());
            String host = UrlUtils.hostOf(u);
            return !host.isEmpty() && isInternalHost(host);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    static boolean isInternalHost(String host) {
        String h = host.toLowerCase(Locale.ROOT);
        if (h.startsWith("[") && h.endsWith("]")) h = h.substring(1, h.length() - 1);
        if (INTERNAL_TARGETS.contains(h)) return true;
        if (h.startsWith("127.") || h.startsWith("10.") || h.startsWith("192.168.") || h.startsWith("169.254.")) return true;
        if (h.startsWith("172.")) {
            String[] parts = h.split("\\.");
            if (parts.length == 4) {
                try {
                    int second = Integer.parseInt(parts[1]);
                    return second >= 16 && second <= 31;
                } catch (NumberFormatException e) {
                    return false;
                }
            }
        }
        return false;
    }
}
