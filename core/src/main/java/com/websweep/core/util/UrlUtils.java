package com.websweep.core.util;

import com.google.common.net.InetAddresses;
import com.google.common.net.InternetDomainName;

import java.net.URI;
import java.util.Locale;

/** URL 정규화 + 등록 도메인(public suffix 기준) 판정 유틸 */
public final class UrlUtils {
    private UrlUtils(){}

    /**
     * 정규화 규칙(멱등):
     * - fragment 제거, scheme/host 소문자
     * - 기본 포트 제거(http:80, https:443)
     * - 빈 경로는 "/", 중복 슬래시 축소, dot-segment 제거
     * - 루트가 아닌 경로의 끝 슬래시 제거
     * - 쿼리는 원문(raw) 그대로 보존
     */
    public static URI normalize(URI u) {
        if (u == null) return null;
        URI n;
        try {
            n = u.normalize();
        } catch (RuntimeException e) {
            n = u;
        }

        String scheme = (n.getScheme() == null ? "http" : n.getScheme()).toLowerCase(Locale.ROOT);
        String host = hostOf(n);
        if (host.isEmpty()) return n;

        int port = n.getPort();
        if ((scheme.equals("http") && port == 80) || (scheme.equals("https") && port == 443)) {
            port = -1;
        }

        String path = n.getRawPath();
        if (path == null || path.isEmpty()) path = "/";
        path = path.replaceAll("/{2,}", "/");
        if (path.length() > 1 && path.endsWith("/")) path = path.substring(0, path.length() - 1);

        String query = n.getRawQuery();

        StringBuilder sb = new StringBuilder(64);
        sb.append(scheme).append("://").append(host);
        if (port >= 0) sb.append(':').append(port);
        sb.append(path);
        if (query != null && !query.isEmpty()) sb.append('?').append(query);

        try {
            return URI.create(sb.toString());
        } catch (IllegalArgumentException e) {
            // 재조립 실패 시 원본 유지(보수적)
            return u;
        }
    }

    /** 문자열 버전. 파싱 불가/비 http(s)면 null */
    public static String normalize(String raw) {
        URI u = parse(raw);
        if (u == null) return null;
        return normalize(u).toString();
    }

    /** 관대한 파싱: 공백 트림 + 공백 인코딩. http/https 절대 URL만 허용, 아니면 null */
    public static URI parse(String raw) {
        if (raw == null) return null;
        String s = raw.trim().replace(" ", "%20");
        if (s.isEmpty()) return null;
        try {
            URI u = new URI(s);
            if (!isHttp(u) || hostOf(u).isEmpty()) return null;
            return u;
        } catch (Exception e) {
            return null;
        }
    }

    public static boolean isHttp(URI u) {
        if (u == null || u.getScheme() == null) return false;
        String s = u.getScheme().toLowerCase(Locale.ROOT);
        return s.equals("http") || s.equals("https");
    }

    /**
     * 등록 도메인(eTLD+1) 동일 여부. 예: a.example.co.uk ~ b.example.co.uk.
     * IP/localhost/공개 접미사 밖의 호스트는 호스트 문자열 비교로 대체.
     */
    public static boolean sameRegistrableDomain(URI a, URI b) {
        if (a == null || b == null) return false;
        String ha = hostOf(a);
        String hb = hostOf(b);
        if (ha.isEmpty() || hb.isEmpty()) return false;
        if (ha.equals(hb)) return true;
        return registrableDomain(ha).equals(registrableDomain(hb));
    }

    /** eTLD+1. 판정 불가하면 host 그대로 */
    public static String registrableDomain(String host) {
        if (host == null || host.isEmpty()) return "";
        String h = host.toLowerCase(Locale.ROOT);
        if (h.startsWith("[") || InetAddresses.isInetAddress(h)) return h;
        try {
            InternetDomainName d = InternetDomainName.from(h);
            if (d.isUnderPublicSuffix()) return d.topPrivateDomain().toString();
            return h;
        } catch (IllegalArgumentException | IllegalStateException e) {
            return h;
        }
    }

    /** 소문자 호스트(없으면 ""). getHost()가 null인 경우(밑줄 포함 등) authority에서 추출 */
    public static String hostOf(URI u) {
        if (u == null) return "";
        String h = u.getHost();
        if (h == null) {
            String auth = u.getRawAuthority();
            if (auth == null) return "";
            int at = auth.lastIndexOf('@');
            if (at >= 0) auth = auth.substring(at + 1);
            if (!auth.startsWith("[")) {
                int colon = auth.indexOf(':');
                if (colon >= 0) auth = auth.substring(0, colon);
            }
            h = auth;
        }
        return h.toLowerCase(Locale.ROOT);
    }

    /** scheme://host[:port] */
    public static String origin(URI u) {
        String scheme = (u.getScheme() == null ? "http" : u.getScheme().toLowerCase(Locale.ROOT));
        int port = u.getPort();
        return scheme + "://" + hostOf(u) + (port >= 0 ? ":" + port : "");
    }

    /** origin + 절대 경로 */
    public static URI withPath(URI base, String path) {
        String p = (path == null || path.isEmpty()) ? "/" : (path.startsWith("/") ? path : "/" + path);
        return URI.create(origin(base) + p);
    }
}
