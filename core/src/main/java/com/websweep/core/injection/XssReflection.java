package com.websweep.core.injection;

import com.websweep.core.model.HttpResponseData;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Attribute;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * XSS 반사 판정.
 * 정확 반사는 textarea/code/pre 안에 있는 것을 제외하고, 마커 반사는 위치(context)를 분류한다.
 */
public final class XssReflection {
    private XssReflection() {}

    /** 실행 가능한 구성 요소. 페이로드와 본문 양쪽에 있어야 반사로 본다. */
    static final List<String> INDICATORS = List.of(
            "<script>", "javascript:", "onerror=", "onload=", "onclick=", "onmouseover=", "onfocus=", "onmouseout=",
            "onkeypress=", "onsubmit=", "ontoggle=", "alert(", "String.fromCharCode", "eval(", "document.cookie",
            "fetch(");

    static final List<String> WAF_TEXT = List.of(
            "security block", "blocked for security reasons", "attack detected", "firewall", "waf", "mod_security",
            "forbidden", "suspicious activity", "malicious request");

    static final Set<Integer> WAF_STATUS = Set.of(403, 406, 429, 501);

    public static final String CONTEXT_SCRIPT = "script";
    public static final String CONTEXT_HTML = "html";
    public static final String CONTEXT_URL = "url";

    private static final Pattern INERT_BLOCKS = Pattern.compile(
            "<(textarea|code|pre)\\b[^>]*>.*?</\\1\\s*>", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final String ALNUM = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";
    private static final SecureRandom RND = new SecureRandom();

    /** 페이로드가 이스케이프되지 않은 채 textarea/code/pre 밖에 다시 나타나는가 */
    public static boolean isReflectedExact(String body, String payload) {
        if (body == null || payload == null || payload.isEmpty()) return false;
        if (!body.contains(payload)) return false;
        boolean executable = false;
        for (String ind : INDICATORS) {
            if (payload.contains(ind) && body.contains(ind)) {
                executable = true;
                break;
            }
        }
        if (!executable) return false;
        return stripInertBlocks(body).contains(payload);
    }

    /** 마커가 textarea/code/pre 밖에 나타나는가 */
    public static boolean isMarkerReflected(String body, String marker) {
        if (body == null || marker == null || marker.isEmpty()) return false;
        return body.contains(marker) && stripInertBlocks(body).contains(marker);
    }

    /** textarea/code/pre 블록을 통째로 지운 본문 */
    static String stripInertBlocks(String body) {
        return INERT_BLOCKS.matcher(body).replaceAll("");
    }

    /** 마커가 나타난 위치: script, attribute:&lt;name&gt;, html, url */
    public static List<String> contexts(String body, String marker) {
        List<String> out = new ArrayList<>();
        if (body == null || marker == null || !body.contains(marker)) return out;
        Document doc = Jsoup.parse(body);

        for (Element s : doc.select("script")) {
            if (s.data().contains(marker)) {
                out.add(CONTEXT_SCRIPT);
                break;
            }
        }
        Set<String> attrs = new LinkedHashSet<>();
        for (Element el : doc.getAllElements()) {
            for (Attribute a : el.attributes()) {
                if (a.getValue().contains(marker)) attrs.add("attribute:" + a.getKey());
            }
        }
        out.addAll(attrs);
        if (doc.outerHtml().contains(marker)) {
            out.add(CONTEXT_HTML);
        }
        if (body.contains("href=\"" + marker + "\"") || body.contains("src=\"" + marker + "\"")) {
            out.add(CONTEXT_URL);
        }
        return out;
    }

    public static boolean isWafBlock(HttpResponseData resp) {
        if (resp == null) return false;
        String lower = resp.bodyLower();
        for (String w : WAF_TEXT) {
            if (lower.contains(w)) return true;
        }
        return WAF_STATUS.contains(resp.getStatusCode());
    }

    /** script tag / event handler / javascript URI / other */
    public static String xssType(String payload) {
        String p = payload == null ? "" : payload.toLowerCase(Locale.ROOT);
        if (p.contains("<script>")) return "script tag";
        if (p.contains("onerror") || p.contains("onload")) return "event handler";
        if (p.contains("javascript:")) return "javascript URI";
        return "other";
    }

    /** "xss" + 8자 영숫자 */
    public static String newMarker() {
        StringBuilder sb = new StringBuilder("xss");
        for (int i = 0; i < 8; i++) sb.append(ALNUM.charAt(RND.nextInt(ALNUM.length())));
        return sb.toString();
    }

    public static String markerPayload(String marker) {
        return "<script>alert('" + marker + "')</script>";
    }
}
