package com.websweep.core.analyzer;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/** 체크 공용 본문/마크업 헬퍼. 입력이 null이거나 깨져 있어도 던지지 않는다. */
public final class HtmlSupport {
    private HtmlSupport() {}

    /** 패턴 중 하나라도 find 되면 그 매치 문자열, 없으면 null */
    public static String firstMatch(List<Pattern> patterns, String text) {
        if (text == null || text.isEmpty()) return null;
        for (Pattern p : patterns) {
            var m = p.matcher(text);
            if (m.find()) return m.group();
        }
        return null;
    }

    public static boolean anyMatch(List<Pattern> patterns, String text) {
        return firstMatch(patterns, text) != null;
    }

    /** 소문자 본문에 키워드가 하나라도 포함되는가 */
    public static boolean containsAny(String lowerText, List<String> needles) {
        if (lowerText == null || lowerText.isEmpty()) return false;
        for (String n : needles) {
            if (lowerText.contains(n)) return true;
        }
        return false;
    }

    /** 요청 단위 분석에 쓰는 관대한 파싱 */
    public static Document parse(String body, URI base) {
        return Jsoup.parse(body == null ? "" : body, base == null ? "" : base.toString());
    }

    /**
     * src/href 속성을 절대 URL 문자열로. "//cdn" 은 https: 를 붙인다.
     * 해석 불가면 원문 반환.
     */
    public static String absoluteUrl(Element el, String attr, URI base) {
        String raw = el.attr(attr).trim();
        if (raw.isEmpty()) return "";
        if (raw.startsWith("//")) return "https:" + raw;
        String lower = raw.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) return raw;
        String abs = el.absUrl(attr);
        if (!abs.isEmpty()) return abs;
        try {
            return base == null ? raw : base.resolve(raw.replace(" ", "%20")).toString();
        } catch (IllegalArgumentException e) {
            return raw;
        }
    }

    public static Pattern ci(String regex) {
        return Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    }
}
