package com.websweep.core.http;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Set-Cookie 헤더 한 줄의 파싱 결과.
 * java.net.HttpCookie는 SameSite를 노출하지 않아 속성을 직접 읽는다.
 *
 * @param sameSite 속성이 없으면 null, 값이 비어 있으면 ""
 */
public record SetCookie(String name, String value, boolean secure, boolean httpOnly, String sameSite) {

    /** 이름이 없는 헤더는 null */
    public static SetCookie parse(String header) {
        if (header == null) return null;
        String[] parts = header.split(";");
        String first = parts[0].trim();
        int eq = first.indexOf('=');
        String name = (eq < 0 ? first : first.substring(0, eq)).trim();
        if (name.isEmpty()) return null;
        String value = (eq < 0 ? "" : first.substring(eq + 1).trim());

        boolean secure = false;
        boolean httpOnly = false;
        String sameSite = null;
        for (int i = 1; i < parts.length; i++) {
            String attr = parts[i].trim();
            int aeq = attr.indexOf('=');
            String key = (aeq < 0 ? attr : attr.substring(0, aeq)).trim().toLowerCase(Locale.ROOT);
            String val = (aeq < 0 ? "" : attr.substring(aeq + 1).trim());
            switch (key) {
                case "secure" -> secure = true;
                case "httponly" -> httpOnly = true;
                case "samesite" -> sameSite = val;
                default -> { }
            }
        }
        return new SetCookie(name, value, secure, httpOnly, sameSite);
    }

    public static List<SetCookie> parseAll(List<String> headers) {
        List<SetCookie> out = new ArrayList<>();
        if (headers == null) return out;
        for (String h : headers) {
            SetCookie c = parse(h);
            if (c != null) out.add(c);
        }
        return out;
    }
}
