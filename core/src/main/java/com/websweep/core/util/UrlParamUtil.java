package com.websweep.core.util;

import java.net.URI;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * URL 쿼리 파라미터 유틸
 * - parseQuery: 단일값 맵(마지막 값을 채택). parseQueryMulti: 다값 맵.
 * - replaceParam: key 값만 바꾸고 나머지 파라미터/순서는 유지(주입 요청용).
 * - withQuery: 쿼리를 통째로 교체.
 * - encodeForm: application/x-www-form-urlencoded 본문 생성.
 */
public final class UrlParamUtil {
    private UrlParamUtil() {}

    /** 단일값 쿼리 파싱(마지막 값을 채택). 입력 순서 유지. */
    public static Map<String, String> parseQuery(URI url) {
        Map<String, List<String>> multi = parseQueryMulti(url);
        Map<String, String> single = new LinkedHashMap<>();
        for (var e : multi.entrySet()) {
            List<String> vals = e.getValue();
            single.put(e.getKey(), vals.isEmpty() ? "" : vals.get(vals.size() - 1));
        }
        return single;
    }

    /** 다값 쿼리 파싱. 입력 순서 유지. 잘못된 % 인코딩은 원문 유지. */
    public static Map<String, List<String>> parseQueryMulti(URI url) {
        Objects.requireNonNull(url, "url");
        Map<String, List<String>> m = new LinkedHashMap<>();
        String q = url.getRawQuery();
        if (q == null || q.isEmpty()) return m;

        for (String p : q.split("&")) {
            if (p.isEmpty()) continue;
            int i = p.indexOf('=');
            final String k, v;
            if (i < 0) {
                k = dec(p);
                v = "";
            } else {
                k = dec(p.substring(0, i));
                v = dec(p.substring(i + 1));
            }
            if (k.isEmpty()) continue;
            m.computeIfAbsent(k, __ -> new ArrayList<>()).add(v);
        }
        return m;
    }

    /** key의 값을 value로 교체(없으면 끝에 추가). 다른 파라미터는 그대로. */
    public static URI replaceParam(URI base, String key, String value) {
        Objects.requireNonNull(base, "base");
        if (key == null || key.isBlank()) throw new IllegalArgumentException("key must not be blank");
        Map<String, String> params = parseQuery(base);
        params.put(key, value == null ? "" : value);
        return withQuery(base, params);
    }

    /** 쿼리를 params로 교체(fragment 제거) */
    public static URI withQuery(URI base, Map<String, String> params) {
        Objects.requireNonNull(base, "base");
        String path = (base.getRawPath() == null || base.getRawPath().isEmpty()) ? "/" : base.getRawPath();
        String q = encodeForm(params);
        return URI.create(UrlUtils.origin(base) + path + (q.isEmpty() ? "" : "?" + q));
    }

    /** k1=v1&k2=v2 (UTF-8 인코딩) */
    public static String encodeForm(Map<String, String> params) {
        if (params == null || params.isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        for (var e : params.entrySet()) {
            if (e.getKey() == null) continue;
            if (sb.length() > 0) sb.append('&');
            sb.append(enc(e.getKey())).append('=').append(enc(e.getValue() == null ? "" : e.getValue()));
        }
        return sb.toString();
    }

    private static String enc(String s) { return URLEncoder.encode(s, StandardCharsets.UTF_8); }

    private static String dec(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            return s;
        }
    }
}
