package com.websweep.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;

import java.util.List;

/**
 * Finding.details의 태그드 변형(tagged variant).
 * 어떤 레코드를 쓰는지는 Finding.type이 결정하고, 공통 네 필드는 {@link Advice}로 평탄화되어 직렬화된다.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface FindingDetails {

    Advice advice();

    default Severity severity() { return advice().severity(); }
    default String description() { return advice().description(); }
    default String recommendation() { return advice().recommendation(); }
    default String consequences() { return advice().consequences(); }

    /** 추가 필드 없음(no_https, 로깅 계열 등) */
    record General(@JsonUnwrapped Advice advice) implements FindingDetails {}

    /** missing_* 헤더 */
    record MissingHeader(@JsonUnwrapped Advice advice,
                         @JsonProperty("header_name") String headerName,
                         @JsonProperty("header_description") String headerDescription) implements FindingDetails {}

    /** sql_injection. form 기반이면 form/inputField, URL 기반이면 parameter */
    record SqlInjection(@JsonUnwrapped Advice advice,
                        Form form,
                        String payload,
                        @JsonProperty("payload_name") String payloadName,
                        String method,
                        @JsonProperty("input_field") String inputField,
                        String parameter,
                        @JsonProperty("detection_method") String detectionMethod) implements FindingDetails {}

    /** xss / reflected_xss */
    record Xss(@JsonUnwrapped Advice advice,
               Form form,
               String payload,
               String method,
               @JsonProperty("input_field") String inputField,
               String parameter,
               @JsonProperty("xss_type") String xssType,
               @JsonProperty("reflection_type") String reflectionType,
               List<String> contexts,
               @JsonProperty("waf_detected") Boolean wafDetected,
               String notes) implements FindingDetails {}

    /** crypto_failure_insecure_cookies */
    record InsecureCookies(@JsonUnwrapped Advice advice,
                           @JsonProperty("insecure_cookies") List<CookieIssue> cookies) implements FindingDetails {}

    record CookieIssue(String name, List<String> issues) {}

    /** crypto_failure_outdated_tls */
    record OutdatedTls(@JsonUnwrapped Advice advice,
                       @JsonProperty("tls_version") String tlsVersion) implements FindingDetails {}

    /** vulnerable_component */
    record Component(@JsonUnwrapped Advice advice,
                     String library,
                     String version,
                     String cve,
                     @JsonProperty("script_url") String scriptUrl) implements FindingDetails {}

    /** broken_access_control */
    record Access(@JsonUnwrapped Advice advice,
                  @JsonProperty("status_code") int statusCode,
                  @JsonProperty("access_granted") boolean accessGranted) implements FindingDetails {}

    /** CSRF/레이트리밋/인증 계열: 대상 폼 */
    record FormCheck(@JsonUnwrapped Advice advice,
                     @JsonProperty("form_action") String formAction,
                     @JsonProperty("form_method") String formMethod) implements FindingDetails {}

    /** 외부 리소스 기반(SRI 누락/http 스크립트는 scriptUrl, 패키지 저장소는 sourceUrl) */
    record Resource(@JsonUnwrapped Advice advice,
                    @JsonProperty("script_url") String scriptUrl,
                    @JsonProperty("source_url") String sourceUrl) implements FindingDetails {

        public static Resource script(Advice advice, String scriptUrl) { return new Resource(advice, scriptUrl, null); }
        public static Resource source(Advice advice, String sourceUrl) { return new Resource(advice, null, sourceUrl); }
    }

    /** 본문 패턴 매칭 기반(디렉터리 리스팅, 상세 에러, 역직렬화 등) */
    record Evidence(@JsonUnwrapped Advice advice,
                    String evidence) implements FindingDetails {}

    /** ssrf_*. 탐지 위치(URL 파라미터/폼 입력/API 엔드포인트)에 해당하는 필드만 채운다. */
    record Ssrf(@JsonUnwrapped Advice advice,
                String parameter,
                @JsonProperty("input_name") String inputName,
                String payload,
                @JsonProperty("original_value") String originalValue,
                @JsonProperty("form_action") String formAction,
                @JsonProperty("form_method") String formMethod,
                String endpoint,
                String method,
                @JsonProperty("content_type") String contentType,
                @JsonProperty("status_code") Integer statusCode,
                @JsonProperty("detection_method") String detectionMethod) implements FindingDetails {}
}
