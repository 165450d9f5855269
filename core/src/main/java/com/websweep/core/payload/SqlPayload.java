package com.websweep.core.payload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * SQL 인젝션 페이로드. expectedResult가 있으면 응답 본문에서 그 문자열을 찾는다(Result based).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SqlPayload(String name,
                         String payload,
                         @JsonProperty("expected_result") String expectedResult) {

    public SqlPayload {
        payload = (payload == null ? "" : payload);
        name = (name == null || name.isBlank()) ? "Custom" : name;
        expectedResult = (expectedResult == null || expectedResult.isEmpty()) ? null : expectedResult;
    }

    /** sql.txt 한 줄 */
    public static SqlPayload plain(String payload) {
        return new SqlPayload("Custom", payload, null);
    }

    public boolean hasExpectedResult() { return expectedResult != null; }
}
