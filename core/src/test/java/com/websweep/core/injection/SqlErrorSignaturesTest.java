package com.websweep.core.injection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("SqlErrorSignatures")
class SqlErrorSignaturesTest {

    @Test
    @DisplayName("MySQL 'SQL syntax' 오류는 ' OR '1'='1 주입에서 취약 판정")
    void mysqlSyntaxError() {
        String body = "<b>Warning</b>: You have an error in your SQL syntax; check the manual that corresponds "
                + "to your MySQL server version for the right syntax to use near ''1'='1'' at line 1";

        assertTrue(SqlErrorSignatures.isVulnerableToSqlInjection(body, "' OR '1'='1"));
        assertThat(SqlErrorSignatures.match(body)).contains("SQL syntax");
    }

    @Test
    @DisplayName("대소문자 무시, 정규식 시그니처도 적용")
    void caseInsensitiveAndRegex() {
        assertThat(SqlErrorSignatures.match("sql syntax error")).contains("sql syntax");
        assertTrue(SqlErrorSignatures.isVulnerableToSqlInjection("ORA-01756: quoted string not properly terminated", "'"));
        assertTrue(SqlErrorSignatures.isVulnerableToSqlInjection("PostgreSQL query failed: ERROR: unterminated", "'"));
    }

    @Test
    @DisplayName("일반 페이지와 빈 본문은 취약하지 않음")
    void cleanBodies() {
        assertFalse(SqlErrorSignatures.isVulnerableToSqlInjection("<html><body>No results</body></html>", "' OR '1'='1"));
        assertFalse(SqlErrorSignatures.isVulnerableToSqlInjection("", "'"));
        assertFalse(SqlErrorSignatures.isVulnerableToSqlInjection(null, "'"));
    }
}
