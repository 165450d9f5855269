package com.websweep.core.injection;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/** DB 오류 배너 시그니처. 대소문자 무시. */
public final class SqlErrorSignatures {
    private SqlErrorSignatures() {}

    private static final List<String> LITERALS = List.of(
            "SQL syntax",
            "mysql_fetch_array", "mysql_fetch_assoc", "mysql_fetch", "mysql_num_rows", "mysql_result", "mysql_query",
            "mysql error", "Warning: mysql_", "valid MySQL result", "MySqlClient.", "com.mysql.jdbc.exceptions",
            "Unknown column",
            "ORA-",
            "SQLite/JDBCDriver", "SQLite.Exception", "System.Data.SQLite.SQLiteException",
            "valid PostgreSQL result", "Npgsql.",
            "Microsoft SQL Server", "ODBC SQL Server Driver", "SQLServer JDBC Driver",
            "com.microsoft.sqlserver.jdbc", "SQLServerException", "SQLServerDriver", "SQLServer",
            "Microsoft OLE DB Provider for SQL Server", "System.Data.SqlClient.SqlException",
            "Unclosed quotation mark after the character string",
            "Error Occurred While Processing Request", "Server Error in '/' Application");

    private static final List<String> REGEXES = List.of(
            "PostgreSQL.*ERROR",
            "Warning.*pg_",
            "check the manual that corresponds to your (MySQL|MariaDB) server version");

    static final List<Pattern> PATTERNS = compile();

    /** 본문에서 처음 걸린 시그니처 */
    public static Optional<String> match(String body) {
        if (body == null || body.isEmpty()) return Optional.empty();
        for (Pattern p : PATTERNS) {
            var m = p.matcher(body);
            if (m.find()) return Optional.of(m.group());
        }
        return Optional.empty();
    }

    /** 응답 본문에 DB 오류 시그니처가 있으면 true. payload 는 판정에 쓰지 않는다. */
    public static boolean isVulnerableToSqlInjection(String body, String payload) {
        return match(body).isPresent();
    }

    /* --- 헬퍼 --- */

    private static List<Pattern> compile() {
        int flags = Pattern.CASE_INSENSITIVE;
        List<Pattern> out = new ArrayList<>();
        for (String s : LITERALS) out.add(Pattern.compile(Pattern.quote(s), flags));
        for (String r : REGEXES) out.add(Pattern.compile(r, flags));
        return List.copyOf(out);
    }
}
