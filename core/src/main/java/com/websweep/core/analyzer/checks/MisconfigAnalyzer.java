package com.websweep.core.analyzer.checks;

import com.websweep.core.analyzer.AnalysisContext;
import com.websweep.core.analyzer.HtmlSupport;
import com.websweep.core.analyzer.ResponseAnalyzer;
import com.websweep.core.crawler.Page;
import com.websweep.core.model.Advice;
import com.websweep.core.model.CheckCategory;
import com.websweep.core.model.Finding;
import com.websweep.core.model.FindingDetails;
import com.websweep.core.model.FindingType;
import com.websweep.core.model.HttpResponseData;
import com.websweep.core.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A05 보안 설정 오류: 디렉터리 리스팅(200), 상세 에러/스택 트레이스(4xx/5xx), 기본 설정 파일/문구.
 * 헤더 누락은 {@link SecurityHeadersAnalyzer}가 담당한다.
 */
public final class MisconfigAnalyzer implements ResponseAnalyzer {

    static final List<Pattern> DIRECTORY_LISTING = List.of(
            HtmlSupport.ci("<title>index of"),
            HtmlSupport.ci("<h1>directory listing"),
            HtmlSupport.ci("<h1>index of"),
            HtmlSupport.ci("parent directory</a>"),
            HtmlSupport.ci("directory listing for"),
            HtmlSupport.ci("<pre>name\\s+last modified\\s+size\\s+description"),
            HtmlSupport.ci("<pre>directory listing of"));

    static final List<Pattern> VERBOSE_ERRORS = List.of(
            HtmlSupport.ci("exception|stack trace|syntax error|fatal error"),
            HtmlSupport.ci("(sql|odbc|ole db|jdbc) error"),
            HtmlSupport.ci("(php|python|ruby|perl|java|\\.net) error"),
            HtmlSupport.ci("line \\d+ of file"),
            HtmlSupport.ci("call stack"),
            HtmlSupport.ci("uncaught exception"),
            HtmlSupport.ci("debug info"),
            HtmlSupport.ci("thrown in"),
            HtmlSupport.ci("undefined index:"),
            HtmlSupport.ci("undefined variable:"),
            HtmlSupport.ci("error occurred in"),
            HtmlSupport.ci("<b>warning</b>:"),
            HtmlSupport.ci("<b>notice</b>:"),
            HtmlSupport.ci("<b>error</b>:"));

    static final List<String> DEFAULT_CONFIG_PATHS = List.of(
            "phpinfo.php", "config.php", "config.inc.php", "setup.php", "default.config", "conf.default",
            "wp-config.php", "server-status", "server-info", ".env", ".git", ".svn", ".htpasswd",
            ".htaccess", "config.xml", "web.config", "settings.py", "settings.ini");

    static final List<String> DEFAULT_CONFIG_TEXT = List.of(
            "installation complete", "setup successful", "default password", "default username",
            "default admin", "password is", "username is", "configuration file", "config file");

    private static final Advice DIRECTORY_LISTING_ADVICE = Advice.of(Severity.MEDIUM,
            "Directory listing is enabled",
            "Disable directory listing in your web server configuration",
            "Attackers can view the contents of directories, potentially exposing sensitive files");

    private static final Advice VERBOSE_ERRORS_ADVICE = Advice.of(Severity.MEDIUM,
            "Verbose error messages or stack traces detected",
            "Configure your application to display generic error messages in production",
            "Detailed error messages can reveal sensitive information about your application structure, dependencies, and potential vulnerabilities");

    private static final Advice DEFAULT_CONFIGS_ADVICE = Advice.of(Severity.HIGH,
            "Default configuration files or credentials detected",
            "Remove default configuration files and change default credentials",
            "Default configurations often contain vulnerabilities or credentials that are widely known to attackers");

    @Override
    public CheckCategory category() { return CheckCategory.SECURITY_MISCONFIGURATIONS; }

    @Override
    public List<Finding> analyze(Page page, AnalysisContext ctx) {
        return check(page.response(), page.url().toString());
    }

    /** 4xx/5xx 페이지용 */
    public List<Finding> analyzeErrorPage(Page page) {
        return check(page.response(), page.url().toString());
    }

    public static List<Finding> check(HttpResponseData resp, String url) {
        List<Finding> out = new ArrayList<>();
        String body = resp.getBody();
        int sc = resp.getStatusCode();

        if (sc == 200) {
            String ev = HtmlSupport.firstMatch(DIRECTORY_LISTING, body);
            if (ev != null) {
                out.add(Finding.of(FindingType.MISCONFIG_DIRECTORY_LISTING, url,
                        new FindingDetails.Evidence(DIRECTORY_LISTING_ADVICE, ev)));
            }
        }
        if (sc >= 400) {
            String ev = HtmlSupport.firstMatch(VERBOSE_ERRORS, body);
            if (ev != null) {
                out.add(Finding.of(FindingType.MISCONFIG_VERBOSE_ERRORS, url,
                        new FindingDetails.Evidence(VERBOSE_ERRORS_ADVICE, ev)));
            }
        }
        String ev = defaultConfigEvidence(url, resp.bodyLower());
        if (ev != null) {
            out.add(Finding.of(FindingType.MISCONFIG_DEFAULT_CONFIGS, url,
                    new FindingDetails.Evidence(DEFAULT_CONFIGS_ADVICE, ev)));
        }
        return out;
    }

    /* --- 헬퍼 --- */

    private static String defaultConfigEvidence(String url, String lowerBody) {
        String lu = url.toLowerCase(Locale.ROOT);
        for (String p : DEFAULT_CONFIG_PATHS) {
            if (lu.contains(p)) return p;
        }
        for (String t : DEFAULT_CONFIG_TEXT) {
            if (lowerBody.contains(t)) return t;
        }
        return null;
    }
}
