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
import com.websweep.core.model.Severity;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** A08 무결성 실패: SRI 누락, HTTP 스크립트, HTTP 패키지 저장소, 역직렬화 흔적. */
public final class IntegrityFailuresAnalyzer implements ResponseAnalyzer {

    static final List<Pattern> INSECURE_PACKAGE_SOURCES = List.of(
            Pattern.compile("http://registry\\.npmjs\\.org"),
            Pattern.compile("http://rubygems\\.org"),
            Pattern.compile("http://pypi\\.org"),
            Pattern.compile("http://repo\\d+\\.maven\\.org"),
            Pattern.compile("http://plugins\\.jquery\\.com"),
            Pattern.compile("http://bower\\.herokuapp\\.com"),
            Pattern.compile("http://unpkg\\.com"),
            Pattern.compile("http://cdn\\.jsdelivr\\.net"),
            Pattern.compile("http://cdnjs\\.cloudflare\\.com"));

    static final List<Pattern> DESERIALIZATION = List.of(
            HtmlSupport.ci("\\.deserialize\\("),
            HtmlSupport.ci("ObjectInputStream"),
            HtmlSupport.ci("readObject\\("),
            HtmlSupport.ci("yaml\\.load\\("),
            HtmlSupport.ci("pickle\\.loads"),
            HtmlSupport.ci("Marshal\\.load"),
            HtmlSupport.ci("unserialize\\("),
            HtmlSupport.ci("fromJSON\\("),
            HtmlSupport.ci("JSON\\.parse\\("),
            HtmlSupport.ci("eval\\("),
            HtmlSupport.ci("fromCharCode\\("));

    private static final Advice MISSING_SRI = Advice.of(Severity.MEDIUM,
            "External script without Subresource Integrity (SRI) protection",
            "Add integrity attribute to the script tag with a valid hash",
            "Without SRI, attackers who compromise the CDN or external resource could inject malicious code into your application");
    private static final Advice INSECURE_SCRIPT = Advice.of(Severity.HIGH,
            "Script loaded over insecure HTTP",
            "Load all scripts over HTTPS",
            "Scripts loaded over HTTP are vulnerable to man-in-the-middle attacks");
    private static final Advice INSECURE_SOURCE = Advice.of(Severity.MEDIUM,
            "Insecure package source or registry",
            "Use secure and verified package sources",
            "Insecure package sources could distribute compromised dependencies");
    private static final Advice DESERIALIZE = Advice.of(Severity.HIGH,
            "Potential insecure deserialization vulnerability",
            "Use secure deserialization methods or alternatives like JSON",
            "Insecure deserialization can lead to remote code execution");

    /** script[src] 하나. */
    record ScriptRef(String url, boolean hasIntegrity) {}

    @Override
    public CheckCategory category() { return CheckCategory.INTEGRITY_FAILURES; }

    @Override
    public List<Finding> analyze(Page page, AnalysisContext ctx) {
        return check(page.document(), page.url(), page.response().getBody());
    }

    public static List<Finding> check(Document doc, URI pageUrl, String body) {
        List<Finding> out = new ArrayList<>();
        String url = pageUrl.toString();
        List<ScriptRef> scripts = (doc == null ? List.of() : scripts(doc, pageUrl));

        for (ScriptRef s : scripts) {
            if (!s.hasIntegrity() && isExternal(s.url(), pageUrl)) {
                out.add(Finding.of(FindingType.INTEGRITY_MISSING_SRI, url, FindingDetails.Resource.script(MISSING_SRI, s.url())));
            }
        }
        for (ScriptRef s : scripts) {
            if (s.url().startsWith("http://")) {
                out.add(Finding.of(FindingType.INTEGRITY_INSECURE_SCRIPT, url, FindingDetails.Resource.script(INSECURE_SCRIPT, s.url())));
            }
        }
        for (String src : insecurePackageSources(body)) {
            out.add(Finding.of(FindingType.INTEGRITY_INSECURE_PACKAGE_SOURCE, url, FindingDetails.Resource.source(INSECURE_SOURCE, src)));
        }
        String evidence = HtmlSupport.firstMatch(DESERIALIZATION, body);
        if (evidence != null) {
            out.add(Finding.of(FindingType.INTEGRITY_INSECURE_DESERIALIZATION, url, new FindingDetails.Evidence(DESERIALIZE, evidence)));
        }
        return out;
    }

    static List<ScriptRef> scripts(Document doc, URI base) {
        List<ScriptRef> out = new ArrayList<>();
        for (Element s : doc.select("script[src]")) {
            String src = HtmlSupport.absoluteUrl(s, "src", base);
            if (src == null || src.isEmpty()) continue;
            out.add(new ScriptRef(src, !s.attr("integrity").isBlank()));
        }
        return out;
    }

    /** host:port 가 다르면 외부 */
    static boolean isExternal(String scriptUrl, URI pageUrl) {
        try {
            URI s = URI.create(scriptUrl);
            if (s.getHost() == null) return false;
            return !Objects.equals(netloc(s), netloc(pageUrl));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /** 본문에 나타난 HTTP 패키지 저장소 URL(페이지 내 중복 제거) */
    static Set<String> insecurePackageSources(String body) {
        Set<String> out = new LinkedHashSet<>();
        if (body == null) return out;
        for (Pattern p : INSECURE_PACKAGE_SOURCES) {
            Matcher m = p.matcher(body);
            while (m.find()) out.add(m.group());
        }
        return out;
    }

    /* --- 헬퍼 --- */

    private static String netloc(URI u) {
        String host = u.getHost() == null ? "" : u.getHost().toLowerCase(Locale.ROOT);
        return u.getPort() < 0 ? host : host + ":" + u.getPort();
    }
}
