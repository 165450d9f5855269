package com.websweep.core.analyzer.checks;

import com.websweep.core.analyzer.AnalysisContext;
import com.websweep.core.analyzer.HtmlSupport;
import com.websweep.core.analyzer.ResponseAnalyzer;
import com.websweep.core.analyzer.components.VulnerableLibraryTable;
import com.websweep.core.crawler.Page;
import com.websweep.core.model.Advice;
import com.websweep.core.model.CheckCategory;
import com.websweep.core.model.Finding;
import com.websweep.core.model.FindingDetails;
import com.websweep.core.model.FindingType;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A06 취약 컴포넌트: script src / stylesheet href 에서 라이브러리명+버전을 뽑아 취약 버전 표와 비교.
 */
public final class ComponentsAnalyzer implements ResponseAnalyzer {

    /** 라이브러리 이름이 null이면 쿼리스트링 버전(v=, version=)만 잡힌 경우 */
    private record VersionPattern(Pattern pattern, String library) {}

    /** 라이브러리와 버전 식별 결과 */
    public record Identified(String library, String version) {}

    private static final List<VersionPattern> PATTERNS = List.of(
            vp("jquery[.-](\\d+\\.\\d+(?:\\.\\d+)?)", "jquery"),
            vp("bootstrap[.-]?(\\d+\\.\\d+(?:\\.\\d+)?)", "bootstrap"),
            vp("angular[.-]?(\\d+\\.\\d+(?:\\.\\d+)?)", "angular"),
            vp("react[.-]?(\\d+\\.\\d+(?:\\.\\d+)?)", "react"),
            vp("vue[.-]?(\\d+\\.\\d+(?:\\.\\d+)?)", "vue"),
            vp("lodash[.-]?(\\d+\\.\\d+(?:\\.\\d+)?)", "lodash"),
            vp("moment[.-]?(\\d+\\.\\d+(?:\\.\\d+)?)", "moment"),
            vp("[?&]v=(\\d+\\.\\d+(?:\\.\\d+)?)", null),
            vp("[?&]version=(\\d+\\.\\d+(?:\\.\\d+)?)", null));

    @Override
    public CheckCategory category() { return CheckCategory.VULNERABLE_COMPONENTS; }

    @Override
    public List<Finding> analyze(Page page, AnalysisContext ctx) {
        return check(page.document(), page.url(), ctx.libraries());
    }

    public static List<Finding> check(Document doc, URI pageUrl, VulnerableLibraryTable table) {
        List<Finding> out = new ArrayList<>();
        if (doc == null) return out;
        String url = pageUrl.toString();

        for (String resource : resourceUrls(doc, pageUrl)) {
            Identified id = identify(resource, table);
            if (id == null) continue;
            VulnerableLibraryTable.Entry e = table.match(id.library(), id.version());
            if (e == null) continue;

            Advice advice = Advice.of(e.severityLevel(),
                    orElse(e.description(), "Vulnerable version of " + id.library() + " detected"),
                    orElse(e.recommendation(), "Update " + id.library() + " to the latest version"),
                    orElse(e.consequences(), "Using outdated components with known vulnerabilities can lead to security breaches"));
            out.add(Finding.of(FindingType.VULNERABLE_COMPONENT, url,
                    new FindingDetails.Component(advice, id.library(), id.version(),
                            orElse(e.cve(), "Unknown"), resource)));
        }
        return out;
    }

    /** URL 하나에서 라이브러리/버전 식별. 둘 중 하나라도 모르면 null. */
    public static Identified identify(String resourceUrl, VulnerableLibraryTable table) {
        if (resourceUrl == null || resourceUrl.isEmpty()) return null;
        String library = null;
        String version = null;
        for (VersionPattern vp : PATTERNS) {
            Matcher m = vp.pattern().matcher(resourceUrl);
            if (m.find()) {
                library = vp.library();
                version = m.group(1);
                break;
            }
        }
        if (version != null && library == null) {
            String lower = resourceUrl.toLowerCase(Locale.ROOT);
            for (String lib : table.libraries()) {
                if (lower.contains(lib)) { library = lib; break; }
            }
        }
        return (library == null || version == null) ? null : new Identified(library, version);
    }

    /* --- 헬퍼 --- */

    private static Set<String> resourceUrls(Document doc, URI pageUrl) {
        Set<String> out = new LinkedHashSet<>();
        for (Element s : doc.select("script[src]")) {
            String u = HtmlSupport.absoluteUrl(s, "src", pageUrl);
            if (!u.isEmpty()) out.add(u);
        }
        for (Element l : doc.select("link[rel~=(?i)stylesheet][href]")) {
            String u = HtmlSupport.absoluteUrl(l, "href", pageUrl);
            if (!u.isEmpty()) out.add(u);
        }
        return out;
    }

    private static VersionPattern vp(String regex, String library) {
        return new VersionPattern(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), library);
    }

    private static String orElse(String v, String def) {
        return (v == null || v.isBlank()) ? def : v;
    }
}
