package com.websweep.core.analyzer.components;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.type.TypeReference;
import com.websweep.core.model.Severity;
import com.websweep.core.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 라이브러리별 취약 버전 표.
 * 내장 표 위에 확장 JSON({@code {lib: {versions, cve, severity, ...}}})을 병합한다:
 * 이미 있는 라이브러리는 버전만 합치고, 새 라이브러리는 통째로 추가.
 */
public final class VulnerableLibraryTable {
    private static final Logger LOG = LoggerFactory.getLogger(VulnerableLibraryTable.class);

    /** 확장 JSON 한 항목 */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Entry(List<String> versions, String cve, String severity,
                        String description, String recommendation, String consequences) {

        public Entry {
            versions = (versions == null ? List.of() : List.copyOf(versions));
        }

        public Severity severityLevel() { return Severity.parse(severity, Severity.MEDIUM); }

        Entry withMoreVersions(List<String> more) {
            LinkedHashSet<String> merged = new LinkedHashSet<>(versions);
            merged.addAll(more);
            return new Entry(new ArrayList<>(merged), cve, severity, description, recommendation, consequences);
        }
    }

    private final Map<String, Entry> entries;

    private VulnerableLibraryTable(Map<String, Entry> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    public static VulnerableLibraryTable builtIn() {
        return new VulnerableLibraryTable(new LinkedHashMap<>(BUILT_IN));
    }

    /** 확장 파일이 null/없음/깨짐이면 내장 표만(경고) */
    public static VulnerableLibraryTable load(Path extension) {
        Map<String, Entry> m = new LinkedHashMap<>(BUILT_IN);
        if (extension == null) return new VulnerableLibraryTable(m);
        if (!Files.isRegularFile(extension)) {
            LOG.warn("vulnerable_libraries_file not found: {} (built-in table only)", extension);
            return new VulnerableLibraryTable(m);
        }
        try (InputStream in = Files.newInputStream(extension)) {
            merge(m, Json.mapper().readValue(in, new TypeReference<Map<String, Entry>>() {}));
        } catch (IOException e) {
            LOG.warn("Failed to read vulnerable_libraries_file {}: {} (built-in table only)", extension, e.toString());
        }
        return new VulnerableLibraryTable(m);
    }

    public Entry get(String library) {
        return library == null ? null : entries.get(library.toLowerCase(Locale.ROOT));
    }

    public Iterable<String> libraries() { return entries.keySet(); }

    public int size() { return entries.size(); }

    /** 취약하면 항목, 아니면 null */
    public Entry match(String library, String version) {
        Entry e = get(library);
        if (e == null || version == null) return null;
        return VersionComparator.isVulnerable(version, e.versions()) ? e : null;
    }

    /* --- 헬퍼 --- */

    static void merge(Map<String, Entry> base, Map<String, Entry> extra) {
        if (extra == null) return;
        for (var e : extra.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            String lib = e.getKey().toLowerCase(Locale.ROOT);
            Entry cur = base.get(lib);
            base.put(lib, cur == null ? e.getValue() : cur.withMoreVersions(e.getValue().versions()));
        }
    }

    private static List<String> range(int major, int fromMinor, int toMinor) {
        List<String> out = new ArrayList<>();
        for (int m = fromMinor; m <= toMinor; m++) out.add(major + "." + m);
        return out;
    }

    @SafeVarargs
    private static List<String> concat(List<String>... parts) {
        List<String> out = new ArrayList<>();
        for (List<String> p : parts) out.addAll(p);
        return List.copyOf(out);
    }

    private static Entry multi(List<String> versions, String name, String issues, String severity, String upgradeName) {
        return new Entry(versions, "Multiple CVEs", severity,
                "Multiple vulnerabilities in " + name + " may allow " + issues,
                "Update to the latest version of " + upgradeName,
                "Outdated " + upgradeName + " versions may contain security vulnerabilities that could be exploited by attackers");
    }

    private static final Map<String, Entry> BUILT_IN;
    static {
        Map<String, Entry> m = new LinkedHashMap<>();
        m.put("jquery", multi(concat(range(1, 0, 12), range(2, 0, 2), range(3, 0, 4)),
                "jQuery", "XSS, prototype pollution, or other security issues", "Medium", "jQuery"));
        m.put("bootstrap", multi(concat(range(2, 0, 3), range(3, 0, 3), range(4, 0, 4)),
                "Bootstrap", "XSS or other security issues", "Medium", "Bootstrap"));
        m.put("angular", multi(concat(range(1, 0, 7), range(2, 0, 4), range(4, 0, 3), range(5, 0, 2),
                        range(6, 0, 1), range(7, 0, 2), range(8, 0, 2), range(9, 0, 0)),
                "AngularJS", "XSS, prototype pollution, or other security issues", "High", "Angular"));
        m.put("react", multi(concat(range(0, 3, 14), range(15, 0, 6), range(16, 0, 9)),
                "React", "XSS or other security issues", "Medium", "React"));
        m.put("vue", multi(concat(range(1, 0, 0), range(2, 0, 6)),
                "Vue", "XSS or other security issues", "Medium", "Vue"));

        List<String> lodash4x = new ArrayList<>();
        for (int p = 0; p <= 15; p++) lodash4x.add("4.17." + p);
        m.put("lodash", new Entry(
                concat(range(0, 1, 9), range(1, 0, 3), range(2, 0, 4), range(3, 0, 10), range(4, 0, 16), lodash4x),
                "CVE-2019-10744", "High",
                "Prototype pollution vulnerability in Lodash",
                "Update to the latest version of Lodash",
                "Attackers could potentially modify Object prototype, leading to application crashes or remote code execution"));
        m.put("moment", new Entry(concat(range(1, 0, 7), range(2, 0, 19)),
                "CVE-2017-18214", "Medium",
                "Regular expression denial of service (ReDoS) vulnerability in Moment.js",
                "Update to the latest version of Moment.js",
                "Attackers could cause denial of service by providing specially crafted input to the parser"));
        BUILT_IN = Collections.unmodifiableMap(m);
    }
}
