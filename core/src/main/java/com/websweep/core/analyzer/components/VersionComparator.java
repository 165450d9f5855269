package com.websweep.core.analyzer.components;

import java.util.Collection;
import java.util.Optional;

/**
 * 점(.) 구분 숫자 버전 비교. 없는 자리는 0으로 본다("1.9" == "1.9.0").
 * 숫자가 아닌 자리가 있으면 파싱 실패(empty).
 */
public final class VersionComparator {
    private VersionComparator() {}

    public static Optional<int[]> parse(String version) {
        if (version == null || version.isBlank()) return Optional.empty();
        String[] parts = version.trim().split("\\.");
        int[] out = new int[parts.length];
        try {
            for (int i = 0; i < parts.length; i++) out[i] = Integer.parseInt(parts[i]);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
        return Optional.of(out);
    }

    /** 자리별 비교. a<b 음수, 같으면 0, a>b 양수 */
    public static int compare(int[] a, int[] b) {
        int n = Math.max(a.length, b.length);
        for (int i = 0; i < n; i++) {
            int x = i < a.length ? a[i] : 0;
            int y = i < b.length ? b[i] : 0;
            if (x != y) return Integer.compare(x, y);
        }
        return 0;
    }

    /**
     * 취약 판정:
     * 목록에 정확히 있거나, 목록 버전의 하위 패치("1.12" 목록에 "1.12.4"),
     * 또는 목록의 가장 높은 버전 이하. 검사 대상 버전을 파싱할 수 없으면 보수적으로 취약.
     * 파싱 안 되는 목록 항목은 건너뛴다.
     */
    public static boolean isVulnerable(String version, Collection<String> listed) {
        if (listed == null || listed.isEmpty()) return false;
        if (listed.contains(version)) return true;

        Optional<int[]> parsed = parse(version);
        if (parsed.isEmpty()) return true;
        int[] v = parsed.get();

        int[] newest = null;
        for (String l : listed) {
            if (version.startsWith(l + ".")) return true;
            Optional<int[]> lv = parse(l);
            if (lv.isEmpty()) continue;
            if (newest == null || compare(lv.get(), newest) > 0) newest = lv.get();
        }
        return newest != null && compare(v, newest) <= 0;
    }
}
