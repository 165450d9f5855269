package com.websweep.core.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** excluded_paths / included_paths 필터 */
public final class UrlExclusion {
    private UrlExclusion(){}

    private static final Logger LOG = LoggerFactory.getLogger(UrlExclusion.class);
    private static final Pattern NEVER = Pattern.compile("(?!)");
    private static final Map<String, Pattern> CACHE = new ConcurrentHashMap<>();

    /**
     * patterns 지원:
     * <ul>
     *   <li>접두(prefix): {@code "/logout"} 또는 {@code "https://host/path"}</li>
     *   <li>glob: {@code '*'}, {@code '?'} 포함 (예: {@code "/admin/*"})</li>
     *   <li>정규식: {@code "re:"} 접두 (예: {@code re:\?.*token=.*})</li>
     * </ul>
     */
    public static boolean isExcluded(URI url, List<String> patterns){
        if (url == null || patterns == null || patterns.isEmpty()) return false;
        return matchesAny(url, patterns);
    }

    /** includes가 비어 있으면 전부 허용, 아니면 하나 이상 매칭돼야 함 */
    public static boolean isIncluded(URI url, List<String> includes) {
        if (url == null) return false;
        if (includes == null || includes.isEmpty()) return true;
        return matchesAny(url, includes);
    }

    /** 스코프 필터 최종 판정 */
    public static boolean isAllowed(URI url, List<String> includes, List<String> excludes) {
        return isIncluded(url, includes) && !isExcluded(url, excludes);
    }

    private static boolean matchesAny(URI url, List<String> patterns) {
        final String s = url.toString();
        for (String p : patterns) {
            if (p == null || p.isBlank()) continue;

            if (p.startsWith("re:")) {
                if (compiled(p, p.substring(3)).matcher(s).find()) return true;
            } else if (p.indexOf('*') >= 0 || p.indexOf('?') >= 0) {
                if (compiled(p, globToRegex(p)).matcher(s).find()) return true;
            } else {
                if (s.startsWith(p)) return true;

                // 호스트 상대 prefix: "/logout" 같은 경우
                if (p.startsWith("/") && s.contains("://")) {
                    int i = s.indexOf('/', s.indexOf("://") + 3);
                    String pathAndMore = (i > 0) ? s.substring(i) : "/";
                    if (pathAndMore.startsWith(p)) return true;
                }
            }
        }
        return false;
    }

    private static Pattern compiled(String key, String regex) {
        return CACHE.computeIfAbsent(key, k -> {
            try {
                return Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
            } catch (PatternSyntaxException e) {
                LOG.warn("Invalid path pattern ignored: {} ({})", k, e.getDescription());
                return NEVER;
            }
        });
    }

    private static String globToRegex(String glob){
        StringBuilder r = new StringBuilder();
        for (int i = 0; i < glob.length(); i++){
            char c = glob.charAt(i);
            switch(c){
                case '*': r.append(".*"); break;
                case '?': r.append('.'); break;
                case '.': case '\\': case '+': case '(': case ')':
                case '^': case '$': case '|': case '{': case '}':
                case '[': case ']': r.append('\\').append(c); break;
                default: r.append(c);
            }
        }
        return r.toString();
    }
}
