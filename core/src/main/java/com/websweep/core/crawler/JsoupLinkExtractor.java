package com.websweep.core.crawler;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/** JSoup 기반 링크 추출기: a/area[href], frame/iframe[src] → abs: URL */
public class JsoupLinkExtractor implements LinkExtractor {

    private static final String SELECTOR = "a[href], area[href], frame[src], iframe[src]";

    @Override
    public List<URI> extract(Document doc) {
        Set<URI> out = new LinkedHashSet<>();
        if (doc == null) return new ArrayList<>();

        for (Element el : doc.select(SELECTOR)) {
            String abs = el.hasAttr("href") ? el.attr("abs:href") : el.attr("abs:src");
            if (abs == null || abs.isBlank()) continue;
            try {
                URI u = URI.create(abs.trim().replace(" ", "%20"));
                String s = u.getScheme();
                if (s == null) continue;
                if (!s.equalsIgnoreCase("http") && !s.equalsIgnoreCase("https")) continue;
                out.add(u);
            } catch (IllegalArgumentException ignore) {
                // 잘못된 URL은 무시
            }
        }
        return new ArrayList<>(out);
    }
}
