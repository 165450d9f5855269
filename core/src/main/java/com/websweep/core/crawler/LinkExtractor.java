package com.websweep.core.crawler;

import org.jsoup.nodes.Document;

import java.net.URI;
import java.util.List;

/** 페이지에서 절대 URL을 추출하는 전략 인터페이스. */
public interface LinkExtractor {
    /**
     * http/https 절대 링크만 돌려준다. 깨진 href는 건너뛴다.
     * 파싱 예외를 던지지 않는다.
     */
    List<URI> extract(Document doc);
}
