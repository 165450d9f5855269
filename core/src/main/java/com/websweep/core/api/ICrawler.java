package com.websweep.core.api;

import com.websweep.core.crawler.CrawlResult;

import java.net.URI;

/** 크롤러 최소 계약: 시드에서 출발해 범위 안 페이지를 모두 방문한다. */
public interface ICrawler {
    CrawlResult crawl(URI seed);
}
