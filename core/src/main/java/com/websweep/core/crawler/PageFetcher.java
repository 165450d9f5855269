package com.websweep.core.crawler;

import com.websweep.core.model.HttpResponseData;

import java.net.URI;

/** 크롤 페이지 한 장을 (재시도 포함) 가져온다. 전송 실패는 status -1 응답. */
@FunctionalInterface
public interface PageFetcher {
    HttpResponseData fetch(URI url) throws InterruptedException;
}
