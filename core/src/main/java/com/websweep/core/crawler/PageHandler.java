package com.websweep.core.crawler;

import com.websweep.core.model.HttpResponseData;

import java.net.URI;

/**
 * 크롤러가 페이지 단위로 호출하는 콜백. 여러 워커 스레드에서 동시에 불린다.
 * 호출 순서(페이지 하나 기준): onVisit → onFetched → beforeLinks → onLink* → afterLinks,
 * 실패하면 onVisit → (onFetched) → onFailed. 4xx/5xx 응답은 onErrorPage가 받는다.
 */
public interface PageHandler {

    /** URL을 claim 했다(scanned_urls 에 포함됨) */
    default void onVisit(URI url, int depth) {}

    /** 응답을 받았다(전송 실패 포함) */
    default void onFetched(URI url, HttpResponseData response) {}

    /** 링크 enqueue 전: 폼/파라미터 인젝션 */
    default void beforeLinks(Page page) {}

    /** 추출된 링크 하나. inScope=false면 기록만 하고 방문하지 않는다. */
    default void onLink(URI source, URI target, boolean inScope) {}

    /** 링크 enqueue 후: 응답 분석 */
    default void afterLinks(Page page) {}

    /** 4xx/5xx 응답 페이지(본문 분석용). 기본 구현은 실패로만 기록한다. */
    default void onErrorPage(Page page, String errorType) {
        onFailed(page.url(), page.depth(), errorType);
    }

    /** errorType: timeout, connection_error, client_error, server_error, non_html_content ... */
    default void onFailed(URI url, int depth, String errorType) {}
}
