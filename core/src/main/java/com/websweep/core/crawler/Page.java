package com.websweep.core.crawler;

import com.websweep.core.model.Form;
import com.websweep.core.model.HttpResponseData;
import org.jsoup.nodes.Document;

import java.net.URI;
import java.util.List;

/**
 * 성공적으로 가져온 HTML 페이지 하나.
 *
 * @param url      정규화된 URL
 * @param document 파싱된 DOM(깨진 마크업도 jsoup이 복구한 상태)
 * @param links    추출된 절대 링크(범위 밖 포함, 페이지 내 중복 제거)
 */
public record Page(URI url, int depth, HttpResponseData response, Document document,
                   List<Form> forms, List<URI> links) {

    public Page {
        forms = (forms == null ? List.of() : List.copyOf(forms));
        links = (links == null ? List.of() : List.copyOf(links));
    }
}
