package com.websweep.core.crawler;

import com.websweep.core.model.Form;
import org.jsoup.nodes.Document;

import java.net.URI;
import java.util.List;

/** 페이지의 form 요소를 {@link Form}으로 변환 */
public interface FormExtractor {
    /** action은 pageUrl 기준 절대 URL로 해석한다(없으면 pageUrl). */
    List<Form> extract(Document doc, URI pageUrl);
}
