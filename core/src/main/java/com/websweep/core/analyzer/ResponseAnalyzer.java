package com.websweep.core.analyzer;

import com.websweep.core.crawler.Page;
import com.websweep.core.model.CheckCategory;
import com.websweep.core.model.Finding;

import java.util.List;

/**
 * 크롤된 페이지 하나를 검사하는 체크.
 * 마크업이 깨졌거나 비어 있어도 예외 없이 빈 리스트를 돌려줘야 한다.
 */
public interface ResponseAnalyzer {

    CheckCategory category();

    default String name() { return getClass().getSimpleName(); }

    List<Finding> analyze(Page page, AnalysisContext ctx);
}
