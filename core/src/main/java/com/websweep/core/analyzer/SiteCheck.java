package com.websweep.core.analyzer;

import com.websweep.core.model.CheckCategory;
import com.websweep.core.model.Finding;

import java.net.URI;
import java.util.List;

/** 크롤 시작 전에 대상 origin 기준으로 한 번 도는 체크(잘 알려진 경로 스윕 등). */
public interface SiteCheck {

    CheckCategory category();

    default String name() { return getClass().getSimpleName(); }

    List<Finding> run(URI target, AnalysisContext ctx);
}
