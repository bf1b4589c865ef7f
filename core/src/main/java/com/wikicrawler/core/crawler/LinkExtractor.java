package com.wikicrawler.core.crawler;

import com.wikicrawler.core.model.ArticleLink;

import java.util.List;

/** 페이지 본문에서 문서 링크를 추출하는 전략 인터페이스. */
public interface LinkExtractor {
    /**
     * body에서 관심 대상 링크만 문서 순서대로 반환.
     * href는 원본 그대로(상대 경로 가능)이며 해석은 호출자가 한다.
     */
    List<ArticleLink> extract(String baseUrl, String body);
}
