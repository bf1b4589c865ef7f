package com.wikicrawler.core.model;

import java.util.Objects;

/** 페이지에서 추출한 링크 한 개: 원본 href(상대 경로 가능) + 보이는 텍스트. */
public record ArticleLink(String href, String text) {
    public ArticleLink {
        Objects.requireNonNull(href, "href");
        text = (text == null) ? "" : text;
    }
}
