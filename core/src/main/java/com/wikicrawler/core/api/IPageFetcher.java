// IPageFetcher.java
package com.wikicrawler.core.api;

import com.wikicrawler.core.model.FetchResult;

/**
 * 페이지 fetch 최소 계약: 절대 URL을 받아 문서 또는 "가져올 수 없음"을 돌려준다.
 * 전송 오류/콘텐츠 타입 불일치는 예외가 아니라 FetchResult 로 표현한다.
 */
public interface IPageFetcher extends AutoCloseable {
    FetchResult fetch(String url);
    @Override default void close() throws Exception {}
}
