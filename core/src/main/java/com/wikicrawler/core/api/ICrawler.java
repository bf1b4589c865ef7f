// ICrawler.java
package com.wikicrawler.core.api;

import java.util.List;

/** 크롤러 최소 계약: 시작→목표 경로(URL 목록)를 돌려준다. 없으면 빈 목록. */
public interface ICrawler extends AutoCloseable {
    List<String> findPath();
    @Override default void close() throws Exception {}
}
