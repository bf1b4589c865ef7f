package com.wikicrawler.core.crawler;

/** 크롤 중단: 협력 객체(fetcher/extractor)의 예상 밖 실패 또는 인터럽트. */
public class CrawlException extends RuntimeException {
    public CrawlException(String message, Throwable cause) {
        super(message, cause);
    }
}
