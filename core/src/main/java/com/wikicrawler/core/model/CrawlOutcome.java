package com.wikicrawler.core.model;

/** 크롤 종료 사유. 호출자에게는 FOUND 외에는 모두 빈 경로로 보인다. */
public enum CrawlOutcome {
    /** 기록된 그래프 안에서 시작→목표 경로를 찾음 */
    FOUND,
    /** 탐색을 마쳤지만 기록된 간선으로는 목표에 닿지 않음 */
    TARGET_UNREACHABLE,
    /** 시작 페이지부터 가져오지 못해 즉시 종료 */
    START_NOT_FETCHABLE
}
