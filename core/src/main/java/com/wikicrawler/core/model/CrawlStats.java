package com.wikicrawler.core.model;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** 크롤 런타임 텔레메트리 누적기 (스레드 세이프). */
public final class CrawlStats {
    private final AtomicLong pagesExpanded   = new AtomicLong(0); // 링크까지 처리한 페이지
    private final AtomicLong fetchFailures   = new AtomicLong(0); // not fetchable 로 버린 페이지
    private final AtomicLong duplicateSkips  = new AtomicLong(0); // 이미 확장(선점)된 노드를 다시 꺼낸 횟수
    private final AtomicLong linksSeen       = new AtomicLong(0); // 추출된 링크 총합
    private final AtomicLong sumFetchMs      = new AtomicLong(0);
    private final AtomicInteger maxObservedFetches = new AtomicInteger(0);

    public void pageExpanded(int links) {
        pagesExpanded.incrementAndGet();
        linksSeen.addAndGet(links);
    }
    public void fetchFailed() { fetchFailures.incrementAndGet(); }
    public void duplicateSkipped() { duplicateSkips.incrementAndGet(); }
    public void addFetchTimeMs(long ms) { sumFetchMs.addAndGet(ms); }

    /** 현재 동시 fetch 수를 관측하여 최대값 갱신 */
    public void observeFetchConcurrency(int current) {
        maxObservedFetches.accumulateAndGet(current, Math::max);
    }

    public Snapshot snapshot() {
        long pages = pagesExpanded.get();
        long failed = fetchFailures.get();
        long attempts = Math.max(1, pages + failed);
        return new Snapshot(pages, failed, duplicateSkips.get(), linksSeen.get(),
                maxObservedFetches.get(), sumFetchMs.get() / attempts);
    }

    /** 불변 스냅샷 DTO */
    public static final class Snapshot {
        public final long pagesExpanded;
        public final long fetchFailures;
        public final long duplicateSkips;
        public final long linksSeen;
        public final int  maxObservedFetches;
        public final long avgFetchMs;
        public Snapshot(long pagesExpanded, long fetchFailures, long duplicateSkips,
                        long linksSeen, int maxObservedFetches, long avgFetchMs) {
            this.pagesExpanded = pagesExpanded;
            this.fetchFailures = fetchFailures;
            this.duplicateSkips = duplicateSkips;
            this.linksSeen = linksSeen;
            this.maxObservedFetches = maxObservedFetches;
            this.avgFetchMs = avgFetchMs;
        }
    }
}
