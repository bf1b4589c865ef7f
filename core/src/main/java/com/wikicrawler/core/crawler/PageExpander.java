package com.wikicrawler.core.crawler;

import com.wikicrawler.core.api.IPageFetcher;
import com.wikicrawler.core.model.ArticleLink;
import com.wikicrawler.core.model.CrawlStats;
import com.wikicrawler.core.model.FetchResult;
import com.wikicrawler.core.model.PrioritizedLink;
import com.wikicrawler.core.util.StructuredLog;
import com.wikicrawler.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 노드 한 개 확장: fetch → 링크 추출 → 우선순위 → 간선 기록/큐 투입.
 * 시작 노드(동기)와 워커 모두 이 경로를 탄다. 확장 선점(claim)은 호출 측 책임.
 */
final class PageExpander {

    private static final Logger LOG = LoggerFactory.getLogger(PageExpander.class);
    private static final StructuredLog SLOG = StructuredLog.get(PageExpander.class);

    private final IPageFetcher fetcher;
    private final LinkExtractor extractor;
    private final List<String> keywords;
    private final String target;
    private final CrawlGraph graph;
    private final Frontier frontier;
    private final TerminationSignal signal;
    private final CrawlStats stats;

    // 동시 fetch 상한 (워커 수와 별개)
    private final Semaphore fetchLimiter;
    private final AtomicInteger inFlight = new AtomicInteger(0);

    PageExpander(IPageFetcher fetcher, LinkExtractor extractor, List<String> keywords, String target,
                 int fetchConcurrency, CrawlGraph graph, Frontier frontier,
                 TerminationSignal signal, CrawlStats stats) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.keywords = List.copyOf(keywords);
        this.target = Objects.requireNonNull(target, "target");
        this.fetchLimiter = new Semaphore(Math.max(1, fetchConcurrency));
        this.graph = graph;
        this.frontier = frontier;
        this.signal = signal;
        this.stats = stats;
    }

    /**
     * @return 페이지를 가져와 링크까지 처리했으면 true, not fetchable 이면 false
     * @throws InterruptedException fetch 대기 중이거나 fetch 도중 인터럽트된 경우
     */
    boolean expand(String current) throws InterruptedException {
        FetchResult page = fetch(current);
        // fetcher 가 인터럽트를 결과로 삼켰으면 여기서 다시 올린다
        if (Thread.interrupted()) {
            throw new InterruptedException("Interrupted while fetching " + current);
        }
        if (!page.isFetchable()) {
            stats.fetchFailed();
            LOG.debug("Fetch \"{}\" failed: {}", current, page.getReason());
            SLOG.debug("fetch-failed", "url", current, "reason", page.getReason());
            return false;
        }

        List<ArticleLink> links = extractor.extract(current, page.getBody());
        stats.pageExpanded(links.size());
        LOG.debug("Fetch \"{}\"... found {} article links", current, links.size());

        int enqueued = 0;
        for (PrioritizedLink link : LinkPrioritizer.prioritize(links, keywords)) {
            String next = UrlUtils.resolve(current, link.href());
            if (next == null) {
                LOG.debug("Skip unresolvable href \"{}\" on {}", link.href(), current);
                continue;
            }
            graph.addEdge(current, next);

            if (next.equals(target)) {
                if (signal.set()) {
                    LOG.info("Target found on {}", current);
                    SLOG.info("target-found", "url", current, "target", target);
                }
                // 대기 중인 워커를 깨워 새 dequeue를 막는다
                frontier.close();
                break; // 이 페이지의 나머지 링크는 기록/투입하지 않음
            }
            if (frontier.put(link.priority(), next)) enqueued++;
        }

        SLOG.debug("page-expanded", "url", current, "links", links.size(), "enqueued", enqueued);
        return true;
    }

    private FetchResult fetch(String url) throws InterruptedException {
        fetchLimiter.acquire();
        int cur = inFlight.incrementAndGet();
        stats.observeFetchConcurrency(cur);
        long t0 = System.nanoTime();
        try {
            FetchResult r = fetcher.fetch(url);
            return (r != null) ? r : FetchResult.notFetchable(url, "fetcher returned null");
        } finally {
            stats.addFetchTimeMs((System.nanoTime() - t0) / 1_000_000);
            inFlight.decrementAndGet();
            fetchLimiter.release();
        }
    }
}
