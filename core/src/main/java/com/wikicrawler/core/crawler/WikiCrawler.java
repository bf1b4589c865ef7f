package com.wikicrawler.core.crawler;

import com.wikicrawler.core.api.ICrawler;
import com.wikicrawler.core.api.IPageFetcher;
import com.wikicrawler.core.http.HttpPageFetcher;
import com.wikicrawler.core.model.CrawlConfig;
import com.wikicrawler.core.model.CrawlOutcome;
import com.wikicrawler.core.model.CrawlStats;
import com.wikicrawler.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * 시작 문서에서 목표 문서까지의 경로 탐색기.
 * <ol>
 *   <li>시작 노드를 호출 스레드에서 동기 확장해 그래프/frontier를 채운다</li>
 *   <li>워커 풀을 띄우고 목표 발견 또는 고갈까지 대기</li>
 *   <li>기록된 그래프에서 BFS로 경로 복원</li>
 * </ol>
 * findPath()를 다시 부르면 새 그래프로 처음부터 탐색한다.
 */
public final class WikiCrawler implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(WikiCrawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(WikiCrawler.class);

    private final CrawlConfig config;
    private final IPageFetcher fetcher;
    private final LinkExtractor extractor;

    // 마지막 실행 결과 (리포트용)
    private volatile CrawlGraph graph = new CrawlGraph();
    private volatile CrawlStats stats = new CrawlStats();
    private volatile CrawlOutcome outcome;
    private volatile List<String> lastPath = List.of();
    private volatile Instant startedAt;
    private volatile Instant finishedAt;

    /** 기본 구현: HTTP fetcher + JSoup 추출기 */
    public WikiCrawler(CrawlConfig config) {
        this(config, new HttpPageFetcher(config), new JsoupLinkExtractor(config.getArticlePrefix()));
    }

    /** DI/테스트용 */
    public WikiCrawler(CrawlConfig config, IPageFetcher fetcher, LinkExtractor extractor) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    /** 한 줄 진입점: 기본 설정 + 주어진 동시성/키워드로 탐색 (HTTP + JSoup) */
    public static List<String> findPath(String start, String target, int concurrency, List<String> keywords) {
        CrawlConfig cfg = quickConfig(start, target, concurrency, keywords);
        return findPath(cfg, new HttpPageFetcher(cfg), new JsoupLinkExtractor(cfg.getArticlePrefix()));
    }

    /** 한 줄 진입점 (협력 객체 주입) */
    public static List<String> findPath(String start, String target, int concurrency, List<String> keywords,
                                        IPageFetcher fetcher, LinkExtractor extractor) {
        return findPath(quickConfig(start, target, concurrency, keywords), fetcher, extractor);
    }

    private static List<String> findPath(CrawlConfig cfg, IPageFetcher fetcher, LinkExtractor extractor) {
        try (WikiCrawler crawler = new WikiCrawler(cfg, fetcher, extractor)) {
            return crawler.findPath();
        }
    }

    private static CrawlConfig quickConfig(String start, String target, int concurrency, List<String> keywords) {
        return CrawlConfig.defaults()
                .setStart(start)
                .setTarget(target)
                .setConcurrency(concurrency)
                .setKeywords(keywords);
    }

    @Override
    public List<String> findPath() {
        final String start = config.getStart();
        final String target = config.getTarget();
        final int workers = config.getEffectiveWorkers();

        CrawlGraph g = new CrawlGraph();
        CrawlStats st = new CrawlStats();
        this.graph = g;
        this.stats = st;
        this.outcome = null;
        this.lastPath = List.of();
        this.startedAt = Instant.now();
        this.finishedAt = null;

        LOG.info("Crawl start: start={}, target={}, concurrency={}, workers={}, keywords={}",
                start, target, config.getConcurrency(), workers, config.getKeywords());
        SLOG.info("crawl-start",
                "start", start,
                "target", target,
                "concurrency", config.getConcurrency(),
                "workers", workers,
                "keywords", String.join(",", config.getKeywords()));

        if (start.equals(target)) {
            return finish(List.of(start), g, st);
        }

        TerminationSignal signal = new TerminationSignal();
        Frontier frontier = new Frontier(workers);
        PageExpander expander = new PageExpander(fetcher, extractor, config.getKeywords(), target,
                config.getConcurrency(), g, frontier, signal, st);

        // ---- 0) 시작 노드 동기 확장 ----
        g.claim(start);
        boolean seeded;
        try {
            seeded = expander.expand(start);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CrawlException("Interrupted while fetching start page", ie);
        } catch (RuntimeException e) {
            SLOG.error("worker-failed", e, "url", start);
            throw new CrawlException("Start page expansion failed: " + e, e);
        }

        if (!seeded) {
            frontier.close();
            this.outcome = CrawlOutcome.START_NOT_FETCHABLE;
            this.lastPath = List.of();
            this.finishedAt = Instant.now();
            LOG.error("Initial fetch failed: {} not fetchable", start);
            SLOG.error("start-not-fetchable", null, "url", start);
            return List.of();
        }
        SLOG.info("seed-expanded",
                "links", g.neighbors(start).size(),
                "frontier", frontier.size(),
                "targetFound", signal.isSet());

        // ---- 1) 워커 풀 ----
        if (!signal.isSet()) {
            new CrawlWorkerPool(workers, frontier, g, signal, expander, st).run();
        }

        // ---- 2) 경로 복원 ----
        return finish(PathFinder.shortestPath(g, start, target), g, st);
    }

    private List<String> finish(List<String> path, CrawlGraph g, CrawlStats st) {
        this.outcome = path.isEmpty() ? CrawlOutcome.TARGET_UNREACHABLE : CrawlOutcome.FOUND;
        this.lastPath = path;
        this.finishedAt = Instant.now();

        var snap = st.snapshot();
        LOG.info("Crawl done. outcome={}, hops={}, pages={}, failures={}, nodes={}, edges={}",
                outcome, Math.max(0, path.size() - 1), snap.pagesExpanded, snap.fetchFailures,
                g.nodeCount(), g.edgeCount());
        SLOG.info("crawl-done",
                "outcome", outcome.name(),
                "hops", Math.max(0, path.size() - 1),
                "pages", snap.pagesExpanded,
                "fetchFailures", snap.fetchFailures,
                "duplicateSkips", snap.duplicateSkips,
                "nodes", g.nodeCount(),
                "edges", g.edgeCount(),
                "maxObservedFetches", snap.maxObservedFetches);
        return path;
    }

    @Override
    public void close() {
        try {
            fetcher.close();
        } catch (Exception e) {
            LOG.warn("Fetcher close failed: {}", e.toString());
        }
    }

    /* =========================
       마지막 실행 결과 게터
       ========================= */

    public CrawlConfig getConfig() { return config; }

    /** findPath() 전에는 null */
    public CrawlOutcome getOutcome() { return outcome; }

    public List<String> getLastPath() { return lastPath; }

    /** 마지막 실행의 그래프. 실행이 끝난 뒤에는 더 바뀌지 않는다. */
    public CrawlGraph getGraph() { return graph; }

    public CrawlStats.Snapshot getStatsSnapshot() { return stats.snapshot(); }

    public Instant getStartedAt() { return startedAt; }

    public Instant getFinishedAt() { return finishedAt; }
}
