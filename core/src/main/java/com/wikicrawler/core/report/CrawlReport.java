package com.wikicrawler.core.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.wikicrawler.core.crawler.WikiCrawler;
import com.wikicrawler.core.model.CrawlConfig;
import com.wikicrawler.core.model.CrawlOutcome;
import com.wikicrawler.core.model.CrawlStats;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** 실행 결과 리포트 (JSON 직렬화 대상). 필드 공개 + 기본 생성자: Jackson 역직렬화용. */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CrawlReport {
    public String v = "1";

    public String start;
    public String target;
    public CrawlOutcome outcome;
    public List<String> path = List.of();
    public int hops;

    public Instant startedAt;
    public Instant finishedAt;
    public long elapsedMs;

    public GraphInfo graph = new GraphInfo();
    public StatsInfo stats = new StatsInfo();
    public ConfigInfo config = new ConfigInfo();

    public static final class GraphInfo {
        public int nodes;
        public long edges;
    }

    public static final class StatsInfo {
        public long pagesExpanded;
        public long fetchFailures;
        public long duplicateSkips;
        public long linksSeen;
        public int maxObservedFetches;
        public long avgFetchMs;
    }

    public static final class ConfigInfo {
        public int concurrency;
        public int workers;
        public List<String> keywords = List.of();
        public long timeoutMs;
    }

    /** 마지막 findPath() 실행 결과로 리포트 구성 */
    public static CrawlReport of(WikiCrawler crawler) {
        CrawlConfig cfg = crawler.getConfig();
        CrawlReport r = new CrawlReport();
        r.start = cfg.getStart();
        r.target = cfg.getTarget();
        r.outcome = crawler.getOutcome();
        r.path = crawler.getLastPath();
        r.hops = Math.max(0, r.path.size() - 1);
        r.startedAt = crawler.getStartedAt();
        r.finishedAt = crawler.getFinishedAt();
        if (r.startedAt != null && r.finishedAt != null) {
            r.elapsedMs = Duration.between(r.startedAt, r.finishedAt).toMillis();
        }

        r.graph.nodes = crawler.getGraph().nodeCount();
        r.graph.edges = crawler.getGraph().edgeCount();

        CrawlStats.Snapshot s = crawler.getStatsSnapshot();
        r.stats.pagesExpanded = s.pagesExpanded;
        r.stats.fetchFailures = s.fetchFailures;
        r.stats.duplicateSkips = s.duplicateSkips;
        r.stats.linksSeen = s.linksSeen;
        r.stats.maxObservedFetches = s.maxObservedFetches;
        r.stats.avgFetchMs = s.avgFetchMs;

        r.config.concurrency = cfg.getConcurrency();
        r.config.workers = cfg.getEffectiveWorkers();
        r.config.keywords = cfg.getKeywords();
        r.config.timeoutMs = cfg.getTimeoutMs();
        return r;
    }
}
