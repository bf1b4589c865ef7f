package com.wikicrawler.core.model;

import com.wikicrawler.core.util.UrlUtils;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 크롤 설정 (crawl.yml 매핑 대상). 순수 설정 보관용.
 * CLI 옵션은 YAML 값 위에 덮어쓴다.
 */
public final class CrawlConfig {

    public static final String DEFAULT_ARTICLE_PREFIX = "/wiki/";
    public static final String DEFAULT_USER_AGENT = "WikiCrawler/0.1 (+path-finder)";

    // ---------- 기본 필드 ----------
    private String start;                    // 시작 URL (필수)
    private String target;                   // 목표 URL (필수)
    private int concurrency = 25;            // 동시 fetch 상한
    private int workers = 0;                 // 0이면 concurrency와 동일
    private List<String> keywords = List.of();

    private Duration timeout = Duration.ofSeconds(10); // 요청 타임아웃
    private boolean followRedirects = true;
    private String userAgent = DEFAULT_USER_AGENT;

    /** 추출 대상 링크의 href 접두어 (같은 사이트의 문서 링크만) */
    private String articlePrefix = DEFAULT_ARTICLE_PREFIX;

    // ---------- getters ----------
    public String getStart() { return start; }
    public String getTarget() { return target; }
    public int getConcurrency() { return concurrency; }
    public List<String> getKeywords() { return keywords; }
    public Duration getTimeout() { return timeout; }
    public boolean isFollowRedirects() { return followRedirects; }
    public String getUserAgent() { return userAgent; }
    public String getArticlePrefix() { return articlePrefix; }

    /** 설정값 그대로 (0 = 미지정) */
    public int getWorkers() { return workers; }

    /** 실제로 띄울 워커 수: 미지정이면 fetch 상한과 같다 */
    public int getEffectiveWorkers() { return workers > 0 ? workers : concurrency; }

    // ---------- fluent setters ----------
    public CrawlConfig setStart(String start) { this.start = start; return this; }
    public CrawlConfig setTarget(String target) { this.target = target; return this; }
    public CrawlConfig setConcurrency(int concurrency) { this.concurrency = Math.max(1, concurrency); return this; }
    public CrawlConfig setWorkers(int workers) { this.workers = Math.max(0, workers); return this; }
    public CrawlConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CrawlConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public CrawlConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public CrawlConfig setArticlePrefix(String articlePrefix) { this.articlePrefix = articlePrefix; return this; }

    /** null이면 빈 목록. 순서가 곧 우선순위이므로 그대로 복사한다. */
    public CrawlConfig setKeywords(List<String> keywords) {
        this.keywords = (keywords == null) ? List.of() : List.copyOf(keywords);
        return this;
    }

    public CrawlConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(target, "target");
        if (start.isBlank()) throw new IllegalArgumentException("start must not be blank");
        if (target.isBlank()) throw new IllegalArgumentException("target must not be blank");
        if (!UrlUtils.isHttpLike(start)) throw new IllegalArgumentException("start must be an absolute http(s) URL: " + start);
        if (!UrlUtils.isHttpLike(target)) throw new IllegalArgumentException("target must be an absolute http(s) URL: " + target);
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (workers < 0) throw new IllegalArgumentException("workers must be >= 0");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        Objects.requireNonNull(keywords, "keywords");
        Objects.requireNonNull(userAgent, "userAgent");
        Objects.requireNonNull(articlePrefix, "articlePrefix");
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    public long getTimeoutMs() { return timeout.toMillis(); }
}
