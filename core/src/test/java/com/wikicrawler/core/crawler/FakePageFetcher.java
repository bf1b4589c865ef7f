package com.wikicrawler.core.crawler;

import com.wikicrawler.core.api.IPageFetcher;
import com.wikicrawler.core.model.FetchResult;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 테스트용 fetcher: url → HTML 맵에서 응답.
 * 등록 안 된 url, nonHtml 로 지정한 url 은 not fetchable.
 * 호출 횟수와 동시 호출 최대치를 기록한다.
 */
final class FakePageFetcher implements IPageFetcher {
    static final String BASE = "https://en.wiki.test";

    private final Map<String, String> pages = new HashMap<>();
    private final Set<String> nonHtml = new HashSet<>();
    private final Map<String, RuntimeException> failures = new HashMap<>();
    private final ConcurrentHashMap<String, AtomicInteger> counts = new ConcurrentHashMap<>();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final AtomicInteger maxInFlight = new AtomicInteger();
    private volatile long delayMs = 0;

    static String url(String article) { return BASE + "/wiki/" + article; }

    /** article 페이지에 (보이는 텍스트 = 문서명) 링크들을 순서대로 둔다 */
    FakePageFetcher page(String article, String... linkedArticles) {
        StringBuilder html = new StringBuilder("<html><body><p>").append(article).append("</p>");
        for (String to : linkedArticles) {
            html.append("<a href=\"/wiki/").append(to).append("\">").append(to).append("</a> ");
        }
        // 문서 링크가 아닌 것들은 추출기에서 걸러져야 한다
        html.append("<a href=\"https://elsewhere.test/x\">ext</a><a href=\"#top\">top</a>");
        html.append("</body></html>");
        pages.put(url(article), html.toString());
        return this;
    }

    /** 링크 텍스트를 직접 지정: pairs = text, href, text, href ... */
    FakePageFetcher pageWithAnchors(String article, String... textHrefPairs) {
        StringBuilder html = new StringBuilder("<html><body>");
        for (int i = 0; i + 1 < textHrefPairs.length; i += 2) {
            html.append("<a href=\"").append(textHrefPairs[i + 1]).append("\">")
                .append(textHrefPairs[i]).append("</a> ");
        }
        html.append("</body></html>");
        pages.put(url(article), html.toString());
        return this;
    }

    FakePageFetcher nonHtml(String article) {
        nonHtml.add(url(article));
        return this;
    }

    FakePageFetcher failing(String article, RuntimeException e) {
        failures.put(url(article), e);
        return this;
    }

    FakePageFetcher delay(long ms) {
        this.delayMs = ms;
        return this;
    }

    @Override
    public FetchResult fetch(String url) {
        counts.computeIfAbsent(url, k -> new AtomicInteger()).incrementAndGet();
        int cur = inFlight.incrementAndGet();
        maxInFlight.accumulateAndGet(cur, Math::max);
        try {
            if (delayMs > 0) Thread.sleep(delayMs);
            RuntimeException boom = failures.get(url);
            if (boom != null) throw boom;
            if (nonHtml.contains(url)) return FetchResult.notFetchable(url, "not HTML: application/pdf");
            String html = pages.get(url);
            if (html == null) return FetchResult.notFetchable(url, "404");
            return FetchResult.document(url, "text/html; charset=UTF-8", html);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FetchResult.notFetchable(url, "interrupted");
        } finally {
            inFlight.decrementAndGet();
        }
    }

    int fetchCount(String article) {
        AtomicInteger c = counts.get(url(article));
        return c == null ? 0 : c.get();
    }

    int totalFetches() {
        return counts.values().stream().mapToInt(AtomicInteger::get).sum();
    }

    Map<String, AtomicInteger> counts() { return counts; }

    int maxInFlight() { return maxInFlight.get(); }
}
