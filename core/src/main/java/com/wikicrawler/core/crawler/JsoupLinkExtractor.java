package com.wikicrawler.core.crawler;

import com.wikicrawler.core.model.ArticleLink;
import com.wikicrawler.core.model.CrawlConfig;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** 기본 JSoup 기반 링크 추출기: a[href] 중 href가 문서 접두어(/wiki/)로 시작하는 것만. */
public class JsoupLinkExtractor implements LinkExtractor {
    private final String articlePrefix;

    public JsoupLinkExtractor() {
        this(CrawlConfig.DEFAULT_ARTICLE_PREFIX);
    }

    public JsoupLinkExtractor(String articlePrefix) {
        this.articlePrefix = Objects.requireNonNull(articlePrefix, "articlePrefix");
    }

    @Override
    public List<ArticleLink> extract(String baseUrl, String body) {
        List<ArticleLink> out = new ArrayList<>();
        if (body == null || body.isEmpty()) return out;

        Document doc = (baseUrl == null) ? Jsoup.parse(body) : Jsoup.parse(body, baseUrl);
        for (Element a : doc.select("a[href]")) {
            // abs:href 가 아니라 원본 href 기준 (같은 사이트 상대 링크만 대상)
            String href = a.attr("href");
            if (!href.startsWith(articlePrefix)) continue;
            out.add(new ArticleLink(href, a.text()));
        }
        return out;
    }
}
