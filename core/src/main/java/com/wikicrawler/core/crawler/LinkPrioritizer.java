package com.wikicrawler.core.crawler;

import com.wikicrawler.core.model.ArticleLink;
import com.wikicrawler.core.model.PrioritizedLink;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 키워드 기반 링크 우선순위 부여 (순수 함수).
 * - 입력 순서를 그대로 유지한다. 정렬은 Frontier 몫.
 * - 우선순위 = 텍스트 또는 href에 처음 포함된 키워드의 인덱스(대소문자 무시),
 *   아무것도 없으면 keywords.size().
 */
public final class LinkPrioritizer {
    private LinkPrioritizer() {}

    public static List<PrioritizedLink> prioritize(List<ArticleLink> links, List<String> keywords) {
        List<String> kws = lowered(keywords);
        List<PrioritizedLink> out = new ArrayList<>(links == null ? 0 : links.size());
        if (links == null) return out;

        for (ArticleLink link : links) {
            out.add(new PrioritizedLink(priorityOf(link, kws), link.href()));
        }
        return out;
    }

    /** kws는 이미 소문자 */
    static int priorityOf(ArticleLink link, List<String> kws) {
        String text = link.text().toLowerCase(Locale.ROOT);
        String href = link.href().toLowerCase(Locale.ROOT);
        for (int i = 0; i < kws.size(); i++) {
            String kw = kws.get(i);
            if (text.contains(kw) || href.contains(kw)) return i;
        }
        return kws.size();
    }

    private static List<String> lowered(List<String> keywords) {
        if (keywords == null || keywords.isEmpty()) return List.of();
        List<String> out = new ArrayList<>(keywords.size());
        for (String k : keywords) out.add(k == null ? "" : k.toLowerCase(Locale.ROOT));
        return out;
    }
}
