package com.wikicrawler.core.crawler;

import com.wikicrawler.core.model.ArticleLink;
import com.wikicrawler.core.model.PrioritizedLink;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LinkPrioritizerTest {

    @Test
    void priority_is_index_of_first_matching_keyword() {
        List<ArticleLink> links = List.of(
                new ArticleLink("/wiki/Cat", "Cat"),
                new ArticleLink("/wiki/Dog", "Dog"),
                new ArticleLink("/wiki/Mouse", "Mouse"));

        List<PrioritizedLink> out = LinkPrioritizer.prioritize(links, List.of("dog", "cat"));

        assertThat(out).extracting(PrioritizedLink::priority).containsExactly(1, 0, 2);
        assertThat(out).extracting(PrioritizedLink::href)
                .containsExactly("/wiki/Cat", "/wiki/Dog", "/wiki/Mouse");
    }

    @Test
    void physics_math_example() {
        List<ArticleLink> links = List.of(
                new ArticleLink("/wiki/Chem", "Chemistry"),
                new ArticleLink("/wiki/Phys", "Physics today"),
                new ArticleLink("/wiki/X", "Unrelated"));

        assertThat(LinkPrioritizer.prioritize(links, List.of("physics", "math")))
                .extracting(PrioritizedLink::priority).containsExactly(2, 0, 2);
    }

    @Test
    void no_keywords_means_everything_is_zero() {
        List<ArticleLink> links = List.of(
                new ArticleLink("/wiki/A", "A"),
                new ArticleLink("/wiki/B", "B"));

        assertThat(LinkPrioritizer.prioritize(links, List.of()))
                .extracting(PrioritizedLink::priority).containsOnly(0);
        assertThat(LinkPrioritizer.prioritize(links, null))
                .extracting(PrioritizedLink::priority).containsOnly(0);
    }

    @Test
    void earlier_keyword_wins_when_several_match() {
        var link = new ArticleLink("/wiki/Dog_and_cat", "dog and cat");

        assertThat(LinkPrioritizer.priorityOf(link, List.of("cat", "dog"))).isZero();
        assertThat(LinkPrioritizer.priorityOf(link, List.of("bird", "dog", "cat"))).isEqualTo(1);
    }

    @Test
    void match_is_case_insensitive_on_text_or_href() {
        var onlyInHref = new ArticleLink("/wiki/Golden_Gate_Bridge", "landmark");
        var onlyInText = new ArticleLink("/wiki/X1", "The BRIDGE");

        List<PrioritizedLink> out = LinkPrioritizer.prioritize(
                List.of(onlyInHref, onlyInText), List.of("Bridge"));

        assertThat(out).extracting(PrioritizedLink::priority).containsExactly(0, 0);
    }

    @Test
    void empty_input_gives_empty_output() {
        assertThat(LinkPrioritizer.prioritize(List.of(), List.of("x"))).isEmpty();
        assertThat(LinkPrioritizer.prioritize(null, List.of("x"))).isEmpty();
    }
}
