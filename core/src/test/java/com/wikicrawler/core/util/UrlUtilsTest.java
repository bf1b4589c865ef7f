package com.wikicrawler.core.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class UrlUtilsTest {

    private static final String BASE = "https://en.wikipedia.org/wiki/Potato";

    @Test
    void resolves_site_relative_href_against_base() {
        assertThat(UrlUtils.resolve(BASE, "/wiki/Tomato"))
                .isEqualTo("https://en.wikipedia.org/wiki/Tomato");
        assertThat(UrlUtils.resolve(BASE, "  /wiki/Tomato "))
                .isEqualTo("https://en.wikipedia.org/wiki/Tomato");
    }

    @Test
    void does_not_normalize_fragment_or_case() {
        assertThat(UrlUtils.resolve(BASE, "/wiki/Tomato#History"))
                .isEqualTo("https://en.wikipedia.org/wiki/Tomato#History");
        assertThat(UrlUtils.resolve(BASE, "/wiki/tomato"))
                .isNotEqualTo(UrlUtils.resolve(BASE, "/wiki/Tomato"));
    }

    @Test
    void percent_encoded_href_stays_as_is() {
        assertThat(UrlUtils.resolve(BASE, "/wiki/Caf%C3%A9"))
                .isEqualTo("https://en.wikipedia.org/wiki/Caf%C3%A9");
    }

    @Test
    void syntax_error_gives_null() {
        assertThat(UrlUtils.resolve(BASE, "/wiki/Bad name")).isNull();
        assertThat(UrlUtils.resolve(BASE, null)).isNull();
        assertThat(UrlUtils.resolve(null, "/wiki/A")).isNull();
    }

    @Test
    void http_like() {
        assertThat(UrlUtils.isHttpLike(BASE)).isTrue();
        assertThat(UrlUtils.isHttpLike("HTTP://example.com")).isTrue();
        assertThat(UrlUtils.isHttpLike("ftp://example.com")).isFalse();
        assertThat(UrlUtils.isHttpLike("/wiki/A")).isFalse();
        assertThat(UrlUtils.isHttpLike("not a url")).isFalse();
        assertThat(UrlUtils.isHttpLike(null)).isFalse();
    }
}
