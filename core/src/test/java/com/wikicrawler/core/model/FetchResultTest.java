package com.wikicrawler.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FetchResultTest {

    @Test
    void media_type_strips_parameters_and_case() {
        assertThat(FetchResult.mediaType("Text/HTML; charset=UTF-8")).isEqualTo("text/html");
        assertThat(FetchResult.mediaType(" application/json ")).isEqualTo("application/json");
        assertThat(FetchResult.mediaType(null)).isEmpty();
    }

    @Test
    void factories() {
        FetchResult doc = FetchResult.document("u", "text/html", null);
        assertThat(doc.isFetchable()).isTrue();
        assertThat(doc.getBody()).isEmpty();

        FetchResult no = FetchResult.notFetchable("u", "not HTML: image/png");
        assertThat(no.isFetchable()).isFalse();
        assertThat(no.getStatusCode()).isEqualTo(-1);
        assertThat(no.getReason()).isEqualTo("not HTML: image/png");
    }

    @Test
    void builder_requires_url() {
        assertThatThrownBy(() -> FetchResult.builder().build()).isInstanceOf(NullPointerException.class);
    }
}
