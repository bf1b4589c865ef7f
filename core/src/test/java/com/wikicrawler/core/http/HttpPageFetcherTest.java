package com.wikicrawler.core.http;

import com.wikicrawler.core.model.CrawlConfig;
import com.wikicrawler.core.model.FetchResult;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class HttpPageFetcherTest {

    // 간단한 HttpResponse 스텁
    static class Resp implements HttpResponse<String> {
        final int code; final Map<String, List<String>> headers; final String body;
        Resp(int code, Map<String, List<String>> headers, String body) {
            this.code = code; this.headers = headers; this.body = body;
        }
        @Override public int statusCode() { return code; }
        @Override public HttpRequest request() { return null; }
        @Override public Optional<HttpResponse<String>> previousResponse() { return Optional.empty(); }
        @Override public HttpHeaders headers() { return HttpHeaders.of(headers, (a, b) -> true); }
        @Override public String body() { return body; }
        @Override public Optional<javax.net.ssl.SSLSession> sslSession() { return Optional.empty(); }
        @Override public URI uri() { return URI.create("https://en.wiki.test"); }
        @Override public HttpClient.Version version() { return HttpClient.Version.HTTP_1_1; }
    }

    private static final String URL = "https://en.wiki.test/wiki/Start";

    private static CrawlConfig cfg() {
        return CrawlConfig.defaults().setTimeoutMs(2000).setUserAgent("wc-test/1.0");
    }

    @Test
    void html_with_charset_is_a_document() {
        AtomicReference<HttpRequest> seen = new AtomicReference<>();
        HttpPageFetcher.HttpSender sender = req -> {
            seen.set(req);
            return new Resp(200, Map.of("Content-Type", List.of("text/html; charset=UTF-8")), "<html/>");
        };

        FetchResult r = new HttpPageFetcher(cfg(), sender).fetch(URL);

        assertThat(r.isFetchable()).isTrue();
        assertThat(r.getBody()).isEqualTo("<html/>");
        assertThat(r.getStatusCode()).isEqualTo(200);
        assertThat(seen.get().method()).isEqualTo("GET");
        assertThat(seen.get().headers().firstValue("User-Agent")).contains("wc-test/1.0");
    }

    @Test
    void status_code_is_not_inspected() {
        HttpPageFetcher.HttpSender sender =
                req -> new Resp(404, Map.of("content-type", List.of("TEXT/HTML")), "<p>missing</p>");

        FetchResult r = new HttpPageFetcher(cfg(), sender).fetch(URL);

        assertThat(r.isFetchable()).isTrue();
        assertThat(r.getStatusCode()).isEqualTo(404);
    }

    @Test
    void non_html_is_not_fetchable() {
        HttpPageFetcher.HttpSender sender =
                req -> new Resp(200, Map.of("Content-Type", List.of("application/json")), "{}");

        FetchResult r = new HttpPageFetcher(cfg(), sender).fetch(URL);

        assertThat(r.isFetchable()).isFalse();
        assertThat(r.getReason()).isEqualTo("not HTML: application/json");
        assertThat(r.getBody()).isEmpty();
    }

    @Test
    void missing_content_type_is_not_fetchable() {
        HttpPageFetcher.HttpSender sender = req -> new Resp(200, Map.of(), "<html/>");

        FetchResult r = new HttpPageFetcher(cfg(), sender).fetch(URL);

        assertThat(r.isFetchable()).isFalse();
        assertThat(r.getReason()).isEqualTo("not HTML: <none>");
    }

    @Test
    void transport_error_is_not_fetchable() {
        HttpPageFetcher.HttpSender sender = req -> { throw new java.io.IOException("connection reset"); };

        FetchResult r = new HttpPageFetcher(cfg(), sender).fetch(URL);

        assertThat(r.isFetchable()).isFalse();
        assertThat(r.getStatusCode()).isEqualTo(-1);
        assertThat(r.getReason()).isEqualTo("IOException: connection reset");
    }

    @Test
    void interrupted_send_keeps_interrupt_flag() {
        HttpPageFetcher.HttpSender sender = req -> { throw new InterruptedException(); };

        try {
            FetchResult r = new HttpPageFetcher(cfg(), sender).fetch(URL);
            assertThat(r.isFetchable()).isFalse();
            assertThat(r.getReason()).isEqualTo("interrupted");
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted(); // 다음 테스트에 영향 없도록 해제
        }
    }

    @Test
    void malformed_url_is_not_fetchable() {
        HttpPageFetcher.HttpSender sender = req -> new Resp(200, Map.of(), "");

        FetchResult r = new HttpPageFetcher(cfg(), sender).fetch("https://bad host/x");

        assertThat(r.isFetchable()).isFalse();
        assertThat(r.getReason()).startsWith("IllegalArgumentException");
    }
}
