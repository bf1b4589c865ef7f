package com.wikicrawler.core.http;

import com.wikicrawler.core.api.IPageFetcher;
import com.wikicrawler.core.model.CrawlConfig;
import com.wikicrawler.core.model.FetchResult;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Objects;

/**
 * HTTP 페이지 fetcher: GET 후 Content-Type 이 text/html 일 때만 문서로 취급.
 * 그 외 콘텐츠/전송 오류는 모두 not fetchable. 재시도 없음.
 * 상태 코드는 보지 않는다(HTML 오류 페이지도 문서).
 */
public class HttpPageFetcher implements IPageFetcher {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws Exception;
    }

    static final String HTML = "text/html";

    private final CrawlConfig config;
    private final HttpClient client;   // 프로덕션 경로
    private final HttpSender sender;   // 테스트 경로(있으면 이걸 사용)

    public HttpPageFetcher(CrawlConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        this.sender = null; // 기본은 HttpClient 사용
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpPageFetcher(CrawlConfig config, HttpSender testSender) {
        this.config = Objects.requireNonNull(config, "config");
        this.client = null; // 테스트에선 사용 안 함
        this.sender = Objects.requireNonNull(testSender, "testSender");
    }

    @Override
    public FetchResult fetch(String url) {
        Objects.requireNonNull(url, "url");
        long start = System.nanoTime();
        try {
            HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                    .timeout(config.getTimeout())
                    .header("User-Agent", config.getUserAgent())
                    .header("Accept", "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8")
                    .GET()
                    .build();

            HttpResponse<String> resp = (sender != null)
                    ? sender.send(req)
                    : client.send(req, HttpResponse.BodyHandlers.ofString());

            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            String contentType = resp.headers().firstValue("Content-Type").orElse(null);

            if (!HTML.equals(FetchResult.mediaType(contentType))) {
                return FetchResult.builder()
                        .url(url)
                        .statusCode(resp.statusCode())
                        .contentType(contentType)
                        .fetchable(false)
                        .reason("not HTML: " + (contentType == null ? "<none>" : contentType))
                        .responseTimeMs(elapsedMs)
                        .build();
            }

            return FetchResult.builder()
                    .url(url)
                    .statusCode(resp.statusCode())
                    .contentType(contentType)
                    .body(resp.body() == null ? "" : resp.body())
                    .fetchable(true)
                    .responseTimeMs(elapsedMs)
                    .build();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return failed(url, start, "interrupted");
        } catch (Exception e) {
            return failed(url, start, e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static FetchResult failed(String url, long start, String reason) {
        return FetchResult.builder()
                .url(url)
                .statusCode(-1)
                .fetchable(false)
                .reason(reason)
                .responseTimeMs((System.nanoTime() - start) / 1_000_000)
                .build();
    }
}
