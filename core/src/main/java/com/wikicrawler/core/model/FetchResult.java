package com.wikicrawler.core.model;

import java.util.Locale;
import java.util.Objects;

/**
 * 페이지 fetch 결과. 문서(본문 + 콘텐츠 타입) 이거나 "가져올 수 없음" 둘 중 하나.
 * 가져올 수 없는 경우 reason에 사유(콘텐츠 타입/전송 오류)를 남긴다.
 */
public final class FetchResult {
    private final String url;
    private final int statusCode;
    private final String contentType;
    private final String body;
    private final boolean fetchable;
    private final String reason;
    private final long responseTimeMs;

    private FetchResult(Builder b) {
        this.url = b.url;
        this.statusCode = b.statusCode;
        this.contentType = b.contentType;
        this.body = (b.body == null) ? "" : b.body;
        this.fetchable = b.fetchable;
        this.reason = b.reason;
        this.responseTimeMs = b.responseTimeMs;
    }

    public String getUrl() { return url; }
    /** 전송 오류면 -1 */
    public int getStatusCode() { return statusCode; }
    public String getContentType() { return contentType; }
    public String getBody() { return body; }
    public boolean isFetchable() { return fetchable; }
    public String getReason() { return reason; }
    public long getResponseTimeMs() { return responseTimeMs; }

    /** Content-Type 헤더의 미디어 타입 부분만(소문자, 파라미터 제거). 없으면 빈 문자열. */
    public static String mediaType(String contentType) {
        if (contentType == null) return "";
        int semi = contentType.indexOf(';');
        String mt = (semi >= 0) ? contentType.substring(0, semi) : contentType;
        return mt.trim().toLowerCase(Locale.ROOT);
    }

    // ----- 팩토리 -----
    public static FetchResult document(String url, String contentType, String body) {
        return builder().url(url).statusCode(200).contentType(contentType).body(body).fetchable(true).build();
    }

    public static FetchResult notFetchable(String url, String reason) {
        return builder().url(url).statusCode(-1).fetchable(false).reason(reason).build();
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private int statusCode;
        private String contentType;
        private String body;
        private boolean fetchable;
        private String reason;
        private long responseTimeMs;

        public Builder url(String url) { this.url = url; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder contentType(String contentType) { this.contentType = contentType; return this; }
        public Builder body(String body) { this.body = body; return this; }
        public Builder fetchable(boolean fetchable) { this.fetchable = fetchable; return this; }
        public Builder reason(String reason) { this.reason = reason; return this; }
        public Builder responseTimeMs(long responseTimeMs) { this.responseTimeMs = responseTimeMs; return this; }

        public FetchResult build() {
            Objects.requireNonNull(url, "url");
            return new FetchResult(this);
        }
    }
}
