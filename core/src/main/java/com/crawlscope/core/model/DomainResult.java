package com.crawlscope.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * 도메인 하나의 크롤 결과.
 * 실패 결과는 url/error 만 채워지고 content 는 빈 문자열, matches 는 빈 목록이다.
 * 타임아웃으로 끝난 경우에는 그때까지의 부분 결과와 error 가 함께 남는다.
 */
@JsonPropertyOrder({"url", "title", "content", "matches", "pages_crawled",
        "has_more_pages", "metadata", "error"})
public final class DomainResult {

    @JsonProperty("url")
    private final String url;
    @JsonProperty("title")
    private final String title;
    @JsonProperty("content")
    private final String content;
    @JsonProperty("matches")
    private final List<KeywordMatch> matches;
    @JsonProperty("pages_crawled")
    private final int pagesCrawled;
    @JsonProperty("has_more_pages")
    private final boolean hasMorePages;
    @JsonProperty("metadata")
    private final CrawlMetadata metadata;
    @JsonProperty("error")
    private final String error;

    private DomainResult(Builder b) {
        this.url = b.url;
        this.title = b.title;
        this.content = (b.content == null) ? "" : b.content;
        this.matches = (b.matches == null) ? List.of() : List.copyOf(b.matches);
        this.pagesCrawled = b.pagesCrawled;
        this.hasMorePages = b.hasMorePages;
        this.metadata = b.metadata;
        this.error = b.error;
    }

    /** 오케스트레이터가 도메인 실패를 담을 때 쓰는 자리표시 결과 */
    public static DomainResult failed(String url, String error) {
        return builder().url(url).error(error).build();
    }

    public String getUrl() { return url; }
    public String getTitle() { return title; }
    public String getContent() { return content; }
    public List<KeywordMatch> getMatches() { return matches; }
    public int getPagesCrawled() { return pagesCrawled; }
    public boolean isHasMorePages() { return hasMorePages; }
    public CrawlMetadata getMetadata() { return metadata; }
    public String getError() { return error; }

    public boolean hasError() { return error != null; }

    @Override
    public String toString() {
        return "DomainResult{url=" + url + ", pages=" + pagesCrawled + ", matches=" + matches.size()
                + ", hasMore=" + hasMorePages + (error != null ? ", error=" + error : "") + '}';
    }

    // ----- 빌더 -----
    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String url;
        private String title;
        private String content;
        private List<KeywordMatch> matches;
        private int pagesCrawled;
        private boolean hasMorePages;
        private CrawlMetadata metadata;
        private String error;

        public Builder url(String url) { this.url = url; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder content(String content) { this.content = content; return this; }
        public Builder matches(List<KeywordMatch> matches) { this.matches = matches; return this; }
        public Builder pagesCrawled(int pagesCrawled) { this.pagesCrawled = pagesCrawled; return this; }
        public Builder hasMorePages(boolean hasMorePages) { this.hasMorePages = hasMorePages; return this; }
        public Builder metadata(CrawlMetadata metadata) { this.metadata = metadata; return this; }
        public Builder error(String error) { this.error = error; return this; }

        public DomainResult build() {
            Objects.requireNonNull(url, "url");
            return new DomainResult(this);
        }
    }
}
