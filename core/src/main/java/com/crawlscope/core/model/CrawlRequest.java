package com.crawlscope.core.model;

import com.crawlscope.core.error.CrawlException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * 크롤 요청 (JSON 매핑 대상).
 * url 은 콤마로 여러 개를 이어 붙일 수 있다. 선택 필드는 null 이면 기본값을 쓴다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class CrawlRequest {

    public static final int DEFAULT_MAX_PAGES = 10;

    @JsonProperty("url")
    private String url;

    @JsonProperty("keywords")
    private List<String> keywords = new ArrayList<>();

    @JsonProperty("max_depth")
    private Integer maxDepth;

    @JsonProperty("max_time_seconds")
    private Long maxTimeSeconds;

    @JsonProperty("follow_pagination")
    private Boolean followPagination;

    @JsonProperty("max_pages")
    private Integer maxPages;

    @JsonProperty("date_from")
    private String dateFrom;     // YYYY-MM-DD

    @JsonProperty("date_to")
    private String dateTo;       // YYYY-MM-DD

    // ---------- getters ----------
    public String getUrl() { return url; }
    public List<String> getKeywords() { return keywords; }
    public Integer getMaxDepth() { return maxDepth; }
    public Long getMaxTimeSeconds() { return maxTimeSeconds; }
    public Boolean getFollowPagination() { return followPagination; }
    public Integer getMaxPages() { return maxPages; }
    public String getDateFrom() { return dateFrom; }
    public String getDateTo() { return dateTo; }

    // ---------- fluent setters ----------
    public CrawlRequest setUrl(String url) { this.url = url; return this; }
    public CrawlRequest setKeywords(List<String> keywords) {
        this.keywords = (keywords == null) ? new ArrayList<>() : new ArrayList<>(keywords);
        return this;
    }
    public CrawlRequest setMaxDepth(Integer maxDepth) { this.maxDepth = maxDepth; return this; }
    public CrawlRequest setMaxTimeSeconds(Long maxTimeSeconds) { this.maxTimeSeconds = maxTimeSeconds; return this; }
    public CrawlRequest setFollowPagination(Boolean followPagination) { this.followPagination = followPagination; return this; }
    public CrawlRequest setMaxPages(Integer maxPages) { this.maxPages = maxPages; return this; }
    public CrawlRequest setDateFrom(String dateFrom) { this.dateFrom = dateFrom; return this; }
    public CrawlRequest setDateTo(String dateTo) { this.dateTo = dateTo; return this; }

    // ---------- 기본값 해석 ----------
    public boolean followPaginationOrDefault() {
        return followPagination != null && followPagination;
    }

    /** 요청값 → 설정 기본값 → 10 순서 */
    public int maxPagesOr(int fallback) {
        if (maxPages != null) return maxPages;
        return fallback > 0 ? fallback : DEFAULT_MAX_PAGES;
    }

    /** 요청값이 없으면 fallback(0 이하면 무제한 의미로 null) */
    public Long maxTimeSecondsOr(long fallback) {
        if (maxTimeSeconds != null) return maxTimeSeconds;
        return fallback > 0 ? fallback : null;
    }

    // ---------- validate ----------
    /** 네트워크 활동 전에 호출. 날짜 범위 검증은 DateFilter 담당. */
    public void validate() throws CrawlException {
        if (url == null || url.isBlank()) throw CrawlException.other("url is required");
        if (keywords == null || keywords.stream().allMatch(k -> k == null || k.isBlank())) {
            throw CrawlException.other("at least one keyword is required");
        }
        if (maxDepth != null && maxDepth < 0) throw CrawlException.other("max_depth must be >= 0");
        if (maxTimeSeconds != null && maxTimeSeconds < 0) throw CrawlException.other("max_time_seconds must be >= 0");
        if (maxPages != null && maxPages < 0) throw CrawlException.other("max_pages must be >= 0");
    }
}
