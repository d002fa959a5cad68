package com.crawlscope.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** 요청 하나의 집계 결과. results 는 요청 URL 순서를 따른다. */
public record CrawlResult(
        @JsonProperty("results") List<DomainResult> results,
        @JsonProperty("total_pages_crawled") int totalPagesCrawled,
        @JsonProperty("total_processing_time_ms") long totalProcessingTimeMs,
        @JsonProperty("crawl_timestamp") String crawlTimestamp
) {
    public CrawlResult {
        results = (results == null) ? List.of() : List.copyOf(results);
    }

    public long failedDomains() {
        return results.stream().filter(DomainResult::hasError).count();
    }
}
