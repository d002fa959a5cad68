package com.crawlscope.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CrawlMetadata(
        @JsonProperty("crawl_timestamp") String crawlTimestamp,            // unix seconds
        @JsonProperty("total_processing_time_ms") long totalProcessingTimeMs,
        @JsonProperty("content_summary") String contentSummary,
        @JsonProperty("last_modified") String lastModified,
        @JsonProperty("published_date") String publishedDate
) {}
