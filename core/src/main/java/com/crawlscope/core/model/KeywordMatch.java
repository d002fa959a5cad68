package com.crawlscope.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** 한 페이지에서 한 키워드가 잡힌 결과. context 는 원문 구간들을 이어 붙인 것. */
public record KeywordMatch(
        @JsonProperty("keyword") String keyword,
        @JsonProperty("context") String context,
        @JsonProperty("cleaned_text") String cleanedText,
        @JsonProperty("count") int count,
        @JsonProperty("relevance_score") double relevanceScore,
        @JsonProperty("source_url") String sourceUrl
) {}
