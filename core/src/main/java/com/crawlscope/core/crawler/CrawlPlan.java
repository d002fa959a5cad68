package com.crawlscope.core.crawler;

import com.crawlscope.core.model.CrawlRequest;
import com.crawlscope.core.model.CrawlerSettings;

import java.time.Duration;
import java.util.List;

/**
 * 요청 + 설정 기본값을 한 번 해석한 도메인 공통 크롤 계획.
 * 모든 도메인 작업이 읽기 전용으로 공유한다.
 */
public record CrawlPlan(
        List<String> keywords,
        boolean followPagination,
        int maxPages,
        Duration timeLimit,      // null = 무제한
        Integer maxDepth,        // null = 무제한
        DateFilter.Range dateRange
) {
    public CrawlPlan {
        keywords = List.copyOf(keywords);
        if (dateRange == null) dateRange = DateFilter.Range.UNBOUNDED;
    }

    public static CrawlPlan of(CrawlRequest req, CrawlerSettings settings, DateFilter.Range range) {
        Long seconds = req.maxTimeSecondsOr(settings.defaults().getMaxTimeSeconds());
        List<String> keywords = req.getKeywords().stream()
                .filter(k -> k != null && !k.isBlank())
                .toList();
        return new CrawlPlan(
                keywords,
                req.followPaginationOrDefault(),
                req.maxPagesOr(settings.defaults().getMaxPages()),
                seconds == null ? null : Duration.ofSeconds(seconds),
                req.getMaxDepth(),
                range);
    }
}
