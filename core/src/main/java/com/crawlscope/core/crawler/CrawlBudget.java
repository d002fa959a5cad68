package com.crawlscope.core.crawler;

import java.time.Duration;
import java.util.function.LongSupplier;

/** 도메인 크롤 한 번의 시간/페이지/깊이 예산. 단일 스레드에서만 쓴다. */
public final class CrawlBudget {
    private final LongSupplier nanoClock;
    private final long startNanos;
    private final Duration timeLimit;   // null 이면 무제한
    private final int maxPages;
    private final Integer maxDepth;     // null 이면 무제한

    public CrawlBudget(Duration timeLimit, int maxPages, Integer maxDepth, LongSupplier nanoClock) {
        this.nanoClock = nanoClock;
        this.startNanos = nanoClock.getAsLong();
        this.timeLimit = timeLimit;
        this.maxPages = Math.max(0, maxPages);
        this.maxDepth = maxDepth;
    }

    public Duration elapsed() {
        return Duration.ofNanos(nanoClock.getAsLong() - startNanos);
    }

    public boolean isTimeExpired() {
        return timeLimit != null && elapsed().compareTo(timeLimit) > 0;
    }

    /** 남은 시간. 제한이 없으면 null */
    public Duration remainingTime() {
        if (timeLimit == null) return null;
        Duration left = timeLimit.minus(elapsed());
        return left.isNegative() ? Duration.ZERO : left;
    }

    public boolean pagesExhausted(int pagesCrawled) {
        return pagesCrawled >= maxPages;
    }

    public boolean depthExceeded(int depth) {
        return maxDepth != null && depth > maxDepth;
    }
}
