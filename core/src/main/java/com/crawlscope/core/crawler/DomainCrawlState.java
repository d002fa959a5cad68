package com.crawlscope.core.crawler;

import com.crawlscope.core.model.KeywordMatch;
import com.crawlscope.core.util.UrlUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** DomainCrawler 한 번의 실행이 독점하는 가변 상태. 크롤이 끝나면 버린다. */
final class DomainCrawlState {

    private final URI seed;
    private final Set<String> visited = new HashSet<>();   // UrlUtils.visitKey
    private final List<KeywordMatch> matches = new ArrayList<>();
    private final StringBuilder content = new StringBuilder();

    private URI currentUrl;
    private int pagesCrawled;
    private int depth;
    private boolean hasMorePages;
    private boolean titleCaptured;
    private String title;
    private PageExtractor.PageDates lastDates = PageExtractor.PageDates.NONE;

    DomainCrawlState(URI seed) {
        this.seed = seed;
        this.currentUrl = seed;
        this.visited.add(UrlUtils.visitKey(seed));
    }

    URI seed() { return seed; }
    URI currentUrl() { return currentUrl; }
    int pagesCrawled() { return pagesCrawled; }
    int depth() { return depth; }
    boolean hasMorePages() { return hasMorePages; }
    boolean titleCaptured() { return titleCaptured; }
    String title() { return title; }
    List<KeywordMatch> matches() { return matches; }
    String content() { return content.toString(); }
    PageExtractor.PageDates lastDates() { return lastDates; }

    void countPage() { pagesCrawled++; }
    void markMorePages() { hasMorePages = true; }
    void recordDates(PageExtractor.PageDates dates) { this.lastDates = dates; }

    void captureTitle(String title) {
        this.title = title;
        this.titleCaptured = true;
    }

    void appendPage(String cleaned) {
        if (content.length() > 0) content.append(DomainCrawler.PAGE_SEPARATOR);
        content.append(cleaned);
    }

    /** 처음 보는 URL 이면 방문 처리하고 현재 URL 로 삼는다. 이미 봤으면 false (루프). */
    boolean advanceTo(URI next) {
        if (!visited.add(UrlUtils.visitKey(next))) return false;
        currentUrl = next;
        depth++;
        return true;
    }
}
