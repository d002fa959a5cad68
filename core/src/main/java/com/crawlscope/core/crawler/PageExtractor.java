package com.crawlscope.core.crawler;

import com.crawlscope.core.error.CrawlException;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * 가져온 HTML 에서 제목/날짜/본문 평문/다음 페이지 링크를 뽑는다.
 * 상태 없음: 여러 도메인 작업이 하나를 공유해도 된다.
 */
public class PageExtractor {

    private static final Set<String> MODIFIED_KEYS = Set.of(
            "article:modified_time", "article:updated_time", "last-modified", "date-modified");
    private static final Set<String> PUBLISHED_KEYS = Set.of(
            "article:published_time", "date", "publish-date", "publication-date");

    private final List<PaginationRules.Rule> paginationRules;

    public PageExtractor() {
        this(PaginationRules.DEFAULT);
    }

    public PageExtractor(List<PaginationRules.Rule> paginationRules) {
        this.paginationRules = List.copyOf(paginationRules);
    }

    /** 페이지에서 찾은 날짜 문자열(원문 그대로) */
    public record PageDates(String lastModified, String published) {
        public static final PageDates NONE = new PageDates(null, null);

        /** 필터에 넘길 후보 목록 (null 제외) */
        public List<String> candidates() {
            List<String> out = new ArrayList<>(2);
            if (lastModified != null) out.add(lastModified);
            if (published != null) out.add(published);
            return Collections.unmodifiableList(out);
        }
    }

    public Document parse(String html, URI baseUrl) {
        return Jsoup.parse(html == null ? "" : html, baseUrl == null ? "" : baseUrl.toString());
    }

    public PageDates extractDates(String html) {
        return extractDates(parse(html, null));
    }

    /** meta property/name 우선, 없으면 time[datetime] 을 발행일로. 범주별 첫 값 유지. */
    public PageDates extractDates(Document doc) {
        String lastModified = null;
        String published = null;

        for (Element meta : doc.select("meta[content]")) {
            String content = meta.attr("content").trim();
            if (content.isEmpty()) continue;
            for (String attr : List.of("property", "name")) {
                String key = meta.attr(attr).trim().toLowerCase(Locale.ROOT);
                if (key.isEmpty()) continue;
                if (lastModified == null && MODIFIED_KEYS.contains(key)) lastModified = content;
                if (published == null && PUBLISHED_KEYS.contains(key)) published = content;
            }
        }

        if (published == null) {
            for (Element time : doc.select("time[datetime]")) {
                String dt = time.attr("datetime").trim();
                if (!dt.isEmpty()) {
                    published = dt;
                    break;
                }
            }
        }
        return new PageDates(lastModified, published);
    }

    public Optional<String> extractTitle(String html) throws CrawlException {
        return extractTitle(parse(html, null));
    }

    /** 첫 title 요소의 텍스트. 빈 제목은 없음으로 본다. */
    public Optional<String> extractTitle(Document doc) throws CrawlException {
        Element title;
        try {
            title = doc.selectFirst("title");
        } catch (Selector.SelectorParseException e) {
            throw CrawlException.selector(e.getMessage(), e);
        }
        if (title == null) return Optional.empty();
        String text = title.text().trim();
        return text.isEmpty() ? Optional.empty() : Optional.of(text);
    }

    public String cleanText(String html) {
        return HtmlText.clean(html);
    }

    public String cleanText(Document doc) {
        return HtmlText.clean(doc.body());
    }

    public Optional<URI> findNextPageUrl(String html, URI currentUrl) {
        return findNextPageUrl(parse(html, currentUrl), currentUrl);
    }

    public Optional<URI> findNextPageUrl(Document doc, URI currentUrl) {
        if (currentUrl != null && doc.baseUri().isEmpty()) doc.setBaseUri(currentUrl.toString());
        return PaginationRules.findNext(doc, paginationRules);
    }
}
