package com.crawlscope.core.crawler;

import com.crawlscope.core.api.IPageFetcher;
import com.crawlscope.core.error.CrawlException;
import com.crawlscope.core.model.FetchedPage;

import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/** 네트워크 없는 가짜 사이트: 경로 → HTML. 요청마다 가짜 nano 시계를 진행시킬 수 있다. */
final class FakeSite implements IPageFetcher {
    final AtomicLong nanos = new AtomicLong();
    final List<URI> fetched = new ArrayList<>();
    final List<Duration> timeouts = new ArrayList<>();

    private final Function<String, String> pages;
    private final Map<String, Integer> status = new HashMap<>();
    private final Map<String, CrawlException> failures = new HashMap<>();
    private long advancePerFetch;

    FakeSite(Function<String, String> pagesByPath) { this.pages = pagesByPath; }

    static FakeSite of(Map<String, String> byPath) { return new FakeSite(byPath::get); }

    FakeSite status(String path, int code) { status.put(path, code); return this; }
    FakeSite fail(String path, CrawlException e) { failures.put(path, e); return this; }
    FakeSite advancePerFetch(Duration d) { this.advancePerFetch = d.toNanos(); return this; }

    long now() { return nanos.get(); }

    @Override
    public FetchedPage fetch(URI url, Duration timeout) throws CrawlException {
        fetched.add(url);
        timeouts.add(timeout);
        nanos.addAndGet(advancePerFetch);
        String path = url.getRawPath().isEmpty() ? "/" : url.getRawPath();
        if (failures.containsKey(path)) throw failures.get(path);
        String html = pages.apply(path);
        return FetchedPage.builder()
                .url(url)
                .statusCode(html == null ? 404 : status.getOrDefault(path, 200))
                .body(html == null ? "<title>Not found</title>" : html)
                .build();
    }

    /** /p1 → /p2 → ... 끝없이 이어지는 목록 페이지 */
    static String chainPage(int n) {
        return "<html><head><title>P" + n + "</title></head><body>"
                + "<p>widget page " + n + "</p>"
                + "<a class=\"next\" href=\"/p" + (n + 1) + "\">next</a>"
                + "</body></html>";
    }

    static FakeSite endlessChain() {
        return new FakeSite(path -> path.startsWith("/p") ? chainPage(Integer.parseInt(path.substring(2))) : null);
    }
}
