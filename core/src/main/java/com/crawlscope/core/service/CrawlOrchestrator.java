package com.crawlscope.core.service;

import com.crawlscope.core.api.IPageFetcher;
import com.crawlscope.core.api.IResultPublisher;
import com.crawlscope.core.crawler.CrawlPlan;
import com.crawlscope.core.crawler.DateFilter;
import com.crawlscope.core.crawler.DomainCrawler;
import com.crawlscope.core.error.CrawlException;
import com.crawlscope.core.http.PageFetcher;
import com.crawlscope.core.model.CrawlRequest;
import com.crawlscope.core.model.CrawlResult;
import com.crawlscope.core.model.CrawlerSettings;
import com.crawlscope.core.model.DomainResult;
import com.crawlscope.core.service.publish.JsonLinesResultPublisher;
import com.crawlscope.core.service.publish.PublishDispatcher;
import com.crawlscope.core.util.CrawlWarningListener;
import com.crawlscope.core.util.StructuredLog;
import com.crawlscope.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 크롤 오케스트레이터:
 *  - 요청 검증(키워드/숫자/날짜 범위) → URL 목록 분리 → 도메인별 DomainCrawler → 결과 집계
 *  - 도메인 실패는 해당 DomainResult.error 로만 남고 다른 도메인에 영향 없음
 *  - concurrency > 1 이면 고정 스레드풀(상한 = min(도메인 수, concurrency))
 *  - crawl() 은 집계 후 발행자에게 비동기로 넘긴다(반환을 막지 않음)
 */
public final class CrawlOrchestrator implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlOrchestrator.class);
    private static final StructuredLog SLOG = StructuredLog.get(CrawlOrchestrator.class);

    private final CrawlerSettings settings;
    private final DomainCrawler domainCrawler;
    private final CrawlWarningListener warnings;
    private final PublishDispatcher dispatcher;
    private final Clock wallClock;

    /** 기본 구현: HttpClient 수집기 + 로그 경고 + 설정 기반 발행자 */
    public CrawlOrchestrator(CrawlerSettings settings) {
        this(settings, new PageFetcher(settings), CrawlWarningListener.LOGGING, defaultPublishers(settings));
    }

    /** DI/테스트용 */
    public CrawlOrchestrator(CrawlerSettings settings,
                             IPageFetcher fetcher,
                             CrawlWarningListener warnings,
                             List<IResultPublisher> publishers) {
        this(settings, new DomainCrawler(fetcher), warnings, publishers, Clock.systemUTC());
    }

    public CrawlOrchestrator(CrawlerSettings settings,
                             DomainCrawler domainCrawler,
                             CrawlWarningListener warnings,
                             List<IResultPublisher> publishers,
                             Clock wallClock) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.settings.validate();
        this.domainCrawler = Objects.requireNonNull(domainCrawler, "domainCrawler");
        this.warnings = (warnings != null) ? warnings : CrawlWarningListener.NONE;
        this.dispatcher = new PublishDispatcher(publishers == null ? List.of() : publishers);
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    private static List<IResultPublisher> defaultPublishers(CrawlerSettings settings) {
        if (!settings.publish().isEnabled()) return List.of();
        return List.of(new JsonLinesResultPublisher(settings.publish().getJsonLines()));
    }

    /* =========================
       URL 목록 파싱
       ========================= */

    /** 콤마 목록의 한 항목. uri 가 null 이면 error 에 사유가 있다. */
    public record UrlEntry(String raw, URI uri, String error) {
        public boolean isValid() { return uri != null; }
    }

    /** 콤마 분리 → 백틱/공백 제거 → 스킴 기본값 https. 빈 항목은 버리고 잘못된 항목은 사유와 함께 남긴다. */
    public static List<UrlEntry> parseUrlEntries(String rawField) {
        List<UrlEntry> out = new ArrayList<>();
        if (rawField == null) return out;
        for (String part : UrlUtils.clean(rawField).split(",")) {
            String trimmed = part.trim();
            if (trimmed.isEmpty()) continue;
            String candidate = UrlUtils.withDefaultScheme(trimmed);
            try {
                out.add(new UrlEntry(trimmed, UrlUtils.parseHttpUrl(candidate), null));
            } catch (URISyntaxException e) {
                out.add(new UrlEntry(trimmed, null, e.getMessage()));
            }
        }
        return out;
    }

    /** 유효 URL 만. 잘못된 항목은 경고 채널로 알리고 건너뛴다. 하나도 없으면 OTHER. */
    public static List<URI> parseUrls(String rawField, CrawlWarningListener warnings) throws CrawlException {
        List<URI> urls = new ArrayList<>();
        for (UrlEntry e : parseUrlEntries(rawField)) {
            if (e.isValid()) urls.add(e.uri());
            else if (warnings != null) warnings.onWarning("url-skipped", "Failed to parse URL '" + e.raw() + "': " + e.error());
        }
        if (urls.isEmpty()) throw CrawlException.other("No valid URLs provided");
        return urls;
    }

    /* =========================
       실행 API
       ========================= */

    /** run + 발행자에게 비동기 전달 */
    public CrawlResult crawl(CrawlRequest request) throws CrawlException {
        CrawlResult result = run(request);
        dispatcher.dispatch(result);
        return result;
    }

    public CrawlResult run(CrawlRequest request) throws CrawlException {
        Objects.requireNonNull(request, "request");
        final long startNanos = System.nanoTime();

        // ---- 0) 요청 단위 검증: 네트워크 활동 전 ----
        request.validate();
        DateFilter.Range range = DateFilter.validateRange(request.getDateFrom(), request.getDateTo());
        List<UrlEntry> entries = parseUrlEntries(request.getUrl());
        long validCount = entries.stream().filter(UrlEntry::isValid).count();
        if (validCount == 0) throw CrawlException.other("No valid URLs provided");

        CrawlPlan plan = CrawlPlan.of(request, settings, range);
        int cc = (int) Math.max(1, Math.min(validCount, settings.getConcurrency()));

        LOG.info("Crawl start: domains={}, keywords={}, maxPages={}, follow={}, cc={}",
                validCount, plan.keywords().size(), plan.maxPages(), plan.followPagination(), cc);
        SLOG.info("crawl-start",
                "domains", (int) validCount,
                "keywords", plan.keywords().size(),
                "maxPages", plan.maxPages(),
                "followPagination", plan.followPagination(),
                "cc", cc);

        // ---- 1) 도메인별 실행 ----
        List<DomainResult> results = (cc == 1)
                ? runSequential(entries, plan, startNanos)
                : runPooled(entries, plan, startNanos, cc);

        // ---- 2) 집계 ----
        int totalPages = results.stream().mapToInt(DomainResult::getPagesCrawled).sum();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        CrawlResult result = new CrawlResult(results, totalPages, elapsedMs,
                String.valueOf(wallClock.instant().getEpochSecond()));

        LOG.info("Crawl done. domains={}, totalPages={}, failed={}, elapsedMs={}",
                results.size(), totalPages, result.failedDomains(), elapsedMs);
        SLOG.info("crawl-done",
                "domains", results.size(),
                "totalPages", totalPages,
                "failed", (int) result.failedDomains(),
                "elapsedMs", elapsedMs);
        return result;
    }

    private List<DomainResult> runSequential(List<UrlEntry> entries, CrawlPlan plan, long startNanos) {
        List<DomainResult> out = new ArrayList<>(entries.size());
        for (UrlEntry e : entries) out.add(crawlEntry(e, plan, startNanos));
        return out;
    }

    private List<DomainResult> runPooled(List<UrlEntry> entries, CrawlPlan plan, long startNanos, int cc) {
        ExecutorService exec = new ThreadPoolExecutor(
                cc, cc,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("crawl-worker"));

        List<Future<DomainResult>> futures = new ArrayList<>(entries.size());
        try {
            for (UrlEntry e : entries) {
                futures.add(exec.submit(() -> crawlEntry(e, plan, startNanos)));
            }

            List<DomainResult> out = new ArrayList<>(entries.size());
            for (int i = 0; i < futures.size(); i++) {
                UrlEntry e = entries.get(i);
                try {
                    out.add(futures.get(i).get());
                } catch (ExecutionException ex) {
                    Throwable cause = (ex.getCause() != null) ? ex.getCause() : ex;
                    LOG.warn("Domain task failed: {}", cause.toString());
                    out.add(DomainResult.failed(displayUrl(e), CrawlException.other(cause.toString()).getMessage()));
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new CancellationException("Interrupted while collecting domain results");
                }
            }
            return out;
        } finally {
            exec.shutdownNow();
            try {
                exec.awaitTermination(30, TimeUnit.SECONDS);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
    }

    /** 도메인 경계: 여기서 모든 도메인 단위 실패를 DomainResult 로 바꾼다 */
    private DomainResult crawlEntry(UrlEntry entry, CrawlPlan plan, long startNanos) {
        if (!entry.isValid()) {
            String msg = "Failed to parse URL '" + entry.raw() + "': " + entry.error();
            warnings.onWarning("url-skipped", msg);
            SLOG.warn("url-skipped", "raw", entry.raw(), "reason", entry.error());
            return DomainResult.failed(displayUrl(entry), CrawlException.invalidUrl(entry.raw() + " (" + entry.error() + ")").getMessage());
        }
        URI seed = entry.uri();
        try {
            DomainResult r = domainCrawler.crawl(seed, plan, startNanos);
            SLOG.info("domain-done",
                    "url", seed.toString(),
                    "pages", r.getPagesCrawled(),
                    "matches", r.getMatches().size(),
                    "hasMore", r.isHasMorePages(),
                    "error", r.getError());
            return r;
        } catch (CrawlException e) {
            LOG.warn("Domain crawl failed for {}: {}", seed, e.getMessage());
            SLOG.error("domain-failed", e, "url", seed.toString(), "kind", e.getKind().name());
            return DomainResult.failed(seed.toString(), e.getMessage());
        } catch (RuntimeException e) {
            LOG.warn("Unexpected failure crawling {}", seed, e);
            SLOG.error("domain-failed", e, "url", seed.toString(), "kind", CrawlException.Kind.OTHER.name());
            return DomainResult.failed(seed.toString(), CrawlException.other(e.toString()).getMessage());
        }
    }

    private static String displayUrl(UrlEntry e) {
        return e.isValid() ? e.uri().toString() : UrlUtils.withDefaultScheme(e.raw());
    }

    /** 남은 발행 작업을 정리한다 */
    @Override
    public void close() {
        dispatcher.close();
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
