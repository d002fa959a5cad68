package com.crawlscope.core.crawler;

import com.crawlscope.core.api.IPageFetcher;
import com.crawlscope.core.error.CrawlException;
import com.crawlscope.core.model.CrawlMetadata;
import com.crawlscope.core.model.DomainResult;
import com.crawlscope.core.model.FetchedPage;
import com.crawlscope.core.util.StructuredLog;
import org.jsoup.nodes.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * 도메인 하나에 대한 fetch → extract → 날짜 필터 → 키워드 → 페이지네이션 루프.
 * - 매 fetch 전에 시간/페이지/깊이 예산 확인. 걸리면 hasMorePages=true 로 종료
 * - 방문한 URL 로 돌아가는 "다음" 링크는 루프로 보고 종료
 * - 전송 실패는 재시도 없이 예외로 올린다(오케스트레이터가 도메인 오류로 기록)
 * - 키워드 스캔 중 시간 초과는 부분 결과 + error 로 돌려준다
 */
public class DomainCrawler {

    private static final Logger LOG = LoggerFactory.getLogger(DomainCrawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(DomainCrawler.class);

    public static final String PAGE_SEPARATOR = "\n\n--- Next Page ---\n\n";

    private final IPageFetcher fetcher;
    private final PageExtractor extractor;
    private final LongSupplier nanoClock;
    private final Clock wallClock;

    public DomainCrawler(IPageFetcher fetcher) {
        this(fetcher, new PageExtractor(), System::nanoTime, Clock.systemUTC());
    }

    /** 테스트용: 시계 주입 */
    public DomainCrawler(IPageFetcher fetcher, PageExtractor extractor, LongSupplier nanoClock, Clock wallClock) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * @param requestStartNanos 요청 전체 시작 시각(메타데이터 처리 시간 기준)
     */
    public DomainResult crawl(URI seed, CrawlPlan plan, long requestStartNanos) throws CrawlException {
        Objects.requireNonNull(seed, "seed");
        Objects.requireNonNull(plan, "plan");

        DomainCrawlState state = new DomainCrawlState(seed);
        CrawlBudget budget = new CrawlBudget(plan.timeLimit(), plan.maxPages(), plan.maxDepth(), nanoClock);

        try {
            while (true) {
                if (budgetHit(state, budget)) {
                    state.markMorePages();
                    break;
                }

                URI current = state.currentUrl();
                FetchedPage page = fetcher.fetch(current, budget.remainingTime());
                if (!page.isSuccess()) {
                    LOG.warn("Non-2xx response {} for {} (body still processed)", page.getStatusCode(), current);
                }

                Document doc = extractor.parse(page.getBody(), current);
                PageExtractor.PageDates dates = extractor.extractDates(doc);
                state.recordDates(dates);

                if (!DateFilter.matches(dates.candidates(), plan.dateRange())) {
                    state.countPage();
                    SLOG.debug("page-skipped-date", "url", current.toString(),
                            "lastModified", dates.lastModified(), "published", dates.published());
                } else {
                    if (!state.titleCaptured()) {
                        state.captureTitle(extractor.extractTitle(doc).orElse(null));
                    }
                    int before = state.matches().size();
                    try {
                        KeywordScorer.scanPage(page.getBody(), plan.keywords(), current.toString(),
                                budget::isTimeExpired, state.matches());
                    } catch (CrawlException e) {
                        // 이 페이지에서 이미 잡힌 매치가 있으면 페이지도 결과에 포함
                        if (e.getKind() == CrawlException.Kind.TIMEOUT && state.matches().size() > before) {
                            state.appendPage(extractor.cleanText(doc));
                            state.countPage();
                        }
                        throw e;
                    }
                    state.appendPage(extractor.cleanText(doc));
                    state.countPage();
                    SLOG.debug("page-fetched", "url", current.toString(), "status", page.getStatusCode(),
                            "pageNo", state.pagesCrawled(), "matches", state.matches().size());
                }

                if (!plan.followPagination()) break;

                Optional<URI> next = extractor.findNextPageUrl(doc, current);
                if (next.isEmpty()) break;
                if (!state.advanceTo(next.get())) {
                    LOG.debug("Pagination loop at {} -> {}", current, next.get());
                    break;
                }
            }
        } catch (CrawlException e) {
            if (e.getKind() != CrawlException.Kind.TIMEOUT) throw e;
            // 시간 초과: 그때까지의 결과는 살린다
            state.markMorePages();
            LOG.info("Time budget exhausted mid-scan for {} after {} page(s)", seed, state.pagesCrawled());
            return toResult(state, requestStartNanos, e.getMessage());
        }

        return toResult(state, requestStartNanos, null);
    }

    private static boolean budgetHit(DomainCrawlState state, CrawlBudget budget) {
        return budget.isTimeExpired()
                || budget.pagesExhausted(state.pagesCrawled())
                || budget.depthExceeded(state.depth());
    }

    private DomainResult toResult(DomainCrawlState state, long requestStartNanos, String error) {
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(nanoClock.getAsLong() - requestStartNanos);
        PageExtractor.PageDates dates = state.lastDates();
        CrawlMetadata metadata = new CrawlMetadata(
                String.valueOf(wallClock.instant().getEpochSecond()),
                elapsedMs,
                state.title(),
                dates.lastModified(),
                dates.published());

        return DomainResult.builder()
                .url(state.seed().toString())
                .title(state.title())
                .content(state.content())
                .matches(state.matches())
                .pagesCrawled(state.pagesCrawled())
                .hasMorePages(state.hasMorePages())
                .metadata(metadata)
                .error(error)
                .build();
    }
}
