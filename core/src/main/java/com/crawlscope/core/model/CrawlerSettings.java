package com.crawlscope.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * 프로세스 단위 크롤러 설정 (crawler.yml 매핑 대상).
 * 요청 단위 값(maxPages 등)은 CrawlRequest 가 우선하고, 여기 defaults 는 비어 있을 때만 쓴다.
 */
public final class CrawlerSettings {

    /** 요청에 값이 없을 때 쓰는 기본 예산: YAML `defaults:` 섹션 */
    public static final class Defaults {
        private int maxPages = CrawlRequest.DEFAULT_MAX_PAGES;
        /** 0이면 시간 예산 없음 */
        private long maxTimeSeconds = 0;

        public int getMaxPages() { return maxPages; }
        public Defaults setMaxPages(int v) { this.maxPages = v; return this; }

        public long getMaxTimeSeconds() { return maxTimeSeconds; }
        public Defaults setMaxTimeSeconds(long v) { this.maxTimeSeconds = v; return this; }
    }

    /** 결과 발행: YAML `publish:` 섹션 */
    public static final class Publish {
        private boolean enabled = false;
        private Path jsonLines = Path.of("out", "crawl-results.jsonl");

        public boolean isEnabled() { return enabled; }
        public Publish setEnabled(boolean v) { this.enabled = v; return this; }

        public Path getJsonLines() { return jsonLines; }
        public Publish setJsonLines(Path p) { this.jsonLines = p; return this; }
    }

    private String userAgent = "CrawlScope/0.3 (+keyword-crawler)";
    private Duration timeout = Duration.ofSeconds(15);   // 페이지당 요청 타임아웃
    private boolean followRedirects = true;
    private int concurrency = 1;                          // 1 = 도메인 순차 처리

    private final Defaults defaults = new Defaults();
    private final Publish publish = new Publish();

    // ---------- getters ----------
    public String getUserAgent() { return userAgent; }
    public Duration getTimeout() { return timeout; }
    public boolean isFollowRedirects() { return followRedirects; }
    public int getConcurrency() { return concurrency; }
    public Defaults defaults() { return defaults; }
    public Publish publish() { return publish; }

    // ---------- fluent setters ----------
    public CrawlerSettings setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public CrawlerSettings setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CrawlerSettings setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public CrawlerSettings setConcurrency(int concurrency) { this.concurrency = Math.max(1, concurrency); return this; }

    public CrawlerSettings setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        if (userAgent == null || userAgent.isBlank()) throw new IllegalArgumentException("userAgent must not be blank");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be >= 1");
        if (defaults.getMaxPages() < 1) throw new IllegalArgumentException("defaults.maxPages must be >= 1");
        if (defaults.getMaxTimeSeconds() < 0) throw new IllegalArgumentException("defaults.maxTimeSeconds must be >= 0");
        if (publish.isEnabled()) Objects.requireNonNull(publish.getJsonLines(), "publish.jsonLines");
    }

    public static CrawlerSettings defaultSettings() { return new CrawlerSettings(); }
}
