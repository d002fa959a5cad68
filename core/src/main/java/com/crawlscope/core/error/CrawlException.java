package com.crawlscope.core.error;

import java.util.Objects;

/**
 * 크롤 코어의 단일 예외 타입. 종류(Kind)로 원인을 구분한다.
 * - 요청 단위 검증 실패(날짜/URL 목록/키워드)는 도메인 시작 전에 던진다.
 * - 도메인 단위 실패는 오케스트레이터가 DomainResult.error 로 변환한다.
 */
public class CrawlException extends Exception {

    public enum Kind {
        REQUEST("Request error", 400),
        URL("Invalid URL", 400),
        SELECTOR("Selector error", 400),
        TIMEOUT("Timeout error", 200),
        DATE_PARSING("Date parsing error", 400),
        OTHER("Other error", 400);

        private final String label;
        private final int httpStatus;

        Kind(String label, int httpStatus) {
            this.label = label;
            this.httpStatus = httpStatus;
        }

        public String label() { return label; }

        /** 라우팅 계층이 이 종류에 대해 돌려주던 HTTP 상태 코드 */
        public int httpStatus() { return httpStatus; }
    }

    public static final String TIME_LIMIT_MESSAGE = "Crawling exceeded the time limit";

    private final Kind kind;

    public CrawlException(Kind kind, String detail) {
        this(kind, detail, null);
    }

    public CrawlException(Kind kind, String detail, Throwable cause) {
        super(Objects.requireNonNull(kind, "kind").label() + ": " + detail, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }

    // ---------- factories ----------
    public static CrawlException request(String detail, Throwable cause) {
        return new CrawlException(Kind.REQUEST, detail, cause);
    }

    public static CrawlException invalidUrl(String detail) {
        return new CrawlException(Kind.URL, detail);
    }

    public static CrawlException selector(String detail, Throwable cause) {
        return new CrawlException(Kind.SELECTOR, detail, cause);
    }

    public static CrawlException timeout() {
        return new CrawlException(Kind.TIMEOUT, TIME_LIMIT_MESSAGE);
    }

    public static CrawlException dateParsing(String detail) {
        return new CrawlException(Kind.DATE_PARSING, detail);
    }

    public static CrawlException other(String detail) {
        return new CrawlException(Kind.OTHER, detail);
    }
}
