package com.crawlscope.core.crawler;

import com.crawlscope.core.error.CrawlException;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 날짜 범위 필터.
 * - 요청 경계(date_from/date_to)는 YYYY-MM-DD 만 허용
 * - 페이지에서 뽑은 날짜는 RFC 3339 → YYYY-MM-DD → YYYY/MM/DD → MM/DD/YYYY 순서로 시도
 * - 파싱 가능한 날짜가 하나도 없는 페이지는 통과(제외하지 않음)
 */
public final class DateFilter {

    private static final DateTimeFormatter ISO_DATE =
            DateTimeFormatter.ofPattern("uuuu-MM-dd").withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter SLASH_YMD =
            DateTimeFormatter.ofPattern("uuuu/MM/dd").withResolverStyle(ResolverStyle.STRICT);
    private static final DateTimeFormatter SLASH_MDY =
            DateTimeFormatter.ofPattern("MM/dd/uuuu").withResolverStyle(ResolverStyle.STRICT);

    private DateFilter() {}

    /** 검증을 마친 요청 범위. 양쪽 다 null 이면 필터 없음. */
    public record Range(LocalDate from, LocalDate to) {
        public static final Range UNBOUNDED = new Range(null, null);

        public boolean isUnbounded() { return from == null && to == null; }

        public boolean contains(LocalDate d) {
            boolean afterFrom = (from == null) || !d.isBefore(from);
            boolean beforeTo = (to == null) || !d.isAfter(to);
            return afterFrom && beforeTo;
        }
    }

    /** 요청 경계용: YYYY-MM-DD 엄격 파싱 */
    public static LocalDate parseBound(String text) throws CrawlException {
        Objects.requireNonNull(text, "text");
        try {
            return LocalDate.parse(text.trim(), ISO_DATE);
        } catch (DateTimeParseException e) {
            throw CrawlException.dateParsing("Invalid date format '" + text + "': " + e.getMessage());
        }
    }

    /** 페이지 날짜용: 네 가지 형식 중 처음 성공한 것 */
    public static LocalDate parseDate(String text) throws CrawlException {
        return parsePageDate(text).orElseThrow(
                () -> CrawlException.dateParsing("Unrecognized date '" + text + "'"));
    }

    public static Optional<LocalDate> parsePageDate(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String s = text.trim();
        try {
            return Optional.of(OffsetDateTime.parse(s, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toLocalDate());
        } catch (DateTimeParseException ignore) {
            // 다음 형식
        }
        for (DateTimeFormatter f : List.of(ISO_DATE, SLASH_YMD, SLASH_MDY)) {
            try {
                return Optional.of(LocalDate.parse(s, f));
            } catch (DateTimeParseException ignore) {
                // 다음 형식
            }
        }
        return Optional.empty();
    }

    /** 둘 다 있으면 from <= to 이어야 한다 */
    public static Range validateRange(String from, String to) throws CrawlException {
        LocalDate f = (from == null || from.isBlank()) ? null : parseBound(from);
        LocalDate t = (to == null || to.isBlank()) ? null : parseBound(to);
        if (f != null && t != null && f.isAfter(t)) {
            throw CrawlException.dateParsing("date_from cannot be after date_to");
        }
        return new Range(f, t);
    }

    public static boolean matches(List<String> pageDates, Range range) {
        if (range == null || range.isUnbounded()) return true;

        boolean anyParsed = false;
        if (pageDates != null) {
            for (String raw : pageDates) {
                Optional<LocalDate> d = parsePageDate(raw);
                if (d.isEmpty()) continue;
                anyParsed = true;
                if (range.contains(d.get())) return true;
            }
        }
        // 날짜를 못 뽑은 페이지는 기본 포함
        return !anyParsed;
    }

    public static boolean matches(List<String> pageDates, LocalDate from, LocalDate to) {
        return matches(pageDates, new Range(from, to));
    }
}
