package com.crawlscope.core.crawler;

import com.crawlscope.core.error.CrawlException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DateFilterTest {

    private static final LocalDate JAN_1 = LocalDate.of(2024, 1, 1);
    private static final LocalDate DEC_31 = LocalDate.of(2024, 12, 31);

    @Nested
    @DisplayName("요청 경계 파싱/범위 검증")
    class Bounds {

        @Test
        void validateRange_accepts_from_before_or_equal_to() throws Exception {
            DateFilter.Range r = DateFilter.validateRange("2024-01-01", "2024-12-31");
            assertThat(r.from()).isEqualTo(JAN_1);
            assertThat(r.to()).isEqualTo(DEC_31);

            DateFilter.Range same = DateFilter.validateRange("2024-03-03", "2024-03-03");
            assertThat(same.from()).isEqualTo(same.to());
        }

        @Test
        void validateRange_rejects_inverted_range() {
            assertThatThrownBy(() -> DateFilter.validateRange("2024-12-31", "2024-01-01"))
                    .isInstanceOf(CrawlException.class)
                    .hasMessage("Date parsing error: date_from cannot be after date_to")
                    .extracting(e -> ((CrawlException) e).getKind())
                    .isEqualTo(CrawlException.Kind.DATE_PARSING);
        }

        @Test
        void validateRange_absent_bounds_are_open() throws Exception {
            assertThat(DateFilter.validateRange(null, null).isUnbounded()).isTrue();
            DateFilter.Range onlyTo = DateFilter.validateRange("", "2024-05-05");
            assertThat(onlyTo.from()).isNull();
            assertThat(onlyTo.to()).isEqualTo(LocalDate.of(2024, 5, 5));
        }

        @Test
        void parseBound_is_strict_about_calendar() {
            assertThatThrownBy(() -> DateFilter.parseBound("2024-02-30"))
                    .isInstanceOf(CrawlException.class)
                    .hasMessageStartingWith("Date parsing error: Invalid date format '2024-02-30'");
            assertThatThrownBy(() -> DateFilter.parseBound("2024/01/01"))
                    .isInstanceOf(CrawlException.class);
        }
    }

    @Nested
    @DisplayName("페이지 날짜 형식")
    class PageDates {

        @Test
        void parses_all_supported_formats() {
            assertThat(DateFilter.parsePageDate("2024-06-01T10:15:30Z")).contains(LocalDate.of(2024, 6, 1));
            assertThat(DateFilter.parsePageDate("2024-06-01T23:30:00-05:00")).contains(LocalDate.of(2024, 6, 1));
            assertThat(DateFilter.parsePageDate("2024-06-01")).contains(LocalDate.of(2024, 6, 1));
            assertThat(DateFilter.parsePageDate("2024/06/01")).contains(LocalDate.of(2024, 6, 1));
            assertThat(DateFilter.parsePageDate("06/01/2024")).contains(LocalDate.of(2024, 6, 1));
        }

        @Test
        void unrecognized_text_is_empty_or_fails() {
            assertThat(DateFilter.parsePageDate("June 1st")).isEmpty();
            assertThat(DateFilter.parsePageDate("  ")).isEmpty();
            assertThat(DateFilter.parsePageDate(null)).isEmpty();
            assertThatThrownBy(() -> DateFilter.parseDate("yesterday"))
                    .isInstanceOf(CrawlException.class)
                    .hasMessageContaining("yesterday");
        }
    }

    @Nested
    @DisplayName("포함 여부")
    class Matching {

        @Test
        void date_inside_range_matches() {
            assertThat(DateFilter.matches(List.of("2024-06-01"), JAN_1, DEC_31)).isTrue();
        }

        @Test
        void date_outside_range_does_not_match() {
            assertThat(DateFilter.matches(List.of("2023-06-01"), JAN_1, DEC_31)).isFalse();
            assertThat(DateFilter.matches(List.of("2025-01-01"), JAN_1, DEC_31)).isFalse();
        }

        @Test
        void any_parseable_date_in_range_is_enough() {
            assertThat(DateFilter.matches(List.of("2023-01-01", "2024-02-02"), JAN_1, DEC_31)).isTrue();
        }

        @Test
        void no_parseable_date_is_included() {
            assertThat(DateFilter.matches(List.of("not a date"), JAN_1, DEC_31)).isTrue();
            assertThat(DateFilter.matches(List.of(), JAN_1, DEC_31)).isTrue();
            assertThat(DateFilter.matches(Arrays.asList((String) null), JAN_1, DEC_31)).isTrue();
        }

        @Test
        void unparseable_candidates_are_ignored_next_to_parseable_ones() {
            assertThat(DateFilter.matches(List.of("garbage", "2023-01-01"), JAN_1, DEC_31)).isFalse();
        }

        @Test
        void no_bounds_always_matches() {
            assertThat(DateFilter.matches(List.of("1999-01-01"), null, null)).isTrue();
            assertThat(DateFilter.matches(List.of("1999-01-01"), DateFilter.Range.UNBOUNDED)).isTrue();
        }

        @Test
        void open_ended_bounds() {
            assertThat(DateFilter.matches(List.of("2030-01-01"), JAN_1, null)).isTrue();
            assertThat(DateFilter.matches(List.of("2020-01-01"), JAN_1, null)).isFalse();
            assertThat(DateFilter.matches(List.of("2020-01-01"), null, DEC_31)).isTrue();
        }

        @Test
        void bounds_are_inclusive() {
            assertThat(DateFilter.matches(List.of("2024-01-01"), JAN_1, DEC_31)).isTrue();
            assertThat(DateFilter.matches(List.of("12/31/2024"), JAN_1, DEC_31)).isTrue();
        }
    }
}
