package com.crawlscope.core.crawler;

import com.crawlscope.core.error.CrawlException;
import com.crawlscope.core.model.KeywordMatch;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;

class KeywordScorerTest {

    private static String pad(String head, int length) {
        StringBuilder sb = new StringBuilder(head);
        while (sb.length() < length) sb.append('.');
        return sb.toString();
    }

    @Test
    void findMatches_is_case_insensitive_and_non_overlapping() {
        KeywordScorer.Occurrences occ = KeywordScorer.findMatches("Widget and WIDGET and widgetwidget", "widget");
        assertEquals(4, occ.count());

        assertEquals(2, KeywordScorer.findMatches("aaaa", "aa").count());
        assertEquals(1, KeywordScorer.findMatches("aaa", "aa").count());
    }

    @Test
    void keyword_is_trimmed_and_blank_never_matches() {
        assertEquals(1, KeywordScorer.findMatches("a widget here", "  widget ").count());
        assertEquals(0, KeywordScorer.findMatches("anything", "   ").count());
        assertEquals(0, KeywordScorer.findMatches("anything", "").count());
    }

    @Test
    void context_window_is_fifty_chars_each_side_clamped() {
        String before = "b".repeat(80);
        String after = "a".repeat(80);
        String content = before + "KEY" + after;

        KeywordScorer.Occurrences occ = KeywordScorer.findMatches(content, "key");
        assertThat(occ.contexts()).containsExactly("b".repeat(50) + "KEY" + "a".repeat(50));

        KeywordScorer.Occurrences edge = KeywordScorer.findMatches("KEY tail", "key");
        assertThat(edge.contexts()).containsExactly("KEY tail");
    }

    @Test
    void contexts_are_joined_with_separator() {
        String content = "x" + " ".repeat(120) + "x";
        KeywordScorer.Occurrences occ = KeywordScorer.findMatches(content, "x");
        assertThat(occ.joinedContext()).contains(KeywordScorer.CONTEXT_SEPARATOR);
        assertThat(occ.contexts()).hasSize(2);
    }

    @Test
    void score_matches_formula() {
        // 100자 중 1회 + 앞 1/3 보너스 → (1.0*0.7 + 0.3) * 10
        assertThat(KeywordScorer.score("widget", pad("widget", 100))).isCloseTo(10.0, within(1e-9));
        // 뒤쪽에만 있으면 보너스 없음
        String tailOnly = ".".repeat(94) + "widget";
        assertThat(KeywordScorer.score("widget", tailOnly)).isCloseTo(7.0, within(1e-9));
    }

    @Test
    void score_zero_without_occurrences_and_capped_at_hundred() {
        assertThat(KeywordScorer.score("widget", "nothing to see")).isZero();
        assertThat(KeywordScorer.score("widget", "")).isZero();
        assertThat(KeywordScorer.score("ab", "ab".repeat(50))).isEqualTo(100.0);
    }

    @Test
    void score_is_monotonic_in_density() {
        double previous = -1;
        for (int n = 1; n <= 8; n++) {
            String ctx = pad("kw ".repeat(n), 200);
            double s = KeywordScorer.score("kw", ctx);
            assertThat(s).isGreaterThan(previous);
            assertThat(s).isBetween(0.0, 100.0);
            previous = s;
        }
    }

    @Test
    void scanPage_skips_absent_keywords_and_keeps_order() throws Exception {
        List<KeywordMatch> sink = new ArrayList<>();
        KeywordScorer.scanPage("<p>alpha beta alpha</p>", List.of("alpha", "gamma", "beta"),
                "https://ex.com/", () -> false, sink);

        assertThat(sink).extracting(KeywordMatch::keyword).containsExactly("alpha", "beta");
        KeywordMatch alpha = sink.get(0);
        assertEquals(2, alpha.count());
        assertEquals("https://ex.com/", alpha.sourceUrl());
        assertThat(alpha.cleanedText()).doesNotContain("<p>");
        assertThat(alpha.relevanceScore()).isBetween(0.0, 100.0);
    }

    @Test
    void scanPage_timeout_before_keyword_adds_nothing() {
        List<KeywordMatch> sink = new ArrayList<>();
        assertThatThrownBy(() -> KeywordScorer.scanPage("alpha", List.of("alpha"), "u", () -> true, sink))
                .isInstanceOf(CrawlException.class)
                .hasMessage("Timeout error: Crawling exceeded the time limit");
        assertThat(sink).isEmpty();
    }

    @Test
    void scanPage_timeout_mid_occurrences_appends_truncated_match_first() {
        AtomicInteger calls = new AtomicInteger();
        // 첫 호출(키워드 진입)은 통과, 출현 순회에서 만료
        List<KeywordMatch> sink = new ArrayList<>();
        assertThatThrownBy(() -> KeywordScorer.scanPage("alpha alpha alpha", List.of("alpha"), "u",
                () -> calls.incrementAndGet() > 1, sink))
                .isInstanceOf(CrawlException.class)
                .extracting(e -> ((CrawlException) e).getKind())
                .isEqualTo(CrawlException.Kind.TIMEOUT);

        assertThat(sink).hasSize(1);
        KeywordMatch m = sink.get(0);
        assertEquals(KeywordScorer.TRUNCATED_CONTEXT, m.context());
        assertEquals(3, m.count());
        assertThat(m.relevanceScore()).isZero();
    }
}
