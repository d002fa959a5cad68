package com.crawlscope.core.crawler;

import org.jsoup.nodes.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class PageExtractorTest {

    private final PageExtractor extractor = new PageExtractor();
    private static final URI LIST = URI.create("https://shop.example/list?page=1");

    @Nested
    @DisplayName("날짜 메타")
    class Dates {

        @Test
        void meta_property_and_name_are_case_insensitive() {
            String html = "<head>"
                    + "<meta property=\"Article:Modified_Time\" content=\"2024-05-01T00:00:00Z\">"
                    + "<meta name=\"DATE\" content=\"2024-04-01\">"
                    + "</head>";
            PageExtractor.PageDates d = extractor.extractDates(html);
            assertEquals("2024-05-01T00:00:00Z", d.lastModified());
            assertEquals("2024-04-01", d.published());
            assertThat(d.candidates()).containsExactly("2024-05-01T00:00:00Z", "2024-04-01");
        }

        @Test
        void first_match_wins_and_blank_content_ignored() {
            String html = "<head>"
                    + "<meta name=\"last-modified\" content=\"  \">"
                    + "<meta name=\"date-modified\" content=\"2024-02-02\">"
                    + "<meta name=\"last-modified\" content=\"2024-03-03\">"
                    + "<meta property=\"article:published_time\" content=\"2024-01-01\">"
                    + "</head>";
            PageExtractor.PageDates d = extractor.extractDates(html);
            assertEquals("2024-02-02", d.lastModified());
            assertEquals("2024-01-01", d.published());
        }

        @Test
        void time_element_is_published_fallback() {
            PageExtractor.PageDates d = extractor.extractDates(
                    "<body><time>no attr</time><time datetime=\"2023-09-09\">Sep 9</time></body>");
            assertNull(d.lastModified());
            assertEquals("2023-09-09", d.published());
        }

        @Test
        void no_dates() {
            PageExtractor.PageDates d = extractor.extractDates("<p>plain</p>");
            assertThat(d.candidates()).isEmpty();
        }
    }

    @Nested
    @DisplayName("제목/본문")
    class TitleAndText {

        @Test
        void title_trimmed_or_empty() throws Exception {
            assertThat(extractor.extractTitle("<title>  Widgets  </title>")).contains("Widgets");
            assertThat(extractor.extractTitle("<title>   </title>")).isEmpty();
            assertThat(extractor.extractTitle("<p>none</p>")).isEmpty();
        }

        @Test
        void cleanText_delegates_block_text() {
            assertEquals("a\nb", extractor.cleanText("<p>a</p><p>b</p>"));
        }

        @Test
        void cleanText_on_parsed_document_matches_raw_html() {
            String html = "<html><head><title>T</title><script>x()</script></head>"
                    + "<body><h1>Head</h1><p>one<br>two</p><ul><li>a</li><li>b</li></ul></body></html>";
            Document doc = extractor.parse(html, LIST);
            assertEquals(extractor.cleanText(html), extractor.cleanText(doc));
            assertEquals("Head\none\ntwo\na\nb", extractor.cleanText(doc));
        }
    }

    @Nested
    @DisplayName("다음 페이지")
    class NextPage {

        @Test
        void relative_href_resolves_against_current_url() {
            Optional<URI> next = extractor.findNextPageUrl("<a class=\"next\" href=\"/list?page=2\">more</a>", LIST);
            assertThat(next).contains(URI.create("https://shop.example/list?page=2"));
        }

        @Test
        void rule_priority_prefers_a_next_over_later_rules() {
            String html = "<a class=\"pagination-next\" href=\"/b\">b</a><a class=\"next\" href=\"/a\">a</a>";
            assertThat(extractor.findNextPageUrl(html, LIST)).contains(URI.create("https://shop.example/a"));
        }

        @Test
        void rel_next_token() {
            String html = "<a href=\"/x\">x</a><a rel=\"nofollow next\" href=\"/p2\">2</a>";
            assertThat(extractor.findNextPageUrl(html, LIST)).contains(URI.create("https://shop.example/p2"));
        }

        @Test
        void rel_next_wins_over_class_names() {
            String html = "<a class=\"next\" href=\"/by-class\">more</a><a rel=\"next\" href=\"/by-rel\">2</a>";
            assertThat(extractor.findNextPageUrl(html, LIST)).contains(URI.create("https://shop.example/by-rel"));
        }

        @Test
        void aria_label_wins_over_last_pagination_anchor() {
            String html = "<div class=\"pagination\"><a href=\"/1\">1</a>"
                    + "<a aria-label=\"Next\" href=\"/2\">›</a><a href=\"/9\">Last</a></div>";
            assertThat(extractor.findNextPageUrl(html, LIST)).contains(URI.create("https://shop.example/2"));
        }

        @Test
        void anchor_text_next_or_raquo() {
            assertThat(extractor.findNextPageUrl("<a href=\"/n\">Next page</a>", LIST))
                    .contains(URI.create("https://shop.example/n"));
            assertThat(extractor.findNextPageUrl("<a href=\"/r\">»</a>", LIST))
                    .contains(URI.create("https://shop.example/r"));
        }

        @Test
        void pagination_container_last_anchor() {
            String html = "<div class=\"pagination\"><a href=\"/1\">1</a><a href=\"/2\">2</a><a href=\"/3\">3</a></div>";
            assertThat(extractor.findNextPageUrl(html, LIST)).contains(URI.create("https://shop.example/3"));
        }

        @Test
        void aria_label_next() {
            String html = "<nav class=\"pagination\"><a aria-label=\"Previous\" href=\"/0\">‹</a>"
                    + "<a aria-label=\"Next\" href=\"/9\">›</a></nav>";
            assertThat(extractor.findNextPageUrl(html, LIST)).contains(URI.create("https://shop.example/9"));
        }

        @Test
        void non_http_href_falls_through_to_next_rule() {
            String html = "<a class=\"next\" href=\"javascript:void(0)\">x</a><li class=\"next\"><a href=\"/ok\">ok</a></li>";
            assertThat(extractor.findNextPageUrl(html, LIST)).contains(URI.create("https://shop.example/ok"));
        }

        @Test
        void none_found() {
            assertThat(extractor.findNextPageUrl("<a href=\"/about\">About</a>", LIST)).isEmpty();
            assertThat(extractor.findNextPageUrl("<a class=\"next\">no href</a>", LIST)).isEmpty();
        }
    }
}
