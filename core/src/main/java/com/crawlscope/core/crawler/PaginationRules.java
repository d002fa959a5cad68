package com.crawlscope.core.crawler;

import com.crawlscope.core.util.UrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.net.URI;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * "다음 페이지" 링크 탐색 규칙. 고정 우선순위로 시도하고 처음 해석되는 절대 URL 을 쓴다.
 * 규칙이 요소를 찾았어도 href 가 http(s) 로 해석되지 않으면 다음 규칙으로 넘어간다.
 */
public final class PaginationRules {

    /** 이름 + 후보 요소 탐색 함수 */
    public record Rule(String name, Function<Document, Element> finder) {}

    private static final Pattern NEXT_WORD = Pattern.compile("(?i)\\bnext\\b");

    public static final List<Rule> DEFAULT = List.of(
            new Rule("a[rel=next]", d -> firstAnchor(d, a -> hasToken(a.attr("rel"), "next"))),
            new Rule("a.next", d -> d.selectFirst("a.next")),
            new Rule("a.pagination-next", d -> d.selectFirst("a.pagination-next")),
            new Rule("a.pagination__next", d -> d.selectFirst("a.pagination__next")),
            new Rule("li.next a", d -> d.selectFirst("li.next a")),
            new Rule("a:text(next)", d -> firstAnchor(d, a -> NEXT_WORD.matcher(a.text()).find())),
            new Rule("a:text(»)", d -> firstAnchor(d, a -> a.text().contains("»"))),
            new Rule(".pagination a[aria-label=Next]",
                    d -> first(d.select(".pagination a[aria-label]"), a -> a.attr("aria-label").trim().equalsIgnoreCase("next"))),
            new Rule("div.pagination a:last", d -> lastOf(d.select("div.pagination a")))
    );

    private PaginationRules() {}

    public static Optional<URI> findNext(Document doc, List<Rule> rules) {
        for (Rule rule : rules) {
            Element el = rule.finder().apply(doc);
            if (el == null || !el.hasAttr("href")) continue;
            URI next = UrlUtils.toHttpUri(el.absUrl("href"));
            if (next != null) return Optional.of(next);
        }
        return Optional.empty();
    }

    private static Element firstAnchor(Document d, Predicate<Element> p) {
        return first(d.select("a[href]"), p);
    }

    private static Element first(Elements els, Predicate<Element> p) {
        for (Element a : els) {
            if (p.test(a)) return a;
        }
        return null;
    }

    private static boolean hasToken(String attr, String token) {
        for (String t : attr.trim().split("\\s+")) {
            if (t.equalsIgnoreCase(token)) return true;
        }
        return false;
    }

    private static Element lastOf(Elements els) {
        return els.isEmpty() ? null : els.last();
    }
}
