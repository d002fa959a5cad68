package com.crawlscope.core.crawler;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeFilter;
import org.jsoup.select.NodeTraversor;

import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/** HTML → 블록 구조를 살린 평문 */
public final class HtmlText {

    private static final Set<String> SKIP = Set.of("script", "style", "noscript", "template", "head");
    private static final Pattern MANY_NEWLINES = Pattern.compile("\n{3,}");

    private HtmlText() {}

    public static String clean(String html) {
        if (html == null || html.isBlank()) return "";
        return clean(Jsoup.parse(html).body());
    }

    /** 이미 파싱된 요소(보통 body) 기준 */
    public static String clean(Element root) {
        if (root == null) return "";

        StringBuilder sb = new StringBuilder();
        NodeTraversor.filter(new BlockTextFilter(sb), root);

        String joined = sb.toString().lines()
                .map(String::trim)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.joining("\n"));
        return MANY_NEWLINES.matcher(joined).replaceAll("\n\n").trim();
    }

    private static final class BlockTextFilter implements NodeFilter {
        private final StringBuilder out;

        BlockTextFilter(StringBuilder out) { this.out = out; }

        @Override
        public FilterResult head(Node node, int depth) {
            if (node instanceof TextNode t) {
                out.append(t.text());
            } else if (node instanceof Element el) {
                String tag = el.normalName();
                if (SKIP.contains(tag)) return FilterResult.SKIP_ENTIRELY;
                if (tag.equals("br") || el.isBlock()) out.append('\n');
            }
            return FilterResult.CONTINUE;
        }

        @Override
        public FilterResult tail(Node node, int depth) {
            if (node instanceof Element el && el.isBlock()) out.append('\n');
            return FilterResult.CONTINUE;
        }
    }
}
