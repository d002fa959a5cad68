package com.crawlscope.core.crawler;

import com.crawlscope.core.error.CrawlException;
import com.crawlscope.core.model.KeywordMatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.BooleanSupplier;

/**
 * 키워드 출현 탐색 + 문맥 창 + 관련도 점수.
 * 검색은 대소문자 무시, 겹치지 않는 부분 문자열 기준.
 */
public final class KeywordScorer {

    public static final int CONTEXT_RADIUS = 50;
    public static final String CONTEXT_SEPARATOR = "\n...\n";
    public static final String TRUNCATED_CONTEXT = "Time limit reached during processing";

    private KeywordScorer() {}

    public record Occurrences(int count, List<String> contexts) {
        public String joinedContext() { return String.join(CONTEXT_SEPARATOR, contexts); }
    }

    /** 출현 시작 위치들. 빈 키워드는 항상 빈 목록. */
    public static List<Integer> positions(String content, String keyword) {
        List<Integer> out = new ArrayList<>();
        if (content == null || keyword == null) return out;
        String kw = keyword.trim();
        if (kw.isEmpty()) return out;

        int last = content.length() - kw.length();
        int i = 0;
        while (i <= last) {
            if (content.regionMatches(true, i, kw, 0, kw.length())) {
                out.add(i);
                i += kw.length();
            } else {
                i++;
            }
        }
        return out;
    }

    /** 출현 위치 앞뒤 50자(경계에서 잘림) */
    public static String contextAt(String content, int pos, int keywordLength) {
        int start = Math.max(0, pos - CONTEXT_RADIUS);
        int end = Math.min(content.length(), pos + keywordLength + CONTEXT_RADIUS);
        return content.substring(start, end);
    }

    public static Occurrences findMatches(String content, String keyword) {
        List<Integer> pos = positions(content, keyword);
        int len = (keyword == null) ? 0 : keyword.trim().length();
        List<String> contexts = new ArrayList<>(pos.size());
        for (int p : pos) contexts.add(contextAt(content, p, len));
        return new Occurrences(pos.size(), contexts);
    }

    /**
     * 밀도(100자당 출현 수) x 0.7 + 앞 1/3 출현 보너스 0.3, 그 합 x 10 (상한 100).
     */
    public static double score(String keyword, String context) {
        if (context == null || context.isEmpty()) return 0.0;
        int count = positions(context, keyword).size();
        if (count == 0) return 0.0;

        double density = (count * 100.0) / context.length();
        String firstThird = context.substring(0, context.length() / 3).toLowerCase(Locale.ROOT);
        double positionBoost = firstThird.contains(keyword.trim().toLowerCase(Locale.ROOT)) ? 0.3 : 0.0;

        double score = (density * 0.7) + positionBoost;
        return Math.min(score * 10.0, 100.0);
    }

    /**
     * 한 페이지에 대해 모든 키워드를 훑어 sink 에 추가한다. 출현 0회 키워드는 건너뛴다.
     * 시간이 다 되면 TIMEOUT 예외. 출현 순회 중이었다면 잘린 표시 결과를 먼저 남긴다.
     */
    public static void scanPage(String content, List<String> keywords, String sourceUrl,
                                BooleanSupplier timeExpired, List<KeywordMatch> sink) throws CrawlException {
        for (String keyword : keywords) {
            if (timeExpired.getAsBoolean()) throw CrawlException.timeout();
            if (keyword == null || keyword.isBlank()) continue;

            List<Integer> pos = positions(content, keyword);
            if (pos.isEmpty()) continue;

            int len = keyword.trim().length();
            List<String> contexts = new ArrayList<>(pos.size());
            for (int p : pos) {
                if (timeExpired.getAsBoolean()) {
                    sink.add(new KeywordMatch(keyword, TRUNCATED_CONTEXT, TRUNCATED_CONTEXT,
                            pos.size(), 0.0, sourceUrl));
                    throw CrawlException.timeout();
                }
                contexts.add(contextAt(content, p, len));
            }

            String context = String.join(CONTEXT_SEPARATOR, contexts);
            sink.add(new KeywordMatch(keyword, context, HtmlText.clean(context),
                    pos.size(), score(keyword, context), sourceUrl));
        }
    }
}
