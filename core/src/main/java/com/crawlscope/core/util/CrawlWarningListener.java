package com.crawlscope.core.util;

import org.slf4j.LoggerFactory;

/**
 * 요청을 중단시키지 않는 경고 채널 (예: 파싱 불가 URL 건너뜀).
 * 오케스트레이터에 주입한다.
 */
@FunctionalInterface
public interface CrawlWarningListener {
    /**
     * @param code   "url-skipped" 등 짧은 식별자
     * @param detail 사람이 읽을 설명
     */
    void onWarning(String code, String detail);

    CrawlWarningListener NONE = (code, detail) -> {};

    /** 기본: SLF4J warn 으로 기록 */
    CrawlWarningListener LOGGING = (code, detail) ->
            LoggerFactory.getLogger(CrawlWarningListener.class).warn("[{}] {}", code, detail);
}
