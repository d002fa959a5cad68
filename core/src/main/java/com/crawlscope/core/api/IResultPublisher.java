package com.crawlscope.core.api;

import com.crawlscope.core.model.CrawlResult;

/**
 * 크롤 완료 후 결과를 하위 시스템(큐/저장소/파일)으로 넘기는 지점.
 * 호출은 백그라운드에서 일어나며 예외는 호출자에게 전파되지 않는다.
 */
public interface IResultPublisher extends AutoCloseable {
    String name();
    void publish(CrawlResult result) throws Exception;
    @Override default void close() throws Exception {}
}
