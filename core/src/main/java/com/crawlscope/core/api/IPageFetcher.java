package com.crawlscope.core.api;

import com.crawlscope.core.error.CrawlException;
import com.crawlscope.core.model.FetchedPage;

import java.net.URI;
import java.time.Duration;

/** HTTP GET 최소 계약. 전송 실패는 REQUEST 종류의 CrawlException 으로 알린다. */
@FunctionalInterface
public interface IPageFetcher {
    FetchedPage fetch(URI url, Duration timeout) throws CrawlException;
}
