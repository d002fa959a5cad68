package com.crawlscope.core.http;

import com.crawlscope.core.api.IPageFetcher;
import com.crawlscope.core.error.CrawlException;
import com.crawlscope.core.model.CrawlerSettings;
import com.crawlscope.core.model.FetchedPage;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * java.net.http 기반 페이지 수집기.
 * 재시도 없음: 전송 실패 한 번이면 해당 도메인 크롤이 끝난다.
 * 4xx/5xx 는 실패가 아니라 응답으로 돌려준다(본문은 그대로 처리).
 */
public class PageFetcher implements IPageFetcher {

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final CrawlerSettings settings;
    private final HttpSender sender;

    public PageFetcher(CrawlerSettings settings) {
        this(settings, clientSender(settings));
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public PageFetcher(CrawlerSettings settings, HttpSender sender) {
        this.settings = Objects.requireNonNull(settings, "settings");
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    private static HttpSender clientSender(CrawlerSettings settings) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(settings.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(settings.getTimeout())
                .build();
        return req -> client.send(req, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    }

    @Override
    public FetchedPage fetch(URI url, Duration timeout) throws CrawlException {
        Objects.requireNonNull(url, "url");
        Duration effective = effectiveTimeout(timeout);
        long start = System.nanoTime();
        try {
            HttpRequest req = HttpRequest.newBuilder(url)
                    .timeout(effective)
                    .header("User-Agent", settings.getUserAgent())
                    .header("Accept", "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8")
                    .GET()
                    .build();

            HttpResponse<String> resp = sender.send(req);
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            return FetchedPage.builder()
                    .url(url)
                    .statusCode(resp.statusCode())
                    .headers(resp.headers().map())
                    .body(resp.body())
                    .responseTimeMs(elapsedMs)
                    .build();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw CrawlException.request("interrupted while fetching " + url, ie);
        } catch (IOException | IllegalArgumentException e) {
            throw CrawlException.request(url + ": " + e, e);
        }
    }

    /** 설정 타임아웃과 남은 시간 예산 중 짧은 쪽. 최소 1ms. */
    Duration effectiveTimeout(Duration remaining) {
        Duration base = settings.getTimeout();
        if (remaining == null) return base;
        Duration d = remaining.compareTo(base) < 0 ? remaining : base;
        return (d.isNegative() || d.isZero()) ? Duration.ofMillis(1) : d;
    }
}
