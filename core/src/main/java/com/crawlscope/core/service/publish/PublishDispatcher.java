package com.crawlscope.core.service.publish;

import com.crawlscope.core.api.IResultPublisher;
import com.crawlscope.core.model.CrawlResult;
import com.crawlscope.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * 크롤 결과를 발행자들에게 넘기는 단일 데몬 스레드.
 * - dispatch() 는 즉시 반환 (크롤 응답을 막지 않음)
 * - 발행자 하나의 실패는 로그만 남기고 다음 발행자로 진행
 * - close() 는 대기 중인 작업을 제한 시간 안에서 비운다
 */
public final class PublishDispatcher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(PublishDispatcher.class);
    private static final StructuredLog SLOG = StructuredLog.get(PublishDispatcher.class);

    static final long DRAIN_TIMEOUT_SECONDS = 10;

    private final List<IResultPublisher> publishers;
    private final ExecutorService exec;

    public PublishDispatcher(List<IResultPublisher> publishers) {
        this.publishers = List.copyOf(publishers);
        this.exec = this.publishers.isEmpty() ? null : Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "crawl-publish");
            t.setDaemon(true);
            return t;
        });
    }

    public boolean isEnabled() { return exec != null; }

    /** 발행 예약. 발행자가 없거나 이미 닫혔으면 아무 것도 하지 않는다. */
    public void dispatch(CrawlResult result) {
        if (exec == null || result == null) return;
        try {
            exec.execute(() -> publishAll(result));
        } catch (RejectedExecutionException e) {
            LOG.warn("Publish skipped (dispatcher closed): {} domains", result.results().size());
        }
    }

    /** 동기 발행: 호출 스레드에서 바로 수행 */
    public void publishAll(CrawlResult result) {
        for (IResultPublisher p : publishers) {
            try {
                p.publish(result);
                SLOG.info("result-published", "publisher", p.name(), "domains", result.results().size());
            } catch (Exception e) {
                LOG.warn("Publisher {} failed: {}", p.name(), e.toString());
                SLOG.error("publish-failed", e, "publisher", p.name());
            }
        }
    }

    @Override
    public void close() {
        if (exec != null) {
            exec.shutdown();
            try {
                if (!exec.awaitTermination(DRAIN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                    LOG.warn("Publish queue not drained within {}s; dropping pending results", DRAIN_TIMEOUT_SECONDS);
                    exec.shutdownNow();
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                exec.shutdownNow();
            }
        }
        for (IResultPublisher p : publishers) {
            try {
                p.close();
            } catch (Exception e) {
                LOG.warn("Publisher {} close failed: {}", p.name(), e.toString());
            }
        }
    }
}
