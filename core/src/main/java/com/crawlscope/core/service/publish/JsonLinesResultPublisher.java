package com.crawlscope.core.service.publish;

import com.crawlscope.core.api.IResultPublisher;
import com.crawlscope.core.model.CrawlResult;
import com.crawlscope.core.util.JsonCodec;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * 결과 1건 = JSON 한 줄. 파일 끝에 덧붙인다(부모 디렉터리 자동 생성).
 * 여러 스레드에서 호출돼도 줄 단위로 섞이지 않도록 동기화.
 */
public final class JsonLinesResultPublisher implements IResultPublisher {

    private final Path target;

    public JsonLinesResultPublisher(Path target) {
        this.target = Objects.requireNonNull(target, "target").toAbsolutePath().normalize();
    }

    @Override
    public String name() { return "jsonl:" + target.getFileName(); }

    @Override
    public synchronized void publish(CrawlResult result) throws IOException {
        Objects.requireNonNull(result, "result");
        Path parent = target.getParent();
        if (parent != null) Files.createDirectories(parent);

        String line = JsonCodec.mapper().writeValueAsString(result);
        try (Writer w = Files.newBufferedWriter(target, StandardCharsets.UTF_8,
                StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE)) {
            w.write(line);
            w.write('\n');
        }
    }
}
