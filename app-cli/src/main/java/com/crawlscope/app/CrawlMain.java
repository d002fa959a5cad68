package com.crawlscope.app;

import com.crawlscope.app.logging.LogSetup;
import com.crawlscope.core.error.CrawlException;
import com.crawlscope.core.model.CrawlRequest;
import com.crawlscope.core.model.CrawlResult;
import com.crawlscope.core.model.CrawlerSettings;
import com.crawlscope.core.service.CrawlOrchestrator;
import com.crawlscope.core.util.JsonCodec;
import com.crawlscope.core.util.YamlSettingsLoader;
import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * 요청 JSON 하나를 실행하고 결과 JSON 을 출력한다.
 * 종료 코드: 0 = 성공(도메인별 에러 포함), 2 = 요청 검증 실패, 1 = 입출력/설정 실패
 */
@Command(
        name = "crawlscope",
        description = "Crawl the request's URLs and report keyword matches as JSON",
        mixinStandardHelpOptions = true,
        version = "crawlscope 0.3.0"
)
public final class CrawlMain implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(CrawlMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_IO = 1;
    static final int EXIT_INVALID = 2;

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", paramLabel = "REQUEST", description = "Crawl request JSON file")
    Path requestFile;

    @Option(names = {"-c", "--config"}, paramLabel = "YAML",
            description = "crawler.yml path (default: bundled settings)")
    Path config;

    @Option(names = {"-o", "--out"}, paramLabel = "FILE",
            description = "Write the result JSON here instead of stdout")
    Path out;

    @Option(names = "--log-dir", paramLabel = "DIR", defaultValue = "logs",
            description = "Rolling log directory (default: ${DEFAULT-VALUE})")
    Path logDir;

    @Option(names = "--log-level", paramLabel = "LEVEL",
            description = "JUL level override, e.g. FINE (default: -Dcs.log.level or INFO)")
    String logLevel;

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    static int execute(String... args) {
        return new CommandLine(new CrawlMain()).execute(args);
    }

    @Override
    public Integer call() {
        LogSetup.init(logDir);
        if (logLevel != null) LogSetup.setLevel(LogSetup.levelOf(logLevel));
        PrintWriter stdout = spec.commandLine().getOut();
        PrintWriter stderr = spec.commandLine().getErr();

        CrawlerSettings settings;
        CrawlRequest request;
        try {
            settings = (config != null) ? YamlSettingsLoader.load(config) : YamlSettingsLoader.loadOrDefault(null);
            settings.validate();
        } catch (IOException | RuntimeException e) {
            // YAML 문법 오류/숫자 형식 오류/범위 검증 실패 포함
            LOG.error("Settings load failed: {}", e.toString());
            stderr.println("Settings error: " + e.getMessage());
            return EXIT_IO;
        }

        try {
            request = JsonCodec.mapper().readValue(Files.readString(requestFile, StandardCharsets.UTF_8), CrawlRequest.class);
        } catch (JsonProcessingException e) {
            stderr.println("Request error: " + e.getOriginalMessage());
            return EXIT_INVALID;
        } catch (IOException e) {
            LOG.error("Request read failed: {}", requestFile, e);
            stderr.println("Cannot read request: " + e.getMessage());
            return EXIT_IO;
        }

        CrawlResult result;
        try (CrawlOrchestrator orchestrator = new CrawlOrchestrator(settings)) {
            result = orchestrator.crawl(request);
        } catch (CrawlException e) {
            LOG.warn("Request rejected: {}", e.getMessage());
            stderr.println(e.getMessage());
            return EXIT_INVALID;
        }

        try {
            String json = JsonCodec.pretty().writeValueAsString(result);
            if (out != null) {
                Path parent = out.toAbsolutePath().getParent();
                if (parent != null) Files.createDirectories(parent);
                Files.writeString(out, json + System.lineSeparator(), StandardCharsets.UTF_8);
                stdout.printf("Wrote %d domain result(s), %d page(s) to %s%n",
                        result.results().size(), result.totalPagesCrawled(), out.toAbsolutePath());
            } else {
                stdout.println(json);
            }
            stdout.flush();
        } catch (IOException e) {
            LOG.error("Result write failed: {}", out, e);
            stderr.println("Cannot write result: " + e.getMessage());
            return EXIT_IO;
        }
        return EXIT_OK;
    }
}
