package com.crawlscope.core.util;

import com.crawlscope.core.model.CrawlerSettings;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * crawler.yml 을 읽어 CrawlerSettings 로 변환.
 *
 * 예상 YAML 키:
 * userAgent: "CrawlScope/0.3"
 * timeoutMs: 15000
 * followRedirects: true
 * concurrency: 1
 * defaults:
 *   maxPages: 10
 *   maxTimeSeconds: 0
 * publish:
 *   enabled: false
 *   jsonLines: "out/crawl-results.jsonl"
 */
public final class YamlSettingsLoader {

    /** 클래스패스에 번들된 기본 설정 */
    public static final String BUNDLED_RESOURCE = "/crawler.yml";

    private YamlSettingsLoader() {}

    /** 파일이 있으면 파일, 없으면 번들 기본값 */
    public static CrawlerSettings loadOrDefault(Path yamlPath) throws IOException {
        if (yamlPath != null && Files.exists(yamlPath)) return load(yamlPath);
        try (InputStream in = YamlSettingsLoader.class.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                CrawlerSettings cfg = CrawlerSettings.defaultSettings();
                cfg.validate();
                return cfg;
            }
            return load(in);
        }
    }

    public static CrawlerSettings load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("crawler.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static CrawlerSettings load(InputStream in) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        CrawlerSettings cfg = CrawlerSettings.defaultSettings();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어 있으면 기본값 유지
            cfg.validate();
            return cfg;
        }

        setString(map, "userAgent", cfg::setUserAgent);
        setLong(map, "timeoutMs", ms -> { if (ms > 0) cfg.setTimeout(Duration.ofMillis(ms)); });
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setInt(map, "concurrency", cfg::setConcurrency);

        Map<?, ?> defaults = getMap(map, "defaults");
        if (defaults != null) {
            setInt(defaults, "maxPages", cfg.defaults()::setMaxPages);
            setLong(defaults, "maxTimeSeconds", cfg.defaults()::setMaxTimeSeconds);
        }

        Map<?, ?> publish = getMap(map, "publish");
        if (publish != null) {
            setBoolean(publish, "enabled", cfg.publish()::setEnabled);
            setString(publish, "jsonLines", s -> cfg.publish().setJsonLines(Path.of(s)));
        }

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return (v instanceof Map<?, ?> m) ? m : null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v).trim());
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v).trim()));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }
}
