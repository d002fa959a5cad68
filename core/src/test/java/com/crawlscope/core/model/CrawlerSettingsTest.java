package com.crawlscope.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CrawlerSettingsTest {

    @Test
    void defaults_are_sequential_with_ten_pages() {
        CrawlerSettings s = CrawlerSettings.defaultSettings();
        s.validate();
        assertEquals(1, s.getConcurrency());
        assertEquals(Duration.ofSeconds(15), s.getTimeout());
        assertEquals(10, s.defaults().getMaxPages());
        assertTrue(s.isFollowRedirects());
    }

    @Test
    void concurrency_is_clamped_and_timeout_ms_floor() {
        CrawlerSettings s = CrawlerSettings.defaultSettings().setConcurrency(0).setTimeoutMs(0);
        assertEquals(1, s.getConcurrency());
        assertEquals(Duration.ofMillis(1), s.getTimeout());
    }

    @Test
    void validate_rejects_bad_values() {
        assertThatThrownBy(() -> CrawlerSettings.defaultSettings().setUserAgent(" ").validate())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CrawlerSettings.defaultSettings().setTimeout(Duration.ZERO).validate())
                .isInstanceOf(IllegalArgumentException.class);
        CrawlerSettings neg = CrawlerSettings.defaultSettings();
        neg.defaults().setMaxTimeSeconds(-1);
        assertThatThrownBy(neg::validate).hasMessageContaining("maxTimeSeconds");
    }
}
