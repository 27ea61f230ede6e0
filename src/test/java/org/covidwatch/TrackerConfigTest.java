package org.covidwatch;

import org.covidwatch.config.TrackerConfig;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class TrackerConfigTest {

    private static Properties props(String... kv) {
        Properties p = new Properties();
        p.setProperty(TrackerConfig.FETCH_URL, "https://example.org/daily.csv");
        for (int i = 0; i < kv.length; i += 2) {
            p.setProperty(kv[i], kv[i + 1]);
        }
        return p;
    }

    @Test
    void defaults() {
        TrackerConfig c = TrackerConfig.from(props());
        assertEquals("https://example.org/daily.csv", c.fetchUrl());
        assertEquals(Duration.ofMinutes(20), c.fetchInterval());
        assertEquals(Duration.ofMinutes(2), c.fetchTimeout());
        assertEquals(3, c.retryMaxAttempts());
        assertEquals("classpath:regions.json", c.catalogSource());
        assertEquals(Path.of("data/subscriptions.json"), c.storePath());
        assertFalse(c.recoverOnCorruption());
        assertEquals(10, c.maxPerSubscriber());
        assertEquals(Duration.ofHours(1), c.staleAfter());
    }

    @Test
    void overrides() {
        TrackerConfig c = TrackerConfig.from(props(
                TrackerConfig.FETCH_INTERVAL, "5m",
                TrackerConfig.FETCH_TIMEOUT, "PT30S",
                TrackerConfig.STORE_RECOVER, "TRUE",
                TrackerConfig.MAX_PER_SUBSCRIBER, " 4 ",
                TrackerConfig.STORE_PATH, "/var/lib/covidwatch/subs.json"));
        assertEquals(Duration.ofMinutes(5), c.fetchInterval());
        assertEquals(Duration.ofSeconds(30), c.fetchTimeout());
        assertTrue(c.recoverOnCorruption());
        assertEquals(4, c.maxPerSubscriber());
        assertEquals(Path.of("/var/lib/covidwatch/subs.json"), c.storePath());
    }

    @Test
    void missingUrl_isRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> TrackerConfig.from(new Properties()));
        assertTrue(e.getMessage().contains(TrackerConfig.FETCH_URL));
    }

    @Test
    void badValues_nameTheKey() {
        assertRejected(TrackerConfig.FETCH_INTERVAL, "0s");
        assertRejected(TrackerConfig.FETCH_INTERVAL, "often");
        assertRejected(TrackerConfig.RETRY_MAX_ATTEMPTS, "0");
        assertRejected(TrackerConfig.MAX_PER_SUBSCRIBER, "ten");
        assertRejected(TrackerConfig.STORE_RECOVER, "yes");
    }

    @Test
    void classpathDefaultsLoad() {
        TrackerConfig c = TrackerConfig.load();
        assertFalse(c.fetchUrl().isBlank());
    }

    private static void assertRejected(String key, String value) {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> TrackerConfig.from(props(key, value)));
        assertTrue(e.getMessage().contains(key), e.getMessage());
    }
}
