package org.covidwatch.config;

import org.covidwatch.util.Durations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Properties;

/**
 * Typed runtime settings.
 * <p>
 * Sources, later ones winning: {@code covidwatch.properties} on the classpath, the file named
 * by the {@code covidwatch.config} system property, then system properties with the same keys
 * (e.g. {@code -Dfetch.interval=5m}). Values are validated on load; a bad value fails with an
 * {@link IllegalArgumentException} naming the key.
 */
public final class TrackerConfig {

    private static final Logger log = LoggerFactory.getLogger(TrackerConfig.class);

    public static final String RESOURCE = "covidwatch.properties";
    public static final String CONFIG_FILE_PROPERTY = "covidwatch.config";

    public static final String FETCH_URL = "fetch.url";
    public static final String FETCH_INTERVAL = "fetch.interval";
    public static final String FETCH_TIMEOUT = "fetch.timeout";
    public static final String RETRY_MAX_ATTEMPTS = "fetch.retry.max-attempts";
    public static final String RETRY_BASE_DELAY = "fetch.retry.base-delay";
    public static final String RETRY_MAX_DELAY = "fetch.retry.max-delay";
    public static final String RETRY_JITTER = "fetch.retry.jitter";
    public static final String CATALOG_SOURCE = "catalog.source";
    public static final String STORE_PATH = "store.path";
    public static final String STORE_RECOVER = "store.recover-on-corruption";
    public static final String MAX_PER_SUBSCRIBER = "subscriptions.max-per-subscriber";
    public static final String STALE_AFTER = "snapshot.stale-after";

    private static final String[] KEYS = {
            FETCH_URL, FETCH_INTERVAL, FETCH_TIMEOUT, RETRY_MAX_ATTEMPTS, RETRY_BASE_DELAY,
            RETRY_MAX_DELAY, RETRY_JITTER, CATALOG_SOURCE, STORE_PATH, STORE_RECOVER,
            MAX_PER_SUBSCRIBER, STALE_AFTER
    };

    private final String fetchUrl;
    private final Duration fetchInterval;
    private final Duration fetchTimeout;
    private final int retryMaxAttempts;
    private final Duration retryBaseDelay;
    private final Duration retryMaxDelay;
    private final Duration retryJitter;
    private final String catalogSource;
    private final Path storePath;
    private final boolean recoverOnCorruption;
    private final int maxPerSubscriber;
    private final Duration staleAfter;

    private TrackerConfig(Properties p) {
        this.fetchUrl = p.getProperty(FETCH_URL, "").trim();
        if (fetchUrl.isEmpty()) {
            throw new IllegalArgumentException(FETCH_URL + " is required");
        }
        this.fetchInterval = positiveDuration(p, FETCH_INTERVAL, "20m");
        this.fetchTimeout = positiveDuration(p, FETCH_TIMEOUT, "2m");
        this.retryMaxAttempts = positiveInt(p, RETRY_MAX_ATTEMPTS, "3");
        this.retryBaseDelay = duration(p, RETRY_BASE_DELAY, "1s");
        this.retryMaxDelay = duration(p, RETRY_MAX_DELAY, "8s");
        this.retryJitter = duration(p, RETRY_JITTER, "200ms");
        this.catalogSource = p.getProperty(CATALOG_SOURCE, "classpath:regions.json").trim();
        this.storePath = Path.of(p.getProperty(STORE_PATH, "data/subscriptions.json").trim());
        this.recoverOnCorruption = bool(p, STORE_RECOVER, "false");
        this.maxPerSubscriber = positiveInt(p, MAX_PER_SUBSCRIBER, "10");
        this.staleAfter = positiveDuration(p, STALE_AFTER, "1h");
    }

    /** Classpath defaults, optional external file, then system properties. */
    public static TrackerConfig load() {
        Properties merged = new Properties();
        try (InputStream in = TrackerConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                    merged.load(r);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("could not read classpath " + RESOURCE, e);
        }

        String external = System.getProperty(CONFIG_FILE_PROPERTY);
        if (external != null && !external.isBlank()) {
            Path file = Path.of(external.trim());
            try (Reader r = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                merged.load(r);
                log.info("Loaded configuration overrides from {}", file.toAbsolutePath());
            } catch (IOException e) {
                throw new UncheckedIOException("could not read config file " + file, e);
            }
        }

        for (String key : KEYS) {
            String v = System.getProperty(key);
            if (v != null) {
                merged.setProperty(key, v);
            }
        }
        return from(merged);
    }

    /** Builds a config from explicit properties; unset keys take their defaults. */
    public static TrackerConfig from(Properties properties) {
        return new TrackerConfig(properties);
    }

    /* -------------------- parsing helpers -------------------- */

    private static Duration duration(Properties p, String key, String def) {
        String raw = p.getProperty(key, def);
        try {
            Duration d = Durations.parse(raw);
            if (d.isNegative()) {
                throw new IllegalArgumentException("negative");
            }
            return d;
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("invalid duration for " + key + ": '" + raw + "'", e);
        }
    }

    private static Duration positiveDuration(Properties p, String key, String def) {
        Duration d = duration(p, key, def);
        if (d.isZero()) {
            throw new IllegalArgumentException(key + " must be greater than zero");
        }
        return d;
    }

    private static int positiveInt(Properties p, String key, String def) {
        String raw = p.getProperty(key, def).trim();
        try {
            int v = Integer.parseInt(raw);
            if (v < 1) {
                throw new IllegalArgumentException(key + " must be >= 1: " + v);
            }
            return v;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid integer for " + key + ": '" + raw + "'", e);
        }
    }

    private static boolean bool(Properties p, String key, String def) {
        String raw = p.getProperty(key, def).trim().toLowerCase(Locale.ROOT);
        if (raw.equals("true")) return true;
        if (raw.equals("false")) return false;
        throw new IllegalArgumentException("invalid boolean for " + key + ": '" + raw + "'");
    }

    /* -------------------- accessors -------------------- */

    public String fetchUrl() { return fetchUrl; }
    public Duration fetchInterval() { return fetchInterval; }
    public Duration fetchTimeout() { return fetchTimeout; }
    public int retryMaxAttempts() { return retryMaxAttempts; }
    public Duration retryBaseDelay() { return retryBaseDelay; }
    public Duration retryMaxDelay() { return retryMaxDelay; }
    public Duration retryJitter() { return retryJitter; }
    public String catalogSource() { return catalogSource; }
    public Path storePath() { return storePath; }
    public boolean recoverOnCorruption() { return recoverOnCorruption; }
    public int maxPerSubscriber() { return maxPerSubscriber; }
    public Duration staleAfter() { return staleAfter; }

    @Override
    public String toString() {
        return "TrackerConfig{fetchUrl=" + fetchUrl
                + ", interval=" + fetchInterval
                + ", timeout=" + fetchTimeout
                + ", retry=" + retryMaxAttempts + "x/" + retryBaseDelay + ".." + retryMaxDelay
                + ", catalog=" + catalogSource
                + ", store=" + storePath
                + ", recoverOnCorruption=" + recoverOnCorruption
                + ", maxPerSubscriber=" + maxPerSubscriber
                + ", staleAfter=" + staleAfter + "}";
    }
}
