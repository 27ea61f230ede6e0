package org.covidwatch.app;

import org.covidwatch.aggregate.SnapshotAggregator;
import org.covidwatch.catalog.AliasRegionCatalog;
import org.covidwatch.catalog.CatalogLoader;
import org.covidwatch.client.SnapshotFetchers;
import org.covidwatch.config.TrackerConfig;
import org.covidwatch.exceptions.StoreCorruptionException;
import org.covidwatch.interfaces.Notifier;
import org.covidwatch.interfaces.SnapshotFetcher;
import org.covidwatch.notify.LoggingNotifier;
import org.covidwatch.parser.CsvSnapshotParser;
import org.covidwatch.persistence.FileSubscriptionStore;
import org.covidwatch.scheduler.ReconciliationScheduler;
import org.covidwatch.scheduler.SnapshotHolder;
import org.covidwatch.service.TrackerService;
import org.covidwatch.util.FixedTtlPolicy;
import org.covidwatch.util.SimpleRetryExecutor;
import org.covidwatch.util.SimpleWakeSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.concurrent.CountDownLatch;

/**
 * Wires the tracker together and runs the reconciliation loop until the JVM is stopped.
 * <p>
 * Example: {@code java -Dfetch.url=https://host/daily.csv -jar covid-watch.jar}
 */
public final class TrackerApplication {

    private static final Logger log = LoggerFactory.getLogger(TrackerApplication.class);

    private final ReconciliationScheduler scheduler;
    private final TrackerService service;

    TrackerApplication(ReconciliationScheduler scheduler, TrackerService service) {
        this.scheduler = scheduler;
        this.service = service;
    }

    /**
     * Builds every component from the configuration. Fails when the catalog can not be
     * loaded or the subscription store is unreadable.
     */
    public static TrackerApplication create(TrackerConfig config, Notifier notifier) throws IOException {
        Clock clock = Clock.systemUTC();
        AliasRegionCatalog catalog = CatalogLoader.load(config.catalogSource());
        FileSubscriptionStore store = FileSubscriptionStore.open(
                config.storePath(), config.maxPerSubscriber(), config.recoverOnCorruption());
        SnapshotFetcher fetcher = SnapshotFetchers.forLocation(config.fetchUrl(), config.fetchTimeout());
        SnapshotHolder holder = new SnapshotHolder();
        SnapshotAggregator aggregator = new SnapshotAggregator();
        SimpleWakeSignal wake = new SimpleWakeSignal();

        ReconciliationScheduler scheduler = ReconciliationScheduler.builder()
                .fetcher(fetcher)
                .parser(new CsvSnapshotParser(catalog))
                .aggregator(aggregator)
                .store(store)
                .notifier(notifier)
                .holder(holder)
                .retry(new SimpleRetryExecutor(config.retryMaxAttempts(), config.retryBaseDelay(),
                        config.retryMaxDelay(), config.retryJitter()))
                .wakeSignal(wake)
                .interval(config.fetchInterval())
                .fetchTimeout(config.fetchTimeout())
                .clock(clock)
                .build();

        TrackerService service = new TrackerService(catalog, aggregator, store, holder,
                new FixedTtlPolicy(config.staleAfter()), wake, clock);
        return new TrackerApplication(scheduler, service);
    }

    public ReconciliationScheduler scheduler() {
        return scheduler;
    }

    /** Command surface for an external dispatcher. */
    public TrackerService service() {
        return service;
    }

    public void start() {
        scheduler.start();
    }

    public void stop() {
        scheduler.stop();
    }

    public static void main(String[] args) throws Exception {
        TrackerConfig config;
        try {
            config = TrackerConfig.load();
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            System.exit(2);
            return;
        }
        log.info("Starting with {}", config);

        TrackerApplication app;
        try {
            app = create(config, new LoggingNotifier());
        } catch (StoreCorruptionException e) {
            log.error("{}. Fix or move the file, or set {}=true to start empty.",
                    e.getMessage(), TrackerConfig.STORE_RECOVER);
            System.exit(1);
            return;
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutting down");
            app.stop();
            stopped.countDown();
        }, "shutdown"));

        app.start();
        stopped.await();
    }
}
