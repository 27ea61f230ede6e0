package org.covidwatch.scheduler;

import org.covidwatch.aggregate.SnapshotAggregator;
import org.covidwatch.exceptions.FetchException;
import org.covidwatch.exceptions.FetchTimeoutException;
import org.covidwatch.exceptions.NotifyDeliveryException;
import org.covidwatch.exceptions.RegionNotFoundException;
import org.covidwatch.exceptions.SnapshotParseException;
import org.covidwatch.exceptions.StoreWriteException;
import org.covidwatch.interfaces.Notifier;
import org.covidwatch.interfaces.RetryExecutor;
import org.covidwatch.interfaces.SnapshotFetcher;
import org.covidwatch.interfaces.SnapshotParser;
import org.covidwatch.interfaces.SubscriptionStore;
import org.covidwatch.interfaces.WakeSignal;
import org.covidwatch.model.MetricChange;
import org.covidwatch.model.MetricSet;
import org.covidwatch.model.Snapshot;
import org.covidwatch.model.Subscription;
import org.covidwatch.util.SimpleRetryExecutor;
import org.covidwatch.util.SimpleWakeSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * ReconciliationScheduler fetches a fresh snapshot on a fixed interval, publishes it and
 * notifies every subscriber whose watched region changed since the last delivery.
 * <p>
 * <b>Design notes:</b>
 * <ul>
 *   <li>One tick is {@code FETCHING -> PARSING -> RECONCILING}; a failed fetch or parse keeps
 *       the previously published snapshot and ends the tick early.</li>
 *   <li>Each fetch attempt runs on a fetch thread and is abandoned after {@code fetchTimeout};
 *       only the scheduler thread waits for it, queries keep reading the published snapshot.</li>
 *   <li>A subscription is notified at most once per tick, and its last-notified figures are
 *       written only after the notifier returned normally. A failed delivery is simply
 *       offered again on the next successful tick.</li>
 *   <li>{@link #requestRefresh()} only sets the wake signal: it shortens the current sleep and
 *       never interrupts a running tick.</li>
 * </ul>
 */
public final class ReconciliationScheduler {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationScheduler.class);

    private final SnapshotFetcher fetcher;
    private final SnapshotParser parser;
    private final SnapshotAggregator aggregator;
    private final SubscriptionStore store;
    private final Notifier notifier;
    private final SnapshotHolder holder;
    private final RetryExecutor retry;
    private final WakeSignal wakeSignal;
    private final Duration interval;
    private final Duration fetchTimeout;
    private final Clock clock;

    private final ExecutorService fetchPool;

    private volatile SchedulerState state = SchedulerState.IDLE;
    private volatile TickReport lastReport;
    private volatile boolean running;
    private Thread loopThread;

    private ReconciliationScheduler(Builder b) {
        this.fetcher = Objects.requireNonNull(b.fetcher, "fetcher");
        this.parser = Objects.requireNonNull(b.parser, "parser");
        this.store = Objects.requireNonNull(b.store, "store");
        this.notifier = Objects.requireNonNull(b.notifier, "notifier");
        this.holder = Objects.requireNonNull(b.holder, "holder");
        this.aggregator = b.aggregator != null ? b.aggregator : new SnapshotAggregator();
        this.retry = b.retry != null ? b.retry : SimpleRetryExecutor.once();
        this.wakeSignal = b.wakeSignal != null ? b.wakeSignal : new SimpleWakeSignal();
        this.interval = b.interval;
        this.fetchTimeout = b.fetchTimeout;
        this.clock = b.clock;
        this.fetchPool = Executors.newCachedThreadPool(daemonThreads("snapshot-fetch"));
    }

    public static Builder builder() {
        return new Builder();
    }

    /* =========================== one tick =========================== */

    /**
     * Runs one full cycle on the calling thread. Fetch and parse failures are reported in the
     * returned {@link TickReport}, never thrown.
     */
    public TickReport runTick() {
        Instant startedAt = clock.instant();
        try {
            state = SchedulerState.FETCHING;
            byte[] raw;
            try {
                raw = retry.execute(this::fetchOnce);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return finish(TickReport.failed(TickReport.Outcome.FETCH_FAILED, startedAt,
                        since(startedAt), "interrupted"));
            } catch (Exception e) {
                log.warn("Fetch from {} failed, keeping previous snapshot: {}", fetcher.describe(), e.getMessage());
                return finish(TickReport.failed(TickReport.Outcome.FETCH_FAILED, startedAt,
                        since(startedAt), e.getMessage()));
            }

            state = SchedulerState.PARSING;
            Snapshot snapshot;
            try {
                snapshot = parser.parse(raw, clock.instant());
            } catch (SnapshotParseException e) {
                log.warn("Snapshot rejected, keeping previous snapshot: {}", e.getMessage());
                return finish(TickReport.failed(TickReport.Outcome.PARSE_FAILED, startedAt,
                        since(startedAt), e.getMessage()));
            }
            holder.publish(snapshot);

            state = SchedulerState.RECONCILING;
            return finish(reconcile(snapshot, startedAt));
        } finally {
            // every tick, successful or not, hands over to the sleep phase
            state = SchedulerState.SLEEPING;
        }
    }

    private TickReport reconcile(Snapshot snapshot, Instant startedAt) {
        int notified = 0, unchanged = 0, failed = 0, skipped = 0;

        for (Subscription sub : store.allSubscriptions()) {
            MetricSet current;
            try {
                current = aggregator.metricsFor(snapshot, sub.region());
            } catch (RegionNotFoundException e) {
                log.debug("{} not in snapshot, skipping subscriber {}", sub.region(), sub.subscriberId());
                skipped++;
                continue;
            }

            MetricSet previous = sub.lastNotified();
            if (previous != null && previous.sameFiguresAs(current)) {
                unchanged++;
                continue;
            }

            try {
                notifier.notify(new MetricChange(sub.subscriberId(), sub.region(), previous, current));
            } catch (NotifyDeliveryException | RuntimeException e) {
                log.warn("Delivery to {} for {} failed, will retry next tick: {}",
                        sub.subscriberId(), sub.region(), e.getMessage());
                failed++;
                continue;
            }
            notified++;

            try {
                store.recordNotified(sub.subscriberId(), sub.region(), current);
            } catch (StoreWriteException e) {
                // the change is delivered again next tick
                log.error("Could not record delivery to {} for {}: {}",
                        sub.subscriberId(), sub.region(), e.getMessage());
            }
        }

        return new TickReport(TickReport.Outcome.RECONCILED, startedAt, since(startedAt),
                notified, unchanged, failed, skipped, snapshot.size() + " regions");
    }

    /** One bounded fetch attempt; the retry executor decides whether to try again. */
    private byte[] fetchOnce() throws FetchException, InterruptedException {
        Future<byte[]> future = fetchPool.submit(fetcher::fetch);
        try {
            return future.get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new FetchTimeoutException(fetchTimeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            // keep the flag so a retry backoff ends at once
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof FetchException) {
                throw (FetchException) cause;
            }
            throw new FetchException("fetch failed: " + cause, cause);
        }
    }

    private TickReport finish(TickReport report) {
        lastReport = report;
        if (report.reconciled()) {
            log.info("Tick done in {}ms: {} notified, {} unchanged, {} failed, {} skipped ({})",
                    report.took().toMillis(), report.notified(), report.unchanged(),
                    report.failed(), report.skipped(), report.detail());
        } else {
            log.warn("Tick ended early: {} ({})", report.outcome(), report.detail());
        }
        return report;
    }

    private Duration since(Instant startedAt) {
        return Duration.between(startedAt, clock.instant());
    }

    /* =========================== loop =========================== */

    /** Starts the background loop; the first tick runs immediately. */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        loopThread = new Thread(this::loop, "reconciliation-scheduler");
        loopThread.setDaemon(true);
        loopThread.start();
        log.info("Scheduler started: source={}, interval={}, fetch timeout={}",
                fetcher.describe(), interval, fetchTimeout);
    }

    private void loop() {
        while (running) {
            try {
                runTick();
            } catch (RuntimeException e) {
                // keep the loop alive; the next tick starts from the published snapshot
                log.error("Tick failed unexpectedly", e);
            }
            if (!running) {
                break;
            }
            try {
                boolean woken = wakeSignal.awaitWake(interval);
                if (woken) {
                    log.info("Manual refresh requested, starting tick early");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } finally {
                state = SchedulerState.IDLE;
            }
        }
        state = SchedulerState.IDLE;
        log.info("Scheduler loop stopped");
    }

    /** Ends the loop and waits briefly for it to exit. */
    public void stop() {
        Thread t;
        synchronized (this) {
            if (!running) {
                fetchPool.shutdownNow();
                return;
            }
            running = false;
            t = loopThread;
        }
        t.interrupt();
        try {
            t.join(TimeUnit.SECONDS.toMillis(5));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        fetchPool.shutdownNow();
    }

    /** Cuts the current sleep short. Never blocks and never interrupts a running tick. */
    public void requestRefresh() {
        wakeSignal.wake();
    }

    public SchedulerState state() {
        return state;
    }

    /** @return the report of the most recent tick, or {@code null} before the first one */
    public TickReport lastReport() {
        return lastReport;
    }

    public boolean isRunning() {
        return running;
    }

    private static ThreadFactory daemonThreads(String name) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, name + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /* =========================== builder =========================== */

    public static final class Builder {
        private SnapshotFetcher fetcher;
        private SnapshotParser parser;
        private SnapshotAggregator aggregator;
        private SubscriptionStore store;
        private Notifier notifier;
        private SnapshotHolder holder;
        private RetryExecutor retry;
        private WakeSignal wakeSignal;
        private Duration interval = Duration.ofMinutes(20);
        private Duration fetchTimeout = Duration.ofMinutes(2);
        private Clock clock = Clock.systemUTC();

        private Builder() {}

        public Builder fetcher(SnapshotFetcher v)       { this.fetcher = v; return this; }
        public Builder parser(SnapshotParser v)         { this.parser = v; return this; }
        public Builder aggregator(SnapshotAggregator v) { this.aggregator = v; return this; }
        public Builder store(SubscriptionStore v)       { this.store = v; return this; }
        public Builder notifier(Notifier v)             { this.notifier = v; return this; }
        public Builder holder(SnapshotHolder v)         { this.holder = v; return this; }
        public Builder retry(RetryExecutor v)           { this.retry = v; return this; }
        public Builder wakeSignal(WakeSignal v)         { this.wakeSignal = v; return this; }
        public Builder interval(Duration v)             { this.interval = v; return this; }
        public Builder fetchTimeout(Duration v)         { this.fetchTimeout = v; return this; }
        public Builder clock(Clock v)                   { this.clock = v; return this; }

        public ReconciliationScheduler build() {
            if (interval == null || interval.isNegative() || interval.isZero()) {
                throw new IllegalArgumentException("interval must be positive: " + interval);
            }
            if (fetchTimeout == null || fetchTimeout.isNegative() || fetchTimeout.isZero()) {
                throw new IllegalArgumentException("fetchTimeout must be positive: " + fetchTimeout);
            }
            Objects.requireNonNull(clock, "clock");
            return new ReconciliationScheduler(this);
        }
    }
}
