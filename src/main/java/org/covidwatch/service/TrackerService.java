package org.covidwatch.service;

import org.covidwatch.aggregate.SnapshotAggregator;
import org.covidwatch.exceptions.RegionNotFoundException;
import org.covidwatch.exceptions.StoreWriteException;
import org.covidwatch.exceptions.SubscriptionLimitException;
import org.covidwatch.exceptions.UnknownRegionException;
import org.covidwatch.interfaces.ExpiryPolicy;
import org.covidwatch.interfaces.RegionCatalog;
import org.covidwatch.interfaces.SubscriptionStore;
import org.covidwatch.interfaces.WakeSignal;
import org.covidwatch.model.MetricSet;
import org.covidwatch.model.RankingEntry;
import org.covidwatch.model.Region;
import org.covidwatch.model.Snapshot;
import org.covidwatch.model.Totals;
import org.covidwatch.scheduler.SnapshotHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.stream.Collectors;

/**
 * Query and subscription commands for an external chat dispatcher.
 * <p>
 * Every method returns a {@link CommandResult}; failures are mapped to a
 * {@link CommandError} and never thrown. Queries read whatever snapshot is currently
 * published and never wait for a fetch.
 */
public final class TrackerService {

    private static final Logger log = LoggerFactory.getLogger(TrackerService.class);

    static final int SUMMARY_TOP = 3;
    static final int MAX_RANKING_PAGE = 50;
    static final int SUGGESTIONS = 5;

    private final RegionCatalog catalog;
    private final SnapshotAggregator aggregator;
    private final SubscriptionStore store;
    private final SnapshotHolder holder;
    private final ExpiryPolicy expiry;
    private final WakeSignal refreshSignal;
    private final Clock clock;

    public TrackerService(RegionCatalog catalog,
                          SnapshotAggregator aggregator,
                          SubscriptionStore store,
                          SnapshotHolder holder,
                          ExpiryPolicy expiry,
                          WakeSignal refreshSignal,
                          Clock clock) {
        this.catalog = catalog;
        this.aggregator = aggregator;
        this.store = store;
        this.holder = holder;
        this.expiry = expiry;
        this.refreshSignal = refreshSignal;
        this.clock = clock;
    }

    /* =========================== queries =========================== */

    public CommandResult<Summary> getSummary() {
        Optional<Snapshot> current = holder.current();
        if (current.isEmpty()) {
            return noSnapshot();
        }
        Snapshot snapshot = current.get();
        Totals totals = aggregator.globalTotals(snapshot);
        return CommandResult.ok(new Summary(
                totals,
                totals.countryCount(),
                aggregator.rank(snapshot, SUMMARY_TOP),
                aggregator.rankProvinces(snapshot, SUMMARY_TOP),
                snapshot.fetchedAt(),
                isStale(snapshot)));
    }

    /** The top {@code limit} countries by confirmed cases. */
    public CommandResult<RankingPage> getRanking(int limit) {
        return getRanking(1, limit);
    }

    /**
     * {@code limit} countries starting at 1-based position {@code start}. A page that would run
     * past the last ranked country is moved back so it stays full.
     */
    public CommandResult<RankingPage> getRanking(int start, int limit) {
        if (start < 1) {
            return CommandResult.fail(CommandError.Code.INVALID_ARGUMENT, "Invalid starting point: " + start);
        }
        if (limit < 1 || limit > MAX_RANKING_PAGE) {
            return CommandResult.fail(CommandError.Code.INVALID_ARGUMENT,
                    "Number of countries to show must be between 1 and " + MAX_RANKING_PAGE + ": " + limit);
        }
        Optional<Snapshot> current = holder.current();
        if (current.isEmpty()) {
            return noSnapshot();
        }
        Snapshot snapshot = current.get();
        int total = aggregator.rankedCountryCount(snapshot);
        int first = start;
        if ((long) start + limit - 1 > total) {
            first = Math.max(1, total - limit + 1);
        }
        List<RankingEntry> entries = aggregator.rank(snapshot, first, limit);
        return CommandResult.ok(new RankingPage(entries, first, total, snapshot.fetchedAt(), isStale(snapshot)));
    }

    public CommandResult<RegionStatus> getStatus(String regionQuery) {
        Region region;
        try {
            region = catalog.resolve(regionQuery);
        } catch (UnknownRegionException e) {
            return unknownRegion(e);
        }
        Optional<Snapshot> current = holder.current();
        if (current.isEmpty()) {
            return noSnapshot();
        }
        Snapshot snapshot = current.get();
        MetricSet metrics;
        try {
            metrics = aggregator.metricsFor(snapshot, region);
        } catch (RegionNotFoundException e) {
            return CommandResult.fail(CommandError.Code.NO_DATA,
                    "No data for " + region.displayName() + " in the current snapshot");
        }
        OptionalInt rank = region.isCountryLevel() ? aggregator.rankOf(snapshot, region) : OptionalInt.empty();
        return CommandResult.ok(new RegionStatus(region, metrics, rank, snapshot.fetchedAt(), isStale(snapshot)));
    }

    /* =========================== subscriptions =========================== */

    public CommandResult<SubscriptionAck> subscribeRegion(String subscriberId, String regionQuery) {
        if (isBlank(subscriberId)) {
            return CommandResult.fail(CommandError.Code.INVALID_ARGUMENT, "Missing subscriber id");
        }
        Region region;
        try {
            region = catalog.resolve(regionQuery);
        } catch (UnknownRegionException e) {
            return unknownRegion(e);
        }
        boolean added;
        try {
            added = store.subscribe(subscriberId, region);
        } catch (SubscriptionLimitException e) {
            return CommandResult.fail(CommandError.Code.SUBSCRIPTION_LIMIT,
                    "You can only subscribe to " + e.limit() + " regions");
        } catch (StoreWriteException e) {
            log.error("Subscribe {} to {} not persisted: {}", subscriberId, region, e.getMessage());
            return CommandResult.fail(CommandError.Code.STORE_FAILURE, "Subscription could not be saved, try again later");
        }
        return CommandResult.ok(new SubscriptionAck(region, added, currentMetrics(region)));
    }

    public CommandResult<SubscriptionAck> unsubscribeRegion(String subscriberId, String regionQuery) {
        if (isBlank(subscriberId)) {
            return CommandResult.fail(CommandError.Code.INVALID_ARGUMENT, "Missing subscriber id");
        }
        Region region;
        try {
            region = catalog.resolve(regionQuery);
        } catch (UnknownRegionException e) {
            return unknownRegion(e);
        }
        boolean removed;
        try {
            removed = store.unsubscribe(subscriberId, region);
        } catch (StoreWriteException e) {
            log.error("Unsubscribe {} from {} not persisted: {}", subscriberId, region, e.getMessage());
            return CommandResult.fail(CommandError.Code.STORE_FAILURE, "Subscription could not be removed, try again later");
        }
        if (!removed) {
            return CommandResult.fail(CommandError.Code.NOT_SUBSCRIBED,
                    "Not subscribed to " + region.displayName());
        }
        return CommandResult.ok(new SubscriptionAck(region, true, null));
    }

    public CommandResult<List<Region>> listSubscriptions(String subscriberId) {
        if (isBlank(subscriberId)) {
            return CommandResult.fail(CommandError.Code.INVALID_ARGUMENT, "Missing subscriber id");
        }
        return CommandResult.ok(List.copyOf(store.listFor(subscriberId)));
    }

    /** Asks the scheduler to start its next tick now. Returns at once. */
    public CommandResult<Void> forceRefresh() {
        refreshSignal.wake();
        log.info("Manual refresh requested");
        return CommandResult.ok(null);
    }

    /* =========================== helpers =========================== */

    private MetricSet currentMetrics(Region region) {
        Optional<Snapshot> current = holder.current();
        if (current.isEmpty()) {
            return null;
        }
        try {
            return aggregator.metricsFor(current.get(), region);
        } catch (RegionNotFoundException e) {
            return null;
        }
    }

    private boolean isStale(Snapshot snapshot) {
        return expiry.isExpired(snapshot.fetchedAt(), clock.instant());
    }

    private static <T> CommandResult<T> unknownRegion(UnknownRegionException e) {
        List<String> names = e.suggestions().stream()
                .limit(SUGGESTIONS)
                .map(Region::displayName)
                .collect(Collectors.toList());
        String message = "No region named '" + e.query() + "'"
                + (names.isEmpty() ? "" : ". Did you mean: " + String.join(", ", names) + "?");
        return CommandResult.fail(new CommandError(CommandError.Code.UNKNOWN_REGION, message, names));
    }

    private static <T> CommandResult<T> noSnapshot() {
        return CommandResult.fail(CommandError.Code.NO_DATA, "No data has been fetched yet");
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
