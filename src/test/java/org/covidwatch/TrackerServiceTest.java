package org.covidwatch;

import org.covidwatch.aggregate.SnapshotAggregator;
import org.covidwatch.model.Region;
import org.covidwatch.parser.CsvSnapshotParser;
import org.covidwatch.persistence.FileSubscriptionStore;
import org.covidwatch.scheduler.ReconciliationScheduler;
import org.covidwatch.scheduler.SnapshotHolder;
import org.covidwatch.scheduler.TickReport;
import org.covidwatch.service.CommandError;
import org.covidwatch.service.CommandResult;
import org.covidwatch.service.RankingPage;
import org.covidwatch.service.RegionStatus;
import org.covidwatch.service.Summary;
import org.covidwatch.service.SubscriptionAck;
import org.covidwatch.service.TrackerService;
import org.covidwatch.util.FixedTtlPolicy;
import org.covidwatch.util.SimpleWakeSignal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.OptionalInt;

import static org.covidwatch.Fixtures.confirmedOnly;
import static org.covidwatch.Fixtures.counts;
import static org.covidwatch.Fixtures.snapshot;
import static org.junit.jupiter.api.Assertions.*;

class TrackerServiceTest {

    private static final Region US = Region.country("US");
    private static final Region CA = Region.province("US", "California");
    private static final Region NY = Region.province("US", "New York");
    private static final Region ITALY = Region.country("Italy");
    private static final Region GERMANY = Region.country("Germany");
    private static final Region FRANCE = Region.country("France");

    @TempDir Path tmp;

    private SnapshotHolder holder;
    private SimpleWakeSignal wake;
    private FileSubscriptionStore store;
    private TrackerService service;

    @BeforeEach
    void setUp() {
        holder = new SnapshotHolder();
        wake = new SimpleWakeSignal();
        store = FileSubscriptionStore.open(tmp.resolve("subs.json"), 3, false);
        service = serviceAt(Clock.fixed(Fixtures.T0.plusSeconds(60), ZoneOffset.UTC));
    }

    private TrackerService serviceAt(Clock clock) {
        return new TrackerService(Fixtures.catalog(), new SnapshotAggregator(), store, holder,
                new FixedTtlPolicy(Duration.ofHours(1)), wake, clock);
    }

    private void publishDefault() {
        holder.publish(snapshot(
                CA, counts(600, 10, 100), NY, counts(400, 20, 50),
                ITALY, counts(700, 70, 300),
                GERMANY, counts(300, 3, 200),
                FRANCE, confirmedOnly(200)));
    }

    @Test
    void queriesBeforeFirstSnapshotReportNoData() {
        assertEquals(CommandError.Code.NO_DATA, service.getSummary().error().code());
        assertEquals(CommandError.Code.NO_DATA, service.getRanking(5).error().code());
        assertEquals(CommandError.Code.NO_DATA, service.getStatus("Italy").error().code());

        CommandResult<SubscriptionAck> sub = service.subscribeRegion("guild-1", "Italy");
        assertTrue(sub.isOk());
        assertNull(sub.value().current());
    }

    @Test
    void summaryShowsTotalsAndTopThrees() {
        publishDefault();
        Summary summary = service.getSummary().value();

        assertEquals(2200L, summary.totals().metrics().confirmed());
        assertEquals(4, summary.affectedCountries());
        assertFalse(summary.totals().complete(), "France has no deaths");
        assertEquals(List.of(US, ITALY, GERMANY),
                summary.topCountries().stream().map(e -> e.region()).toList());
        assertEquals(List.of(CA, NY), summary.topProvinces().stream().map(e -> e.region()).toList());
        assertEquals(Fixtures.T0, summary.snapshotAt());
        assertFalse(summary.stale());
    }

    @Test
    void oldSnapshotIsFlaggedStale() {
        publishDefault();
        TrackerService later = serviceAt(Clock.fixed(Fixtures.T0.plus(Duration.ofHours(2)), ZoneOffset.UTC));
        assertTrue(later.getSummary().value().stale());
        assertTrue(later.getStatus("Italy").value().stale());
    }

    @Test
    void rankingPagesStayFullNearTheEnd() {
        publishDefault();

        RankingPage top = service.getRanking(2).value();
        assertEquals(1, top.start());
        assertEquals(List.of(US, ITALY), top.entries().stream().map(e -> e.region()).toList());
        assertEquals(4, top.totalRanked());

        RankingPage tail = service.getRanking(3, 3).value();
        assertEquals(2, tail.start());
        assertEquals(List.of(ITALY, GERMANY, FRANCE), tail.entries().stream().map(e -> e.region()).toList());
        assertEquals(4, tail.entries().get(2).rank());
    }

    @Test
    void rankingRejectsBadArguments() {
        publishDefault();
        assertEquals(CommandError.Code.INVALID_ARGUMENT, service.getRanking(0, 3).error().code());
        assertEquals(CommandError.Code.INVALID_ARGUMENT, service.getRanking(0).error().code());
        assertEquals(CommandError.Code.INVALID_ARGUMENT, service.getRanking(1000).error().code());
    }

    @Test
    void statusResolvesAliasesAndRanksCountries() {
        publishDefault();

        RegionStatus us = service.getStatus("united states").value();
        assertEquals(US, us.region());
        assertEquals(1000L, us.metrics().confirmed());
        assertEquals(OptionalInt.of(1), us.countryRank());

        RegionStatus ca = service.getStatus("CA").value();
        assertEquals(CA, ca.region());
        assertEquals(600L, ca.metrics().confirmed());
        assertEquals(OptionalInt.empty(), ca.countryRank());
    }

    @Test
    void unknownRegionComesWithSuggestions() {
        publishDefault();
        CommandError error = service.getStatus("Germny").error();
        assertEquals(CommandError.Code.UNKNOWN_REGION, error.code());
        assertTrue(error.suggestions().contains("Germany"), error.suggestions().toString());
        assertTrue(error.message().contains("Germny"));
    }

    @Test
    void catalogedRegionWithoutDataIsNoData() {
        publishDefault();
        assertEquals(CommandError.Code.NO_DATA, service.getStatus("Canada").error().code());
    }

    @Test
    void subscribeUnsubscribeAndList() {
        publishDefault();

        SubscriptionAck first = service.subscribeRegion("guild-1", "usa").value();
        assertEquals(US, first.region());
        assertTrue(first.changed());
        assertEquals(1000L, first.current().confirmed());

        assertFalse(service.subscribeRegion("guild-1", "US").value().changed());
        service.subscribeRegion("guild-1", "Italy");
        assertEquals(List.of(ITALY, US), service.listSubscriptions("guild-1").value());

        assertTrue(service.unsubscribeRegion("guild-1", "United States").isOk());
        assertEquals(CommandError.Code.NOT_SUBSCRIBED,
                service.unsubscribeRegion("guild-1", "United States").error().code());
        assertEquals(List.of(ITALY), service.listSubscriptions("guild-1").value());
    }

    @Test
    void subscriptionErrorsAreStructured() {
        assertEquals(CommandError.Code.UNKNOWN_REGION, service.subscribeRegion("guild-1", "Atlantis").error().code());
        assertEquals(CommandError.Code.INVALID_ARGUMENT, service.subscribeRegion(" ", "Italy").error().code());
        assertEquals(CommandError.Code.INVALID_ARGUMENT, service.listSubscriptions(null).error().code());

        service.subscribeRegion("guild-1", "Italy");
        service.subscribeRegion("guild-1", "Germany");
        service.subscribeRegion("guild-1", "France");
        assertEquals(CommandError.Code.SUBSCRIPTION_LIMIT, service.subscribeRegion("guild-1", "US").error().code());
    }

    @Test
    void forceRefreshOnlySetsTheWakeSignal() {
        assertFalse(wake.isPending());
        assertTrue(service.forceRefresh().isOk());
        assertTrue(wake.isPending());
    }

    @Test
    void queriesSurviveMalformedUpstreamData() {
        ReconciliationScheduler.Builder b = ReconciliationScheduler.builder()
                .parser(new CsvSnapshotParser(Fixtures.catalog()))
                .store(store)
                .notifier(change -> { })
                .holder(holder)
                .clock(Clock.fixed(Fixtures.T0, ZoneOffset.UTC));

        ReconciliationSchedulerTest.ScriptedFetcher fetcher = new ReconciliationSchedulerTest.ScriptedFetcher()
                .then(Fixtures.simpleCsv("Italy,,500,5,50", "US,,900,9,90"))
                .then("\u0000\u0001garbage".getBytes(StandardCharsets.UTF_8));
        ReconciliationScheduler scheduler = b.fetcher(fetcher).build();

        assertTrue(scheduler.runTick().reconciled());
        assertEquals(TickReport.Outcome.PARSE_FAILED, scheduler.runTick().outcome());

        assertEquals(900L, service.getStatus("US").value().metrics().confirmed());
        assertEquals(List.of(US, ITALY),
                service.getRanking(5).value().entries().stream().map(e -> e.region()).toList());
    }
}
