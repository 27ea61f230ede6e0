package org.covidwatch.aggregate;

import org.covidwatch.exceptions.RegionNotFoundException;
import org.covidwatch.model.MetricSet;
import org.covidwatch.model.RankingEntry;
import org.covidwatch.model.Region;
import org.covidwatch.model.Snapshot;
import org.covidwatch.model.Totals;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Derives per-region figures, global totals and rankings from a {@link Snapshot}.
 * <p>
 * Stateless: every result is computed from the snapshot passed in, so the same snapshot
 * always yields the same output.
 * <p>
 * Countries come either from an explicit country-level row or, when the upstream only
 * publishes provinces, from a roll-up of those provinces. An explicit country row always
 * wins, so provinces are never counted twice.
 */
public final class SnapshotAggregator {

    private static final Comparator<RankingEntry> RANKING_ORDER =
            Comparator.comparingLong(RankingEntry::confirmed).reversed()
                    .thenComparing(RankingEntry::region);

    /**
     * Figures for one region. A country with no row of its own is rolled up from its
     * provinces; any figure missing from one of those provinces is unknown in the roll-up.
     *
     * @throws RegionNotFoundException when the snapshot has nothing for the region
     */
    public MetricSet metricsFor(Snapshot snapshot, Region region) throws RegionNotFoundException {
        MetricSet row = snapshot.regions().get(region);
        if (row != null) {
            return row;
        }
        if (region.isCountryLevel()) {
            MetricSet rolled = rollUp(snapshot, region);
            if (rolled != null) {
                return rolled;
            }
        }
        throw new RegionNotFoundException(region);
    }

    /** Country-level figures for every country present in the snapshot, sorted by region. */
    public SortedMap<Region, MetricSet> countryMetrics(Snapshot snapshot) {
        SortedMap<Region, MetricSet> out = new TreeMap<>();
        Set<Region> countries = new HashSet<>();
        for (Region r : snapshot.regions().keySet()) {
            countries.add(r.countryRegion());
        }
        for (Region c : countries) {
            MetricSet explicit = snapshot.regions().get(c);
            out.put(c, explicit != null ? explicit : rollUp(snapshot, c));
        }
        return out;
    }

    /**
     * Sum across countries. Unknown figures are left out of the sum rather than counted as
     * zero, and the affected regions are reported so callers can flag the total as partial.
     */
    public Totals globalTotals(Snapshot snapshot) {
        long confirmed = 0, deaths = 0, recovered = 0, active = 0, tested = 0;
        boolean anyConfirmed = false, anyDeaths = false, anyRecovered = false, anyActive = false, anyTested = false;
        Set<Region> incomplete = new HashSet<>();

        SortedMap<Region, MetricSet> countries = countryMetrics(snapshot);
        for (Map.Entry<Region, MetricSet> e : countries.entrySet()) {
            Region country = e.getKey();
            MetricSet m = sourceFor(snapshot, country, e.getValue(), incomplete);

            if (m.confirmed() != null) { confirmed += m.confirmed(); anyConfirmed = true; } else incomplete.add(country);
            if (m.deaths() != null)    { deaths += m.deaths(); anyDeaths = true; }       else incomplete.add(country);
            if (m.recovered() != null) { recovered += m.recovered(); anyRecovered = true; } else incomplete.add(country);
            if (m.active() != null)    { active += m.active(); anyActive = true; }       else incomplete.add(country);
            if (m.peopleTested() != null) { tested += m.peopleTested(); anyTested = true; }
        }

        // each figure is its own partial sum; active is not re-derived from the other three
        MetricSet sum = new MetricSet(
                anyConfirmed ? confirmed : null,
                anyDeaths ? deaths : null,
                anyRecovered ? recovered : null,
                anyActive ? active : null,
                null,
                anyTested ? tested : null,
                snapshot.fetchedAt());
        return new Totals(sum, incomplete.isEmpty(), incomplete, countries.size());
    }

    /** Top {@code limit} countries by confirmed cases. */
    public List<RankingEntry> rank(Snapshot snapshot, int limit) {
        return rank(snapshot, 1, limit);
    }

    /**
     * Countries ranked by confirmed cases, descending, ties by region name; returns the page
     * starting at 1-based position {@code start}. Countries with unknown confirmed counts
     * are not ranked. Provinces never appear.
     */
    public List<RankingEntry> rank(Snapshot snapshot, int start, int limit) {
        if (start < 1) {
            throw new IllegalArgumentException("start must be >= 1: " + start);
        }
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0: " + limit);
        }
        return page(ranked(countryMetrics(snapshot)), start, limit);
    }

    /** Top {@code limit} provinces by confirmed cases, across all countries. */
    public List<RankingEntry> rankProvinces(Snapshot snapshot, int limit) {
        if (limit < 0) {
            throw new IllegalArgumentException("limit must be >= 0: " + limit);
        }
        SortedMap<Region, MetricSet> provinces = new TreeMap<>();
        snapshot.regions().forEach((r, m) -> {
            if (!r.isCountryLevel()) provinces.put(r, m);
        });
        return page(ranked(provinces), 1, limit);
    }

    /** 1-based position of a country in the full ranking, if it is ranked. */
    public OptionalInt rankOf(Snapshot snapshot, Region country) {
        if (!country.isCountryLevel()) {
            return OptionalInt.empty();
        }
        for (RankingEntry e : ranked(countryMetrics(snapshot))) {
            if (e.region().equals(country)) {
                return OptionalInt.of(e.rank());
            }
        }
        return OptionalInt.empty();
    }

    /** Number of ranked countries, i.e. countries with a known confirmed count. */
    public int rankedCountryCount(Snapshot snapshot) {
        return ranked(countryMetrics(snapshot)).size();
    }

    /* -------------------- helpers -------------------- */

    private static List<RankingEntry> ranked(Map<Region, MetricSet> candidates) {
        List<RankingEntry> unordered = new ArrayList<>();
        candidates.forEach((r, m) -> {
            if (m.confirmed() != null) {
                unordered.add(new RankingEntry(r, m.confirmed(), 0));
            }
        });
        unordered.sort(RANKING_ORDER);
        List<RankingEntry> out = new ArrayList<>(unordered.size());
        for (int i = 0; i < unordered.size(); i++) {
            RankingEntry e = unordered.get(i);
            out.add(new RankingEntry(e.region(), e.confirmed(), i + 1));
        }
        return out;
    }

    private static List<RankingEntry> page(List<RankingEntry> all, int start, int limit) {
        int from = Math.min(start - 1, all.size());
        int to = (int) Math.min((long) from + limit, all.size());
        return List.copyOf(all.subList(from, to));
    }

    /**
     * Strict roll-up of a country's provinces; {@code null} if it has none in the snapshot.
     */
    private static MetricSet rollUp(Snapshot snapshot, Region country) {
        MetricSet acc = null;
        for (MetricSet m : provincesOf(snapshot, country).values()) {
            acc = acc == null ? m : acc.merge(m);
        }
        if (acc == null) {
            return null;
        }
        // incident rate is per population and can not be rolled up
        return new MetricSet(acc.confirmed(), acc.deaths(), acc.recovered(), acc.active(),
                null, acc.peopleTested(), acc.asOf());
    }

    /**
     * For totals, a rolled-up country contributes the lenient sum of its provinces: known
     * province figures are kept and the gaps are reported through {@code incomplete}.
     */
    private static MetricSet sourceFor(Snapshot snapshot, Region country, MetricSet countryLevel,
                                       Set<Region> incomplete) {
        if (snapshot.contains(country)) {
            return countryLevel;
        }
        Long confirmed = null, deaths = null, recovered = null, active = null, tested = null;
        Instant asOf = null;
        for (Map.Entry<Region, MetricSet> e : provincesOf(snapshot, country).entrySet()) {
            MetricSet m = e.getValue();
            if (m.hasUnknown()) {
                incomplete.add(e.getKey());
            }
            confirmed = lenientSum(confirmed, m.confirmed());
            deaths = lenientSum(deaths, m.deaths());
            recovered = lenientSum(recovered, m.recovered());
            active = lenientSum(active, m.active());
            tested = lenientSum(tested, m.peopleTested());
            if (asOf == null || (m.asOf() != null && m.asOf().isAfter(asOf))) {
                asOf = m.asOf();
            }
        }
        return new MetricSet(confirmed, deaths, recovered, active, null, tested, asOf);
    }

    private static SortedMap<Region, MetricSet> provincesOf(Snapshot snapshot, Region country) {
        // provinces sort directly after their country-level key
        SortedMap<Region, MetricSet> out = new TreeMap<>(snapshot.regions()
                .subMap(country, new Region(country.country() + "\0", "")));
        out.remove(country);
        return out;
    }

    private static Long lenientSum(Long acc, Long v) {
        if (v == null) return acc;
        return acc == null ? v : acc + v;
    }
}
