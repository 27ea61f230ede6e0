package org.covidwatch.model;

import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * One fetched-and-parsed dataset.
 * <p>
 * Immutable: the region map is copied into a sorted, unmodifiable view on construction.
 * A newer snapshot replaces this one by reference; it is never updated in place.
 */
public final class Snapshot {

    private final Instant fetchedAt;
    private final SortedMap<Region, MetricSet> regions;
    private final List<String> warnings;

    public Snapshot(Instant fetchedAt, Map<Region, MetricSet> regions, List<String> warnings) {
        this.fetchedAt = Objects.requireNonNull(fetchedAt, "fetchedAt");
        this.regions = Collections.unmodifiableSortedMap(new TreeMap<>(regions));
        this.warnings = List.copyOf(warnings);
    }

    public Instant fetchedAt() {
        return fetchedAt;
    }

    /** Region rows exactly as parsed (no roll-ups), sorted by region. */
    public SortedMap<Region, MetricSet> regions() {
        return regions;
    }

    public Optional<MetricSet> row(Region region) {
        return Optional.ofNullable(regions.get(region));
    }

    public boolean contains(Region region) {
        return regions.containsKey(region);
    }

    /** Rows skipped or degraded while parsing. */
    public List<String> warnings() {
        return warnings;
    }

    public int size() {
        return regions.size();
    }

    @Override
    public String toString() {
        return "Snapshot{fetchedAt=" + fetchedAt + ", regions=" + regions.size()
                + ", warnings=" + warnings.size() + "}";
    }
}
