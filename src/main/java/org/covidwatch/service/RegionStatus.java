package org.covidwatch.service;

import org.covidwatch.model.MetricSet;
import org.covidwatch.model.Region;

import java.time.Instant;
import java.util.OptionalInt;

/**
 * Current figures for one region. {@code countryRank} is empty for provinces and for
 * countries without a known confirmed count.
 */
public record RegionStatus(Region region,
                           MetricSet metrics,
                           OptionalInt countryRank,
                           Instant snapshotAt,
                           boolean stale) {
}
