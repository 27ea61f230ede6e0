package org.covidwatch.service;

import org.covidwatch.model.RankingEntry;
import org.covidwatch.model.Totals;

import java.time.Instant;
import java.util.List;

/**
 * Global overview: summed figures, the number of affected countries and the three most
 * affected countries and provinces.
 */
public record Summary(Totals totals,
                      int affectedCountries,
                      List<RankingEntry> topCountries,
                      List<RankingEntry> topProvinces,
                      Instant snapshotAt,
                      boolean stale) {

    public Summary {
        topCountries = List.copyOf(topCountries);
        topProvinces = List.copyOf(topProvinces);
    }
}
