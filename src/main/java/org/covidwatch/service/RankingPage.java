package org.covidwatch.service;

import org.covidwatch.model.RankingEntry;

import java.time.Instant;
import java.util.List;

/**
 * One page of the country ranking. {@code start} is the 1-based position of the first entry,
 * which may be earlier than requested so that a page near the end is still full.
 */
public record RankingPage(List<RankingEntry> entries,
                          int start,
                          int totalRanked,
                          Instant snapshotAt,
                          boolean stale) {

    public RankingPage {
        entries = List.copyOf(entries);
    }
}
