package org.covidwatch.model;

/** One line of a confirmed-cases ranking; {@code rank} is 1-based. */
public record RankingEntry(Region region, long confirmed, int rank) {
}
