package org.covidwatch.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Case-count figures for one region at one point in time.
 * <p>
 * Every figure is nullable: {@code null} means the upstream source did not report a usable
 * value. Unknown figures are never treated as zero, so a missing column can not show up as
 * a drop in cases when comparing two snapshots.
 * <p>
 * {@link #ofCounts} and the {@link Builder} derive {@code active} as
 * {@code confirmed - deaths - recovered} whenever those three are known, and keep the reported
 * value only when they are not. The canonical constructor takes every figure as given, so sums
 * of partially known figures never re-derive {@code active}.
 */
public record MetricSet(Long confirmed,
                        Long deaths,
                        Long recovered,
                        Long active,
                        Double incidentRate,
                        Long peopleTested,
                        Instant asOf) {

    public MetricSet {
        requireNonNegative("confirmed", confirmed);
        requireNonNegative("deaths", deaths);
        requireNonNegative("recovered", recovered);
        requireNonNegative("active", active);
        requireNonNegative("peopleTested", peopleTested);
        if (incidentRate != null && (incidentRate < 0 || incidentRate.isNaN() || incidentRate.isInfinite())) {
            throw new IllegalArgumentException("incidentRate must be a non-negative number: " + incidentRate);
        }
    }

    /** Only confirmed/deaths/recovered known; active is derived. */
    public static MetricSet ofCounts(Long confirmed, Long deaths, Long recovered, Instant asOf) {
        return new MetricSet(confirmed, deaths, recovered, derivedActive(confirmed, deaths, recovered, null),
                null, null, asOf);
    }

    /** Every figure unknown. */
    public static MetricSet unknown(Instant asOf) {
        return new MetricSet(null, null, null, null, null, null, asOf);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean hasUnknown() {
        return confirmed == null || deaths == null || recovered == null || active == null;
    }

    /**
     * Field-wise comparison of the figures, ignoring {@link #asOf()}.
     * Two unknowns are equal; unknown versus a value is a change.
     */
    public boolean sameFiguresAs(MetricSet other) {
        if (other == null) {
            return false;
        }
        for (Metric m : Metric.values()) {
            if (!Objects.equals(m.valueOf(this), m.valueOf(other))) {
                return false;
            }
        }
        return true;
    }

    /**
     * Sums two rows that describe the same region. A figure unknown on either side stays
     * unknown, and the incident rate can not be summed so it becomes unknown.
     */
    public MetricSet merge(MetricSet other) {
        Instant latest = asOf;
        if (latest == null || (other.asOf != null && other.asOf.isAfter(latest))) {
            latest = other.asOf;
        }
        return new MetricSet(
                strictSum(confirmed, other.confirmed),
                strictSum(deaths, other.deaths),
                strictSum(recovered, other.recovered),
                strictSum(active, other.active),
                null,
                strictSum(peopleTested, other.peopleTested),
                latest);
    }

    public MetricSet withAsOf(Instant when) {
        return new MetricSet(confirmed, deaths, recovered, active, incidentRate, peopleTested, when);
    }

    private static Long derivedActive(Long confirmed, Long deaths, Long recovered, Long reported) {
        if (confirmed == null || deaths == null || recovered == null) {
            return reported;
        }
        long derived = confirmed - deaths - recovered;
        return derived >= 0 ? derived : null;
    }

    private static Long strictSum(Long a, Long b) {
        return (a == null || b == null) ? null : Math.addExact(a, b);
    }

    private static void requireNonNegative(String name, Long value) {
        if (value != null && value < 0) {
            throw new IllegalArgumentException(name + " must be non-negative: " + value);
        }
    }

    /** Fluent construction, mostly for callers assembling figures field by field. */
    public static final class Builder {
        private Long confirmed;
        private Long deaths;
        private Long recovered;
        private Long active;
        private Double incidentRate;
        private Long peopleTested;
        private Instant asOf;

        private Builder() {}

        public Builder confirmed(Long v)    { this.confirmed = v; return this; }
        public Builder deaths(Long v)       { this.deaths = v; return this; }
        public Builder recovered(Long v)    { this.recovered = v; return this; }
        public Builder active(Long v)       { this.active = v; return this; }
        public Builder incidentRate(Double v) { this.incidentRate = v; return this; }
        public Builder peopleTested(Long v) { this.peopleTested = v; return this; }
        public Builder asOf(Instant v)      { this.asOf = v; return this; }

        public MetricSet build() {
            return new MetricSet(confirmed, deaths, recovered,
                    derivedActive(confirmed, deaths, recovered, active), incidentRate, peopleTested, asOf);
        }
    }
}
