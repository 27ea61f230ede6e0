package org.covidwatch.model;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * A detected change for one subscription, handed to the notifier.
 * {@code previous} is {@code null} on the first delivery.
 */
public record MetricChange(String subscriberId, Region region, MetricSet previous, MetricSet current) {

    public MetricChange {
        Objects.requireNonNull(subscriberId, "subscriberId");
        Objects.requireNonNull(region, "region");
        Objects.requireNonNull(current, "current");
    }

    public boolean isInitial() {
        return previous == null;
    }

    /**
     * Signed differences ({@code "+200"}, {@code "-3"}) for every figure known on both sides
     * that moved, in {@link Metric} order. Empty on the first delivery.
     */
    public Map<Metric, String> deltas() {
        Map<Metric, String> out = new LinkedHashMap<>();
        if (previous == null) {
            return out;
        }
        for (Metric m : Metric.values()) {
            Number before = m.valueOf(previous);
            Number after = m.valueOf(current);
            if (before == null || after == null || before.equals(after)) {
                continue;
            }
            out.put(m, signed(m, before, after));
        }
        return out;
    }

    private static String signed(Metric m, Number before, Number after) {
        if (m == Metric.INCIDENT_RATE) {
            double d = after.doubleValue() - before.doubleValue();
            return (d >= 0 ? "+" : "") + String.format(Locale.ROOT, "%.2f", d);
        }
        long d = after.longValue() - before.longValue();
        return (d >= 0 ? "+" : "") + d;
    }
}
