package org.covidwatch.model;

import java.util.Objects;

/**
 * A subscriber watching one region, with the figures last delivered to them
 * ({@code null} until the first notification).
 */
public record Subscription(String subscriberId, Region region, MetricSet lastNotified) {

    public Subscription {
        Objects.requireNonNull(subscriberId, "subscriberId");
        Objects.requireNonNull(region, "region");
    }

    public Subscription withLastNotified(MetricSet metrics) {
        return new Subscription(subscriberId, region, metrics);
    }
}
