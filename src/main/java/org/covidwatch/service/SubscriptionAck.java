package org.covidwatch.service;

import org.covidwatch.model.MetricSet;
import org.covidwatch.model.Region;

/**
 * Result of a subscribe or unsubscribe.
 *
 * @param region  canonical region the query resolved to
 * @param changed {@code false} when subscribing to an already watched region
 * @param current figures from the published snapshot, or {@code null} when unavailable
 */
public record SubscriptionAck(Region region, boolean changed, MetricSet current) {
}
