package org.covidwatch.interfaces;

import org.covidwatch.exceptions.StoreWriteException;
import org.covidwatch.exceptions.SubscriptionLimitException;
import org.covidwatch.model.MetricSet;
import org.covidwatch.model.Region;
import org.covidwatch.model.Subscription;

import java.util.List;
import java.util.SortedSet;

/**
 * Durable subscriber to watched-region mapping.
 * <p>
 * Mutations are serialized and each one is persisted before it becomes visible.
 */
public interface SubscriptionStore {

    /** @return {@code true} if added, {@code false} if the subscriber already watched it */
    boolean subscribe(String subscriberId, Region region)
            throws StoreWriteException, SubscriptionLimitException;

    /** @return {@code true} if a subscription was removed */
    boolean unsubscribe(String subscriberId, Region region) throws StoreWriteException;

    SortedSet<Region> listFor(String subscriberId);

    /** Every subscription, ordered by subscriber then region. */
    List<Subscription> allSubscriptions();

    /**
     * Remember what was last delivered. No-op if the subscription was removed meanwhile.
     */
    void recordNotified(String subscriberId, Region region, MetricSet metrics) throws StoreWriteException;
}
