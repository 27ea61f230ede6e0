package org.covidwatch.interfaces;

import java.time.Duration;
import java.time.Instant;

/** Decides when published data is too old to present as current. */
public interface ExpiryPolicy {

    Duration ttl();

    default boolean isExpired(Instant publishedAt, Instant now) {
        return publishedAt == null || Duration.between(publishedAt, now).compareTo(ttl()) > 0;
    }
}
