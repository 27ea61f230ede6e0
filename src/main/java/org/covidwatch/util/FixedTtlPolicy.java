package org.covidwatch.util;

import org.covidwatch.interfaces.ExpiryPolicy;

import java.time.Duration;

/**
 * FixedTtlPolicy flags the published snapshot as stale once it is older than a constant
 * time-to-live.
 * <p>
 * The snapshot stays queryable after it expires; the flag only
 * lets the command surface warn that recent fetches have been failing.
 */
public final class FixedTtlPolicy implements ExpiryPolicy {

    private final Duration ttl;

    /**
     * @param ttl age after which a snapshot is reported as stale
     */
    public FixedTtlPolicy(Duration ttl) {
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must not be negative: " + ttl);
        }
        this.ttl = ttl;
    }

    @Override
    public Duration ttl() {
        return ttl;
    }
}
