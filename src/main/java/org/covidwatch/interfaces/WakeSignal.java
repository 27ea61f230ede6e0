package org.covidwatch.interfaces;

import java.time.Duration;

/**
 * Lets the scheduler sleep between ticks while allowing a manual refresh to cut the sleep short.
 * Usage:
 *  - Scheduler, between ticks:  signal.awaitWake(interval);
 *  - Command surface:           signal.wake();
 */
public interface WakeSignal {

    /** Request an early wake-up. Never blocks; repeated calls before a wait collapse into one. */
    void wake();

    /**
     * Block until {@link #wake()} is called or the timeout passes. A wake requested before
     * this call is consumed immediately.
     * @return true if woken by a request; false if the timeout passed
     */
    boolean awaitWake(Duration timeout) throws InterruptedException;
}
