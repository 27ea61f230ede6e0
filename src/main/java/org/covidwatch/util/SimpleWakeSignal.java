package org.covidwatch.util;

import org.covidwatch.interfaces.WakeSignal;

import java.time.Duration;

/**
 * Monitor-based wake signal for the scheduler's sleep phase.
 * <p>
 * <b>Notes:</b>
 * <ul>
 *   <li>{@link #wake()} only sets a flag and calls {@code notifyAll()}; it never waits.</li>
 *   <li>A pending flag is consumed by the next {@link #awaitWake(Duration)}, so a refresh
 *       requested while a tick is running shortens the following sleep.</li>
 *   <li>Waits loop on the flag to absorb spurious wake-ups.</li>
 * </ul>
 */
public final class SimpleWakeSignal implements WakeSignal {

    /** Monitor object used for coordinating wait/notify among threads. */
    private final Object mon = new Object();

    /** Set by {@link #wake()}, cleared by the waiter that consumes it. */
    private boolean pending = false;

    @Override
    public void wake() {
        synchronized (mon) {
            pending = true;
            mon.notifyAll();
        }
    }

    @Override
    public boolean awaitWake(Duration timeout) throws InterruptedException {
        long end = System.nanoTime() + Math.max(0L, timeout.toNanos());
        synchronized (mon) {
            while (!pending) {
                long waitNs = end - System.nanoTime();
                if (waitNs <= 0) return false;
                long ms = waitNs / 1_000_000L;
                int ns = (int) (waitNs % 1_000_000L);
                mon.wait(ms, ns);
            }
            pending = false;
            return true;
        }
    }

    /** @return whether a wake request is waiting to be consumed */
    public boolean isPending() {
        synchronized (mon) {
            return pending;
        }
    }
}
