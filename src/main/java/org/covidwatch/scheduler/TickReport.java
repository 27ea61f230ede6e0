package org.covidwatch.scheduler;

import java.time.Duration;
import java.time.Instant;

/**
 * What one reconciliation tick did.
 *
 * @param notified  subscriptions whose change was delivered
 * @param unchanged subscriptions whose figures matched the last delivery
 * @param failed    deliveries that threw; retried on the next successful tick
 * @param skipped   subscriptions whose region is absent from the snapshot
 */
public record TickReport(Outcome outcome,
                         Instant startedAt,
                         Duration took,
                         int notified,
                         int unchanged,
                         int failed,
                         int skipped,
                         String detail) {

    public enum Outcome {
        FETCH_FAILED,
        PARSE_FAILED,
        RECONCILED
    }

    static TickReport failed(Outcome outcome, Instant startedAt, Duration took, String detail) {
        return new TickReport(outcome, startedAt, took, 0, 0, 0, 0, detail);
    }

    public boolean reconciled() {
        return outcome == Outcome.RECONCILED;
    }
}
