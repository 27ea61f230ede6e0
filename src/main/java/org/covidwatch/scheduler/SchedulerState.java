package org.covidwatch.scheduler;

/**
 * Phases of one reconciliation cycle: {@code IDLE -> FETCHING -> PARSING -> RECONCILING ->
 * SLEEPING -> IDLE}. A failed fetch or parse goes straight from {@code FETCHING} or
 * {@code PARSING} to {@code SLEEPING}. {@code IDLE} is the state before the first tick, between
 * waking and the next fetch, and after the loop stops.
 */
public enum SchedulerState {
    IDLE,
    FETCHING,
    PARSING,
    RECONCILING,
    SLEEPING
}
