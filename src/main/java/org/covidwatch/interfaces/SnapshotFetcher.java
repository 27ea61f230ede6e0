package org.covidwatch.interfaces;

import org.covidwatch.exceptions.FetchException;

/** Opaque source of raw snapshot bytes. Retry policy belongs to the caller. */
public interface SnapshotFetcher {

    byte[] fetch() throws FetchException;

    /** Human-readable origin, used in log lines. */
    String describe();
}
