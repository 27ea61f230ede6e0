package org.covidwatch.interfaces;

import org.covidwatch.exceptions.SnapshotParseException;
import org.covidwatch.model.Snapshot;

import java.time.Instant;

public interface SnapshotParser {

    /**
     * Turns raw tabular bytes into a snapshot stamped {@code fetchedAt}.
     *
     * @throws SnapshotParseException when the bytes are not a usable table, or
     *         {@link org.covidwatch.exceptions.EmptySnapshotException} when no row resolves
     */
    Snapshot parse(byte[] raw, Instant fetchedAt) throws SnapshotParseException;
}
