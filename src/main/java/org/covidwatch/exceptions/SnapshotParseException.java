package org.covidwatch.exceptions;

/** Upstream bytes could not be turned into a snapshot. */
public class SnapshotParseException extends CovidWatchException {

    public SnapshotParseException(String message) {
        super(message);
    }

    public SnapshotParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
