package org.covidwatch.exceptions;

/** The upstream data parsed, but not a single row resolved to a known region. */
public class EmptySnapshotException extends SnapshotParseException {

    private final int skippedRows;

    public EmptySnapshotException(int skippedRows) {
        super("Snapshot contains no valid region (" + skippedRows + " rows skipped)");
        this.skippedRows = skippedRows;
    }

    public int skippedRows() {
        return skippedRows;
    }
}
