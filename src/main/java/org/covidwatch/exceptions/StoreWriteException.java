package org.covidwatch.exceptions;

/** The durable subscription file could not be replaced; in-memory state is unchanged. */
public class StoreWriteException extends CovidWatchException {

    public StoreWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
