package org.covidwatch.exceptions;

/** Transport-level failure while fetching raw snapshot bytes. */
public class FetchException extends CovidWatchException {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
