package org.covidwatch.exceptions;

/** Base of the recoverable, checked failures raised by the tracker core. */
public class CovidWatchException extends Exception {

    public CovidWatchException(String message) {
        super(message);
    }

    public CovidWatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
