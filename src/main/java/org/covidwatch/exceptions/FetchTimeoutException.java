package org.covidwatch.exceptions;

import java.time.Duration;

public class FetchTimeoutException extends FetchException {

    public FetchTimeoutException(Duration timeout) {
        super("Fetch did not complete within " + timeout.toMillis() + "ms");
    }

    public FetchTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
