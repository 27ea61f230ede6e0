package org.covidwatch.exceptions;

/** A notifier could not confirm delivery to one subscriber. */
public class NotifyDeliveryException extends CovidWatchException {

    public NotifyDeliveryException(String message) {
        super(message);
    }

    public NotifyDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
