package org.covidwatch.exceptions;

public class SubscriptionLimitException extends CovidWatchException {

    private final int limit;

    public SubscriptionLimitException(String subscriberId, int limit) {
        super("Subscriber " + subscriberId + " already watches " + limit + " regions");
        this.limit = limit;
    }

    public int limit() {
        return limit;
    }
}
