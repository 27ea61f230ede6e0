package org.covidwatch.interfaces;

import org.covidwatch.exceptions.NotifyDeliveryException;
import org.covidwatch.model.MetricChange;

/**
 * Delivery sink for detected changes.
 * <p>
 * Returning normally means delivery is confirmed; any exception counts as a failed
 * delivery and the change is offered again on the next reconciliation.
 */
public interface Notifier {

    void notify(MetricChange change) throws NotifyDeliveryException;
}
