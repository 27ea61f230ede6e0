package org.covidwatch.notify;

import org.covidwatch.interfaces.Notifier;
import org.covidwatch.model.Metric;
import org.covidwatch.model.MetricChange;
import org.covidwatch.model.MetricSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.Map;

/**
 * Writes each change to the log, e.g.
 * {@code [guild-42] US: Confirmed 1200 (+200), Deaths 30, Recovered 400 (+10)}.
 * Delivery can not fail, so every change counts as delivered.
 */
public final class LoggingNotifier implements Notifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotifier.class);

    @Override
    public void notify(MetricChange change) {
        log.info("[{}] {}{}: {}", change.subscriberId(), change.region().displayName(),
                change.isInitial() ? " (first update)" : "", render(change));
    }

    static String render(MetricChange change) {
        MetricSet current = change.current();
        Map<Metric, String> deltas = change.deltas();
        StringBuilder sb = new StringBuilder();
        for (Metric m : Metric.values()) {
            Number v = m.valueOf(current);
            if (v == null) {
                continue;
            }
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(m.label()).append(' ').append(format(m, v));
            String delta = deltas.get(m);
            if (delta != null) {
                sb.append(" (").append(delta).append(')');
            }
        }
        return sb.length() == 0 ? "no figures reported" : sb.toString();
    }

    private static String format(Metric m, Number v) {
        return m == Metric.INCIDENT_RATE ? String.format(Locale.ROOT, "%.2f", v.doubleValue()) : v.toString();
    }
}
