package org.covidwatch.model;

import java.util.function.Function;

/** The individual figures of a {@link MetricSet}, in display order. */
public enum Metric {
    CONFIRMED("Confirmed", MetricSet::confirmed),
    DEATHS("Deaths", MetricSet::deaths),
    RECOVERED("Recovered", MetricSet::recovered),
    ACTIVE("Active", MetricSet::active),
    INCIDENT_RATE("Incident Rate", MetricSet::incidentRate),
    PEOPLE_TESTED("People Tested", MetricSet::peopleTested);

    private final String label;
    private final Function<MetricSet, Number> getter;

    Metric(String label, Function<MetricSet, Number> getter) {
        this.label = label;
        this.getter = getter;
    }

    public String label() {
        return label;
    }

    /** @return the figure, or {@code null} when unknown */
    public Number valueOf(MetricSet metrics) {
        return metrics == null ? null : getter.apply(metrics);
    }
}
