package org.covidwatch.model;

import java.util.Set;

/**
 * Global sums across countries.
 *
 * @param metrics        summed figures; a figure no country reported is unknown
 * @param complete       {@code false} when at least one region had an unknown figure that
 *                       was left out of a sum
 * @param incomplete     the regions whose unknown figures were excluded
 * @param countryCount   number of countries that contributed
 */
public record Totals(MetricSet metrics, boolean complete, Set<Region> incomplete, int countryCount) {

    public Totals {
        incomplete = Set.copyOf(incomplete);
    }
}
