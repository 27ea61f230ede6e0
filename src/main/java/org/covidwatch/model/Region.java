package org.covidwatch.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * A country, or a province/state inside a country.
 * <p>
 * An empty {@code province} denotes the country-level aggregate. Regions order by
 * country, then province, which is also the tie-break order used by rankings.
 */
public record Region(String country, String province) implements Comparable<Region> {

    private static final Comparator<Region> ORDER =
            Comparator.comparing((Region r) -> r.country()).thenComparing(r -> r.province());

    public Region {
        Objects.requireNonNull(country, "country");
        if (country.isBlank()) {
            throw new IllegalArgumentException("blank country");
        }
        province = province == null ? "" : province;
    }

    /** Country-level region. */
    public static Region country(String country) {
        return new Region(country, "");
    }

    public static Region province(String country, String province) {
        if (province == null || province.isBlank()) {
            throw new IllegalArgumentException("blank province for " + country);
        }
        return new Region(country, province);
    }

    public boolean isCountryLevel() {
        return province.isEmpty();
    }

    /** The country-level region this one rolls up into (itself for countries). */
    public Region countryRegion() {
        return isCountryLevel() ? this : country(country);
    }

    /** {@code "Province, Country"} or just {@code "Country"}. */
    public String displayName() {
        return isCountryLevel() ? country : province + ", " + country;
    }

    @Override
    public int compareTo(Region other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return displayName();
    }
}
