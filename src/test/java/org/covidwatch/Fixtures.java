package org.covidwatch;

import org.covidwatch.catalog.AliasRegionCatalog;
import org.covidwatch.model.MetricSet;
import org.covidwatch.model.Region;
import org.covidwatch.model.Snapshot;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Shared test data: a small catalog, CSV builders and snapshot shortcuts. */
final class Fixtures {

    static final Instant T0 = Instant.parse("2020-04-01T00:00:00Z");

    static final String JHU_HEADER =
            "FIPS,Admin2,Province_State,Country_Region,Last_Update,Lat,Long_,Confirmed,Deaths,Recovered,Active,Combined_Key,Incident_Rate,Case_Fatality_Ratio";

    private Fixtures() {}

    static AliasRegionCatalog catalog() {
        return AliasRegionCatalog.builder()
                .country("US", List.of("USA", "United States", "America"))
                .country("Canada")
                .country("China", List.of("Mainland China"))
                .country("Australia")
                .country("Italy")
                .country("Germany")
                .country("France")
                .country("Georgia")
                .country("India")
                .country("Pakistan")
                .country("Taiwan*", List.of("Taiwan"))
                .country("Korea, South", List.of("South Korea", "Republic of Korea"))
                .province("US", "California", List.of("CA"))
                .province("US", "New York", List.of("NY"))
                .province("US", "Washington", List.of("WA"))
                .province("US", "Georgia", List.of("GA"))
                .province("Canada", "Ontario")
                .province("Canada", "Quebec")
                .province("China", "Hubei")
                .province("China", "Hong Kong", List.of("HK"))
                .province("Australia", "New South Wales", List.of("NSW"))
                .province("Australia", "Victoria")
                .province("India", "Punjab")
                .province("Pakistan", "Punjab")
                .build();
    }

    static byte[] csv(String header, String... rows) {
        StringBuilder sb = new StringBuilder(header).append("\r\n");
        for (String r : rows) {
            sb.append(r).append("\r\n");
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    /** Minimal layout: country, province, confirmed, deaths, recovered. */
    static byte[] simpleCsv(String... rows) {
        return csv("Country_Region,Province_State,Confirmed,Deaths,Recovered", rows);
    }

    static byte[] resource(String name) {
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream(name)) {
            if (in == null) {
                throw new IllegalStateException("missing test resource " + name);
            }
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static MetricSet counts(long confirmed, long deaths, long recovered) {
        return MetricSet.ofCounts(confirmed, deaths, recovered, T0);
    }

    static MetricSet confirmedOnly(long confirmed) {
        return MetricSet.builder().confirmed(confirmed).asOf(T0).build();
    }

    static Snapshot snapshot(Object... regionThenMetrics) {
        Map<Region, MetricSet> rows = new LinkedHashMap<>();
        for (int i = 0; i < regionThenMetrics.length; i += 2) {
            rows.put((Region) regionThenMetrics[i], (MetricSet) regionThenMetrics[i + 1]);
        }
        return new Snapshot(T0, rows, List.of());
    }
}
