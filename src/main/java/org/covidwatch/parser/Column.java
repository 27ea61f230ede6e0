package org.covidwatch.parser;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Column semantics recognised in upstream headers.
 * <p>
 * Headers are matched by name, never by position: case, spaces, {@code _} and {@code /}
 * are ignored, and every column accepts the spellings the upstream has used over time.
 */
enum Column {
    COUNTRY("Country_Region", "Country/Region", "Country"),
    PROVINCE("Province_State", "Province/State", "Province", "State"),
    LAST_UPDATE("Last_Update", "Last Update", "Updated"),
    CONFIRMED("Confirmed", "Cases"),
    DEATHS("Deaths"),
    RECOVERED("Recovered"),
    ACTIVE("Active"),
    INCIDENT_RATE("Incident_Rate", "Incidence_Rate", "Incident Rate"),
    PEOPLE_TESTED("People_Tested", "Total_Test_Results", "Tested");

    private final List<String> synonyms;

    Column(String... names) {
        this.synonyms = List.of(names).stream().map(Column::squash).toList();
    }

    /** Finds the header that carries this column, if any. */
    Optional<String> locate(List<String> headers) {
        for (String h : headers) {
            if (h != null && synonyms.contains(squash(h))) {
                return Optional.of(h);
            }
        }
        return Optional.empty();
    }

    static boolean isMetric(Column c) {
        return c != COUNTRY && c != PROVINCE && c != LAST_UPDATE;
    }

    static String squash(String header) {
        StringBuilder sb = new StringBuilder(header.length());
        for (char ch : header.toLowerCase(Locale.ROOT).toCharArray()) {
            if (Character.isLetterOrDigit(ch)) sb.append(ch);
        }
        return sb.toString();
    }

    /** Header name per column, for log lines. */
    static String describe(Map<Column, String> mapping) {
        StringBuilder sb = new StringBuilder();
        mapping.forEach((c, h) -> sb.append(sb.length() == 0 ? "" : ", ").append(c).append('=').append(h));
        return sb.toString();
    }
}
