package org.covidwatch.parser;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;
import org.covidwatch.exceptions.EmptySnapshotException;
import org.covidwatch.exceptions.SnapshotParseException;
import org.covidwatch.exceptions.UnknownRegionException;
import org.covidwatch.interfaces.RegionCatalog;
import org.covidwatch.interfaces.SnapshotParser;
import org.covidwatch.model.MetricSet;
import org.covidwatch.model.Region;
import org.covidwatch.model.Snapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Parses upstream CSV snapshots (JHU daily-report layout and its variants).
 * <p>
 * <b>Behaviour:</b>
 * <ul>
 *   <li>Columns are found by header name; a missing metric column makes that figure unknown.
 *       A name that appears twice rejects the snapshot.</li>
 *   <li>Rows whose region the catalog can not resolve are skipped and recorded as warnings.</li>
 *   <li>Unparseable or negative numbers become unknown for that row only.</li>
 *   <li>Several rows for one region (US counties, say) are merged into one.</li>
 * </ul>
 */
public final class CsvSnapshotParser implements SnapshotParser {

    private static final Logger log = LoggerFactory.getLogger(CsvSnapshotParser.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .setAllowMissingColumnNames(true)
            // a repeated column name would make the column lookup ambiguous
            .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_EMPTY)
            .build();

    private static final DateTimeFormatter SPACE_SEPARATED = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final DateTimeFormatter US_SHORT = DateTimeFormatter.ofPattern("M/d/yy H:mm");

    private final RegionCatalog catalog;

    public CsvSnapshotParser(RegionCatalog catalog) {
        this.catalog = catalog;
    }

    @Override
    public Snapshot parse(byte[] raw, Instant fetchedAt) throws SnapshotParseException {
        if (raw == null || raw.length == 0) {
            throw new SnapshotParseException("empty input");
        }
        String text = new String(raw, StandardCharsets.UTF_8);
        if (text.startsWith("\uFEFF")) {
            text = text.substring(1);
        }

        try (CSVParser parser = FORMAT.parse(new StringReader(text))) {
            Map<Column, String> columns = mapColumns(parser.getHeaderNames());
            log.debug("Snapshot columns: {}", Column.describe(columns));

            Map<Region, MetricSet> regions = new HashMap<>();
            List<String> warnings = new ArrayList<>();
            int skipped = 0;

            for (CSVRecord record : parser) {
                long rowNo = record.getRecordNumber() + 1; // header is line 1
                Region region;
                try {
                    region = regionOf(record, columns);
                } catch (UnknownRegionException e) {
                    warnings.add("row " + rowNo + ": " + e.getMessage());
                    skipped++;
                    continue;
                }
                MetricSet metrics = metricsOf(record, columns, rowNo, fetchedAt, warnings);
                regions.merge(region, metrics, MetricSet::merge);
            }

            if (regions.isEmpty()) {
                throw new EmptySnapshotException(skipped);
            }
            if (skipped > 0) {
                log.warn("Snapshot skipped {} unresolvable rows", skipped);
            }
            warnings.forEach(w -> log.debug("Snapshot warning: {}", w));
            log.info("Parsed snapshot: {} regions, {} warnings", regions.size(), warnings.size());
            return new Snapshot(fetchedAt, regions, warnings);

        } catch (IOException | UncheckedIOException e) {
            throw new SnapshotParseException("malformed CSV: " + e.getMessage(), e);
        } catch (IllegalArgumentException | IllegalStateException e) {
            // commons-csv reports header problems (duplicates, missing) this way
            throw new SnapshotParseException("malformed CSV header: " + e.getMessage(), e);
        }
    }

    /* -------------------- helpers -------------------- */

    private static Map<Column, String> mapColumns(List<String> headers) throws SnapshotParseException {
        Map<Column, String> mapping = new EnumMap<>(Column.class);
        for (Column c : Column.values()) {
            c.locate(headers).ifPresent(h -> mapping.put(c, h));
        }
        if (!mapping.containsKey(Column.COUNTRY)) {
            throw new SnapshotParseException("no country column in header " + headers);
        }
        if (mapping.keySet().stream().noneMatch(Column::isMetric)) {
            throw new SnapshotParseException("no metric columns in header " + headers);
        }
        return mapping;
    }

    private Region regionOf(CSVRecord record, Map<Column, String> columns) throws UnknownRegionException {
        String countryRaw = cell(record, columns, Column.COUNTRY);
        String provinceRaw = cell(record, columns, Column.PROVINCE);
        Region country = catalog.resolve(countryRaw);
        if (provinceRaw.isEmpty() || provinceRaw.equalsIgnoreCase(countryRaw)
                || provinceRaw.equalsIgnoreCase(country.country())) {
            return country;
        }
        return catalog.resolveProvince(country.countryRegion(), provinceRaw);
    }

    private static MetricSet metricsOf(CSVRecord record, Map<Column, String> columns, long rowNo,
                                       Instant fetchedAt, List<String> warnings) {
        Instant asOf = parseInstant(cell(record, columns, Column.LAST_UPDATE));
        return MetricSet.builder()
                .confirmed(count(record, columns, Column.CONFIRMED, rowNo, warnings))
                .deaths(count(record, columns, Column.DEATHS, rowNo, warnings))
                .recovered(count(record, columns, Column.RECOVERED, rowNo, warnings))
                .active(count(record, columns, Column.ACTIVE, rowNo, warnings))
                .incidentRate(rate(record, columns, rowNo, warnings))
                .peopleTested(count(record, columns, Column.PEOPLE_TESTED, rowNo, warnings))
                .asOf(asOf == null ? fetchedAt : asOf)
                .build();
    }

    private static String cell(CSVRecord record, Map<Column, String> columns, Column c) {
        String header = columns.get(c);
        if (header == null || !record.isSet(header)) {
            return "";
        }
        String v = record.get(header);
        return v == null ? "" : v.trim();
    }

    /** Whole non-negative number, or {@code null}. Accepts {@code "12.0"} as upstream sometimes writes. */
    private static Long count(CSVRecord record, Map<Column, String> columns, Column c,
                              long rowNo, List<String> warnings) {
        String v = cell(record, columns, c);
        if (v.isEmpty()) {
            return null;
        }
        try {
            BigDecimal d = new BigDecimal(v);
            if (d.signum() < 0) {
                warnings.add("row " + rowNo + ": negative " + c + " '" + v + "' treated as unknown");
                return null;
            }
            return d.longValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            warnings.add("row " + rowNo + ": unparseable " + c + " '" + v + "' treated as unknown");
            return null;
        }
    }

    private static Double rate(CSVRecord record, Map<Column, String> columns, long rowNo, List<String> warnings) {
        String v = cell(record, columns, Column.INCIDENT_RATE);
        if (v.isEmpty()) {
            return null;
        }
        try {
            double d = Double.parseDouble(v);
            if (d < 0 || Double.isNaN(d) || Double.isInfinite(d)) {
                warnings.add("row " + rowNo + ": invalid INCIDENT_RATE '" + v + "' treated as unknown");
                return null;
            }
            return d;
        } catch (NumberFormatException e) {
            warnings.add("row " + rowNo + ": unparseable INCIDENT_RATE '" + v + "' treated as unknown");
            return null;
        }
    }

    /** ISO date-time, {@code yyyy-MM-dd HH:mm:ss}, {@code M/d/yy H:mm} (all UTC) or epoch millis. */
    static Instant parseInstant(String v) {
        if (v == null || v.isEmpty()) {
            return null;
        }
        if (v.chars().allMatch(Character::isDigit)) {
            try {
                return Instant.ofEpochMilli(Long.parseLong(v));
            } catch (NumberFormatException e) {
                return null;
            }
        }
        try {
            return OffsetDateTime.parse(v).toInstant();
        } catch (DateTimeParseException ignored) {
            // try the next layout
        }
        for (DateTimeFormatter f : List.of(DateTimeFormatter.ISO_LOCAL_DATE_TIME, SPACE_SEPARATED, US_SHORT)) {
            try {
                return LocalDateTime.parse(v, f).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                // try the next layout
            }
        }
        return null;
    }
}
