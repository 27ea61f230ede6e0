package org.covidwatch.catalog;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Builds an {@link AliasRegionCatalog} from a JSON document.
 * <p>
 * The source is either {@code classpath:<resource>} or a filesystem path. Document shape:
 * <pre>
 * {"countries": [
 *   {"name": "US", "aliases": ["USA", "United States"],
 *    "provinces": ["California", "Texas"],
 *    "provinceAliases": {"California": ["CA"]}}
 * ]}
 * </pre>
 */
public final class CatalogLoader {

    private static final Logger log = LoggerFactory.getLogger(CatalogLoader.class);
    private static final Gson GSON = new Gson();
    private static final String CLASSPATH_PREFIX = "classpath:";

    private CatalogLoader() {}

    /**
     * @throws IOException if the source can not be read or is not a valid catalog document
     */
    public static AliasRegionCatalog load(String source) throws IOException {
        try (Reader reader = open(source)) {
            CatalogDocument doc = GSON.fromJson(reader, CatalogDocument.class);
            if (doc == null || doc.countries == null || doc.countries.isEmpty()) {
                throw new IOException("catalog " + source + " lists no countries");
            }
            AliasRegionCatalog catalog = toCatalog(doc);
            log.info("Loaded region catalog from {}: {} countries", source, catalog.countries().size());
            return catalog;
        } catch (JsonParseException | IllegalArgumentException e) {
            throw new IOException("invalid catalog " + source + ": " + e.getMessage(), e);
        }
    }

    private static Reader open(String source) throws IOException {
        if (source.startsWith(CLASSPATH_PREFIX)) {
            String resource = source.substring(CLASSPATH_PREFIX.length());
            InputStream in = CatalogLoader.class.getClassLoader().getResourceAsStream(resource);
            if (in == null) {
                throw new IOException("catalog resource not found: " + resource);
            }
            return new InputStreamReader(in, StandardCharsets.UTF_8);
        }
        return Files.newBufferedReader(Path.of(source), StandardCharsets.UTF_8);
    }

    private static AliasRegionCatalog toCatalog(CatalogDocument doc) {
        AliasRegionCatalog.Builder b = AliasRegionCatalog.builder();
        for (CountryEntry c : doc.countries) {
            if (c.name == null) {
                throw new IllegalArgumentException("country entry without name");
            }
            b.country(c.name, c.aliases == null ? List.of() : c.aliases);
        }
        for (CountryEntry c : doc.countries) {
            if (c.provinces == null) continue;
            Map<String, List<String>> provinceAliases = c.provinceAliases == null ? Map.of() : c.provinceAliases;
            for (String p : c.provinces) {
                b.province(c.name, p, provinceAliases.getOrDefault(p, List.of()));
            }
        }
        return b.build();
    }

    /* ---- JSON shape ---- */

    private static final class CatalogDocument {
        List<CountryEntry> countries;
    }

    private static final class CountryEntry {
        String name;
        List<String> aliases;
        List<String> provinces;
        Map<String, List<String>> provinceAliases;
    }
}
