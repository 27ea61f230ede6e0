package org.covidwatch;

import org.covidwatch.catalog.AliasRegionCatalog;
import org.covidwatch.catalog.CatalogLoader;
import org.covidwatch.exceptions.UnknownRegionException;
import org.covidwatch.interfaces.RegionCatalog;
import org.covidwatch.model.Region;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;

class RegionCatalogTest {

    private final RegionCatalog catalog = Fixtures.catalog();

    @Test
    void resolvesCanonicalNamesAndAliasesIgnoringCase() throws Exception {
        Region us = Region.country("US");
        assertEquals(us, catalog.resolve("US"));
        assertEquals(us, catalog.resolve("usa"));
        assertEquals(us, catalog.resolve("  United   States "));
        assertEquals(us, catalog.resolve("U.S.A."));
    }

    @Test
    void trailingStarAndAccentsAreIgnored() throws Exception {
        assertEquals(Region.country("Taiwan*"), catalog.resolve("taiwan"));
        assertEquals(Region.country("Taiwan*"), catalog.resolve("Taiwan*"));
        assertEquals(Region.country("Korea, South"), catalog.resolve("Korea, South"));
        assertEquals(Region.country("Korea, South"), catalog.resolve("south korea"));
        assertEquals(Region.province("Canada", "Quebec"), catalog.resolve("Québec"));
    }

    @Test
    void resolvesBareAndQualifiedProvinces() throws Exception {
        Region ca = Region.province("US", "California");
        assertEquals(ca, catalog.resolve("california"));
        assertEquals(ca, catalog.resolve("CA"));
        assertEquals(ca, catalog.resolve("California, US"));
        assertEquals(ca, catalog.resolve("california, usa"));
        assertEquals(Region.province("China", "Hubei"), catalog.resolve("Hubei, Mainland China"));
    }

    @Test
    void countryWinsOverProvinceWithSameName() throws Exception {
        assertEquals(Region.country("Georgia"), catalog.resolve("Georgia"));
        assertEquals(Region.province("US", "Georgia"), catalog.resolve("Georgia, US"));
    }

    @Test
    void ambiguousProvinceIsRejectedWithBothCandidates() {
        UnknownRegionException e = assertThrows(UnknownRegionException.class, () -> catalog.resolve("Punjab"));
        assertEquals(List.of(Region.province("India", "Punjab"), Region.province("Pakistan", "Punjab")),
                e.suggestions());
    }

    @Test
    void unknownNameCarriesSuggestions() {
        UnknownRegionException e = assertThrows(UnknownRegionException.class, () -> catalog.resolve("Itly"));
        assertEquals("Itly", e.query());
        assertTrue(e.suggestions().contains(Region.country("Italy")), "suggestions: " + e.suggestions());

        UnknownRegionException blank = assertThrows(UnknownRegionException.class, () -> catalog.resolve("   "));
        assertTrue(blank.suggestions().isEmpty());
    }

    @Test
    void suggestPrefersPrefixMatches() {
        List<Region> s = catalog.suggest("ger", 5);
        assertFalse(s.isEmpty());
        assertEquals(Region.country("Germany"), s.get(0));
        assertTrue(catalog.suggest("ger", 0).isEmpty());
    }

    @Test
    void resolveProvinceIsScopedToCountry() throws Exception {
        Region us = Region.country("US");
        assertEquals(Region.province("US", "New York"), catalog.resolveProvince(us, "NY"));
        assertThrows(UnknownRegionException.class, () -> catalog.resolveProvince(us, "Ontario"));
    }

    @Test
    void listReturnsCountryThenProvincesInCatalogOrder() {
        assertEquals(List.of(Region.country("Canada"),
                        Region.province("Canada", "Ontario"),
                        Region.province("Canada", "Quebec")),
                catalog.list(Region.country("Canada")));
        assertEquals(catalog.list(Region.country("Canada")), catalog.list(Region.province("Canada", "Quebec")));
        assertTrue(catalog.list(Region.country("Atlantis")).isEmpty());
    }

    @Test
    void countriesAreSorted() {
        List<Region> countries = catalog.countries();
        assertEquals(12, countries.size());
        assertEquals(Region.country("Australia"), countries.get(0));
        assertTrue(countries.stream().allMatch(Region::isCountryLevel));
    }

    @Test
    void conflictingAliasIsRejected() {
        AliasRegionCatalog.Builder b = AliasRegionCatalog.builder().country("Congo (Kinshasa)", List.of("Congo"));
        assertThrows(IllegalArgumentException.class, () -> b.country("Congo (Brazzaville)", List.of("Congo")));
    }

    @Test
    void bundledCatalogLoadsFromClasspath() throws Exception {
        AliasRegionCatalog bundled = CatalogLoader.load("classpath:regions.json");
        assertTrue(bundled.countries().size() > 150);
        assertEquals(Region.country("US"), bundled.resolve("United States"));
        assertEquals(Region.country("Taiwan*"), bundled.resolve("Taiwan"));
        assertEquals(Region.province("US", "California"), bundled.resolve("California"));
    }

    @Test
    void catalogLoadsFromFile(@TempDir Path tmp) throws Exception {
        Path file = tmp.resolve("regions.json");
        Files.writeString(file, "{\"countries\":[{\"name\":\"Narnia\",\"aliases\":[\"NA\"],"
                + "\"provinces\":[\"Cair Paravel\"],\"provinceAliases\":{\"Cair Paravel\":[\"CP\"]}}]}",
                StandardCharsets.UTF_8);
        AliasRegionCatalog loaded = CatalogLoader.load(file.toString());
        assertEquals(Region.country("Narnia"), loaded.resolve("na"));
        assertEquals(Region.province("Narnia", "Cair Paravel"), loaded.resolve("CP"));
    }

    @Test
    void invalidCatalogDocumentsFail(@TempDir Path tmp) throws Exception {
        Path empty = tmp.resolve("empty.json");
        Files.writeString(empty, "{\"countries\":[]}", StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> CatalogLoader.load(empty.toString()));

        Path broken = tmp.resolve("broken.json");
        Files.writeString(broken, "{\"countries\":[{\"name\":", StandardCharsets.UTF_8);
        assertThrows(IOException.class, () -> CatalogLoader.load(broken.toString()));

        assertThrows(IOException.class, () -> CatalogLoader.load("classpath:no-such-catalog.json"));
    }

    @Test
    void regionsOrderByCountryThenProvince() {
        Region ny = Region.province("US", "New York");
        Region ca = Region.province("US", "California");
        Region us = Region.country("US");
        Region italy = Region.country("Italy");

        TreeSet<Region> sorted = new TreeSet<>(List.of(ny, us, italy, ca));
        assertEquals(List.of(italy, us, ca, ny), List.copyOf(sorted));
        assertTrue(us.compareTo(ca) < 0, "country-level entry sorts before its provinces");
        assertEquals(0, ca.compareTo(Region.province("US", "California")));
    }
}
