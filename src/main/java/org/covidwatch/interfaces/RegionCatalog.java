package org.covidwatch.interfaces;

import org.covidwatch.exceptions.UnknownRegionException;
import org.covidwatch.model.Region;

import java.util.List;

/**
 * Canonical country/province names and their aliases. Read-only once built.
 */
public interface RegionCatalog {

    /** Resolve user or upstream input ("usa", "California", "Hubei, China") to a region. */
    Region resolve(String rawName) throws UnknownRegionException;

    /** Resolve a province name within an already resolved country. */
    Region resolveProvince(Region country, String rawProvince) throws UnknownRegionException;

    /** Country-level entry first, then its provinces in catalog order. */
    List<Region> list(Region country);

    /** All country-level regions, sorted. */
    List<Region> countries();

    /** Close matches for an unresolvable name, at most {@code max}. */
    List<Region> suggest(String rawName, int max);
}
