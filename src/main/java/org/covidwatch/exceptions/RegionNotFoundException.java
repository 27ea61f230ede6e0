package org.covidwatch.exceptions;

import org.covidwatch.model.Region;

/** A catalogued region that has no figures in the snapshot being queried. */
public class RegionNotFoundException extends CovidWatchException {

    private final Region region;

    public RegionNotFoundException(Region region) {
        super("No data for " + region.displayName());
        this.region = region;
    }

    public Region region() {
        return region;
    }
}
