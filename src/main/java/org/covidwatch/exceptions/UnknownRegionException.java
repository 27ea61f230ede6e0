package org.covidwatch.exceptions;

import org.covidwatch.model.Region;

import java.util.List;

/**
 * A region name that no catalog entry or alias matches. Carries close candidates so the
 * caller can decide whether to offer them.
 */
public class UnknownRegionException extends CovidWatchException {

    private final String query;
    private final List<Region> suggestions;

    public UnknownRegionException(String query, List<Region> suggestions) {
        super("Unknown region: '" + query + "'");
        this.query = query;
        this.suggestions = List.copyOf(suggestions);
    }

    public String query() {
        return query;
    }

    public List<Region> suggestions() {
        return suggestions;
    }
}
