package org.covidwatch.client;

import org.covidwatch.interfaces.SnapshotFetcher;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.Locale;

/** Picks the fetcher for a configured source location. */
public final class SnapshotFetchers {

    private SnapshotFetchers() {}

    /**
     * {@code http://} and {@code https://} locations are downloaded, {@code file:} URIs and
     * plain paths are read from disk.
     */
    public static SnapshotFetcher forLocation(String location, Duration timeout) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException("empty snapshot location");
        }
        String trimmed = location.trim();
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return new HttpSnapshotFetcher(URI.create(trimmed), timeout);
        }
        if (lower.startsWith("file:")) {
            return new PathSnapshotFetcher(Paths.get(URI.create(trimmed)));
        }
        return new PathSnapshotFetcher(Path.of(trimmed));
    }
}
