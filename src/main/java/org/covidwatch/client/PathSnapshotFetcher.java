package org.covidwatch.client;

import org.covidwatch.exceptions.FetchException;
import org.covidwatch.interfaces.SnapshotFetcher;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/** Reads the snapshot from a local file, e.g. a mirrored daily report. */
public final class PathSnapshotFetcher implements SnapshotFetcher {

    private final Path file;

    public PathSnapshotFetcher(Path file) {
        this.file = file;
    }

    @Override
    public byte[] fetch() throws FetchException {
        try {
            return Files.readAllBytes(file);
        } catch (NoSuchFileException e) {
            throw new FetchException("snapshot file not found: " + file, e);
        } catch (IOException e) {
            throw new FetchException("could not read " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return file.toAbsolutePath().toString();
    }
}
