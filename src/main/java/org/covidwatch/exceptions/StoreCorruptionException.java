package org.covidwatch.exceptions;

import java.nio.file.Path;

/**
 * The persisted subscription file exists but can not be read back.
 * Raised while opening the store; startup stops here unless corruption recovery is enabled.
 */
public class StoreCorruptionException extends RuntimeException {

    private final Path file;

    public StoreCorruptionException(Path file, String message, Throwable cause) {
        super("Subscription store " + file + " is unreadable: " + message, cause);
        this.file = file;
    }

    public Path file() {
        return file;
    }
}
