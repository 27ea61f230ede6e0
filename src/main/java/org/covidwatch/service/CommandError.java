package org.covidwatch.service;

import java.util.List;
import java.util.Objects;

/**
 * Structured failure of a command. {@code suggestions} holds display names of close region
 * matches and is empty for every code except {@link Code#UNKNOWN_REGION}.
 */
public record CommandError(Code code, String message, List<String> suggestions) {

    public enum Code {
        /** The region query matched nothing in the catalog. */
        UNKNOWN_REGION,
        /** No snapshot yet, or the snapshot has nothing for the region. */
        NO_DATA,
        INVALID_ARGUMENT,
        SUBSCRIPTION_LIMIT,
        NOT_SUBSCRIBED,
        /** The subscription could not be persisted; nothing was changed. */
        STORE_FAILURE
    }

    public CommandError {
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(message, "message");
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
    }

    public static CommandError of(Code code, String message) {
        return new CommandError(code, message, List.of());
    }
}
