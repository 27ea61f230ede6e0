package org.covidwatch.service;

import java.util.Objects;

/**
 * Outcome of a command: either a value or a {@link CommandError}, never both.
 *
 * @param <T> value type; {@link Void} for commands that only acknowledge
 */
public final class CommandResult<T> {

    private final T value;
    private final CommandError error;

    private CommandResult(T value, CommandError error) {
        this.value = value;
        this.error = error;
    }

    public static <T> CommandResult<T> ok(T value) {
        return new CommandResult<>(value, null);
    }

    public static <T> CommandResult<T> fail(CommandError error) {
        return new CommandResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> CommandResult<T> fail(CommandError.Code code, String message) {
        return fail(CommandError.of(code, message));
    }

    public boolean isOk() {
        return error == null;
    }

    /** @throws IllegalStateException if this result is an error */
    public T value() {
        if (error != null) {
            throw new IllegalStateException("no value, command failed: " + error.code() + " " + error.message());
        }
        return value;
    }

    /** @return the error, or {@code null} on success */
    public CommandError error() {
        return error;
    }

    @Override
    public String toString() {
        return isOk() ? "ok(" + value + ")" : "error(" + error.code() + ": " + error.message() + ")";
    }
}
