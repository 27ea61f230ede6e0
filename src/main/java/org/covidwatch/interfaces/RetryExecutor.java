package org.covidwatch.interfaces;

import java.util.concurrent.Callable;

public interface RetryExecutor {
    /**
     * Executes the given operation with retry.
     * @param op  A Callable whose call() may throw Exception. Returns a result or null.
     * @param <T> Result type
     * @return the result from the first successful attempt
     * @throws Exception the last failure once all attempts are used up
     */
    <T> T execute(Callable<T> op) throws Exception;
}
