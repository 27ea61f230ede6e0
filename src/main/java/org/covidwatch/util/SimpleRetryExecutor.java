package org.covidwatch.util;

import org.covidwatch.interfaces.RetryExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ThreadLocalRandom;

/**
 * SimpleRetryExecutor retries a failing operation with exponential backoff and optional
 * jitter. The reconciliation scheduler uses it around each snapshot fetch.
 * <p>
 * <b>Notes:</b>
 * <ul>
 *   <li>Retry count is fixed; delays double from {@code baseDelay} and are capped by {@code maxDelay}.</li>
 *   <li>Sleeping blocks the calling thread only, which is the scheduler thread.</li>
 *   <li>An interrupt during backoff stops retrying and rethrows the last failure.</li>
 * </ul>
 */
public final class SimpleRetryExecutor implements RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(SimpleRetryExecutor.class);

    /** Maximum number of attempts (inclusive of first try). */
    private final int maxAttempts;

    /** Delay before the first retry, in milliseconds. */
    private final long baseDelayMs;

    /** Maximum allowed delay between retries, in milliseconds. */
    private final long maxDelayMs;

    /** Maximum random jitter applied to each delay, in milliseconds. */
    private final long jitterMs;

    /**
     * @param maxAttempts maximum number of attempts (minimum 1)
     * @param baseDelay   delay before the first retry
     * @param maxDelay    cap for the exponential backoff
     * @param jitter      random jitter range added to each delay
     */
    public SimpleRetryExecutor(int maxAttempts, Duration baseDelay, Duration maxDelay, Duration jitter) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseDelayMs = Math.max(0, baseDelay.toMillis());
        this.maxDelayMs  = Math.max(this.baseDelayMs, maxDelay.toMillis());
        this.jitterMs    = Math.max(0, jitter.toMillis());
    }

    /** Single attempt, no backoff. */
    public static SimpleRetryExecutor once() {
        return new SimpleRetryExecutor(1, Duration.ZERO, Duration.ZERO, Duration.ZERO);
    }

    /**
     * Executes the provided operation with retry semantics.
     * <p>
     * Attempt {@code n} (n &ge; 2) waits {@code baseDelay * 2^(n-2)}, capped by
     * {@code maxDelay}, plus up to {@code jitter}.
     * </p>
     *
     * @param op the operation to execute; should throw on transient failure
     * @param <T> return type of the callable
     * @return result of {@code op.call()} if successful
     * @throws Exception the failure of the last attempt
     */
    @Override
    public <T> T execute(Callable<T> op) throws Exception {
        int attempt = 0;
        while (true) {
            attempt++;
            try {
                return op.call();
            } catch (Exception e) {
                if (attempt >= maxAttempts) {
                    throw e;
                }

                long delay = baseDelayMs << Math.min(30, attempt - 1);
                if (delay > maxDelayMs || delay < 0) delay = maxDelayMs;
                long sleep = delay + (jitterMs > 0 ? ThreadLocalRandom.current().nextLong(jitterMs) : 0L);

                log.info("Retry attempt {}/{} in {}ms (error: {})", attempt + 1, maxAttempts, sleep, e.getMessage());

                try {
                    Thread.sleep(sleep);
                } catch (InterruptedException ie) {
                    // restore interrupt flag before rethrowing
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }
}
