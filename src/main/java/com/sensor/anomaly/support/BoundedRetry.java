package com.sensor.anomaly.support;

import com.sensor.anomaly.exception.DependencyUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Retries a call against an external dependency a fixed number of times with exponential
 * backoff and full jitter. Exhaustion surfaces as {@link DependencyUnavailableException};
 * failures the predicate does not consider transient propagate unchanged on first occurrence.
 */
public class BoundedRetry {

    private static final Logger log = LoggerFactory.getLogger(BoundedRetry.class);

    private final String dependency;
    private final int maxAttempts;
    private final long initialBackoffMs;
    private final long maxBackoffMs;
    private final Predicate<Throwable> transientFailure;

    public BoundedRetry(String dependency, int maxAttempts, long initialBackoffMs, long maxBackoffMs,
                        Predicate<Throwable> transientFailure) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got " + maxAttempts);
        }
        this.dependency = dependency;
        this.maxAttempts = maxAttempts;
        this.initialBackoffMs = Math.max(0, initialBackoffMs);
        this.maxBackoffMs = Math.max(this.initialBackoffMs, maxBackoffMs);
        this.transientFailure = transientFailure;
    }

    public <T> T call(String operation, Supplier<T> action) {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return action.get();
            } catch (RuntimeException e) {
                if (!transientFailure.test(e)) {
                    throw e;
                }
                last = e;
                if (attempt < maxAttempts) {
                    long delay = backoffFor(attempt);
                    log.debug("{} {} failed (attempt {}/{}), retrying in {} ms: {}",
                            dependency, operation, attempt, maxAttempts, delay, e.getMessage());
                    sleep(delay, attempt, e);
                }
            }
        }
        log.warn("{} {} failed after {} attempt(s): {}", dependency, operation, maxAttempts,
                last.getMessage());
        throw new DependencyUnavailableException(dependency, maxAttempts, last);
    }

    public void run(String operation, Runnable action) {
        call(operation, () -> {
            action.run();
            return null;
        });
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    long backoffFor(int attempt) {
        long ceiling = Math.min(maxBackoffMs, initialBackoffMs << Math.min(attempt - 1, 20));
        if (ceiling <= 0) {
            return 0;
        }
        return ThreadLocalRandom.current().nextLong(ceiling + 1);
    }

    private void sleep(long delayMs, int attempt, RuntimeException cause) {
        if (delayMs <= 0) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new DependencyUnavailableException(dependency, attempt, cause);
        }
    }
}
