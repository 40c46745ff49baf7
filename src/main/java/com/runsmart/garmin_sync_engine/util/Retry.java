package com.runsmart.garmin_sync_engine.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.function.IntFunction;
import java.util.function.Predicate;

/**
 * Bounded retry with exponential backoff. The delay before attempt {@code n + 1} is
 * {@code baseDelay * 2^(n - 1)}.
 */
public final class Retry {
    private static final Logger logger = LoggerFactory.getLogger(Retry.class);

    private Retry() {
    }

    public record Attempted<T>(T value, int attempts) {
    }

    public static Duration delayFor(Duration baseDelay, int attempt) {
        return baseDelay.multipliedBy(1L << Math.max(0, attempt - 1));
    }

    /**
     * Calls {@code call} with the 1-based attempt number until {@code shouldRetry} rejects the
     * result or {@code maxAttempts} is reached. Exceptions thrown by {@code call} are not retried.
     */
    public static <T> Attempted<T> withRetry(IntFunction<T> call,
                                             Predicate<T> shouldRetry,
                                             int maxAttempts,
                                             Duration baseDelay,
                                             Sleeper sleeper) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        int attempt = 1;
        while (true) {
            T result = call.apply(attempt);
            if (attempt >= maxAttempts || !shouldRetry.test(result)) {
                return new Attempted<>(result, attempt);
            }
            Duration delay = delayFor(baseDelay, attempt);
            logger.debug("Attempt {} of {} will be retried in {} ms", attempt, maxAttempts, delay.toMillis());
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new Attempted<>(result, attempt);
            }
            attempt++;
        }
    }
}
