package com.libragraph.inventory.core.source;

import java.time.Duration;
import java.util.Objects;

/**
 * Bounded exponential backoff for object store reads.
 *
 * @param maxAttempts    total attempts including the first one (at least 1)
 * @param initialBackoff delay before the first retry; doubles up to {@code maxBackoff}
 * @param maxBackoff     upper bound for a single delay
 */
public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {

    public RetryPolicy {
        Objects.requireNonNull(initialBackoff, "initialBackoff cannot be null");
        Objects.requireNonNull(maxBackoff, "maxBackoff cannot be null");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1, got: " + maxAttempts);
        }
        if (initialBackoff.isNegative() || initialBackoff.isZero()) {
            throw new IllegalArgumentException("initialBackoff must be positive, got: " + initialBackoff);
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            maxBackoff = initialBackoff;
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(200), Duration.ofSeconds(5));
    }
}
