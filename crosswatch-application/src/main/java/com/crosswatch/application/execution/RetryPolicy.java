package com.crosswatch.application.execution;

import java.time.Duration;
import java.util.Objects;

/** Bounded exponential backoff: base * 2^(attempt-1), capped at {@code maxBackoff}. */
public record RetryPolicy(int maxAttempts, Duration baseBackoff, Duration maxBackoff) {

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        Objects.requireNonNull(baseBackoff, "baseBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
    }

    /** Delay before the attempt following {@code failedAttempt} (1-based). */
    public Duration backoffAfter(int failedAttempt) {
        int shift = Math.min(Math.max(failedAttempt - 1, 0), 20);
        Duration d = baseBackoff.multipliedBy(1L << shift);
        return d.compareTo(maxBackoff) > 0 ? maxBackoff : d;
    }

    public boolean canRetryAfter(int failedAttempt) {
        return failedAttempt < maxAttempts;
    }
}
