package com.crosswatch.application.execution;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;

import java.time.Duration;

/**
 * Global limit for outbound order requests, shared by all symbol workers.
 * Venue limits are per account, not per symbol.
 *
 * <p>{@code burst} permits are handed out per refresh period of {@code burst / permitsPerSecond} seconds.
 * A non-positive rate disables limiting; a positive rate must lie within {@link #MIN_RATE}..{@link #MAX_RATE}.
 */
public final class OrderRateLimiter {

    static final String NAME = "venue-orders";

    /** One order per ~17 minutes; slower rates overflow the refresh period arithmetic. */
    public static final double MIN_RATE = 0.001;
    public static final double MAX_RATE = 1_000;
    private static final Duration MAX_WAIT = Duration.ofSeconds(30);

    private final RateLimiter limiter;

    public OrderRateLimiter(double permitsPerSecond, int burst) {
        if (Double.isNaN(permitsPerSecond) || permitsPerSecond > MAX_RATE
                || (permitsPerSecond > 0 && permitsPerSecond < MIN_RATE)) {
            throw new IllegalArgumentException("Order rate must be <= 0 or within " + MIN_RATE + ".." + MAX_RATE
                    + " per second, got " + permitsPerSecond);
        }
        if (!(permitsPerSecond > 0)) {
            this.limiter = null;
            return;
        }
        int permits = Math.max(1, burst);
        long periodNanos = Math.max(1L, Math.round(permits / permitsPerSecond * 1_000_000_000L));
        this.limiter = RateLimiter.of(NAME, RateLimiterConfig.custom()
                .limitForPeriod(permits)
                .limitRefreshPeriod(Duration.ofNanos(periodNanos))
                .timeoutDuration(maxWait(periodNanos))
                .build());
    }

    // must cover a full period, otherwise acquirePermission() fails fast instead of waiting
    private static Duration maxWait(long periodNanos) {
        Duration period = Duration.ofNanos(periodNanos).multipliedBy(2);
        return period.compareTo(MAX_WAIT) > 0 ? period : MAX_WAIT;
    }

    /** Limiter that never waits. */
    public static OrderRateLimiter unlimited() {
        return new OrderRateLimiter(0, 1);
    }

    public boolean isUnlimited() {
        return limiter == null;
    }

    /** Blocks until a permit is available. */
    public void acquire() throws InterruptedException {
        if (limiter == null) return;
        while (!limiter.acquirePermission()) {
            // resilience4j restores the interrupt flag instead of throwing
            if (Thread.interrupted()) throw new InterruptedException("Interrupted while waiting for an order permit");
        }
    }

    /** Permits left in the current period; -1 when unlimited. */
    public int availablePermits() {
        return limiter == null ? -1 : limiter.getMetrics().getAvailablePermissions();
    }
}
