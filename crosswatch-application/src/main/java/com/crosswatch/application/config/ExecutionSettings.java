package com.crosswatch.application.config;

import com.crosswatch.application.execution.RetryPolicy;

import java.time.Duration;

public record ExecutionSettings(
        int maxAttempts,
        Duration backoffBase,
        Duration backoffMax,
        double ordersPerSecond,
        int orderBurst
) {
    public static ExecutionSettings defaults() {
        return new ExecutionSettings(3, Duration.ofSeconds(1), Duration.ofSeconds(30), 5.0, 5);
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(maxAttempts, backoffBase, backoffMax);
    }
}
