package com.crosswatch.application.execution;

import com.crosswatch.domain.signal.CrossoverEvent;

import java.util.Objects;

/** What the coordinator did with one crossover event. */
public record ExecutionOutcome(
        CrossoverEvent event,
        Status status,
        String orderId,
        int attempts,
        String reason
) {
    public enum Status {
        EXECUTED,
        SUPPRESSED,
        FAILED_TRANSIENT,
        FAILED_PERMANENT,
        SIGNAL_ONLY
    }

    public ExecutionOutcome {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(status, "status");
    }

    public static ExecutionOutcome executed(CrossoverEvent event, String orderId, int attempts) {
        return new ExecutionOutcome(event, Status.EXECUTED, orderId, attempts, null);
    }

    public static ExecutionOutcome suppressed(CrossoverEvent event, String reason) {
        return new ExecutionOutcome(event, Status.SUPPRESSED, null, 0, reason);
    }

    public static ExecutionOutcome failed(CrossoverEvent event, boolean permanent, int attempts, String reason) {
        return new ExecutionOutcome(event, permanent ? Status.FAILED_PERMANENT : Status.FAILED_TRANSIENT,
                null, attempts, reason);
    }

    public static ExecutionOutcome signalOnly(CrossoverEvent event) {
        return signalOnly(event, "auto-trade disabled");
    }

    public static ExecutionOutcome signalOnly(CrossoverEvent event, String reason) {
        return new ExecutionOutcome(event, Status.SIGNAL_ONLY, null, 0, reason);
    }

    public boolean isExecuted() {
        return status == Status.EXECUTED;
    }

    public boolean isFailure() {
        return status == Status.FAILED_TRANSIENT || status == Status.FAILED_PERMANENT;
    }
}
