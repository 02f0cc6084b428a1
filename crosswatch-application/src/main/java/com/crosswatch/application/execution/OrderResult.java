package com.crosswatch.application.execution;

/**
 * Venue answer to one order submission.
 * Retry decisions depend only on the variant, never on the reason text.
 */
public sealed interface OrderResult permits OrderResult.Success, OrderResult.TransientFailure, OrderResult.PermanentFailure {

    record Success(String orderId) implements OrderResult {}

    /** Network, timeout, rate limit: worth retrying. */
    record TransientFailure(String reason) implements OrderResult {}

    /** Rejected order, bad credentials, insufficient balance: never retried. */
    record PermanentFailure(String reason) implements OrderResult {}

    static OrderResult success(String orderId) {
        return new Success(orderId);
    }

    static OrderResult transientFailure(String reason) {
        return new TransientFailure(reason);
    }

    static OrderResult permanentFailure(String reason) {
        return new PermanentFailure(reason);
    }
}
