package com.crosswatch.application.ports;

import com.crosswatch.application.execution.ExecutionRequest;
import com.crosswatch.application.execution.OrderResult;

/**
 * Venue order placement.
 *
 * Implementations classify every failure as transient (retryable) or permanent
 * and report it through {@link OrderResult} instead of throwing.
 */
public interface OrderExecutionPort {
    OrderResult submitOrder(ExecutionRequest request);
}
