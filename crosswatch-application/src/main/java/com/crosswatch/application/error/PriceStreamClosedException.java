package com.crosswatch.application.error;

/**
 * The price stream terminated (closed locally or disconnected by the adapter).
 * Recoverable: the consumer resubscribes.
 */
public class PriceStreamClosedException extends Exception {

    public PriceStreamClosedException(String message) {
        super(message);
    }

    public PriceStreamClosedException(String message, Throwable cause) {
        super(message, cause);
    }
}
