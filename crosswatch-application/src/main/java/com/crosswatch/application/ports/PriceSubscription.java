package com.crosswatch.application.ports;

import com.crosswatch.application.error.PriceStreamClosedException;
import com.crosswatch.domain.market.PriceSample;

/**
 * Live, ordered price stream for one symbol. Not restartable once closed:
 * after {@link PriceStreamClosedException} the caller must subscribe again.
 */
public interface PriceSubscription extends AutoCloseable {

    /** Blocks until the next sample is available. */
    PriceSample next() throws InterruptedException, PriceStreamClosedException;

    /** Terminates the stream; a blocked {@link #next()} ends with {@link PriceStreamClosedException}. */
    @Override
    void close();
}
