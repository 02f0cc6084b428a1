package com.crosswatch.application.ports;

import com.crosswatch.domain.market.PriceSample;
import com.crosswatch.domain.market.Symbol;

import java.time.Instant;
import java.util.List;

public interface PriceSourcePort {

    /**
     * Opens a stream of samples strictly newer than {@code after}.
     * With {@code after == null} only samples produced from now on are emitted.
     */
    PriceSubscription subscribe(Symbol symbol, Instant after) throws Exception;

    default PriceSubscription subscribe(Symbol symbol) throws Exception {
        return subscribe(symbol, null);
    }

    /** Most recent {@code limit} completed samples, oldest first. Used to warm the averages. */
    List<PriceSample> history(Symbol symbol, int limit) throws Exception;
}
