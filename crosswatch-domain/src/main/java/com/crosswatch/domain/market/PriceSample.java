package com.crosswatch.domain.market;

import java.time.Instant;
import java.util.Objects;

/** One timestamped price observation for a symbol. */
public record PriceSample(
        Symbol symbol,
        Instant timestamp,
        double price
) {
    public PriceSample {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(timestamp, "timestamp");
    }

    public static PriceSample of(String symbol, long epochMillis, double price) {
        return new PriceSample(Symbol.of(symbol), Instant.ofEpochMilli(epochMillis), price);
    }
}
