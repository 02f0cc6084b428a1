package com.crosswatch.domain.signal;

import com.crosswatch.domain.market.Symbol;

import java.time.Instant;
import java.util.Objects;

public record CrossoverEvent(
        Symbol symbol,
        CrossDirection direction,
        Instant timestamp,
        double shortValue,
        double longValue
) {
    public CrossoverEvent {
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(timestamp, "timestamp");
    }
}
