package com.crosswatch.application.config;

import com.crosswatch.domain.market.Symbol;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable per-symbol settings taken from the configuration snapshot.
 * A leverage of 0 leaves the account's current leverage untouched.
 */
public record SymbolSettings(
        Symbol symbol,
        int shortWindow,
        int longWindow,
        double quantity,
        Duration minInterval,
        int priceScale,
        int leverage,
        MarketType market
) {
    public SymbolSettings {
        Objects.requireNonNull(symbol, "symbol");
        minInterval = minInterval == null ? Duration.ZERO : minInterval;
        market = market == null ? MarketType.FUTURES : market;
    }

    public SymbolSettings(Symbol symbol, int shortWindow, int longWindow, double quantity,
                          Duration minInterval, int priceScale) {
        this(symbol, shortWindow, longWindow, quantity, minInterval, priceScale, 0, MarketType.FUTURES);
    }

    public boolean monitorOnly() {
        return market == MarketType.SPOT;
    }
}
