package com.crosswatch.domain.signal;

import com.crosswatch.domain.market.PriceSample;
import com.crosswatch.domain.market.Symbol;

/** A discarded sample and why it was discarded. */
public record DataQualityIssue(Symbol symbol, PriceSample sample, Reason reason, String detail) {

    public enum Reason {
        OUT_OF_ORDER,
        INVALID_PRICE,
        SYMBOL_MISMATCH,
        MISSING
    }

    @Override
    public String toString() {
        return "DataQuality[" + symbol + "] " + reason + ": " + detail;
    }
}
