package com.crosswatch.domain.signal;

import com.crosswatch.domain.market.Symbol;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;

/**
 * Snapshot of both moving averages for one symbol after an accepted sample.
 *
 * Values are kept unrounded; {@link #format(double, int)} is for display only.
 */
public record MAState(
        Symbol symbol,
        double shortValue,
        double longValue,
        long samples,
        boolean shortWarm,
        boolean longWarm,
        Instant lastTimestamp
) {

    /** The long window drives validity: no crossover is meaningful before it is full. */
    public boolean isWarm() {
        return longWarm;
    }

    public double difference() {
        return shortValue - longValue;
    }

    public String describe(int scale) {
        return "short=" + format(shortValue, scale) + " long=" + format(longValue, scale);
    }

    public static String format(double value, int scale) {
        if (!Double.isFinite(value)) return String.valueOf(value);
        return BigDecimal.valueOf(value).setScale(Math.max(0, scale), RoundingMode.HALF_UP).toPlainString();
    }
}
