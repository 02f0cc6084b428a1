package com.crosswatch.domain.signal;

import java.util.Locale;

/**
 * Averaging formula used by {@link MovingAverageTracker}.
 *
 * EMA uses k = 2 / (n + 1) and is seeded with the simple average of the first n samples.
 * SMA is a plain rolling-window mean.
 */
public enum MovingAverageType {
    EMA,
    SMA;

    RollingAverage newAverage(int period) {
        return switch (this) {
            case EMA -> new ExponentialAverage(period);
            case SMA -> new SimpleAverage(period);
        };
    }

    public static MovingAverageType parse(String raw) {
        if (raw == null || raw.isBlank()) return EMA;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unsupported moving average type: " + raw);
        }
    }
}
