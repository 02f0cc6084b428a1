package com.crosswatch.application.config;

import java.util.Locale;

/**
 * Market a symbol is watched on. FUTURES symbols may trade; SPOT symbols are monitor-only
 * and never reach the order venue.
 */
public enum MarketType {
    FUTURES,
    SPOT;

    /** Accepts CONTRACT as an alias for FUTURES. */
    public static MarketType parse(String raw) {
        if (raw == null || raw.isBlank()) return FUTURES;
        String v = raw.trim().toUpperCase(Locale.ROOT);
        if (v.equals("CONTRACT")) return FUTURES;
        return valueOf(v);
    }
}
