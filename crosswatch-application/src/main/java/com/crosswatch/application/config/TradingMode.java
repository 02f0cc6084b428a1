package com.crosswatch.application.config;

import java.util.Locale;

/** PAPER never touches the venue's order endpoint; LIVE does. */
public enum TradingMode {
    PAPER,
    LIVE;

    public static TradingMode parse(String raw) {
        if (raw == null || raw.isBlank()) return PAPER;
        return valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
