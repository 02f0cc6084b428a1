package com.crosswatch.domain.market;

import java.util.Locale;
import java.util.Objects;

/**
 * Native venue symbol (e.g. BTCUSDT).
 *
 * Accepts "BTC/USDT", "BTC-USDT" and "BTC_USDT" too and strips the separator,
 * because the venue API only understands the concatenated form.
 */
public final class Symbol implements Comparable<Symbol> {

    private final String value;

    private Symbol(String value) {
        this.value = value;
    }

    public static Symbol of(String raw) {
        Objects.requireNonNull(raw, "symbol");
        String v = raw.trim().toUpperCase(Locale.ROOT)
                .replace("/", "")
                .replace("-", "")
                .replace("_", "");
        if (v.isEmpty()) throw new IllegalArgumentException("Empty symbol");
        for (int i = 0; i < v.length(); i++) {
            if (!Character.isLetterOrDigit(v.charAt(i))) {
                throw new IllegalArgumentException("Unsupported symbol format: " + raw);
            }
        }
        return new Symbol(v);
    }

    public String value() { return value; }

    @Override
    public String toString() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Symbol other)) return false;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public int compareTo(Symbol o) {
        return value.compareTo(o.value);
    }
}
