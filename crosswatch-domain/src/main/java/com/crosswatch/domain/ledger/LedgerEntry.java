package com.crosswatch.domain.ledger;

import com.crosswatch.domain.market.Symbol;
import com.crosswatch.domain.signal.CrossDirection;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Last executed direction for a symbol.
 * {@code lastDirection} and {@code executedAt} are both null until the first confirmed execution.
 */
public record LedgerEntry(Symbol symbol, CrossDirection lastDirection, Instant executedAt) {

    public LedgerEntry {
        Objects.requireNonNull(symbol, "symbol");
        if ((lastDirection == null) != (executedAt == null)) {
            throw new IllegalArgumentException("lastDirection and executedAt must be set together");
        }
    }

    public static LedgerEntry empty(Symbol symbol) {
        return new LedgerEntry(symbol, null, null);
    }

    public Optional<CrossDirection> direction() {
        return Optional.ofNullable(lastDirection);
    }

    public boolean isEmpty() {
        return lastDirection == null;
    }
}
