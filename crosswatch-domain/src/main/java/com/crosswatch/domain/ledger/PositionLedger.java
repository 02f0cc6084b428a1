package com.crosswatch.domain.ledger;

import com.crosswatch.domain.market.Symbol;
import com.crosswatch.domain.signal.CrossDirection;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Anti-duplication ledger: one entry per configured symbol.
 *
 * <p>An execution is allowed only if the requested direction differs from the last executed one
 * and (when configured) the minimum interval since the last execution has passed.
 *
 * <p>Callers must call {@link #record} only AFTER a confirmed execution, and must serialize
 * mayExecute/record for the same symbol (one worker per symbol does that).
 */
public final class PositionLedger {

    private final Map<Symbol, LedgerEntry> entries = new ConcurrentHashMap<>();
    private final Map<Symbol, Duration> minIntervals = new ConcurrentHashMap<>();

    public void register(Symbol symbol, Duration minInterval) {
        Objects.requireNonNull(symbol, "symbol");
        entries.putIfAbsent(symbol, LedgerEntry.empty(symbol));
        minIntervals.put(symbol, minInterval == null || minInterval.isNegative() ? Duration.ZERO : minInterval);
    }

    /** Loads a persisted entry; only applies to registered symbols. */
    public boolean restore(LedgerEntry entry) {
        Objects.requireNonNull(entry, "entry");
        if (!entries.containsKey(entry.symbol())) return false;
        entries.put(entry.symbol(), entry);
        return true;
    }

    public void remove(Symbol symbol) {
        entries.remove(symbol);
        minIntervals.remove(symbol);
    }

    public Set<Symbol> symbols() {
        return Set.copyOf(entries.keySet());
    }

    public LedgerEntry entry(Symbol symbol) {
        LedgerEntry e = entries.get(symbol);
        if (e == null) throw new IllegalArgumentException("Symbol not registered: " + symbol);
        return e;
    }

    public boolean mayExecute(Symbol symbol, CrossDirection direction, Instant now) {
        return suppressionReason(symbol, direction, now).isEmpty();
    }

    /** Empty when allowed; otherwise a human-readable reason. */
    public Optional<String> suppressionReason(Symbol symbol, CrossDirection direction, Instant now) {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(now, "now");
        LedgerEntry e = entry(symbol);
        if (e.isEmpty()) return Optional.empty();

        if (e.lastDirection() == direction) {
            return Optional.of("duplicate " + direction + " (last executed " + e.executedAt() + ")");
        }

        Duration min = minIntervals.getOrDefault(symbol, Duration.ZERO);
        if (!min.isZero() && now.isBefore(e.executedAt().plus(min))) {
            return Optional.of("within min interval " + min + " of last execution at " + e.executedAt());
        }
        return Optional.empty();
    }

    public LedgerEntry record(Symbol symbol, CrossDirection direction, Instant now) {
        Objects.requireNonNull(direction, "direction");
        Objects.requireNonNull(now, "now");
        entry(symbol);
        LedgerEntry next = new LedgerEntry(symbol, direction, now);
        entries.put(symbol, next);
        return next;
    }
}
