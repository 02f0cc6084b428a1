package com.crosswatch.domain.signal;

import com.crosswatch.domain.market.Symbol;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Detects strict sign flips of (short - long) between consecutive warm updates of one symbol.
 *
 * <ul>
 *   <li>Cold updates are ignored.</li>
 *   <li>The first warm update with a non-zero difference seeds the sign and emits nothing.</li>
 *   <li>A zero difference keeps the previous sign.</li>
 *   <li>negative to positive emits GOLDEN, positive to negative emits DEATH.</li>
 * </ul>
 *
 * Not thread-safe: one detector per symbol, fed in order.
 */
public class CrossoverDetector {

    private final Symbol symbol;
    private int sign;

    public CrossoverDetector(Symbol symbol) {
        this.symbol = Objects.requireNonNull(symbol, "symbol");
    }

    public Symbol symbol() {
        return symbol;
    }

    public Optional<CrossoverEvent> onUpdate(MAState state) {
        Objects.requireNonNull(state, "state");
        if (!symbol.equals(state.symbol())) {
            throw new IllegalArgumentException("Detector for " + symbol + " got state for " + state.symbol());
        }
        if (!state.isWarm()) return Optional.empty();

        double diff = state.difference();
        int next = diff > 0.0 ? 1 : (diff < 0.0 ? -1 : 0);
        if (next == 0) return Optional.empty();

        int prev = sign;
        sign = next;
        if (prev == 0 || prev == next) return Optional.empty();

        CrossDirection direction = next > 0 ? CrossDirection.GOLDEN : CrossDirection.DEATH;
        return Optional.of(new CrossoverEvent(
                symbol, direction, state.lastTimestamp(), state.shortValue(), state.longValue()));
    }

    /** Runs a finite sequence of updates through this detector. */
    public List<CrossoverEvent> scan(Iterable<MAState> states) {
        List<CrossoverEvent> out = new ArrayList<>();
        for (MAState s : states) {
            onUpdate(s).ifPresent(out::add);
        }
        return out;
    }

    public boolean isSeeded() {
        return sign != 0;
    }

    /** Last non-zero sign of (short - long): 1, -1, or 0 when not seeded yet. */
    public int currentSign() {
        return sign;
    }

    public void reset() {
        sign = 0;
    }
}
