package com.crosswatch.domain.ledger;

import com.crosswatch.domain.signal.CrossDirection;

/**
 * Per-symbol lifecycle:
 * COLD (long average not warm) -> WARM_NEUTRAL (no execution yet) -> WARM_LONG / WARM_SHORT.
 *
 * Only confirmed executions move between WARM_* phases; suppressed events don't.
 */
public enum SymbolPhase {
    COLD,
    WARM_NEUTRAL,
    WARM_LONG,
    WARM_SHORT;

    public static SymbolPhase of(boolean warm, LedgerEntry entry) {
        if (!warm) return COLD;
        if (entry == null || entry.isEmpty()) return WARM_NEUTRAL;
        return entry.lastDirection() == CrossDirection.GOLDEN ? WARM_LONG : WARM_SHORT;
    }
}
