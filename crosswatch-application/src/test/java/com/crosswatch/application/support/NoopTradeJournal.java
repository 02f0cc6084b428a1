package com.crosswatch.application.support;

import com.crosswatch.application.ports.TradeJournalPort;

/** Journal for tests that do not look at the trade log. */
public final class NoopTradeJournal implements TradeJournalPort {
    @Override
    public void logTrade(String mode, String symbol, String side, double qty, String orderId, String comment) {
        // no-op
    }
}
