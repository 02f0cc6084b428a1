package com.crosswatch.application.ports;

/**
 * Application port for persisting executed orders (journal/audit).
 * Implementations live in infrastructure (SQLite).
 */
public interface TradeJournalPort {
    void logTrade(String mode,
                  String symbol,
                  String side,
                  double qty,
                  String orderId,
                  String comment);
}
