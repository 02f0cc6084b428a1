package com.crosswatch.application.ports;

import com.crosswatch.domain.ledger.LedgerEntry;
import com.crosswatch.domain.market.Symbol;

import java.util.Map;

/**
 * Durable storage for the position ledger.
 * It is the only state consulted when the engine restarts.
 */
public interface LedgerStorePort {

    Map<Symbol, LedgerEntry> loadAll() throws Exception;

    void save(LedgerEntry entry) throws Exception;

    void delete(Symbol symbol) throws Exception;
}
