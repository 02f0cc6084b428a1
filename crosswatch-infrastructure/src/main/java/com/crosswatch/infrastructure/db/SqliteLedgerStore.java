package com.crosswatch.infrastructure.db;

import com.crosswatch.application.ports.LedgerStorePort;
import com.crosswatch.domain.ledger.LedgerEntry;
import com.crosswatch.domain.market.Symbol;
import com.crosswatch.domain.signal.CrossDirection;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** Ledger rows keyed by symbol; only non-empty entries are stored. */
public class SqliteLedgerStore implements LedgerStorePort {

    private final Database db;

    public SqliteLedgerStore(Database db) {
        this.db = db;
    }

    @Override
    public Map<Symbol, LedgerEntry> loadAll() throws SQLException {
        String sql = "SELECT symbol, last_direction, executed_at FROM ledger ORDER BY symbol";
        Map<Symbol, LedgerEntry> out = new LinkedHashMap<>();
        try (Connection c = db.getConnection();
             PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                Symbol symbol = Symbol.of(rs.getString("symbol"));
                LedgerEntry entry = new LedgerEntry(
                        symbol,
                        CrossDirection.valueOf(rs.getString("last_direction")),
                        Instant.parse(rs.getString("executed_at"))
                );
                out.put(symbol, entry);
            }
        }
        return out;
    }

    @Override
    public void save(LedgerEntry entry) throws SQLException {
        if (entry.isEmpty()) {
            delete(entry.symbol());
            return;
        }
        String sql = """
            INSERT INTO ledger (symbol, last_direction, executed_at) VALUES (?, ?, ?)
            ON CONFLICT(symbol) DO UPDATE SET last_direction = excluded.last_direction, executed_at = excluded.executed_at
        """;
        try (Connection c = db.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, entry.symbol().value());
            ps.setString(2, entry.lastDirection().name());
            ps.setString(3, entry.executedAt().toString());
            ps.executeUpdate();
        }
    }

    @Override
    public void delete(Symbol symbol) throws SQLException {
        try (Connection c = db.getConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM ledger WHERE symbol = ?")) {
            ps.setString(1, symbol.value());
            ps.executeUpdate();
        }
    }
}
