package com.crosswatch.infrastructure.journal;

import com.crosswatch.application.ports.TradeJournalPort;
import com.crosswatch.infrastructure.db.Database;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Clock;

/**
 * Audit trail of executed orders in the {@code trades} table.
 * A failed insert is logged; it never fails the execution that was already confirmed.
 */
public class SqliteTradeJournal implements TradeJournalPort {

    private static final Logger log = LoggerFactory.getLogger(SqliteTradeJournal.class);

    private final Database db;
    private final Clock clock;

    public SqliteTradeJournal(Database db) {
        this(db, Clock.systemUTC());
    }

    public SqliteTradeJournal(Database db, Clock clock) {
        this.db = db;
        this.clock = clock;
    }

    @Override
    public void logTrade(String mode, String symbol, String side, double qty, String orderId, String comment) {
        String sql = """
            INSERT INTO trades (ts, mode, symbol, side, qty, order_id, comment)
            VALUES (?, ?, ?, ?, ?, ?, ?)
        """;

        try (Connection conn = db.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, clock.instant().toString());
            ps.setString(2, mode);
            ps.setString(3, symbol);
            ps.setString(4, side);
            ps.setDouble(5, qty);
            ps.setString(6, orderId);
            ps.setString(7, comment);

            ps.executeUpdate();
        } catch (SQLException e) {
            log.error("Trade journal insert failed for order {}: {}", orderId, e.getMessage());
        }
    }

    /** Number of journaled trades for a symbol. */
    public int count(String symbol) throws SQLException {
        try (Connection conn = db.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM trades WHERE symbol = ?")) {
            ps.setString(1, symbol);
            try (var rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }
}
