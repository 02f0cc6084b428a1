package com.crosswatch.infrastructure.db;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

/**
 * SQLite file holding the position ledger and the trade journal.
 */
public final class Database {

    public static final String DEFAULT_PATH = "data/crosswatch.db";

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS ledger (
              symbol TEXT PRIMARY KEY,
              last_direction TEXT NOT NULL,
              executed_at TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS trades (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              ts TEXT NOT NULL,
              mode TEXT,
              symbol TEXT,
              side TEXT,
              qty REAL,
              order_id TEXT,
              comment TEXT
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_trades_symbol ON trades(symbol)"
    );

    private final Path file;
    private final String url;

    public Database(Path file) {
        this.file = file;
        this.url = "jdbc:sqlite:" + file;
    }

    public Path file() {
        return file;
    }

    public Connection getConnection() throws SQLException {
        Connection c = DriverManager.getConnection(url);
        try (Statement st = c.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA busy_timeout=5000");
        } catch (SQLException e) {
            c.close();
            throw e;
        }
        return c;
    }

    /** Creates the parent directory and tables if missing. */
    public Database initSchema() {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create directory for " + file, e);
        }

        try (Connection c = getConnection(); Statement st = c.createStatement()) {
            for (String sql : SCHEMA) st.executeUpdate(sql);
        } catch (SQLException e) {
            throw new IllegalStateException("initSchema() failed for " + url, e);
        }
        return this;
    }
}
