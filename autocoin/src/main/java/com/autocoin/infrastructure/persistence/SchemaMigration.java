package com.autocoin.infrastructure.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the trading tables on startup.
 *
 * Tables:
 * - positions: one row per opened position, closed in place on exit
 * - orders: one row per order attempt, upserted by id
 */
public final class SchemaMigration {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigration.class);

    private final DataSource dataSource;

    public SchemaMigration(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    public void migrate() {
        log.info("[MIGRATION] Checking trading schema");

        try (Connection conn = dataSource.getConnection()) {
            if (!tableExists(conn, "positions")) {
                createPositionsTable(conn);
                log.info("[MIGRATION] ✓ positions table created");
            }
            if (!tableExists(conn, "orders")) {
                createOrdersTable(conn);
                log.info("[MIGRATION] ✓ orders table created");
            }
            log.info("[MIGRATION] Schema up to date");
        } catch (SQLException e) {
            log.error("[MIGRATION] Migration failed: {}", e.getMessage(), e);
            throw new RuntimeException("Schema migration failed", e);
        }
    }

    private boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metadata = conn.getMetaData();
        try (ResultSet rs = metadata.getTables(null, null, tableName, new String[]{"TABLE"})) {
            return rs.next();
        }
    }

    private void createPositionsTable(Connection conn) throws SQLException {
        String sql = """
            CREATE TABLE positions (
                id TEXT PRIMARY KEY,
                market TEXT NOT NULL,
                entry_price REAL NOT NULL,
                amount REAL NOT NULL,
                entry_time INTEGER NOT NULL,
                stop_loss REAL NOT NULL,
                take_profit REAL NOT NULL,
                exit_price REAL,
                exit_time INTEGER,
                pnl REAL,
                pnl_rate REAL,
                status TEXT NOT NULL,
                created_at INTEGER NOT NULL DEFAULT (strftime('%s', 'now') * 1000),
                updated_at INTEGER NOT NULL DEFAULT (strftime('%s', 'now') * 1000)
            )
            """;
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
            stmt.execute("CREATE INDEX idx_positions_status ON positions(status, market)");
        }
    }

    private void createOrdersTable(Connection conn) throws SQLException {
        String sql = """
            CREATE TABLE orders (
                id TEXT PRIMARY KEY,
                market TEXT NOT NULL,
                side TEXT NOT NULL,
                price REAL NOT NULL,
                volume REAL NOT NULL,
                status TEXT NOT NULL,
                executed_volume REAL DEFAULT 0,
                executed_amount REAL DEFAULT 0,
                created_timestamp INTEGER NOT NULL
            )
            """;
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }
}
