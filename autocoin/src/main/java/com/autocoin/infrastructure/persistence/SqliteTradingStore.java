package com.autocoin.infrastructure.persistence;

import com.autocoin.application.port.output.TradingStore;
import com.autocoin.domain.model.Order;
import com.autocoin.domain.model.Position;
import com.autocoin.domain.model.PositionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * JDBC store for positions and orders on SQLite.
 *
 * Times are stored as epoch milliseconds. Every failure is logged and rethrown; callers
 * decide whether a failed write matters.
 */
public final class SqliteTradingStore implements TradingStore {
    private static final Logger log = LoggerFactory.getLogger(SqliteTradingStore.class);

    private final DataSource dataSource;

    public SqliteTradingStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void savePosition(Position position) {
        String sql = """
            INSERT INTO positions (
                id, market, entry_price, amount, entry_time, stop_loss, take_profit, status
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, position.id());
            ps.setString(2, position.market());
            ps.setDouble(3, position.entryPrice());
            ps.setDouble(4, position.amount());
            ps.setLong(5, position.entryTime().toEpochMilli());
            ps.setDouble(6, position.stopLoss());
            ps.setDouble(7, position.takeProfit());
            ps.setString(8, PositionStatus.ACTIVE.dbValue());

            ps.executeUpdate();
            log.info("[STORE] Position saved: {} {} @ {}", position.id(), position.market(), position.entryPrice());

        } catch (SQLException e) {
            log.error("[STORE] Error saving position {}: {}", position.id(), e.getMessage(), e);
            throw new RuntimeException("Failed to save position", e);
        }
    }

    @Override
    public boolean closePosition(String market, double exitPrice, double pnl, double pnlRate) {
        String sql = """
            UPDATE positions SET
                exit_price = ?,
                exit_time = ?,
                pnl = ?,
                pnl_rate = ?,
                status = ?,
                updated_at = ?
            WHERE market = ? AND status = ?
            """;

        long now = Instant.now().toEpochMilli();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setDouble(1, exitPrice);
            ps.setLong(2, now);
            ps.setDouble(3, pnl);
            ps.setDouble(4, pnlRate);
            ps.setString(5, PositionStatus.CLOSED.dbValue());
            ps.setLong(6, now);
            ps.setString(7, market);
            ps.setString(8, PositionStatus.ACTIVE.dbValue());

            int updated = ps.executeUpdate();
            if (updated == 0) {
                log.warn("[STORE] No active position to close for {}", market);
                return false;
            }
            log.info("[STORE] Position closed: {} exit={} pnlRate={}", market, exitPrice, pnlRate);
            return true;

        } catch (SQLException e) {
            log.error("[STORE] Error closing position for {}: {}", market, e.getMessage(), e);
            throw new RuntimeException("Failed to close position", e);
        }
    }

    @Override
    public List<Position> getAllActivePositions() {
        String sql = "SELECT * FROM positions WHERE status = ? ORDER BY entry_time ASC";
        List<Position> positions = new ArrayList<>();

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, PositionStatus.ACTIVE.dbValue());
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    positions.add(mapPosition(rs));
                }
            }
        } catch (SQLException e) {
            log.error("[STORE] Error loading active positions: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to load active positions", e);
        }

        return positions;
    }

    @Override
    public Optional<Position> getActivePosition(String market) {
        String sql = "SELECT * FROM positions WHERE market = ? AND status = ? LIMIT 1";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, market);
            ps.setString(2, PositionStatus.ACTIVE.dbValue());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapPosition(rs));
                }
            }
        } catch (SQLException e) {
            log.error("[STORE] Error loading active position for {}: {}", market, e.getMessage(), e);
            throw new RuntimeException("Failed to load active position", e);
        }

        return Optional.empty();
    }

    @Override
    public void saveOrder(Order order) {
        String sql = """
            INSERT INTO orders (
                id, market, side, price, volume, status,
                executed_volume, executed_amount, created_timestamp
            ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
                status = excluded.status,
                executed_volume = excluded.executed_volume,
                executed_amount = excluded.executed_amount
            """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, order.id());
            ps.setString(2, order.market());
            ps.setString(3, order.side().wireValue());
            ps.setDouble(4, order.price());
            ps.setDouble(5, order.volume());
            ps.setString(6, order.status().name().toLowerCase(Locale.ROOT));
            ps.setDouble(7, order.executedVolume());
            ps.setDouble(8, order.executedAmount());
            ps.setLong(9, order.createdAt().toEpochMilli());

            ps.executeUpdate();
            log.debug("[STORE] Order saved: {} {} {}", order.id(), order.side(), order.status());

        } catch (SQLException e) {
            log.error("[STORE] Error saving order {}: {}", order.id(), e.getMessage(), e);
            throw new RuntimeException("Failed to save order", e);
        }
    }

    /**
     * Status stored for an order, empty if the id is unknown.
     */
    Optional<String> findOrderStatus(String orderId) {
        String sql = "SELECT status FROM orders WHERE id = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, orderId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(rs.getString("status"));
                }
            }
        } catch (SQLException e) {
            log.error("[STORE] Error loading order {}: {}", orderId, e.getMessage(), e);
            throw new RuntimeException("Failed to load order", e);
        }

        return Optional.empty();
    }

    private Position mapPosition(ResultSet rs) throws SQLException {
        return new Position(
            rs.getString("id"),
            rs.getString("market"),
            rs.getDouble("entry_price"),
            rs.getDouble("amount"),
            Instant.ofEpochMilli(rs.getLong("entry_time")),
            rs.getDouble("stop_loss"),
            rs.getDouble("take_profit")
        );
    }
}
