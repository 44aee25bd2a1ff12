package io.chunkmesh.storage;

import io.chunkmesh.model.TransferId;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;

/**
 * Durable memory of transfers delivered at this node, so a restarted node answers a late
 * retransmission with an acknowledgement instead of delivering the payload again. Keeps at most
 * {@code maxEntries} ids, pruning the oldest.
 */
public final class DeliveredStore {
    private final Database database;
    private final int maxEntries;

    public DeliveredStore(Database database, int maxEntries) {
        this.database = database;
        this.maxEntries = Math.max(1, maxEntries);
    }

    public boolean contains(TransferId transferId) {
        String sql = "SELECT 1 FROM delivered_transfers WHERE transfer_id = ?";
        try (Connection conn = database.openConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, transferId.toString());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new RuntimeException("DB query failed", e);
        }
    }

    public void markDelivered(TransferId transferId, String originalType, long size, long deliveredAtMs) {
        try (Connection conn = database.openConnection()) {
            try (PreparedStatement ps = conn.prepareStatement("""
                    INSERT INTO delivered_transfers(transfer_id, original_type, size, delivered_at_ms)
                    VALUES (?, ?, ?, ?)
                    ON CONFLICT(transfer_id) DO NOTHING
                    """)) {
                ps.setString(1, transferId.toString());
                ps.setString(2, originalType == null ? "" : originalType);
                ps.setLong(3, size);
                ps.setLong(4, deliveredAtMs);
                ps.executeUpdate();
            }
            try (PreparedStatement ps = conn.prepareStatement("""
                    DELETE FROM delivered_transfers
                    WHERE transfer_id IN (
                        SELECT transfer_id FROM delivered_transfers
                        ORDER BY delivered_at_ms DESC, transfer_id DESC
                        LIMIT -1 OFFSET ?
                    )
                    """)) {
                ps.setInt(1, maxEntries);
                ps.executeUpdate();
            }
        } catch (SQLException e) {
            throw new RuntimeException("DB exec failed", e);
        }
    }

    public int count() {
        try (Connection conn = database.openConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM delivered_transfers");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("DB query failed", e);
        }
    }
}
