package io.chunkmesh.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.chunkmesh.model.NodeId;
import io.chunkmesh.model.Transfer;
import io.chunkmesh.model.TransferId;
import io.chunkmesh.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Durable copy of outbound transfers still awaiting acknowledgement, so a restarted node keeps
 * retrying them. Rows are written on send, updated after every attempt or partial ack and removed
 * once the transfer completes or a failed one is dismissed.
 */
public final class PendingStore {
    private static final TypeReference<List<Integer>> INDEX_LIST = new TypeReference<>() { };

    private final Database database;

    public PendingStore(Database database) {
        this.database = database;
    }

    public void save(PendingRecord record) {
        Transfer transfer = record.transfer();
        try (Connection conn = database.openConnection(); PreparedStatement ps = conn.prepareStatement("""
                INSERT INTO pending_transfers(
                    transfer_id, original_type, total_size, ttl, recipient, mtu, payload,
                    unacknowledged_json, attempt_count, status, created_at_ms
                ) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
                ON CONFLICT(transfer_id) DO UPDATE SET
                    unacknowledged_json = excluded.unacknowledged_json,
                    attempt_count = excluded.attempt_count,
                    status = excluded.status
                """)) {
            ps.setString(1, transfer.transferId().toString());
            ps.setString(2, transfer.originalType());
            ps.setLong(3, transfer.totalSize());
            ps.setInt(4, transfer.ttl());
            ps.setString(5, transfer.recipient() == null ? null : transfer.recipient().toString());
            ps.setInt(6, record.mtu());
            ps.setBytes(7, record.payload());
            ps.setString(8, Jsons.toCompactJson(record.unacknowledged()));
            ps.setInt(9, record.attemptCount());
            ps.setString(10, record.failed() ? "FAILED" : "PENDING");
            ps.setLong(11, record.createdAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("DB exec failed", e);
        }
    }

    /** Returns false when no row exists for the transfer. */
    public boolean updateProgress(TransferId transferId, List<Integer> unacknowledged, int attemptCount, boolean failed) {
        String sql = """
                UPDATE pending_transfers
                SET unacknowledged_json = ?, attempt_count = ?, status = ?
                WHERE transfer_id = ?
                """;
        try (Connection conn = database.openConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, Jsons.toCompactJson(unacknowledged));
            ps.setInt(2, attemptCount);
            ps.setString(3, failed ? "FAILED" : "PENDING");
            ps.setString(4, transferId.toString());
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("DB exec failed", e);
        }
    }

    public boolean delete(TransferId transferId) {
        try (Connection conn = database.openConnection();
             PreparedStatement ps = conn.prepareStatement("DELETE FROM pending_transfers WHERE transfer_id = ?")) {
            ps.setString(1, transferId.toString());
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("DB exec failed", e);
        }
    }

    /** All persisted transfers, oldest first. */
    public List<PendingRecord> loadAll() {
        String sql = """
                SELECT transfer_id, original_type, total_size, ttl, recipient, mtu, payload,
                       unacknowledged_json, attempt_count, status, created_at_ms
                FROM pending_transfers
                ORDER BY created_at_ms ASC, transfer_id ASC
                """;
        List<PendingRecord> out = new ArrayList<>();
        try (Connection conn = database.openConnection();
             PreparedStatement ps = conn.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(mapRecord(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("DB query failed", e);
        }
        return out;
    }

    public int count() {
        try (Connection conn = database.openConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT COUNT(*) FROM pending_transfers");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("DB query failed", e);
        }
    }

    private static PendingRecord mapRecord(ResultSet rs) throws SQLException {
        String recipient = rs.getString("recipient");
        Transfer transfer = new Transfer(
                TransferId.parse(rs.getString("transfer_id")),
                rs.getString("original_type"),
                rs.getLong("total_size"),
                rs.getInt("ttl"),
                recipient == null ? null : NodeId.of(recipient)
        );
        List<Integer> unacknowledged;
        try {
            unacknowledged = Jsons.mapper().readValue(rs.getString("unacknowledged_json"), INDEX_LIST);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Corrupt pending row " + transfer.transferId(), e);
        }
        return new PendingRecord(
                transfer,
                rs.getInt("mtu"),
                rs.getBytes("payload"),
                unacknowledged,
                rs.getInt("attempt_count"),
                "FAILED".equals(rs.getString("status")),
                rs.getLong("created_at_ms")
        );
    }
}
