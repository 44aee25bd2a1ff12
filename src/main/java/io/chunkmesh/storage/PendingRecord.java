package io.chunkmesh.storage;

import io.chunkmesh.model.Transfer;

import java.util.List;

/**
 * Persisted outbound transfer: the header and payload needed to fragment it again, plus its
 * acknowledgement progress at the last write.
 */
public record PendingRecord(
        Transfer transfer,
        int mtu,
        byte[] payload,
        List<Integer> unacknowledged,
        int attemptCount,
        boolean failed,
        long createdAtMs
) {
    public PendingRecord {
        payload = payload == null ? new byte[0] : payload;
        unacknowledged = unacknowledged == null ? List.of() : List.copyOf(unacknowledged);
    }
}
