package io.chunkmesh.model;

import java.util.List;

public record PendingTransferView(
        TransferId transferId,
        String status,
        int totalChunks,
        List<Integer> unacknowledged,
        int attemptCount,
        long nextRetryDeadlineMs
) {
}
