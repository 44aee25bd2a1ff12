package io.chunkmesh.model;

import java.util.List;

/**
 * Read-only view of outbound transfers for presentation: the pending ones and those that have
 * given up and await a manual retry or dismissal.
 */
public record PendingSnapshot(
        int pendingCount,
        int failedCount,
        List<TransferId> pendingIds,
        List<TransferId> failedIds,
        List<PendingTransferView> transfers
) {
}
