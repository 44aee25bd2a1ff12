package io.chunkmesh.model;

import java.util.Objects;

/**
 * Header of one logical binary send. {@code recipient} is null for broadcast transfers.
 */
public record Transfer(
        TransferId transferId,
        String originalType,
        long totalSize,
        int ttl,
        NodeId recipient
) {
    public static final String DEFAULT_TYPE = "application/octet-stream";
    public static final int MAX_TTL = 255;

    public Transfer {
        Objects.requireNonNull(transferId, "transferId");
        originalType = originalType == null || originalType.isBlank() ? DEFAULT_TYPE : originalType.trim();
        if (ttl < 0 || ttl > MAX_TTL) {
            throw new IllegalArgumentException("ttl must be within 0.." + MAX_TTL + ": " + ttl);
        }
        if (totalSize < 0) {
            throw new IllegalArgumentException("totalSize must not be negative: " + totalSize);
        }
    }

    public static Transfer broadcast(TransferId transferId, String originalType, long totalSize, int ttl) {
        return new Transfer(transferId, originalType, totalSize, ttl, null);
    }

    public boolean isBroadcast() {
        return recipient == null;
    }
}
