package io.chunkmesh.model;

/**
 * A fully reassembled inbound transfer. Only the storage location of the bytes is kept.
 */
public record ReceivedBinaryEvent(
        TransferId transferId,
        String originalType,
        long size,
        String location,
        int ttl,
        NodeId recipient,
        long receivedAtMs
) {
}
