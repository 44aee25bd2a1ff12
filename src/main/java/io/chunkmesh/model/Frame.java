package io.chunkmesh.model;

import java.util.Objects;

/**
 * One unit placed on the wire: a slice of a transfer's payload ({@link FrameKind#DATA}) or an
 * acknowledgement ({@link FrameKind#ACK}, empty payload). Payload arrays are shared, never
 * mutated after construction.
 */
public record Frame(
        FrameKind kind,
        TransferId transferId,
        int ttl,
        NodeId recipient,
        String originalType,
        int sequenceIndex,
        int totalChunks,
        boolean isFinal,
        byte[] payload
) {
    private static final byte[] EMPTY = new byte[0];

    public Frame {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(transferId, "transferId");
        originalType = originalType == null ? Transfer.DEFAULT_TYPE : originalType;
        payload = payload == null ? EMPTY : payload;
    }

    public static Frame data(Transfer transfer, int sequenceIndex, int totalChunks, byte[] slice) {
        return new Frame(
                FrameKind.DATA,
                transfer.transferId(),
                transfer.ttl(),
                transfer.recipient(),
                transfer.originalType(),
                sequenceIndex,
                totalChunks,
                sequenceIndex == totalChunks - 1,
                slice
        );
    }

    /**
     * Acknowledgement for {@code source}'s transfer. A whole-transfer ack has {@code isFinal} set;
     * otherwise it covers only {@code sequenceIndex}.
     */
    public static Frame ack(Frame source, int ttl, boolean wholeTransfer) {
        return new Frame(
                FrameKind.ACK,
                source.transferId(),
                ttl,
                null,
                source.originalType(),
                wholeTransfer ? 0 : source.sequenceIndex(),
                source.totalChunks(),
                wholeTransfer,
                EMPTY
        );
    }

    public Frame withTtl(int newTtl) {
        return new Frame(kind, transferId, newTtl, recipient, originalType, sequenceIndex, totalChunks, isFinal, payload);
    }

    public boolean isAck() {
        return kind == FrameKind.ACK;
    }

    public boolean isBroadcast() {
        return recipient == null;
    }

    @Override
    public String toString() {
        return "Frame[" + kind
                + " " + transferId.shortId()
                + " " + sequenceIndex + "/" + totalChunks
                + " ttl=" + ttl
                + (isFinal ? " final" : "")
                + " " + payload.length + "B]";
    }
}
