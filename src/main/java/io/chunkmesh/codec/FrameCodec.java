package io.chunkmesh.codec;

import io.chunkmesh.model.Frame;
import io.chunkmesh.model.FrameKind;
import io.chunkmesh.model.NodeId;
import io.chunkmesh.model.TransferId;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Byte-exact wire envelope, big-endian:
 *
 * <pre>
 * magic(1) kind(1) transferId(16) ttl(1) recipientFlag(1) [recipient(16)]
 * typeLen(1) type(n) sequenceIndex(2) totalChunks(2) isFinal(1) payloadLen(2) payload(n)
 * </pre>
 */
public final class FrameCodec {
    public static final byte MAGIC = (byte) 0xC7;
    public static final int ID_BYTES = 16;
    public static final int MAX_TYPE_BYTES = 0xFF;
    public static final int MAX_PAYLOAD_BYTES = 0xFFFF;

    private static final int FIXED_BYTES = 1 + 1 + ID_BYTES + 1 + 1 + 1 + 2 + 2 + 1 + 2;

    private FrameCodec() {
    }

    public static int headerSize(String originalType, boolean hasRecipient) {
        return FIXED_BYTES + typeBytes(originalType).length + (hasRecipient ? ID_BYTES : 0);
    }

    public static byte[] encode(Frame frame) {
        byte[] type = typeBytes(frame.originalType());
        byte[] payload = frame.payload();
        if (frame.ttl() < 0 || frame.ttl() > 0xFF) {
            throw new IllegalArgumentException("ttl does not fit an unsigned byte: " + frame.ttl());
        }
        if (frame.totalChunks() < 1 || frame.totalChunks() > 0xFFFF) {
            throw new IllegalArgumentException("totalChunks out of range: " + frame.totalChunks());
        }
        if (frame.sequenceIndex() < 0 || frame.sequenceIndex() >= frame.totalChunks()) {
            throw new IllegalArgumentException("sequenceIndex out of range: " + frame.sequenceIndex());
        }
        if (payload.length > MAX_PAYLOAD_BYTES) {
            throw new IllegalArgumentException("payload slice too large: " + payload.length);
        }
        boolean hasRecipient = frame.recipient() != null;
        ByteBuffer buf = ByteBuffer.allocate(headerSize(frame.originalType(), hasRecipient) + payload.length);
        buf.put(MAGIC);
        buf.put(frame.kind().code());
        putUuid(buf, frame.transferId().value());
        buf.put((byte) frame.ttl());
        buf.put((byte) (hasRecipient ? 1 : 0));
        if (hasRecipient) {
            putUuid(buf, frame.recipient().value());
        }
        buf.put((byte) type.length);
        buf.put(type);
        buf.putShort((short) frame.sequenceIndex());
        buf.putShort((short) frame.totalChunks());
        buf.put((byte) (frame.isFinal() ? 1 : 0));
        buf.putShort((short) payload.length);
        buf.put(payload);
        return buf.array();
    }

    public static Frame decode(byte[] bytes) {
        if (bytes == null || bytes.length < FIXED_BYTES) {
            throw new MalformedFrameException("Frame too short: " + (bytes == null ? 0 : bytes.length) + " bytes");
        }
        ByteBuffer buf = ByteBuffer.wrap(bytes);
        try {
            if (buf.get() != MAGIC) {
                throw new MalformedFrameException("Bad frame magic");
            }
            FrameKind kind;
            try {
                kind = FrameKind.fromCode(buf.get());
            } catch (IllegalArgumentException e) {
                throw new MalformedFrameException(e.getMessage(), e);
            }
            TransferId transferId = new TransferId(getUuid(buf));
            int ttl = Byte.toUnsignedInt(buf.get());
            NodeId recipient = switch (buf.get()) {
                case 0 -> null;
                case 1 -> new NodeId(getUuid(buf));
                default -> throw new MalformedFrameException("Bad recipient flag");
            };
            byte[] type = new byte[Byte.toUnsignedInt(buf.get())];
            buf.get(type);
            int sequenceIndex = Short.toUnsignedInt(buf.getShort());
            int totalChunks = Short.toUnsignedInt(buf.getShort());
            boolean isFinal = switch (buf.get()) {
                case 0 -> false;
                case 1 -> true;
                default -> throw new MalformedFrameException("Bad isFinal flag");
            };
            byte[] payload = new byte[Short.toUnsignedInt(buf.getShort())];
            buf.get(payload);
            if (buf.hasRemaining()) {
                throw new MalformedFrameException("Trailing bytes after frame: " + buf.remaining());
            }
            if (totalChunks == 0) {
                throw new MalformedFrameException("totalChunks must be at least 1");
            }
            if (sequenceIndex >= totalChunks) {
                throw new MalformedFrameException("sequenceIndex " + sequenceIndex + " >= totalChunks " + totalChunks);
            }
            if (kind == FrameKind.ACK && payload.length > 0) {
                throw new MalformedFrameException("Acknowledgement carries a payload");
            }
            return new Frame(
                    kind,
                    transferId,
                    ttl,
                    recipient,
                    new String(type, StandardCharsets.UTF_8),
                    sequenceIndex,
                    totalChunks,
                    isFinal,
                    payload
            );
        } catch (BufferUnderflowException e) {
            throw new MalformedFrameException("Truncated frame", e);
        }
    }

    private static byte[] typeBytes(String originalType) {
        byte[] type = (originalType == null ? "" : originalType).getBytes(StandardCharsets.UTF_8);
        if (type.length > MAX_TYPE_BYTES) {
            throw new IllegalArgumentException("originalType longer than " + MAX_TYPE_BYTES + " bytes");
        }
        return type;
    }

    private static void putUuid(ByteBuffer buf, UUID value) {
        buf.putLong(value.getMostSignificantBits());
        buf.putLong(value.getLeastSignificantBits());
    }

    private static UUID getUuid(ByteBuffer buf) {
        return new UUID(buf.getLong(), buf.getLong());
    }
}
