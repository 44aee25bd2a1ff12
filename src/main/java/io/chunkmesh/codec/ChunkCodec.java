package io.chunkmesh.codec;

import io.chunkmesh.model.Frame;
import io.chunkmesh.model.Transfer;
import io.chunkmesh.model.TransferId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/**
 * Splits payloads into MTU-bounded frames and puts them back together.
 */
public final class ChunkCodec {
    public static final int MAX_CHUNKS = 0xFFFF;
    public static final int DEFAULT_TTL = 3;

    private static final Logger LOG = LoggerFactory.getLogger(ChunkCodec.class);

    private ChunkCodec() {
    }

    public static List<Frame> fragment(byte[] payload, TransferId transferId, int mtu) {
        int size = payload == null ? 0 : payload.length;
        return fragment(payload, Transfer.broadcast(transferId, Transfer.DEFAULT_TYPE, size, DEFAULT_TTL), mtu);
    }

    /**
     * Every frame but the last carries exactly {@code mtu} bytes; the last carries the remainder
     * and is marked final.
     */
    public static List<Frame> fragment(byte[] payload, Transfer transfer, int mtu) {
        if (mtu <= 0 || mtu > FrameCodec.MAX_PAYLOAD_BYTES) {
            throw new InvalidInputException("mtu must be within 1.." + FrameCodec.MAX_PAYLOAD_BYTES + ": " + mtu);
        }
        int typeBytes = transfer.originalType().getBytes(StandardCharsets.UTF_8).length;
        if (typeBytes > FrameCodec.MAX_TYPE_BYTES) {
            throw new InvalidInputException(
                    "originalType of " + typeBytes + " bytes exceeds " + FrameCodec.MAX_TYPE_BYTES + " bytes");
        }
        if (payload == null || payload.length == 0) {
            throw new InvalidInputException("payload must not be empty");
        }
        long chunkCount = ((long) payload.length + mtu - 1) / mtu;
        if (chunkCount > MAX_CHUNKS) {
            throw new InvalidInputException(
                    "payload of " + payload.length + " bytes needs " + chunkCount
                            + " chunks at mtu " + mtu + ", max=" + MAX_CHUNKS
            );
        }
        int totalChunks = (int) chunkCount;
        List<Frame> frames = new ArrayList<>(totalChunks);
        for (int i = 0; i < totalChunks; i++) {
            int from = i * mtu;
            int to = Math.min(payload.length, from + mtu);
            frames.add(Frame.data(transfer, i, totalChunks, Arrays.copyOfRange(payload, from, to)));
        }
        return frames;
    }

    /**
     * Pure reassembly over whatever frames have been seen for one transfer. Order and duplicates do
     * not matter. Frames that disagree with the first valid frame on transfer id or chunk count,
     * or whose index is out of range, are ignored.
     */
    public static Assembly tryAssemble(Collection<Frame> framesSeen) {
        if (framesSeen == null || framesSeen.isEmpty()) {
            return Assembly.incomplete(-1);
        }
        Frame reference = null;
        Frame[] slots = null;
        int present = 0;
        for (Frame frame : framesSeen) {
            if (frame == null || frame.isAck()) {
                continue;
            }
            if (reference == null) {
                if (!hasValidIndex(frame)) {
                    continue;
                }
                reference = frame;
                slots = new Frame[frame.totalChunks()];
            }
            if (!frame.transferId().equals(reference.transferId())) {
                LOG.warn("Ignoring frame of transfer {} while assembling {}", frame.transferId(), reference.transferId());
                continue;
            }
            if (frame.totalChunks() != reference.totalChunks()) {
                LOG.warn("Ignoring malformed frame {}: totalChunks disagrees with {}", frame, reference.totalChunks());
                continue;
            }
            if (!hasValidIndex(frame)) {
                continue;
            }
            if (slots[frame.sequenceIndex()] == null) {
                slots[frame.sequenceIndex()] = frame;
                present++;
            }
        }
        if (slots == null) {
            return Assembly.incomplete(-1);
        }
        if (present < slots.length) {
            return Assembly.incomplete(slots.length - present);
        }
        int length = 0;
        for (Frame slot : slots) {
            length += slot.payload().length;
        }
        byte[] out = new byte[length];
        int offset = 0;
        for (Frame slot : slots) {
            System.arraycopy(slot.payload(), 0, out, offset, slot.payload().length);
            offset += slot.payload().length;
        }
        return Assembly.complete(out);
    }

    private static boolean hasValidIndex(Frame frame) {
        if (frame.totalChunks() <= 0 || frame.sequenceIndex() < 0 || frame.sequenceIndex() >= frame.totalChunks()) {
            LOG.warn("Ignoring malformed frame {}: index out of range", frame);
            return false;
        }
        return true;
    }
}
