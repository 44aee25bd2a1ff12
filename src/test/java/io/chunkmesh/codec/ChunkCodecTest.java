package io.chunkmesh.codec;

import io.chunkmesh.model.Frame;
import io.chunkmesh.model.NodeId;
import io.chunkmesh.model.Transfer;
import io.chunkmesh.model.TransferId;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

final class ChunkCodecTest {

    @Test
    void fragmentThenAssembleReproducesPayloadAcrossSizes() {
        Random random = new Random(42L);
        int[] sizes = {1, 2, 17, 180, 181, 1_000, 10_000};
        int[] mtus = {1, 7, 180, 500, 20_000};
        for (int size : sizes) {
            byte[] payload = new byte[size];
            random.nextBytes(payload);
            for (int mtu : mtus) {
                if ((size + mtu - 1) / mtu > ChunkCodec.MAX_CHUNKS) {
                    continue;
                }
                List<Frame> frames = ChunkCodec.fragment(payload, TransferId.random(), mtu);
                Assembly assembly = ChunkCodec.tryAssemble(frames);
                Assertions.assertTrue(assembly.complete(), "size=" + size + " mtu=" + mtu);
                Assertions.assertArrayEquals(payload, assembly.bytes(), "size=" + size + " mtu=" + mtu);
            }
        }
    }

    @Test
    void fragmentSplitsAtMtuAndMarksOnlyLastFinal() {
        byte[] payload = new byte[10_000];
        Transfer transfer = new Transfer(TransferId.random(), "image/png", payload.length, 3, NodeId.of("bob"));
        List<Frame> frames = ChunkCodec.fragment(payload, transfer, 500);

        Assertions.assertEquals(20, frames.size());
        for (int i = 0; i < frames.size(); i++) {
            Frame frame = frames.get(i);
            Assertions.assertEquals(i, frame.sequenceIndex());
            Assertions.assertEquals(20, frame.totalChunks());
            Assertions.assertEquals(500, frame.payload().length);
            Assertions.assertEquals(i == 19, frame.isFinal());
            Assertions.assertEquals("image/png", frame.originalType());
            Assertions.assertEquals(NodeId.of("bob"), frame.recipient());
            Assertions.assertEquals(3, frame.ttl());
        }

        List<Frame> uneven = ChunkCodec.fragment(new byte[1_001], TransferId.random(), 500);
        Assertions.assertEquals(3, uneven.size());
        Assertions.assertEquals(1, uneven.get(2).payload().length);
    }

    @Test
    void outOfOrderChunksAssembleToSameBytes() {
        byte[] payload = new byte[]{1, 2, 3, 4, 5, 6, 7, 8};
        List<Frame> frames = ChunkCodec.fragment(payload, TransferId.random(), 2);
        Assertions.assertEquals(4, frames.size());

        List<Frame> shuffled = List.of(frames.get(2), frames.get(0), frames.get(3), frames.get(1));
        Assembly inOrder = ChunkCodec.tryAssemble(frames);
        Assembly outOfOrder = ChunkCodec.tryAssemble(shuffled);

        Assertions.assertTrue(outOfOrder.complete());
        Assertions.assertArrayEquals(inOrder.bytes(), outOfOrder.bytes());
        Assertions.assertArrayEquals(payload, outOfOrder.bytes());
    }

    @Test
    void missingChunkIsReportedAndDuplicatesAreTolerated() {
        byte[] payload = new byte[]{9, 8, 7, 6, 5};
        List<Frame> frames = ChunkCodec.fragment(payload, TransferId.random(), 2);

        List<Frame> partial = new ArrayList<>(List.of(frames.get(0), frames.get(0), frames.get(2)));
        Assembly incomplete = ChunkCodec.tryAssemble(partial);
        Assertions.assertFalse(incomplete.complete());
        Assertions.assertEquals(1, incomplete.missing());

        partial.add(frames.get(1));
        partial.add(frames.get(2));
        Assembly complete = ChunkCodec.tryAssemble(partial);
        Assertions.assertTrue(complete.complete());
        Assertions.assertArrayEquals(payload, complete.bytes());
    }

    @Test
    void framesOfOtherTransfersOrWrongCountAreIgnored() {
        TransferId id = TransferId.random();
        List<Frame> frames = ChunkCodec.fragment(new byte[]{1, 2, 3, 4}, id, 2);
        Frame foreign = ChunkCodec.fragment(new byte[]{9, 9}, TransferId.random(), 2).get(0);
        Frame wrongCount = new Frame(frames.get(1).kind(), id, 3, null, null, 1, 5, false, new byte[]{0, 0});

        Assembly withNoise = ChunkCodec.tryAssemble(List.of(frames.get(0), foreign, wrongCount));
        Assertions.assertFalse(withNoise.complete());

        Assembly fixed = ChunkCodec.tryAssemble(List.of(frames.get(0), foreign, wrongCount, frames.get(1)));
        Assertions.assertTrue(fixed.complete());
        Assertions.assertArrayEquals(new byte[]{1, 2, 3, 4}, fixed.bytes());
    }

    @Test
    void emptyInputIsIncomplete() {
        Assertions.assertFalse(ChunkCodec.tryAssemble(List.of()).complete());
    }

    @Test
    void invalidFragmentRequestsAreRejected() {
        TransferId id = TransferId.random();
        Assertions.assertThrows(InvalidInputException.class, () -> ChunkCodec.fragment(new byte[10], id, 0));
        Assertions.assertThrows(InvalidInputException.class, () -> ChunkCodec.fragment(new byte[10], id, -5));
        Assertions.assertThrows(InvalidInputException.class, () -> ChunkCodec.fragment(new byte[0], id, 10));
        Assertions.assertThrows(InvalidInputException.class, () -> ChunkCodec.fragment(null, id, 10));
        Assertions.assertThrows(InvalidInputException.class,
                () -> ChunkCodec.fragment(new byte[ChunkCodec.MAX_CHUNKS + 1], id, 1));
        Assertions.assertThrows(InvalidInputException.class,
                () -> ChunkCodec.fragment(new byte[10], id, FrameCodec.MAX_PAYLOAD_BYTES + 1));
    }

    @Test
    void typeTagThatCannotBeEncodedIsRejectedBeforeFraming() {
        Transfer longType = Transfer.broadcast(TransferId.random(), "x".repeat(FrameCodec.MAX_TYPE_BYTES + 1), 10L, 2);
        Assertions.assertThrows(InvalidInputException.class, () -> ChunkCodec.fragment(new byte[10], longType, 4));

        Transfer multiByte = Transfer.broadcast(TransferId.random(), "\u00e9".repeat(128), 10L, 2);
        Assertions.assertThrows(InvalidInputException.class, () -> ChunkCodec.fragment(new byte[10], multiByte, 4));

        Transfer longest = Transfer.broadcast(TransferId.random(), "x".repeat(FrameCodec.MAX_TYPE_BYTES), 10L, 2);
        List<Frame> frames = ChunkCodec.fragment(new byte[10], longest, FrameCodec.MAX_PAYLOAD_BYTES);
        Assertions.assertEquals(1, frames.size());
        Assertions.assertEquals(longest.originalType(), FrameCodec.decode(FrameCodec.encode(frames.get(0))).originalType());
    }
}
