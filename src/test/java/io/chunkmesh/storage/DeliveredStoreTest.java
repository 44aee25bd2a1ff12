package io.chunkmesh.storage;

import io.chunkmesh.config.ChunkMeshConfig;
import io.chunkmesh.config.EngineSettings;
import io.chunkmesh.inbox.Inbox;
import io.chunkmesh.ledger.TransferLedger;
import io.chunkmesh.model.Frame;
import io.chunkmesh.model.NodeId;
import io.chunkmesh.model.TransferId;
import io.chunkmesh.router.DeliveryRouter;
import io.chunkmesh.router.RouteOutcome;
import io.chunkmesh.router.RouteState;
import io.chunkmesh.testing.InMemoryMesh;
import io.chunkmesh.testing.ManualClock;
import io.chunkmesh.testing.MemoryBinaryStore;
import io.chunkmesh.testing.MeshNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class DeliveredStoreTest {
    private static final EngineSettings SETTINGS = EngineSettings.defaults().withMtu(4);

    @Test
    void remembersDeliveriesAcrossInstances() throws Exception {
        Path root = Files.createTempDirectory("chunkmesh-test-delivered-");
        try {
            Database database = new Database(ChunkMeshConfig.fromRoot(root.toString()));
            database.init();
            TransferId id = TransferId.random();

            DeliveredStore store = new DeliveredStore(database, 8);
            Assertions.assertFalse(store.contains(id));
            store.markDelivered(id, "text/plain", 12L, 1_000L);
            store.markDelivered(id, "text/plain", 12L, 2_000L);
            Assertions.assertTrue(store.contains(id));
            Assertions.assertEquals(1, store.count());

            database.init();
            DeliveredStore reopened = new DeliveredStore(new Database(ChunkMeshConfig.fromRoot(root.toString())), 8);
            Assertions.assertTrue(reopened.contains(id));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void prunesOldestBeyondCapacity() throws Exception {
        Path root = Files.createTempDirectory("chunkmesh-test-delivered-");
        try {
            Database database = new Database(ChunkMeshConfig.fromRoot(root.toString()));
            database.init();
            DeliveredStore store = new DeliveredStore(database, 2);
            TransferId oldest = TransferId.random();
            TransferId middle = TransferId.random();
            TransferId newest = TransferId.random();
            store.markDelivered(oldest, "", 1L, 100L);
            store.markDelivered(middle, "", 1L, 200L);
            store.markDelivered(newest, "", 1L, 300L);

            Assertions.assertEquals(2, store.count());
            Assertions.assertFalse(store.contains(oldest));
            Assertions.assertTrue(store.contains(middle));
            Assertions.assertTrue(store.contains(newest));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void restartedNodeAcknowledgesRetransmissionWithoutRedelivery() throws Exception {
        Path root = Files.createTempDirectory("chunkmesh-test-delivered-");
        try {
            Database database = new Database(ChunkMeshConfig.fromRoot(root.toString()));
            database.init();
            DeliveredStore delivered = new DeliveredStore(database, 64);
            ManualClock clock = new ManualClock(0L);
            InMemoryMesh mesh = new InMemoryMesh();
            MeshNode a = new MeshNode(mesh, "a", SETTINGS, clock);
            NodeId bId = NodeId.of("b");
            MemoryBinaryStore bStore = new MemoryBinaryStore();
            Inbox firstInbox = new Inbox(SETTINGS.inboxCapacity());
            DeliveryRouter first = router(mesh, bId, firstInbox, bStore, delivered, clock);
            mesh.link(a.id, bId);
            mesh.loseWhere(d -> d.from().equals(bId));

            TransferId id = a.send("persisted".getBytes(StandardCharsets.UTF_8), bId, 2);
            mesh.drain();
            Assertions.assertEquals(RouteState.DELIVERED, first.stateOf(id));
            Assertions.assertTrue(delivered.contains(id));
            Assertions.assertEquals(1, bStore.count());
            Assertions.assertEquals(1, a.ledger.size());
            List<byte[]> retransmission = mesh.sent(a.id, bId).stream().map(InMemoryMesh.Delivery::bytes).toList();

            Inbox restartedInbox = new Inbox(SETTINGS.inboxCapacity());
            DeliveryRouter restarted = router(mesh, bId, restartedInbox, bStore, delivered, clock);
            mesh.loseWhere(d -> false);
            mesh.clearHistory();
            clock.advance(SETTINGS.baseBackoffMs());

            RouteOutcome out = restarted.onFrame(retransmission.get(0), a.id);
            Assertions.assertEquals(RouteState.DELIVERED, out.state());
            Assertions.assertNull(out.delivered());
            mesh.drain();

            Assertions.assertEquals(0, restartedInbox.size());
            Assertions.assertEquals(1, bStore.count());
            List<InMemoryMesh.Delivery> acks = mesh.sent(bId, a.id);
            Assertions.assertEquals(1, acks.size());
            Frame ack = acks.get(0).frame();
            Assertions.assertTrue(ack.isAck());
            Assertions.assertEquals(id, ack.transferId());
            Assertions.assertEquals(0, a.ledger.size());
        } finally {
            deleteRecursively(root);
        }
    }

    private static DeliveryRouter router(
            InMemoryMesh mesh,
            NodeId node,
            Inbox inbox,
            MemoryBinaryStore store,
            DeliveredStore delivered,
            ManualClock clock
    ) {
        InMemoryMesh.MeshTransport transport = mesh.join(node);
        TransferLedger ledger = new TransferLedger(SETTINGS.retryPolicy(), clock);
        DeliveryRouter router = new DeliveryRouter(transport, ledger, inbox, store, delivered, SETTINGS, clock);
        transport.setFrameListener(router::onFrame);
        return router;
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
