package io.chunkmesh.router;

import io.chunkmesh.config.EngineSettings;
import io.chunkmesh.model.Frame;
import io.chunkmesh.model.ReceivedBinaryEvent;
import io.chunkmesh.model.TransferId;
import io.chunkmesh.testing.InMemoryMesh;
import io.chunkmesh.testing.ManualClock;
import io.chunkmesh.testing.MeshNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

final class MeshScenarioTest {

    @Test
    void broadcastCrossesRelayAndAckFlowsBackToOrigin() {
        EngineSettings settings = EngineSettings.defaults().withMtu(500).withRetry(5, 2_000L, 600_000L, 0L);
        ManualClock clock = new ManualClock(1_700_000_000_000L);
        InMemoryMesh mesh = new InMemoryMesh();
        MeshNode origin = new MeshNode(mesh, "origin", settings, clock);
        MeshNode relay = new MeshNode(mesh, "relay", settings, clock);
        MeshNode destination = new MeshNode(mesh, "destination", settings, clock);
        mesh.link(origin.id, relay.id);
        mesh.link(relay.id, destination.id);

        byte[] payload = new byte[10_000];
        new Random(7L).nextBytes(payload);
        TransferId id = origin.send(payload, null, 3);
        Assertions.assertEquals(20, origin.ledger.find(id).orElseThrow().totalChunks());

        mesh.drain();

        List<InMemoryMesh.Delivery> relayed = mesh.sent(relay.id, destination.id);
        Assertions.assertEquals(20, relayed.size());
        for (InMemoryMesh.Delivery delivery : relayed) {
            Frame frame = delivery.frame();
            Assertions.assertFalse(frame.isAck());
            Assertions.assertEquals(2, frame.ttl());
        }

        Assertions.assertEquals(1, destination.inbox.size());
        ReceivedBinaryEvent received = destination.inbox.list().get(0);
        Assertions.assertEquals(id, received.transferId());
        Assertions.assertEquals(10_000L, received.size());
        Assertions.assertArrayEquals(payload, destination.store.read(received.location()));

        List<InMemoryMesh.Delivery> destinationAcks = mesh.sent(destination.id, relay.id);
        Assertions.assertEquals(1, destinationAcks.size());
        Assertions.assertTrue(destinationAcks.get(0).frame().isAck());
        Assertions.assertEquals(2, destinationAcks.get(0).frame().ttl());

        boolean forwardedWithTtlOne = mesh.sent(relay.id, origin.id).stream()
                .map(InMemoryMesh.Delivery::frame)
                .anyMatch(frame -> frame.isAck() && frame.ttl() == 1);
        Assertions.assertTrue(forwardedWithTtlOne);

        Assertions.assertEquals(0, origin.ledger.size());
        Assertions.assertTrue(origin.ledger.snapshot().pendingIds().isEmpty());
        Assertions.assertEquals(0, origin.inbox.size());
        Assertions.assertEquals(RouteState.DELIVERED, destination.router.stateOf(id));
    }
}
