package io.chunkmesh.transport;

import io.chunkmesh.model.NodeId;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.net.DatagramSocket;
import java.net.SocketException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

final class UdpTransportAdapterTest {

    @Test
    void parsesNamedPeer() {
        UdpTransportAdapter.SeedEndpoint peer = UdpTransportAdapter.parsePeer(" relay-1@10.0.0.7:4040 ");
        Assertions.assertEquals(NodeId.of("relay-1"), peer.node());
        Assertions.assertEquals("10.0.0.7", peer.host());
        Assertions.assertEquals(4040, peer.port());
    }

    @Test
    void rejectsMalformedPeers() {
        for (String raw : List.of("", "relay@host", "@host:1", "relay@:1", "relay@host:", "relay@host:x", "relay@host:70000")) {
            Assertions.assertThrows(IllegalArgumentException.class, () -> UdpTransportAdapter.parsePeer(raw), raw);
        }
    }

    @Test
    void sendingBeforeStartIsALinkError() {
        UdpTransportAdapter adapter = new UdpTransportAdapter(NodeId.of("a"), 40_000, List.of());
        Assertions.assertThrows(LinkException.class, () -> adapter.send(PeerAddress.BROADCAST, new byte[] {1}));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new UdpTransportAdapter(NodeId.of("a"), 0, List.of()));
    }

    @Test
    void deliversFramesOverLoopbackWithSenderId() throws Exception {
        int portA = freePort();
        int portB = freePort();
        NodeId a = NodeId.of("udp-a");
        NodeId b = NodeId.of("udp-b");
        UdpTransportAdapter left = new UdpTransportAdapter(a, portA,
                List.of(new UdpTransportAdapter.SeedEndpoint(b, "127.0.0.1", portB)));
        UdpTransportAdapter right = new UdpTransportAdapter(b, portB,
                List.of(new UdpTransportAdapter.SeedEndpoint(a, "127.0.0.1", portA)), 64);
        BlockingQueue<NodeId> senders = new ArrayBlockingQueue<>(4);
        BlockingQueue<byte[]> frames = new ArrayBlockingQueue<>(4);
        right.setFrameListener((bytes, from) -> {
            senders.add(from);
            frames.add(bytes);
        });
        try {
            left.start();
            right.start();
            Assertions.assertEquals(Set.of(b), left.reachablePeers());

            left.send(PeerAddress.of(b), new byte[] {(byte) 0xC7, 1, 2, 3});
            Assertions.assertEquals(a, senders.poll(5, TimeUnit.SECONDS));
            Assertions.assertArrayEquals(new byte[] {(byte) 0xC7, 1, 2, 3}, frames.poll(1, TimeUnit.SECONDS));

            Assertions.assertThrows(LinkException.class, () -> left.send(PeerAddress.of(NodeId.of("nobody")), new byte[] {1}));
            Assertions.assertThrows(LinkException.class, () -> right.send(PeerAddress.BROADCAST, new byte[64]));
        } finally {
            left.close();
            right.close();
        }
    }

    private static int freePort() throws SocketException {
        try (DatagramSocket socket = new DatagramSocket(0)) {
            return socket.getLocalPort();
        }
    }
}
