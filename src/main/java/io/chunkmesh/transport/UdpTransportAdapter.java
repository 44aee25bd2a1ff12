package io.chunkmesh.transport;

import io.chunkmesh.model.NodeId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.DatagramPacket;
import java.net.DatagramSocket;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Datagram link with a static peer table. Every datagram is prefixed with the sender's 16 byte
 * node id so receivers know which neighbour a frame came from.
 */
public final class UdpTransportAdapter implements TransportAdapter {
    public static final int DEFAULT_MAX_DATAGRAM_BYTES = 8192;
    private static final int NODE_PREFIX_BYTES = 16;
    private static final Logger LOG = LoggerFactory.getLogger(UdpTransportAdapter.class);

    private final NodeId localNode;
    private final int bindPort;
    private final int maxDatagramBytes;
    private final Map<NodeId, SeedEndpoint> peers;
    private volatile FrameListener listener;
    private volatile boolean running;
    private DatagramSocket socket;
    private Thread receiver;

    public UdpTransportAdapter(NodeId localNode, int bindPort, List<SeedEndpoint> peers) {
        this(localNode, bindPort, peers, DEFAULT_MAX_DATAGRAM_BYTES);
    }

    public UdpTransportAdapter(NodeId localNode, int bindPort, List<SeedEndpoint> peers, int maxDatagramBytes) {
        if (bindPort <= 0 || bindPort > 65535) {
            throw new IllegalArgumentException("Invalid UDP port: " + bindPort);
        }
        this.localNode = localNode;
        this.bindPort = bindPort;
        this.maxDatagramBytes = Math.max(NODE_PREFIX_BYTES + 1, maxDatagramBytes);
        this.peers = new LinkedHashMap<>();
        for (SeedEndpoint peer : peers) {
            if (!peer.node().equals(localNode)) {
                this.peers.put(peer.node(), peer);
            }
        }
    }

    /**
     * Parses {@code name@host:port}; the name is mapped through {@link NodeId#of(String)}.
     */
    public static SeedEndpoint parsePeer(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Peer must not be blank");
        }
        String value = raw.trim();
        int at = value.indexOf('@');
        int colon = value.lastIndexOf(':');
        if (at <= 0 || colon <= at + 1 || colon == value.length() - 1) {
            throw new IllegalArgumentException("Peer must look like name@host:port: " + raw);
        }
        int port;
        try {
            port = Integer.parseInt(value.substring(colon + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid peer port: " + raw, e);
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid peer port: " + raw);
        }
        return new SeedEndpoint(NodeId.of(value.substring(0, at)), value.substring(at + 1, colon), port);
    }

    @Override
    public NodeId localNode() {
        return localNode;
    }

    @Override
    public Set<NodeId> reachablePeers() {
        return new LinkedHashSet<>(peers.keySet());
    }

    @Override
    public void setFrameListener(FrameListener listener) {
        this.listener = listener;
    }

    @Override
    public synchronized void start() throws LinkException {
        if (running) {
            return;
        }
        try {
            DatagramSocket opened = new DatagramSocket(null);
            opened.setReuseAddress(true);
            opened.bind(new InetSocketAddress(bindPort));
            opened.setSoTimeout(250);
            socket = opened;
        } catch (SocketException e) {
            throw new LinkException("Failed to bind UDP port " + bindPort, e);
        }
        running = true;
        receiver = new Thread(this::receiveLoop, "chunkmesh-udp-" + bindPort);
        receiver.setDaemon(true);
        receiver.start();
    }

    @Override
    public void send(PeerAddress destination, byte[] frameBytes) throws LinkException {
        DatagramSocket current = socket;
        if (current == null || !running) {
            throw new LinkException("UDP link is not started");
        }
        if (frameBytes.length + NODE_PREFIX_BYTES > maxDatagramBytes) {
            throw new LinkException("Frame of " + frameBytes.length + " bytes exceeds link limit " + maxDatagramBytes);
        }
        List<SeedEndpoint> targets = new ArrayList<>();
        if (destination.isBroadcast()) {
            targets.addAll(peers.values());
        } else {
            SeedEndpoint peer = peers.get(destination.node());
            if (peer == null) {
                throw new LinkException("Peer not reachable: " + destination);
            }
            targets.add(peer);
        }
        byte[] datagram = ByteBuffer.allocate(NODE_PREFIX_BYTES + frameBytes.length)
                .putLong(localNode.value().getMostSignificantBits())
                .putLong(localNode.value().getLeastSignificantBits())
                .put(frameBytes)
                .array();
        LinkException failure = null;
        for (SeedEndpoint target : targets) {
            try {
                current.send(new DatagramPacket(
                        datagram,
                        datagram.length,
                        InetAddress.getByName(target.host()),
                        target.port()
                ));
            } catch (IOException e) {
                failure = new LinkException("Failed to send to " + target, e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public synchronized void close() {
        running = false;
        if (socket != null) {
            socket.close();
        }
        if (receiver != null) {
            try {
                receiver.join(1_000L);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private void receiveLoop() {
        byte[] buf = new byte[maxDatagramBytes];
        while (running) {
            DatagramPacket incoming = new DatagramPacket(buf, buf.length);
            try {
                socket.receive(incoming);
            } catch (SocketTimeoutException timeout) {
                continue;
            } catch (IOException e) {
                if (running) {
                    LOG.warn("UDP receive failed on port {}: {}", bindPort, e.getMessage());
                }
                continue;
            }
            if (incoming.getLength() <= NODE_PREFIX_BYTES) {
                LOG.debug("Dropping runt datagram of {} bytes", incoming.getLength());
                continue;
            }
            ByteBuffer view = ByteBuffer.wrap(incoming.getData(), incoming.getOffset(), incoming.getLength());
            NodeId from = new NodeId(new UUID(view.getLong(), view.getLong()));
            byte[] frame = new byte[view.remaining()];
            view.get(frame);
            FrameListener current = listener;
            if (current != null) {
                current.onFrameReceived(frame, from);
            }
        }
    }

    public record SeedEndpoint(NodeId node, String host, int port) {
        @Override
        public String toString() {
            return node + "@" + host + ":" + port;
        }
    }
}
