package io.chunkmesh.transport;

import io.chunkmesh.model.NodeId;

import java.util.Objects;

/**
 * Destination of a link write: one peer, or every reachable peer when {@link #BROADCAST}.
 */
public record PeerAddress(NodeId node) {
    public static final PeerAddress BROADCAST = new PeerAddress(null);

    public static PeerAddress of(NodeId node) {
        return new PeerAddress(Objects.requireNonNull(node, "node"));
    }

    public boolean isBroadcast() {
        return node == null;
    }

    @Override
    public String toString() {
        return isBroadcast() ? "broadcast" : node.toString();
    }
}
