package io.chunkmesh.transport;

import io.chunkmesh.model.NodeId;

import java.util.Set;

/**
 * The only source and sink of bytes for the transfer engine. Connection establishment and
 * addressing beyond peer ids belong to the implementation.
 */
public interface TransportAdapter extends AutoCloseable {

    NodeId localNode();

    /** Peers a frame can currently be written to. */
    Set<NodeId> reachablePeers();

    void send(PeerAddress destination, byte[] frameBytes) throws LinkException;

    /** Inbound frames are delivered to this listener, one call per frame. */
    void setFrameListener(FrameListener listener);

    default void start() throws LinkException {
    }

    @Override
    void close();
}
