package io.chunkmesh.transport;

import io.chunkmesh.model.NodeId;

@FunctionalInterface
public interface FrameListener {
    void onFrameReceived(byte[] frameBytes, NodeId fromPeer);
}
