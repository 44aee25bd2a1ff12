package io.chunkmesh.router;

import io.chunkmesh.model.Frame;
import io.chunkmesh.model.NodeId;

import java.util.TreeMap;

final class RouteEntry {
    RouteState state;
    final NodeId upstream;
    final TreeMap<Integer, Frame> chunks;
    long lastActivityMs;

    RouteEntry(RouteState state, NodeId upstream, long nowMs) {
        this.state = state;
        this.upstream = upstream;
        this.chunks = new TreeMap<>();
        this.lastActivityMs = nowMs;
    }
}
