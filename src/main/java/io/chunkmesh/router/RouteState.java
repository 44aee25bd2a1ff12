package io.chunkmesh.router;

public enum RouteState {
    UNKNOWN,
    RELAYING,
    REASSEMBLING,
    DELIVERED,
    EXPIRED
}
