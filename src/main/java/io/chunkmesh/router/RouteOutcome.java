package io.chunkmesh.router;

import io.chunkmesh.model.Frame;
import io.chunkmesh.model.ReceivedBinaryEvent;
import io.chunkmesh.model.TransferId;

/**
 * What handling one inbound frame did at this node. {@code delivered} is set only when the
 * completed transfer was newly added to the inbox; {@code recoveredFailure} marks an
 * acknowledgement that completed an outbound transfer already given up on.
 */
public record RouteOutcome(
        Frame frame,
        RouteState state,
        int relayedTo,
        ReceivedBinaryEvent delivered,
        TransferId completedOutbound,
        RuntimeException storageFailure,
        boolean recoveredFailure
) {
    static RouteOutcome malformed() {
        return new RouteOutcome(null, RouteState.UNKNOWN, 0, null, null, null, false);
    }

    static RouteOutcome of(Frame frame, RouteState state, int relayedTo) {
        return new RouteOutcome(frame, state, relayedTo, null, null, null, false);
    }

    public boolean relayed() {
        return relayedTo > 0;
    }
}
