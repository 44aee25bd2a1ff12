package io.chunkmesh.router;

import io.chunkmesh.codec.Assembly;
import io.chunkmesh.codec.ChunkCodec;
import io.chunkmesh.codec.FrameCodec;
import io.chunkmesh.codec.MalformedFrameException;
import io.chunkmesh.config.EngineSettings;
import io.chunkmesh.inbox.Inbox;
import io.chunkmesh.ledger.PendingOutboundTransfer;
import io.chunkmesh.ledger.TransferLedger;
import io.chunkmesh.model.Frame;
import io.chunkmesh.model.FrameKind;
import io.chunkmesh.model.NodeId;
import io.chunkmesh.model.ReceivedBinaryEvent;
import io.chunkmesh.model.TransferId;
import io.chunkmesh.storage.BinaryStore;
import io.chunkmesh.storage.DeliveredStore;
import io.chunkmesh.transport.LinkException;
import io.chunkmesh.transport.PeerAddress;
import io.chunkmesh.transport.TransportAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-transfer routing state machine of one node: decides for each inbound frame whether to
 * store it, relay it, deliver the completed transfer or route an acknowledgement.
 *
 * <p>Not thread-safe. Every call must come from the runtime actor thread.
 */
public final class DeliveryRouter {
    private static final Logger LOG = LoggerFactory.getLogger(DeliveryRouter.class);

    private final NodeId localNode;
    private final TransportAdapter transport;
    private final TransferLedger ledger;
    private final Inbox inbox;
    private final BinaryStore store;
    private final DeliveredStore deliveredStore;
    private final EngineSettings settings;
    private final Clock clock;
    private final SeenCache relayed;
    private final SeenCache acked;
    private final LinkedHashMap<TransferId, RouteEntry> routes;
    private final LinkedHashMap<TransferId, Boolean> originated;

    public DeliveryRouter(
            TransportAdapter transport,
            TransferLedger ledger,
            Inbox inbox,
            BinaryStore store,
            DeliveredStore deliveredStore,
            EngineSettings settings,
            Clock clock
    ) {
        this.localNode = transport.localNode();
        this.transport = transport;
        this.ledger = ledger;
        this.inbox = inbox;
        this.store = store;
        this.deliveredStore = deliveredStore;
        this.settings = settings;
        this.clock = clock;
        this.relayed = new SeenCache(settings.seenWindowMs(), settings.seenMaxEntries());
        this.acked = new SeenCache(settings.seenWindowMs(), settings.seenMaxEntries());
        int routeMax = settings.routeMaxEntries();
        this.routes = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<TransferId, RouteEntry> eldest) {
                return size() > routeMax;
            }
        };
        this.originated = new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<TransferId, Boolean> eldest) {
                return size() > routeMax;
            }
        };
    }

    public RouteOutcome onFrame(byte[] frameBytes, NodeId fromPeer) {
        Frame frame;
        try {
            frame = FrameCodec.decode(frameBytes);
        } catch (MalformedFrameException e) {
            LOG.warn("Dropping malformed frame from {}: {}", fromPeer, e.getMessage());
            return RouteOutcome.malformed();
        }
        long nowMs = clock.millis();
        return frame.isAck() ? handleAck(frame, fromPeer, nowMs) : handleData(frame, fromPeer, nowMs);
    }

    /**
     * Emits the first attempt of a transfer this node created. Echoes of it are dropped from then
     * on.
     */
    public int originate(List<Frame> frames) {
        if (frames.isEmpty()) {
            return 0;
        }
        originated.put(frames.get(0).transferId(), Boolean.TRUE);
        return emit(frames);
    }

    /**
     * Writes originated frames to the link: straight to the recipient when it is a neighbour,
     * otherwise to every reachable peer. Returns the number of frames written.
     */
    public int emit(List<Frame> frames) {
        int written = 0;
        Set<NodeId> reachable = transport.reachablePeers();
        for (Frame frame : frames) {
            PeerAddress destination = frame.recipient() != null && reachable.contains(frame.recipient())
                    ? PeerAddress.of(frame.recipient())
                    : PeerAddress.BROADCAST;
            if (write(destination, FrameCodec.encode(frame))) {
                written++;
            }
        }
        if (written < frames.size()) {
            LOG.warn("Wrote {}/{} frames of transfer {}, the rest is left to retry",
                    written, frames.size(), frames.get(0).transferId().shortId());
        }
        return written;
    }

    /**
     * Drops partial reassemblies idle for longer than the reassembly timeout and expired dedup
     * entries. Returns the number of reassemblies dropped.
     */
    public int purgeStale(long nowMs) {
        relayed.purgeExpired(nowMs);
        acked.purgeExpired(nowMs);
        int dropped = 0;
        Iterator<Map.Entry<TransferId, RouteEntry>> it = routes.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<TransferId, RouteEntry> entry = it.next();
            RouteEntry route = entry.getValue();
            if (route.state == RouteState.REASSEMBLING && nowMs - route.lastActivityMs >= settings.reassemblyTimeoutMs()) {
                LOG.info("Dropping stale reassembly of {} ({}/{} chunks)", entry.getKey().shortId(),
                        route.chunks.size(), route.chunks.isEmpty() ? 0 : route.chunks.firstEntry().getValue().totalChunks());
                it.remove();
                dropped++;
            }
        }
        return dropped;
    }

    public RouteState stateOf(TransferId transferId) {
        RouteEntry entry = routes.get(transferId);
        return entry == null ? RouteState.UNKNOWN : entry.state;
    }

    public Optional<NodeId> upstreamOf(TransferId transferId) {
        RouteEntry entry = routes.get(transferId);
        return entry == null ? Optional.empty() : Optional.ofNullable(entry.upstream);
    }

    /** Marks a transfer restored after a restart as this node's own, without emitting it. */
    public void rememberOriginated(TransferId transferId) {
        originated.put(transferId, Boolean.TRUE);
    }

    public boolean isOriginated(TransferId transferId) {
        return originated.containsKey(transferId);
    }

    public int routeCount() {
        return routes.size();
    }

    public NodeId localNode() {
        return localNode;
    }

    private RouteOutcome handleData(Frame frame, NodeId fromPeer, long nowMs) {
        TransferId id = frame.transferId();
        if (originated.containsKey(id)) {
            LOG.debug("Dropping echo of own transfer {}", id.shortId());
            return RouteOutcome.of(frame, RouteState.UNKNOWN, 0);
        }
        RouteEntry entry = routes.get(id);
        if (entry == null) {
            entry = openRoute(frame, fromPeer, nowMs);
            routes.put(id, entry);
        }
        return switch (entry.state) {
            case RELAYING -> {
                entry.lastActivityMs = nowMs;
                yield RouteOutcome.of(frame, RouteState.RELAYING, relay(frame, fromPeer, nowMs));
            }
            case REASSEMBLING -> reassemble(entry, frame, fromPeer, nowMs);
            case DELIVERED -> {
                entry.lastActivityMs = nowMs;
                if (acked.markIfAbsent(new SeenCache.Key(id, FrameKind.ACK, SeenCache.WHOLE_TRANSFER), nowMs)) {
                    sendAck(frame, fromPeer, true);
                }
                int relayedTo = isForThisNode(frame) ? 0 : relay(frame, fromPeer, nowMs);
                yield RouteOutcome.of(frame, RouteState.DELIVERED, relayedTo);
            }
            case EXPIRED, UNKNOWN -> RouteOutcome.of(frame, entry.state, 0);
        };
    }

    private RouteEntry openRoute(Frame frame, NodeId fromPeer, long nowMs) {
        if (deliveredStore != null && deliveredStore.contains(frame.transferId())) {
            return new RouteEntry(RouteState.DELIVERED, fromPeer, nowMs);
        }
        if (frame.ttl() <= 0) {
            LOG.debug("Transfer {} arrived with exhausted ttl, expiring", frame.transferId().shortId());
            return new RouteEntry(RouteState.EXPIRED, fromPeer, nowMs);
        }
        if (frame.recipient() != null && !isForThisNode(frame)) {
            return new RouteEntry(RouteState.RELAYING, fromPeer, nowMs);
        }
        return new RouteEntry(RouteState.REASSEMBLING, fromPeer, nowMs);
    }

    private RouteOutcome reassemble(RouteEntry entry, Frame frame, NodeId fromPeer, long nowMs) {
        if (frame.ttl() <= 0) {
            LOG.debug("Discarding exhausted-ttl chunk {}", frame);
            return RouteOutcome.of(frame, RouteState.REASSEMBLING, 0);
        }
        if (!entry.chunks.isEmpty() && entry.chunks.firstEntry().getValue().totalChunks() != frame.totalChunks()) {
            LOG.warn("Dropping chunk {} that disagrees on totalChunks", frame);
            return RouteOutcome.of(frame, RouteState.REASSEMBLING, 0);
        }
        entry.lastActivityMs = nowMs;
        int relayedTo = frame.isBroadcast() ? relay(frame, fromPeer, nowMs) : 0;
        entry.chunks.putIfAbsent(frame.sequenceIndex(), frame);
        if (entry.chunks.size() < frame.totalChunks()) {
            if (settings.chunkAcks()
                    && acked.markIfAbsent(new SeenCache.Key(frame.transferId(), FrameKind.ACK, frame.sequenceIndex()), nowMs)) {
                sendAck(frame, fromPeer, false);
            }
            return RouteOutcome.of(frame, RouteState.REASSEMBLING, relayedTo);
        }
        Assembly assembly = ChunkCodec.tryAssemble(entry.chunks.values());
        if (!assembly.complete()) {
            return RouteOutcome.of(frame, RouteState.REASSEMBLING, relayedTo);
        }
        return deliver(entry, frame, fromPeer, assembly.bytes(), relayedTo, nowMs);
    }

    private RouteOutcome deliver(RouteEntry entry, Frame frame, NodeId fromPeer, byte[] bytes, int relayedTo, long nowMs) {
        TransferId id = frame.transferId();
        if (inbox.isFull() && !inbox.contains(id)) {
            LOG.warn("Inbox full, holding transfer {} unacknowledged until an entry is dismissed", id.shortId());
            return RouteOutcome.of(frame, RouteState.REASSEMBLING, relayedTo);
        }
        String location;
        try {
            location = store.store(bytes, frame.originalType());
        } catch (RuntimeException e) {
            LOG.warn("Failed to store transfer {}, keeping it in reassembly: {}", id.shortId(), e.getMessage());
            return new RouteOutcome(frame, RouteState.REASSEMBLING, relayedTo, null, null, e, false);
        }
        entry.state = RouteState.DELIVERED;
        entry.chunks.clear();
        ReceivedBinaryEvent event = new ReceivedBinaryEvent(
                id,
                frame.originalType(),
                bytes.length,
                location,
                frame.ttl(),
                frame.recipient(),
                nowMs
        );
        if (deliveredStore != null) {
            try {
                deliveredStore.markDelivered(id, frame.originalType(), bytes.length, nowMs);
            } catch (RuntimeException e) {
                LOG.warn("Failed to record delivery of {}", id.shortId(), e);
            }
        }
        boolean inserted = inbox.insert(event);
        acked.markIfAbsent(new SeenCache.Key(id, FrameKind.ACK, SeenCache.WHOLE_TRANSFER), nowMs);
        sendAck(frame, fromPeer, true);
        LOG.info("Delivered transfer {} ({} bytes, {})", id.shortId(), bytes.length, frame.originalType());
        return new RouteOutcome(frame, RouteState.DELIVERED, relayedTo, inserted ? event : null, null, null, false);
    }

    private RouteOutcome handleAck(Frame frame, NodeId fromPeer, long nowMs) {
        TransferId id = frame.transferId();
        boolean wasFailed = ledger.find(id).map(PendingOutboundTransfer::isFailed).orElse(false);
        boolean completed = frame.isFinal()
                ? ledger.acknowledgeAll(id)
                : ledger.acknowledge(id, frame.sequenceIndex());
        int relayedTo = 0;
        if (!originated.containsKey(id) && isRouted(id) && frame.ttl() > 1) {
            int index = frame.isFinal() ? SeenCache.WHOLE_TRANSFER : frame.sequenceIndex();
            if (relayed.markIfAbsent(new SeenCache.Key(id, FrameKind.ACK, index), nowMs)) {
                relayedTo = forwardAck(frame, fromPeer);
            }
        }
        return new RouteOutcome(frame, stateOf(id), relayedTo, null, completed ? id : null, null, completed && wasFailed);
    }

    /** True when this node carried the transfer's data and so sits on its acknowledgement path. */
    private boolean isRouted(TransferId transferId) {
        RouteEntry entry = routes.get(transferId);
        return entry != null && (entry.state == RouteState.RELAYING
                || entry.state == RouteState.REASSEMBLING
                || entry.state == RouteState.DELIVERED);
    }

    private int forwardAck(Frame frame, NodeId fromPeer) {
        Frame forwarded = frame.withTtl(frame.ttl() - 1);
        byte[] bytes = FrameCodec.encode(forwarded);
        NodeId upstream = upstreamOf(frame.transferId()).orElse(null);
        if (upstream != null && !upstream.equals(fromPeer) && transport.reachablePeers().contains(upstream)) {
            return write(PeerAddress.of(upstream), bytes) ? 1 : 0;
        }
        return writeToAllExcept(bytes, fromPeer);
    }

    private int relay(Frame frame, NodeId fromPeer, long nowMs) {
        if (frame.ttl() <= 1) {
            return 0;
        }
        if (!relayed.markIfAbsent(new SeenCache.Key(frame.transferId(), FrameKind.DATA, frame.sequenceIndex()), nowMs)) {
            return 0;
        }
        return writeToAllExcept(FrameCodec.encode(frame.withTtl(frame.ttl() - 1)), fromPeer);
    }

    private void sendAck(Frame source, NodeId toPeer, boolean wholeTransfer) {
        Frame ack = Frame.ack(source, source.ttl(), wholeTransfer);
        write(toPeer == null ? PeerAddress.BROADCAST : PeerAddress.of(toPeer), FrameCodec.encode(ack));
    }

    private int writeToAllExcept(byte[] bytes, NodeId excluded) {
        int written = 0;
        for (NodeId peer : transport.reachablePeers()) {
            if (peer.equals(excluded) || peer.equals(localNode)) {
                continue;
            }
            if (write(PeerAddress.of(peer), bytes)) {
                written++;
            }
        }
        return written;
    }

    private boolean write(PeerAddress destination, byte[] bytes) {
        try {
            transport.send(destination, bytes);
            return true;
        } catch (LinkException e) {
            LOG.warn("Link write to {} failed: {}", destination, e.getMessage());
            return false;
        }
    }

    private boolean isForThisNode(Frame frame) {
        return localNode.equals(frame.recipient());
    }
}
