package io.chunkmesh.identity;

import io.chunkmesh.model.NodeId;
import io.chunkmesh.model.ReceivedBinaryEvent;
import io.chunkmesh.runtime.SendOutcome;
import io.chunkmesh.runtime.TransferRuntime;
import io.chunkmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Per-peer reveal state of the local identity. A reveal is sent as an ordinary transfer of type
 * {@link #REVEAL_TYPE}; a peer's reveal is picked up from the inbox like any other payload.
 */
public final class IdentityReveal {
    public static final String REVEAL_TYPE = "application/x-chunkmesh-identity";
    private static final Logger LOG = LoggerFactory.getLogger(IdentityReveal.class);

    public enum State {
        ANONYMOUS,
        REVEALED
    }

    private final TransferRuntime runtime;
    private final String displayName;
    private final Clock clock;
    private final Map<NodeId, State> states;
    private final Map<String, IdentityCard> known;

    public IdentityReveal(TransferRuntime runtime, String displayName, Clock clock) {
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("displayName must not be blank");
        }
        this.runtime = runtime;
        this.displayName = displayName.trim();
        this.clock = clock;
        this.states = new LinkedHashMap<>();
        this.known = new LinkedHashMap<>();
    }

    public synchronized State stateFor(NodeId peer) {
        return states.getOrDefault(peer, State.ANONYMOUS);
    }

    /**
     * Sends the local identity card to {@code peer}. Revealing twice to the same peer sends
     * nothing and returns an empty result. A send that fails puts the peer back to
     * {@link State#ANONYMOUS} so the reveal can be tried again.
     */
    public synchronized Optional<CompletableFuture<SendOutcome>> reveal(NodeId peer) {
        if (stateFor(peer) == State.REVEALED) {
            return Optional.empty();
        }
        IdentityCard card = new IdentityCard(runtime.localNode().toString(), displayName, clock.millis());
        byte[] payload = Jsons.toCompactJson(card).getBytes(StandardCharsets.UTF_8);
        states.put(peer, State.REVEALED);
        CompletableFuture<SendOutcome> sent = runtime.send(payload, REVEAL_TYPE, peer);
        sent.whenComplete((outcome, error) -> {
            if (error != null) {
                LOG.warn("Identity reveal to {} failed: {}", peer, error.getMessage());
                revertReveal(peer);
            }
        });
        return Optional.of(sent);
    }

    private synchronized void revertReveal(NodeId peer) {
        states.remove(peer);
    }

    /**
     * Reads a received transfer and, when it is an identity card, records it.
     */
    public synchronized Optional<IdentityCard> recognize(ReceivedBinaryEvent event) {
        if (!REVEAL_TYPE.equals(event.originalType())) {
            return Optional.empty();
        }
        IdentityCard card;
        try {
            card = Jsons.mapper().readValue(Files.readAllBytes(Path.of(event.location())), IdentityCard.class);
        } catch (IOException e) {
            LOG.warn("Ignoring unreadable identity card in transfer {}: {}", event.transferId().shortId(), e.getMessage());
            return Optional.empty();
        }
        if (card.node() == null || card.displayName() == null) {
            return Optional.empty();
        }
        known.put(card.node(), card);
        return Optional.of(card);
    }

    public synchronized Optional<IdentityCard> knownIdentity(NodeId peer) {
        return Optional.ofNullable(known.get(peer.toString()));
    }
}
