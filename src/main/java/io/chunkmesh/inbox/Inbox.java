package io.chunkmesh.inbox;

import io.chunkmesh.model.ReceivedBinaryEvent;
import io.chunkmesh.model.TransferId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Completed inbound transfers awaiting dismissal, keyed by transfer id. Entries never expire on
 * their own. Mutated only from the runtime actor.
 */
public final class Inbox {
    private static final Logger LOG = LoggerFactory.getLogger(Inbox.class);
    private static final Comparator<ReceivedBinaryEvent> PRESENTATION_ORDER = Comparator
            .comparingLong(ReceivedBinaryEvent::size).reversed()
            .thenComparingLong(ReceivedBinaryEvent::receivedAtMs)
            .thenComparing(event -> event.transferId().toString());

    private final int capacity;
    private final Map<TransferId, ReceivedBinaryEvent> entries;

    public Inbox(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Inbox capacity must be >= 1: " + capacity);
        }
        this.capacity = capacity;
        this.entries = new LinkedHashMap<>();
    }

    /**
     * Returns true only when the event was added; callers notify the user on true alone.
     */
    public boolean insert(ReceivedBinaryEvent event) {
        if (entries.containsKey(event.transferId())) {
            return false;
        }
        if (entries.size() >= capacity) {
            LOG.warn("Inbox full ({} entries), rejecting transfer {}", capacity, event.transferId());
            return false;
        }
        entries.put(event.transferId(), event);
        return true;
    }

    public boolean isFull() {
        return entries.size() >= capacity;
    }

    public boolean dismiss(TransferId transferId) {
        return entries.remove(transferId) != null;
    }

    public boolean contains(TransferId transferId) {
        return entries.containsKey(transferId);
    }

    public Optional<ReceivedBinaryEvent> find(TransferId transferId) {
        return Optional.ofNullable(entries.get(transferId));
    }

    /** Snapshot ordered by size descending. The order has no protocol meaning. */
    public List<ReceivedBinaryEvent> list() {
        List<ReceivedBinaryEvent> out = new ArrayList<>(entries.values());
        out.sort(PRESENTATION_ORDER);
        return List.copyOf(out);
    }

    public int size() {
        return entries.size();
    }

    public int capacity() {
        return capacity;
    }
}
