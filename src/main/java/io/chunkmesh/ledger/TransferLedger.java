package io.chunkmesh.ledger;

import io.chunkmesh.model.Frame;
import io.chunkmesh.model.PendingSnapshot;
import io.chunkmesh.model.PendingTransferView;
import io.chunkmesh.model.TransferId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Source of truth for outbound transfers awaiting acknowledgement. Not thread-safe: the runtime
 * actor is its only writer.
 */
public final class TransferLedger {
    private static final Logger LOG = LoggerFactory.getLogger(TransferLedger.class);

    private final RetryPolicy retryPolicy;
    private final Clock clock;
    private final Map<TransferId, PendingOutboundTransfer> transfers;

    public TransferLedger(RetryPolicy retryPolicy, Clock clock) {
        this.retryPolicy = retryPolicy;
        this.clock = clock;
        this.transfers = new LinkedHashMap<>();
    }

    public PendingOutboundTransfer registerOutbound(TransferId transferId, List<Frame> chunks) {
        if (chunks == null || chunks.isEmpty()) {
            throw new IllegalArgumentException("Transfer " + transferId + " has no chunks");
        }
        PendingOutboundTransfer existing = transfers.get(transferId);
        if (existing != null) {
            return existing;
        }
        PendingOutboundTransfer created = new PendingOutboundTransfer(transferId, chunks, clock.millis());
        transfers.put(transferId, created);
        return created;
    }

    /**
     * Reinstates a transfer persisted before a restart with its acknowledgement progress. It is due
     * at once unless it was failed, in which case it waits for a manual retry or dismissal.
     */
    public PendingOutboundTransfer restoreOutbound(
            TransferId transferId,
            List<Frame> chunks,
            Collection<Integer> unacknowledged,
            int attemptCount,
            boolean failed,
            long createdAtMs
    ) {
        if (chunks == null || chunks.isEmpty()) {
            throw new IllegalArgumentException("Transfer " + transferId + " has no chunks");
        }
        PendingOutboundTransfer restored = new PendingOutboundTransfer(transferId, chunks, createdAtMs);
        restored.retainUnacknowledged(unacknowledged);
        restored.recordAttempt(Math.max(0, attemptCount), clock.millis());
        if (failed) {
            restored.markFailed();
        }
        transfers.put(transferId, restored);
        return restored;
    }

    /**
     * Marks one chunk acknowledged. Returns true when this call completed the transfer and removed
     * it from the ledger. Unknown transfers and repeated acks are no-ops.
     */
    public boolean acknowledge(TransferId transferId, int chunkIndex) {
        PendingOutboundTransfer transfer = transfers.get(transferId);
        if (transfer == null) {
            return false;
        }
        transfer.acknowledge(chunkIndex);
        return completeIfAcknowledged(transfer);
    }

    public boolean acknowledgeAll(TransferId transferId) {
        PendingOutboundTransfer transfer = transfers.get(transferId);
        if (transfer == null) {
            return false;
        }
        transfer.acknowledgeAll();
        return completeIfAcknowledged(transfer);
    }

    /**
     * Counts one emission of the transfer and schedules the next retry.
     *
     * @throws TransferAbandonedException when the attempt would exceed the ceiling; the transfer
     *         is then failed and excluded from {@link #due(long)}
     */
    public PendingOutboundTransfer markAttempt(TransferId transferId) {
        PendingOutboundTransfer transfer = transfers.get(transferId);
        if (transfer == null) {
            throw new IllegalStateException("Unknown outbound transfer: " + transferId);
        }
        int next = transfer.attemptCount() + 1;
        if (next > retryPolicy.maxAttempts()) {
            transfer.markFailed();
            throw new TransferAbandonedException(transferId, transfer.attemptCount());
        }
        long deadline = clock.millis() + retryPolicy.computeBackoffMs(next);
        transfer.recordAttempt(next, deadline);
        return transfer;
    }

    public List<PendingOutboundTransfer> due(long nowMs) {
        List<PendingOutboundTransfer> out = new ArrayList<>();
        for (PendingOutboundTransfer transfer : transfers.values()) {
            if (!transfer.isFailed() && transfer.nextRetryDeadlineMs() <= nowMs) {
                out.add(transfer);
            }
        }
        return out;
    }

    public List<PendingOutboundTransfer> active() {
        List<PendingOutboundTransfer> out = new ArrayList<>();
        for (PendingOutboundTransfer transfer : transfers.values()) {
            if (!transfer.isFailed()) {
                out.add(transfer);
            }
        }
        return out;
    }

    public Optional<PendingOutboundTransfer> find(TransferId transferId) {
        return Optional.ofNullable(transfers.get(transferId));
    }

    public boolean resetAttempts(TransferId transferId) {
        PendingOutboundTransfer transfer = transfers.get(transferId);
        if (transfer == null) {
            return false;
        }
        transfer.reset(clock.millis());
        return true;
    }

    public boolean forget(TransferId transferId) {
        return transfers.remove(transferId) != null;
    }

    public int size() {
        return transfers.size();
    }

    public PendingSnapshot snapshot() {
        List<TransferId> pending = new ArrayList<>();
        List<TransferId> failed = new ArrayList<>();
        List<PendingTransferView> views = new ArrayList<>();
        for (PendingOutboundTransfer transfer : transfers.values()) {
            if (transfer.isFailed()) {
                failed.add(transfer.transferId());
            } else {
                pending.add(transfer.transferId());
            }
            views.add(transfer.toView());
        }
        return new PendingSnapshot(pending.size(), failed.size(), List.copyOf(pending), List.copyOf(failed), List.copyOf(views));
    }

    private boolean completeIfAcknowledged(PendingOutboundTransfer transfer) {
        if (!transfer.isFullyAcknowledged()) {
            return false;
        }
        transfers.remove(transfer.transferId());
        if (transfer.isFailed()) {
            LOG.info("Late acknowledgement recovered failed transfer {} after {} attempts",
                    transfer.transferId(), transfer.attemptCount());
            return true;
        }
        LOG.debug("Transfer {} fully acknowledged after {} attempts", transfer.transferId(), transfer.attemptCount());
        return true;
    }
}
