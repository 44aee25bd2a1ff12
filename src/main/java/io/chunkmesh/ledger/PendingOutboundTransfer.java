package io.chunkmesh.ledger;

import io.chunkmesh.model.Frame;
import io.chunkmesh.model.PendingTransferView;
import io.chunkmesh.model.TransferId;
import io.chunkmesh.model.TransferStatus;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Ledger-owned record of a transfer awaiting acknowledgement. Mutated only by
 * {@link TransferLedger}.
 */
public final class PendingOutboundTransfer {
    private final TransferId transferId;
    private final List<Frame> frames;
    private final TreeSet<Integer> unacknowledged;
    private final long createdAtMs;
    private int attemptCount;
    private long nextRetryDeadlineMs;
    private TransferStatus status;

    PendingOutboundTransfer(TransferId transferId, List<Frame> frames, long createdAtMs) {
        this.transferId = transferId;
        this.frames = List.copyOf(frames);
        this.unacknowledged = new TreeSet<>();
        for (Frame frame : frames) {
            unacknowledged.add(frame.sequenceIndex());
        }
        this.createdAtMs = createdAtMs;
        this.attemptCount = 0;
        this.nextRetryDeadlineMs = createdAtMs;
        this.status = TransferStatus.PENDING;
    }

    public TransferId transferId() {
        return transferId;
    }

    public int totalChunks() {
        return frames.size();
    }

    public List<Integer> unacknowledged() {
        return List.copyOf(unacknowledged);
    }

    /** Frames still awaiting acknowledgement, in index order. */
    public List<Frame> unacknowledgedFrames() {
        List<Frame> out = new ArrayList<>(unacknowledged.size());
        for (Frame frame : frames) {
            if (unacknowledged.contains(frame.sequenceIndex())) {
                out.add(frame);
            }
        }
        return out;
    }

    public int attemptCount() {
        return attemptCount;
    }

    public long nextRetryDeadlineMs() {
        return nextRetryDeadlineMs;
    }

    public TransferStatus status() {
        return status;
    }

    public long createdAtMs() {
        return createdAtMs;
    }

    public boolean isFailed() {
        return status == TransferStatus.FAILED;
    }

    public PendingTransferView toView() {
        return new PendingTransferView(
                transferId,
                status.name(),
                frames.size(),
                unacknowledged(),
                attemptCount,
                nextRetryDeadlineMs
        );
    }

    boolean acknowledge(int chunkIndex) {
        return unacknowledged.remove(chunkIndex);
    }

    void acknowledgeAll() {
        unacknowledged.clear();
    }

    void retainUnacknowledged(Collection<Integer> indices) {
        unacknowledged.retainAll(indices);
    }

    boolean isFullyAcknowledged() {
        return unacknowledged.isEmpty();
    }

    void recordAttempt(int attempt, long nextDeadlineMs) {
        this.attemptCount = attempt;
        this.nextRetryDeadlineMs = nextDeadlineMs;
    }

    void markFailed() {
        this.status = TransferStatus.FAILED;
    }

    void reset(long nowMs) {
        this.attemptCount = 0;
        this.nextRetryDeadlineMs = nowMs;
        this.status = TransferStatus.PENDING;
    }
}
