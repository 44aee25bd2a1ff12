package io.chunkmesh.ledger;

import io.chunkmesh.model.TransferId;

/**
 * The attempt ceiling of an outbound transfer was exceeded. Terminal for automatic retries; the
 * transfer stays visible as failed until dismissed or retried by hand.
 */
public class TransferAbandonedException extends RuntimeException {
    private final TransferId transferId;
    private final int attempts;

    public TransferAbandonedException(TransferId transferId, int attempts) {
        super("Transfer " + transferId + " abandoned after " + attempts + " attempts");
        this.transferId = transferId;
        this.attempts = attempts;
    }

    public TransferId transferId() {
        return transferId;
    }

    public int attempts() {
        return attempts;
    }
}
