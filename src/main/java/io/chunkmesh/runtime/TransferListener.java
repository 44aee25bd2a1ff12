package io.chunkmesh.runtime;

import io.chunkmesh.ledger.TransferAbandonedException;
import io.chunkmesh.model.ReceivedBinaryEvent;
import io.chunkmesh.model.TransferId;

/**
 * Presentation-side callbacks. Invoked on the runtime actor thread; implementations must not
 * block.
 */
public interface TransferListener {

    /** A transfer completed here and was newly added to the inbox. */
    default void onReceived(ReceivedBinaryEvent event) {
    }

    /** An outbound transfer was fully acknowledged. */
    default void onCompleted(TransferId transferId) {
    }

    default void onAbandoned(TransferAbandonedException failure) {
    }

    default void onStorageFailure(TransferId transferId, RuntimeException failure) {
    }
}
