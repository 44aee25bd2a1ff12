package io.chunkmesh.runtime;

import io.chunkmesh.ledger.PendingOutboundTransfer;
import io.chunkmesh.ledger.TransferAbandonedException;
import io.chunkmesh.ledger.TransferLedger;
import io.chunkmesh.model.TransferId;
import io.chunkmesh.router.DeliveryRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Re-emits unacknowledged chunks of pending transfers. The timer thread only posts tick
 * messages; {@link #retryDue} and {@link #retryAll} run on the runtime actor.
 */
public final class RetryScheduler implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(RetryScheduler.class);

    private final TransferLedger ledger;
    private final DeliveryRouter router;
    private final long tickMs;
    private ScheduledExecutorService timer;

    public RetryScheduler(TransferLedger ledger, DeliveryRouter router, long tickMs) {
        this.ledger = ledger;
        this.router = router;
        this.tickMs = Math.max(1L, tickMs);
    }

    public synchronized void start(Runnable postTick) {
        if (timer != null) {
            return;
        }
        timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "chunkmesh-retry-tick");
            t.setDaemon(true);
            return t;
        });
        timer.scheduleAtFixedRate(postTick, tickMs, tickMs, TimeUnit.MILLISECONDS);
    }

    /** Retries every pending transfer whose deadline has passed. */
    public RetryOutcome retryDue(long nowMs, Consumer<TransferAbandonedException> onAbandoned) {
        return retry(ledger.due(nowMs), onAbandoned);
    }

    /** Retries every pending transfer regardless of its deadline. */
    public RetryOutcome retryAll(Consumer<TransferAbandonedException> onAbandoned) {
        return retry(ledger.active(), onAbandoned);
    }

    /**
     * Puts a failed transfer back into rotation with a fresh attempt budget and emits it at once.
     */
    public RetryOutcome retryFailed(TransferId transferId, Consumer<TransferAbandonedException> onAbandoned) {
        if (!ledger.resetAttempts(transferId)) {
            return RetryOutcome.empty();
        }
        return retry(ledger.find(transferId).map(List::of).orElse(List.of()), onAbandoned);
    }

    private RetryOutcome retry(List<PendingOutboundTransfer> transfers, Consumer<TransferAbandonedException> onAbandoned) {
        if (transfers.isEmpty()) {
            return RetryOutcome.empty();
        }
        List<TransferId> retried = new ArrayList<>();
        List<TransferId> abandoned = new ArrayList<>();
        int written = 0;
        for (PendingOutboundTransfer transfer : transfers) {
            try {
                ledger.markAttempt(transfer.transferId());
            } catch (TransferAbandonedException e) {
                LOG.warn("Abandoning transfer {} after {} attempts", transfer.transferId().shortId(), e.attempts());
                abandoned.add(transfer.transferId());
                onAbandoned.accept(e);
                continue;
            }
            try {
                written += router.emit(transfer.unacknowledgedFrames());
            } catch (RuntimeException e) {
                LOG.warn("Failed to re-emit transfer {}, skipping it this round", transfer.transferId().shortId(), e);
                continue;
            }
            retried.add(transfer.transferId());
            LOG.debug("Retried transfer {} attempt {} ({} chunks missing)",
                    transfer.transferId().shortId(), transfer.attemptCount(), transfer.unacknowledged().size());
        }
        return new RetryOutcome(List.copyOf(retried), written, List.copyOf(abandoned));
    }

    @Override
    public synchronized void close() {
        if (timer != null) {
            timer.shutdownNow();
            timer = null;
        }
    }
}
