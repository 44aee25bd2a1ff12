package io.chunkmesh.runtime;

import io.chunkmesh.codec.ChunkCodec;
import io.chunkmesh.config.ChunkMeshConfig;
import io.chunkmesh.config.EngineSettings;
import io.chunkmesh.inbox.Inbox;
import io.chunkmesh.ledger.TransferAbandonedException;
import io.chunkmesh.ledger.PendingOutboundTransfer;
import io.chunkmesh.ledger.TransferLedger;
import io.chunkmesh.model.Frame;
import io.chunkmesh.model.NodeId;
import io.chunkmesh.model.PendingSnapshot;
import io.chunkmesh.model.ReceivedBinaryEvent;
import io.chunkmesh.model.Transfer;
import io.chunkmesh.model.TransferId;
import io.chunkmesh.observability.AuditLogger;
import io.chunkmesh.router.DeliveryRouter;
import io.chunkmesh.router.RouteOutcome;
import io.chunkmesh.storage.BinaryStore;
import io.chunkmesh.storage.Database;
import io.chunkmesh.storage.DeliveredStore;
import io.chunkmesh.storage.FileBinaryStore;
import io.chunkmesh.storage.PendingRecord;
import io.chunkmesh.storage.PendingStore;
import io.chunkmesh.transport.LinkException;
import io.chunkmesh.transport.TransportAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Node-level transfer engine. Ledger, router and inbox are owned by a single actor thread; every
 * public operation is a message to it and completes the returned future with its result.
 */
public final class TransferRuntime implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(TransferRuntime.class);
    private static final Duration RECEIVED_MAX_AGE = Duration.ofHours(24);

    private final TransportAdapter transport;
    private final EngineSettings settings;
    private final Clock clock;
    private final TransferListener listener;
    private final AuditLogger auditLogger;
    private final TransferLedger ledger;
    private final Inbox inbox;
    private final DeliveryRouter router;
    private final RetryScheduler scheduler;
    private final PendingStore pendingStore;
    private final ExecutorService actor;

    public TransferRuntime(
            TransportAdapter transport,
            BinaryStore store,
            DeliveredStore deliveredStore,
            AuditLogger auditLogger,
            EngineSettings settings,
            Clock clock,
            TransferListener listener
    ) {
        this(transport, store, deliveredStore, null, auditLogger, settings, clock, listener);
    }

    /**
     * {@code pendingStore} may be null, in which case outbound transfers live in memory only.
     * Otherwise the transfers it holds are restored into the ledger before the runtime accepts work.
     */
    public TransferRuntime(
            TransportAdapter transport,
            BinaryStore store,
            DeliveredStore deliveredStore,
            PendingStore pendingStore,
            AuditLogger auditLogger,
            EngineSettings settings,
            Clock clock,
            TransferListener listener
    ) {
        this.transport = transport;
        this.settings = settings;
        this.clock = clock;
        this.listener = listener == null ? new TransferListener() { } : listener;
        this.auditLogger = auditLogger;
        this.ledger = new TransferLedger(settings.retryPolicy(), clock);
        this.inbox = new Inbox(settings.inboxCapacity());
        this.router = new DeliveryRouter(transport, ledger, inbox, store, deliveredStore, settings, clock);
        this.scheduler = new RetryScheduler(ledger, router, settings.retryTickMs());
        this.pendingStore = pendingStore;
        this.actor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "chunkmesh-actor");
            t.setDaemon(true);
            return t;
        });
        restorePending();
    }

    /**
     * Wires a runtime over the on-disk layout under {@code config}: settings file, received
     * payload directory, delivered and pending transfer tables and audit log. Outbound transfers
     * left pending by a previous run are due at the first tick.
     */
    public static TransferRuntime open(ChunkMeshConfig config, TransportAdapter transport, TransferListener listener) {
        EngineSettings settings = EngineSettings.load(config.settingsFile());
        Database database = new Database(config);
        database.init();
        FileBinaryStore store = new FileBinaryStore(config.receivedDir());
        int removed = store.cleanupStale(RECEIVED_MAX_AGE);
        if (removed > 0) {
            LOG.info("Removed {} stale received payloads from {}", removed, store.dir());
        }
        AuditLogger audit = new AuditLogger(config.auditFile(), transport.localNode().toString());
        return new TransferRuntime(
                transport,
                store,
                new DeliveredStore(database, settings.seenMaxEntries()),
                new PendingStore(database),
                audit,
                settings,
                Clock.systemUTC(),
                listener
        );
    }

    /**
     * Attaches to the link and starts the retry timer.
     */
    public void start() throws LinkException {
        transport.setFrameListener((bytes, from) -> onFrame(bytes, from).exceptionally(e -> {
            LOG.warn("Inbound frame from {} not processed: {}", from, e.getMessage());
            return null;
        }));
        transport.start();
        scheduler.start(() -> tick().exceptionally(e -> {
            LOG.warn("Retry tick failed: {}", e.getMessage());
            return null;
        }));
        LOG.info("Transfer runtime started on node {} (mtu={}, ttl={})",
                transport.localNode(), settings.mtu(), settings.defaultTtl());
    }

    public CompletableFuture<SendOutcome> send(byte[] payload, String originalType, NodeId recipient) {
        return send(payload, originalType, recipient, settings.defaultTtl());
    }

    /**
     * Fragments {@code payload}, registers it as pending and emits the first attempt.
     * {@code recipient} null means broadcast.
     */
    public CompletableFuture<SendOutcome> send(byte[] payload, String originalType, NodeId recipient, int ttl) {
        return submit(() -> {
            long size = payload == null ? 0L : payload.length;
            Transfer transfer = new Transfer(TransferId.random(), originalType, size, ttl, recipient);
            List<Frame> frames = ChunkCodec.fragment(payload, transfer, settings.mtu());
            PendingOutboundTransfer pending = ledger.registerOutbound(transfer.transferId(), frames);
            ledger.markAttempt(transfer.transferId());
            if (pendingStore != null) {
                try {
                    pendingStore.save(new PendingRecord(transfer, settings.mtu(), payload, pending.unacknowledged(),
                            pending.attemptCount(), false, pending.createdAtMs()));
                } catch (RuntimeException e) {
                    ledger.forget(transfer.transferId());
                    throw e;
                }
            }
            int written = router.originate(frames);
            audit("transfer.send", transfer.transferId(), "ok", Map.of(
                    "type", transfer.originalType(),
                    "size", size,
                    "chunks", frames.size(),
                    "ttl", ttl,
                    "recipient", recipient == null ? "broadcast" : recipient.toString()
            ));
            return new SendOutcome(transfer.transferId(), frames.size(), written);
        });
    }

    public CompletableFuture<RouteOutcome> onFrame(byte[] frameBytes, NodeId fromPeer) {
        return submit(() -> {
            RouteOutcome out = router.onFrame(frameBytes, fromPeer);
            if (out.delivered() != null) {
                ReceivedBinaryEvent event = out.delivered();
                audit("transfer.delivered", event.transferId(), "ok", Map.of(
                        "type", event.originalType(),
                        "size", event.size(),
                        "location", event.location()
                ));
                listener.onReceived(event);
            }
            if (out.frame() != null && out.frame().isAck() && router.isOriginated(out.frame().transferId())) {
                persistProgress(out.frame().transferId());
            }
            if (out.completedOutbound() != null) {
                audit("transfer.acknowledged", out.completedOutbound(), out.recoveredFailure() ? "recovered" : "ok", Map.of());
                listener.onCompleted(out.completedOutbound());
            }
            if (out.storageFailure() != null) {
                audit("transfer.delivered", out.frame().transferId(), "storage_failed",
                        Map.of("error", String.valueOf(out.storageFailure().getMessage())));
                listener.onStorageFailure(out.frame().transferId(), out.storageFailure());
            }
            return out;
        });
    }

    /** One scheduler tick: retries due transfers and purges stale reassemblies. */
    public CompletableFuture<RetryOutcome> tick() {
        return submit(() -> {
            long nowMs = clock.millis();
            RetryOutcome out = scheduler.retryDue(nowMs, this::abandoned);
            router.purgeStale(nowMs);
            persistProgress(out);
            auditRetries(out, "tick");
            return out;
        });
    }

    /** Re-emits every pending transfer now, e.g. when the link comes back. Counts as an attempt. */
    public CompletableFuture<RetryOutcome> retryNow() {
        return submit(() -> {
            RetryOutcome out = scheduler.retryAll(this::abandoned);
            persistProgress(out);
            auditRetries(out, "manual");
            return out;
        });
    }

    public CompletableFuture<RetryOutcome> retryFailed(TransferId transferId) {
        return submit(() -> {
            boolean failed = ledger.find(transferId).map(t -> t.isFailed()).orElse(false);
            if (!failed) {
                return RetryOutcome.empty();
            }
            RetryOutcome out = scheduler.retryFailed(transferId, this::abandoned);
            persistProgress(out);
            auditRetries(out, "failed");
            return out;
        });
    }

    public CompletableFuture<Boolean> dismissFailed(TransferId transferId) {
        return submit(() -> {
            boolean failed = ledger.find(transferId).map(t -> t.isFailed()).orElse(false);
            if (!failed) {
                return false;
            }
            ledger.forget(transferId);
            persistProgress(transferId);
            audit("transfer.dismissed", transferId, "ok", Map.of());
            return true;
        });
    }

    public CompletableFuture<Boolean> dismiss(TransferId transferId) {
        return submit(() -> {
            boolean removed = inbox.dismiss(transferId);
            if (removed) {
                audit("inbox.dismiss", transferId, "ok", Map.of());
            }
            return removed;
        });
    }

    public CompletableFuture<List<ReceivedBinaryEvent>> inboxSnapshot() {
        return submit(inbox::list);
    }

    public CompletableFuture<PendingSnapshot> pendingSnapshot() {
        return submit(ledger::snapshot);
    }

    public NodeId localNode() {
        return transport.localNode();
    }

    public EngineSettings settings() {
        return settings;
    }

    @Override
    public void close() {
        scheduler.close();
        transport.close();
        actor.shutdown();
        try {
            if (!actor.awaitTermination(2, TimeUnit.SECONDS)) {
                actor.shutdownNow();
            }
        } catch (InterruptedException e) {
            actor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void restorePending() {
        if (pendingStore == null) {
            return;
        }
        int restored = 0;
        for (PendingRecord record : pendingStore.loadAll()) {
            TransferId id = record.transfer().transferId();
            if (record.unacknowledged().isEmpty()) {
                pendingStore.delete(id);
                continue;
            }
            try {
                List<Frame> frames = ChunkCodec.fragment(record.payload(), record.transfer(), record.mtu());
                ledger.restoreOutbound(id, frames, record.unacknowledged(), record.attemptCount(),
                        record.failed(), record.createdAtMs());
                router.rememberOriginated(id);
                restored++;
            } catch (RuntimeException e) {
                LOG.warn("Dropping unrestorable pending transfer {}", id.shortId(), e);
                pendingStore.delete(id);
            }
        }
        if (restored > 0) {
            LOG.info("Restored {} pending outbound transfers", restored);
        }
    }

    private void persistProgress(RetryOutcome out) {
        for (TransferId id : out.retried()) {
            persistProgress(id);
        }
        for (TransferId id : out.abandoned()) {
            persistProgress(id);
        }
    }

    /** Mirrors the ledger entry of {@code transferId} into the pending table, deleting it once gone. */
    private void persistProgress(TransferId transferId) {
        if (pendingStore == null) {
            return;
        }
        try {
            Optional<PendingOutboundTransfer> transfer = ledger.find(transferId);
            if (transfer.isEmpty()) {
                pendingStore.delete(transferId);
                return;
            }
            PendingOutboundTransfer t = transfer.get();
            pendingStore.updateProgress(transferId, t.unacknowledged(), t.attemptCount(), t.isFailed());
        } catch (RuntimeException e) {
            LOG.warn("Failed to persist progress of transfer {}", transferId.shortId(), e);
        }
    }

    private void abandoned(TransferAbandonedException failure) {
        audit("transfer.abandoned", failure.transferId(), "failed", Map.of("attempts", failure.attempts()));
        listener.onAbandoned(failure);
    }

    private void auditRetries(RetryOutcome out, String trigger) {
        for (TransferId id : out.retried()) {
            int attempt = ledger.find(id).map(t -> t.attemptCount()).orElse(0);
            audit("transfer.retry", id, "ok", Map.of("trigger", trigger, "attempt", attempt));
        }
    }

    private void audit(String action, TransferId transferId, String result, Map<String, Object> details) {
        if (auditLogger != null) {
            auditLogger.log(AuditLogger.AuditEvent.of(action, transferId, result, details));
        }
    }

    private <T> CompletableFuture<T> submit(Supplier<T> task) {
        try {
            return CompletableFuture.supplyAsync(task, actor);
        } catch (RejectedExecutionException e) {
            return CompletableFuture.failedFuture(new IllegalStateException("Transfer runtime is closed", e));
        }
    }
}
