package io.chunkmesh.config;

import io.chunkmesh.codec.FrameCodec;
import io.chunkmesh.ledger.RetryPolicy;
import io.chunkmesh.model.Transfer;
import io.chunkmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables of the transfer engine. Missing or out-of-range fields in the settings file fall back
 * to (or are clamped against) the defaults.
 */
public record EngineSettings(
        int mtu,
        int defaultTtl,
        int maxAttempts,
        long baseBackoffMs,
        long maxBackoffMs,
        long retryJitterMs,
        long retryTickMs,
        long seenWindowMs,
        int seenMaxEntries,
        int routeMaxEntries,
        int inboxCapacity,
        long reassemblyTimeoutMs,
        boolean chunkAcks
) {
    public static final int DEFAULT_MTU = 180;
    public static final int DEFAULT_TTL = 3;
    public static final int DEFAULT_MAX_ATTEMPTS = 5;
    public static final long DEFAULT_BASE_BACKOFF_MS = 2_000L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 600_000L;
    public static final long DEFAULT_RETRY_JITTER_MS = 250L;

    public static EngineSettings defaults() {
        return new EngineSettings(
                DEFAULT_MTU,
                DEFAULT_TTL,
                DEFAULT_MAX_ATTEMPTS,
                DEFAULT_BASE_BACKOFF_MS,
                DEFAULT_MAX_BACKOFF_MS,
                DEFAULT_RETRY_JITTER_MS,
                1_000L,
                1_500L,
                10_000,
                1_024,
                256,
                120_000L,
                false
        );
    }

    /**
     * Reads {@code settingsFile} when it exists, otherwise returns the defaults.
     */
    public static EngineSettings load(Path settingsFile) {
        EngineSettings defaults = defaults();
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults;
        }
        try {
            EngineSettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), EngineSettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + settingsFile, e);
        }
    }

    public static EngineSettings fromFile(EngineSettingsFile file, EngineSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int mtu = Math.min(FrameCodec.MAX_PAYLOAD_BYTES, sanitizeInt(file.mtu(), defaults.mtu(), 1));
        int defaultTtl = Math.min(Transfer.MAX_TTL, sanitizeInt(file.defaultTtl(), defaults.defaultTtl(), 0));
        int maxAttempts = sanitizeInt(file.maxAttempts(), defaults.maxAttempts(), 1);
        long baseBackoff = sanitizeLong(file.baseBackoffMs(), defaults.baseBackoffMs(), 1L);
        long maxBackoff = sanitizeLong(file.maxBackoffMs(), defaults.maxBackoffMs(), baseBackoff);
        if (maxBackoff < baseBackoff) {
            maxBackoff = baseBackoff;
        }
        long jitter = sanitizeLong(file.retryJitterMs(), defaults.retryJitterMs(), 0L);
        long tick = sanitizeLong(file.retryTickMs(), defaults.retryTickMs(), 10L);
        long seenWindow = sanitizeLong(file.seenWindowMs(), defaults.seenWindowMs(), 1L);
        int seenMax = sanitizeInt(file.seenMaxEntries(), defaults.seenMaxEntries(), 16);
        int routeMax = sanitizeInt(file.routeMaxEntries(), defaults.routeMaxEntries(), 16);
        int inboxCapacity = sanitizeInt(file.inboxCapacity(), defaults.inboxCapacity(), 1);
        long reassemblyTimeout = sanitizeLong(file.reassemblyTimeoutMs(), defaults.reassemblyTimeoutMs(), 1_000L);
        boolean chunkAcks = sanitizeBoolean(file.chunkAcks(), defaults.chunkAcks());
        return new EngineSettings(
                mtu,
                defaultTtl,
                maxAttempts,
                baseBackoff,
                maxBackoff,
                jitter,
                tick,
                seenWindow,
                seenMax,
                routeMax,
                inboxCapacity,
                reassemblyTimeout,
                chunkAcks
        );
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(maxAttempts, baseBackoffMs, maxBackoffMs, retryJitterMs);
    }

    public EngineSettings withMtu(int value) {
        return new EngineSettings(value, defaultTtl, maxAttempts, baseBackoffMs, maxBackoffMs, retryJitterMs,
                retryTickMs, seenWindowMs, seenMaxEntries, routeMaxEntries, inboxCapacity, reassemblyTimeoutMs, chunkAcks);
    }

    public EngineSettings withRetry(int attempts, long baseMs, long maxMs, long jitterMs) {
        return new EngineSettings(mtu, defaultTtl, attempts, baseMs, maxMs, jitterMs,
                retryTickMs, seenWindowMs, seenMaxEntries, routeMaxEntries, inboxCapacity, reassemblyTimeoutMs, chunkAcks);
    }

    public EngineSettings withRetryTickMs(long value) {
        return new EngineSettings(mtu, defaultTtl, maxAttempts, baseBackoffMs, maxBackoffMs, retryJitterMs,
                value, seenWindowMs, seenMaxEntries, routeMaxEntries, inboxCapacity, reassemblyTimeoutMs, chunkAcks);
    }

    public EngineSettings withInboxCapacity(int value) {
        return new EngineSettings(mtu, defaultTtl, maxAttempts, baseBackoffMs, maxBackoffMs, retryJitterMs,
                retryTickMs, seenWindowMs, seenMaxEntries, routeMaxEntries, value, reassemblyTimeoutMs, chunkAcks);
    }

    public EngineSettings withChunkAcks(boolean value) {
        return new EngineSettings(mtu, defaultTtl, maxAttempts, baseBackoffMs, maxBackoffMs, retryJitterMs,
                retryTickMs, seenWindowMs, seenMaxEntries, routeMaxEntries, inboxCapacity, reassemblyTimeoutMs, value);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static boolean sanitizeBoolean(Boolean raw, boolean fallback) {
        if (raw == null) {
            return fallback;
        }
        return raw;
    }

    public record EngineSettingsFile(
            Integer mtu,
            Integer defaultTtl,
            Integer maxAttempts,
            Long baseBackoffMs,
            Long maxBackoffMs,
            Long retryJitterMs,
            Long retryTickMs,
            Long seenWindowMs,
            Integer seenMaxEntries,
            Integer routeMaxEntries,
            Integer inboxCapacity,
            Long reassemblyTimeoutMs,
            Boolean chunkAcks
    ) {
    }
}
