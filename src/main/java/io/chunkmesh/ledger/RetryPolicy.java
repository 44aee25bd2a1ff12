package io.chunkmesh.ledger;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Attempt ceiling and capped exponential backoff for outbound transfers.
 */
public record RetryPolicy(int maxAttempts, long baseBackoffMs, long maxBackoffMs, long jitterMs) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
        }
        baseBackoffMs = Math.max(1L, baseBackoffMs);
        maxBackoffMs = Math.max(baseBackoffMs, maxBackoffMs);
        jitterMs = Math.max(0L, jitterMs);
    }

    public long computeBackoffMs(int attempt) {
        long backoff = baseBackoffMs;
        for (int i = 1; i < attempt; i++) {
            if (backoff >= maxBackoffMs / 2L) {
                backoff = maxBackoffMs;
                break;
            }
            backoff *= 2L;
        }
        backoff = Math.min(backoff, maxBackoffMs);
        if (jitterMs == 0L) {
            return backoff;
        }
        long jitter = ThreadLocalRandom.current().nextLong(0L, jitterMs + 1L);
        return Math.min(maxBackoffMs, backoff + jitter);
    }
}
