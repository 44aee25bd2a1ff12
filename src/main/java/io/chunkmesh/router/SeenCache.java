package io.chunkmesh.router;

import io.chunkmesh.model.FrameKind;
import io.chunkmesh.model.TransferId;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Recently-seen frame keys with a sliding expiry window and a hard size bound. Oldest entries
 * go first on either limit. Not thread-safe.
 */
public final class SeenCache {
    /** Index used for keys that cover a whole transfer rather than one chunk. */
    public static final int WHOLE_TRANSFER = -1;

    private final long windowMs;
    private final int maxEntries;
    private final LinkedHashMap<Key, Long> seenAtMs;

    public SeenCache(long windowMs, int maxEntries) {
        if (windowMs <= 0L) {
            throw new IllegalArgumentException("windowMs must be positive: " + windowMs);
        }
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be >= 1: " + maxEntries);
        }
        this.windowMs = windowMs;
        this.maxEntries = maxEntries;
        this.seenAtMs = new LinkedHashMap<>();
    }

    /**
     * Records {@code key} as seen at {@code nowMs}. Returns false when it was already seen within
     * the window, in which case the original timestamp is kept.
     */
    public boolean markIfAbsent(Key key, long nowMs) {
        purgeExpired(nowMs);
        if (seenAtMs.containsKey(key)) {
            return false;
        }
        seenAtMs.put(key, nowMs);
        while (seenAtMs.size() > maxEntries) {
            Iterator<Key> it = seenAtMs.keySet().iterator();
            it.next();
            it.remove();
        }
        return true;
    }

    public boolean contains(Key key, long nowMs) {
        Long at = seenAtMs.get(key);
        return at != null && nowMs - at < windowMs;
    }

    public int purgeExpired(long nowMs) {
        int removed = 0;
        Iterator<Map.Entry<Key, Long>> it = seenAtMs.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Key, Long> entry = it.next();
            if (nowMs - entry.getValue() < windowMs) {
                break;
            }
            it.remove();
            removed++;
        }
        return removed;
    }

    public int size() {
        return seenAtMs.size();
    }

    public record Key(TransferId transferId, FrameKind kind, int sequenceIndex) {
    }
}
