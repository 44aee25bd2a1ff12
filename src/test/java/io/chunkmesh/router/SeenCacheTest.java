package io.chunkmesh.router;

import io.chunkmesh.model.FrameKind;
import io.chunkmesh.model.TransferId;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SeenCacheTest {

    @Test
    void keysAreSeenOnceWithinWindow() {
        SeenCache cache = new SeenCache(1_000L, 100);
        SeenCache.Key key = new SeenCache.Key(TransferId.random(), FrameKind.DATA, 3);

        Assertions.assertTrue(cache.markIfAbsent(key, 0L));
        Assertions.assertFalse(cache.markIfAbsent(key, 500L));
        Assertions.assertTrue(cache.contains(key, 999L));
        Assertions.assertFalse(cache.contains(key, 1_000L));
        Assertions.assertTrue(cache.markIfAbsent(key, 1_000L));
    }

    @Test
    void kindAndIndexDistinguishKeys() {
        SeenCache cache = new SeenCache(1_000L, 100);
        TransferId id = TransferId.random();
        Assertions.assertTrue(cache.markIfAbsent(new SeenCache.Key(id, FrameKind.DATA, 0), 0L));
        Assertions.assertTrue(cache.markIfAbsent(new SeenCache.Key(id, FrameKind.ACK, 0), 0L));
        Assertions.assertTrue(cache.markIfAbsent(new SeenCache.Key(id, FrameKind.DATA, 1), 0L));
        Assertions.assertTrue(cache.markIfAbsent(new SeenCache.Key(id, FrameKind.ACK, SeenCache.WHOLE_TRANSFER), 0L));
        Assertions.assertEquals(4, cache.size());
    }

    @Test
    void oldestEntriesAreEvictedBeyondBound() {
        SeenCache cache = new SeenCache(60_000L, 3);
        TransferId id = TransferId.random();
        for (int i = 0; i < 5; i++) {
            Assertions.assertTrue(cache.markIfAbsent(new SeenCache.Key(id, FrameKind.DATA, i), i));
        }
        Assertions.assertEquals(3, cache.size());
        Assertions.assertFalse(cache.contains(new SeenCache.Key(id, FrameKind.DATA, 0), 10L));
        Assertions.assertTrue(cache.contains(new SeenCache.Key(id, FrameKind.DATA, 4), 10L));
    }

    @Test
    void purgeDropsExpiredEntries() {
        SeenCache cache = new SeenCache(100L, 10);
        TransferId id = TransferId.random();
        cache.markIfAbsent(new SeenCache.Key(id, FrameKind.DATA, 0), 0L);
        cache.markIfAbsent(new SeenCache.Key(id, FrameKind.DATA, 1), 50L);
        Assertions.assertEquals(1, cache.purgeExpired(120L));
        Assertions.assertEquals(1, cache.size());
    }
}
