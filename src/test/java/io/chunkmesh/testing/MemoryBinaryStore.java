package io.chunkmesh.testing;

import io.chunkmesh.storage.BinaryStore;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

public final class MemoryBinaryStore implements BinaryStore {
    private final Map<String, byte[]> stored = new LinkedHashMap<>();
    private int failuresLeft;

    public void failNext(int count) {
        failuresLeft = count;
    }

    @Override
    public String store(byte[] bytes, String originalType) {
        if (failuresLeft > 0) {
            failuresLeft--;
            throw new UncheckedIOException("Failed to store payload", new IOException("disk full"));
        }
        String location = "mem://" + stored.size();
        stored.put(location, bytes.clone());
        return location;
    }

    public byte[] read(String location) {
        return stored.get(location);
    }

    public int count() {
        return stored.size();
    }
}
