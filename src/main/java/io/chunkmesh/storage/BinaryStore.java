package io.chunkmesh.storage;

/**
 * Storage collaborator for reassembled payloads. The engine keeps only the returned location.
 */
@FunctionalInterface
public interface BinaryStore {

    /**
     * @return a stable location string for the stored bytes
     * @throws java.io.UncheckedIOException when the bytes cannot be persisted
     */
    String store(byte[] bytes, String originalType);
}
