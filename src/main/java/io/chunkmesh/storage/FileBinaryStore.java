package io.chunkmesh.storage;

import io.chunkmesh.util.Hashing;
import io.chunkmesh.util.Jsons;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Content-addressed file store: {@code <sha256>.bin} holds the bytes, {@code <sha256>.json} a
 * small metadata sidecar. Storing identical content twice yields the same location.
 */
public final class FileBinaryStore implements BinaryStore {
    private final Path dir;

    public FileBinaryStore(Path dir) {
        this.dir = dir;
    }

    @Override
    public String store(byte[] bytes, String originalType) {
        String type = originalType == null ? "" : originalType;
        String name = Hashing.sha256Hex(bytes, type.getBytes(StandardCharsets.UTF_8));
        Path binPath = dir.resolve(name + ".bin");
        Path metaPath = dir.resolve(name + ".json");
        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("original_type", type);
        meta.put("size", bytes.length);
        meta.put("stored_at", Instant.now().toString());
        try {
            Files.createDirectories(dir);
            Files.write(binPath, bytes);
            Files.writeString(metaPath, Jsons.toJson(meta), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to store received payload " + name, e);
        }
        return binPath.toAbsolutePath().toString();
    }

    /**
     * Removes stored payloads (and their sidecars) last modified before {@code maxAge} ago.
     * Returns the number of payloads removed.
     */
    public int cleanupStale(Duration maxAge) {
        if (!Files.isDirectory(dir)) {
            return 0;
        }
        Instant cutoff = Instant.now().minus(maxAge);
        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*.bin")) {
            for (Path bin : stream) {
                if (Files.getLastModifiedTime(bin).toInstant().isBefore(cutoff)) {
                    String fileName = bin.getFileName().toString();
                    Files.deleteIfExists(bin);
                    Files.deleteIfExists(dir.resolve(fileName.substring(0, fileName.length() - 4) + ".json"));
                    removed++;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to clean up received payloads in " + dir, e);
        }
        return removed;
    }

    public Path dir() {
        return dir;
    }
}
