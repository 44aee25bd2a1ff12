package io.chunkmesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class ChunkMeshConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "chunkmesh-settings.json";

    private final Path rootDir;

    public ChunkMeshConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static ChunkMeshConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new ChunkMeshConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path receivedDir() {
        return rootDir.resolve("received");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path dbFile() {
        return rootDir.resolve("chunkmesh.db");
    }
}
