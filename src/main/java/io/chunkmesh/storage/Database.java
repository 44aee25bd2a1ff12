package io.chunkmesh.storage;

import io.chunkmesh.config.ChunkMeshConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public final class Database {
    private final ChunkMeshConfig config;
    private final String jdbcUrl;

    public Database(ChunkMeshConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        try {
            Files.createDirectories(config.rootDir());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("""
                    CREATE TABLE IF NOT EXISTS delivered_transfers (
                        transfer_id TEXT PRIMARY KEY,
                        original_type TEXT NOT NULL,
                        size INTEGER NOT NULL,
                        delivered_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_delivered_at ON delivered_transfers(delivered_at_ms)");
            st.execute("""
                    CREATE TABLE IF NOT EXISTS pending_transfers (
                        transfer_id TEXT PRIMARY KEY,
                        original_type TEXT NOT NULL,
                        total_size INTEGER NOT NULL,
                        ttl INTEGER NOT NULL,
                        recipient TEXT,
                        mtu INTEGER NOT NULL,
                        payload BLOB NOT NULL,
                        unacknowledged_json TEXT NOT NULL,
                        attempt_count INTEGER NOT NULL,
                        status TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize schema", e);
        }
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }
}
