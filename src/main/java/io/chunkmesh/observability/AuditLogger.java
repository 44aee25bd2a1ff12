package io.chunkmesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.chunkmesh.util.Hashing;
import io.chunkmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only transfer lifecycle trail. Each line is a compact JSON row chained to its
 * predecessor through {@code prev_hash}/{@code hash}.
 */
public final class AuditLogger {
    private static final Logger LOG = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private final String node;
    private String previousHash;

    public AuditLogger(Path auditFile, String node) {
        this.auditFile = auditFile;
        this.node = node == null || node.isBlank() ? "local" : node.trim();
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException raced) {
                    LOG.debug("Audit log {} created concurrently", auditFile);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("node", node);
        row.put("action", event.action());
        row.put("transfer_id", event.transferId());
        row.put("result", event.result());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Recomputes every row hash and checks each row links to the one before it.
     */
    public synchronized boolean verifyChain() {
        String expectedPrev = "";
        try {
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line.isBlank()) {
                    continue;
                }
                JsonNode node = Jsons.mapper().readTree(line);
                if (!(node instanceof ObjectNode row)) {
                    return false;
                }
                String hash = row.path("hash").asText("");
                if (!expectedPrev.equals(row.path("prev_hash").asText(""))) {
                    return false;
                }
                row.remove("hash");
                if (!hash.equals(Hashing.sha256Hex(Jsons.toCompactJson(row)))) {
                    return false;
                }
                expectedPrev = hash;
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
        return true;
    }

    public List<String> readLines() {
        try {
            return Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        String last = "";
        try {
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            LOG.warn("Audit log {} has an unreadable tail, starting a new chain: {}", auditFile, e.getMessage());
            return "";
        }
    }

    public record AuditEvent(
            String action,
            String transferId,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, Object transferId, String result, Map<String, Object> details) {
            return new AuditEvent(
                    action,
                    transferId == null ? null : transferId.toString(),
                    result,
                    details == null ? Map.of() : details
            );
        }
    }
}
