package io.chunkmesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.chunkmesh.model.TransferId;
import io.chunkmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void rowsAreChainedAndVerifiable() throws Exception {
        Path root = Files.createTempDirectory("chunkmesh-test-audit-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger logger = new AuditLogger(file, "node-a");
            TransferId id = TransferId.random();
            logger.log(AuditLogger.AuditEvent.of("transfer.send", id, "ok", Map.of("chunks", 3)));
            logger.log(AuditLogger.AuditEvent.of("transfer.acknowledged", id, "ok", Map.of()));

            List<String> lines = logger.readLines();
            Assertions.assertEquals(2, lines.size());
            JsonNode first = Jsons.mapper().readTree(lines.get(0));
            JsonNode second = Jsons.mapper().readTree(lines.get(1));
            Assertions.assertEquals("node-a", first.path("node").asText());
            Assertions.assertEquals(id.toString(), first.path("transfer_id").asText());
            Assertions.assertEquals(3, first.path("details").path("chunks").asInt());
            Assertions.assertEquals("", first.path("prev_hash").asText());
            Assertions.assertEquals(first.path("hash").asText(), second.path("prev_hash").asText());
            Assertions.assertEquals(second.path("hash").asText(), logger.currentHash());
            Assertions.assertTrue(logger.verifyChain());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reopenedLoggerContinuesChain() throws Exception {
        Path root = Files.createTempDirectory("chunkmesh-test-audit-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger first = new AuditLogger(file, "node-a");
            first.log(AuditLogger.AuditEvent.of("transfer.send", null, "ok", Map.of()));
            String head = first.currentHash();

            AuditLogger reopened = new AuditLogger(file, "node-a");
            Assertions.assertEquals(head, reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("inbox.dismiss", TransferId.random(), "ok", Map.of()));
            Assertions.assertTrue(reopened.verifyChain());
            Assertions.assertEquals(2, reopened.readLines().size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksChain() throws Exception {
        Path root = Files.createTempDirectory("chunkmesh-test-audit-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger logger = new AuditLogger(file, "node-a");
            logger.log(AuditLogger.AuditEvent.of("transfer.send", TransferId.random(), "ok", Map.of()));
            logger.log(AuditLogger.AuditEvent.of("transfer.abandoned", TransferId.random(), "failed", Map.of()));

            String tampered = Files.readString(file, StandardCharsets.UTF_8).replace("\"failed\"", "\"ok\"");
            Files.writeString(file, tampered, StandardCharsets.UTF_8);
            Assertions.assertFalse(logger.verifyChain());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
