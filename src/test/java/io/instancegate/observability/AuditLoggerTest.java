package io.instancegate.observability;

import com.fasterxml.jackson.databind.JsonNode;
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
    void chainVerifiesAndSurvivesReopen() throws Exception {
        Path root = Files.createTempDirectory("instancegate-test-audit-chain-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger logger = new AuditLogger(file, "secret-a");
            logger.log(AuditLogger.AuditEvent.of("operator.register", "op", "inst", "ok", Map.of("version", 1)));
            logger.log(AuditLogger.AuditEvent.of("owner.register", "own", "inst", "unauthorized",
                    Map.of("error", "Invalid owner token", "owner_token", "deadbeef")));
            String head = logger.currentHash();

            AuditLogger reopened = new AuditLogger(file, "secret-a");
            Assertions.assertEquals(head, reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("workload.configure", "owner", "inst", "ok", null));

            AuditLogger.VerifyOutcome outcome = reopened.verify();
            Assertions.assertTrue(outcome.valid(), outcome.reason());
            Assertions.assertEquals(3, outcome.rows());

            List<JsonNode> tail = reopened.tail(2);
            Assertions.assertEquals(2, tail.size());
            Assertions.assertEquals("***", tail.get(0).path("details").path("owner_token").asText());
            Assertions.assertEquals(head, tail.get(1).path("prev_hash").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tamperingIsDetected() throws Exception {
        Path root = Files.createTempDirectory("instancegate-test-audit-tamper-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger logger = new AuditLogger(file, "secret-a");
            logger.log(AuditLogger.AuditEvent.of("operator.register", "op", "inst", "ok", Map.of()));
            logger.log(AuditLogger.AuditEvent.of("owner.register", "own", "inst", "ok", Map.of()));

            String original = Files.readString(file, StandardCharsets.UTF_8);
            Files.writeString(file, original.replaceFirst("\"actor\":\"own\"", "\"actor\":\"eve\""), StandardCharsets.UTF_8);
            AuditLogger.VerifyOutcome edited = new AuditLogger(file, "secret-a").verify();
            Assertions.assertFalse(edited.valid());
            Assertions.assertEquals(2, edited.firstBrokenLine());

            Files.writeString(file, original, StandardCharsets.UTF_8);
            Assertions.assertFalse(new AuditLogger(file, "secret-b").verify().valid());
            Assertions.assertTrue(new AuditLogger(file, "secret-a").verify().valid());
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
