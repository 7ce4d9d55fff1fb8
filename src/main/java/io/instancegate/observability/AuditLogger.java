package io.instancegate.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.instancegate.security.SensitiveDataMasker;
import io.instancegate.util.Hashing;
import io.instancegate.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class AuditLogger {
    private final Path auditFile;
    private final String signingSecret;
    private String previousHash;

    public AuditLogger(Path auditFile, String signingSecret) {
        this.auditFile = auditFile;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
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
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", sanitizeDetails(event.details()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
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

    public synchronized List<JsonNode> tail(int limit) {
        List<JsonNode> rows = readRows();
        int from = Math.max(0, rows.size() - Math.max(1, limit));
        return new ArrayList<>(rows.subList(from, rows.size()));
    }

    public synchronized VerifyOutcome verify() {
        List<JsonNode> rows = readRows();
        String expectedPrev = "";
        for (int i = 0; i < rows.size(); i++) {
            JsonNode row = rows.get(i);
            String hash = row.path("hash").asText("");
            String prev = row.path("prev_hash").asText("");
            if (!expectedPrev.equals(prev)) {
                return new VerifyOutcome(false, rows.size(), i + 1, "prev_hash mismatch");
            }
            ObjectNode body = row.deepCopy();
            body.remove("hash");
            body.remove("signature");
            String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(body));
            if (!recomputed.equals(hash)) {
                return new VerifyOutcome(false, rows.size(), i + 1, "hash mismatch");
            }
            if (!signingSecret.isBlank()) {
                String signature = row.path("signature").asText("");
                if (!Hashing.constantTimeEquals(Hashing.hmacSha256Hex(signingSecret, hash), signature)) {
                    return new VerifyOutcome(false, rows.size(), i + 1, "signature mismatch");
                }
            }
            expectedPrev = hash;
        }
        return new VerifyOutcome(true, rows.size(), 0, "ok");
    }

    private List<JsonNode> readRows() {
        List<JsonNode> rows = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line == null || line.isBlank()) {
                    continue;
                }
                rows.add(Jsons.compactMapper().readTree(line));
            }
            return rows;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        List<JsonNode> rows = readRows();
        if (rows.isEmpty()) {
            return "";
        }
        return rows.get(rows.size() - 1).path("hash").asText("");
    }

    private Map<String, Object> sanitizeDetails(Map<String, Object> input) {
        if (input == null || input.isEmpty()) {
            return Map.of();
        }
        JsonNode node = Jsons.mapper().valueToTree(input);
        JsonNode masked = SensitiveDataMasker.masked(node);
        Map<String, Object> out = new LinkedHashMap<>();
        masked.fields().forEachRemaining(e -> out.put(e.getKey(), e.getValue()));
        return out;
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, details == null ? Map.of() : details);
        }
    }

    public record VerifyOutcome(boolean valid, int rows, int firstBrokenLine, String reason) {
    }
}
