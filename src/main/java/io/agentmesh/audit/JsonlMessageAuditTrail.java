package io.agentmesh.audit;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentmesh.model.AgentMessage;
import io.agentmesh.util.Hashing;
import io.agentmesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class JsonlMessageAuditTrail implements MessageAuditTrail {
    private final Path journalFile;
    private String previousHash;

    public JsonlMessageAuditTrail(Path journalFile) {
        this.journalFile = journalFile;
        try {
            Files.createDirectories(journalFile.toAbsolutePath().getParent());
            if (!Files.exists(journalFile)) {
                try {
                    Files.createFile(journalFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Created concurrently between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new AuditException("Failed to initialize audit journal: " + journalFile, e);
        }
        this.previousHash = loadLastHash();
    }

    @Override
    public synchronized void record(AgentMessage message) {
        AuditRecord record = AuditRecord.of(message);
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("id", record.id());
        row.put("sender", record.sender());
        row.put("recipient", record.recipient());
        row.put("message_type", record.kind());
        row.put("payload", record.payload());
        row.put("priority", record.priority());
        row.put("timestamp", record.timestamp());
        row.put("correlation_id", record.correlationId());
        row.put("expires_at", record.expiresAt());
        row.put("processed", record.processed());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(journalFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new AuditException("Failed to append audit journal", e);
        }
    }

    @Override
    public synchronized List<AuditRecord> recent(int limit) {
        List<String> lines = readLines();
        int from = Math.max(0, lines.size() - Math.max(1, limit));
        List<AuditRecord> out = new ArrayList<>();
        for (String line : lines.subList(from, lines.size())) {
            out.add(toRecord(parse(line)));
        }
        return out;
    }

    /**
     * Recomputes the hash chain. Returns the number of verified rows, or throws on the first
     * broken link.
     */
    public synchronized int verifyChain() {
        String expectedPrev = "";
        int checked = 0;
        for (String line : readLines()) {
            JsonNode node = parse(line);
            String prev = node.path("prev_hash").asText("");
            if (!expectedPrev.equals(prev)) {
                throw new IllegalStateException("Audit chain broken at row " + (checked + 1));
            }
            Map<String, Object> row = new LinkedHashMap<>(Jsons.toMap(line));
            String hash = String.valueOf(row.remove("hash"));
            if (!Hashing.sha256Hex(Jsons.toCompactJson(row)).equals(hash)) {
                throw new IllegalStateException("Audit row hash mismatch at row " + (checked + 1));
            }
            expectedPrev = hash;
            checked++;
        }
        return checked;
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    private String loadLastHash() {
        List<String> lines = readLines();
        if (lines.isEmpty()) {
            return "";
        }
        return parse(lines.get(lines.size() - 1)).path("hash").asText("");
    }

    private List<String> readLines() {
        try {
            List<String> out = new ArrayList<>();
            for (String line : Files.readAllLines(journalFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(line);
                }
            }
            return out;
        } catch (IOException e) {
            throw new AuditException("Failed to read audit journal", e);
        }
    }

    private static JsonNode parse(String line) {
        try {
            return Jsons.mapper().readTree(line);
        } catch (IOException e) {
            throw new AuditException("Corrupt audit journal line", e);
        }
    }

    private static AuditRecord toRecord(JsonNode node) {
        return new AuditRecord(
                node.path("id").asText(),
                node.path("sender").asText(),
                node.path("recipient").asText(),
                node.path("message_type").asText(),
                node.path("payload").asText(),
                node.path("priority").asInt(),
                node.path("timestamp").asText(),
                node.path("correlation_id").isNull() ? null : node.path("correlation_id").asText(null),
                node.path("expires_at").isNull() ? null : node.path("expires_at").asText(null),
                node.path("processed").asBoolean(false)
        );
    }
}
