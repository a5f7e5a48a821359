package io.agentfarm.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.agentfarm.util.Hashing;
import io.agentfarm.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

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

/**
 * Append-only JSONL trail of farm mutations. Each row carries the hash of the previous row,
 * so a truncated or edited file is detectable with {@link #verify()}.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private final String project;
    private String previousHash;

    public AuditLogger(Path auditFile, String project) {
        this.auditFile = auditFile;
        this.project = project == null || project.isBlank() ? "default" : project.trim();
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
        row.put("project", project);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
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

    /**
     * Records {@code event}, downgrading a write failure to a warning. Used after the
     * audited change already happened and must not be reported as failed.
     */
    public void logQuietly(AuditEvent event) {
        try {
            log(event);
        } catch (RuntimeException e) {
            log.warn("Audit write failed for {} {}: {}", event.action(), event.resource(), e.getMessage());
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path auditFile() {
        return auditFile;
    }

    /**
     * Re-computes the chain from the first row.
     */
    public VerifyResult verify() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
        String expectedPrev = "";
        int rows = 0;
        List<Integer> broken = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            rows++;
            try {
                @SuppressWarnings("unchecked")
                Map<String, Object> row = Jsons.mapper().readValue(line, LinkedHashMap.class);
                Object hash = row.remove("hash");
                String recomputed = Hashing.sha256Hex(Jsons.toCompactJson(row));
                if (!expectedPrev.equals(row.get("prev_hash")) || !recomputed.equals(hash)) {
                    broken.add(i + 1);
                }
                expectedPrev = hash == null ? "" : hash.toString();
            } catch (IOException e) {
                broken.add(i + 1);
            }
        }
        return new VerifyResult(rows, broken.isEmpty(), broken);
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.mapper().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            log.warn("Audit log {} unreadable, starting a new chain: {}", auditFile, e.getMessage());
            return "";
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, "af", resource, result, details == null ? Map.of() : details);
        }

        /**
         * Alternating keys and values. Unlike {@link Map#of} a null value is kept as JSON null.
         */
        public static Map<String, Object> details(Object... keyValues) {
            if (keyValues.length % 2 != 0) {
                throw new IllegalArgumentException("details needs key/value pairs");
            }
            Map<String, Object> out = new LinkedHashMap<>();
            for (int i = 0; i < keyValues.length; i += 2) {
                out.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
            }
            return out;
        }
    }

    public record VerifyResult(int rows, boolean valid, List<Integer> brokenLines) {
    }
}
