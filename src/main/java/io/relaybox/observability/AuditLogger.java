package io.relaybox.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.relaybox.security.SensitiveDataMasker;
import io.relaybox.util.Hashing;
import io.relaybox.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines audit trail. Each row carries the hash of the previous row, and an
 * HMAC of its own hash when a signing secret is configured, so truncation or edits show up
 * when the chain is re-verified.
 */
public final class AuditLogger implements AuditSink {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private final String signingSecret;
    private final Clock clock;
    private String previousHash;

    public AuditLogger(Path auditFile, String signingSecret, Clock clock) {
        this.auditFile = auditFile;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        this.clock = clock;
        try {
            Path parent = auditFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException e) {
                    log.debug("Audit file {} appeared concurrently", auditFile);
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    @Override
    public synchronized void record(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.ofEpochMilli(clock.millis()).toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", SensitiveDataMasker.masked(event.details()));
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

    /**
     * Recomputes the chain from the first row. Returns the number of rows verified, or throws
     * if a row's hash, link or signature does not match.
     */
    public synchronized int verifyChain() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
        String expectedPrev = "";
        int rows = 0;
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            Map<String, Object> row = parseRow(line);
            String hash = String.valueOf(row.remove("hash"));
            Object signature = row.remove("signature");
            if (!expectedPrev.equals(String.valueOf(row.get("prev_hash")))) {
                throw new IllegalStateException("audit chain broken at row " + (rows + 1));
            }
            if (!Hashing.sha256Hex(Jsons.toCompactJson(row)).equals(hash)) {
                throw new IllegalStateException("audit row " + (rows + 1) + " was modified");
            }
            if (!signingSecret.isBlank()
                    && !Hashing.constantTimeEquals(Hashing.hmacSha256Hex(signingSecret, hash), String.valueOf(signature))) {
                throw new IllegalStateException("audit row " + (rows + 1) + " has an invalid signature");
            }
            expectedPrev = hash;
            rows++;
        }
        return rows;
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
            log.warn("Audit file {} has an unreadable tail; starting a new chain", auditFile);
            return "";
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> parseRow(String line) {
        try {
            return Jsons.mapper().readValue(line, LinkedHashMap.class);
        } catch (IOException e) {
            throw new IllegalStateException("audit row is not valid JSON", e);
        }
    }
}
