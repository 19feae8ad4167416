package io.syncvault.observability;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.syncvault.security.SensitiveDataMasker;
import io.syncvault.util.Hashing;
import io.syncvault.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines event log. Every row carries the hash of the previous row, so editing or
 * removing a line breaks the chain from that point on; {@link #verifyChain()} finds the break.
 * Rows are additionally HMAC-signed when a signing secret is configured.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String namespace;
    private final String signingSecret;
    private String lastHash;

    public AuditLogger(Path auditFile, String namespace, String signingSecret) {
        this.auditFile = auditFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        try {
            if (auditFile.getParent() != null) {
                Files.createDirectories(auditFile.getParent());
            }
            // CREATE + APPEND of nothing: creates the file when absent, never truncates.
            Files.write(auditFile, new byte[0], StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        List<String> existing = rows();
        this.lastHash = existing.isEmpty() ? "" : parse(existing.get(existing.size() - 1)).path("hash").asText("");
    }

    public Path auditFile() {
        return auditFile;
    }

    public synchronized void log(AuditEvent event) {
        ObjectNode row = Jsons.mapper().createObjectNode();
        row.put("timestamp", Instant.now().toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("run_id", event.runId());
        row.set("details", SensitiveDataMasker.masked(Jsons.mapper().valueToTree(event.details())));
        row.put("prev_hash", lastHash);
        String hash = hashOf(row);
        row.put("hash", hash);
        if (!signingSecret.isEmpty()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, hash));
        }
        try {
            Files.writeString(auditFile, Jsons.toCompactJson(row) + System.lineSeparator(), StandardCharsets.UTF_8,
                    StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
        lastHash = hash;
    }

    public synchronized String currentHash() {
        return lastHash;
    }

    public synchronized List<JsonNode> readAll() {
        List<JsonNode> out = new ArrayList<>();
        for (String line : rows()) {
            out.add(parse(line));
        }
        return out;
    }

    /**
     * Recomputes every row hash and link. Line numbers are 1-based and count blank lines.
     */
    public synchronized ChainVerification verifyChain() {
        List<String> lines = readLines();
        String expectedPrev = "";
        int verified = 0;
        for (int i = 0; i < lines.size(); i++) {
            if (lines.get(i).isBlank()) {
                continue;
            }
            int lineNo = i + 1;
            JsonNode parsed;
            try {
                parsed = Jsons.mapper().readTree(lines.get(i));
            } catch (IOException e) {
                return ChainVerification.broken(verified, lineNo, "unparseable row");
            }
            if (!parsed.isObject()) {
                return ChainVerification.broken(verified, lineNo, "unparseable row");
            }
            ObjectNode row = (ObjectNode) parsed;
            if (!expectedPrev.equals(row.path("prev_hash").asText(""))) {
                return ChainVerification.broken(verified, lineNo, "prev_hash does not link to previous row");
            }
            String hash = row.path("hash").asText("");
            String signature = row.path("signature").asText("");
            row.remove("hash");
            row.remove("signature");
            if (!hashOf(row).equals(hash)) {
                return ChainVerification.broken(verified, lineNo, "row hash mismatch");
            }
            if (!signingSecret.isEmpty() && !Hashing.hmacSha256Hex(signingSecret, hash).equals(signature)) {
                return ChainVerification.broken(verified, lineNo, "signature mismatch");
            }
            expectedPrev = hash;
            verified++;
        }
        return new ChainVerification(true, verified, 0, "");
    }

    private static String hashOf(ObjectNode rowWithoutHash) {
        return Hashing.sha256Hex(Jsons.toCompactJson(rowWithoutHash));
    }

    private List<String> readLines() {
        try {
            return Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private List<String> rows() {
        List<String> out = new ArrayList<>();
        for (String line : readLines()) {
            if (!line.isBlank()) {
                out.add(line);
            }
        }
        return out;
    }

    private JsonNode parse(String line) {
        try {
            return Jsons.mapper().readTree(line);
        } catch (IOException e) {
            throw new RuntimeException("Failed to parse audit row in " + auditFile, e);
        }
    }

    public record ChainVerification(boolean intact, int rowsVerified, int brokenAtLine, String reason) {
        static ChainVerification broken(int rowsVerified, int line, String reason) {
            return new ChainVerification(false, rowsVerified, line, reason);
        }
    }

    /**
     * One audited action. {@code resource} names what was acted on, e.g. {@code replica/orders}.
     */
    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String runId,
            Map<String, Object> details
    ) {
        public AuditEvent {
            actor = actor == null || actor.isBlank() ? "system" : actor.trim();
            details = details == null ? Map.of() : details;
        }

        public static AuditEvent of(
                String action,
                String actor,
                String resource,
                String result,
                String runId,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, actor, resource, result, runId, details);
        }
    }
}
