package io.syncvault.observability;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

final class AuditLoggerTest {

    @Test
    void rowsChainAndSurviveReopen() throws Exception {
        Path root = Files.createTempDirectory("syncvault-test-audit-chain-");
        try {
            Path file = root.resolve("audit").resolve("audit.log");
            AuditLogger logger = new AuditLogger(file, "ops", "s3cr3t");
            logger.log(AuditLogger.AuditEvent.of("sync.start", "sync-engine", "collection/users", "ok",
                    "run_1", Map.of("batch_size", 10)));
            logger.log(AuditLogger.AuditEvent.of("sync.complete", "sync-engine", "collection/users", "success",
                    "run_1", Map.of("written", 10)));

            AuditLogger reopened = new AuditLogger(file, "ops", "s3cr3t");
            Assertions.assertEquals(logger.currentHash(), reopened.currentHash());
            reopened.log(AuditLogger.AuditEvent.of("integrity.audit", null, "source/primary", "ok", null, Map.of()));

            List<JsonNode> rows = reopened.readAll();
            Assertions.assertEquals(3, rows.size());
            Assertions.assertEquals("", rows.get(0).path("prev_hash").asText());
            Assertions.assertEquals(rows.get(1).path("hash").asText(), rows.get(2).path("prev_hash").asText());
            Assertions.assertEquals("system", rows.get(2).path("actor").asText());
            Assertions.assertEquals("ops", rows.get(2).path("namespace").asText());
            Assertions.assertFalse(rows.get(0).path("signature").asText().isBlank());

            AuditLogger.ChainVerification verification = reopened.verifyChain();
            Assertions.assertTrue(verification.intact());
            Assertions.assertEquals(3, verification.rowsVerified());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedRowBreaksChain() throws Exception {
        Path root = Files.createTempDirectory("syncvault-test-audit-tamper-");
        try {
            Path file = root.resolve("audit.log");
            AuditLogger logger = new AuditLogger(file, "ops", "");
            for (int i = 0; i < 3; i++) {
                logger.log(AuditLogger.AuditEvent.of("sync.batch", "sync-engine", "collection/users", "ok",
                        "run_1", Map.of("batch_index", i)));
            }
            List<String> lines = new ArrayList<>(Files.readAllLines(file, StandardCharsets.UTF_8));
            lines.set(1, lines.get(1).replace("\"result\":\"ok\"", "\"result\":\"failed\""));
            Files.write(file, lines, StandardCharsets.UTF_8);

            AuditLogger.ChainVerification verification = logger.verifyChain();

            Assertions.assertFalse(verification.intact());
            Assertions.assertEquals(2, verification.brokenAtLine());
            Assertions.assertEquals(1, verification.rowsVerified());
            Assertions.assertEquals("row hash mismatch", verification.reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void wrongSigningSecretIsDetected() throws Exception {
        Path root = Files.createTempDirectory("syncvault-test-audit-signature-");
        try {
            Path file = root.resolve("audit.log");
            new AuditLogger(file, "ops", "first-secret").log(AuditLogger.AuditEvent.of(
                    "runtime.settings.load", "runtime", "settings", "ok", null, Map.of()));

            AuditLogger.ChainVerification verification = new AuditLogger(file, "ops", "other-secret").verifyChain();

            Assertions.assertFalse(verification.intact());
            Assertions.assertEquals("signature mismatch", verification.reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void detailsAreMaskedBeforeWriting() throws Exception {
        Path root = Files.createTempDirectory("syncvault-test-audit-mask-");
        try {
            AuditLogger logger = new AuditLogger(root.resolve("audit.log"), "ops", "");
            logger.log(AuditLogger.AuditEvent.of("reconcile.apply", "reconciler", "report/rpt_1", "converged", null,
                    Map.of("api_token", "abc", "target", "postgres://admin:hunter2@db:5432/app", "key", "rec-7")));

            JsonNode details = logger.readAll().get(0).path("details");
            Assertions.assertEquals("***", details.path("api_token").asText());
            Assertions.assertEquals("postgres://***@db:5432/app", details.path("target").asText());
            Assertions.assertEquals("rec-7", details.path("key").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void runIdsCarryKindPrefix() {
        String runId = RunIds.newRunId();

        Assertions.assertTrue(runId.matches("run_[0-9a-f]{24}"));
        Assertions.assertNotEquals(runId, RunIds.newRunId());
        Assertions.assertTrue(RunIds.newReportId().startsWith("rpt_"));
        Assertions.assertTrue(RunIds.newConflictId().startsWith("cfl_"));
    }

    private static void deleteRecursively(Path root) throws Exception {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path p : walk.sorted(Comparator.comparingInt(Path::getNameCount).reversed()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }
}
