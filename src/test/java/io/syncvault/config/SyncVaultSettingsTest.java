package io.syncvault.config;

import io.syncvault.model.SyncProfile;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Stream;

final class SyncVaultSettingsTest {

    @Test
    void missingFileGivesDefaults() throws Exception {
        Path root = Files.createTempDirectory("syncvault-test-settings-default-");
        try {
            SyncVaultSettings settings = SyncVaultSettings.load(root.resolve("syncvault-settings.json"));

            Assertions.assertEquals(SyncVaultSettings.defaults(), settings);
            Assertions.assertEquals(SyncVaultConfig.DEFAULT_DESTINATION_PARALLELISM, settings.destinationParallelism());
            Assertions.assertEquals(SyncProfile.DEFAULT_BATCH_SIZE, settings.defaultBatchSize());
            Assertions.assertTrue(settings.auditSigning());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void fileValuesAreSanitized() throws Exception {
        Path root = Files.createTempDirectory("syncvault-test-settings-file-");
        try {
            Path file = root.resolve("syncvault-settings.json");
            Files.writeString(file, """
                    {
                      "destination_parallelism": 0,
                      "default_batch_size": 200,
                      "parity_block_count": 100000,
                      "checksum_exclusions": ["_etag", " ", "_user "],
                      "audit_signing": false,
                      "unknown_key": 1
                    }
                    """, StandardCharsets.UTF_8);

            SyncVaultSettings settings = SyncVaultSettings.load(file);

            Assertions.assertEquals(1, settings.destinationParallelism());
            Assertions.assertEquals(200, settings.defaultBatchSize());
            Assertions.assertEquals(SyncVaultConfig.MAX_PARITY_BLOCK_COUNT, settings.parityBlockCount());
            Assertions.assertEquals(Set.of("_etag", "_user"), settings.checksumExclusions());
            Assertions.assertFalse(settings.auditSigning());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void partialFileKeepsOtherDefaults() {
        SyncVaultSettings settings = SyncVaultSettings.fromFile(
                new SyncVaultSettings.SettingsFile(8, null, null, null, null),
                SyncVaultSettings.defaults()
        );

        Assertions.assertEquals(8, settings.destinationParallelism());
        Assertions.assertEquals(SyncVaultConfig.DEFAULT_PARITY_BLOCK_COUNT, settings.parityBlockCount());
        Assertions.assertEquals(SyncProfile.DEFAULT_CHECKSUM_EXCLUSIONS, settings.checksumExclusions());
    }

    @Test
    void namespacesGetTheirOwnRoot() {
        SyncVaultConfig base = SyncVaultConfig.fromRoot("/tmp/vault");
        SyncVaultConfig scoped = SyncVaultConfig.fromRoot("/tmp/vault", "Team A/B");

        Assertions.assertEquals(base.rootDir(), base.rootBaseDir());
        Assertions.assertEquals("team-a-b", scoped.namespace());
        Assertions.assertEquals(base.rootDir().resolve("namespaces").resolve("team-a-b"), scoped.rootDir());
        Assertions.assertEquals(scoped.rootDir().resolve("audit").resolve("audit.log"), scoped.auditFile());
        Assertions.assertEquals("default", SyncVaultConfig.fromRoot("/tmp/vault", "  ").namespace());
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
