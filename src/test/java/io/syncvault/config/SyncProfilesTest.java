package io.syncvault.config;

import io.syncvault.TestRecords;
import io.syncvault.model.ConflictStrategy;
import io.syncvault.model.RecordFilter;
import io.syncvault.model.SyncMode;
import io.syncvault.model.SyncProfile;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

final class SyncProfilesTest {

    @Test
    void parsesEveryProfileKey() {
        SyncProfile profile = SyncProfiles.parse("""
                {
                  "name": "customers-nightly",
                  "sync_mode": "incremental",
                  "conflict_resolution": "newest_wins",
                  "batch_size": 250,
                  "delete_orphans": true,
                  "preserve_key": false,
                  "timestamp_field": "modified_at",
                  "key_field": "id",
                  "field_mappings": {"name": "full_name"},
                  "field_exclusions": ["ssn"],
                  "filter_query": {"status": "active"},
                  "checksum_exclusions": ["_user"]
                }
                """, "fallback");

        Assertions.assertEquals("customers-nightly", profile.name());
        Assertions.assertEquals(SyncMode.INCREMENTAL, profile.mode());
        Assertions.assertEquals(ConflictStrategy.NEWEST_WINS, profile.conflictStrategy());
        Assertions.assertEquals(250, profile.batchSize());
        Assertions.assertTrue(profile.deleteOrphans());
        Assertions.assertFalse(profile.effectiveDeleteOrphans());
        Assertions.assertFalse(profile.preserveKey());
        Assertions.assertEquals("modified_at", profile.timestampField());
        Assertions.assertEquals("id", profile.keyField());
        Assertions.assertEquals(Map.of("name", "full_name"), profile.fieldMappings());
        Assertions.assertEquals(Set.of("ssn"), profile.fieldExclusions());
        Assertions.assertEquals(Set.of("_user"), profile.checksumExclusions());
        Assertions.assertTrue(profile.filter().matches(TestRecords.record("a", "status", "active")));
        Assertions.assertFalse(profile.filter().matches(TestRecords.record("b", "status", "closed")));
    }

    @Test
    void minimalProfileTakesDefaults() {
        SyncProfile profile = SyncProfiles.parse("{\"sync_mode\":\"master-slave\"}", "mirror");

        Assertions.assertEquals("mirror", profile.name());
        Assertions.assertEquals(SyncMode.MASTER_SLAVE, profile.mode());
        Assertions.assertEquals(ConflictStrategy.SOURCE_WINS, profile.conflictStrategy());
        Assertions.assertEquals(SyncProfile.DEFAULT_BATCH_SIZE, profile.batchSize());
        Assertions.assertTrue(profile.preserveKey());
        Assertions.assertTrue(profile.effectiveDeleteOrphans());
        Assertions.assertEquals(SyncProfile.DEFAULT_KEY_FIELD, profile.keyField());
        Assertions.assertEquals(SyncProfile.DEFAULT_CHECKSUM_EXCLUSIONS, profile.checksumExclusions());
        Assertions.assertTrue(profile.filter().isEmpty());
    }

    @Test
    void rejectsInvalidProfiles() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> SyncProfiles.parse("{}", "x"));
        Assertions.assertThrows(IllegalArgumentException.class, () -> SyncProfiles.parse("{not json", "x"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> SyncProfiles.parse("{\"sync_mode\":\"bidirectional\"}", "x"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> SyncProfiles.parse("{\"sync_mode\":\"full_sync\",\"batch_size\":0}", "x"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> SyncProfiles.parse("{\"sync_mode\":\"full_sync\",\"conflict_resolution\":\"coin_flip\"}", "x"));
    }

    @Test
    void writtenProfilesLoadBackFromDirectory() throws Exception {
        Path root = Files.createTempDirectory("syncvault-test-profiles-");
        try {
            SyncProfile written = SyncProfile.of("b-orders", SyncMode.FULL)
                    .withDeleteOrphans(true)
                    .withBatchSize(40)
                    .withFieldMappings(Map.of("total", "amount"))
                    .withFilter(RecordFilter.eq("region", "eu"));
            SyncProfiles.write(written, root.resolve("b-orders.json"));
            Files.writeString(root.resolve("a-users.json"), "{\"sync_mode\":\"append_only\"}", StandardCharsets.UTF_8);
            Files.writeString(root.resolve("notes.txt"), "ignored", StandardCharsets.UTF_8);

            List<SyncProfile> loaded = SyncProfiles.loadAll(root);

            Assertions.assertEquals(List.of("a-users", "b-orders"), loaded.stream().map(SyncProfile::name).toList());
            Assertions.assertEquals(written, loaded.get(1));
            Assertions.assertTrue(loaded.get(1).filter().matches(TestRecords.record("o-1", "region", "eu")));
            Assertions.assertTrue(Files.readString(root.resolve("b-orders.json")).contains("\"region\""));
            Assertions.assertTrue(SyncProfiles.loadAll(root.resolve("absent")).isEmpty());
        } finally {
            deleteRecursively(root);
        }
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
