package io.syncvault.sync;

import io.syncvault.model.Record;
import io.syncvault.model.RecordFilter;
import io.syncvault.model.SyncMode;
import io.syncvault.model.SyncProfile;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Set;

import static io.syncvault.TestRecords.record;

final class RecordTransformerTest {

    @Test
    void untouchedProfileReturnsSameRecord() {
        Record input = record("rec-1", "name", "A");

        Assertions.assertSame(input, RecordTransformer.transform(input, SyncProfile.of("p", SyncMode.FULL)));
    }

    @Test
    void exclusionsDropFieldsAndMappingsRenameThem() {
        SyncProfile profile = SyncProfile.of("p", SyncMode.FULL)
                .withFieldExclusions(Set.of("secret"))
                .withFieldMappings(Map.of("name", "full_name"));

        Record out = RecordTransformer.transform(record("rec-1", "name", "A", "secret", "x", "age", 3), profile);

        Assertions.assertEquals("rec-1", out.key());
        Assertions.assertFalse(out.has("secret"));
        Assertions.assertFalse(out.has("name"));
        Assertions.assertEquals("A", out.get("full_name").asText());
        Assertions.assertEquals(3, out.get("age").asInt());
    }

    @Test
    void keyFieldIsNeverExcludedOrRenamed() {
        SyncProfile profile = SyncProfile.of("p", SyncMode.FULL)
                .withFieldExclusions(Set.of("_key"))
                .withFieldMappings(Map.of("_key", "id", "alias", "_key"));

        Record out = RecordTransformer.transform(record("rec-1", "alias", "other"), profile);

        Assertions.assertEquals("rec-1", out.key());
        Assertions.assertFalse(out.has("id"));
        Assertions.assertFalse(out.has("alias"));
    }

    @Test
    void renamedValueOverwritesExistingField() {
        SyncProfile profile = SyncProfile.of("p", SyncMode.FULL).withFieldMappings(Map.of("nick", "name"));

        Record out = RecordTransformer.transform(record("rec-1", "name", "old", "nick", "new"), profile);

        Assertions.assertEquals("new", out.get("name").asText());
        Assertions.assertFalse(out.has("nick"));
    }

    @Test
    void filterSelectsByFieldEquality() {
        SyncProfile profile = SyncProfile.of("p", SyncMode.FULL)
                .withFilter(RecordFilter.of(Map.of("status", "active", "tier", 2)));

        Assertions.assertTrue(RecordTransformer.selects(record("a", "status", "active", "tier", 2.0), profile));
        Assertions.assertFalse(RecordTransformer.selects(record("b", "status", "inactive", "tier", 2), profile));
        Assertions.assertFalse(RecordTransformer.selects(record("c", "status", "active"), profile));
    }
}
