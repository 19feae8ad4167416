package io.syncvault.integrity;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.syncvault.model.Record;
import io.syncvault.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static io.syncvault.TestRecords.record;

final class RecordChecksumsTest {

    @Test
    void fieldInsertionOrderDoesNotChangeChecksum() {
        Record first = record("rec-1", "name", "A", "status", "active", "count", 3);
        Record second = record("rec-1", "count", 3, "status", "active", "name", "A");

        Assertions.assertEquals(RecordChecksums.checksum(first), RecordChecksums.checksum(second));
    }

    @Test
    void nestedObjectsAreOrderIndependentToo() {
        Map<String, Object> innerA = new LinkedHashMap<>();
        innerA.put("city", "NYC");
        innerA.put("zip", "10001");
        Map<String, Object> innerB = new LinkedHashMap<>();
        innerB.put("zip", "10001");
        innerB.put("city", "NYC");

        Assertions.assertEquals(
                RecordChecksums.checksum(record("rec-1", "address", innerA)),
                RecordChecksums.checksum(record("rec-1", "address", innerB))
        );
    }

    @Test
    void anyNonExcludedFieldChangeChangesChecksum() {
        Record base = record("rec-1", "name", "A", "tags", List.of("x", "y"));

        Assertions.assertNotEquals(RecordChecksums.checksum(base),
                RecordChecksums.checksum(record("rec-1", "name", "B", "tags", List.of("x", "y"))));
        Assertions.assertNotEquals(RecordChecksums.checksum(base),
                RecordChecksums.checksum(record("rec-1", "name", "A", "tags", List.of("y", "x"))));
        Assertions.assertNotEquals(RecordChecksums.checksum(base),
                RecordChecksums.checksum(record("rec-2", "name", "A", "tags", List.of("x", "y"))));
        Assertions.assertNotEquals(RecordChecksums.checksum(record("rec-1", "v", "1")),
                RecordChecksums.checksum(record("rec-1", "v", 1)));
    }

    @Test
    void defaultExclusionsIgnoreBookkeepingFields() {
        Record left = record("rec-1", "name", "A", "_user", "alice", "_batchID", "b-1");
        Record right = record("rec-1", "name", "A", "_user", "bob", "_raw", "raw text");

        Assertions.assertEquals(RecordChecksums.checksum(left), RecordChecksums.checksum(right));
        Assertions.assertFalse(RecordChecksums.sameContent(left, right, Set.of()));
        Assertions.assertTrue(RecordChecksums.sameContent(left, right, Set.of("_user", "_raw", "_batchID")));
    }

    @Test
    void nullAndAbsentFieldsAgreeAndNumbersAreNormalized() {
        Map<String, Object> withNull = new LinkedHashMap<>();
        withNull.put("_key", "rec-1");
        withNull.put("note", null);
        withNull.put("amount", 1.50);

        Assertions.assertEquals(
                RecordChecksums.checksum(Record.fromMap(withNull)),
                RecordChecksums.checksum(record("rec-1", "amount", 1.5))
        );
        Assertions.assertEquals(
                RecordChecksums.checksum(record("rec-1", "amount", 2)),
                RecordChecksums.checksum(record("rec-1", "amount", 2.0))
        );
    }

    @Test
    void checksumIsLowercaseSha256Hex() {
        String checksum = RecordChecksums.checksum(record("rec-1", "name", "A"));

        Assertions.assertEquals(RecordChecksums.HEX_LENGTH, checksum.length());
        Assertions.assertTrue(checksum.matches("[0-9a-f]{64}"));
        Assertions.assertEquals("{\"_key\":\"rec-1\",\"name\":\"A\"}",
                RecordChecksums.canonicalJson(record("rec-1", "name", "A"), Set.of()));
    }

    @Test
    void unsupportedValueKindsAreRejected() {
        ObjectNode fields = Jsons.mapper().createObjectNode();
        fields.put("_key", "rec-1");
        fields.put("blob", new byte[]{1, 2, 3});

        Assertions.assertThrows(IllegalArgumentException.class, () -> Record.of(fields));
    }
}
