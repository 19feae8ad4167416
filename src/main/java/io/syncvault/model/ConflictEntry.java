package io.syncvault.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;

/**
 * A divergent record pair deferred for manual review. The destination record stays untouched
 * until the entry is resolved out of band.
 */
public record ConflictEntry(
        String key,
        String collection,
        String destination,
        ObjectNode sourceRecord,
        ObjectNode destinationRecord,
        Instant detectedAt
) {
    public static ConflictEntry of(String collection, String destination, Record source, Record target) {
        return new ConflictEntry(
                source.key(),
                collection,
                destination,
                source.fields(),
                target.fields(),
                Instant.now()
        );
    }
}
