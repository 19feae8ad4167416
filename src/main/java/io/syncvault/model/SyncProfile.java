package io.syncvault.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable configuration of one sync run.
 *
 * <p>{@code checksumExclusions} lists bookkeeping fields ignored when fingerprinting records;
 * {@code fieldExclusions} lists fields dropped from records before they are written.
 */
public record SyncProfile(
        String name,
        SyncMode mode,
        ConflictStrategy conflictStrategy,
        int batchSize,
        boolean deleteOrphans,
        boolean preserveKey,
        String timestampField,
        String keyField,
        Map<String, String> fieldMappings,
        Set<String> fieldExclusions,
        RecordFilter filter,
        Set<String> checksumExclusions
) {
    public static final int DEFAULT_BATCH_SIZE = 1000;
    public static final String DEFAULT_TIMESTAMP_FIELD = "_updated";
    public static final String DEFAULT_KEY_FIELD = "_key";
    public static final Set<String> DEFAULT_CHECKSUM_EXCLUSIONS = Set.of("_user", "_raw", "_batchID");

    public SyncProfile {
        if (name == null || name.isBlank()) {
            name = "default";
        }
        if (mode == null) {
            throw new IllegalArgumentException("mode must not be null");
        }
        conflictStrategy = conflictStrategy == null ? ConflictStrategy.SOURCE_WINS : conflictStrategy;
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, was " + batchSize);
        }
        timestampField = timestampField == null || timestampField.isBlank()
                ? DEFAULT_TIMESTAMP_FIELD
                : timestampField.trim();
        keyField = keyField == null || keyField.isBlank() ? DEFAULT_KEY_FIELD : keyField.trim();
        fieldMappings = fieldMappings == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fieldMappings));
        fieldExclusions = fieldExclusions == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(fieldExclusions));
        filter = filter == null ? RecordFilter.all() : filter;
        checksumExclusions = checksumExclusions == null
                ? DEFAULT_CHECKSUM_EXCLUSIONS
                : Collections.unmodifiableSet(new LinkedHashSet<>(checksumExclusions));
    }

    public static SyncProfile of(String name, SyncMode mode) {
        return new SyncProfile(
                name,
                mode,
                ConflictStrategy.SOURCE_WINS,
                DEFAULT_BATCH_SIZE,
                false,
                true,
                DEFAULT_TIMESTAMP_FIELD,
                DEFAULT_KEY_FIELD,
                Map.of(),
                Set.of(),
                RecordFilter.all(),
                DEFAULT_CHECKSUM_EXCLUSIONS
        );
    }

    /**
     * Master/slave runs always remove destination-only records.
     */
    public boolean effectiveDeleteOrphans() {
        return mode == SyncMode.MASTER_SLAVE || (mode == SyncMode.FULL && deleteOrphans);
    }

    public SyncProfile withConflictStrategy(ConflictStrategy value) {
        return new SyncProfile(name, mode, value, batchSize, deleteOrphans, preserveKey, timestampField,
                keyField, fieldMappings, fieldExclusions, filter, checksumExclusions);
    }

    public SyncProfile withBatchSize(int value) {
        return new SyncProfile(name, mode, conflictStrategy, value, deleteOrphans, preserveKey, timestampField,
                keyField, fieldMappings, fieldExclusions, filter, checksumExclusions);
    }

    public SyncProfile withDeleteOrphans(boolean value) {
        return new SyncProfile(name, mode, conflictStrategy, batchSize, value, preserveKey, timestampField,
                keyField, fieldMappings, fieldExclusions, filter, checksumExclusions);
    }

    public SyncProfile withPreserveKey(boolean value) {
        return new SyncProfile(name, mode, conflictStrategy, batchSize, deleteOrphans, value, timestampField,
                keyField, fieldMappings, fieldExclusions, filter, checksumExclusions);
    }

    public SyncProfile withTimestampField(String value) {
        return new SyncProfile(name, mode, conflictStrategy, batchSize, deleteOrphans, preserveKey, value,
                keyField, fieldMappings, fieldExclusions, filter, checksumExclusions);
    }

    public SyncProfile withKeyField(String value) {
        return new SyncProfile(name, mode, conflictStrategy, batchSize, deleteOrphans, preserveKey, timestampField,
                value, fieldMappings, fieldExclusions, filter, checksumExclusions);
    }

    public SyncProfile withFieldMappings(Map<String, String> value) {
        return new SyncProfile(name, mode, conflictStrategy, batchSize, deleteOrphans, preserveKey, timestampField,
                keyField, value, fieldExclusions, filter, checksumExclusions);
    }

    public SyncProfile withFieldExclusions(Set<String> value) {
        return new SyncProfile(name, mode, conflictStrategy, batchSize, deleteOrphans, preserveKey, timestampField,
                keyField, fieldMappings, value, filter, checksumExclusions);
    }

    public SyncProfile withFilter(RecordFilter value) {
        return new SyncProfile(name, mode, conflictStrategy, batchSize, deleteOrphans, preserveKey, timestampField,
                keyField, fieldMappings, fieldExclusions, value, checksumExclusions);
    }

    public SyncProfile withChecksumExclusions(Set<String> value) {
        return new SyncProfile(name, mode, conflictStrategy, batchSize, deleteOrphans, preserveKey, timestampField,
                keyField, fieldMappings, fieldExclusions, filter, value);
    }
}
