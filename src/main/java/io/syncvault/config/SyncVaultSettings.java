package io.syncvault.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.syncvault.model.SyncProfile;
import io.syncvault.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Runtime settings resolved from {@code syncvault-settings.json}. Every field of the file is
 * optional; missing or out-of-range values fall back to defaults.
 */
public record SyncVaultSettings(
        int destinationParallelism,
        int defaultBatchSize,
        int parityBlockCount,
        Set<String> checksumExclusions,
        boolean auditSigning
) {
    public static SyncVaultSettings defaults() {
        return new SyncVaultSettings(
                SyncVaultConfig.DEFAULT_DESTINATION_PARALLELISM,
                SyncProfile.DEFAULT_BATCH_SIZE,
                SyncVaultConfig.DEFAULT_PARITY_BLOCK_COUNT,
                SyncProfile.DEFAULT_CHECKSUM_EXCLUSIONS,
                true
        );
    }

    /**
     * Reads the settings file, or returns the defaults when it does not exist.
     */
    public static SyncVaultSettings load(Path file) {
        SyncVaultSettings defaults = defaults();
        if (file == null || !Files.exists(file)) {
            return defaults;
        }
        try {
            SettingsFile parsed = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(parsed, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + file, e);
        }
    }

    static SyncVaultSettings fromFile(SettingsFile file, SyncVaultSettings defaults) {
        if (file == null) {
            return defaults;
        }
        int parallelism = sanitizeInt(file.destinationParallelism(), defaults.destinationParallelism(), 1);
        int batchSize = sanitizeInt(file.defaultBatchSize(), defaults.defaultBatchSize(), 1);
        int blockCount = Math.min(
                SyncVaultConfig.MAX_PARITY_BLOCK_COUNT,
                sanitizeInt(file.parityBlockCount(), defaults.parityBlockCount(), 1)
        );
        Set<String> exclusions = defaults.checksumExclusions();
        if (file.checksumExclusions() != null) {
            Set<String> cleaned = new LinkedHashSet<>();
            for (String field : file.checksumExclusions()) {
                if (field != null && !field.isBlank()) {
                    cleaned.add(field.trim());
                }
            }
            exclusions = Collections.unmodifiableSet(cleaned);
        }
        boolean signing = file.auditSigning() == null ? defaults.auditSigning() : file.auditSigning();
        return new SyncVaultSettings(parallelism, batchSize, blockCount, exclusions, signing);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    record SettingsFile(
            @JsonProperty("destination_parallelism") Integer destinationParallelism,
            @JsonProperty("default_batch_size") Integer defaultBatchSize,
            @JsonProperty("parity_block_count") Integer parityBlockCount,
            @JsonProperty("checksum_exclusions") Set<String> checksumExclusions,
            @JsonProperty("audit_signing") Boolean auditSigning
    ) {
    }
}
