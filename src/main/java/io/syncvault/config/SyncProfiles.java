package io.syncvault.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.syncvault.model.ConflictStrategy;
import io.syncvault.model.RecordFilter;
import io.syncvault.model.SyncMode;
import io.syncvault.model.SyncProfile;
import io.syncvault.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Reads and writes sync profiles as JSON documents with snake_case keys:
 *
 * <pre>
 * {"name": "nightly", "sync_mode": "incremental", "conflict_resolution": "newest_wins",
 *  "batch_size": 500, "filter_query": {"region": "eu"}}
 * </pre>
 *
 * A file without a {@code name} takes the file name without extension.
 */
public final class SyncProfiles {
    private static final TypeReference<Map<String, Object>> FILTER_TYPE = new TypeReference<>() {
    };

    private SyncProfiles() {
    }

    public static SyncProfile load(Path file) {
        try {
            String json = Files.readString(file, StandardCharsets.UTF_8);
            String fallbackName = file.getFileName().toString().replaceFirst("\\.json$", "");
            return parse(json, fallbackName);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read sync profile: " + file, e);
        }
    }

    /**
     * Loads every {@code *.json} profile in a directory, sorted by file name. A missing directory
     * holds no profiles.
     */
    public static List<SyncProfile> loadAll(Path dir) {
        if (dir == null || !Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            List<SyncProfile> out = new ArrayList<>();
            for (Path file : files.filter(p -> p.getFileName().toString().endsWith(".json")).sorted().toList()) {
                out.add(load(file));
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to list sync profiles: " + dir, e);
        }
    }

    public static SyncProfile parse(String json, String fallbackName) {
        ProfileFile file;
        try {
            file = Jsons.mapper().readValue(json, ProfileFile.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid sync profile JSON: " + e.getOriginalMessage(), e);
        }
        if (file == null) {
            throw new IllegalArgumentException("Sync profile document is empty");
        }
        if (file.syncMode() == null || file.syncMode().isBlank()) {
            throw new IllegalArgumentException("sync_mode is required");
        }
        return new SyncProfile(
                file.name() == null || file.name().isBlank() ? fallbackName : file.name(),
                SyncMode.fromString(file.syncMode()),
                ConflictStrategy.fromString(file.conflictResolution()),
                file.batchSize() == null ? SyncProfile.DEFAULT_BATCH_SIZE : file.batchSize(),
                Boolean.TRUE.equals(file.deleteOrphans()),
                file.preserveKey() == null || file.preserveKey(),
                file.timestampField(),
                file.keyField(),
                file.fieldMappings(),
                file.fieldExclusions(),
                RecordFilter.of(file.filterQuery()),
                file.checksumExclusions()
        );
    }

    public static String toJson(SyncProfile profile) {
        ProfileFile file = new ProfileFile(
                profile.name(),
                profile.mode().wireName(),
                profile.conflictStrategy().wireName(),
                profile.batchSize(),
                profile.deleteOrphans(),
                profile.preserveKey(),
                profile.timestampField(),
                profile.keyField(),
                profile.fieldMappings(),
                profile.fieldExclusions(),
                Jsons.mapper().convertValue(profile.filter(), FILTER_TYPE),
                profile.checksumExclusions()
        );
        return Jsons.toJson(file);
    }

    public static void write(SyncProfile profile, Path file) {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.writeString(file, toJson(profile), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write sync profile: " + file, e);
        }
    }

    record ProfileFile(
            @JsonProperty("name") String name,
            @JsonProperty("sync_mode") String syncMode,
            @JsonProperty("conflict_resolution") String conflictResolution,
            @JsonProperty("batch_size") Integer batchSize,
            @JsonProperty("delete_orphans") Boolean deleteOrphans,
            @JsonProperty("preserve_key") Boolean preserveKey,
            @JsonProperty("timestamp_field") String timestampField,
            @JsonProperty("key_field") String keyField,
            @JsonProperty("field_mappings") Map<String, String> fieldMappings,
            @JsonProperty("field_exclusions") Set<String> fieldExclusions,
            @JsonProperty("filter_query") Map<String, Object> filterQuery,
            @JsonProperty("checksum_exclusions") Set<String> checksumExclusions
    ) {
    }
}
