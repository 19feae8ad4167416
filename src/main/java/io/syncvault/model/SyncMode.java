package io.syncvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SyncMode {
    FULL("full_sync"),
    INCREMENTAL("incremental"),
    APPEND_ONLY("append_only"),
    MASTER_SLAVE("master_slave");

    private final String wireName;

    SyncMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static SyncMode fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("sync mode must not be blank");
        }
        String normalized = raw.trim().replace('-', '_');
        for (SyncMode value : values()) {
            if (value.name().equalsIgnoreCase(normalized) || value.wireName.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown sync mode: " + raw);
    }
}
