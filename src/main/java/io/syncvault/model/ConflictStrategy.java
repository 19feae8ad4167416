package io.syncvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConflictStrategy {
    SOURCE_WINS("source_wins"),
    DESTINATION_WINS("destination_wins"),
    NEWEST_WINS("newest_wins"),
    MERGE("merge"),
    MANUAL_REVIEW("manual_review");

    private final String wireName;

    ConflictStrategy(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ConflictStrategy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return SOURCE_WINS;
        }
        String normalized = raw.trim().replace('-', '_');
        for (ConflictStrategy value : values()) {
            if (value.name().equalsIgnoreCase(normalized) || value.wireName.equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown conflict strategy: " + raw);
    }
}
