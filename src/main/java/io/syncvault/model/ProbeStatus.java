package io.syncvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ProbeStatus {
    OK("ok"),
    MISMATCH("mismatch"),
    MISSING_COLLECTION("missing_collection"),
    UNREACHABLE("unreachable"),
    ERROR("error");

    private final String wireName;

    ProbeStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean repairable() {
        return this == MISMATCH || this == MISSING_COLLECTION;
    }

    @JsonCreator
    public static ProbeStatus fromString(String raw) {
        for (ProbeStatus value : values()) {
            if (value.wireName.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown probe status: " + raw);
    }
}
