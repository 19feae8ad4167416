package io.syncvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ReconcileMode {
    DRY_RUN("dry_run"),
    APPLY("apply");

    private final String wireName;

    ReconcileMode(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static ReconcileMode fromString(String raw) {
        for (ReconcileMode value : values()) {
            if (value.wireName.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown reconcile mode: " + raw);
    }
}
