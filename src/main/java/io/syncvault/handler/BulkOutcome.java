package io.syncvault.handler;

import java.util.List;

/**
 * Result of a bulk write or delete: how many records were affected plus one message per
 * record-level failure.
 */
public record BulkOutcome(int count, List<String> errors) {
    public BulkOutcome {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static BulkOutcome ok(int count) {
        return new BulkOutcome(count, List.of());
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
