package io.syncvault.model;

/**
 * Progress marker emitted after a batch has been written. {@code batchIndex} is zero-based
 * over the filtered source sequence; {@code recordsProcessed} counts source records through
 * the end of that batch.
 */
public record Checkpoint(
        int batchIndex,
        String lastKey,
        long recordsProcessed,
        long createdAtMs
) {
    public Checkpoint {
        if (batchIndex < 0) {
            throw new IllegalArgumentException("batchIndex must be >= 0");
        }
        lastKey = lastKey == null ? "" : lastKey;
    }
}
