package io.syncvault.model;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one sync run against one destination. Callers distinguish a clean run
 * ({@link RunState#SUCCESS}), a run with record-level errors ({@link RunState#PARTIAL_FAILURE}),
 * a cooperative stop ({@link RunState#CANCELLED}) and a run that never wrote anything
 * ({@link RunState#ABORTED}).
 */
public record SyncResult(
        String runId,
        String profile,
        SyncMode mode,
        String collection,
        String destination,
        RunState state,
        boolean success,
        long recordsRead,
        long recordsWritten,
        long recordsSkipped,
        long recordsDeleted,
        long recordsFailed,
        long conflictsDetected,
        long conflictsResolved,
        long conflictsQueued,
        int batchesProcessed,
        Instant startedAt,
        Instant completedAt,
        String errorMessage,
        List<String> errors,
        List<Checkpoint> checkpoints,
        List<ConflictEntry> conflicts
) {
    public SyncResult {
        errors = errors == null ? List.of() : List.copyOf(errors);
        checkpoints = checkpoints == null ? List.of() : List.copyOf(checkpoints);
        conflicts = conflicts == null ? List.of() : List.copyOf(conflicts);
    }

    public Checkpoint lastCheckpoint() {
        return checkpoints.isEmpty() ? null : checkpoints.get(checkpoints.size() - 1);
    }
}
