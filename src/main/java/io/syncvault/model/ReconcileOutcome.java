package io.syncvault.model;

import java.util.List;

/**
 * Changes planned, and when not a dry run applied, for each repairable destination collection.
 */
public record ReconcileOutcome(
        ReconcileMode mode,
        List<Action> actions,
        boolean converged,
        List<String> errors
) {
    public ReconcileOutcome {
        actions = actions == null ? List.of() : List.copyOf(actions);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public int totalPlanned() {
        int total = 0;
        for (Action action : actions) {
            total += action.copyKeys().size() + action.overwriteKeys().size() + action.deleteKeys().size();
        }
        return total;
    }

    public record Action(
            String destination,
            String collection,
            boolean createCollection,
            List<String> copyKeys,
            List<String> overwriteKeys,
            List<String> deleteKeys,
            List<ConflictEntry> queued,
            long copied,
            long overwritten,
            long deleted,
            ProbeResult after
    ) {
        public Action {
            copyKeys = copyKeys == null ? List.of() : List.copyOf(copyKeys);
            overwriteKeys = overwriteKeys == null ? List.of() : List.copyOf(overwriteKeys);
            deleteKeys = deleteKeys == null ? List.of() : List.copyOf(deleteKeys);
            queued = queued == null ? List.of() : List.copyOf(queued);
        }

        public Action withAfter(ProbeResult probe) {
            return new Action(destination, collection, createCollection, copyKeys, overwriteKeys, deleteKeys,
                    queued, copied, overwritten, deleted, probe);
        }
    }
}
