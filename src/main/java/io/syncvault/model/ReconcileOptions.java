package io.syncvault.model;

/**
 * How a reconciliation treats the differences found by an audit.
 *
 * @param deleteExtras       remove destination-only keys
 * @param reviewMismatches   queue mismatched keys for manual review instead of overwriting them
 */
public record ReconcileOptions(
        ReconcileMode mode,
        boolean deleteExtras,
        boolean reviewMismatches,
        int batchSize
) {
    public ReconcileOptions {
        mode = mode == null ? ReconcileMode.DRY_RUN : mode;
        batchSize = batchSize < 1 ? SyncProfile.DEFAULT_BATCH_SIZE : batchSize;
    }

    public static ReconcileOptions dryRun() {
        return new ReconcileOptions(ReconcileMode.DRY_RUN, false, false, SyncProfile.DEFAULT_BATCH_SIZE);
    }

    public static ReconcileOptions apply(boolean deleteExtras) {
        return new ReconcileOptions(ReconcileMode.APPLY, deleteExtras, false, SyncProfile.DEFAULT_BATCH_SIZE);
    }

    public boolean isDryRun() {
        return mode == ReconcileMode.DRY_RUN;
    }
}
