package io.syncvault.integrity;

import io.syncvault.handler.BulkOutcome;
import io.syncvault.handler.CollectionHandler;
import io.syncvault.handler.HandlerRegistry;
import io.syncvault.model.ConflictEntry;
import io.syncvault.model.IntegrityReport;
import io.syncvault.model.ProbeResult;
import io.syncvault.model.ProbeStatus;
import io.syncvault.model.Record;
import io.syncvault.model.ReconcileMode;
import io.syncvault.model.ReconcileOptions;
import io.syncvault.model.ReconcileOutcome;
import io.syncvault.observability.AuditLogger;
import io.syncvault.sync.BatchPlanner;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Repairs the divergence an {@link IntegrityReport} describes. The source is authoritative:
 * missing keys are copied, mismatched keys overwritten (or queued for review) and, on request,
 * destination-only keys deleted. A dry run reads but never writes.
 */
public final class Reconciler {
    private static final String ACTOR = "reconciler";

    private final IntegrityAuditor auditor;
    private final HandlerRegistry destinations;
    private final AuditLogger auditLogger;

    public Reconciler(IntegrityAuditor auditor, HandlerRegistry destinations, AuditLogger auditLogger) {
        this.auditor = auditor;
        this.destinations = destinations;
        this.auditLogger = auditLogger;
    }

    public ReconcileOutcome reconcile(IntegrityReport report, ReconcileOptions options) {
        ReconcileOptions opts = options == null ? ReconcileOptions.dryRun() : options;
        List<ReconcileOutcome.Action> actions = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        boolean converged = true;
        for (ProbeResult probe : report.probes()) {
            if (probe.status() == ProbeStatus.OK) {
                continue;
            }
            if (!probe.status().repairable()) {
                errors.add(probe.destination() + "/" + probe.collection() + ": cannot repair "
                        + probe.status().wireName() + (probe.errorMessage().isBlank() ? "" : " (" + probe.errorMessage() + ")"));
                converged = false;
                continue;
            }
            Optional<CollectionHandler> destination = destinations.findByName(probe.destination());
            if (destination.isEmpty()) {
                errors.add(probe.destination() + ": no handler registered");
                converged = false;
                continue;
            }
            ReconcileOutcome.Action action;
            try {
                Plan plan = plan(destination.get(), probe, opts);
                if (opts.isDryRun()) {
                    action = plan.toAction(0L, 0L, 0L, List.of(), null);
                } else {
                    action = apply(destination.get(), plan, opts, errors)
                            .withAfter(auditor.probe(destination.get(), probe.collection()));
                }
            } catch (RuntimeException e) {
                errors.add(probe.destination() + "/" + probe.collection() + ": " + e.getMessage());
                converged = false;
                continue;
            }
            actions.add(action);
            if (opts.isDryRun() || action.after() == null || action.after().status() != ProbeStatus.OK) {
                converged = false;
            }
        }
        ReconcileOutcome outcome = new ReconcileOutcome(opts.mode(), actions, converged, errors);
        audit(opts.mode() == ReconcileMode.DRY_RUN ? "reconcile.plan" : "reconcile.apply",
                converged ? "converged" : opts.isDryRun() ? "planned" : "diverged",
                report.reportId(), Map.of(
                        "actions", actions.size(),
                        "planned_changes", outcome.totalPlanned(),
                        "errors", errors.size()
                ));
        return outcome;
    }

    private Plan plan(CollectionHandler destination, ProbeResult probe, ReconcileOptions opts) {
        List<String> missing = probe.missingKeys();
        List<String> extra = probe.extraKeys();
        List<String> mismatched = probe.mismatchedKeys();
        boolean create = probe.status() == ProbeStatus.MISSING_COLLECTION;
        boolean needsKeys = missing.isEmpty() && extra.isEmpty() && mismatched.isEmpty();
        if (needsKeys) {
            // A plain probe carries no keys; recompute them.
            CollectionFingerprint sourceFp = CollectionFingerprint.read(auditor.source(), probe.collection(),
                    auditor.checksumExclusions());
            CollectionFingerprint replicaFp = create
                    ? CollectionFingerprint.empty(probe.collection())
                    : CollectionFingerprint.read(destination, probe.collection(), auditor.checksumExclusions());
            CollectionFingerprint.KeyDifferences diff = sourceFp.diff(replicaFp);
            missing = diff.missing();
            extra = diff.extra();
            mismatched = diff.mismatched();
        }
        List<String> overwrite = opts.reviewMismatches() ? List.of() : mismatched;
        List<String> review = opts.reviewMismatches() ? mismatched : List.of();
        List<String> delete = opts.deleteExtras() ? extra : List.of();
        return new Plan(probe.destination(), probe.collection(), create, missing, overwrite, delete, review);
    }

    private ReconcileOutcome.Action apply(
            CollectionHandler destination,
            Plan plan,
            ReconcileOptions opts,
            List<String> errors
    ) {
        CollectionHandler source = auditor.source();
        String collection = plan.collection();
        if (!source.connect()) {
            throw new IllegalStateException("source '" + source.name() + "' is not reachable");
        }
        try {
            if (!destination.connect()) {
                throw new IllegalStateException("destination '" + destination.name() + "' is not reachable");
            }
            try {
                if (plan.createCollection() && !destination.collectionExists(collection)) {
                    if (!destination.createCollection(collection, source.getSchema(collection).orElse(null))) {
                        throw new IllegalStateException("failed to create collection '" + collection + "'");
                    }
                }
                Map<String, Record> sourceRecords = readByKey(source, collection,
                        union(plan.copyKeys(), plan.overwriteKeys()));
                long copied = write(destination, plan, plan.copyKeys(), sourceRecords, opts, errors);
                long overwritten = write(destination, plan, plan.overwriteKeys(), sourceRecords, opts, errors);
                long deleted = 0L;
                for (List<String> chunk : BatchPlanner.batch(plan.deleteKeys(), opts.batchSize())) {
                    BulkOutcome outcome = destination.deleteRecords(collection, chunk);
                    deleted += outcome.count();
                    prefix(plan, outcome.errors(), errors);
                }
                List<ConflictEntry> queued = new ArrayList<>();
                for (String key : plan.reviewKeys()) {
                    Optional<Record> sourceRecord = source.getRecordByKey(collection, key);
                    Optional<Record> destinationRecord = destination.getRecordByKey(collection, key);
                    if (sourceRecord.isPresent() && destinationRecord.isPresent()) {
                        queued.add(ConflictEntry.of(collection, destination.name(), sourceRecord.get(),
                                destinationRecord.get()));
                    }
                }
                return plan.toAction(copied, overwritten, deleted, queued, null);
            } finally {
                destination.disconnect();
            }
        } finally {
            source.disconnect();
        }
    }

    private long write(
            CollectionHandler destination,
            Plan plan,
            List<String> keys,
            Map<String, Record> sourceRecords,
            ReconcileOptions opts,
            List<String> errors
    ) {
        List<Record> records = new ArrayList<>(keys.size());
        for (String key : keys) {
            Record record = sourceRecords.get(key);
            if (record == null) {
                errors.add(plan.destination() + "/" + plan.collection() + ": " + key + ": gone from source");
            } else {
                records.add(record);
            }
        }
        long written = 0L;
        for (List<Record> chunk : BatchPlanner.batch(records, opts.batchSize())) {
            BulkOutcome outcome = destination.writeRecords(plan.collection(), chunk, true);
            written += outcome.count();
            prefix(plan, outcome.errors(), errors);
        }
        return written;
    }

    private static Map<String, Record> readByKey(CollectionHandler handler, String collection, Set<String> keys) {
        Map<String, Record> out = new LinkedHashMap<>();
        if (keys.isEmpty()) {
            return out;
        }
        try (Stream<Record> records = handler.readRecords(collection)) {
            records.filter(record -> keys.contains(record.key())).forEach(record -> out.put(record.key(), record));
        }
        return out;
    }

    private static Set<String> union(List<String> left, List<String> right) {
        Set<String> out = new HashSet<>(left);
        out.addAll(right);
        return out;
    }

    private static void prefix(Plan plan, List<String> handlerErrors, List<String> errors) {
        for (String error : handlerErrors) {
            errors.add(plan.destination() + "/" + plan.collection() + ": " + error);
        }
    }

    private void audit(String action, String result, String reportId, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        auditLogger.log(AuditLogger.AuditEvent.of(action, ACTOR, "report/" + reportId, result, null, details));
    }

    private record Plan(
            String destination,
            String collection,
            boolean createCollection,
            List<String> copyKeys,
            List<String> overwriteKeys,
            List<String> deleteKeys,
            List<String> reviewKeys
    ) {
        ReconcileOutcome.Action toAction(long copied, long overwritten, long deleted,
                                         List<ConflictEntry> queued, ProbeResult after) {
            return new ReconcileOutcome.Action(destination, collection, createCollection, copyKeys, overwriteKeys,
                    deleteKeys, queued, copied, overwritten, deleted, after);
        }
    }
}
