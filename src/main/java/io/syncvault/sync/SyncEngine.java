package io.syncvault.sync;

import io.syncvault.handler.BulkOutcome;
import io.syncvault.handler.CollectionHandler;
import io.syncvault.integrity.RecordChecksums;
import io.syncvault.model.Checkpoint;
import io.syncvault.model.ConflictEntry;
import io.syncvault.model.Record;
import io.syncvault.model.RunState;
import io.syncvault.model.SyncMode;
import io.syncvault.model.SyncProfile;
import io.syncvault.model.SyncResult;
import io.syncvault.observability.AuditLogger;
import io.syncvault.observability.RunIds;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

/**
 * Replicates one collection from a source handler to one destination handler under a
 * {@link SyncProfile}. One engine instance runs one sync at a time; independent destinations
 * get independent engines.
 *
 * <p>A run moves {@code IDLE -> RUNNING -> SUCCESS | PARTIAL_FAILURE | CANCELLED}, or to
 * {@code ABORTED} when the handlers cannot be connected, the source lacks the collection, the
 * destination collection cannot be created, or either side cannot be read. Nothing is written
 * before those checks pass.
 *
 * <p>The filtered source and the destination key set (whole records in incremental mode) are
 * loaded into memory before the first batch is written rather than streamed through the
 * handler's cursor, so a run needs memory proportional to the collection size.
 */
public final class SyncEngine {
    private static final String ACTOR = "sync-engine";

    private final CollectionHandler source;
    private final CollectionHandler destination;
    private final SyncProfile profile;
    private final AuditLogger auditLogger;
    private final AtomicBoolean cancelRequested;
    private volatile RunState state;

    public SyncEngine(CollectionHandler source, CollectionHandler destination, SyncProfile profile) {
        this(source, destination, profile, null);
    }

    public SyncEngine(
            CollectionHandler source,
            CollectionHandler destination,
            SyncProfile profile,
            AuditLogger auditLogger
    ) {
        this.source = source;
        this.destination = destination;
        this.profile = profile;
        this.auditLogger = auditLogger;
        this.cancelRequested = new AtomicBoolean(false);
        this.state = RunState.IDLE;
    }

    public SyncProfile profile() {
        return profile;
    }

    public RunState state() {
        return state;
    }

    /**
     * Requests a cooperative stop. The in-flight batch finishes; no further batch starts and
     * orphans are not deleted. A request made before {@link #sync} is called stops that run before
     * it connects to either handler; the request is cleared when a run finishes.
     */
    public void cancel() {
        cancelRequested.set(true);
    }

    public boolean cancelRequested() {
        return cancelRequested.get();
    }

    public SyncResult sync(String collection) {
        return sync(collection, null);
    }

    /**
     * Runs one sync, skipping the batches {@code resumeFrom} confirms as written.
     */
    public synchronized SyncResult sync(String collection, Checkpoint resumeFrom) {
        try {
            return runOnce(collection, resumeFrom);
        } finally {
            cancelRequested.set(false);
        }
    }

    private SyncResult runOnce(String collection, Checkpoint resumeFrom) {
        state = RunState.RUNNING;
        RunTally tally = new RunTally(RunIds.newRunId(), collection);
        audit("sync.start", "ok", tally.runId, collection, Map.of(
                "mode", profile.mode().wireName(),
                "conflict_resolution", profile.conflictStrategy().wireName(),
                "batch_size", profile.batchSize(),
                "resume_batch", resumeFrom == null ? -1 : resumeFrom.batchIndex()
        ));
        if (cancelRequested.get()) {
            tally.cancelled = true;
            return complete(tally);
        }
        boolean sourceConnected = false;
        boolean destinationConnected = false;
        try {
            sourceConnected = connect(source, tally);
            destinationConnected = sourceConnected && connect(destination, tally);
            if (!sourceConnected) {
                tally.abort("Failed to connect to source '" + source.name() + "'");
            } else if (!destinationConnected) {
                tally.abort("Failed to connect to destination '" + destination.name() + "'");
            } else {
                run(tally, collection, resumeFrom);
            }
        } finally {
            if (sourceConnected) {
                disconnect(source, tally);
            }
            if (destinationConnected) {
                disconnect(destination, tally);
            }
        }
        return complete(tally);
    }

    /**
     * Keys present at the destination but not at the source, in destination order.
     */
    public static Set<String> findOrphans(Collection<String> sourceKeys, Collection<String> destinationKeys) {
        Set<String> known = sourceKeys instanceof Set<String> set ? set : new HashSet<>(sourceKeys);
        Set<String> orphans = new LinkedHashSet<>();
        for (String key : destinationKeys) {
            if (!known.contains(key)) {
                orphans.add(key);
            }
        }
        return orphans;
    }

    private void run(RunTally tally, String collection, Checkpoint resumeFrom) {
        // An absent source collection would otherwise read as empty and orphan every replica key.
        String sourceError = checkSource(collection);
        if (sourceError != null) {
            tally.abort(sourceError);
            return;
        }
        String creationError = ensureCollection(collection);
        if (creationError != null) {
            tally.abort(creationError);
            return;
        }
        List<Record> selected;
        DestinationView view;
        try {
            selected = readSource(collection);
            view = readDestination(collection);
        } catch (RuntimeException e) {
            tally.abort("Failed to read collection '" + collection + "': " + e.getMessage());
            return;
        }
        replicate(tally, selected, view, resumeFrom);
    }

    private void replicate(RunTally tally, List<Record> selected, DestinationView view, Checkpoint resumeFrom) {
        List<BatchPlanner.Batch> plan = BatchPlanner.plan(selected, profile.batchSize());
        List<BatchPlanner.Batch> remaining = BatchPlanner.resumeFrom(plan, resumeFrom);
        // Checkpoints must stay contiguous; once a batch fails outright none are emitted.
        boolean checkpointing = true;
        for (BatchPlanner.Batch batch : remaining) {
            if (cancelRequested.get()) {
                tally.cancelled = true;
                break;
            }
            boolean batchWritten = processBatch(tally, batch, view);
            tally.batchesProcessed++;
            checkpointing = checkpointing && batchWritten;
            if (checkpointing) {
                tally.checkpoints.add(BatchPlanner.checkpointAfter(batch));
            }
        }
        if (cancelRequested.get()) {
            tally.cancelled = true;
        }
        if (!tally.cancelled && profile.effectiveDeleteOrphans()) {
            Set<String> sourceKeys = new HashSet<>();
            for (Record record : selected) {
                sourceKeys.add(record.key());
            }
            deleteOrphans(tally, findOrphans(sourceKeys, view.keys()));
        }
    }

    private boolean processBatch(RunTally tally, BatchPlanner.Batch batch, DestinationView view) {
        List<Record> toWrite = new ArrayList<>(batch.size());
        long skippedBefore = tally.skipped;
        for (Record raw : batch.records()) {
            tally.read++;
            Record record = RecordTransformer.transform(raw, profile);
            switch (profile.mode()) {
                case FULL, MASTER_SLAVE -> toWrite.add(record);
                case APPEND_ONLY -> {
                    if (view.keys().contains(record.key())) {
                        tally.skipped++;
                    } else {
                        toWrite.add(record);
                    }
                }
                case INCREMENTAL -> decideIncremental(tally, record, view.record(record.key()), toWrite);
            }
        }
        boolean written = write(tally, batch, toWrite);
        audit("sync.batch", written ? "ok" : "failed", tally.runId, tally.collection, Map.of(
                "batch_index", batch.index(),
                "records", batch.size(),
                "written", toWrite.size(),
                "skipped", tally.skipped - skippedBefore
        ));
        return written;
    }

    private void decideIncremental(RunTally tally, Record record, Record existing, List<Record> toWrite) {
        if (existing == null) {
            toWrite.add(record);
            return;
        }
        if (RecordChecksums.sameContent(record, existing, profile.checksumExclusions())) {
            tally.skipped++;
            return;
        }
        tally.conflictsDetected++;
        ConflictResolver.Resolution resolution = ConflictResolver.resolve(
                record,
                existing,
                profile.conflictStrategy(),
                profile.timestampField()
        );
        switch (resolution.outcome()) {
            case WRITE_SOURCE, WRITE_MERGED -> {
                tally.conflictsResolved++;
                toWrite.add(resolution.record());
            }
            case KEEP_DESTINATION -> {
                tally.conflictsResolved++;
                tally.skipped++;
            }
            case QUEUED -> {
                tally.conflictsQueued++;
                ConflictEntry entry = ConflictEntry.of(tally.collection, destination.name(), record, existing);
                tally.conflicts.add(entry);
                audit("conflict.queued", "queued", tally.runId, tally.collection, Map.of("key", entry.key()));
            }
        }
    }

    /**
     * Returns false only when the handler failed the batch as a whole.
     */
    private boolean write(RunTally tally, BatchPlanner.Batch batch, List<Record> toWrite) {
        if (toWrite.isEmpty()) {
            return true;
        }
        try {
            BulkOutcome outcome = destination.writeRecords(tally.collection, toWrite, profile.preserveKey());
            tally.written += outcome.count();
            tally.failed += Math.max(0, toWrite.size() - outcome.count());
            tally.errors.addAll(outcome.errors());
            return true;
        } catch (RuntimeException e) {
            tally.failed += toWrite.size();
            tally.errors.add("batch " + batch.index() + ": write failed: " + e.getMessage());
            return false;
        }
    }

    private void deleteOrphans(RunTally tally, Set<String> orphans) {
        if (orphans.isEmpty()) {
            return;
        }
        long deletedBefore = tally.deleted;
        for (List<String> chunk : BatchPlanner.batch(new ArrayList<>(orphans), profile.batchSize())) {
            try {
                BulkOutcome outcome = destination.deleteRecords(tally.collection, chunk);
                tally.deleted += outcome.count();
                tally.errors.addAll(outcome.errors());
                tally.failed += outcome.errors().size();
            } catch (RuntimeException e) {
                tally.failed += chunk.size();
                tally.errors.add("orphan delete failed: " + e.getMessage());
            }
        }
        audit("sync.orphans", "ok", tally.runId, tally.collection, Map.of(
                "orphans", orphans.size(),
                "deleted", tally.deleted - deletedBefore
        ));
    }

    private boolean connect(CollectionHandler handler, RunTally tally) {
        try {
            return handler.connect();
        } catch (RuntimeException e) {
            tally.errors.add("connect '" + handler.name() + "' failed: " + e.getMessage());
            return false;
        }
    }

    private void disconnect(CollectionHandler handler, RunTally tally) {
        try {
            handler.disconnect();
        } catch (RuntimeException e) {
            tally.errors.add("disconnect '" + handler.name() + "' failed: " + e.getMessage());
        }
    }

    private String checkSource(String collection) {
        try {
            return source.collectionExists(collection)
                    ? null
                    : "Source collection '" + collection + "' not found at '" + source.name() + "'";
        } catch (RuntimeException e) {
            return "Failed to look up source collection '" + collection + "': " + e.getMessage();
        }
    }

    /**
     * Returns an error message, or null once the destination collection exists.
     */
    private String ensureCollection(String collection) {
        try {
            if (destination.collectionExists(collection)) {
                return null;
            }
            boolean created = destination.createCollection(collection, source.getSchema(collection).orElse(null));
            return created ? null : "Failed to create collection '" + collection + "' at '" + destination.name() + "'";
        } catch (RuntimeException e) {
            return "Failed to create collection '" + collection + "' at '" + destination.name() + "': "
                    + e.getMessage();
        }
    }

    private List<Record> readSource(String collection) {
        try (Stream<Record> records = source.readRecords(collection, profile.filter(), null, 0, 0)) {
            return records.filter(record -> RecordTransformer.selects(record, profile)).toList();
        }
    }

    private DestinationView readDestination(String collection) {
        SyncMode mode = profile.mode();
        boolean needsRecords = mode == SyncMode.INCREMENTAL;
        boolean needsKeys = needsRecords || mode == SyncMode.APPEND_ONLY || profile.effectiveDeleteOrphans();
        if (!needsKeys) {
            return DestinationView.EMPTY;
        }
        List<String> projection = needsRecords ? null : List.of(profile.keyField());
        Map<String, Record> byKey = new LinkedHashMap<>();
        try (Stream<Record> records = destination.readRecords(collection, null, projection, 0, 0)) {
            records.forEach(record -> byKey.put(record.key(), needsRecords ? record : null));
        }
        return new DestinationView(byKey);
    }

    private SyncResult complete(RunTally tally) {
        RunState finalState;
        if (tally.aborted != null) {
            finalState = RunState.ABORTED;
        } else if (tally.cancelled) {
            finalState = RunState.CANCELLED;
        } else if (tally.errors.isEmpty()) {
            finalState = RunState.SUCCESS;
        } else {
            finalState = RunState.PARTIAL_FAILURE;
        }
        state = finalState;
        SyncResult result = new SyncResult(
                tally.runId,
                profile.name(),
                profile.mode(),
                tally.collection,
                destination.name(),
                finalState,
                finalState == RunState.SUCCESS,
                tally.read,
                tally.written,
                tally.skipped,
                tally.deleted,
                tally.failed,
                tally.conflictsDetected,
                tally.conflictsResolved,
                tally.conflictsQueued,
                tally.batchesProcessed,
                tally.startedAt,
                Instant.now(),
                tally.aborted != null ? tally.aborted : tally.errors.isEmpty() ? null : tally.errors.get(0),
                tally.errors,
                tally.checkpoints,
                tally.conflicts
        );
        if (finalState == RunState.ABORTED) {
            audit("sync.abort", "aborted", tally.runId, tally.collection, Map.of("error", tally.aborted));
        } else {
            audit("sync.complete", finalState.name().toLowerCase(), tally.runId, tally.collection, Map.of(
                    "read", result.recordsRead(),
                    "written", result.recordsWritten(),
                    "skipped", result.recordsSkipped(),
                    "deleted", result.recordsDeleted(),
                    "failed", result.recordsFailed(),
                    "conflicts_queued", result.conflictsQueued(),
                    "batches", result.batchesProcessed()
            ));
        }
        return result;
    }

    private void audit(String action, String result, String runId, String collection, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        Map<String, Object> withTarget = new LinkedHashMap<>(details);
        withTarget.put("source", source.name());
        withTarget.put("destination", destination.name());
        withTarget.put("profile", profile.name());
        auditLogger.log(AuditLogger.AuditEvent.of(
                action,
                ACTOR,
                "collection/" + collection,
                result,
                runId,
                withTarget
        ));
    }

    private record DestinationView(Map<String, Record> byKey) {
        static final DestinationView EMPTY = new DestinationView(Map.of());

        Set<String> keys() {
            return byKey.keySet();
        }

        Record record(String key) {
            return byKey.get(key);
        }
    }

    private static final class RunTally {
        private final String runId;
        private final String collection;
        private final Instant startedAt = Instant.now();
        private final List<String> errors = new ArrayList<>();
        private final List<Checkpoint> checkpoints = new ArrayList<>();
        private final List<ConflictEntry> conflicts = new ArrayList<>();
        private long read;
        private long written;
        private long skipped;
        private long deleted;
        private long failed;
        private long conflictsDetected;
        private long conflictsResolved;
        private long conflictsQueued;
        private int batchesProcessed;
        private boolean cancelled;
        private String aborted;

        private RunTally(String runId, String collection) {
            this.runId = runId;
            this.collection = collection;
        }

        private void abort(String message) {
            aborted = message;
            errors.add(message);
        }
    }
}
