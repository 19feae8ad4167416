package io.syncvault.runtime;

import io.syncvault.config.SyncProfiles;
import io.syncvault.config.SyncVaultConfig;
import io.syncvault.handler.BulkOutcome;
import io.syncvault.handler.InMemoryCollectionHandler;
import io.syncvault.integrity.IntegrityAuditor;
import io.syncvault.integrity.ParitySet;
import io.syncvault.model.Checkpoint;
import io.syncvault.model.ConflictStrategy;
import io.syncvault.model.IntegrityReport;
import io.syncvault.model.ProbeStatus;
import io.syncvault.model.Record;
import io.syncvault.model.ReconcileOptions;
import io.syncvault.model.ReconcileOutcome;
import io.syncvault.model.RunState;
import io.syncvault.model.SyncMode;
import io.syncvault.model.SyncProfile;
import io.syncvault.model.SyncResult;
import io.syncvault.storage.Database;
import io.syncvault.storage.SqliteCollectionHandler;
import io.syncvault.storage.SyncStateStore;
import io.syncvault.sync.ConflictResolver;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

import static io.syncvault.TestRecords.numbered;
import static io.syncvault.TestRecords.record;

final class SyncVaultRuntimeTest {
    private static final String COLLECTION = "customers";

    @Test
    void syncFansOutToEveryDestination() throws Exception {
        Path root = Files.createTempDirectory("syncvault-test-runtime-fanout-");
        try {
            SyncVaultRuntime runtime = runtime(root);
            InMemoryCollectionHandler source = new InMemoryCollectionHandler("primary");
            source.put(COLLECTION, numbered("cust", 60));
            InMemoryCollectionHandler memoryReplica = new InMemoryCollectionHandler("replica-mem");
            Database db = new Database(runtime.config());
            SqliteCollectionHandler sqliteReplica = new SqliteCollectionHandler(db, "replica-sql");
            runtime.registerHandler(source);
            runtime.registerHandler(memoryReplica);
            runtime.registerHandler(sqliteReplica);
            SyncProfile profile = runtime.newProfile("nightly", SyncMode.FULL).withBatchSize(20);

            List<SyncResult> results = runtime.runSync(profile, "primary", List.of("replica-mem", "replica-sql"),
                    COLLECTION);

            Assertions.assertEquals(List.of("replica-mem", "replica-sql"),
                    results.stream().map(SyncResult::destination).toList());
            for (SyncResult result : results) {
                Assertions.assertEquals(RunState.SUCCESS, result.state());
                Assertions.assertEquals(60L, result.recordsWritten());
                Assertions.assertTrue(runtime.stateStore()
                        .loadCheckpoint("nightly", result.destination(), COLLECTION).isEmpty());
            }
            Assertions.assertEquals(60L, sqliteReplica.getRecordCount(COLLECTION));
            Assertions.assertTrue(Files.exists(root.resolve("security").resolve("audit-signing.key")));
            Assertions.assertTrue(runtime.verifyAuditChain().intact());
            Assertions.assertEquals("runtime.settings.load",
                    runtime.auditLogger().readAll().get(0).path("action").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cancelledRunLeavesCheckpointForNextRun() throws Exception {
        Path root = Files.createTempDirectory("syncvault-test-runtime-resume-");
        try {
            SyncVaultRuntime runtime = runtime(root);
            AtomicReference<SyncVaultRuntime> cancelFrom = new AtomicReference<>(runtime);
            InMemoryCollectionHandler source = new InMemoryCollectionHandler("primary");
            source.put(COLLECTION, numbered("cust", 50));
            InMemoryCollectionHandler replica = new InMemoryCollectionHandler("replica") {
                @Override
                public BulkOutcome writeRecords(String collection, List<Record> records, boolean preserveKey) {
                    BulkOutcome outcome = super.writeRecords(collection, records, preserveKey);
                    SyncVaultRuntime owner = cancelFrom.get();
                    if (owner != null) {
                        owner.cancelAll();
                    }
                    return outcome;
                }
            };
            runtime.registerHandler(source);
            runtime.registerHandler(replica);
            SyncProfile profile = runtime.newProfile("hourly", SyncMode.FULL).withBatchSize(10);

            SyncResult cancelled = runtime.runSync(profile, "primary", List.of("replica"), COLLECTION).get(0);

            Assertions.assertEquals(RunState.CANCELLED, cancelled.state());
            Checkpoint stored = runtime.stateStore().loadCheckpoint("hourly", "replica", COLLECTION).orElseThrow();
            Assertions.assertEquals("cust-10", stored.lastKey());

            cancelFrom.set(null);
            SyncResult resumed = runtime.runSync(profile, "primary", List.of("replica"), COLLECTION).get(0);

            Assertions.assertEquals(RunState.SUCCESS, resumed.state());
            Assertions.assertEquals(40L, resumed.recordsWritten());
            Assertions.assertEquals(50, replica.snapshot(COLLECTION).size());
            Assertions.assertTrue(runtime.stateStore().loadCheckpoint("hourly", "replica", COLLECTION).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cancelAlsoStopsDestinationsWaitingForAThread() throws Exception {
        Path root = Files.createTempDirectory("syncvault-test-runtime-queued-cancel-");
        try {
            Files.writeString(root.resolve("syncvault-settings.json"), """
                    {"destination_parallelism": 1}
                    """, StandardCharsets.UTF_8);
            SyncVaultRuntime runtime = runtime(root);
            AtomicReference<SyncVaultRuntime> cancelFrom = new AtomicReference<>(runtime);
            AtomicInteger signalled = new AtomicInteger(-1);
            InMemoryCollectionHandler source = new InMemoryCollectionHandler("primary");
            source.put(COLLECTION, numbered("cust", 50));
            InMemoryCollectionHandler first = new InMemoryCollectionHandler("a") {
                @Override
                public BulkOutcome writeRecords(String collection, List<Record> records, boolean preserveKey) {
                    BulkOutcome outcome = super.writeRecords(collection, records, preserveKey);
                    SyncVaultRuntime owner = cancelFrom.getAndSet(null);
                    if (owner != null) {
                        signalled.set(owner.cancelAll());
                    }
                    return outcome;
                }
            };
            InMemoryCollectionHandler second = new InMemoryCollectionHandler("b");
            runtime.registerHandler(source);
            runtime.registerHandler(first);
            runtime.registerHandler(second);
            SyncProfile profile = runtime.newProfile("hourly", SyncMode.FULL).withBatchSize(10);

            List<SyncResult> results = runtime.runSync(profile, "primary", List.of("a", "b"), COLLECTION);

            Assertions.assertEquals(1, runtime.settings().destinationParallelism());
            Assertions.assertEquals(2, signalled.get());
            Assertions.assertEquals(RunState.CANCELLED, results.get(0).state());
            Assertions.assertEquals(10L, results.get(0).recordsWritten());
            Assertions.assertEquals(RunState.CANCELLED, results.get(1).state());
            Assertions.assertEquals(0L, results.get(1).recordsWritten());
            Assertions.assertFalse(second.collectionExists(COLLECTION));
            Assertions.assertTrue(runtime.stateStore().loadCheckpoint("hourly", "b", COLLECTION).isEmpty());

            List<SyncResult> rerun = runtime.runSync(profile, "primary", List.of("a", "b"), COLLECTION);

            Assertions.assertEquals(RunState.SUCCESS, rerun.get(0).state());
            Assertions.assertEquals(40L, rerun.get(0).recordsWritten());
            Assertions.assertEquals(RunState.SUCCESS, rerun.get(1).state());
            Assertions.assertEquals(50L, rerun.get(1).recordsWritten());
            Assertions.assertEquals(0, runtime.cancelAll());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void queuedConflictsAreResolvedLater() throws Exception {
        Path root = Files.createTempDirectory("syncvault-test-runtime-conflicts-");
        try {
            SyncVaultRuntime runtime = runtime(root);
            InMemoryCollectionHandler source = new InMemoryCollectionHandler("primary");
            source.put(COLLECTION, List.of(record("a", "tier", "gold"), record("b", "tier", "silver")));
            InMemoryCollectionHandler replica = new InMemoryCollectionHandler("replica");
            replica.put(COLLECTION, List.of(record("a", "tier", "bronze"), record("b", "tier", "iron")));
            runtime.registerHandler(source);
            runtime.registerHandler(replica);
            SyncProfile profile = runtime.newProfile("review", SyncMode.INCREMENTAL)
                    .withConflictStrategy(ConflictStrategy.MANUAL_REVIEW);

            SyncResult result = runtime.runSync(profile, "primary", List.of("replica"), COLLECTION).get(0);
            Assertions.assertEquals(2L, result.conflictsQueued());

            List<SyncStateStore.QueuedConflict> pending = runtime.pendingConflicts("replica", COLLECTION);
            Assertions.assertEquals(2, pending.size());
            SyncStateStore.QueuedConflict forA = pending.stream()
                    .filter(q -> q.entry().key().equals("a")).findFirst().orElseThrow();
            SyncStateStore.QueuedConflict forB = pending.stream()
                    .filter(q -> q.entry().key().equals("b")).findFirst().orElseThrow();

            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> runtime.resolveConflict(forA.conflictId(), ConflictStrategy.MANUAL_REVIEW, "ops"));

            SyncVaultRuntime.ConflictResolution applied =
                    runtime.resolveConflict(forA.conflictId(), ConflictStrategy.SOURCE_WINS, "ops");
            Assertions.assertTrue(applied.written());
            Assertions.assertEquals(ConflictResolver.Outcome.WRITE_SOURCE, applied.outcome());
            Assertions.assertEquals("gold", replica.getRecordByKey(COLLECTION, "a").orElseThrow().get("tier").asText());

            SyncVaultRuntime.ConflictResolution kept =
                    runtime.resolveConflict(forB.conflictId(), ConflictStrategy.DESTINATION_WINS, "ops");
            Assertions.assertFalse(kept.written());
            Assertions.assertEquals("iron", replica.getRecordByKey(COLLECTION, "b").orElseThrow().get("tier").asText());

            Assertions.assertTrue(runtime.pendingConflicts(null, null).isEmpty());
            Assertions.assertThrows(IllegalStateException.class,
                    () -> runtime.resolveConflict(forA.conflictId(), ConflictStrategy.SOURCE_WINS, "ops"));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> runtime.resolveConflict("cfl_missing", ConflictStrategy.SOURCE_WINS, "ops"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void auditReportIsStoredAndDrivesReconcile() throws Exception {
        Path root = Files.createTempDirectory("syncvault-test-runtime-audit-");
        try {
            SyncVaultRuntime runtime = runtime(root);
            InMemoryCollectionHandler source = new InMemoryCollectionHandler("primary");
            source.put(COLLECTION, numbered("cust", 12));
            InMemoryCollectionHandler replica = new InMemoryCollectionHandler("replica");
            replica.put(COLLECTION, numbered("cust", 10));
            replica.put(COLLECTION, List.of(record("cust-4", "name", "edited"), record("orphan", "v", 1)));
            runtime.registerHandler(source);
            runtime.registerHandler(replica);

            IntegrityReport report = runtime.audit("primary", List.of("replica"), List.of(COLLECTION));

            Assertions.assertEquals(IntegrityReport.OverallStatus.DEGRADED, report.overallStatus());
            Assertions.assertTrue(Files.exists(root.resolve("reports").resolve(report.reportId() + ".json")));
            Assertions.assertEquals(report.reportId(), runtime.reportHistory(5).get(0).reportId());

            ReconcileOutcome planned = runtime.reconcile(report.reportId(), ReconcileOptions.dryRun());
            Assertions.assertEquals(3, planned.totalPlanned());
            Assertions.assertEquals(11, replica.snapshot(COLLECTION).size());

            ReconcileOutcome applied = runtime.reconcile(report.reportId(), ReconcileOptions.apply(true));
            Assertions.assertTrue(applied.converged(), () -> String.valueOf(applied.errors()));
            Assertions.assertEquals(ProbeStatus.OK, applied.actions().get(0).after().status());

            IntegrityReport after = runtime.audit("primary", List.of("replica"), List.of(COLLECTION));
            Assertions.assertEquals(IntegrityReport.OverallStatus.OK, after.overallStatus());
            Assertions.assertEquals(2, runtime.reportHistory(5).size());
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> runtime.reconcile("rpt_unknown", ReconcileOptions.dryRun()));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void settingsAndProfilesComeFromTheDataRoot() throws Exception {
        Path root = Files.createTempDirectory("syncvault-test-runtime-settings-");
        try {
            Files.writeString(root.resolve("syncvault-settings.json"), """
                    {"default_batch_size": 7, "parity_block_count": 4, "audit_signing": false}
                    """, StandardCharsets.UTF_8);
            SyncProfiles.write(SyncProfile.of("mirror", SyncMode.MASTER_SLAVE),
                    root.resolve("profiles").resolve("mirror.json"));
            SyncVaultRuntime runtime = runtime(root);

            Assertions.assertEquals(7, runtime.newProfile("x", SyncMode.FULL).batchSize());
            Assertions.assertEquals(SyncMode.MASTER_SLAVE, runtime.loadProfile("mirror").mode());
            Assertions.assertEquals(List.of("mirror"), runtime.profiles().stream().map(SyncProfile::name).toList());
            Assertions.assertFalse(Files.exists(root.resolve("security").resolve("audit-signing.key")));
            Assertions.assertEquals("ok", runtime.auditLogger().readAll().get(0).path("result").asText());

            InMemoryCollectionHandler source = new InMemoryCollectionHandler("primary");
            source.put(COLLECTION, numbered("cust", 30));
            InMemoryCollectionHandler replica = new InMemoryCollectionHandler("replica");
            replica.put(COLLECTION, numbered("cust", 30));
            runtime.registerHandler(source);
            runtime.registerHandler(replica);
            ParitySet parity = runtime.paritySet("primary", COLLECTION);
            Assertions.assertEquals(4, parity.blockCount());
            replica.put(COLLECTION, List.of(record("cust-9", "name", "flipped")));
            IntegrityAuditor.ParityVerification verification =
                    runtime.verifyParity("primary", "replica", COLLECTION, parity);
            Assertions.assertEquals(List.of(ParitySet.blockOf("cust-9", 4)), verification.failedBlocks());
        } finally {
            deleteRecursively(root);
        }
    }

    private static SyncVaultRuntime runtime(Path root) {
        SyncVaultRuntime runtime = new SyncVaultRuntime(SyncVaultConfig.fromRoot(root.toString()));
        runtime.init();
        return runtime;
    }

    private static void deleteRecursively(Path root) throws Exception {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path p : walk.sorted(Comparator.comparingInt(Path::getNameCount).reversed()).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }
}
