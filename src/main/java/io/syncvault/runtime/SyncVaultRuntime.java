package io.syncvault.runtime;

import io.syncvault.config.SyncProfiles;
import io.syncvault.config.SyncVaultConfig;
import io.syncvault.config.SyncVaultSettings;
import io.syncvault.handler.BulkOutcome;
import io.syncvault.handler.CollectionHandler;
import io.syncvault.handler.HandlerRegistry;
import io.syncvault.integrity.IntegrityAuditor;
import io.syncvault.integrity.ParitySet;
import io.syncvault.integrity.Reconciler;
import io.syncvault.model.Checkpoint;
import io.syncvault.model.ConflictEntry;
import io.syncvault.model.ConflictStrategy;
import io.syncvault.model.IntegrityReport;
import io.syncvault.model.ReconcileOptions;
import io.syncvault.model.ReconcileOutcome;
import io.syncvault.model.Record;
import io.syncvault.model.RunState;
import io.syncvault.model.SyncMode;
import io.syncvault.model.SyncProfile;
import io.syncvault.model.SyncResult;
import io.syncvault.observability.AuditLogger;
import io.syncvault.storage.Database;
import io.syncvault.storage.SyncStateStore;
import io.syncvault.sync.ConflictResolver;
import io.syncvault.sync.SyncEngine;
import io.syncvault.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

public final class SyncVaultRuntime {
    private static final String ACTOR = "runtime";

    private final SyncVaultConfig config;
    private final SyncVaultSettings settings;
    private final Database database;
    private final SyncStateStore stateStore;
    private final HandlerRegistry handlers;
    private final AuditLogger auditLogger;
    private final Map<String, SyncEngine> activeEngines;
    private final Set<RunGroup> activeGroups;

    public SyncVaultRuntime(SyncVaultConfig config) {
        this.config = config;
        this.settings = SyncVaultSettings.load(config.settingsFile());
        this.database = new Database(config);
        this.stateStore = new SyncStateStore(database);
        this.handlers = new HandlerRegistry();
        this.activeEngines = new ConcurrentHashMap<>();
        this.activeGroups = ConcurrentHashMap.newKeySet();
        String signingSecret = settings.auditSigning()
                ? loadOrCreateAuditSigningSecret(config.securityRoot().resolve("audit-signing.key"))
                : "";
        this.auditLogger = new AuditLogger(config.auditFile(), config.namespace(), signingSecret);
    }

    public void init() {
        database.init();
        boolean fromFile = Files.exists(config.settingsFile());
        auditLogger.log(AuditLogger.AuditEvent.of(
                "runtime.settings.load",
                ACTOR,
                "runtime/settings",
                fromFile ? "ok" : "ok_default",
                null,
                Map.of(
                        "config", config.settingsFile().toString(),
                        "source", fromFile ? "file" : "defaults",
                        "destination_parallelism", settings.destinationParallelism(),
                        "default_batch_size", settings.defaultBatchSize(),
                        "parity_block_count", settings.parityBlockCount()
                )
        ));
    }

    public SyncVaultConfig config() {
        return config;
    }

    public SyncVaultSettings settings() {
        return settings;
    }

    public HandlerRegistry handlers() {
        return handlers;
    }

    public SyncStateStore stateStore() {
        return stateStore;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public void registerHandler(CollectionHandler handler) {
        handlers.register(handler);
    }

    /**
     * A profile carrying this runtime's default batch size and checksum exclusions.
     */
    public SyncProfile newProfile(String name, SyncMode mode) {
        return SyncProfile.of(name, mode)
                .withBatchSize(settings.defaultBatchSize())
                .withChecksumExclusions(settings.checksumExclusions());
    }

    public SyncProfile loadProfile(String name) {
        return SyncProfiles.load(config.profilesRoot().resolve(name + ".json"));
    }

    public List<SyncProfile> profiles() {
        return SyncProfiles.loadAll(config.profilesRoot());
    }

    /**
     * Syncs one collection to every destination, at most {@code destination_parallelism} at a time.
     * Each destination resumes from its stored checkpoint. A run that reaches the end clears the
     * checkpoint; a cancelled run stores its last one. Queued conflicts are persisted.
     */
    public List<SyncResult> runSync(SyncProfile profile, String sourceName, List<String> destinationNames,
                                    String collection) {
        CollectionHandler source = handlers.require(sourceName);
        List<CollectionHandler> destinations = new ArrayList<>();
        for (String name : destinationNames) {
            destinations.add(handlers.require(name));
        }
        if (destinations.isEmpty()) {
            return List.of();
        }
        int threads = Math.min(settings.destinationParallelism(), destinations.size());
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        RunGroup group = new RunGroup(destinations.size());
        activeGroups.add(group);
        try {
            List<Future<SyncResult>> futures = new ArrayList<>();
            for (CollectionHandler destination : destinations) {
                futures.add(pool.submit(() -> runOne(group, profile, source, destination, collection)));
            }
            List<SyncResult> results = new ArrayList<>();
            for (Future<SyncResult> future : futures) {
                results.add(future.get());
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancelAll();
            throw new RuntimeException("Interrupted while waiting for sync runs", e);
        } catch (ExecutionException e) {
            throw new RuntimeException("Sync run failed: " + e.getCause().getMessage(), e.getCause());
        } finally {
            activeGroups.remove(group);
            pool.shutdown();
        }
    }

    private SyncResult runOne(RunGroup group, SyncProfile profile, CollectionHandler source,
                              CollectionHandler destination, String collection) {
        group.pending.decrementAndGet();
        String runKey = profile.name() + "/" + destination.name() + "/" + collection;
        SyncEngine engine = new SyncEngine(source, destination, profile, auditLogger);
        if (activeEngines.putIfAbsent(runKey, engine) != null) {
            throw new IllegalStateException("A sync is already running for " + runKey);
        }
        // Checked after registering: cancelAll raises the group flag before it walks the engines.
        if (group.cancelled.get()) {
            engine.cancel();
        }
        try {
            Checkpoint resume = stateStore.loadCheckpoint(profile.name(), destination.name(), collection).orElse(null);
            SyncResult result = engine.sync(collection, resume);
            if (result.state() == RunState.SUCCESS || result.state() == RunState.PARTIAL_FAILURE) {
                stateStore.clearCheckpoint(profile.name(), destination.name(), collection);
            } else if (result.state() == RunState.CANCELLED && result.lastCheckpoint() != null) {
                stateStore.saveCheckpoint(profile.name(), destination.name(), collection, result.lastCheckpoint());
            }
            for (ConflictEntry conflict : result.conflicts()) {
                stateStore.enqueueConflict(profile.name(), conflict);
            }
            return result;
        } finally {
            activeEngines.remove(runKey);
        }
    }

    /**
     * Requests a cooperative stop of every running sync, including destination runs still waiting
     * for a pool thread. Returns how many destination runs were signalled.
     */
    public int cancelAll() {
        int cancelled = 0;
        for (RunGroup group : activeGroups) {
            group.cancelled.set(true);
            cancelled += Math.max(0, group.pending.get());
        }
        for (SyncEngine engine : activeEngines.values()) {
            engine.cancel();
            cancelled++;
        }
        return cancelled;
    }

    /**
     * Audits the source against the destinations, then stores the report in the database and as
     * {@code reports/<reportId>.json}.
     */
    public IntegrityReport audit(String sourceName, List<String> destinationNames, List<String> collections) {
        IntegrityAuditor auditor = auditor(sourceName);
        List<CollectionHandler> destinations = new ArrayList<>();
        for (String name : destinationNames) {
            destinations.add(handlers.require(name));
        }
        IntegrityReport report = auditor.auditAll(destinations, collections);
        stateStore.saveReport(report);
        Path file = config.reportsRoot().resolve(report.reportId() + ".json");
        try {
            Files.createDirectories(config.reportsRoot());
            Files.writeString(file, Jsons.toJson(report), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to write integrity report: " + file, e);
        }
        return report;
    }

    public List<SyncStateStore.ReportSummary> reportHistory(int limit) {
        return stateStore.listReports(limit);
    }

    /**
     * Repairs the divergence a stored report describes. Mismatches queued for review land in the
     * conflict queue.
     */
    public ReconcileOutcome reconcile(String reportId, ReconcileOptions options) {
        IntegrityReport report = stateStore.loadReport(reportId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown integrity report: " + reportId));
        Reconciler reconciler = new Reconciler(auditor(report.source()), handlers, auditLogger);
        ReconcileOutcome outcome = reconciler.reconcile(report, options);
        for (ReconcileOutcome.Action action : outcome.actions()) {
            for (ConflictEntry conflict : action.queued()) {
                stateStore.enqueueConflict("reconcile", conflict);
            }
        }
        return outcome;
    }

    public ParitySet paritySet(String sourceName, String collection) {
        return auditor(sourceName).paritySet(collection, settings.parityBlockCount());
    }

    public IntegrityAuditor.ParityVerification verifyParity(String sourceName, String destinationName,
                                                            String collection, ParitySet expected) {
        return auditor(sourceName).verifyParity(handlers.require(destinationName), collection, expected);
    }

    public List<SyncStateStore.QueuedConflict> pendingConflicts(String destination, String collection) {
        return stateStore.pendingConflicts(destination, collection);
    }

    public ConflictResolution resolveConflict(String conflictId, ConflictStrategy strategy, String actor) {
        return resolveConflict(conflictId, strategy, actor, SyncProfile.DEFAULT_KEY_FIELD,
                SyncProfile.DEFAULT_TIMESTAMP_FIELD);
    }

    /**
     * Applies a queued conflict with a non-deferring strategy and marks it resolved.
     */
    public ConflictResolution resolveConflict(
            String conflictId,
            ConflictStrategy strategy,
            String actor,
            String keyField,
            String timestampField
    ) {
        if (strategy == null || strategy == ConflictStrategy.MANUAL_REVIEW) {
            throw new IllegalArgumentException("A queued conflict must be resolved with a deciding strategy");
        }
        SyncStateStore.QueuedConflict queued = stateStore.findConflict(conflictId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown conflict: " + conflictId));
        if (!queued.pending()) {
            throw new IllegalStateException("Conflict " + conflictId + " is already " + queued.status());
        }
        ConflictEntry entry = queued.entry();
        CollectionHandler destination = handlers.require(entry.destination());
        ConflictResolver.Resolution resolution = ConflictResolver.resolve(
                Record.of(keyField, entry.sourceRecord()),
                Record.of(keyField, entry.destinationRecord()),
                strategy,
                timestampField
        );
        boolean written = false;
        if (resolution.writes()) {
            if (!destination.connect()) {
                throw new IllegalStateException("destination '" + destination.name() + "' is not reachable");
            }
            try {
                BulkOutcome outcome = destination.writeRecords(entry.collection(), List.of(resolution.record()), true);
                if (outcome.hasErrors()) {
                    throw new IllegalStateException("Failed to apply conflict " + conflictId + ": "
                            + String.join("; ", outcome.errors()));
                }
                written = outcome.count() == 1;
            } finally {
                destination.disconnect();
            }
        }
        stateStore.markResolved(conflictId, strategy);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "conflict.resolve",
                actor,
                "collection/" + entry.collection(),
                resolution.outcome().name().toLowerCase(),
                null,
                Map.of(
                        "conflict_id", conflictId,
                        "key", entry.key(),
                        "destination", entry.destination(),
                        "strategy", strategy.wireName()
                )
        ));
        return new ConflictResolution(conflictId, entry.key(), strategy, resolution.outcome(), written);
    }

    public AuditLogger.ChainVerification verifyAuditChain() {
        return auditLogger.verifyChain();
    }

    private IntegrityAuditor auditor(String sourceName) {
        Set<String> exclusions = settings.checksumExclusions();
        return new IntegrityAuditor(handlers.require(sourceName), exclusions, auditLogger);
    }

    private String loadOrCreateAuditSigningSecret(Path keyFile) {
        try {
            if (keyFile.getParent() != null) {
                Files.createDirectories(keyFile.getParent());
            }
            if (Files.exists(keyFile)) {
                String existing = Files.readString(keyFile, StandardCharsets.UTF_8).trim();
                if (!existing.isBlank()) {
                    return existing;
                }
            }
            byte[] random = new byte[32];
            new SecureRandom().nextBytes(random);
            String generated = Base64.getEncoder().encodeToString(random);
            Files.writeString(keyFile, generated, StandardCharsets.UTF_8);
            return generated;
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit signing secret: " + keyFile, e);
        }
    }

    public record ConflictResolution(
            String conflictId,
            String key,
            ConflictStrategy strategy,
            ConflictResolver.Outcome outcome,
            boolean written
    ) {
    }

    /**
     * Destination runs started by one {@link #runSync} call.
     */
    private static final class RunGroup {
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final AtomicInteger pending;

        private RunGroup(int destinations) {
            this.pending = new AtomicInteger(destinations);
        }
    }
}
