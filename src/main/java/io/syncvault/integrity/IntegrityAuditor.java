package io.syncvault.integrity;

import io.syncvault.handler.CollectionHandler;
import io.syncvault.model.IntegrityReport;
import io.syncvault.model.ProbeResult;
import io.syncvault.model.ProbeStatus;
import io.syncvault.model.Record;
import io.syncvault.model.SyncProfile;
import io.syncvault.observability.AuditLogger;
import io.syncvault.observability.RunIds;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Compares a source against its replicas by fingerprint. The auditor only reads: repairs are
 * planned and applied by {@link Reconciler}.
 *
 * <p>Probe classification:
 * <ul>
 *     <li>{@code error}: the source cannot be read or does not hold the collection</li>
 *     <li>{@code unreachable}: the destination does not connect</li>
 *     <li>{@code missing_collection}: the destination connects but lacks the collection</li>
 *     <li>{@code mismatch}: counts or Merkle roots differ</li>
 *     <li>{@code ok}: counts and roots agree</li>
 * </ul>
 */
public final class IntegrityAuditor {
    private static final String ACTOR = "integrity-auditor";

    private final CollectionHandler source;
    private final Set<String> checksumExclusions;
    private final AuditLogger auditLogger;

    public IntegrityAuditor(CollectionHandler source) {
        this(source, SyncProfile.DEFAULT_CHECKSUM_EXCLUSIONS, null);
    }

    public IntegrityAuditor(CollectionHandler source, Set<String> checksumExclusions, AuditLogger auditLogger) {
        this.source = source;
        this.checksumExclusions = checksumExclusions == null
                ? SyncProfile.DEFAULT_CHECKSUM_EXCLUSIONS
                : Set.copyOf(checksumExclusions);
        this.auditLogger = auditLogger;
    }

    public CollectionHandler source() {
        return source;
    }

    public Set<String> checksumExclusions() {
        return checksumExclusions;
    }

    /**
     * Fingerprint comparison of one collection, without key-level differences.
     */
    public ProbeResult probe(CollectionHandler destination, String collection) {
        long startedNs = System.nanoTime();
        SourceSide sourceSide = readSource(collection);
        ProbeResult result;
        if (sourceSide.error() != null) {
            result = ProbeResult.failed(destination.name(), collection, ProbeStatus.ERROR,
                    elapsedMs(startedNs), sourceSide.error());
        } else if (!connectQuietly(destination)) {
            result = ProbeResult.failed(destination.name(), collection, ProbeStatus.UNREACHABLE,
                    elapsedMs(startedNs), "Destination '" + destination.name() + "' is not reachable");
        } else {
            try {
                result = compare(destination, collection, sourceSide.fingerprint(), startedNs, false);
            } finally {
                disconnect(destination);
            }
        }
        audit("integrity.probe", result.status().wireName(), null, destination.name() + "/" + collection, Map.of(
                "source_count", result.sourceCount(),
                "destination_count", result.destinationCount(),
                "latency_ms", result.latencyMs()
        ));
        return result;
    }

    /**
     * Probes every destination for every collection and records which keys are missing,
     * extra or different at each destination. Each source collection is fingerprinted once.
     */
    public IntegrityReport auditAll(List<CollectionHandler> destinations, List<String> collections) {
        String reportId = RunIds.newReportId();
        Map<String, SourceSide> sources = new LinkedHashMap<>();
        for (String collection : collections) {
            sources.put(collection, readSource(collection));
        }
        Map<String, String> sourceFingerprints = new LinkedHashMap<>();
        for (Map.Entry<String, SourceSide> entry : sources.entrySet()) {
            if (entry.getValue().fingerprint() != null) {
                sourceFingerprints.put(entry.getKey(), entry.getValue().fingerprint().root());
            }
        }
        List<ProbeResult> probes = new ArrayList<>();
        for (CollectionHandler destination : destinations) {
            long connectStartedNs = System.nanoTime();
            boolean reachable = connectQuietly(destination);
            try {
                for (String collection : collections) {
                    long startedNs = System.nanoTime();
                    SourceSide sourceSide = sources.get(collection);
                    if (sourceSide.error() != null) {
                        probes.add(ProbeResult.failed(destination.name(), collection, ProbeStatus.ERROR,
                                elapsedMs(startedNs), sourceSide.error()));
                    } else if (!reachable) {
                        probes.add(ProbeResult.failed(destination.name(), collection, ProbeStatus.UNREACHABLE,
                                elapsedMs(connectStartedNs),
                                "Destination '" + destination.name() + "' is not reachable"));
                    } else {
                        probes.add(compare(destination, collection, sourceSide.fingerprint(), startedNs, true));
                    }
                }
            } finally {
                if (reachable) {
                    disconnect(destination);
                }
            }
        }
        IntegrityReport report = IntegrityReport.of(reportId, source.name(), sourceFingerprints, probes);
        audit("integrity.audit", report.overallStatus().wireName(), reportId, "source/" + source.name(), Map.of(
                "destinations", destinations.size(),
                "collections", collections.size(),
                "in_sync", report.collectionsInSync(),
                "mismatched", report.collectionsMismatched()
        ));
        return report;
    }

    /**
     * Parity data of a source collection, to be kept next to a replica and checked later with
     * {@link #verifyParity}.
     */
    public ParitySet paritySet(String collection, int blockCount) {
        return ParitySet.build(collection, readAll(source, collection), blockCount, checksumExclusions);
    }

    public ParityVerification verifyParity(CollectionHandler destination, String collection, ParitySet expected) {
        List<byte[]> blocks = ParitySet.blocks(readAll(destination, collection), expected.blockCount(),
                checksumExclusions);
        List<Integer> failed = expected.failedBlocks(blocks);
        return new ParityVerification(destination.name(), collection, failed.isEmpty(), failed, failed.size() == 1);
    }

    /**
     * Rebuilds the records of one diverged block from the destination's intact blocks and the
     * parity. Rebuilt records carry canonical content: excluded fields and null fields are gone.
     *
     * @throws IllegalStateException when more than one block diverged
     */
    public List<Record> recoverBlock(CollectionHandler destination, String collection, ParitySet expected,
                                     int blockIndex, String keyField) {
        List<byte[]> blocks = ParitySet.blocks(readAll(destination, collection), expected.blockCount(),
                checksumExclusions);
        return ParitySet.decodeBlock(expected.recover(blocks, blockIndex), keyField);
    }

    private ProbeResult compare(
            CollectionHandler destination,
            String collection,
            CollectionFingerprint sourceFingerprint,
            long startedNs,
            boolean withKeys
    ) {
        try {
            if (!destination.collectionExists(collection)) {
                CollectionFingerprint empty = CollectionFingerprint.empty(collection);
                ProbeResult missing = new ProbeResult(destination.name(), collection, ProbeStatus.MISSING_COLLECTION,
                        sourceFingerprint.count(), 0L, sourceFingerprint.root(), empty.root(),
                        List.of(), List.of(), List.of(), elapsedMs(startedNs),
                        "Collection '" + collection + "' does not exist at destination");
                return withKeys
                        ? missing.withKeyDifferences(new ArrayList<>(sourceFingerprint.checksumsByKey().keySet()),
                        List.of(), List.of())
                        : missing;
            }
            CollectionFingerprint replica = CollectionFingerprint.read(destination, collection, checksumExclusions);
            ProbeStatus status = sourceFingerprint.matches(replica) ? ProbeStatus.OK : ProbeStatus.MISMATCH;
            ProbeResult result = new ProbeResult(destination.name(), collection, status,
                    sourceFingerprint.count(), replica.count(), sourceFingerprint.root(), replica.root(),
                    List.of(), List.of(), List.of(), elapsedMs(startedNs), null);
            if (!withKeys || status == ProbeStatus.OK) {
                return result;
            }
            CollectionFingerprint.KeyDifferences diff = sourceFingerprint.diff(replica);
            return result.withKeyDifferences(diff.missing(), diff.extra(), diff.mismatched());
        } catch (RuntimeException e) {
            return ProbeResult.failed(destination.name(), collection, ProbeStatus.ERROR, elapsedMs(startedNs),
                    "Failed to read destination: " + e.getMessage());
        }
    }

    private SourceSide readSource(String collection) {
        if (!connectQuietly(source)) {
            return new SourceSide(null, "Source '" + source.name() + "' is not reachable");
        }
        try {
            if (!source.collectionExists(collection)) {
                return new SourceSide(null, "Source collection '" + collection + "' not found");
            }
            return new SourceSide(CollectionFingerprint.read(source, collection, checksumExclusions), null);
        } catch (RuntimeException e) {
            return new SourceSide(null, "Failed to read source collection '" + collection + "': " + e.getMessage());
        } finally {
            disconnect(source);
        }
    }

    private static List<Record> readAll(CollectionHandler handler, String collection) {
        try (Stream<Record> records = handler.readRecords(collection)) {
            return records.toList();
        }
    }

    private boolean connectQuietly(CollectionHandler handler) {
        try {
            return handler.connect();
        } catch (RuntimeException e) {
            audit("integrity.connect", "failed", null, "handler/" + handler.name(),
                    Map.of("error", String.valueOf(e.getMessage())));
            return false;
        }
    }

    private void disconnect(CollectionHandler handler) {
        try {
            handler.disconnect();
        } catch (RuntimeException e) {
            audit("integrity.disconnect", "failed", null, "handler/" + handler.name(),
                    Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    private static long elapsedMs(long startedNs) {
        return (System.nanoTime() - startedNs) / 1_000_000L;
    }

    private void audit(String action, String result, String runId, String resource, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        auditLogger.log(AuditLogger.AuditEvent.of(action, ACTOR, resource, result, runId, details));
    }

    private record SourceSide(CollectionFingerprint fingerprint, String error) {
    }

    /**
     * Block-level parity check of one replica collection.
     *
     * @param recoverable exactly one block diverged, so it can be rebuilt from the others
     */
    public record ParityVerification(
            String destination,
            String collection,
            boolean intact,
            List<Integer> failedBlocks,
            boolean recoverable
    ) {
        public ParityVerification {
            failedBlocks = List.copyOf(failedBlocks);
        }
    }
}
