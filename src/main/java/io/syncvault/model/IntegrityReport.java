package io.syncvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of auditing one source against a set of destinations and collections.
 */
public record IntegrityReport(
        String reportId,
        Instant generatedAt,
        String source,
        Map<String, String> sourceFingerprints,
        Map<String, DestinationReport> destinations,
        OverallStatus overallStatus,
        int totalCollections,
        int collectionsInSync,
        int collectionsMismatched
) {
    public IntegrityReport {
        sourceFingerprints = sourceFingerprints == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(sourceFingerprints));
        destinations = destinations == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(destinations));
    }

    public static IntegrityReport of(
            String reportId,
            String source,
            Map<String, String> sourceFingerprints,
            List<ProbeResult> probes
    ) {
        Map<String, List<ProbeResult>> grouped = new LinkedHashMap<>();
        for (ProbeResult probe : probes) {
            grouped.computeIfAbsent(probe.destination(), ignored -> new ArrayList<>()).add(probe);
        }
        Map<String, DestinationReport> destinations = new LinkedHashMap<>();
        int total = 0;
        int inSync = 0;
        int mismatched = 0;
        boolean anyError = false;
        for (Map.Entry<String, List<ProbeResult>> entry : grouped.entrySet()) {
            Map<String, ProbeResult> collections = new LinkedHashMap<>();
            boolean destinationOk = true;
            boolean destinationError = false;
            for (ProbeResult probe : entry.getValue()) {
                collections.put(probe.collection(), probe);
                total++;
                if (probe.status() == ProbeStatus.OK) {
                    inSync++;
                } else if (probe.status().repairable()) {
                    mismatched++;
                    destinationOk = false;
                } else {
                    anyError = true;
                    destinationOk = false;
                    destinationError = true;
                }
            }
            OverallStatus status = destinationOk
                    ? OverallStatus.OK
                    : destinationError ? OverallStatus.ERROR : OverallStatus.DEGRADED;
            destinations.put(entry.getKey(), new DestinationReport(status, collections));
        }
        OverallStatus overall;
        if (total == 0) {
            overall = OverallStatus.UNKNOWN;
        } else if (inSync == total) {
            overall = OverallStatus.OK;
        } else if (anyError) {
            overall = OverallStatus.ERROR;
        } else {
            overall = OverallStatus.DEGRADED;
        }
        return new IntegrityReport(reportId, Instant.now(), source, sourceFingerprints, destinations,
                overall, total, inSync, mismatched);
    }

    public List<ProbeResult> probes() {
        List<ProbeResult> out = new ArrayList<>();
        for (DestinationReport destination : destinations.values()) {
            out.addAll(destination.collections().values());
        }
        return out;
    }

    public ProbeResult probe(String destination, String collection) {
        DestinationReport report = destinations.get(destination);
        return report == null ? null : report.collections().get(collection);
    }

    public record DestinationReport(OverallStatus status, Map<String, ProbeResult> collections) {
        public DestinationReport {
            collections = collections == null
                    ? Map.of()
                    : Collections.unmodifiableMap(new LinkedHashMap<>(collections));
        }
    }

    public enum OverallStatus {
        OK("ok"),
        DEGRADED("degraded"),
        ERROR("error"),
        UNKNOWN("unknown");

        private final String wireName;

        OverallStatus(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }

        @JsonCreator
        public static OverallStatus fromString(String raw) {
            for (OverallStatus value : values()) {
                if (value.wireName.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                    return value;
                }
            }
            return UNKNOWN;
        }
    }
}
