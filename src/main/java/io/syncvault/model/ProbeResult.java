package io.syncvault.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Fingerprint comparison of one collection between the source and one destination.
 * Key lists are populated by a full audit and left empty by a plain probe.
 */
public record ProbeResult(
        String destination,
        String collection,
        ProbeStatus status,
        long sourceCount,
        long destinationCount,
        String sourceFingerprint,
        String destinationFingerprint,
        List<String> missingKeys,
        List<String> extraKeys,
        List<String> mismatchedKeys,
        long latencyMs,
        String errorMessage
) {
    static final int SHORT_FINGERPRINT_CHARS = 16;

    public ProbeResult {
        sourceFingerprint = sourceFingerprint == null ? "" : sourceFingerprint;
        destinationFingerprint = destinationFingerprint == null ? "" : destinationFingerprint;
        missingKeys = missingKeys == null ? List.of() : List.copyOf(missingKeys);
        extraKeys = extraKeys == null ? List.of() : List.copyOf(extraKeys);
        mismatchedKeys = mismatchedKeys == null ? List.of() : List.copyOf(mismatchedKeys);
        errorMessage = errorMessage == null ? "" : errorMessage;
    }

    public static ProbeResult failed(String destination, String collection, ProbeStatus status,
                                     long latencyMs, String errorMessage) {
        return new ProbeResult(destination, collection, status, 0L, 0L, "", "",
                List.of(), List.of(), List.of(), latencyMs, errorMessage);
    }

    public ProbeResult withKeyDifferences(List<String> missing, List<String> extra, List<String> mismatched) {
        return new ProbeResult(destination, collection, status, sourceCount, destinationCount,
                sourceFingerprint, destinationFingerprint, missing, extra, mismatched, latencyMs, errorMessage);
    }

    @JsonProperty(value = "sourceFingerprintShort", access = JsonProperty.Access.READ_ONLY)
    public String sourceFingerprintShort() {
        return truncate(sourceFingerprint);
    }

    @JsonProperty(value = "destinationFingerprintShort", access = JsonProperty.Access.READ_ONLY)
    public String destinationFingerprintShort() {
        return truncate(destinationFingerprint);
    }

    static String truncate(String fingerprint) {
        if (fingerprint == null || fingerprint.length() <= SHORT_FINGERPRINT_CHARS) {
            return fingerprint == null ? "" : fingerprint;
        }
        return fingerprint.substring(0, SHORT_FINGERPRINT_CHARS) + "...";
    }
}
