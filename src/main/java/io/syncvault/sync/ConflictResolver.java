package io.syncvault.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.syncvault.model.ConflictStrategy;
import io.syncvault.model.Record;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * Decides what a destination should hold when source and destination disagree on one key.
 * Resolution is pure: the resolver never touches a store, and {@link ConflictStrategy#MANUAL_REVIEW}
 * only reports that the pair must be queued.
 */
public final class ConflictResolver {
    private ConflictResolver() {
    }

    public enum Outcome {
        WRITE_SOURCE,
        WRITE_MERGED,
        KEEP_DESTINATION,
        QUEUED
    }

    public record Resolution(Outcome outcome, Record record) {
        public boolean writes() {
            return outcome == Outcome.WRITE_SOURCE || outcome == Outcome.WRITE_MERGED;
        }

        static Resolution queued() {
            return new Resolution(Outcome.QUEUED, null);
        }
    }

    public static Resolution resolve(
            Record source,
            Record destination,
            ConflictStrategy strategy,
            String timestampField
    ) {
        return switch (strategy) {
            case SOURCE_WINS -> new Resolution(Outcome.WRITE_SOURCE, source);
            case DESTINATION_WINS -> new Resolution(Outcome.KEEP_DESTINATION, destination);
            case NEWEST_WINS -> {
                BigDecimal sourceTime = timestampOf(source, timestampField);
                BigDecimal destinationTime = timestampOf(destination, timestampField);
                yield sourceTime.compareTo(destinationTime) >= 0
                        ? new Resolution(Outcome.WRITE_SOURCE, source)
                        : new Resolution(Outcome.KEEP_DESTINATION, destination);
            }
            case MERGE -> new Resolution(Outcome.WRITE_MERGED, merge(source, destination));
            case MANUAL_REVIEW -> Resolution.queued();
        };
    }

    /**
     * Destination fields overlaid by source fields. Nested objects and lists are replaced as a
     * whole, not merged element-wise.
     */
    public static Record merge(Record source, Record destination) {
        ObjectNode merged = destination.fields();
        merged.setAll(source.fields());
        return Record.of(source.keyField(), merged);
    }

    /**
     * Numeric value of the timestamp field. Numbers and numeric strings are read as-is, ISO-8601
     * instants as epoch seconds; anything else, including a missing field, is 0.
     */
    static BigDecimal timestampOf(Record record, String field) {
        JsonNode value = record.get(field);
        if (value == null || value.isNull()) {
            return BigDecimal.ZERO;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            try {
                return new BigDecimal(text);
            } catch (NumberFormatException ignored) {
                // fall through to ISO-8601
            }
            try {
                Instant instant = Instant.parse(text);
                return BigDecimal.valueOf(instant.getEpochSecond())
                        .add(BigDecimal.valueOf(instant.getNano(), 9));
            } catch (DateTimeParseException ignored) {
                return BigDecimal.ZERO;
            }
        }
        return BigDecimal.ZERO;
    }
}
