package io.syncvault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.syncvault.util.Jsons;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Conjunction of field equality constraints applied when records are selected from a source.
 * An empty filter selects every record.
 */
public final class RecordFilter {
    private static final RecordFilter EMPTY = new RecordFilter(Map.of());

    private final Map<String, JsonNode> equalities;

    private RecordFilter(Map<String, JsonNode> equalities) {
        this.equalities = equalities;
    }

    public static RecordFilter all() {
        return EMPTY;
    }

    @JsonCreator
    public static RecordFilter of(Map<String, ?> equalities) {
        if (equalities == null || equalities.isEmpty()) {
            return EMPTY;
        }
        Map<String, JsonNode> out = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : equalities.entrySet()) {
            Object raw = entry.getValue();
            JsonNode value = raw instanceof JsonNode node ? node.deepCopy() : Jsons.mapper().valueToTree(raw);
            out.put(entry.getKey(), value == null ? NullNode.getInstance() : value);
        }
        return new RecordFilter(Collections.unmodifiableMap(out));
    }

    public static RecordFilter eq(String field, Object value) {
        return of(Map.of(field, value));
    }

    @JsonValue
    public Map<String, JsonNode> equalities() {
        return equalities;
    }

    public boolean isEmpty() {
        return equalities.isEmpty();
    }

    public boolean matches(Record record) {
        for (Map.Entry<String, JsonNode> entry : equalities.entrySet()) {
            JsonNode actual = record.get(entry.getKey());
            JsonNode expected = entry.getValue();
            if (actual == null) {
                if (!expected.isNull()) {
                    return false;
                }
                continue;
            }
            if (!sameValue(actual, expected)) {
                return false;
            }
        }
        return true;
    }

    private static boolean sameValue(JsonNode actual, JsonNode expected) {
        if (actual.isNumber() && expected.isNumber()) {
            return actual.decimalValue().compareTo(expected.decimalValue()) == 0;
        }
        return actual.equals(expected);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof RecordFilter other && equalities.equals(other.equalities);
    }

    @Override
    public int hashCode() {
        return equalities.hashCode();
    }

    @Override
    public String toString() {
        return "RecordFilter" + equalities;
    }
}
