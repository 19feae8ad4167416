package io.syncvault.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeType;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.syncvault.util.Jsons;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A keyed set of fields replicated as a unit.
 *
 * <p>Field values are restricted to the JSON value kinds: string, number, boolean, null, nested
 * object and array. Binary and POJO nodes are rejected so every record has a single well-defined
 * canonical serialization. Field order is preserved but never affects identity or fingerprints.
 */
public final class Record {
    private final String keyField;
    private final ObjectNode fields;

    private Record(String keyField, ObjectNode fields) {
        this.keyField = keyField;
        this.fields = fields;
    }

    public static Record of(String keyField, ObjectNode fields) {
        if (keyField == null || keyField.isBlank()) {
            throw new IllegalArgumentException("keyField must not be blank");
        }
        Objects.requireNonNull(fields, "fields");
        requireSupported(fields, "");
        return new Record(keyField, fields.deepCopy());
    }

    public static Record of(ObjectNode fields) {
        return of(SyncProfile.DEFAULT_KEY_FIELD, fields);
    }

    public static Record fromMap(String keyField, Map<String, ?> fields) {
        ObjectNode node = Jsons.mapper().valueToTree(fields);
        return of(keyField, node);
    }

    public static Record fromMap(Map<String, ?> fields) {
        return fromMap(SyncProfile.DEFAULT_KEY_FIELD, fields);
    }

    public String keyField() {
        return keyField;
    }

    /**
     * Primary key as text. A record without a key field has the empty key.
     */
    public String key() {
        JsonNode value = fields.get(keyField);
        if (value == null || value.isNull()) {
            return "";
        }
        return value.asText("");
    }

    public ObjectNode fields() {
        return fields.deepCopy();
    }

    public JsonNode get(String field) {
        JsonNode value = fields.get(field);
        return value == null ? null : value.deepCopy();
    }

    public boolean has(String field) {
        return fields.has(field);
    }

    public List<String> fieldNames() {
        List<String> out = new ArrayList<>(fields.size());
        fields.fieldNames().forEachRemaining(out::add);
        return out;
    }

    public int size() {
        return fields.size();
    }

    public Record withFields(ObjectNode replacement) {
        return of(keyField, replacement);
    }

    public Record withField(String field, JsonNode value) {
        ObjectNode copy = fields.deepCopy();
        copy.set(field, value);
        return of(keyField, copy);
    }

    public Record withoutField(String field) {
        ObjectNode copy = fields.deepCopy();
        copy.remove(field);
        return new Record(keyField, copy);
    }

    public String toJson() {
        return Jsons.toCompactJson(fields);
    }

    private static void requireSupported(JsonNode node, String path) {
        JsonNodeType type = node.getNodeType();
        switch (type) {
            case STRING, NUMBER, BOOLEAN, NULL -> {
                return;
            }
            case OBJECT -> {
                Iterator<Map.Entry<String, JsonNode>> it = node.fields();
                while (it.hasNext()) {
                    Map.Entry<String, JsonNode> entry = it.next();
                    requireSupported(entry.getValue(), entry.getKey());
                }
            }
            case ARRAY -> {
                for (JsonNode element : node) {
                    requireSupported(element, path);
                }
            }
            default -> throw new IllegalArgumentException(
                    "Unsupported value type " + type + " in field '" + path + "'");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Record other)) {
            return false;
        }
        return keyField.equals(other.keyField) && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(keyField, fields);
    }

    @Override
    public String toString() {
        return "Record{" + keyField + "=" + key() + ", fields=" + fields + "}";
    }
}
