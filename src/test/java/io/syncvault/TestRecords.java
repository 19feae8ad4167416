package io.syncvault;

import io.syncvault.model.Record;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class TestRecords {
    private TestRecords() {
    }

    /**
     * Record with key {@code _key} and the given field/value pairs, in that order.
     */
    public static Record record(String key, Object... fieldsAndValues) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put("_key", key);
        for (int i = 0; i < fieldsAndValues.length; i += 2) {
            fields.put((String) fieldsAndValues[i], fieldsAndValues[i + 1]);
        }
        return Record.fromMap(fields);
    }

    /**
     * {@code rec-1 .. rec-n}, each with a name and a numeric value.
     */
    public static List<Record> numbered(String prefix, int count) {
        List<Record> out = new ArrayList<>(count);
        for (int i = 1; i <= count; i++) {
            out.add(record(prefix + "-" + i, "name", "item " + i, "value", i));
        }
        return out;
    }
}
