package io.syncvault.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.syncvault.model.Record;
import io.syncvault.model.SyncProfile;
import io.syncvault.util.Jsons;

import java.util.Iterator;
import java.util.Map;

/**
 * Shapes source records for a destination. Selection ({@link #selects}) runs before
 * {@link #transform}: the filter always sees source field names, never mapped ones.
 */
public final class RecordTransformer {
    private RecordTransformer() {
    }

    public static boolean selects(Record record, SyncProfile profile) {
        return profile.filter().matches(record);
    }

    /**
     * Drops excluded fields, then renames the remaining ones. The key field is neither dropped
     * nor renamed. When a rename targets a name that already exists, the renamed value wins.
     */
    public static Record transform(Record record, SyncProfile profile) {
        if (profile.fieldExclusions().isEmpty() && profile.fieldMappings().isEmpty()) {
            return record;
        }
        String keyField = profile.keyField();
        ObjectNode source = record.fields();
        ObjectNode passthrough = Jsons.mapper().createObjectNode();
        ObjectNode renamed = Jsons.mapper().createObjectNode();
        Iterator<Map.Entry<String, JsonNode>> it = source.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            String field = entry.getKey();
            if (field.equals(keyField)) {
                passthrough.set(field, entry.getValue());
                continue;
            }
            if (profile.fieldExclusions().contains(field)) {
                continue;
            }
            String target = profile.fieldMappings().get(field);
            if (target == null || target.isBlank() || target.equals(field)) {
                passthrough.set(field, entry.getValue());
            } else {
                renamed.set(target, entry.getValue());
            }
        }
        if (renamed.has(keyField)) {
            renamed.remove(keyField);
        }
        passthrough.setAll(renamed);
        return Record.of(record.keyField(), passthrough);
    }
}
