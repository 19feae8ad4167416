package io.syncvault.integrity;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.syncvault.model.Record;
import io.syncvault.model.SyncProfile;
import io.syncvault.util.Hashing;
import io.syncvault.util.Jsons;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Per-record fingerprints.
 *
 * <p>A record is reduced to a canonical JSON form before hashing: excluded fields are dropped,
 * object keys are sorted at every depth, null-valued object fields are removed (so a null field
 * and an absent field agree) and numbers are normalized to an exact decimal without trailing zeros (so
 * {@code 1} and {@code 1.0} agree). The digest is SHA-256 over the UTF-8 bytes of that form,
 * rendered as 64 lowercase hex characters.
 */
public final class RecordChecksums {
    public static final int HEX_LENGTH = 64;

    private static final JsonNodeFactory NODES = JsonNodeFactory.withExactBigDecimals(true);

    private RecordChecksums() {
    }

    public static String checksum(Record record) {
        return checksum(record, SyncProfile.DEFAULT_CHECKSUM_EXCLUSIONS);
    }

    public static String checksum(Record record, Set<String> exclude) {
        return Hashing.sha256Hex(canonicalBytes(record, exclude));
    }

    public static boolean sameContent(Record left, Record right, Set<String> exclude) {
        return checksum(left, exclude).equals(checksum(right, exclude));
    }

    public static byte[] canonicalBytes(Record record, Set<String> exclude) {
        return canonicalJson(record, exclude).getBytes(StandardCharsets.UTF_8);
    }

    public static String canonicalJson(Record record, Set<String> exclude) {
        Set<String> excluded = exclude == null ? Set.of() : exclude;
        ObjectNode fields = record.fields();
        ObjectNode filtered = NODES.objectNode();
        Iterator<Map.Entry<String, JsonNode>> it = fields.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            if (!excluded.contains(entry.getKey())) {
                filtered.set(entry.getKey(), entry.getValue());
            }
        }
        try {
            return Jsons.compactMapper().writeValueAsString(canonicalize(filtered));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Record is not serializable: " + record.key(), e);
        }
    }

    static JsonNode canonicalize(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            node.fieldNames().forEachRemaining(names::add);
            Collections.sort(names);
            ObjectNode out = NODES.objectNode();
            for (String name : names) {
                JsonNode value = node.get(name);
                if (value == null || value.isNull()) {
                    continue;
                }
                out.set(name, canonicalize(value));
            }
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = NODES.arrayNode();
            for (JsonNode element : node) {
                out.add(canonicalize(element));
            }
            return out;
        }
        if (node.isNumber()) {
            BigDecimal normalized = node.decimalValue().stripTrailingZeros();
            if (normalized.signum() == 0) {
                normalized = BigDecimal.ZERO;
            }
            return NODES.numberNode(normalized);
        }
        return node;
    }
}
