package io.syncvault.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.syncvault.model.Record;
import io.syncvault.model.RecordFilter;
import io.syncvault.model.SyncProfile;
import io.syncvault.util.Jsons;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Stream;

/**
 * Heap-backed store. Collections keep insertion order; a rewrite keeps the position of the
 * replaced record. Reads iterate over a snapshot, so writers never disturb an open cursor.
 */
public class InMemoryCollectionHandler implements CollectionHandler {
    private final String name;
    private final String keyField;
    private final Map<String, StoredCollection> collections = new ConcurrentHashMap<>();
    private volatile boolean reachable = true;
    private volatile boolean connected;

    public InMemoryCollectionHandler(String name) {
        this(name, SyncProfile.DEFAULT_KEY_FIELD);
    }

    public InMemoryCollectionHandler(String name, String keyField) {
        this.name = name;
        this.keyField = keyField;
    }

    @Override
    public String name() {
        return name;
    }

    public void setReachable(boolean reachable) {
        this.reachable = reachable;
    }

    public boolean isConnected() {
        return connected;
    }

    /**
     * Seeds a collection directly, creating it when absent.
     */
    public void put(String collection, List<Record> records) {
        StoredCollection stored = collections.computeIfAbsent(collection, ignored -> new StoredCollection(null));
        synchronized (stored) {
            for (Record record : records) {
                stored.records.put(record.key(), record);
            }
        }
    }

    public List<Record> snapshot(String collection) {
        StoredCollection stored = collections.get(collection);
        if (stored == null) {
            return List.of();
        }
        synchronized (stored) {
            return new ArrayList<>(stored.records.values());
        }
    }

    public void dropCollection(String collection) {
        collections.remove(collection);
    }

    @Override
    public boolean connect() {
        connected = reachable;
        return connected;
    }

    @Override
    public void disconnect() {
        connected = false;
    }

    @Override
    public ConnectionCheck testConnection() {
        if (!reachable) {
            return ConnectionCheck.failed("in-memory store '" + name + "' is marked unreachable");
        }
        return ConnectionCheck.ok("in-memory store '" + name + "' holds " + collections.size() + " collections");
    }

    @Override
    public boolean collectionExists(String collection) {
        requireReachable();
        return collections.containsKey(collection);
    }

    @Override
    public boolean createCollection(String collection, JsonNode schema) {
        requireReachable();
        collections.putIfAbsent(collection, new StoredCollection(schema == null ? null : schema.deepCopy()));
        return true;
    }

    @Override
    public Optional<JsonNode> getSchema(String collection) {
        requireReachable();
        StoredCollection stored = collections.get(collection);
        if (stored == null || stored.schema == null) {
            return Optional.empty();
        }
        return Optional.of(stored.schema.deepCopy());
    }

    @Override
    public Stream<Record> readRecords(String collection, RecordFilter query, List<String> fields, int skip, int limit) {
        requireReachable();
        RecordFilter filter = query == null ? RecordFilter.all() : query;
        Stream<Record> selected = snapshot(collection).stream()
                .filter(filter::matches)
                .skip(Math.max(0, skip));
        if (limit > 0) {
            selected = selected.limit(limit);
        }
        if (fields != null && !fields.isEmpty()) {
            selected = selected.map(record -> project(record, fields));
        }
        return selected;
    }

    @Override
    public BulkOutcome writeRecords(String collection, List<Record> records, boolean preserveKey) {
        requireReachable();
        StoredCollection stored = collections.get(collection);
        if (stored == null) {
            List<String> errors = new ArrayList<>();
            for (Record record : records) {
                errors.add(record.key() + ": collection '" + collection + "' does not exist");
            }
            return new BulkOutcome(0, errors);
        }
        int written = 0;
        List<String> errors = new ArrayList<>();
        synchronized (stored) {
            for (Record record : records) {
                String failure = rejectWrite(collection, record);
                if (failure != null) {
                    errors.add(record.key() + ": " + failure);
                    continue;
                }
                Record toStore = record;
                if (!preserveKey || record.key().isEmpty()) {
                    toStore = record.withField(keyField, TextNode.valueOf(UUID.randomUUID().toString()));
                }
                stored.records.put(toStore.key(), toStore);
                written++;
            }
        }
        return new BulkOutcome(written, errors);
    }

    @Override
    public boolean updateRecord(String collection, String key, Record record) {
        requireReachable();
        StoredCollection stored = collections.get(collection);
        if (stored == null || rejectWrite(collection, record) != null) {
            return false;
        }
        synchronized (stored) {
            if (!stored.records.containsKey(key)) {
                return false;
            }
            stored.records.put(key, record);
            return true;
        }
    }

    @Override
    public BulkOutcome deleteRecords(String collection, Collection<String> keys) {
        requireReachable();
        StoredCollection stored = collections.get(collection);
        if (stored == null) {
            return BulkOutcome.ok(0);
        }
        int deleted = 0;
        List<String> errors = new ArrayList<>();
        synchronized (stored) {
            for (String key : keys) {
                String failure = rejectDelete(collection, key);
                if (failure != null) {
                    errors.add(key + ": " + failure);
                    continue;
                }
                if (stored.records.remove(key) != null) {
                    deleted++;
                }
            }
        }
        return new BulkOutcome(deleted, errors);
    }

    @Override
    public long getRecordCount(String collection, RecordFilter query) {
        requireReachable();
        RecordFilter filter = query == null ? RecordFilter.all() : query;
        return snapshot(collection).stream().filter(filter::matches).count();
    }

    @Override
    public Optional<Record> getRecordByKey(String collection, String key) {
        requireReachable();
        StoredCollection stored = collections.get(collection);
        if (stored == null) {
            return Optional.empty();
        }
        synchronized (stored) {
            return Optional.ofNullable(stored.records.get(key));
        }
    }

    /**
     * Hook for subclasses simulating record-level write failures. Returns a failure message,
     * or {@code null} to accept the write.
     */
    protected String rejectWrite(String collection, Record record) {
        return null;
    }

    /**
     * Hook for subclasses simulating record-level delete failures.
     */
    protected String rejectDelete(String collection, String key) {
        return null;
    }

    private void requireReachable() {
        if (!reachable) {
            throw new HandlerException(name, "store '" + name + "' is unreachable");
        }
    }

    private Record project(Record record, List<String> fields) {
        ObjectNode out = Jsons.mapper().createObjectNode();
        JsonNode key = record.get(keyField);
        if (key != null) {
            out.set(keyField, key);
        }
        for (String field : fields) {
            JsonNode value = record.get(field);
            if (value != null) {
                out.set(field, value);
            }
        }
        return Record.of(record.keyField(), out);
    }

    private static final class StoredCollection {
        private final JsonNode schema;
        private final LinkedHashMap<String, Record> records = new LinkedHashMap<>();

        private StoredCollection(JsonNode schema) {
            this.schema = schema;
        }
    }
}
