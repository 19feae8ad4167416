package io.syncvault.handler;

import com.fasterxml.jackson.databind.JsonNode;
import io.syncvault.model.Record;
import io.syncvault.model.RecordFilter;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Read/write contract a store must satisfy to take part in replication, either as the source or
 * as a destination. The engine never inspects the concrete type behind this interface.
 *
 * <p>Implementations may report transport failures by returning {@code false} or error lists,
 * or by throwing {@link HandlerException}.
 */
public interface CollectionHandler {
    String name();

    boolean connect();

    void disconnect();

    ConnectionCheck testConnection();

    boolean collectionExists(String collection);

    boolean createCollection(String collection, JsonNode schema);

    Optional<JsonNode> getSchema(String collection);

    /**
     * Lazily reads the records of a collection. Each call starts an independent cursor with a
     * stable iteration order, so concurrent callers never share position. The returned stream
     * must be closed.
     *
     * @param fields projection, or an empty list for all fields
     * @param limit  maximum number of records, 0 for no limit
     */
    Stream<Record> readRecords(String collection, RecordFilter query, List<String> fields, int skip, int limit);

    default Stream<Record> readRecords(String collection, RecordFilter query) {
        return readRecords(collection, query, List.of(), 0, 0);
    }

    default Stream<Record> readRecords(String collection) {
        return readRecords(collection, RecordFilter.all());
    }

    /**
     * Writes each record as a whole, replacing any record with the same key.
     *
     * @param preserveKey keep the incoming key; when false the store may assign a new one
     */
    BulkOutcome writeRecords(String collection, List<Record> records, boolean preserveKey);

    boolean updateRecord(String collection, String key, Record record);

    BulkOutcome deleteRecords(String collection, Collection<String> keys);

    long getRecordCount(String collection, RecordFilter query);

    default long getRecordCount(String collection) {
        return getRecordCount(collection, RecordFilter.all());
    }

    Optional<Record> getRecordByKey(String collection, String key);
}
