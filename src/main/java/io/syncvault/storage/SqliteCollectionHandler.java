package io.syncvault.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.syncvault.handler.BulkOutcome;
import io.syncvault.handler.CollectionHandler;
import io.syncvault.handler.ConnectionCheck;
import io.syncvault.handler.HandlerException;
import io.syncvault.model.Record;
import io.syncvault.model.RecordFilter;
import io.syncvault.model.SyncProfile;
import io.syncvault.util.Jsons;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Collection store kept in the vault's SQLite file. Several handlers can share one database;
 * rows are partitioned by handler name. Records are stored as their JSON body and read back in
 * insertion order, which an upsert does not disturb.
 */
public final class SqliteCollectionHandler implements CollectionHandler {
    private final Database database;
    private final String name;
    private final String keyField;
    private volatile boolean connected;

    public SqliteCollectionHandler(Database database, String name) {
        this(database, name, SyncProfile.DEFAULT_KEY_FIELD);
    }

    public SqliteCollectionHandler(Database database, String name, String keyField) {
        this.database = database;
        this.name = name;
        this.keyField = keyField;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public boolean connect() {
        connected = testConnection().ok();
        return connected;
    }

    @Override
    public void disconnect() {
        connected = false;
    }

    public boolean isConnected() {
        return connected;
    }

    @Override
    public ConnectionCheck testConnection() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM vault_collections WHERE handler=?")) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                long count = rs.next() ? rs.getLong(1) : 0L;
                return ConnectionCheck.ok("sqlite store '" + name + "' holds " + count + " collections");
            }
        } catch (SQLException e) {
            return ConnectionCheck.failed("sqlite store '" + name + "' unavailable: " + e.getMessage());
        }
    }

    @Override
    public boolean collectionExists(String collection) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT 1 FROM vault_collections WHERE handler=? AND name=? LIMIT 1")) {
            ps.setString(1, name);
            ps.setString(2, collection);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new HandlerException(name, "Failed to look up collection " + collection, e);
        }
    }

    @Override
    public boolean createCollection(String collection, JsonNode schema) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT OR IGNORE INTO vault_collections(handler,name,schema_json,created_at_ms) VALUES(?,?,?,?)")) {
            ps.setString(1, name);
            ps.setString(2, collection);
            ps.setString(3, schema == null || schema.isNull() ? null : Jsons.toCompactJson(schema));
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
            return true;
        } catch (SQLException e) {
            throw new HandlerException(name, "Failed to create collection " + collection, e);
        }
    }

    @Override
    public Optional<JsonNode> getSchema(String collection) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT schema_json FROM vault_collections WHERE handler=? AND name=?")) {
            ps.setString(1, name);
            ps.setString(2, collection);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next() || rs.getString(1) == null) {
                    return Optional.empty();
                }
                return Optional.of(Jsons.mapper().readTree(rs.getString(1)));
            }
        } catch (SQLException | IOException e) {
            throw new HandlerException(name, "Failed to read schema of " + collection, e);
        }
    }

    /**
     * Filters are evaluated after loading; {@code skip} and {@code limit} apply to the filtered
     * sequence.
     */
    @Override
    public Stream<Record> readRecords(String collection, RecordFilter query, List<String> fields, int skip, int limit) {
        RecordFilter filter = query == null ? RecordFilter.all() : query;
        List<Record> loaded = new ArrayList<>();
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT body_json FROM vault_records WHERE handler=? AND collection=? ORDER BY rowid")) {
            ps.setString(1, name);
            ps.setString(2, collection);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    loaded.add(decode(rs.getString(1)));
                }
            }
        } catch (SQLException | IOException e) {
            throw new HandlerException(name, "Failed to read records of " + collection, e);
        }
        Stream<Record> selected = loaded.stream().filter(filter::matches).skip(Math.max(0, skip));
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
        if (!collectionExists(collection)) {
            List<String> errors = new ArrayList<>();
            for (Record record : records) {
                errors.add(record.key() + ": collection '" + collection + "' does not exist");
            }
            return new BulkOutcome(0, errors);
        }
        long now = Instant.now().toEpochMilli();
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO vault_records(handler,collection,record_key,body_json,updated_at_ms) VALUES(?,?,?,?,?)
                    ON CONFLICT(handler,collection,record_key) DO UPDATE SET body_json=excluded.body_json,
                        updated_at_ms=excluded.updated_at_ms
                    """)) {
                for (Record record : records) {
                    Record toStore = record;
                    if (!preserveKey || record.key().isEmpty()) {
                        toStore = record.withField(keyField, TextNode.valueOf(UUID.randomUUID().toString()));
                    }
                    ps.setString(1, name);
                    ps.setString(2, collection);
                    ps.setString(3, toStore.key());
                    ps.setString(4, toStore.toJson());
                    ps.setLong(5, now);
                    ps.addBatch();
                }
                ps.executeBatch();
                c.commit();
                return BulkOutcome.ok(records.size());
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new HandlerException(name, "Failed to write records to " + collection, e);
        }
    }

    @Override
    public boolean updateRecord(String collection, String key, Record record) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "UPDATE vault_records SET body_json=?, updated_at_ms=? WHERE handler=? AND collection=? AND record_key=?")) {
            ps.setString(1, record.toJson());
            ps.setLong(2, Instant.now().toEpochMilli());
            ps.setString(3, name);
            ps.setString(4, collection);
            ps.setString(5, key);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new HandlerException(name, "Failed to update record " + key + " in " + collection, e);
        }
    }

    @Override
    public BulkOutcome deleteRecords(String collection, Collection<String> keys) {
        int deleted = 0;
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(
                    "DELETE FROM vault_records WHERE handler=? AND collection=? AND record_key=?")) {
                for (String key : keys) {
                    ps.setString(1, name);
                    ps.setString(2, collection);
                    ps.setString(3, key);
                    deleted += ps.executeUpdate();
                }
                c.commit();
                return BulkOutcome.ok(deleted);
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new HandlerException(name, "Failed to delete records from " + collection, e);
        }
    }

    @Override
    public long getRecordCount(String collection, RecordFilter query) {
        if (query == null || query.isEmpty()) {
            try (Connection c = database.openConnection();
                 PreparedStatement ps = c.prepareStatement(
                         "SELECT COUNT(*) FROM vault_records WHERE handler=? AND collection=?")) {
                ps.setString(1, name);
                ps.setString(2, collection);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? rs.getLong(1) : 0L;
                }
            } catch (SQLException e) {
                throw new HandlerException(name, "Failed to count records of " + collection, e);
            }
        }
        try (Stream<Record> records = readRecords(collection, query)) {
            return records.count();
        }
    }

    @Override
    public Optional<Record> getRecordByKey(String collection, String key) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT body_json FROM vault_records WHERE handler=? AND collection=? AND record_key=?")) {
            ps.setString(1, name);
            ps.setString(2, collection);
            ps.setString(3, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(decode(rs.getString(1))) : Optional.empty();
            }
        } catch (SQLException | IOException e) {
            throw new HandlerException(name, "Failed to read record " + key + " from " + collection, e);
        }
    }

    private Record decode(String json) throws IOException {
        return Record.of(keyField, (ObjectNode) Jsons.mapper().readTree(json));
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
        return Record.of(keyField, out);
    }
}
