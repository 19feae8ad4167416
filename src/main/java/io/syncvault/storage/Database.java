package io.syncvault.storage;

import io.syncvault.config.SyncVaultConfig;
import io.syncvault.util.Hashing;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The vault's SQLite file. {@link #init()} is idempotent: it creates the data directories and
 * base tables, applies any pending versioned migration and switches the file to WAL.
 */
public final class Database {
    private static final String MIGRATION_SEED = "syncvault.schema.migration.v1";

    private static final List<String> TABLES = List.of(
            """
            CREATE TABLE IF NOT EXISTS vault_collections (
                handler TEXT NOT NULL,
                name TEXT NOT NULL,
                schema_json TEXT,
                created_at_ms INTEGER NOT NULL,
                PRIMARY KEY(handler, name)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS vault_records (
                handler TEXT NOT NULL,
                collection TEXT NOT NULL,
                record_key TEXT NOT NULL,
                body_json TEXT NOT NULL,
                updated_at_ms INTEGER NOT NULL,
                PRIMARY KEY(handler, collection, record_key),
                FOREIGN KEY(handler, collection) REFERENCES vault_collections(handler, name)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS sync_checkpoints (
                profile TEXT NOT NULL,
                destination TEXT NOT NULL,
                collection TEXT NOT NULL,
                batch_index INTEGER NOT NULL,
                last_key TEXT NOT NULL,
                records_processed INTEGER NOT NULL,
                created_at_ms INTEGER NOT NULL,
                PRIMARY KEY(profile, destination, collection)
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS conflict_queue (
                conflict_id TEXT PRIMARY KEY,
                profile TEXT NOT NULL,
                destination TEXT NOT NULL,
                collection TEXT NOT NULL,
                record_key TEXT NOT NULL,
                source_json TEXT NOT NULL,
                destination_json TEXT NOT NULL,
                detected_at_ms INTEGER NOT NULL,
                status TEXT NOT NULL DEFAULT 'pending',
                resolution TEXT,
                resolved_at_ms INTEGER
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS integrity_reports (
                report_id TEXT PRIMARY KEY,
                source TEXT NOT NULL,
                overall_status TEXT NOT NULL,
                generated_at_ms INTEGER NOT NULL,
                report_json TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS schema_migrations (
                version TEXT PRIMARY KEY,
                description TEXT NOT NULL,
                checksum TEXT NOT NULL,
                applied_at_ms INTEGER NOT NULL,
                success INTEGER NOT NULL
            )
            """
    );

    // Append only; a released step is never edited.
    private static final List<Migration> MIGRATIONS = List.of(
            new Migration(
                    "20261001_001_conflict_queue_indexes",
                    "Index pending conflicts by destination and collection",
                    List.of(
                            "CREATE INDEX IF NOT EXISTS idx_conflict_queue_pending ON conflict_queue(status, destination, collection)",
                            "CREATE INDEX IF NOT EXISTS idx_conflict_queue_key ON conflict_queue(collection, record_key)"
                    )
            ),
            new Migration(
                    "20261001_002_report_history_index",
                    "Index integrity report history by generation time",
                    List.of("CREATE INDEX IF NOT EXISTS idx_integrity_reports_generated ON integrity_reports(generated_at_ms)")
            )
    );

    private final SyncVaultConfig config;
    private final String jdbcUrl;

    public Database(SyncVaultConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile();
    }

    public String namespace() {
        return config.namespace();
    }

    public void init() {
        createDirectories();
        createSchema();
        configureJournal();
    }

    public Connection openConnection() throws SQLException {
        return DriverManager.getConnection(jdbcUrl);
    }

    private void createDirectories() {
        List<Path> dirs = List.of(config.rootDir(), config.auditRoot(), config.securityRoot(), config.reportsRoot());
        try {
            for (Path dir : dirs) {
                Files.createDirectories(dir);
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories under " + config.rootDir(), e);
        }
    }

    private void createSchema() {
        try (Connection conn = openConnection()) {
            try (Statement st = conn.createStatement()) {
                for (String ddl : TABLES) {
                    st.execute(ddl);
                }
            }
            for (Migration migration : MIGRATIONS) {
                if (!alreadyApplied(conn, migration.version())) {
                    apply(conn, migration);
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize schema", e);
        }
    }

    private static boolean alreadyApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT success FROM schema_migrations WHERE version=?")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() && rs.getInt(1) == 1;
            }
        }
    }

    private static void apply(Connection conn, Migration migration) throws SQLException {
        try (Statement st = conn.createStatement()) {
            for (String sql : migration.statements()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement("""
                INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success)
                VALUES(?,?,?,?,1)
                """)) {
            ps.setString(1, migration.version());
            ps.setString(2, migration.description());
            ps.setString(3, migration.checksum());
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private void configureJournal() {
        Map<String, String> expected = new LinkedHashMap<>();
        expected.put("journal_mode=WAL", "wal");
        expected.put("synchronous=NORMAL", "1");
        expected.put("busy_timeout=5000", null);
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            for (Map.Entry<String, String> pragma : expected.entrySet()) {
                st.execute("PRAGMA " + pragma.getKey());
                if (pragma.getValue() != null) {
                    String name = pragma.getKey().substring(0, pragma.getKey().indexOf('='));
                    checkPragma(st, name, pragma.getValue());
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private static void checkPragma(Statement st, String name, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + name)) {
            String actual = rs.next() ? rs.getString(1) : null;
            if (!expected.equalsIgnoreCase(actual)) {
                throw new IllegalStateException("PRAGMA " + name + " is " + actual + ", expected " + expected);
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations() {
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT version,description,checksum,applied_at_ms,success FROM schema_migrations ORDER BY version");
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.add(new SchemaMigrationRow(
                        rs.getString("version"),
                        rs.getString("description"),
                        rs.getString("checksum"),
                        rs.getLong("applied_at_ms"),
                        rs.getInt("success") == 1
                ));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    private record Migration(String version, String description, List<String> statements) {
        String checksum() {
            StringBuilder text = new StringBuilder(MIGRATION_SEED).append('|').append(version).append('|')
                    .append(description);
            statements.forEach(sql -> text.append('|').append(sql));
            return Hashing.sha256Hex(text.toString()).substring(0, 16);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
