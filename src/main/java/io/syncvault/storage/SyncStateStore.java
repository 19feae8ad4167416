package io.syncvault.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.syncvault.model.Checkpoint;
import io.syncvault.model.ConflictEntry;
import io.syncvault.model.ConflictStrategy;
import io.syncvault.model.IntegrityReport;
import io.syncvault.observability.RunIds;
import io.syncvault.util.Jsons;

import java.io.IOException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Caller-side state that outlives a single run: the last checkpoint per
 * (profile, destination, collection), the manual-review conflict queue and integrity report
 * history.
 */
public final class SyncStateStore {
    public static final String STATUS_PENDING = "pending";
    public static final String STATUS_RESOLVED = "resolved";

    private final Database database;

    public SyncStateStore(Database database) {
        this.database = database;
    }

    public void saveCheckpoint(String profile, String destination, String collection, Checkpoint checkpoint) {
        String sql = """
                INSERT INTO sync_checkpoints(profile,destination,collection,batch_index,last_key,records_processed,created_at_ms)
                VALUES(?,?,?,?,?,?,?)
                ON CONFLICT(profile,destination,collection) DO UPDATE SET
                    batch_index=excluded.batch_index,
                    last_key=excluded.last_key,
                    records_processed=excluded.records_processed,
                    created_at_ms=excluded.created_at_ms
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, profile);
            ps.setString(2, destination);
            ps.setString(3, collection);
            ps.setInt(4, checkpoint.batchIndex());
            ps.setString(5, checkpoint.lastKey());
            ps.setLong(6, checkpoint.recordsProcessed());
            ps.setLong(7, checkpoint.createdAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save checkpoint for " + profile + "/" + destination + "/" + collection, e);
        }
    }

    public Optional<Checkpoint> loadCheckpoint(String profile, String destination, String collection) {
        String sql = """
                SELECT batch_index,last_key,records_processed,created_at_ms
                FROM sync_checkpoints WHERE profile=? AND destination=? AND collection=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, profile);
            ps.setString(2, destination);
            ps.setString(3, collection);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new Checkpoint(
                        rs.getInt("batch_index"),
                        rs.getString("last_key"),
                        rs.getLong("records_processed"),
                        rs.getLong("created_at_ms")
                ));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load checkpoint for " + profile + "/" + destination + "/" + collection, e);
        }
    }

    public boolean clearCheckpoint(String profile, String destination, String collection) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "DELETE FROM sync_checkpoints WHERE profile=? AND destination=? AND collection=?")) {
            ps.setString(1, profile);
            ps.setString(2, destination);
            ps.setString(3, collection);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to clear checkpoint for " + profile + "/" + destination + "/" + collection, e);
        }
    }

    /**
     * Stores a conflict as pending and returns its id.
     */
    public String enqueueConflict(String profile, ConflictEntry entry) {
        String conflictId = RunIds.newConflictId();
        String sql = """
                INSERT INTO conflict_queue(conflict_id,profile,destination,collection,record_key,source_json,destination_json,detected_at_ms,status)
                VALUES(?,?,?,?,?,?,?,?,?)
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, conflictId);
            ps.setString(2, profile);
            ps.setString(3, entry.destination());
            ps.setString(4, entry.collection());
            ps.setString(5, entry.key());
            ps.setString(6, Jsons.toCompactJson(entry.sourceRecord()));
            ps.setString(7, Jsons.toCompactJson(entry.destinationRecord()));
            ps.setLong(8, entry.detectedAt().toEpochMilli());
            ps.setString(9, STATUS_PENDING);
            ps.executeUpdate();
            return conflictId;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to enqueue conflict for key " + entry.key(), e);
        }
    }

    public List<QueuedConflict> pendingConflicts(String destination, String collection) {
        StringBuilder sql = new StringBuilder("""
                SELECT conflict_id,profile,destination,collection,record_key,source_json,destination_json,
                       detected_at_ms,status,resolution,resolved_at_ms
                FROM conflict_queue WHERE status=?
                """);
        List<String> args = new ArrayList<>();
        args.add(STATUS_PENDING);
        if (destination != null && !destination.isBlank()) {
            sql.append(" AND destination=?");
            args.add(destination);
        }
        if (collection != null && !collection.isBlank()) {
            sql.append(" AND collection=?");
            args.add(collection);
        }
        sql.append(" ORDER BY detected_at_ms, conflict_id");
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql.toString())) {
            for (int i = 0; i < args.size(); i++) {
                ps.setString(i + 1, args.get(i));
            }
            List<QueuedConflict> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readConflict(rs));
                }
            }
            return out;
        } catch (SQLException | IOException e) {
            throw new RuntimeException("Failed to list pending conflicts", e);
        }
    }

    public Optional<QueuedConflict> findConflict(String conflictId) {
        String sql = """
                SELECT conflict_id,profile,destination,collection,record_key,source_json,destination_json,
                       detected_at_ms,status,resolution,resolved_at_ms
                FROM conflict_queue WHERE conflict_id=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, conflictId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(readConflict(rs)) : Optional.empty();
            }
        } catch (SQLException | IOException e) {
            throw new RuntimeException("Failed to load conflict " + conflictId, e);
        }
    }

    /**
     * Marks a pending conflict resolved. Returns false when it was not pending.
     */
    public boolean markResolved(String conflictId, ConflictStrategy resolution) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "UPDATE conflict_queue SET status=?, resolution=?, resolved_at_ms=? WHERE conflict_id=? AND status=?")) {
            ps.setString(1, STATUS_RESOLVED);
            ps.setString(2, resolution.wireName());
            ps.setLong(3, Instant.now().toEpochMilli());
            ps.setString(4, conflictId);
            ps.setString(5, STATUS_PENDING);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to resolve conflict " + conflictId, e);
        }
    }

    public void saveReport(IntegrityReport report) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT OR REPLACE INTO integrity_reports(report_id,source,overall_status,generated_at_ms,report_json) VALUES(?,?,?,?,?)")) {
            ps.setString(1, report.reportId());
            ps.setString(2, report.source());
            ps.setString(3, report.overallStatus().wireName());
            ps.setLong(4, report.generatedAt().toEpochMilli());
            ps.setString(5, Jsons.toCompactJson(report));
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("Failed to save integrity report " + report.reportId(), e);
        }
    }

    public Optional<IntegrityReport> loadReport(String reportId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT report_json FROM integrity_reports WHERE report_id=?")) {
            ps.setString(1, reportId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(Jsons.mapper().readValue(rs.getString(1), IntegrityReport.class));
            }
        } catch (SQLException | IOException e) {
            throw new RuntimeException("Failed to load integrity report " + reportId, e);
        }
    }

    /**
     * Most recent reports first.
     */
    public List<ReportSummary> listReports(int limit) {
        String sql = """
                SELECT report_id,source,overall_status,generated_at_ms
                FROM integrity_reports
                ORDER BY generated_at_ms DESC, report_id DESC
                LIMIT ?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            List<ReportSummary> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ReportSummary(
                            rs.getString("report_id"),
                            rs.getString("source"),
                            IntegrityReport.OverallStatus.fromString(rs.getString("overall_status")),
                            rs.getLong("generated_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list integrity reports", e);
        }
    }

    private QueuedConflict readConflict(ResultSet rs) throws SQLException, IOException {
        ConflictEntry entry = new ConflictEntry(
                rs.getString("record_key"),
                rs.getString("collection"),
                rs.getString("destination"),
                (ObjectNode) Jsons.mapper().readTree(rs.getString("source_json")),
                (ObjectNode) Jsons.mapper().readTree(rs.getString("destination_json")),
                Instant.ofEpochMilli(rs.getLong("detected_at_ms"))
        );
        long resolvedAt = rs.getLong("resolved_at_ms");
        boolean resolvedAtNull = rs.wasNull();
        String resolution = rs.getString("resolution");
        return new QueuedConflict(
                rs.getString("conflict_id"),
                rs.getString("profile"),
                rs.getString("status"),
                resolution == null ? null : ConflictStrategy.fromString(resolution),
                resolvedAtNull ? null : resolvedAt,
                entry
        );
    }

    public record QueuedConflict(
            String conflictId,
            String profile,
            String status,
            ConflictStrategy resolution,
            Long resolvedAtMs,
            ConflictEntry entry
    ) {
        public boolean pending() {
            return STATUS_PENDING.equals(status);
        }
    }

    public record ReportSummary(
            String reportId,
            String source,
            IntegrityReport.OverallStatus overallStatus,
            long generatedAtMs
    ) {
    }
}
