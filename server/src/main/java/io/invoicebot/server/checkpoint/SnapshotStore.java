package io.invoicebot.server.checkpoint;

import io.invoicebot.server.codec.CompressionType;
import io.invoicebot.server.codec.EncodedState;
import io.invoicebot.server.codec.StateCodec;
import io.invoicebot.server.codec.StateCodecException;
import io.invoicebot.server.config.InvoiceBotProperties;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    private static final String SELECT_METADATA = """
        SELECT snapshot_id, session_id, current_step, total_steps, compression_type, data_size_bytes, checksum,
               created_at
        FROM automation_snapshots
        """;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final StateCodec codec;
    private final InvoiceBotProperties properties;
    private final Clock clock;

    public SnapshotStore(
        NamedParameterJdbcTemplate jdbcTemplate,
        StateCodec codec,
        InvoiceBotProperties properties,
        Clock clock
    ) {
        this.jdbcTemplate = jdbcTemplate;
        this.codec = codec;
        this.properties = properties;
        this.clock = clock;
    }

    public SnapshotMetadata save(SessionSnapshot snapshot) {
        String snapshotId = snapshot.snapshotId() == null
            ? "snap_" + UUID.randomUUID().toString().replace("-", "")
            : snapshot.snapshotId();
        Instant createdAt = snapshot.createdAt() == null ? clock.instant() : snapshot.createdAt();
        CompressionType compression = properties.getCheckpoint().getCompression();

        EncodedState encoded = codec.encode(toPayload(snapshot, snapshotId, createdAt), compression);
        SnapshotMetadata metadata = new SnapshotMetadata(snapshotId, snapshot.sessionId(), snapshot.currentStep(),
            snapshot.totalSteps(), compression, encoded.size(), encoded.checksum(), createdAt);

        String sql = """
            INSERT INTO automation_snapshots(snapshot_id, session_id, current_step, total_steps, compression_type,
                                             data_size_bytes, checksum, payload, created_at)
            VALUES (:id, :sessionId, :currentStep, :totalSteps, :compression, :size, :checksum, :payload, :createdAt)
            """;
        jdbcTemplate.update(sql, new MapSqlParameterSource()
            .addValue("id", snapshotId)
            .addValue("sessionId", metadata.sessionId())
            .addValue("currentStep", metadata.currentStep(), Types.INTEGER)
            .addValue("totalSteps", metadata.totalSteps(), Types.INTEGER)
            .addValue("compression", compression.name())
            .addValue("size", metadata.dataSizeBytes())
            .addValue("checksum", metadata.checksum())
            .addValue("payload", encoded.bytes(), Types.VARBINARY)
            .addValue("createdAt", Timestamp.from(createdAt), Types.TIMESTAMP));
        log.info("Snapshot {} saved for session {} ({} bytes)", snapshotId, metadata.sessionId(), encoded.size());
        return metadata;
    }

    public SessionSnapshot load(String snapshotId) {
        List<StoredSnapshot> rows = jdbcTemplate.query(
            "SELECT snapshot_id, session_id, compression_type, data_size_bytes, checksum, payload "
                + "FROM automation_snapshots WHERE snapshot_id = :id",
            Map.of("id", snapshotId),
            (rs, rowNum) -> new StoredSnapshot(
                rs.getString("snapshot_id"),
                rs.getString("session_id"),
                CompressionType.valueOf(rs.getString("compression_type")),
                rs.getLong("data_size_bytes"),
                rs.getString("checksum"),
                rs.getBytes("payload")));
        StoredSnapshot stored = rows.stream().findFirst()
            .orElseThrow(() -> new CheckpointIntegrityException(snapshotId, IntegrityFailure.MISSING,
                "No snapshot " + snapshotId));
        return decode(stored, verify(stored));
    }

    public IntegrityReport validateIntegrity(String snapshotId) {
        try {
            load(snapshotId);
            return IntegrityReport.ok(snapshotId);
        } catch (CheckpointIntegrityException e) {
            log.warn("Snapshot {} failed integrity check: {}", snapshotId, e.getMessage());
            return IntegrityReport.failed(e);
        }
    }

    public List<SnapshotMetadata> listMetadata(String sessionId) {
        return jdbcTemplate.query(
            SELECT_METADATA + "WHERE session_id = :sessionId ORDER BY created_at DESC",
            Map.of("sessionId", sessionId),
            (rs, rowNum) -> toMetadata(rs));
    }

    public Optional<SnapshotMetadata> findMetadata(String snapshotId) {
        return jdbcTemplate.query(
                SELECT_METADATA + "WHERE snapshot_id = :id",
                Map.of("id", snapshotId),
                (rs, rowNum) -> toMetadata(rs))
            .stream()
            .findFirst();
    }

    public int cleanupOlderThan(int retentionDays) {
        Timestamp cutoff = Timestamp.from(clock.instant().minus(Duration.ofDays(retentionDays)));
        int deleted = jdbcTemplate.update("DELETE FROM automation_snapshots WHERE created_at < :cutoff",
            new MapSqlParameterSource().addValue("cutoff", cutoff, Types.TIMESTAMP));
        if (deleted > 0) {
            log.info("Removed {} snapshots older than {} days", deleted, retentionDays);
        }
        return deleted;
    }

    private byte[] verify(StoredSnapshot stored) {
        String id = stored.snapshotId();
        if (stored.payload() == null) {
            throw new CheckpointIntegrityException(id, IntegrityFailure.MISSING, "Snapshot " + id + " has no payload");
        }
        if (stored.payload().length != stored.dataSizeBytes()) {
            throw new CheckpointIntegrityException(id, IntegrityFailure.SIZE_MISMATCH,
                "Snapshot " + id + " size " + stored.payload().length + " does not match recorded "
                    + stored.dataSizeBytes());
        }
        if (!codec.checksum(stored.payload()).equals(stored.checksum())) {
            throw new CheckpointIntegrityException(id, IntegrityFailure.CHECKSUM_MISMATCH,
                "Snapshot " + id + " checksum does not match recorded value");
        }
        return stored.payload();
    }

    private SessionSnapshot decode(StoredSnapshot stored, byte[] bytes) {
        String id = stored.snapshotId();
        Map<String, Object> payload;
        try {
            payload = codec.decode(bytes, stored.compression());
        } catch (StateCodecException e) {
            throw new CheckpointIntegrityException(id, IntegrityFailure.UNDECODABLE,
                "Snapshot " + id + " could not be decoded: " + e.getMessage(), e);
        }
        if (!id.equals(payload.get("snapshot_id")) || !stored.sessionId().equals(payload.get("session_id"))) {
            throw new CheckpointIntegrityException(id, IntegrityFailure.UNDECODABLE,
                "Snapshot " + id + " payload does not belong to its row");
        }
        return new SessionSnapshot(
            id,
            stored.sessionId(),
            StatePayloads.map(id, payload, "automation_state"),
            StatePayloads.map(id, payload, "browser_state"),
            StatePayloads.bytes(id, payload, "memory_dump"),
            StatePayloads.bytes(id, payload, "screenshot"),
            StatePayloads.string(id, payload, "dom_snapshot"),
            StatePayloads.list(id, payload, "network_logs"),
            StatePayloads.list(id, payload, "console_logs"),
            StatePayloads.map(id, payload, "custom_data"),
            StatePayloads.instant(id, payload, "created_at")
        );
    }

    private Map<String, Object> toPayload(SessionSnapshot snapshot, String snapshotId, Instant createdAt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("snapshot_id", snapshotId);
        payload.put("session_id", snapshot.sessionId());
        payload.put("automation_state", snapshot.automationState());
        payload.put("browser_state", snapshot.browserState());
        payload.put("memory_dump", snapshot.memoryDump());
        payload.put("screenshot", snapshot.screenshot());
        payload.put("dom_snapshot", snapshot.domSnapshot());
        payload.put("network_logs", snapshot.networkLogs());
        payload.put("console_logs", snapshot.consoleLogs());
        payload.put("custom_data", snapshot.customData());
        payload.put("created_at", createdAt);
        return payload;
    }

    private SnapshotMetadata toMetadata(ResultSet rs) throws SQLException {
        return new SnapshotMetadata(
            rs.getString("snapshot_id"),
            rs.getString("session_id"),
            rs.getObject("current_step", Integer.class),
            rs.getObject("total_steps", Integer.class),
            CompressionType.valueOf(rs.getString("compression_type")),
            rs.getLong("data_size_bytes"),
            rs.getString("checksum"),
            rs.getTimestamp("created_at").toInstant()
        );
    }

    private record StoredSnapshot(
        String snapshotId,
        String sessionId,
        CompressionType compression,
        long dataSizeBytes,
        String checksum,
        byte[] payload
    ) {
    }
}
