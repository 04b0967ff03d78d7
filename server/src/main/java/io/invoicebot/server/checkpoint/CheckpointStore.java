package io.invoicebot.server.checkpoint;

import io.invoicebot.server.codec.CompressionType;
import io.invoicebot.server.codec.EncodedState;
import io.invoicebot.server.codec.StateCodec;
import io.invoicebot.server.codec.StateCodecException;
import io.invoicebot.server.config.InvoiceBotProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
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

/**
 * Checkpoint payloads live in write-once {@code <checkpointId>.chk} files; size, checksum and step counters live
 * in {@code automation_checkpoints}. A metadata row is only inserted once its file is fully in place.
 */
@Repository
public class CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    private static final String FILE_SUFFIX = ".chk";
    private static final String SELECT_COLUMNS = """
        SELECT checkpoint_id, session_id, automation_type, current_step, total_steps, compression_type,
               data_size_bytes, checksum, created_at
        FROM automation_checkpoints
        """;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final StateCodec codec;
    private final InvoiceBotProperties properties;
    private final Clock clock;

    public CheckpointStore(
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

    public static String newCheckpointId() {
        return "chk_" + UUID.randomUUID().toString().replace("-", "");
    }

    public Checkpoint save(Checkpoint checkpoint) {
        Optional<CheckpointMetadata> latest = latest(checkpoint.sessionId());
        if (latest.isPresent() && checkpoint.currentStep() < latest.get().currentStep()) {
            throw new IllegalArgumentException("Checkpoint step " + checkpoint.currentStep()
                + " is behind latest step " + latest.get().currentStep() + " of session " + checkpoint.sessionId());
        }

        String checkpointId = checkpoint.checkpointId() == null ? newCheckpointId() : checkpoint.checkpointId();
        CompressionType compression = checkpoint.compressionType() == null
            ? properties.getCheckpoint().getCompression()
            : checkpoint.compressionType();
        Instant createdAt = checkpoint.createdAt() == null ? clock.instant() : checkpoint.createdAt();
        Checkpoint stored = checkpoint.stored(checkpointId, compression, 0L, null, createdAt);

        EncodedState encoded = codec.encode(toPayload(stored), compression);
        Path file = writeOnce(checkpointId, encoded.bytes());
        stored = stored.stored(checkpointId, compression, encoded.size(), encoded.checksum(), createdAt);
        try {
            insertMetadata(stored);
        } catch (RuntimeException e) {
            deleteFile(file);
            throw e;
        }
        log.info("Checkpoint {} saved for session {} at step {}/{} ({} bytes, {})",
            checkpointId, stored.sessionId(), stored.currentStep(), stored.totalSteps(), encoded.size(), compression);

        pruneSession(stored.sessionId());
        return stored;
    }

    public Checkpoint load(String checkpointId) {
        CheckpointMetadata metadata = findMetadata(checkpointId)
            .orElseThrow(() -> new CheckpointIntegrityException(checkpointId, IntegrityFailure.MISSING,
                "No metadata for checkpoint " + checkpointId));
        byte[] bytes = readVerified(metadata);
        return decode(metadata, bytes);
    }

    public IntegrityReport validateIntegrity(String checkpointId) {
        try {
            load(checkpointId);
            return IntegrityReport.ok(checkpointId);
        } catch (CheckpointIntegrityException e) {
            log.warn("Checkpoint {} failed integrity check: {}", checkpointId, e.getMessage());
            return IntegrityReport.failed(e);
        }
    }

    public Optional<CheckpointMetadata> findMetadata(String checkpointId) {
        List<CheckpointMetadata> rows = jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE checkpoint_id = :id",
            Map.of("id", checkpointId),
            (rs, rowNum) -> toMetadata(rs));
        return rows.stream().findFirst();
    }

    public List<CheckpointMetadata> listMetadata(String sessionId) {
        return jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE session_id = :sessionId ORDER BY created_at DESC, current_step DESC",
            Map.of("sessionId", sessionId),
            (rs, rowNum) -> toMetadata(rs));
    }

    public Optional<CheckpointMetadata> latest(String sessionId) {
        return listMetadata(sessionId).stream().findFirst();
    }

    public int cleanupOlderThan(int retentionDays) {
        Timestamp cutoff = Timestamp.from(clock.instant().minus(Duration.ofDays(retentionDays)));
        List<CheckpointMetadata> expired = jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE created_at < :cutoff",
            new MapSqlParameterSource().addValue("cutoff", cutoff, Types.TIMESTAMP),
            (rs, rowNum) -> toMetadata(rs));
        int deleted = 0;
        for (CheckpointMetadata metadata : expired) {
            if (delete(metadata)) {
                deleted++;
            }
        }
        if (deleted > 0) {
            log.info("Removed {} checkpoints older than {} days", deleted, retentionDays);
        }
        return deleted;
    }

    Path fileFor(String checkpointId) {
        return directory().resolve(checkpointId + FILE_SUFFIX);
    }

    private Path directory() {
        return Paths.get(properties.getCheckpoint().getDirectory());
    }

    private Path writeOnce(String checkpointId, byte[] bytes) {
        Path target = fileFor(checkpointId);
        Path temp = directory().resolve(checkpointId + FILE_SUFFIX + ".tmp");
        try {
            Files.createDirectories(directory());
            if (Files.exists(target)) {
                throw new IllegalStateException("Checkpoint file already exists: " + target);
            }
            Files.write(temp, bytes, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            return target;
        } catch (IOException e) {
            deleteFile(temp);
            throw new IllegalStateException("Failed to write checkpoint file: " + target, e);
        }
    }

    private byte[] readVerified(CheckpointMetadata metadata) {
        String id = metadata.checkpointId();
        Path file = fileFor(id);
        if (Files.notExists(file)) {
            throw new CheckpointIntegrityException(id, IntegrityFailure.MISSING, "Checkpoint file not found: " + file);
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new CheckpointIntegrityException(id, IntegrityFailure.UNREADABLE,
                "Checkpoint file " + file + " could not be read: " + e.getMessage(), e);
        }
        if (bytes.length != metadata.dataSizeBytes()) {
            throw new CheckpointIntegrityException(id, IntegrityFailure.SIZE_MISMATCH,
                "Checkpoint " + id + " size " + bytes.length + " does not match recorded " + metadata.dataSizeBytes());
        }
        if (!codec.checksum(bytes).equals(metadata.checksum())) {
            throw new CheckpointIntegrityException(id, IntegrityFailure.CHECKSUM_MISMATCH,
                "Checkpoint " + id + " checksum does not match recorded value");
        }
        return bytes;
    }

    private Checkpoint decode(CheckpointMetadata metadata, byte[] bytes) {
        String id = metadata.checkpointId();
        Map<String, Object> payload;
        try {
            payload = codec.decode(bytes, metadata.compressionType());
        } catch (StateCodecException e) {
            throw new CheckpointIntegrityException(id, IntegrityFailure.UNDECODABLE,
                "Checkpoint " + id + " could not be decoded: " + e.getMessage(), e);
        }
        if (!id.equals(payload.get("checkpoint_id")) || !metadata.sessionId().equals(payload.get("session_id"))) {
            throw new CheckpointIntegrityException(id, IntegrityFailure.UNDECODABLE,
                "Checkpoint " + id + " payload does not belong to its metadata row");
        }
        Integer currentStep = StatePayloads.integer(id, payload, "current_step");
        Integer totalSteps = StatePayloads.integer(id, payload, "total_steps");
        return new Checkpoint(
            id,
            metadata.sessionId(),
            StatePayloads.string(id, payload, "automation_type"),
            currentStep == null ? 0 : currentStep,
            totalSteps == null ? 0 : totalSteps,
            StatePayloads.map(id, payload, "state_data"),
            StatePayloads.map(id, payload, "execution_context"),
            StatePayloads.map(id, payload, "variables"),
            StatePayloads.map(id, payload, "performance_metrics"),
            StatePayloads.list(id, payload, "error_log"),
            metadata.compressionType(),
            metadata.dataSizeBytes(),
            metadata.checksum(),
            StatePayloads.instant(id, payload, "created_at")
        );
    }

    private Map<String, Object> toPayload(Checkpoint checkpoint) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("checkpoint_id", checkpoint.checkpointId());
        payload.put("session_id", checkpoint.sessionId());
        payload.put("automation_type", checkpoint.automationType());
        payload.put("current_step", checkpoint.currentStep());
        payload.put("total_steps", checkpoint.totalSteps());
        payload.put("state_data", checkpoint.stateData());
        payload.put("execution_context", checkpoint.executionContext());
        payload.put("variables", checkpoint.variables());
        payload.put("performance_metrics", checkpoint.performanceMetrics());
        payload.put("error_log", checkpoint.errorLog());
        payload.put("created_at", checkpoint.createdAt());
        return payload;
    }

    private void insertMetadata(Checkpoint checkpoint) {
        String sql = """
            INSERT INTO automation_checkpoints(checkpoint_id, session_id, automation_type, current_step, total_steps,
                                               compression_type, data_size_bytes, checksum, created_at)
            VALUES (:id, :sessionId, :automationType, :currentStep, :totalSteps,
                    :compression, :size, :checksum, :createdAt)
            """;
        jdbcTemplate.update(sql, new MapSqlParameterSource()
            .addValue("id", checkpoint.checkpointId())
            .addValue("sessionId", checkpoint.sessionId())
            .addValue("automationType", checkpoint.automationType())
            .addValue("currentStep", checkpoint.currentStep())
            .addValue("totalSteps", checkpoint.totalSteps())
            .addValue("compression", checkpoint.compressionType().name())
            .addValue("size", checkpoint.dataSizeBytes())
            .addValue("checksum", checkpoint.checksum())
            .addValue("createdAt", Timestamp.from(checkpoint.createdAt()), Types.TIMESTAMP));
    }

    private void pruneSession(String sessionId) {
        int max = properties.getCheckpoint().getMaxPerSession();
        if (max <= 0) {
            return;
        }
        List<CheckpointMetadata> all = listMetadata(sessionId);
        for (CheckpointMetadata metadata : all.subList(Math.min(max, all.size()), all.size())) {
            delete(metadata);
        }
    }

    private boolean delete(CheckpointMetadata metadata) {
        if (!deleteFile(fileFor(metadata.checkpointId()))) {
            return false;
        }
        jdbcTemplate.update("DELETE FROM automation_checkpoints WHERE checkpoint_id = :id",
            Map.of("id", metadata.checkpointId()));
        return true;
    }

    private boolean deleteFile(Path file) {
        try {
            Files.deleteIfExists(file);
            return true;
        } catch (IOException e) {
            log.warn("Failed to delete checkpoint file {}", file, e);
            return false;
        }
    }

    private CheckpointMetadata toMetadata(ResultSet rs) throws SQLException {
        return new CheckpointMetadata(
            rs.getString("checkpoint_id"),
            rs.getString("session_id"),
            rs.getString("automation_type"),
            rs.getInt("current_step"),
            rs.getInt("total_steps"),
            CompressionType.valueOf(rs.getString("compression_type")),
            rs.getLong("data_size_bytes"),
            rs.getString("checksum"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
