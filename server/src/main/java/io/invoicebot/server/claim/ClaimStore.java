package io.invoicebot.server.claim;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.invoicebot.server.common.HashUtils;
import io.invoicebot.server.config.InvoiceBotProperties;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Job ledger keyed by idempotency key. The row lock taken inside {@link #claim} is the only cross-worker
 * coordination point; the in-memory lock only keeps one process from racing itself.
 */
@Repository
public class ClaimStore {

    private static final Logger log = LoggerFactory.getLogger(ClaimStore.class);

    private static final int CONFIG_HASH_LENGTH = 16;
    private static final int SESSION_HASH_LENGTH = 12;

    private static final String SELECT_COLUMNS = """
        SELECT id, idempotency_key, ticket_id, operation_type, session_id, status, claimed_by, claimed_at,
               completed_at, result_json, error_message, retry_count, created_at, updated_at
        FROM job_records
        """;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final TransactionTemplate claimTransaction;
    private final ConfigFingerprint configFingerprint;
    private final ObjectMapper objectMapper;
    private final InvoiceBotProperties properties;
    private final Clock clock;
    private final KeyedLocks localLocks = new KeyedLocks();

    public ClaimStore(
        NamedParameterJdbcTemplate jdbcTemplate,
        PlatformTransactionManager transactionManager,
        ConfigFingerprint configFingerprint,
        ObjectMapper objectMapper,
        InvoiceBotProperties properties,
        Clock clock
    ) {
        this.jdbcTemplate = jdbcTemplate;
        this.claimTransaction = new TransactionTemplate(transactionManager);
        this.claimTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.configFingerprint = configFingerprint;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    public IdempotencyKey computeIdempotencyKey(long ticketId, String operationType, Map<String, ?> config) {
        return computeIdempotencyKey(ticketId, operationType, config, 0);
    }

    public IdempotencyKey computeIdempotencyKey(
        long ticketId,
        String operationType,
        Map<String, ?> config,
        int retryCount
    ) {
        String configHash = configFingerprint.hash(config, CONFIG_HASH_LENGTH);
        return new IdempotencyKey(ticketId, operationType, configHash, retryCount);
    }

    public String sessionIdFor(IdempotencyKey key) {
        return "session_" + key.ticketId() + "_" + HashUtils.shortSha256Hex(key.asString(), SESSION_HASH_LENGTH);
    }

    public ClaimOutcome claim(IdempotencyKey key, String workerId, int timeoutSeconds) {
        Duration timeout = Duration.ofSeconds(timeoutSeconds);
        Duration localWait = Duration.ofMillis(properties.getClaim().getLocalLockWaitMs());
        return localLocks.withLock(
            key.asString(),
            localWait,
            () -> claimUnderLocalLock(key, workerId, timeout),
            () -> {
                log.info("Local lock for {} busy after {} ms, reporting as held", key, localWait.toMillis());
                return new ClaimOutcome.HeldByOther(findByKey(key).map(JobRecord::id).orElse(null), null);
            }
        );
    }

    public boolean heartbeat(long jobId, String workerId) {
        String sql = """
            UPDATE job_records
            SET claimed_at = :now,
                updated_at = :now
            WHERE id = :id
              AND claimed_by = :workerId
              AND status IN (:statuses)
            """;
        int updated = jdbcTemplate.update(sql, new MapSqlParameterSource()
            .addValue("now", Timestamp.from(clock.instant()), Types.TIMESTAMP)
            .addValue("id", jobId)
            .addValue("workerId", workerId)
            .addValue("statuses", names(EnumSet.of(JobStatus.CLAIMED, JobStatus.PROCESSING))));
        if (updated == 0) {
            log.warn("Heartbeat for job {} by {} ignored: claim is no longer held", jobId, workerId);
        }
        return updated == 1;
    }

    public boolean transition(long jobId, JobStatus newStatus, String errorMessage) {
        return applyTransition(jobId, newStatus, errorMessage, null);
    }

    public boolean complete(long jobId, JsonNode result) {
        return applyTransition(jobId, JobStatus.COMPLETED, null, result == null ? "null" : result.toString());
    }

    public Optional<JobRecord> findByKey(IdempotencyKey key) {
        List<JobRecord> rows = jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE idempotency_key = :key",
            Map.of("key", key.asString()),
            (rs, rowNum) -> toRecord(rs));
        return rows.stream().findFirst();
    }

    public Optional<JobRecord> findById(long jobId) {
        List<JobRecord> rows = jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE id = :id",
            Map.of("id", jobId),
            (rs, rowNum) -> toRecord(rs));
        return rows.stream().findFirst();
    }

    public int cleanupStale(int retentionHours) {
        Instant now = clock.instant();
        Timestamp cutoff = Timestamp.from(now.minus(Duration.ofHours(retentionHours)));
        int processing = timeoutActive(JobStatus.PROCESSING, cutoff, now,
            "Job timed out after " + retentionHours + " hours");
        int claimed = timeoutActive(JobStatus.CLAIMED, cutoff, now,
            "Job claim timed out after " + retentionHours + " hours");
        if (processing + claimed > 0) {
            log.warn("Stale job sweep moved {} processing and {} claimed jobs to TIMEOUT", processing, claimed);
        }
        return processing + claimed;
    }

    public int purgeTerminal(int retentionDays) {
        String sql = """
            DELETE FROM job_records
            WHERE status IN (:statuses)
              AND updated_at < :cutoff
            """;
        int deleted = jdbcTemplate.update(sql, new MapSqlParameterSource()
            .addValue("statuses", names(EnumSet.of(
                JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.TIMEOUT, JobStatus.CANCELLED)))
            .addValue("cutoff", Timestamp.from(clock.instant().minus(Duration.ofDays(retentionDays))),
                Types.TIMESTAMP));
        if (deleted > 0) {
            log.info("Purged {} terminal jobs older than {} days", deleted, retentionDays);
        }
        return deleted;
    }

    private ClaimOutcome claimUnderLocalLock(IdempotencyKey key, String workerId, Duration timeout) {
        try {
            return claimInTransaction(key, workerId, timeout);
        } catch (DataIntegrityViolationException e) {
            // another node inserted the row between our lookup and insert; the second pass sees it
            log.info("Lost insert race for {}, resolving against existing row", key);
            return claimInTransaction(key, workerId, timeout);
        }
    }

    private ClaimOutcome claimInTransaction(IdempotencyKey key, String workerId, Duration timeout) {
        return claimTransaction.execute(status -> {
            Instant now = clock.instant();
            Optional<JobRecord> existing = lockByKey(key);
            if (existing.isEmpty()) {
                String sessionId = sessionIdFor(key);
                long jobId = insertClaimed(key, sessionId, workerId, now);
                log.info("Job {} claimed by {} for key {}", jobId, workerId, key);
                return new ClaimOutcome.Claimed(jobId, sessionId, false, 0);
            }
            return resolveExisting(existing.get(), workerId, timeout, now);
        });
    }

    private ClaimOutcome resolveExisting(JobRecord record, String workerId, Duration timeout, Instant now) {
        if (record.status().isFinished()) {
            return new ClaimOutcome.AlreadyProcessed(record);
        }
        if (record.status().isActive()) {
            boolean fresh = record.claimedAt() != null && now.isBefore(record.claimedAt().plus(timeout));
            if (fresh && !workerId.equals(record.claimedBy())) {
                return new ClaimOutcome.HeldByOther(record.id(), record.claimedBy());
            }
            if (fresh) {
                refreshClaim(record.id(), now);
                return new ClaimOutcome.Claimed(record.id(), record.sessionId(), false, record.retryCount());
            }
            log.warn("Claim on job {} by {} went stale at {}, reclaiming for {}",
                record.id(), record.claimedBy(), record.claimedAt(), workerId);
        } else {
            log.info("Job {} in status {} is claimed again by {}", record.id(), record.status(), workerId);
        }
        reclaim(record.id(), workerId, now);
        return new ClaimOutcome.Claimed(record.id(), record.sessionId(), true, record.retryCount() + 1);
    }

    private Optional<JobRecord> lockByKey(IdempotencyKey key) {
        List<JobRecord> rows = jdbcTemplate.query(
            SELECT_COLUMNS + "WHERE idempotency_key = :key FOR UPDATE",
            Map.of("key", key.asString()),
            (rs, rowNum) -> toRecord(rs));
        return rows.stream().findFirst();
    }

    private long insertClaimed(IdempotencyKey key, String sessionId, String workerId, Instant now) {
        String sql = """
            INSERT INTO job_records(idempotency_key, ticket_id, operation_type, session_id, status, claimed_by,
                                    claimed_at, retry_count, created_at, updated_at)
            VALUES (:key, :ticketId, :operationType, :sessionId, :status, :workerId, :now, 0, :now, :now)
            """;
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcTemplate.update(sql, new MapSqlParameterSource()
            .addValue("key", key.asString())
            .addValue("ticketId", key.ticketId())
            .addValue("operationType", key.operationType())
            .addValue("sessionId", sessionId)
            .addValue("status", JobStatus.CLAIMED.name())
            .addValue("workerId", workerId)
            .addValue("now", Timestamp.from(now), Types.TIMESTAMP), keyHolder, new String[] {"id"});
        Number id = keyHolder.getKey();
        if (id == null) {
            throw new IllegalStateException("No generated id returned for job " + key);
        }
        return id.longValue();
    }

    private void refreshClaim(long jobId, Instant now) {
        String sql = """
            UPDATE job_records
            SET claimed_at = :now,
                updated_at = :now
            WHERE id = :id
            """;
        jdbcTemplate.update(sql, new MapSqlParameterSource()
            .addValue("now", Timestamp.from(now), Types.TIMESTAMP)
            .addValue("id", jobId));
    }

    private void reclaim(long jobId, String workerId, Instant now) {
        String sql = """
            UPDATE job_records
            SET status = :status,
                claimed_by = :workerId,
                claimed_at = :now,
                completed_at = NULL,
                error_message = NULL,
                retry_count = retry_count + 1,
                updated_at = :now
            WHERE id = :id
            """;
        jdbcTemplate.update(sql, new MapSqlParameterSource()
            .addValue("status", JobStatus.CLAIMED.name())
            .addValue("workerId", workerId)
            .addValue("now", Timestamp.from(now), Types.TIMESTAMP)
            .addValue("id", jobId));
    }

    private boolean applyTransition(long jobId, JobStatus newStatus, String errorMessage, String resultJson) {
        Set<JobStatus> sources = newStatus.allowedSources();
        if (sources.isEmpty()) {
            log.warn("Ignoring transition of job {} to {}: only a claim may enter that status", jobId, newStatus);
            return false;
        }
        Instant now = clock.instant();
        String sql = """
            UPDATE job_records
            SET status = :status,
                error_message = COALESCE(:errorMessage, error_message),
                result_json = COALESCE(:result, result_json),
                completed_at = COALESCE(:completedAt, completed_at),
                updated_at = :now
            WHERE id = :id
              AND status IN (:sources)
            """;
        int updated = jdbcTemplate.update(sql, new MapSqlParameterSource()
            .addValue("status", newStatus.name())
            .addValue("errorMessage", errorMessage, Types.VARCHAR)
            .addValue("result", resultJson, Types.VARCHAR)
            .addValue("completedAt", newStatus.isTerminal() ? Timestamp.from(now) : null, Types.TIMESTAMP)
            .addValue("now", Timestamp.from(now), Types.TIMESTAMP)
            .addValue("id", jobId)
            .addValue("sources", names(sources)));
        if (updated == 0) {
            String current = findById(jobId).map(r -> r.status().name()).orElse("<missing>");
            log.warn("Ignoring invalid transition of job {} from {} to {}", jobId, current, newStatus);
            return false;
        }
        return true;
    }

    private int timeoutActive(JobStatus status, Timestamp cutoff, Instant now, String message) {
        String sql = """
            UPDATE job_records
            SET status = :timeout,
                error_message = :message,
                completed_at = :now,
                updated_at = :now
            WHERE status = :status
              AND claimed_at < :cutoff
            """;
        return jdbcTemplate.update(sql, new MapSqlParameterSource()
            .addValue("timeout", JobStatus.TIMEOUT.name())
            .addValue("message", message)
            .addValue("now", Timestamp.from(now), Types.TIMESTAMP)
            .addValue("status", status.name())
            .addValue("cutoff", cutoff, Types.TIMESTAMP));
    }

    private List<String> names(Set<JobStatus> statuses) {
        return statuses.stream().map(Enum::name).toList();
    }

    private JobRecord toRecord(ResultSet rs) throws SQLException {
        JsonNode result = null;
        String resultString = rs.getString("result_json");
        if (resultString != null) {
            try {
                result = objectMapper.readTree(resultString);
            } catch (JsonProcessingException e) {
                log.warn("Job {} has unparseable result_json, returning it raw: {}", rs.getLong("id"),
                    e.getOriginalMessage());
                result = objectMapper.createObjectNode().put("raw", resultString);
            }
        }
        return new JobRecord(
            rs.getLong("id"),
            rs.getString("idempotency_key"),
            rs.getLong("ticket_id"),
            rs.getString("operation_type"),
            rs.getString("session_id"),
            JobStatus.valueOf(rs.getString("status")),
            rs.getString("claimed_by"),
            toInstant(rs.getTimestamp("claimed_at")),
            toInstant(rs.getTimestamp("completed_at")),
            result,
            rs.getString("error_message"),
            rs.getInt("retry_count"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at"))
        );
    }

    private static Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
