package io.invoicebot.server.recovery;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class RecoveryPlanRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public RecoveryPlanRepository(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    public void save(RecoveryPlan plan, RecoveryResult result) {
        String sql = """
            INSERT INTO recovery_plans(recovery_id, session_id, target_id, strategy, recovery_status,
                                       recovery_confidence, data_integrity_score, estimated_recovery_seconds,
                                       success, error_message, plan_json, created_at)
            VALUES (:recoveryId, :sessionId, :targetId, :strategy, :status, :confidence, :integrityScore,
                    :estimatedSeconds, :success, :error, :planJson, :createdAt)
            """;
        jdbcTemplate.update(sql, new MapSqlParameterSource()
            .addValue("recoveryId", plan.recoveryId())
            .addValue("sessionId", plan.sessionId())
            .addValue("targetId", plan.checkpointId(), Types.VARCHAR)
            .addValue("strategy", plan.strategy().code())
            .addValue("status", plan.recoveryStatus().name())
            .addValue("confidence", plan.recoveryConfidence())
            .addValue("integrityScore", plan.dataIntegrityScore())
            .addValue("estimatedSeconds", plan.estimatedRecoverySeconds())
            .addValue("success", result.success())
            .addValue("error", result.error(), Types.VARCHAR)
            .addValue("planJson", toJson(plan))
            .addValue("createdAt", Timestamp.from(plan.createdAt()), Types.TIMESTAMP));
    }

    public Optional<RecoveryAttempt> latestForSession(String sessionId) {
        String sql = """
            SELECT recovery_id, session_id, target_id, strategy, recovery_status, success, error_message, created_at
            FROM recovery_plans
            WHERE session_id = :sessionId
            ORDER BY created_at DESC
            """;
        List<RecoveryAttempt> rows = jdbcTemplate.query(sql, Map.of("sessionId", sessionId),
            (rs, rowNum) -> new RecoveryAttempt(
                rs.getString("recovery_id"),
                rs.getString("session_id"),
                rs.getString("target_id"),
                rs.getString("strategy"),
                RecoveryStatus.valueOf(rs.getString("recovery_status")),
                rs.getBoolean("success"),
                rs.getString("error_message"),
                rs.getTimestamp("created_at").toInstant()));
        return rows.stream().findFirst();
    }

    private String toJson(RecoveryPlan plan) {
        try {
            return objectMapper.writeValueAsString(plan);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize recovery plan " + plan.recoveryId(), e);
        }
    }

    public record RecoveryAttempt(
        String recoveryId,
        String sessionId,
        String targetId,
        String strategy,
        RecoveryStatus recoveryStatus,
        boolean success,
        String errorMessage,
        Instant createdAt
    ) {
    }
}
