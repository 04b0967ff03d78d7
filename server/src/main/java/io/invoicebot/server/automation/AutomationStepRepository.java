package io.invoicebot.server.automation;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.util.List;
import java.util.Map;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class AutomationStepRepository {

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public AutomationStepRepository(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public void insert(AutomationStep step, Long jobId) {
        String sql = """
            INSERT INTO automation_steps(session_id, job_id, step_number, route_name, action_type, selector,
                                         description, result_status, timing_ms, retry_used, reasoning,
                                         evidence_ref, created_at)
            VALUES (:sessionId, :jobId, :stepNumber, :routeName, :actionType, :selector, :description,
                    :resultStatus, :timingMs, :retryUsed, :reasoning, :evidenceRef, :createdAt)
            """;
        jdbcTemplate.update(sql, new MapSqlParameterSource()
            .addValue("sessionId", step.sessionId())
            .addValue("jobId", jobId, Types.BIGINT)
            .addValue("stepNumber", step.stepNumber())
            .addValue("routeName", step.routeName(), Types.VARCHAR)
            .addValue("actionType", step.actionType().name())
            .addValue("selector", step.selector(), Types.VARCHAR)
            .addValue("description", step.description(), Types.VARCHAR)
            .addValue("resultStatus", step.resultStatus().name())
            .addValue("timingMs", step.timingMs())
            .addValue("retryUsed", step.retryUsed())
            .addValue("reasoning", step.reasoning(), Types.VARCHAR)
            .addValue("evidenceRef", step.evidenceRef(), Types.VARCHAR)
            .addValue("createdAt", Timestamp.from(step.recordedAt()), Types.TIMESTAMP));
    }

    public int maxStepNumber(String sessionId) {
        Integer max = jdbcTemplate.queryForObject(
            "SELECT MAX(step_number) FROM automation_steps WHERE session_id = :sessionId",
            Map.of("sessionId", sessionId),
            Integer.class);
        return max == null ? 0 : max;
    }

    public List<AutomationStep> findBySession(String sessionId) {
        String sql = """
            SELECT session_id, step_number, route_name, action_type, selector, description, result_status,
                   timing_ms, retry_used, reasoning, evidence_ref, created_at
            FROM automation_steps
            WHERE session_id = :sessionId
            ORDER BY step_number
            """;
        return jdbcTemplate.query(sql, Map.of("sessionId", sessionId), (rs, rowNum) -> toStep(rs));
    }

    private AutomationStep toStep(ResultSet rs) throws SQLException {
        return new AutomationStep(
            rs.getString("session_id"),
            rs.getInt("step_number"),
            rs.getString("route_name"),
            ActionType.valueOf(rs.getString("action_type")),
            rs.getString("selector"),
            rs.getString("description"),
            ResultStatus.valueOf(rs.getString("result_status")),
            rs.getLong("timing_ms"),
            rs.getBoolean("retry_used"),
            rs.getString("reasoning"),
            rs.getString("evidence_ref"),
            rs.getTimestamp("created_at").toInstant()
        );
    }
}
