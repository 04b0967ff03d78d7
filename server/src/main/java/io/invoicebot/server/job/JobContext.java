package io.invoicebot.server.job;

import io.invoicebot.server.claim.IdempotencyKey;
import io.invoicebot.server.recovery.RecoveryResult;
import java.util.Map;
import java.util.Optional;
import java.util.function.BooleanSupplier;

public final class JobContext {

    private final long jobId;
    private final String sessionId;
    private final IdempotencyKey key;
    private final Map<String, Object> config;
    private final String workerId;
    private final int retryCount;
    private final RecoveryResult recovery;
    private final BooleanSupplier heartbeat;

    public JobContext(
        long jobId,
        String sessionId,
        IdempotencyKey key,
        Map<String, Object> config,
        String workerId,
        int retryCount,
        RecoveryResult recovery,
        BooleanSupplier heartbeat
    ) {
        this.jobId = jobId;
        this.sessionId = sessionId;
        this.key = key;
        this.config = config == null ? Map.of() : config;
        this.workerId = workerId;
        this.retryCount = retryCount;
        this.recovery = recovery;
        this.heartbeat = heartbeat;
    }

    public long jobId() {
        return jobId;
    }

    public String sessionId() {
        return sessionId;
    }

    public IdempotencyKey key() {
        return key;
    }

    public long ticketId() {
        return key.ticketId();
    }

    public Map<String, Object> config() {
        return config;
    }

    public String workerId() {
        return workerId;
    }

    public int retryCount() {
        return retryCount;
    }

    public Optional<RecoveryResult> recovery() {
        return Optional.ofNullable(recovery);
    }

    public boolean heartbeat() {
        return heartbeat.getAsBoolean();
    }
}
