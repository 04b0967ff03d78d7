package io.invoicebot.server.job;

import com.fasterxml.jackson.databind.JsonNode;
import io.invoicebot.server.claim.ClaimOutcome;
import io.invoicebot.server.claim.ClaimStore;
import io.invoicebot.server.claim.IdempotencyKey;
import io.invoicebot.server.claim.JobRecord;
import io.invoicebot.server.claim.JobStatus;
import io.invoicebot.server.config.InvoiceBotProperties;
import io.invoicebot.server.persistence.PersistenceCoordinator;
import io.invoicebot.server.recovery.RecoveryResult;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final ClaimStore claimStore;
    private final PersistenceCoordinator persistenceCoordinator;
    private final InvoiceBotProperties properties;
    private final Map<String, JobProcessor> processors;
    private final Map<String, InFlightRun> inFlight = new ConcurrentHashMap<>();
    private final String workerId;

    public JobService(
        ClaimStore claimStore,
        PersistenceCoordinator persistenceCoordinator,
        InvoiceBotProperties properties,
        List<JobProcessor> processors
    ) {
        this.claimStore = claimStore;
        this.persistenceCoordinator = persistenceCoordinator;
        this.properties = properties;
        this.processors = processors.stream()
            .collect(Collectors.toMap(JobProcessor::operationType, Function.identity(), (a, b) -> {
                throw new IllegalStateException("Duplicate job processor for " + a.operationType());
            }));
        String configured = properties.getClaim().getWorkerId();
        this.workerId = configured == null || configured.isBlank()
            ? "worker-" + UUID.randomUUID().toString().substring(0, 8)
            : configured;
    }

    public String workerId() {
        return workerId;
    }

    public JobOutcome submitJob(long ticketId, String operationType, Map<String, ?> config) {
        JobProcessor processor = processors.get(operationType);
        if (processor == null) {
            throw new IllegalArgumentException("No job processor registered for operation type: " + operationType);
        }
        Map<String, ?> jobConfig = config == null ? Map.of() : config;
        IdempotencyKey key = claimStore.computeIdempotencyKey(ticketId, operationType, jobConfig);
        // Registered before claiming: a duplicate submit in this process never reaches the claim.
        InFlightRun current = new InFlightRun();
        InFlightRun running = inFlight.putIfAbsent(key.asString(), current);
        if (running != null) {
            return new JobOutcome.InProgress(running.jobId(key), workerId);
        }
        try {
            return claimAndRun(processor, key, jobConfig, current);
        } finally {
            inFlight.remove(key.asString(), current);
        }
    }

    private JobOutcome claimAndRun(JobProcessor processor, IdempotencyKey key, Map<String, ?> jobConfig,
        InFlightRun current) {
        ClaimOutcome claim = claimStore.claim(key, workerId, properties.getClaim().getTimeoutSeconds());
        if (claim instanceof ClaimOutcome.AlreadyProcessed processed) {
            JobRecord record = processed.record();
            log.info("Job {} for key {} already {}, serving stored result", record.id(), key.asString(),
                record.status());
            return new JobOutcome.AlreadyProcessed(record.id(), record.status(), record.result(),
                record.errorMessage(), record.retryCount());
        }
        if (claim instanceof ClaimOutcome.HeldByOther held) {
            return new JobOutcome.InProgress(held.jobId(), held.holder());
        }

        ClaimOutcome.Claimed claimed = (ClaimOutcome.Claimed) claim;
        current.jobId = claimed.jobId();
        return run(processor, key, claimed, jobConfig);
    }

    private JobOutcome run(JobProcessor processor, IdempotencyKey key, ClaimOutcome.Claimed claimed,
        Map<String, ?> config) {
        long jobId = claimed.jobId();
        if (!claimStore.transition(jobId, JobStatus.PROCESSING, null)) {
            return notStarted(jobId, claimed.retryCount());
        }

        RecoveryResult recovery = null;
        if (claimed.reclaimed()) {
            recovery = recover(claimed.sessionId());
        }
        JobContext context = new JobContext(jobId, claimed.sessionId(), key, new LinkedHashMap<>(config), workerId,
            claimed.retryCount(), recovery, () -> claimStore.heartbeat(jobId, workerId));

        try {
            JsonNode result = processor.process(context);
            if (!claimStore.complete(jobId, result)) {
                return new JobOutcome.Failed(jobId, "Job left PROCESSING before its result was stored", false,
                    claimed.retryCount());
            }
            log.info("Job {} ({}) completed", jobId, key.asString());
            return new JobOutcome.Completed(jobId, claimed.sessionId(), result, claimed.retryCount());
        } catch (InterventionRequiredException e) {
            log.error("Job {} requires human intervention after routes {}: {}", jobId, e.getRoutesAttempted(),
                e.getMessage());
            claimStore.transition(jobId, JobStatus.FAILED, e.getMessage());
            return new JobOutcome.Failed(jobId, e.getMessage(), true, claimed.retryCount());
        } catch (CancellationException e) {
            log.error("Job {} cancelled: {}", jobId, e.getMessage());
            claimStore.transition(jobId, JobStatus.CANCELLED, "Cancelled: " + e.getMessage());
            return new JobOutcome.Failed(jobId, "Cancelled: " + e.getMessage(), false, claimed.retryCount());
        } catch (RuntimeException e) {
            log.error("Job {} failed", jobId, e);
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            claimStore.transition(jobId, JobStatus.FAILED, message);
            return new JobOutcome.Failed(jobId, message, false, claimed.retryCount());
        }
    }

    // Another run of the same job moved the row first; report what it did instead of failing.
    private JobOutcome notStarted(long jobId, int retryCount) {
        JobRecord record = claimStore.findById(jobId).orElse(null);
        if (record == null) {
            return new JobOutcome.Failed(jobId, "Job disappeared before it could enter PROCESSING", false, retryCount);
        }
        if (record.status().isFinished()) {
            log.info("Job {} finished by a concurrent run, serving stored result", jobId);
            return new JobOutcome.AlreadyProcessed(record.id(), record.status(), record.result(),
                record.errorMessage(), record.retryCount());
        }
        if (record.status().isActive()) {
            return new JobOutcome.InProgress(record.id(), record.claimedBy());
        }
        return new JobOutcome.Failed(jobId, "Job could not enter PROCESSING from " + record.status(), false,
            retryCount);
    }

    private RecoveryResult recover(String sessionId) {
        try {
            RecoveryResult result = persistenceCoordinator.recoverSession(sessionId);
            if (result.success()) {
                log.info("Recovered session {} from {}", sessionId, result.recoveredState().recoveredFrom());
            } else {
                log.warn("Session {} not recovered, starting fresh: {}", sessionId, result.error());
            }
            return result;
        } catch (RuntimeException e) {
            log.warn("Recovery of session {} failed, starting fresh", sessionId, e);
            return null;
        }
    }

    private final class InFlightRun {

        private volatile Long jobId;

        Long jobId(IdempotencyKey key) {
            Long known = jobId;
            return known != null ? known : claimStore.findByKey(key).map(JobRecord::id).orElse(null);
        }
    }
}
