package io.invoicebot.server.job;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.invoicebot.server.claim.ClaimOutcome;
import io.invoicebot.server.claim.ClaimStore;
import io.invoicebot.server.claim.ConfigFingerprint;
import io.invoicebot.server.claim.IdempotencyKey;
import io.invoicebot.server.claim.JobRecord;
import io.invoicebot.server.claim.JobStatus;
import io.invoicebot.server.config.InvoiceBotProperties;
import io.invoicebot.server.persistence.PersistenceCoordinator;
import io.invoicebot.server.recovery.RecoveryResult;
import io.invoicebot.server.recovery.RecoveryStrategy;
import io.invoicebot.server.support.MutableClock;
import io.invoicebot.server.support.TestDatabase;
import io.invoicebot.server.support.TestObjects;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class JobServiceTest {

    private static final Map<String, Object> CONFIG = Map.of("url", "https://portal.example.com");

    @TempDir
    Path tempDir;

    private TestDatabase database;
    private MutableClock clock;
    private ObjectMapper objectMapper;
    private InvoiceBotProperties properties;
    private ClaimStore claimStore;
    private PersistenceCoordinator persistenceCoordinator;
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        database = TestDatabase.create();
        clock = MutableClock.at("2024-05-01T12:00:00Z");
        objectMapper = TestObjects.objectMapper();
        properties = TestObjects.properties(tempDir);
        properties.getClaim().setWorkerId("worker-a");
        claimStore = new ClaimStore(database.jdbc(), database.transactionManager(),
            new ConfigFingerprint(objectMapper), objectMapper, properties, clock);
        persistenceCoordinator = mock(PersistenceCoordinator.class);
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    @Test
    @DisplayName("a duplicate submit while the first run is in flight reports InProgress with the same job")
    void duplicateSubmitShouldReportInProgress() throws Exception {
        // given: a processor that blocks until released.
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        JobService service = service(context -> {
            started.countDown();
            await(release);
            return objectMapper.createObjectNode().put("invoice", "F-001");
        });
        pool = Executors.newSingleThreadExecutor();

        Future<JobOutcome> first = pool.submit(() -> service.submitJob(42, "invoice_portal", CONFIG));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        JobOutcome second = service.submitJob(42, "invoice_portal", CONFIG);
        release.countDown();
        JobOutcome firstOutcome = first.get(5, TimeUnit.SECONDS);

        assertThat(firstOutcome).isInstanceOf(JobOutcome.Completed.class);
        JobOutcome.Completed completed = (JobOutcome.Completed) firstOutcome;
        assertThat(second).isEqualTo(new JobOutcome.InProgress(completed.jobId(), "worker-a"));
        assertThat(completed.result().path("invoice").asText()).isEqualTo("F-001");
        assertThat(completed.sessionId()).startsWith("session_42_");
        assertThat(completed.retryCount()).isZero();
    }

    @Test
    @DisplayName("a duplicate submit while the first sits between its claim and its run never claims the job")
    void duplicateSubmitDuringClaimShouldNotClaimAgain() throws Exception {
        // given: the first claim is held right after it commits.
        CountDownLatch claimedFirst = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        HookedClaimStore store = hookedClaimStore(outcome -> {
            claimedFirst.countDown();
            await(release);
        });
        AtomicInteger runs = new AtomicInteger();
        JobService service = service(store, context -> {
            runs.incrementAndGet();
            return objectMapper.createObjectNode().put("invoice", "F-051");
        });
        pool = Executors.newSingleThreadExecutor();

        Future<JobOutcome> first = pool.submit(() -> service.submitJob(51, "invoice_portal", CONFIG));
        assertThat(claimedFirst.await(5, TimeUnit.SECONDS)).isTrue();
        JobOutcome second = service.submitJob(51, "invoice_portal", CONFIG);
        release.countDown();
        JobOutcome firstOutcome = first.get(5, TimeUnit.SECONDS);

        assertThat(firstOutcome).isInstanceOf(JobOutcome.Completed.class);
        long jobId = ((JobOutcome.Completed) firstOutcome).jobId();
        assertThat(second).isEqualTo(new JobOutcome.InProgress(jobId, "worker-a"));
        assertThat(store.claims()).isEqualTo(1);
        assertThat(runs).hasValue(1);
        assertThat(service.submitJob(51, "invoice_portal", CONFIG)).isInstanceOf(JobOutcome.AlreadyProcessed.class);
    }

    @Test
    @DisplayName("a job finished by a concurrent run between claim and start is served from its stored result")
    void jobFinishedBeforeStartShouldBeServedAsAlreadyProcessed() {
        // given: another instance of this worker holds the job and finishes it right after our claim.
        IdempotencyKey key = claimStore.computeIdempotencyKey(52, "invoice_portal", CONFIG);
        ClaimOutcome.Claimed earlier = (ClaimOutcome.Claimed) claimStore.claim(key, "worker-a", 300);
        claimStore.transition(earlier.jobId(), JobStatus.PROCESSING, null);
        HookedClaimStore store = hookedClaimStore(outcome ->
            claimStore.complete(earlier.jobId(), objectMapper.createObjectNode().put("invoice", "F-052")));
        AtomicInteger runs = new AtomicInteger();
        JobService service = service(store, context -> {
            runs.incrementAndGet();
            return objectMapper.createObjectNode();
        });

        JobOutcome outcome = service.submitJob(52, "invoice_portal", CONFIG);

        assertThat(outcome).isInstanceOf(JobOutcome.AlreadyProcessed.class);
        JobOutcome.AlreadyProcessed processed = (JobOutcome.AlreadyProcessed) outcome;
        assertThat(processed.jobId()).isEqualTo(earlier.jobId());
        assertThat(processed.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(processed.result().path("invoice").asText()).isEqualTo("F-052");
        assertThat(runs).hasValue(0);
    }

    @Test
    @DisplayName("another service instance of the same worker reports InProgress while the job runs")
    void sameWorkerInAnotherInstanceShouldReportInProgress() throws Exception {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        JobService running = service(context -> {
            started.countDown();
            await(release);
            return objectMapper.createObjectNode();
        });
        AtomicInteger runs = new AtomicInteger();
        JobService other = service(context -> {
            runs.incrementAndGet();
            return objectMapper.createObjectNode();
        });
        pool = Executors.newSingleThreadExecutor();

        Future<JobOutcome> first = pool.submit(() -> running.submitJob(53, "invoice_portal", CONFIG));
        assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
        JobOutcome second = other.submitJob(53, "invoice_portal", CONFIG);
        release.countDown();
        JobOutcome.Completed completed = (JobOutcome.Completed) first.get(5, TimeUnit.SECONDS);

        assertThat(second).isEqualTo(new JobOutcome.InProgress(completed.jobId(), "worker-a"));
        assertThat(runs).hasValue(0);
        assertThat(claimStore.findById(completed.jobId()).orElseThrow().status()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    @DisplayName("a completed job is served from the stored result without running again")
    void completedJobShouldBeServedFromCache() {
        AtomicInteger runs = new AtomicInteger();
        JobService service = service(context -> {
            runs.incrementAndGet();
            assertThat(context.heartbeat()).isTrue();
            return objectMapper.createObjectNode().put("invoice", "F-002");
        });

        JobOutcome.Completed first = (JobOutcome.Completed) service.submitJob(43, "invoice_portal", CONFIG);
        JobOutcome again = service.submitJob(43, "invoice_portal", CONFIG);

        assertThat(runs).hasValue(1);
        assertThat(again).isInstanceOf(JobOutcome.AlreadyProcessed.class);
        JobOutcome.AlreadyProcessed cached = (JobOutcome.AlreadyProcessed) again;
        assertThat(cached.fromCache()).isTrue();
        assertThat(cached.jobId()).isEqualTo(first.jobId());
        assertThat(cached.status()).isEqualTo(JobStatus.COMPLETED);
        assertThat(cached.result()).isEqualTo(first.result());
    }

    @Test
    @DisplayName("exhausted routes fail the job and flag it for a human")
    void interventionShouldFailJobForHuman() {
        JobService service = service(context -> {
            throw new InterventionRequiredException("All routes exhausted", List.of("header", "hero", "footer"));
        });

        JobOutcome outcome = service.submitJob(44, "invoice_portal", CONFIG);

        assertThat(outcome).isInstanceOf(JobOutcome.Failed.class);
        JobOutcome.Failed failed = (JobOutcome.Failed) outcome;
        assertThat(failed.requiresHumanIntervention()).isTrue();
        assertThat(failed.error()).isEqualTo("All routes exhausted");
        JobRecord record = claimStore.findById(failed.jobId()).orElseThrow();
        assertThat(record.status()).isEqualTo(JobStatus.FAILED);
        assertThat(record.errorMessage()).isEqualTo("All routes exhausted");
    }

    @Test
    @DisplayName("an unexpected processor error fails the job and later submits return the stored error")
    void processorErrorShouldFailJob() {
        JobService service = service(context -> {
            throw new IllegalStateException("portal down");
        });

        JobOutcome.Failed failed = (JobOutcome.Failed) service.submitJob(45, "invoice_portal", CONFIG);
        JobOutcome again = service.submitJob(45, "invoice_portal", CONFIG);

        assertThat(failed.requiresHumanIntervention()).isFalse();
        assertThat(failed.error()).isEqualTo("portal down");
        assertThat(again).isInstanceOf(JobOutcome.AlreadyProcessed.class);
        assertThat(((JobOutcome.AlreadyProcessed) again).status()).isEqualTo(JobStatus.FAILED);
        assertThat(((JobOutcome.AlreadyProcessed) again).error()).isEqualTo("portal down");
    }

    @Test
    @DisplayName("a cancelled run is recorded as CANCELLED")
    void cancellationShouldMarkJobCancelled() {
        JobService service = service(context -> {
            throw new CancellationException("backoff interrupted");
        });

        JobOutcome.Failed failed = (JobOutcome.Failed) service.submitJob(46, "invoice_portal", CONFIG);

        assertThat(failed.error()).isEqualTo("Cancelled: backoff interrupted");
        assertThat(claimStore.findById(failed.jobId()).orElseThrow().status()).isEqualTo(JobStatus.CANCELLED);
    }

    @Test
    @DisplayName("an unknown operation type is rejected before any claim")
    void unknownOperationTypeShouldBeRejected() {
        JobService service = service(context -> objectMapper.nullNode());

        assertThatThrownBy(() -> service.submitJob(47, "bank_sync", CONFIG))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("bank_sync");
        IdempotencyKey key = claimStore.computeIdempotencyKey(47, "bank_sync", CONFIG);
        assertThat(claimStore.findByKey(key)).isEmpty();
    }

    @Test
    @DisplayName("two processors for one operation type are a wiring error")
    void duplicateProcessorsShouldBeRejected() {
        JobProcessor first = new ScriptedProcessor(context -> objectMapper.nullNode());
        JobProcessor second = new ScriptedProcessor(context -> objectMapper.nullNode());

        assertThatThrownBy(() -> new JobService(claimStore, persistenceCoordinator, properties,
            List.of(first, second)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("invoice_portal");
    }

    @Test
    @DisplayName("taking over a stale claim attempts recovery and passes it to the processor")
    void staleClaimShouldTriggerRecovery() {
        // given: a dead worker's claim that has gone stale.
        IdempotencyKey key = claimStore.computeIdempotencyKey(48, "invoice_portal", CONFIG);
        ClaimOutcome.Claimed dead = (ClaimOutcome.Claimed) claimStore.claim(key, "worker-dead", 300);
        claimStore.transition(dead.jobId(), JobStatus.PROCESSING, null);
        clock.advance(Duration.ofSeconds(301));
        RecoveryResult recovery = new RecoveryResult("recovery_1", dead.sessionId(), false, null, null, 3L,
            RecoveryStrategy.NONE, "No recovery points found");
        when(persistenceCoordinator.recoverSession(dead.sessionId())).thenReturn(recovery);
        AtomicReference<JobContext> seen = new AtomicReference<>();
        JobService service = service(context -> {
            seen.set(context);
            return objectMapper.createObjectNode().put("resumed", true);
        });

        JobOutcome outcome = service.submitJob(48, "invoice_portal", CONFIG);

        assertThat(outcome).isInstanceOf(JobOutcome.Completed.class);
        assertThat(((JobOutcome.Completed) outcome).jobId()).isEqualTo(dead.jobId());
        assertThat(((JobOutcome.Completed) outcome).retryCount()).isEqualTo(1);
        verify(persistenceCoordinator).recoverSession(dead.sessionId());
        assertThat(seen.get().recovery()).contains(recovery);
        assertThat(seen.get().sessionId()).isEqualTo(dead.sessionId());
        assertThat(seen.get().workerId()).isEqualTo("worker-a");
    }

    @Test
    @DisplayName("a recovery failure does not stop the reclaimed run")
    void recoveryFailureShouldStartFresh() {
        IdempotencyKey key = claimStore.computeIdempotencyKey(49, "invoice_portal", CONFIG);
        ClaimOutcome.Claimed dead = (ClaimOutcome.Claimed) claimStore.claim(key, "worker-dead", 300);
        clock.advance(Duration.ofSeconds(301));
        when(persistenceCoordinator.recoverSession(anyString())).thenThrow(new IllegalStateException("db down"));
        AtomicReference<JobContext> seen = new AtomicReference<>();
        JobService service = service(context -> {
            seen.set(context);
            return objectMapper.createObjectNode();
        });

        JobOutcome outcome = service.submitJob(49, "invoice_portal", CONFIG);

        assertThat(outcome).isInstanceOf(JobOutcome.Completed.class);
        assertThat(seen.get().recovery()).isEmpty();
        assertThat(claimStore.findById(dead.jobId()).orElseThrow().status()).isEqualTo(JobStatus.COMPLETED);
    }

    @Test
    @DisplayName("a fresh claim never attempts recovery")
    void freshClaimShouldSkipRecovery() {
        JobService service = service(context -> objectMapper.createObjectNode());

        service.submitJob(50, "invoice_portal", null);

        verify(persistenceCoordinator, never()).recoverSession(anyString());
    }

    private JobService service(Function<JobContext, JsonNode> script) {
        return service(claimStore, script);
    }

    private JobService service(ClaimStore store, Function<JobContext, JsonNode> script) {
        return new JobService(store, persistenceCoordinator, properties, List.of(new ScriptedProcessor(script)));
    }

    private HookedClaimStore hookedClaimStore(Consumer<ClaimOutcome> afterFirstClaim) {
        return new HookedClaimStore(database, objectMapper, properties, clock, afterFirstClaim);
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("latch not released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(e);
        }
    }

    /**
     * Runs a callback after the first claim has committed, before the caller sees it.
     */
    private static final class HookedClaimStore extends ClaimStore {

        private final AtomicInteger claims = new AtomicInteger();
        private final Consumer<ClaimOutcome> afterFirstClaim;

        private HookedClaimStore(TestDatabase database, ObjectMapper objectMapper, InvoiceBotProperties properties,
            MutableClock clock, Consumer<ClaimOutcome> afterFirstClaim) {
            super(database.jdbc(), database.transactionManager(), new ConfigFingerprint(objectMapper), objectMapper,
                properties, clock);
            this.afterFirstClaim = afterFirstClaim;
        }

        @Override
        public ClaimOutcome claim(IdempotencyKey key, String workerId, int timeoutSeconds) {
            ClaimOutcome outcome = super.claim(key, workerId, timeoutSeconds);
            if (claims.incrementAndGet() == 1) {
                afterFirstClaim.accept(outcome);
            }
            return outcome;
        }

        int claims() {
            return claims.get();
        }
    }

    private static final class ScriptedProcessor implements JobProcessor {

        private final Function<JobContext, JsonNode> script;

        private ScriptedProcessor(Function<JobContext, JsonNode> script) {
            this.script = script;
        }

        @Override
        public String operationType() {
            return "invoice_portal";
        }

        @Override
        public JsonNode process(JobContext context) {
            return script.apply(context);
        }
    }
}
