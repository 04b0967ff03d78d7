package io.invoicebot.server.persistence;

import io.invoicebot.server.checkpoint.Checkpoint;
import io.invoicebot.server.checkpoint.CheckpointStore;
import io.invoicebot.server.checkpoint.SessionSnapshot;
import io.invoicebot.server.checkpoint.SnapshotMetadata;
import io.invoicebot.server.checkpoint.SnapshotStore;
import io.invoicebot.server.recovery.RecoveryExecutor;
import io.invoicebot.server.recovery.RecoveryPlan;
import io.invoicebot.server.recovery.RecoveryPlanRepository;
import io.invoicebot.server.recovery.RecoveryPlanner;
import io.invoicebot.server.recovery.RecoveryResult;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Entry point for session persistence: periodic auto-checkpoints, manual checkpoints and snapshots, and recovery.
 */
@Service
public class PersistenceCoordinator {

    private static final Logger log = LoggerFactory.getLogger(PersistenceCoordinator.class);

    private final CheckpointStore checkpointStore;
    private final SnapshotStore snapshotStore;
    private final RecoveryPlanner recoveryPlanner;
    private final RecoveryExecutor recoveryExecutor;
    private final RecoveryPlanRepository recoveryPlanRepository;
    private final TaskScheduler scheduler;
    private final Clock clock;
    private final Map<String, AutoCheckpointLoop> loops = new ConcurrentHashMap<>();

    public PersistenceCoordinator(
        CheckpointStore checkpointStore,
        SnapshotStore snapshotStore,
        RecoveryPlanner recoveryPlanner,
        RecoveryExecutor recoveryExecutor,
        RecoveryPlanRepository recoveryPlanRepository,
        @Qualifier("checkpointScheduler") TaskScheduler scheduler,
        Clock clock
    ) {
        this.checkpointStore = checkpointStore;
        this.snapshotStore = snapshotStore;
        this.recoveryPlanner = recoveryPlanner;
        this.recoveryExecutor = recoveryExecutor;
        this.recoveryPlanRepository = recoveryPlanRepository;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public boolean startSessionPersistence(
        String sessionId,
        String automationType,
        SessionStateProvider stateProvider,
        Duration interval
    ) {
        AutoCheckpointLoop loop = new AutoCheckpointLoop(sessionId, automationType, stateProvider);
        if (loops.putIfAbsent(sessionId, loop) != null) {
            log.warn("Auto-checkpoint already running for session {}", sessionId);
            return false;
        }
        loop.future = scheduler.scheduleWithFixedDelay(loop, clock.instant().plus(interval), interval);
        log.info("Auto-checkpoint started for session {} every {} s", sessionId, interval.toSeconds());
        return true;
    }

    public boolean stopSessionPersistence(String sessionId) {
        AutoCheckpointLoop loop = loops.remove(sessionId);
        if (loop == null) {
            return false;
        }
        loop.cancel();
        log.info("Auto-checkpoint stopped for session {} after {} checkpoints", sessionId, loop.saved);
        return true;
    }

    public boolean isPersistenceActive(String sessionId) {
        return loops.containsKey(sessionId);
    }

    public Checkpoint createCheckpoint(Checkpoint checkpoint) {
        Checkpoint saved = checkpointStore.save(checkpoint);
        AutoCheckpointLoop loop = loops.get(saved.sessionId());
        if (loop != null) {
            loop.markSaved(saved.currentStep());
        }
        return saved;
    }

    public SnapshotMetadata createSnapshot(SessionSnapshot snapshot) {
        return snapshotStore.save(snapshot);
    }

    public RecoveryResult recoverSession(String sessionId) {
        return recoverSession(sessionId, null);
    }

    public RecoveryResult recoverSession(String sessionId, String targetPointId) {
        RecoveryPlan plan = recoveryPlanner.plan(sessionId, targetPointId);
        RecoveryResult result = recoveryExecutor.execute(plan);
        recoveryPlanRepository.save(plan, result);
        return result;
    }

    public SessionRecoveryInfo getSessionRecoveryInfo(String sessionId) {
        RecoveryPlan plan = recoveryPlanner.plan(sessionId);
        return new SessionRecoveryInfo(
            sessionId,
            plan.recoveryPoints(),
            plan,
            RecoveryRecommendation.forConfidence(plan.recoveryConfidence()),
            recoveryPlanRepository.latestForSession(sessionId).orElse(null),
            isPersistenceActive(sessionId)
        );
    }

    @PreDestroy
    public void stopAll() {
        loops.keySet().forEach(this::stopSessionPersistence);
    }

    final class AutoCheckpointLoop implements Runnable {

        private final String sessionId;
        private final String automationType;
        private final SessionStateProvider stateProvider;
        private volatile ScheduledFuture<?> future;
        private volatile boolean cancelled;
        private int lastStep = -1;
        private int saved;

        AutoCheckpointLoop(String sessionId, String automationType, SessionStateProvider stateProvider) {
            this.sessionId = sessionId;
            this.automationType = automationType;
            this.stateProvider = stateProvider;
        }

        @Override
        public void run() {
            if (cancelled) {
                return;
            }
            try {
                SessionProgress progress = stateProvider.currentProgress();
                synchronized (this) {
                    if (progress == null || progress.currentStep() <= lastStep) {
                        return;
                    }
                }
                Checkpoint saved = checkpointStore.save(Checkpoint.draft(sessionId, automationType,
                    progress.currentStep(), progress.totalSteps(), progress.stateData(), progress.executionContext(),
                    progress.variables(), progress.performanceMetrics(), progress.errorLog()));
                markSaved(saved.currentStep());
            } catch (RuntimeException e) {
                log.warn("Auto-checkpoint failed for session {}", sessionId, e);
            }
        }

        synchronized void markSaved(int step) {
            lastStep = Math.max(lastStep, step);
            saved++;
        }

        void cancel() {
            cancelled = true;
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
