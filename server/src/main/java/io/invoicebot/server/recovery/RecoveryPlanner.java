package io.invoicebot.server.recovery;

import io.invoicebot.server.checkpoint.CheckpointMetadata;
import io.invoicebot.server.checkpoint.CheckpointStore;
import io.invoicebot.server.checkpoint.IntegrityFailure;
import io.invoicebot.server.checkpoint.IntegrityReport;
import io.invoicebot.server.checkpoint.SnapshotMetadata;
import io.invoicebot.server.checkpoint.SnapshotStore;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class RecoveryPlanner {

    private static final Logger log = LoggerFactory.getLogger(RecoveryPlanner.class);

    static final double DIRECT_RECOVERY_THRESHOLD = 0.9;
    static final double SKIPPED_POINT_PENALTY = 0.9;
    private static final int MAX_OPTIONS = 5;
    private static final long BYTES_PER_MB = 1024L * 1024L;

    private static final Comparator<RecoveryPoint> BY_RECENCY = Comparator
        .comparing(RecoveryPoint::createdAt, Comparator.reverseOrder())
        .thenComparing(RecoveryPoint::currentStep, Comparator.nullsLast(Comparator.reverseOrder()))
        .thenComparing(RecoveryPoint::type);

    private static final Comparator<RecoveryPoint> BY_TRUST = Comparator
        .comparingDouble(RecoveryPoint::confidence).reversed()
        .thenComparing(BY_RECENCY);

    private final CheckpointStore checkpointStore;
    private final SnapshotStore snapshotStore;
    private final Clock clock;

    public RecoveryPlanner(CheckpointStore checkpointStore, SnapshotStore snapshotStore, Clock clock) {
        this.checkpointStore = checkpointStore;
        this.snapshotStore = snapshotStore;
        this.clock = clock;
    }

    public List<RecoveryPoint> listRecoveryPoints(String sessionId) {
        List<RecoveryPoint> points = new ArrayList<>();
        for (CheckpointMetadata checkpoint : checkpointStore.listMetadata(sessionId)) {
            points.add(new RecoveryPoint(checkpoint.checkpointId(), RecoveryPointType.CHECKPOINT, sessionId,
                checkpoint.currentStep(), checkpoint.totalSteps(), checkpoint.dataSizeBytes(),
                checkpoint.createdAt(), RecoveryPointType.CHECKPOINT.confidence()));
        }
        for (SnapshotMetadata snapshot : snapshotStore.listMetadata(sessionId)) {
            points.add(new RecoveryPoint(snapshot.snapshotId(), RecoveryPointType.SNAPSHOT, sessionId,
                snapshot.currentStep(), snapshot.totalSteps(), snapshot.dataSizeBytes(),
                snapshot.createdAt(), RecoveryPointType.SNAPSHOT.confidence()));
        }
        points.sort(BY_RECENCY);
        return points;
    }

    public RecoveryPlan plan(String sessionId) {
        return plan(sessionId, null);
    }

    public RecoveryPlan plan(String sessionId, String targetPointId) {
        String recoveryId = "rec_" + UUID.randomUUID().toString().replace("-", "");
        List<RecoveryPoint> points = listRecoveryPoints(sessionId);
        List<RecoveryOption> options = optionsFor(points);

        if (points.isEmpty()) {
            return unavailable(recoveryId, sessionId, null, null, points, options, List.of(), 0.0,
                "No recovery points for session " + sessionId);
        }

        List<RecoveryPoint> candidates;
        if (targetPointId != null) {
            candidates = points.stream().filter(p -> p.pointId().equals(targetPointId)).toList();
            if (candidates.isEmpty()) {
                return unavailable(recoveryId, sessionId, targetPointId, null, points, options, List.of(), 0.0,
                    "Recovery point " + targetPointId + " does not exist for session " + sessionId);
            }
        } else {
            candidates = points.stream().sorted(BY_TRUST).toList();
        }

        List<String> skipped = new ArrayList<>();
        List<IntegrityReport> failures = new ArrayList<>();
        for (RecoveryPoint candidate : candidates) {
            IntegrityReport report = validate(candidate);
            if (!report.valid()) {
                skipped.add(candidate.pointId());
                failures.add(report);
                continue;
            }
            double confidence = candidate.confidence() * Math.pow(SKIPPED_POINT_PENALTY, skipped.size());
            RecoveryStrategy strategy = strategyFor(candidate.type(), confidence);
            boolean stepsConsistent = stepsInRange(candidate);
            RecoveryStatus status = stepsConsistent ? RecoveryStatus.RECOVERABLE : RecoveryStatus.PARTIAL;
            String reason = stepsConsistent
                ? "Recovery point " + candidate.pointId() + " verified"
                : "Recovery point " + candidate.pointId() + " is intact but its step counters are out of range";
            if (!skipped.isEmpty()) {
                log.warn("Session {} falls back to {} after skipping unusable points {}",
                    sessionId, candidate.pointId(), skipped);
            }
            return new RecoveryPlan(recoveryId, sessionId, candidate.pointId(), candidate.type(), strategy, points,
                status, confidence, report.integrityScore(), estimateSeconds(strategy, candidate.sizeBytes()),
                options, ValidationRule.defaultsFor(sessionId), skipped, reason, clock.instant());
        }

        RecoveryPoint best = candidates.get(0);
        IntegrityReport bestReport = failures.get(0);
        boolean allMissing = failures.stream().allMatch(r -> r.failure() == IntegrityFailure.MISSING);
        RecoveryStatus status = allMissing ? RecoveryStatus.MISSING : RecoveryStatus.CORRUPTED;
        log.warn("Session {} has no usable recovery point: {} of {} candidates failed verification ({})",
            sessionId, failures.size(), candidates.size(), status);
        RecoveryStrategy strategy = strategyFor(best.type(), best.confidence());
        return new RecoveryPlan(recoveryId, sessionId, best.pointId(), best.type(), strategy, points, status, 0.0,
            bestReport.integrityScore(), estimateSeconds(strategy, best.sizeBytes()), options,
            ValidationRule.defaultsFor(sessionId), skipped, bestReport.reason(), clock.instant());
    }

    static RecoveryStrategy strategyFor(RecoveryPointType type, double confidence) {
        if (type == RecoveryPointType.SNAPSHOT) {
            return RecoveryStrategy.SNAPSHOT_RECOVERY;
        }
        return confidence >= DIRECT_RECOVERY_THRESHOLD
            ? RecoveryStrategy.DIRECT_CHECKPOINT_RECOVERY
            : RecoveryStrategy.CHECKPOINT_WITH_VALIDATION;
    }

    static int estimateSeconds(RecoveryStrategy strategy, long sizeBytes) {
        double sizeMb = (double) sizeBytes / BYTES_PER_MB;
        int seconds = strategy.baseSeconds();
        if (sizeMb > 10) {
            seconds += (int) Math.ceil(sizeMb * 2);
        }
        return seconds;
    }

    private IntegrityReport validate(RecoveryPoint point) {
        return switch (point.type()) {
            case CHECKPOINT -> checkpointStore.validateIntegrity(point.pointId());
            case SNAPSHOT -> snapshotStore.validateIntegrity(point.pointId());
        };
    }

    private boolean stepsInRange(RecoveryPoint point) {
        if (point.currentStep() == null || point.totalSteps() == null) {
            return true;
        }
        return point.currentStep() >= 0 && point.currentStep() <= point.totalSteps();
    }

    private List<RecoveryOption> optionsFor(List<RecoveryPoint> points) {
        return points.stream()
            .limit(MAX_OPTIONS)
            .map(point -> point.type() == RecoveryPointType.CHECKPOINT
                ? new RecoveryOption("opt_" + point.pointId(), point.pointId(), point.type(),
                    "Recover from step " + point.currentStep(), point.confidence(), 30)
                : new RecoveryOption("opt_" + point.pointId(), point.pointId(), point.type(),
                    "Recover from snapshot", point.confidence(), 60))
            .toList();
    }

    private RecoveryPlan unavailable(
        String recoveryId,
        String sessionId,
        String targetId,
        RecoveryPointType targetType,
        List<RecoveryPoint> points,
        List<RecoveryOption> options,
        List<String> skipped,
        double integrityScore,
        String reason
    ) {
        log.info("No recovery possible for session {}: {}", sessionId, reason);
        return new RecoveryPlan(recoveryId, sessionId, targetId, targetType, RecoveryStrategy.NONE, points,
            RecoveryStatus.MISSING, 0.0, integrityScore, 0, options, ValidationRule.defaultsFor(sessionId), skipped,
            reason, clock.instant());
    }
}
