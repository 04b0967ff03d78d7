package io.invoicebot.server.recovery;

import io.invoicebot.server.checkpoint.Checkpoint;
import io.invoicebot.server.checkpoint.CheckpointIntegrityException;
import io.invoicebot.server.checkpoint.CheckpointStore;
import io.invoicebot.server.checkpoint.SessionSnapshot;
import io.invoicebot.server.checkpoint.SnapshotStore;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class RecoveryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RecoveryExecutor.class);

    private final CheckpointStore checkpointStore;
    private final SnapshotStore snapshotStore;
    private final Clock clock;

    public RecoveryExecutor(CheckpointStore checkpointStore, SnapshotStore snapshotStore, Clock clock) {
        this.checkpointStore = checkpointStore;
        this.snapshotStore = snapshotStore;
        this.clock = clock;
    }

    public RecoveryResult execute(RecoveryPlan plan) {
        long started = System.nanoTime();
        if (!plan.isRecoverable()) {
            log.warn("Refusing recovery {} for session {}: status {}",
                plan.recoveryId(), plan.sessionId(), plan.recoveryStatus());
            return RecoveryResult.failed(plan,
                "Recovery not possible, status " + plan.recoveryStatus() + ": " + plan.statusReason(), 0L);
        }

        RecoveredState state;
        try {
            state = switch (plan.targetType()) {
                case CHECKPOINT -> fromCheckpoint(checkpointStore.load(plan.checkpointId()));
                case SNAPSHOT -> fromSnapshot(snapshotStore.load(plan.checkpointId()));
            };
        } catch (CheckpointIntegrityException e) {
            log.warn("Recovery {} aborted, {} became unusable: {}", plan.recoveryId(), e.getId(), e.getMessage());
            return RecoveryResult.failed(plan, e.getMessage(), elapsedMs(started));
        }

        ValidationReport validation = validate(state, plan);
        long elapsed = elapsedMs(started);
        log.info("Recovery {} restored session {} to step {}/{} from {} in {} ms (valid={})",
            plan.recoveryId(), state.sessionId(), state.currentStep(), state.totalSteps(), state.recoveredFrom(),
            elapsed, validation.overallValid());
        return new RecoveryResult(plan.recoveryId(), plan.sessionId(), true, state, validation, elapsed,
            plan.strategy(), null);
    }

    private RecoveredState fromCheckpoint(Checkpoint checkpoint) {
        return new RecoveredState(
            checkpoint.sessionId(),
            checkpoint.automationType(),
            checkpoint.currentStep(),
            checkpoint.totalSteps(),
            checkpoint.stateData(),
            checkpoint.executionContext(),
            checkpoint.variables(),
            checkpoint.checkpointId(),
            clock.instant()
        );
    }

    private RecoveredState fromSnapshot(SessionSnapshot snapshot) {
        Map<String, Object> automationState = snapshot.automationState();
        Object automationType = automationState.get("automation_type");
        return new RecoveredState(
            snapshot.sessionId(),
            automationType instanceof String type ? type : null,
            snapshot.currentStep() == null ? 0 : snapshot.currentStep(),
            snapshot.totalSteps() == null ? 0 : snapshot.totalSteps(),
            automationState,
            snapshot.customData(),
            Map.of(),
            snapshot.snapshotId(),
            clock.instant()
        );
    }

    private ValidationReport validate(RecoveredState state, RecoveryPlan plan) {
        List<RuleResult> results = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (ValidationRule rule : plan.validationRules()) {
            RuleResult result = apply(rule, state);
            results.add(result);
            if (!result.passed()) {
                errors.add(rule.ruleId() + ": " + result.message());
            }
        }
        if (!plan.skippedPointIds().isEmpty()) {
            warnings.add("Skipped unusable recovery points " + plan.skippedPointIds());
        }
        if (plan.targetType() == RecoveryPointType.SNAPSHOT) {
            warnings.add("Recovered from snapshot " + plan.checkpointId() + ", step counters come from its automation state");
        }
        if (!errors.isEmpty()) {
            log.warn("Recovery {} validation failed: {}", plan.recoveryId(), errors);
        }
        return new ValidationReport(errors.isEmpty(), results, errors, warnings);
    }

    private RuleResult apply(ValidationRule rule, RecoveredState state) {
        return switch (rule.type()) {
            case REQUIRED_FIELDS -> {
                List<String> missing = rule.requiredFields().stream().filter(f -> !state.hasField(f)).toList();
                yield missing.isEmpty()
                    ? new RuleResult(rule.ruleId(), true, "All required fields present")
                    : new RuleResult(rule.ruleId(), false, "Missing required fields " + missing);
            }
            case SESSION_MATCH -> rule.expectedSessionId().equals(state.sessionId())
                ? new RuleResult(rule.ruleId(), true, "Session id matches")
                : new RuleResult(rule.ruleId(), false,
                    "Expected session " + rule.expectedSessionId() + " but found " + state.sessionId());
            case STEP_RANGE -> state.currentStep() >= 0 && state.currentStep() <= state.totalSteps()
                ? new RuleResult(rule.ruleId(), true, "Step within range")
                : new RuleResult(rule.ruleId(), false,
                    "Step " + state.currentStep() + " outside [0, " + state.totalSteps() + "]");
        };
    }

    private long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
