package io.invoicebot.server.recovery;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import io.invoicebot.server.checkpoint.Checkpoint;
import io.invoicebot.server.checkpoint.SnapshotMetadata;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RecoveryPlannerTest {

    @TempDir
    Path tempDir;

    private RecoveryFixture fixture;

    @BeforeEach
    void setUp() {
        fixture = new RecoveryFixture(tempDir);
    }

    @Test
    @DisplayName("a single intact checkpoint gives a direct recovery plan")
    void intactCheckpointShouldPlanDirectRecovery() {
        Checkpoint checkpoint = fixture.checkpoint("session_b", 6, 10);

        RecoveryPlan plan = fixture.planner.plan("session_b");

        assertThat(plan.recoveryStatus()).isEqualTo(RecoveryStatus.RECOVERABLE);
        assertThat(plan.strategy()).isEqualTo(RecoveryStrategy.DIRECT_CHECKPOINT_RECOVERY);
        assertThat(plan.strategy().code()).isEqualTo("direct_checkpoint_recovery");
        assertThat(plan.checkpointId()).isEqualTo(checkpoint.checkpointId());
        assertThat(plan.recoveryConfidence()).isEqualTo(0.95);
        assertThat(plan.dataIntegrityScore()).isEqualTo(1.0);
        assertThat(plan.estimatedRecoverySeconds()).isEqualTo(30);
        assertThat(plan.recoveryOptions()).singleElement()
            .satisfies(option -> {
                assertThat(option.optionId()).isEqualTo("opt_" + checkpoint.checkpointId());
                assertThat(option.description()).isEqualTo("Recover from step 6");
            });
        assertThat(plan.validationRules()).extracting(ValidationRule::ruleId)
            .containsExactly("state_integrity", "checkpoint_consistency", "step_sequence");
    }

    @Test
    @DisplayName("every checkpoint corrupted makes the plan CORRUPTED")
    void allCorruptedShouldPlanCorrupted() {
        fixture.corrupt(fixture.checkpoint("session_c", 1, 10));
        fixture.corrupt(fixture.checkpoint("session_c", 2, 10));
        fixture.corrupt(fixture.checkpoint("session_c", 3, 10));

        RecoveryPlan plan = fixture.planner.plan("session_c");

        assertThat(plan.recoveryStatus()).isEqualTo(RecoveryStatus.CORRUPTED);
        assertThat(plan.isRecoverable()).isFalse();
        assertThat(plan.recoveryConfidence()).isZero();
        assertThat(plan.dataIntegrityScore()).isEqualTo(0.1);
        assertThat(plan.skippedPointIds()).hasSize(3);
    }

    @Test
    @DisplayName("a corrupted newest checkpoint falls back to the previous one with lower confidence")
    void corruptedNewestShouldFallBack() {
        Checkpoint older = fixture.checkpoint("session_f", 3, 10);
        Checkpoint newest = fixture.checkpoint("session_f", 5, 10);
        fixture.corrupt(newest);

        RecoveryPlan plan = fixture.planner.plan("session_f");

        assertThat(plan.recoveryStatus()).isEqualTo(RecoveryStatus.RECOVERABLE);
        assertThat(plan.checkpointId()).isEqualTo(older.checkpointId());
        assertThat(plan.skippedPointIds()).containsExactly(newest.checkpointId());
        assertThat(plan.recoveryConfidence()).isCloseTo(0.855, within(1e-9));
        assertThat(plan.strategy()).isEqualTo(RecoveryStrategy.CHECKPOINT_WITH_VALIDATION);
    }

    @Test
    @DisplayName("an unreadable newest checkpoint is skipped like a corrupted one")
    void unreadableNewestShouldFallBack() {
        Checkpoint older = fixture.checkpoint("session_u", 2, 10);
        Checkpoint newest = fixture.checkpoint("session_u", 4, 10);
        fixture.replaceWithDirectory(newest);

        RecoveryPlan plan = fixture.planner.plan("session_u");

        assertThat(plan.recoveryStatus()).isEqualTo(RecoveryStatus.RECOVERABLE);
        assertThat(plan.checkpointId()).isEqualTo(older.checkpointId());
        assertThat(plan.skippedPointIds()).containsExactly(newest.checkpointId());
    }

    @Test
    @DisplayName("a session whose only checkpoint is unreadable is CORRUPTED, not MISSING")
    void unreadableOnlyCheckpointShouldPlanCorrupted() {
        fixture.replaceWithDirectory(fixture.checkpoint("session_v", 1, 4));

        RecoveryPlan plan = fixture.planner.plan("session_v");

        assertThat(plan.recoveryStatus()).isEqualTo(RecoveryStatus.CORRUPTED);
        assertThat(plan.dataIntegrityScore()).isZero();
    }

    @Test
    @DisplayName("deleted files and empty sessions are MISSING, not CORRUPTED")
    void missingPointsShouldPlanMissing() {
        fixture.delete(fixture.checkpoint("session_m", 1, 4));

        assertThat(fixture.planner.plan("session_m").recoveryStatus()).isEqualTo(RecoveryStatus.MISSING);
        RecoveryPlan empty = fixture.planner.plan("session_none");
        assertThat(empty.recoveryStatus()).isEqualTo(RecoveryStatus.MISSING);
        assertThat(empty.strategy()).isEqualTo(RecoveryStrategy.NONE);
        assertThat(empty.recoveryPoints()).isEmpty();
    }

    @Test
    @DisplayName("checkpoints are preferred over newer snapshots, snapshots are the last resort")
    void snapshotShouldOnlyBeUsedWhenCheckpointsFail() {
        Checkpoint checkpoint = fixture.checkpoint("session_s", 2, 8);
        SnapshotMetadata snapshot = fixture.snapshot("session_s", 4, 8);

        RecoveryPlan preferCheckpoint = fixture.planner.plan("session_s");
        assertThat(preferCheckpoint.checkpointId()).isEqualTo(checkpoint.checkpointId());
        assertThat(preferCheckpoint.recoveryPoints()).extracting(RecoveryPoint::pointId)
            .containsExactly(snapshot.snapshotId(), checkpoint.checkpointId());

        fixture.corrupt(checkpoint);
        RecoveryPlan fallback = fixture.planner.plan("session_s");
        assertThat(fallback.targetType()).isEqualTo(RecoveryPointType.SNAPSHOT);
        assertThat(fallback.strategy()).isEqualTo(RecoveryStrategy.SNAPSHOT_RECOVERY);
        assertThat(fallback.estimatedRecoverySeconds()).isEqualTo(120);
    }

    @Test
    @DisplayName("an explicit target is honoured, an unknown one is MISSING")
    void explicitTargetShouldBeHonoured() {
        Checkpoint older = fixture.checkpoint("session_t", 1, 5);
        fixture.checkpoint("session_t", 2, 5);

        assertThat(fixture.planner.plan("session_t", older.checkpointId()).checkpointId())
            .isEqualTo(older.checkpointId());
        assertThat(fixture.planner.plan("session_t", "chk_nope").recoveryStatus())
            .isEqualTo(RecoveryStatus.MISSING);
    }

    @Test
    @DisplayName("an intact checkpoint with a step beyond the total is PARTIAL")
    void outOfRangeStepShouldBePartial() {
        fixture.checkpoint("session_p", 12, 10);

        assertThat(fixture.planner.plan("session_p").recoveryStatus()).isEqualTo(RecoveryStatus.PARTIAL);
    }

    @Test
    @DisplayName("large payloads add two seconds per megabyte above ten")
    void estimateShouldGrowWithSize() {
        long twentyMb = 20L * 1024 * 1024;

        assertThat(RecoveryPlanner.estimateSeconds(RecoveryStrategy.DIRECT_CHECKPOINT_RECOVERY, 1024)).isEqualTo(30);
        assertThat(RecoveryPlanner.estimateSeconds(RecoveryStrategy.CHECKPOINT_WITH_VALIDATION, twentyMb))
            .isEqualTo(100);
        assertThat(RecoveryPlanner.strategyFor(RecoveryPointType.CHECKPOINT, 0.89))
            .isEqualTo(RecoveryStrategy.CHECKPOINT_WITH_VALIDATION);
    }
}
