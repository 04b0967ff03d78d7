package io.invoicebot.server.recovery;

import java.time.Instant;
import java.util.List;

public record RecoveryPlan(
    String recoveryId,
    String sessionId,
    String checkpointId,
    RecoveryPointType targetType,
    RecoveryStrategy strategy,
    List<RecoveryPoint> recoveryPoints,
    RecoveryStatus recoveryStatus,
    double recoveryConfidence,
    double dataIntegrityScore,
    int estimatedRecoverySeconds,
    List<RecoveryOption> recoveryOptions,
    List<ValidationRule> validationRules,
    List<String> skippedPointIds,
    String statusReason,
    Instant createdAt
) {

    public RecoveryPlan {
        recoveryPoints = List.copyOf(recoveryPoints);
        recoveryOptions = List.copyOf(recoveryOptions);
        validationRules = List.copyOf(validationRules);
        skippedPointIds = List.copyOf(skippedPointIds);
    }

    public boolean isRecoverable() {
        return recoveryStatus == RecoveryStatus.RECOVERABLE;
    }
}
