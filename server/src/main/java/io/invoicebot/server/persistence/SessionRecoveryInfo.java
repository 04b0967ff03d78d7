package io.invoicebot.server.persistence;

import io.invoicebot.server.recovery.RecoveryPlan;
import io.invoicebot.server.recovery.RecoveryPlanRepository;
import io.invoicebot.server.recovery.RecoveryPoint;
import java.util.List;

public record SessionRecoveryInfo(
    String sessionId,
    List<RecoveryPoint> recoveryPoints,
    RecoveryPlan plan,
    RecoveryRecommendation recommendation,
    RecoveryPlanRepository.RecoveryAttempt lastAttempt,
    boolean autoCheckpointActive
) {
}
