package io.invoicebot.server.recovery;

import java.time.Instant;

public record RecoveryPoint(
    String pointId,
    RecoveryPointType type,
    String sessionId,
    Integer currentStep,
    Integer totalSteps,
    long sizeBytes,
    Instant createdAt,
    double confidence
) {
}
