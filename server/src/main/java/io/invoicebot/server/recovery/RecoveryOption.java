package io.invoicebot.server.recovery;

public record RecoveryOption(
    String optionId,
    String pointId,
    RecoveryPointType type,
    String description,
    double confidence,
    int estimatedSeconds
) {
}
