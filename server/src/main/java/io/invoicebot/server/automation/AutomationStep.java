package io.invoicebot.server.automation;

import java.time.Instant;

public record AutomationStep(
    String sessionId,
    int stepNumber,
    String routeName,
    ActionType actionType,
    String selector,
    String description,
    ResultStatus resultStatus,
    long timingMs,
    boolean retryUsed,
    String reasoning,
    String evidenceRef,
    Instant recordedAt
) {
}
