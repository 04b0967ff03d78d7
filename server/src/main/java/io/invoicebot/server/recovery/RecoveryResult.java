package io.invoicebot.server.recovery;

public record RecoveryResult(
    String recoveryId,
    String sessionId,
    boolean success,
    RecoveredState recoveredState,
    ValidationReport validation,
    long recoveryTimeMs,
    RecoveryStrategy strategy,
    String error
) {

    static RecoveryResult failed(RecoveryPlan plan, String error, long recoveryTimeMs) {
        return new RecoveryResult(plan.recoveryId(), plan.sessionId(), false, null, ValidationReport.notRun(),
            recoveryTimeMs, plan.strategy(), error);
    }
}
