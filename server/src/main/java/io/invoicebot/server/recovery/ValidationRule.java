package io.invoicebot.server.recovery;

import java.util.List;

public record ValidationRule(
    String ruleId,
    ValidationRuleType type,
    String description,
    List<String> requiredFields,
    String expectedSessionId
) {

    public static List<ValidationRule> defaultsFor(String sessionId) {
        return List.of(
            new ValidationRule("state_integrity", ValidationRuleType.REQUIRED_FIELDS,
                "Recovered state carries its state data and execution context",
                List.of(RecoveredState.STATE_DATA, RecoveredState.EXECUTION_CONTEXT), null),
            new ValidationRule("checkpoint_consistency", ValidationRuleType.SESSION_MATCH,
                "Recovered state belongs to the session being recovered", List.of(), sessionId),
            new ValidationRule("step_sequence", ValidationRuleType.STEP_RANGE,
                "Current step lies within [0, totalSteps]", List.of(), null)
        );
    }
}
