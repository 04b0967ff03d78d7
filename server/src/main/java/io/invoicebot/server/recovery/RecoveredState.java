package io.invoicebot.server.recovery;

import java.time.Instant;
import java.util.Map;

public record RecoveredState(
    String sessionId,
    String automationType,
    int currentStep,
    int totalSteps,
    Map<String, Object> stateData,
    Map<String, Object> executionContext,
    Map<String, Object> variables,
    String recoveredFrom,
    Instant recoveredAt
) {

    public static final String STATE_DATA = "stateData";
    public static final String EXECUTION_CONTEXT = "executionContext";
    public static final String VARIABLES = "variables";

    // Decoding turns an absent section into an empty map, so empty counts as missing.
    public boolean hasField(String field) {
        return switch (field) {
            case STATE_DATA -> stateData != null && !stateData.isEmpty();
            case EXECUTION_CONTEXT -> executionContext != null && !executionContext.isEmpty();
            case VARIABLES -> variables != null && !variables.isEmpty();
            case "sessionId" -> sessionId != null && !sessionId.isBlank();
            case "automationType" -> automationType != null && !automationType.isBlank();
            default -> false;
        };
    }
}
