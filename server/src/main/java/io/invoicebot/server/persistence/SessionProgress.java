package io.invoicebot.server.persistence;

import java.util.List;
import java.util.Map;

public record SessionProgress(
    int currentStep,
    int totalSteps,
    Map<String, Object> stateData,
    Map<String, Object> executionContext,
    Map<String, Object> variables,
    Map<String, Object> performanceMetrics,
    List<Map<String, Object>> errorLog
) {
}
