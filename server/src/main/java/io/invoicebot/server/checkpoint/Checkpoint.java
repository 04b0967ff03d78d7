package io.invoicebot.server.checkpoint;

import io.invoicebot.server.codec.CompressionType;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public record Checkpoint(
    String checkpointId,
    String sessionId,
    String automationType,
    int currentStep,
    int totalSteps,
    Map<String, Object> stateData,
    Map<String, Object> executionContext,
    Map<String, Object> variables,
    Map<String, Object> performanceMetrics,
    List<Map<String, Object>> errorLog,
    CompressionType compressionType,
    long dataSizeBytes,
    String checksum,
    Instant createdAt
) {

    public Checkpoint {
        stateData = stateData == null ? Map.of() : stateData;
        executionContext = executionContext == null ? Map.of() : executionContext;
        variables = variables == null ? Map.of() : variables;
        performanceMetrics = performanceMetrics == null ? Map.of() : performanceMetrics;
        errorLog = errorLog == null ? List.of() : errorLog;
    }

    public static Checkpoint draft(
        String sessionId,
        String automationType,
        int currentStep,
        int totalSteps,
        Map<String, Object> stateData,
        Map<String, Object> executionContext,
        Map<String, Object> variables,
        Map<String, Object> performanceMetrics,
        List<Map<String, Object>> errorLog
    ) {
        return new Checkpoint(null, sessionId, automationType, currentStep, totalSteps, stateData,
            executionContext, variables, performanceMetrics, errorLog, null, 0L, null, null);
    }

    Checkpoint stored(String id, CompressionType compression, long size, String sum, Instant created) {
        return new Checkpoint(id, sessionId, automationType, currentStep, totalSteps, stateData,
            executionContext, variables, performanceMetrics, errorLog, compression, size, sum, created);
    }
}
