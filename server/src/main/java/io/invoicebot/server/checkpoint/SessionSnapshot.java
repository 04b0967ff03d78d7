package io.invoicebot.server.checkpoint;

import java.time.Instant;
import java.util.List;
import java.util.Map;

public record SessionSnapshot(
    String snapshotId,
    String sessionId,
    Map<String, Object> automationState,
    Map<String, Object> browserState,
    byte[] memoryDump,
    byte[] screenshot,
    String domSnapshot,
    List<Map<String, Object>> networkLogs,
    List<Map<String, Object>> consoleLogs,
    Map<String, Object> customData,
    Instant createdAt
) {

    public SessionSnapshot {
        automationState = automationState == null ? Map.of() : automationState;
        browserState = browserState == null ? Map.of() : browserState;
        networkLogs = networkLogs == null ? List.of() : networkLogs;
        consoleLogs = consoleLogs == null ? List.of() : consoleLogs;
        customData = customData == null ? Map.of() : customData;
    }

    public Integer currentStep() {
        return automationState.get("current_step") instanceof Integer step ? step : null;
    }

    public Integer totalSteps() {
        return automationState.get("total_steps") instanceof Integer total ? total : null;
    }
}
