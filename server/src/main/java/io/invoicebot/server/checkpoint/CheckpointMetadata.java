package io.invoicebot.server.checkpoint;

import io.invoicebot.server.codec.CompressionType;
import java.time.Instant;

public record CheckpointMetadata(
    String checkpointId,
    String sessionId,
    String automationType,
    int currentStep,
    int totalSteps,
    CompressionType compressionType,
    long dataSizeBytes,
    String checksum,
    Instant createdAt
) {
}
