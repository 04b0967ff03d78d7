package io.invoicebot.server.checkpoint;

import io.invoicebot.server.codec.CompressionType;
import java.time.Instant;

public record SnapshotMetadata(
    String snapshotId,
    String sessionId,
    Integer currentStep,
    Integer totalSteps,
    CompressionType compressionType,
    long dataSizeBytes,
    String checksum,
    Instant createdAt
) {
}
