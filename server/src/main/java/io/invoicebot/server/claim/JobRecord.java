package io.invoicebot.server.claim;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

public record JobRecord(
    long id,
    String idempotencyKey,
    long ticketId,
    String operationType,
    String sessionId,
    JobStatus status,
    String claimedBy,
    Instant claimedAt,
    Instant completedAt,
    JsonNode result,
    String errorMessage,
    int retryCount,
    Instant createdAt,
    Instant updatedAt
) {
}
