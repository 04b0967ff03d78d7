package io.invoicebot.server.claim;

public sealed interface ClaimOutcome {

    record Claimed(long jobId, String sessionId, boolean reclaimed, int retryCount) implements ClaimOutcome {
    }

    record AlreadyProcessed(JobRecord record) implements ClaimOutcome {
    }

    // jobId is null when the local lock timed out before any row was visible.
    record HeldByOther(Long jobId, String holder) implements ClaimOutcome {
    }
}
