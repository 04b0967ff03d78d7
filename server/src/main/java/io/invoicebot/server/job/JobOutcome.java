package io.invoicebot.server.job;

import com.fasterxml.jackson.databind.JsonNode;
import io.invoicebot.server.claim.JobStatus;

/**
 * What a caller of {@link JobService#submitJob} gets back. Claim races, reclaims and recovery never surface
 * as exceptions; only the diagnostic fields here hint at them.
 */
public sealed interface JobOutcome {

    record Completed(long jobId, String sessionId, JsonNode result, int retryCount) implements JobOutcome {
    }

    record Failed(Long jobId, String error, boolean requiresHumanIntervention, int retryCount)
        implements JobOutcome {
    }

    record InProgress(Long jobId, String holder) implements JobOutcome {
    }

    record AlreadyProcessed(long jobId, JobStatus status, JsonNode result, String error, int retryCount)
        implements JobOutcome {

        public boolean fromCache() {
            return true;
        }
    }
}
