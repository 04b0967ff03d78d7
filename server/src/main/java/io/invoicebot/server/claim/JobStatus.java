package io.invoicebot.server.claim;

import java.util.EnumSet;
import java.util.Set;

public enum JobStatus {
    PENDING,
    CLAIMED,
    PROCESSING,
    COMPLETED,
    FAILED,
    TIMEOUT,
    CANCELLED;

    public boolean isActive() {
        return this == CLAIMED || this == PROCESSING;
    }

    public boolean isFinished() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMEOUT || this == CANCELLED;
    }

    // Statuses a row must hold for a transition into this one to be accepted.
    public Set<JobStatus> allowedSources() {
        return switch (this) {
            case PROCESSING -> EnumSet.of(CLAIMED);
            case COMPLETED, FAILED -> EnumSet.of(PROCESSING);
            case TIMEOUT, CANCELLED -> EnumSet.of(PENDING, CLAIMED, PROCESSING);
            case PENDING, CLAIMED -> EnumSet.noneOf(JobStatus.class);
        };
    }
}
