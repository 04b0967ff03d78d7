package io.invoicebot.server.automation;

public enum AttemptOutcome {
    SUCCEEDED,
    EXHAUSTED,
    CANCELLED
}
