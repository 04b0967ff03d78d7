package io.invoicebot.server.recovery;

public enum ValidationRuleType {
    REQUIRED_FIELDS,
    SESSION_MATCH,
    STEP_RANGE
}
