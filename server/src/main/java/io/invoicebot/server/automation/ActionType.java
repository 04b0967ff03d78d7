package io.invoicebot.server.automation;

public enum ActionType {
    SEARCH_ELEMENTS,
    VALIDATE_VISIBILITY,
    CLICK,
    NAVIGATE,
    SUBMIT,
    ORACLE_DECISION,
    ORACLE_ATTEMPT,
    ESCALATION
}
