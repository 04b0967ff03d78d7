package io.invoicebot.server.automation;

public enum ResultStatus {
    SUCCESS,
    FAILED,
    NOT_VISIBLE,
    NOT_FOUND,
    ERROR,
    PARTIAL,
    TIMEOUT,
    REQUIRES_INTERVENTION
}
