package io.invoicebot.server.recovery;

public enum RecoveryStatus {
    RECOVERABLE,
    PARTIAL,
    CORRUPTED,
    MISSING
}
