package io.invoicebot.server.recovery;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecoveryStrategy {
    NONE("none", 0),
    DIRECT_CHECKPOINT_RECOVERY("direct_checkpoint_recovery", 30),
    CHECKPOINT_WITH_VALIDATION("checkpoint_with_validation", 60),
    SNAPSHOT_RECOVERY("snapshot_recovery", 120);

    private final String code;
    private final int baseSeconds;

    RecoveryStrategy(String code, int baseSeconds) {
        this.code = code;
        this.baseSeconds = baseSeconds;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public int baseSeconds() {
        return baseSeconds;
    }
}
