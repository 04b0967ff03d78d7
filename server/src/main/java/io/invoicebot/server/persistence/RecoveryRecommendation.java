package io.invoicebot.server.persistence;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RecoveryRecommendation {
    IMMEDIATE_RECOVERY("immediate_recovery", "high"),
    RECOVERY_WITH_VALIDATION("recovery_with_validation", "medium"),
    MANUAL_INTERVENTION("manual_intervention", "low");

    private final String code;
    private final String confidenceLevel;

    RecoveryRecommendation(String code, String confidenceLevel) {
        this.code = code;
        this.confidenceLevel = confidenceLevel;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String confidenceLevel() {
        return confidenceLevel;
    }

    public static RecoveryRecommendation forConfidence(double confidence) {
        if (confidence >= 0.9) {
            return IMMEDIATE_RECOVERY;
        }
        if (confidence >= 0.7) {
            return RECOVERY_WITH_VALIDATION;
        }
        return MANUAL_INTERVENTION;
    }
}
