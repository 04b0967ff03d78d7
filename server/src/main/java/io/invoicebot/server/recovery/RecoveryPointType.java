package io.invoicebot.server.recovery;

public enum RecoveryPointType {
    CHECKPOINT(0.95),
    SNAPSHOT(0.90);

    private final double confidence;

    RecoveryPointType(double confidence) {
        this.confidence = confidence;
    }

    public double confidence() {
        return confidence;
    }
}
