package io.invoicebot.server.checkpoint;

public enum IntegrityFailure {
    MISSING(0.0),
    UNREADABLE(0.0),
    CHECKSUM_MISMATCH(0.1),
    SIZE_MISMATCH(0.3),
    UNDECODABLE(0.5);

    private final double score;

    IntegrityFailure(double score) {
        this.score = score;
    }

    public double score() {
        return score;
    }
}
