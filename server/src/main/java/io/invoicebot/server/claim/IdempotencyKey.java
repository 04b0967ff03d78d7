package io.invoicebot.server.claim;

public record IdempotencyKey(long ticketId, String operationType, String configHash, int retryCount) {

    public String asString() {
        return ticketId + ":" + operationType + ":" + configHash + ":" + retryCount;
    }

    @Override
    public String toString() {
        return asString();
    }
}
