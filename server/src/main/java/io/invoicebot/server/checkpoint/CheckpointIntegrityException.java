package io.invoicebot.server.checkpoint;

public class CheckpointIntegrityException extends RuntimeException {

    private final String id;
    private final IntegrityFailure failure;

    public CheckpointIntegrityException(String id, IntegrityFailure failure, String message) {
        super(message);
        this.id = id;
        this.failure = failure;
    }

    public CheckpointIntegrityException(String id, IntegrityFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.id = id;
        this.failure = failure;
    }

    public String getId() {
        return id;
    }

    public IntegrityFailure getFailure() {
        return failure;
    }
}
