package io.invoicebot.server.codec;

public class StateCodecException extends RuntimeException {

    public StateCodecException(String message) {
        super(message);
    }

    public StateCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
