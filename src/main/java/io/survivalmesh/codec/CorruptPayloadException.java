package io.survivalmesh.codec;

public final class CorruptPayloadException extends RuntimeException {
    public CorruptPayloadException(String message) {
        super(message);
    }

    public CorruptPayloadException(String message, Throwable cause) {
        super(message, cause);
    }
}
