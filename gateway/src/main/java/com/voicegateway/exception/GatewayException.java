package com.voicegateway.exception;

/**
 * Base exception for every typed failure the gateway reports.
 * Subclasses fix the {@link ErrorKind}; handlers branch on the kind, never on the message.
 */
public abstract class GatewayException extends RuntimeException {

    private final ErrorKind kind;

    protected GatewayException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected GatewayException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
