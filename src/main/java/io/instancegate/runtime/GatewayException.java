package io.instancegate.runtime;

public final class GatewayException extends RuntimeException {
    private final FailureKind kind;

    public GatewayException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GatewayException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind kind() {
        return kind;
    }

    public static GatewayException unauthorized(String message) {
        return new GatewayException(FailureKind.UNAUTHORIZED, message);
    }

    public static GatewayException conflict(String message) {
        return new GatewayException(FailureKind.CONFLICT, message);
    }

    public static GatewayException badRequest(String message) {
        return new GatewayException(FailureKind.BAD_REQUEST, message);
    }
}
