package com.slidemaker.orchestrator.gateway;

/**
 * Failure of an external model call, classified so the step runner can tell
 * transient problems from ones retrying cannot fix.
 */
public class GatewayException extends RuntimeException {

    public enum Kind { AUTHENTICATION, RATE_LIMITED, TIMEOUT, SERVER_ERROR, TRANSPORT, BAD_REQUEST, INVALID_RESPONSE, UNSUPPORTED }

    private final Kind kind;
    private final int  statusCode;

    public GatewayException(Kind kind, String message) {
        this(kind, -1, message, null);
    }

    public GatewayException(Kind kind, String message, Throwable cause) {
        this(kind, -1, message, cause);
    }

    public GatewayException(Kind kind, int statusCode, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind       = kind;
        this.statusCode = statusCode;
    }

    /** Maps an HTTP status from the provider onto a failure kind. */
    public static Kind kindForStatus(int status) {
        return switch (status) {
            case 401, 403 -> Kind.AUTHENTICATION;
            case 429      -> Kind.RATE_LIMITED;
            case 408, 504 -> Kind.TIMEOUT;
            default       -> status >= 500 ? Kind.SERVER_ERROR : Kind.BAD_REQUEST;
        };
    }

    public Kind getKind()   { return kind; }

    /** HTTP status, or -1 when the failure happened before a response arrived. */
    public int statusCode() { return statusCode; }

    public boolean isRetryable() {
        return switch (kind) {
            case AUTHENTICATION, BAD_REQUEST, UNSUPPORTED -> false;
            case RATE_LIMITED, TIMEOUT, SERVER_ERROR, TRANSPORT, INVALID_RESPONSE -> true;
        };
    }
}
