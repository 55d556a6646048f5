package com.guardianintel.claims.exception;

/**
 * Root of the claim engine's error taxonomy. Every subtype carries a stable
 * error code so REST and MCP callers can branch without parsing messages.
 */
public abstract class ClaimsException extends RuntimeException {

    private final String errorCode;

    protected ClaimsException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected ClaimsException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /** Whether the caller may retry the same request later. */
    public boolean isRetryable() {
        return false;
    }
}
