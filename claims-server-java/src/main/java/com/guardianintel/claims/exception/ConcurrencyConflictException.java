package com.guardianintel.claims.exception;

public class ConcurrencyConflictException extends ClaimsException {

    public ConcurrencyConflictException(Long claimId, String message) {
        super("CONCURRENCY_CONFLICT", "Claim " + claimId + ": " + message);
    }

    public ConcurrencyConflictException(Long claimId, String message, Throwable cause) {
        super("CONCURRENCY_CONFLICT", "Claim " + claimId + ": " + message, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
