package com.guardianintel.claims.exception;

public class InvariantViolationException extends ClaimsException {

    public InvariantViolationException(String message) {
        super("INVARIANT_VIOLATION", message);
    }
}
