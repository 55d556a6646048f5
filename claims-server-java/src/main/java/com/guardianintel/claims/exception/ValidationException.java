package com.guardianintel.claims.exception;

public class ValidationException extends ClaimsException {

    public ValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }
}
