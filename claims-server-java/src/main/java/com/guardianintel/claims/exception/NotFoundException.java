package com.guardianintel.claims.exception;

public class NotFoundException extends ClaimsException {

    public NotFoundException(String entity, Object id) {
        super("NOT_FOUND", entity + " not found: " + id);
    }
}
