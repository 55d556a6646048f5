package com.guardianintel.claims.exception;

import com.guardianintel.claims.features.claims.model.ClaimStatus;

/**
 * Raised when the lifecycle rejects an edge, or when an operation requires a
 * claim state the claim is not in.
 */
public class InvalidTransitionException extends ClaimsException {

    public InvalidTransitionException(ClaimStatus from, ClaimStatus to) {
        super("INVALID_TRANSITION", "Transition " + from.code() + " -> " + to.code() + " is not allowed");
    }

    public InvalidTransitionException(String message) {
        super("INVALID_TRANSITION", message);
    }
}
