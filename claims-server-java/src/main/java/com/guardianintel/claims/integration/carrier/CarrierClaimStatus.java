package com.guardianintel.claims.integration.carrier;

import java.util.Arrays;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Canonical carrier-side status vocabulary. Each adapter maps its own labels
 * onto these values; the engine never sees raw carrier labels in its logic.
 */
public enum CarrierClaimStatus {
    RECEIVED("received"),
    ASSIGNED("assigned"),
    INSPECTION_SCHEDULED("inspection-scheduled"),
    INSPECTION_COMPLETE("inspection-complete"),
    UNDER_REVIEW("under-review"),
    APPROVED("approved"),
    PARTIALLY_APPROVED("partially-approved"),
    DENIED("denied"),
    SUPPLEMENT_REQUESTED("supplement-requested"),
    SUPPLEMENT_APPROVED("supplement-approved"),
    PAYMENT_PROCESSING("payment-processing"),
    PAYMENT_ISSUED("payment-issued"),
    CLOSED("closed");

    private final String code;

    CarrierClaimStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public static Optional<CarrierClaimStatus> fromCode(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().replace('_', '-');
        return Arrays.stream(values())
                .filter(s -> s.code.equalsIgnoreCase(normalized))
                .findFirst();
    }
}
