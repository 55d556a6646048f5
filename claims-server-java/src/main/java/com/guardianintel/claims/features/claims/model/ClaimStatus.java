package com.guardianintel.claims.features.claims.model;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Local lifecycle vocabulary. Stored by enum name, exposed by hyphenated code.
 */
public enum ClaimStatus {
    PENDING("pending", "Pending"),
    FILED("filed", "Filed"),
    ADJUSTER_ASSIGNED("adjuster-assigned", "Adjuster Assigned"),
    INSPECTION_SCHEDULED("inspection-scheduled", "Inspection Scheduled"),
    APPROVED("approved", "Approved"),
    SUPPLEMENT("supplement", "Supplement Filed"),
    PAID("paid", "Paid"),
    CLOSED("closed", "Closed"),
    DENIED("denied", "Denied");

    private final String code;
    private final String label;

    ClaimStatus(String code, String label) {
        this.code = code;
        this.label = label;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String label() {
        return label;
    }

    public boolean isTerminal() {
        return this == CLOSED || this == DENIED;
    }

    @JsonCreator
    public static ClaimStatus fromCode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Claim status is required");
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(s -> s.code.equalsIgnoreCase(normalized) || s.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown claim status: " + value));
    }
}
