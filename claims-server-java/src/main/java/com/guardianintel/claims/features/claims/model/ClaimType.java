package com.guardianintel.claims.features.claims.model;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ClaimType {
    ROOF("roof"),
    SIDING("siding"),
    GUTTERS("gutters"),
    FULL_EXTERIOR("full-exterior"),
    INTERIOR("interior");

    private final String code;

    ClaimType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static ClaimType fromCode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Claim type is required");
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(t -> t.code.equalsIgnoreCase(normalized) || t.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown claim type: " + value));
    }
}
