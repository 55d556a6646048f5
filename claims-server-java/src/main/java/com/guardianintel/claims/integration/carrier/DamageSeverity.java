package com.guardianintel.claims.integration.carrier;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum DamageSeverity {
    MINOR,
    MODERATE,
    SEVERE;

    @JsonValue
    public String code() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static DamageSeverity fromCode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Damage severity is required");
        }
        return valueOf(value.trim().toUpperCase());
    }
}
