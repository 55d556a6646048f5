package com.guardianintel.claims.integration.carrier;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum CauseOfLoss {
    HAIL("hail"),
    WIND("wind"),
    TORNADO("tornado"),
    HURRICANE("hurricane"),
    FIRE("fire"),
    WATER("water"),
    LIGHTNING("lightning"),
    FALLEN_TREE("fallen-tree"),
    OTHER("other");

    private final String code;

    CauseOfLoss(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    @JsonCreator
    public static CauseOfLoss fromCode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Cause of loss is required");
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(c -> c.code.equalsIgnoreCase(normalized) || c.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown cause of loss: " + value));
    }
}
