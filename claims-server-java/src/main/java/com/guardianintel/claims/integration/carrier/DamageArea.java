package com.guardianintel.claims.integration.carrier;

import com.fasterxml.jackson.annotation.JsonClassDescription;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

@JsonClassDescription("One damaged part of the property")
public record DamageArea(
    @JsonPropertyDescription("Damaged element, e.g. roof, siding, gutters, windows, interior")
    String damageType,

    @JsonPropertyDescription("minor, moderate or severe")
    DamageSeverity severity,

    @JsonPropertyDescription("Optional: free-text detail")
    String description
) {}
