package com.guardianintel.claims.features.claims.model;

import com.fasterxml.jackson.annotation.JsonInclude;

// Informational only, no invariant attached
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AdjusterContact(
    String name,
    String phone,
    String email,
    String company
) {}
