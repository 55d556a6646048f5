package com.guardianintel.claims.integration.carrier;

public record PhotoReference(
    Long id,
    String url,
    String category,
    String description
) {}
