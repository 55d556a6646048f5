package com.guardianintel.claims.features.customers;

public record Photo(
    Long id,
    Long customerId,
    String url,
    String category,
    String description
) {}
