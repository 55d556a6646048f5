package com.guardianintel.claims.features.claims.service;

import com.guardianintel.claims.features.claims.model.InsuranceClaim;
import com.guardianintel.claims.integration.carrier.FilingResult;

/**
 * @param refiled true when the claim had already been filed before this call
 */
public record FilingOutcome(
    InsuranceClaim claim,
    FilingResult result,
    boolean refiled
) {}
