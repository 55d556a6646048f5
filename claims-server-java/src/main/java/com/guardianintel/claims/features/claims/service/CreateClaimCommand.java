package com.guardianintel.claims.features.claims.service;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.guardianintel.claims.features.claims.model.AdjusterContact;
import com.guardianintel.claims.features.claims.model.ClaimType;

/**
 * Input for a new claim. {@code carrier} and {@code deductible} fall back to the
 * customer's policy data when absent; {@code claimType} defaults to roof.
 */
public record CreateClaimCommand(
    Long customerId,
    String carrier,
    ClaimType claimType,
    LocalDate dateOfLoss,
    BigDecimal initialEstimate,
    BigDecimal approvedValue,
    BigDecimal acv,
    BigDecimal deductible,
    LocalDate inspectionDate,
    AdjusterContact adjuster,
    String scopeOfWork,
    String notes
) {}
