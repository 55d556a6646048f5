package com.guardianintel.claims.features.claims.service;

import java.math.BigDecimal;
import java.time.LocalDate;

import com.guardianintel.claims.features.claims.model.AdjusterContact;
import com.guardianintel.claims.features.claims.model.ClaimType;

/**
 * Partial update of informational and financial fields. Null means "leave as is".
 * Status and filing fields are deliberately absent.
 */
public record UpdateClaimCommand(
    String carrier,
    ClaimType claimType,
    LocalDate dateOfLoss,
    LocalDate inspectionDate,
    LocalDate reinspectionDate,
    BigDecimal initialEstimate,
    BigDecimal approvedValue,
    BigDecimal acv,
    BigDecimal deductible,
    BigDecimal supplementValue,
    BigDecimal totalPaid,
    AdjusterContact adjuster,
    String scopeOfWork,
    String notes
) {}
