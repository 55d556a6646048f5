package com.guardianintel.claims.features.claims.controller;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.guardianintel.claims.features.claims.lifecycle.ClaimFinancials;
import com.guardianintel.claims.features.claims.model.AdjusterContact;
import com.guardianintel.claims.features.claims.model.ClaimStatus;
import com.guardianintel.claims.features.claims.model.ClaimType;
import com.guardianintel.claims.features.claims.model.StatusHistoryEntry;

/**
 * Claim as shown to REST and assistant callers: stored fields plus the derived
 * money summary and what can be done next.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ClaimView(
    Long id,
    Long version,
    Long customerId,
    String carrier,
    String carrierName,
    ClaimType claimType,
    ClaimStatus status,
    String statusLabel,
    boolean filedWithCarrier,
    String carrierClaimId,
    String claimNumber,
    String carrierStatus,
    Instant carrierLastSync,
    String lastSyncError,
    LocalDate dateOfLoss,
    LocalDate inspectionDate,
    LocalDate reinspectionDate,
    LocalDate lastSupplementDate,
    AdjusterContact adjuster,
    String scopeOfWork,
    String notes,
    ClaimFinancials financials,
    Set<ClaimStatus> allowedTransitions,
    boolean canFileWithCarrier,
    boolean canSyncStatus,
    List<StatusHistoryEntry> statusHistory,
    Instant createdAt,
    Instant updatedAt
) {}
