package com.guardianintel.claims.integration.carrier;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * What a carrier currently reports for one claim. Money fields are null when the
 * carrier did not report them.
 *
 * @param rawStatus label exactly as the carrier sent it, kept for display and audit
 */
public record CarrierStatusSnapshot(
    String carrierClaimId,
    String claimNumber,
    String rawStatus,
    CarrierClaimStatus status,
    String statusMessage,
    BigDecimal approvedValue,
    BigDecimal acv,
    BigDecimal paidToDate,
    AdjusterInfo adjuster,
    LocalDate inspectionDate,
    Instant lastUpdated
) {}
