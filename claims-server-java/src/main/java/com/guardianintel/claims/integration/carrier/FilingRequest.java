package com.guardianintel.claims.integration.carrier;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Carrier-neutral first notice of loss. Adapters translate it to their own wire
 * format; nothing in here is carrier specific.
 */
public record FilingRequest(
    Long internalClaimId,
    String policyNumber,
    String policyholderName,
    String propertyAddress,
    LocalDate dateOfLoss,
    CauseOfLoss causeOfLoss,
    String lossDescription,
    List<DamageArea> damageAreas,
    boolean emergencyRepairsNeeded,
    BigDecimal emergencyRepairCost,
    BigDecimal initialEstimate,
    List<PhotoReference> photos
) {
    public FilingRequest {
        damageAreas = damageAreas == null ? List.of() : List.copyOf(damageAreas);
        photos = photos == null ? List.of() : List.copyOf(photos);
    }
}
