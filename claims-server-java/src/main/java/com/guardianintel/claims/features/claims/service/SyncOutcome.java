package com.guardianintel.claims.features.claims.service;

import com.guardianintel.claims.features.claims.model.ClaimStatus;
import com.guardianintel.claims.features.claims.model.InsuranceClaim;
import com.guardianintel.claims.integration.carrier.CarrierStatusSnapshot;

/**
 * Result of one status sync.
 *
 * @param snapshot what the carrier reported; null when the call timed out
 * @param conflict non-null when the carrier's status was not applied
 */
public record SyncOutcome(
    InsuranceClaim claim,
    ClaimStatus previousStatus,
    CarrierStatusSnapshot snapshot,
    SyncConflict conflict,
    boolean timedOut
) {

    public boolean statusChanged() {
        return claim.getStatus() != previousStatus;
    }

    public boolean hasConflict() {
        return conflict != null;
    }
}
