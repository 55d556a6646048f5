package com.guardianintel.claims.features.claims.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.guardianintel.claims.integration.carrier.CauseOfLoss;
import com.guardianintel.claims.integration.carrier.DamageArea;

/**
 * What the user supplies when filing a claim with its carrier. Policyholder name
 * and property address come from the customer record; the policy number does too
 * unless given here.
 */
public record FileClaimCommand(
    String policyNumber,
    CauseOfLoss causeOfLoss,
    String lossDescription,
    List<DamageArea> damageAreas,
    boolean emergencyRepairsNeeded,
    BigDecimal emergencyRepairCost,
    List<Long> photoIds
) {
    public FileClaimCommand {
        // null elements are kept so validation can name them
        damageAreas = damageAreas == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(damageAreas));
        photoIds = photoIds == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(photoIds));
    }
}
