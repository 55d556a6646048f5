package com.guardianintel.claims.features.claims.lifecycle;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import com.guardianintel.claims.features.claims.model.ClaimStatus;
import com.guardianintel.claims.integration.carrier.CarrierClaimStatus;

/**
 * Fixed table from the canonical carrier vocabulary onto local statuses. Carrier
 * sub-states that have no local counterpart collapse onto the nearest one.
 */
public final class CarrierStatusMapping {

    private static final Map<CarrierClaimStatus, ClaimStatus> TABLE = new EnumMap<>(CarrierClaimStatus.class);

    static {
        TABLE.put(CarrierClaimStatus.RECEIVED, ClaimStatus.FILED);
        TABLE.put(CarrierClaimStatus.ASSIGNED, ClaimStatus.ADJUSTER_ASSIGNED);
        TABLE.put(CarrierClaimStatus.INSPECTION_SCHEDULED, ClaimStatus.INSPECTION_SCHEDULED);
        TABLE.put(CarrierClaimStatus.INSPECTION_COMPLETE, ClaimStatus.INSPECTION_SCHEDULED);
        TABLE.put(CarrierClaimStatus.UNDER_REVIEW, ClaimStatus.INSPECTION_SCHEDULED);
        TABLE.put(CarrierClaimStatus.APPROVED, ClaimStatus.APPROVED);
        TABLE.put(CarrierClaimStatus.PARTIALLY_APPROVED, ClaimStatus.APPROVED);
        TABLE.put(CarrierClaimStatus.SUPPLEMENT_APPROVED, ClaimStatus.APPROVED);
        TABLE.put(CarrierClaimStatus.PAYMENT_PROCESSING, ClaimStatus.APPROVED);
        TABLE.put(CarrierClaimStatus.DENIED, ClaimStatus.DENIED);
        TABLE.put(CarrierClaimStatus.SUPPLEMENT_REQUESTED, ClaimStatus.SUPPLEMENT);
        TABLE.put(CarrierClaimStatus.PAYMENT_ISSUED, ClaimStatus.PAID);
        TABLE.put(CarrierClaimStatus.CLOSED, ClaimStatus.CLOSED);
    }

    private CarrierStatusMapping() {
    }

    /** Empty for an unrecognised carrier label (null canonical status). */
    public static Optional<ClaimStatus> toLocal(CarrierClaimStatus carrierStatus) {
        return carrierStatus == null ? Optional.empty() : Optional.ofNullable(TABLE.get(carrierStatus));
    }

    public static Map<CarrierClaimStatus, ClaimStatus> table() {
        return Collections.unmodifiableMap(TABLE);
    }
}
