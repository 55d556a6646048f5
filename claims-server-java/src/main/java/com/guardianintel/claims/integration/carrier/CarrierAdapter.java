package com.guardianintel.claims.integration.carrier;

/**
 * One implementation per insurance carrier. Adding a carrier means adding an
 * adapter bean and a {@code claims.carriers.<code>} entry; nothing else changes.
 */
public interface CarrierAdapter {

    String carrierCode();

    /**
     * Submits a first notice of loss.
     *
     * @throws com.guardianintel.claims.exception.UnsupportedCarrierOperationException if the carrier has no direct filing
     * @throws com.guardianintel.claims.exception.CarrierException on carrier rejection or transport failure
     */
    FilingResult file(FilingRequest request);

    /**
     * Polls the carrier for the current state of a filed claim.
     *
     * @throws com.guardianintel.claims.exception.UnsupportedCarrierOperationException if the carrier has no status sync
     * @throws com.guardianintel.claims.exception.CarrierException on carrier rejection or transport failure
     */
    CarrierStatusSnapshot fetchStatus(String carrierClaimId);

    /** Cheap connectivity probe for health reporting. */
    boolean ping();
}
