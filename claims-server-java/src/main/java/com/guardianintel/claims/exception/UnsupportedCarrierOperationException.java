package com.guardianintel.claims.exception;

/**
 * Capability gate: the carrier does not offer the requested operation.
 * Always raised before any request leaves the process.
 */
public class UnsupportedCarrierOperationException extends ClaimsException {

    private final String carrierCode;

    public UnsupportedCarrierOperationException(String carrierCode, String operation) {
        super("UNSUPPORTED_OPERATION", "Carrier '" + carrierCode + "' does not support " + operation);
        this.carrierCode = carrierCode;
    }

    public String getCarrierCode() {
        return carrierCode;
    }
}
