package com.guardianintel.claims.exception;

/**
 * A carrier rejected a request or could not be reached. The carrier's own code
 * and message are preserved so the user can correct the input and retry.
 */
public class CarrierException extends ClaimsException {

    private final String carrierCode;
    private final String carrierErrorCode;
    private final boolean retryable;

    public CarrierException(String carrierCode, String carrierErrorCode, String message, boolean retryable) {
        super("CARRIER_ERROR", message);
        this.carrierCode = carrierCode;
        this.carrierErrorCode = carrierErrorCode;
        this.retryable = retryable;
    }

    public CarrierException(String carrierCode, String carrierErrorCode, String message, boolean retryable, Throwable cause) {
        super("CARRIER_ERROR", message, cause);
        this.carrierCode = carrierCode;
        this.carrierErrorCode = carrierErrorCode;
        this.retryable = retryable;
    }

    public String getCarrierCode() {
        return carrierCode;
    }

    public String getCarrierErrorCode() {
        return carrierErrorCode;
    }

    @Override
    public boolean isRetryable() {
        return retryable;
    }
}
