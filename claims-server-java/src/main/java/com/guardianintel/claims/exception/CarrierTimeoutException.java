package com.guardianintel.claims.exception;

import java.time.Duration;

public class CarrierTimeoutException extends ClaimsException {

    public CarrierTimeoutException(String carrierCode, String operation, Duration timeout) {
        super("CARRIER_TIMEOUT", "Carrier '" + carrierCode + "' did not answer " + operation + " within " + timeout.toMillis() + "ms");
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
