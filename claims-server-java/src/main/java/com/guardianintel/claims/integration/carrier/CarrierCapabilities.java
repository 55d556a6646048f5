package com.guardianintel.claims.integration.carrier;

/**
 * What a carrier integration can do. Callers consult this before offering
 * "file with carrier" or "sync status" to a user.
 */
public record CarrierCapabilities(
    String code,
    String displayName,
    boolean supportsDirectFiling,
    boolean supportsStatusSync,
    boolean testMode
) {
    public static CarrierCapabilities none(String code, String displayName) {
        return new CarrierCapabilities(code, displayName, false, false, false);
    }
}
