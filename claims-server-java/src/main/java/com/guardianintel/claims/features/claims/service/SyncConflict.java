package com.guardianintel.claims.features.claims.service;

import com.guardianintel.claims.features.claims.model.ClaimStatus;

/**
 * The carrier reported a status the claim cannot move to from where it is, usually
 * a stale one. Returned as a warning; the local status is kept.
 */
public record SyncConflict(
    ClaimStatus localStatus,
    ClaimStatus carrierStatus,
    String carrierRawStatus,
    String message
) {}
