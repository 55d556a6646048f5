package com.guardianintel.claims.features.claims.sync;

import java.time.Instant;
import java.util.List;

/**
 * Summary of one sweep across all carriers.
 *
 * @param skippedCarriers carriers whose batch was abandoned after too many consecutive failures
 * @param skippedClaims   claims not attempted because their carrier was skipped
 */
public record SweepReport(
    Instant startedAt,
    Instant finishedAt,
    int candidates,
    int synced,
    int statusChanges,
    int conflicts,
    int timedOut,
    int failed,
    int skippedClaims,
    List<String> skippedCarriers,
    List<String> errors
) {
    public SweepReport {
        skippedCarriers = List.copyOf(skippedCarriers);
        errors = List.copyOf(errors);
    }
}
