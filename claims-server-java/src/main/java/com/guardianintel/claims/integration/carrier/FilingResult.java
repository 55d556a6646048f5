package com.guardianintel.claims.integration.carrier;

import java.time.LocalDate;
import java.util.List;

public record FilingResult(
    String carrierClaimId,
    String claimNumber,
    CarrierClaimStatus status,
    String statusMessage,
    AdjusterInfo assignedAdjuster,
    LocalDate estimatedResponseDate,
    List<String> nextSteps,
    String trackingUrl
) {
    public FilingResult {
        nextSteps = nextSteps == null ? List.of() : List.copyOf(nextSteps);
    }
}
