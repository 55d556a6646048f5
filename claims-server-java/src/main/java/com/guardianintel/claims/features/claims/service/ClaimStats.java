package com.guardianintel.claims.features.claims.service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Dashboard figures across all claims.
 *
 * @param approvalRate percentage of decided claims (approved, paid, closed or denied) that were not denied
 * @param needsAction  claims waiting on the roofer: pending, filed, adjuster-assigned or supplement
 */
public record ClaimStats(
    long totalClaims,
    long recentClaims,
    long needsAction,
    int approvalRate,
    Map<String, Long> statusBreakdown,
    Financials financials,
    List<CarrierCount> byCarrier,
    List<TypeCount> byType,
    List<AtRiskClaim> atRiskClaims
) {

    public record Financials(
        BigDecimal totalEstimated,
        BigDecimal totalApproved,
        BigDecimal totalPaid,
        BigDecimal totalSupplements,
        BigDecimal pendingRevenue
    ) {}

    public record CarrierCount(String carrier, long count, BigDecimal approvedValue) {}

    public record TypeCount(String type, long count) {}

    public record AtRiskClaim(Long id, String customer, String carrier, BigDecimal approvedValue, long daysSinceApproval) {}
}
