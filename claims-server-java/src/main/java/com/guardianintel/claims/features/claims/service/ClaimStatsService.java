package com.guardianintel.claims.features.claims.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.guardianintel.claims.features.claims.model.ClaimStatus;
import com.guardianintel.claims.features.claims.model.InsuranceClaim;
import com.guardianintel.claims.features.claims.repository.ClaimRepository;
import com.guardianintel.claims.features.customers.Customer;
import com.guardianintel.claims.features.customers.CustomerDirectory;

@Service
public class ClaimStatsService {

    private static final Duration RECENT = Duration.ofDays(30);
    private static final int AT_RISK_LIMIT = 10;
    private static final Set<ClaimStatus> NEEDS_ACTION = EnumSet.of(
            ClaimStatus.PENDING, ClaimStatus.FILED, ClaimStatus.ADJUSTER_ASSIGNED, ClaimStatus.SUPPLEMENT);

    private final ClaimRepository repository;
    private final CustomerDirectory customers;
    private final Clock clock;

    public ClaimStatsService(ClaimRepository repository, CustomerDirectory customers, Clock clock) {
        this.repository = repository;
        this.customers = customers;
        this.clock = clock;
    }

    public ClaimStats stats() {
        List<InsuranceClaim> claims = repository.findAll();
        Instant now = clock.instant();
        Instant cutoff = now.minus(RECENT);

        Map<String, Long> statusBreakdown = new LinkedHashMap<>();
        for (ClaimStatus status : ClaimStatus.values()) {
            statusBreakdown.put(status.code(), claims.stream().filter(c -> c.getStatus() == status).count());
        }

        long approvedLike = statusBreakdown.get(ClaimStatus.APPROVED.code())
                + statusBreakdown.get(ClaimStatus.PAID.code())
                + statusBreakdown.get(ClaimStatus.CLOSED.code());
        long decided = approvedLike + statusBreakdown.get(ClaimStatus.DENIED.code());
        int approvalRate = decided > 0 ? (int) Math.round(approvedLike * 100.0 / decided) : 0;

        BigDecimal totalApproved = sum(claims, InsuranceClaim::getApprovedValue);
        BigDecimal totalPaid = sum(claims, InsuranceClaim::getTotalPaid);
        ClaimStats.Financials financials = new ClaimStats.Financials(
                sum(claims, InsuranceClaim::getInitialEstimate),
                totalApproved,
                totalPaid,
                sum(claims, InsuranceClaim::getSupplementValue),
                totalApproved.subtract(totalPaid));

        List<ClaimStats.CarrierCount> byCarrier = claims.stream()
                .collect(Collectors.groupingBy(InsuranceClaim::getCarrier, LinkedHashMap::new, Collectors.toList()))
                .entrySet().stream()
                .map(e -> new ClaimStats.CarrierCount(e.getKey(), e.getValue().size(), sum(e.getValue(), InsuranceClaim::getApprovedValue)))
                .sorted(Comparator.comparingLong(ClaimStats.CarrierCount::count).reversed())
                .toList();

        List<ClaimStats.TypeCount> byType = claims.stream()
                .filter(c -> c.getClaimType() != null)
                .collect(Collectors.groupingBy(c -> c.getClaimType().code(), LinkedHashMap::new, Collectors.counting()))
                .entrySet().stream()
                .map(e -> new ClaimStats.TypeCount(e.getKey(), e.getValue()))
                .toList();

        // Approved but untouched for 30 days: payment is probably stuck
        List<ClaimStats.AtRiskClaim> atRisk = claims.stream()
                .filter(c -> c.getStatus() == ClaimStatus.APPROVED && c.getUpdatedAt() != null && c.getUpdatedAt().isBefore(cutoff))
                .sorted(Comparator.comparing(InsuranceClaim::getUpdatedAt))
                .limit(AT_RISK_LIMIT)
                .map(c -> new ClaimStats.AtRiskClaim(
                        c.getId(),
                        customers.findById(c.getCustomerId()).map(Customer::fullName).orElse("Unknown customer"),
                        c.getCarrier(),
                        c.getApprovedValue(),
                        Duration.between(c.getUpdatedAt(), now).toDays()))
                .toList();

        return new ClaimStats(
                claims.size(),
                claims.stream().filter(c -> c.getCreatedAt() != null && !c.getCreatedAt().isBefore(cutoff)).count(),
                claims.stream().filter(c -> NEEDS_ACTION.contains(c.getStatus())).count(),
                approvalRate,
                statusBreakdown,
                financials,
                byCarrier,
                byType,
                atRisk);
    }

    private static BigDecimal sum(List<InsuranceClaim> claims, Function<InsuranceClaim, BigDecimal> field) {
        return claims.stream()
                .map(field)
                .filter(v -> v != null)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
