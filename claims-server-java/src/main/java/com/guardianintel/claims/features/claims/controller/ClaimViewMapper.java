package com.guardianintel.claims.features.claims.controller;

import java.util.List;

import org.springframework.stereotype.Component;

import com.guardianintel.claims.features.claims.lifecycle.ClaimStateMachine;
import com.guardianintel.claims.features.claims.lifecycle.FinancialReconciler;
import com.guardianintel.claims.features.claims.model.ClaimStatus;
import com.guardianintel.claims.features.claims.model.InsuranceClaim;
import com.guardianintel.claims.integration.carrier.CarrierCapabilityRegistry;

@Component
public class ClaimViewMapper {

    private final FinancialReconciler reconciler;
    private final CarrierCapabilityRegistry registry;

    public ClaimViewMapper(FinancialReconciler reconciler, CarrierCapabilityRegistry registry) {
        this.reconciler = reconciler;
        this.registry = registry;
    }

    public ClaimView toView(InsuranceClaim claim) {
        ClaimStatus status = claim.getStatus();
        boolean fileable = (status == ClaimStatus.PENDING || status == ClaimStatus.FILED)
                && registry.supportsDirectFiling(claim.getCarrier());
        boolean syncable = claim.isFiledWithCarrier() && !status.isTerminal()
                && registry.supportsStatusSync(claim.getCarrier());

        return new ClaimView(
                claim.getId(),
                claim.getVersion(),
                claim.getCustomerId(),
                claim.getCarrier(),
                registry.displayName(claim.getCarrier()),
                claim.getClaimType(),
                status,
                status.label(),
                claim.isFiledWithCarrier(),
                claim.getCarrierClaimId(),
                claim.getClaimNumber(),
                claim.getCarrierStatus(),
                claim.getCarrierLastSync(),
                claim.getLastSyncError(),
                claim.getDateOfLoss(),
                claim.getInspectionDate(),
                claim.getReinspectionDate(),
                claim.getLastSupplementDate(),
                claim.getAdjuster(),
                claim.getScopeOfWork(),
                claim.getNotes(),
                reconciler.summarize(claim),
                ClaimStateMachine.allowedTargets(status),
                fileable,
                syncable,
                claim.getStatusHistory(),
                claim.getCreatedAt(),
                claim.getUpdatedAt());
    }

    public List<ClaimView> toViews(List<InsuranceClaim> claims) {
        return claims.stream().map(this::toView).toList();
    }
}
