package com.guardianintel.claims.features.claims.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.guardianintel.claims.aspect.AuditedClaimOperation;
import com.guardianintel.claims.exception.CarrierException;
import com.guardianintel.claims.exception.CarrierTimeoutException;
import com.guardianintel.claims.exception.InvalidTransitionException;
import com.guardianintel.claims.exception.InvariantViolationException;
import com.guardianintel.claims.features.claims.lifecycle.CarrierStatusMapping;
import com.guardianintel.claims.features.claims.lifecycle.ClaimStateMachine;
import com.guardianintel.claims.features.claims.lifecycle.FinancialReconciler;
import com.guardianintel.claims.features.claims.model.ClaimStatus;
import com.guardianintel.claims.features.claims.model.InsuranceClaim;
import com.guardianintel.claims.integration.carrier.CarrierAdapter;
import com.guardianintel.claims.integration.carrier.CarrierCapabilityRegistry;
import com.guardianintel.claims.integration.carrier.CarrierStatusSnapshot;

import lombok.extern.slf4j.Slf4j;

/**
 * Pulls a filed claim's status from its carrier and reconciles it locally.
 * <p>
 * Carriers are authoritative for money, so reported amounts, adjuster and
 * inspection date always refresh. Status only moves forward: a carrier status the
 * claim cannot reach from where it is gets recorded as a history note and returned
 * as a {@link SyncConflict}.
 */
@Service
@Slf4j
public class ClaimSyncService {

    public static final String SYSTEM_ACTOR = "carrier-sync";

    private final ClaimStore store;
    private final ClaimLockManager lockManager;
    private final ClaimStateMachine stateMachine;
    private final FinancialReconciler reconciler;
    private final CarrierCapabilityRegistry registry;
    private final CarrierCallRunner callRunner;
    private final Clock clock;

    public ClaimSyncService(ClaimStore store,
                            ClaimLockManager lockManager,
                            ClaimStateMachine stateMachine,
                            FinancialReconciler reconciler,
                            CarrierCapabilityRegistry registry,
                            CarrierCallRunner callRunner,
                            Clock clock) {
        this.store = store;
        this.lockManager = lockManager;
        this.stateMachine = stateMachine;
        this.reconciler = reconciler;
        this.registry = registry;
        this.callRunner = callRunner;
        this.clock = clock;
    }

    /**
     * @throws InvalidTransitionException the claim was never filed with its carrier
     * @throws com.guardianintel.claims.exception.UnsupportedCarrierOperationException carrier has no status sync
     * @throws CarrierException carrier error; recorded on the claim before rethrowing
     * @throws InvariantViolationException carrier figures break a money invariant; recorded likewise
     */
    @AuditedClaimOperation("sync")
    public SyncOutcome sync(Long claimId, String actor) {
        try (ClaimLockManager.Handle ignored = lockManager.acquire(claimId)) {
            InsuranceClaim claim = store.load(claimId);
            if (!claim.isFiledWithCarrier()) {
                throw new InvalidTransitionException("Claim " + claimId + " has not been filed with its carrier; nothing to sync");
            }
            CarrierAdapter adapter = registry.requireStatusSync(claim.getCarrier());
            String carrierClaimId = claim.getCarrierClaimId();

            CarrierStatusSnapshot snapshot;
            try {
                snapshot = callRunner.call(claim.getCarrier(), "fetchStatus", () -> adapter.fetchStatus(carrierClaimId));
            } catch (CarrierTimeoutException e) {
                InsuranceClaim touched = claim.copy();
                touched.setCarrierLastSync(Instant.now(clock));
                return new SyncOutcome(store.save(touched), claim.getStatus(), null, null, true);
            } catch (CarrierException e) {
                recordFailure(claim, e.getCarrierErrorCode() + ": " + e.getMessage(), e);
                throw e;
            } catch (RuntimeException e) {
                recordFailure(claim, e.getClass().getSimpleName() + ": " + e.getMessage(), e);
                throw e;
            }

            try {
                return apply(claim, snapshot, actor);
            } catch (InvariantViolationException e) {
                log.error("Carrier figures for claim {} rejected: {}", claimId, e.getMessage());
                recordFailure(claim, "INVARIANT_VIOLATION: " + e.getMessage(), e);
                throw e;
            }
        }
    }

    private SyncOutcome apply(InsuranceClaim claim, CarrierStatusSnapshot snapshot, String actor) {
        InsuranceClaim working = claim.copy();
        if (snapshot.approvedValue() != null) working.setApprovedValue(snapshot.approvedValue());
        if (snapshot.acv() != null) working.setAcv(snapshot.acv());
        if (snapshot.paidToDate() != null) working.setTotalPaid(snapshot.paidToDate());
        if (snapshot.adjuster() != null) working.setAdjuster(ClaimFilingService.toContact(snapshot.adjuster()));
        if (snapshot.inspectionDate() != null) working.setInspectionDate(snapshot.inspectionDate());
        working.setCarrierStatus(snapshot.rawStatus());
        working.setCarrierLastSync(Instant.now(clock));
        working.setLastSyncError(null);

        ClaimStatus current = claim.getStatus();
        Optional<ClaimStatus> mapped = CarrierStatusMapping.toLocal(snapshot.status());
        SyncConflict conflict = null;
        InsuranceClaim next;

        if (mapped.isEmpty()) {
            log.warn("Claim {}: unrecognised carrier status '{}', refreshing amounts only", claim.getId(), snapshot.rawStatus());
            next = reconciler.reconcile(working);
        } else if (mapped.get() == current) {
            next = reconciler.reconcile(working);
        } else if (ClaimStateMachine.isReachable(current, mapped.get())) {
            next = stateMachine.advance(working, mapped.get(), actor, carrierNote(snapshot));
        } else {
            String message = "Carrier reports '" + snapshot.rawStatus() + "' (" + mapped.get().code()
                    + ") but claim is " + current.code() + "; local status kept";
            log.warn("Claim {}: {}", claim.getId(), message);
            conflict = new SyncConflict(current, mapped.get(), snapshot.rawStatus(), message);
            next = stateMachine.annotate(working, actor, "Sync conflict: " + message);
        }

        InsuranceClaim saved = store.save(next);
        log.info("Synced claim {} with {}: {} -> {}", claim.getId(), claim.getCarrier(), current.code(), saved.getStatus().code());
        return new SyncOutcome(saved, current, snapshot, conflict, false);
    }

    /** Stores the failed attempt; a failing save is attached to {@code cause} so the carrier error still surfaces. */
    private void recordFailure(InsuranceClaim claim, String error, RuntimeException cause) {
        InsuranceClaim failed = claim.copy();
        failed.setCarrierLastSync(Instant.now(clock));
        failed.setLastSyncError(error);
        try {
            store.save(failed);
        } catch (RuntimeException saveFailure) {
            log.error("Could not record sync failure on claim {}", claim.getId(), saveFailure);
            cause.addSuppressed(saveFailure);
        }
    }

    private static String carrierNote(CarrierStatusSnapshot snapshot) {
        String note = "Carrier status: " + snapshot.rawStatus();
        return snapshot.statusMessage() != null ? note + ". " + snapshot.statusMessage() : note;
    }
}
