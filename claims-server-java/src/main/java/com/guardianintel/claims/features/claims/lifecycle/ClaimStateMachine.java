package com.guardianintel.claims.features.claims.lifecycle;

import static com.guardianintel.claims.features.claims.model.ClaimStatus.ADJUSTER_ASSIGNED;
import static com.guardianintel.claims.features.claims.model.ClaimStatus.APPROVED;
import static com.guardianintel.claims.features.claims.model.ClaimStatus.CLOSED;
import static com.guardianintel.claims.features.claims.model.ClaimStatus.DENIED;
import static com.guardianintel.claims.features.claims.model.ClaimStatus.FILED;
import static com.guardianintel.claims.features.claims.model.ClaimStatus.INSPECTION_SCHEDULED;
import static com.guardianintel.claims.features.claims.model.ClaimStatus.PAID;
import static com.guardianintel.claims.features.claims.model.ClaimStatus.PENDING;
import static com.guardianintel.claims.features.claims.model.ClaimStatus.SUPPLEMENT;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Component;

import com.guardianintel.claims.exception.InvalidTransitionException;
import com.guardianintel.claims.exception.InvariantViolationException;
import com.guardianintel.claims.features.claims.model.ClaimStatus;
import com.guardianintel.claims.features.claims.model.InsuranceClaim;
import com.guardianintel.claims.features.claims.model.StatusHistoryEntry;

import lombok.extern.slf4j.Slf4j;

/**
 * Owns the claim lifecycle. Every accepted change works on a copy of the claim,
 * appends exactly one history entry and runs the {@link FinancialReconciler};
 * a rejected change throws and leaves the caller's instance untouched.
 *
 * <pre>
 * pending -> filed -> adjuster-assigned -> inspection-scheduled -> approved -> paid -> closed
 *                                                        approved <-> supplement -> paid
 * filed | adjuster-assigned | inspection-scheduled | approved -> denied
 * </pre>
 */
@Component
@Slf4j
public class ClaimStateMachine {

    private static final Map<ClaimStatus, Set<ClaimStatus>> EDGES = new EnumMap<>(ClaimStatus.class);

    static {
        EDGES.put(PENDING, EnumSet.of(FILED));
        EDGES.put(FILED, EnumSet.of(ADJUSTER_ASSIGNED, DENIED));
        EDGES.put(ADJUSTER_ASSIGNED, EnumSet.of(INSPECTION_SCHEDULED, DENIED));
        EDGES.put(INSPECTION_SCHEDULED, EnumSet.of(APPROVED, DENIED));
        EDGES.put(APPROVED, EnumSet.of(SUPPLEMENT, PAID, DENIED));
        EDGES.put(SUPPLEMENT, EnumSet.of(APPROVED, PAID));
        EDGES.put(PAID, EnumSet.of(CLOSED));
        EDGES.put(CLOSED, EnumSet.noneOf(ClaimStatus.class));
        EDGES.put(DENIED, EnumSet.noneOf(ClaimStatus.class));
    }

    private final FinancialReconciler reconciler;
    private final Clock clock;

    public ClaimStateMachine(FinancialReconciler reconciler, Clock clock) {
        this.reconciler = reconciler;
        this.clock = clock;
    }

    public static boolean isAllowed(ClaimStatus from, ClaimStatus to) {
        return EDGES.get(from).contains(to);
    }

    public static Set<ClaimStatus> allowedTargets(ClaimStatus from) {
        return Collections.unmodifiableSet(EDGES.get(from));
    }

    /** True when {@code to} can be reached from {@code from} through one or more allowed edges. */
    public static boolean isReachable(ClaimStatus from, ClaimStatus to) {
        Set<ClaimStatus> seen = EnumSet.noneOf(ClaimStatus.class);
        Deque<ClaimStatus> queue = new ArrayDeque<>(EDGES.get(from));
        while (!queue.isEmpty()) {
            ClaimStatus next = queue.poll();
            if (next == to) {
                return true;
            }
            if (seen.add(next)) {
                queue.addAll(EDGES.get(next));
            }
        }
        return false;
    }

    /**
     * Single-edge transition requested by a user or API caller. Requesting the
     * current status is a successful no-op that returns the claim unchanged.
     */
    public InsuranceClaim transition(InsuranceClaim claim, ClaimStatus target, String actor, String note) {
        ClaimStatus current = claim.getStatus();
        if (current == target) {
            log.debug("Claim {} already {}, transition is a no-op", claim.getId(), target.code());
            return claim;
        }
        if (!isAllowed(current, target)) {
            throw new InvalidTransitionException(current, target);
        }
        return apply(claim, target, actor, note);
    }

    /**
     * Forward move used when reconciling with a carrier: any status reachable from
     * the current one is accepted, skipped intermediate states included, and is
     * recorded as a single history entry.
     */
    public InsuranceClaim advance(InsuranceClaim claim, ClaimStatus target, String actor, String note) {
        ClaimStatus current = claim.getStatus();
        if (current == target) {
            return claim;
        }
        if (!isReachable(current, target)) {
            throw new InvalidTransitionException(current, target);
        }
        return apply(claim, target, actor, note);
    }

    /**
     * Records a successful carrier filing. A pending claim moves to {@code filed};
     * a claim that is already {@code filed} keeps its status and gets an audit
     * entry for the re-filing. Any later status cannot be re-filed.
     */
    public InsuranceClaim recordFiling(InsuranceClaim claim, String carrierClaimId, String claimNumber,
                                       String actor, String note) {
        ClaimStatus current = claim.getStatus();
        if (current != PENDING && current != FILED) {
            throw new InvalidTransitionException(
                    "Claim " + claim.getId() + " is " + current.code() + " and can no longer be filed with its carrier");
        }
        InsuranceClaim next = claim.copy();
        next.markFiled(carrierClaimId, claimNumber);
        next.applyStatus(FILED, entry(FILED, actor, note));
        return verified(next);
    }

    /** Appends a history note without changing the status. */
    public InsuranceClaim annotate(InsuranceClaim claim, String actor, String note) {
        InsuranceClaim next = claim.copy();
        next.appendHistory(entry(claim.getStatus(), actor, note));
        return verified(next);
    }

    private InsuranceClaim apply(InsuranceClaim claim, ClaimStatus target, String actor, String note) {
        InsuranceClaim next = claim.copy();
        next.applyStatus(target, entry(target, actor, note));
        log.info("Claim {} transitioned {} -> {} by {}", claim.getId(), claim.getStatus().code(), target.code(), actor);
        return verified(next);
    }

    private InsuranceClaim verified(InsuranceClaim next) {
        InsuranceClaim reconciled = reconciler.reconcile(next);
        ensureConsistent(reconciled);
        return reconciled;
    }

    private StatusHistoryEntry entry(ClaimStatus status, String actor, String note) {
        return new StatusHistoryEntry(Instant.now(clock), status, actor, note);
    }

    static void ensureConsistent(InsuranceClaim claim) {
        List<StatusHistoryEntry> history = claim.getStatusHistory();
        if (history.isEmpty() || history.get(history.size() - 1).status() != claim.getStatus()) {
            throw new InvariantViolationException("Status history of claim " + claim.getId() + " does not end in " + claim.getStatus().code());
        }
        if (claim.getCarrierClaimId() != null && !claim.isFiledWithCarrier()) {
            throw new InvariantViolationException("Claim " + claim.getId() + " has a carrier claim id but is not marked as filed");
        }
    }
}
