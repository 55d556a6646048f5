package com.guardianintel.claims.features.claims.lifecycle;

import java.math.BigDecimal;

import org.springframework.stereotype.Component;

import com.guardianintel.claims.exception.InvariantViolationException;
import com.guardianintel.claims.features.claims.model.InsuranceClaim;

/**
 * Derives dependent money fields and enforces the monetary invariants:
 * <ul>
 *   <li>every amount is non-negative and {@code supplementCount >= 0}</li>
 *   <li>{@code approvedValue >= acv} when both are known</li>
 *   <li>{@code depreciation = approvedValue - acv} when both are known, absent otherwise</li>
 *   <li>{@code totalPaid <= approvedValue + supplementValue}</li>
 * </ul>
 * Violations are rejected, never clamped. No I/O.
 */
@Component
public class FinancialReconciler {

    /**
     * @return a reconciled copy of {@code claim}; the argument is not modified
     * @throws InvariantViolationException if the inputs break an invariant
     */
    public InsuranceClaim reconcile(InsuranceClaim claim) {
        requireNonNegative("initialEstimate", claim.getInitialEstimate());
        requireNonNegative("approvedValue", claim.getApprovedValue());
        requireNonNegative("acv", claim.getAcv());
        requireNonNegative("deductible", claim.getDeductible());
        requireNonNegative("supplementValue", claim.getSupplementValue());
        requireNonNegative("totalPaid", claim.getTotalPaid());
        if (claim.getSupplementCount() < 0) {
            throw new InvariantViolationException("supplementCount must not be negative, was " + claim.getSupplementCount());
        }

        BigDecimal rcv = claim.getApprovedValue();
        BigDecimal acv = claim.getAcv();
        BigDecimal depreciation = null;
        if (rcv != null && acv != null) {
            if (rcv.compareTo(acv) < 0) {
                throw new InvariantViolationException(
                        "approvedValue (RCV) " + rcv.toPlainString() + " is lower than ACV " + acv.toPlainString());
            }
            depreciation = rcv.subtract(acv);
        }

        BigDecimal ceiling = orZero(rcv).add(orZero(claim.getSupplementValue()));
        BigDecimal paid = orZero(claim.getTotalPaid());
        if (paid.compareTo(ceiling) > 0) {
            throw new InvariantViolationException(
                    "totalPaid " + paid.toPlainString() + " exceeds approvedValue plus supplements " + ceiling.toPlainString());
        }

        InsuranceClaim reconciled = claim.copy();
        reconciled.setDepreciation(depreciation);
        return reconciled;
    }

    public ClaimFinancials summarize(InsuranceClaim claim) {
        BigDecimal rcv = orZero(claim.getApprovedValue());
        BigDecimal acv = orZero(claim.getAcv());
        BigDecimal supplements = orZero(claim.getSupplementValue());
        BigDecimal paid = orZero(claim.getTotalPaid());
        BigDecimal deductible = orZero(claim.getDeductible());
        BigDecimal receivable = rcv.add(supplements);
        BigDecimal depreciation = claim.getApprovedValue() != null && claim.getAcv() != null
                ? rcv.subtract(acv)
                : BigDecimal.ZERO;

        return new ClaimFinancials(
                orZero(claim.getInitialEstimate()),
                rcv,
                acv,
                depreciation,
                deductible,
                supplements,
                claim.getSupplementCount(),
                paid,
                receivable,
                receivable.subtract(paid),
                receivable.subtract(deductible));
    }

    private static void requireNonNegative(String field, BigDecimal value) {
        if (value != null && value.signum() < 0) {
            throw new InvariantViolationException(field + " must not be negative, was " + value.toPlainString());
        }
    }

    static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }
}
