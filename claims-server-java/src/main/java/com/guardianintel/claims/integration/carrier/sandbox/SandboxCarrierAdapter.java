package com.guardianintel.claims.integration.carrier.sandbox;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import org.springframework.stereotype.Component;

import com.guardianintel.claims.exception.CarrierException;
import com.guardianintel.claims.integration.carrier.AbstractCarrierAdapter;
import com.guardianintel.claims.integration.carrier.AdjusterInfo;
import com.guardianintel.claims.integration.carrier.CarrierClaimStatus;
import com.guardianintel.claims.integration.carrier.CarrierProperties;
import com.guardianintel.claims.integration.carrier.CarrierStatusSnapshot;
import com.guardianintel.claims.integration.carrier.FilingRequest;
import com.guardianintel.claims.integration.carrier.FilingResult;

import lombok.extern.slf4j.Slf4j;

/**
 * In-process carrier for development and demos. Filed claims get sequential ids
 * and move one step along the carrier lifecycle each time their status is polled,
 * so a demo can walk a claim from filing to payment without a real carrier.
 * <p>
 * Policy numbers starting with {@code INVALID} are rejected the way a carrier
 * rejects an unknown policy.
 */
@Component
@Slf4j
public class SandboxCarrierAdapter extends AbstractCarrierAdapter {

    public static final String CODE = "sandbox";

    static final List<CarrierClaimStatus> PROGRESSION = List.of(
            CarrierClaimStatus.RECEIVED,
            CarrierClaimStatus.ASSIGNED,
            CarrierClaimStatus.INSPECTION_SCHEDULED,
            CarrierClaimStatus.INSPECTION_COMPLETE,
            CarrierClaimStatus.APPROVED,
            CarrierClaimStatus.PAYMENT_PROCESSING,
            CarrierClaimStatus.PAYMENT_ISSUED,
            CarrierClaimStatus.CLOSED);

    private static final BigDecimal DEFAULT_ESTIMATE = new BigDecimal("15000.00");
    private static final BigDecimal ACV_RATIO = new BigDecimal("0.90");

    private final Clock clock;
    private final AtomicLong sequence = new AtomicLong(1000);
    private final Map<String, SandboxClaim> claims = new ConcurrentHashMap<>();

    public SandboxCarrierAdapter(CarrierProperties properties, Clock clock) {
        super(CODE, properties);
        this.clock = clock;
    }

    @Override
    protected FilingResult doFile(FilingRequest request) {
        if (request.policyNumber() != null && request.policyNumber().toUpperCase().startsWith("INVALID")) {
            throw new CarrierException(CODE, "POLICY_NOT_FOUND", "Policy number not found in system", false);
        }

        long n = sequence.incrementAndGet();
        String carrierClaimId = "SBX-" + n;
        String claimNumber = "SBX" + LocalDate.now(clock).getYear() + "-" + String.format("%06d", n);
        BigDecimal estimate = request.initialEstimate() != null ? request.initialEstimate() : DEFAULT_ESTIMATE;
        claims.put(carrierClaimId, new SandboxClaim(claimNumber, estimate));

        log.info("Sandbox accepted claim {} as {}", request.internalClaimId(), claimNumber);
        return new FilingResult(
                carrierClaimId,
                claimNumber,
                CarrierClaimStatus.RECEIVED,
                "Your claim has been received and is being processed.",
                null,
                LocalDate.now(clock).plusDays(3),
                List.of("An adjuster will contact you within 2-3 business days",
                        "Gather any additional documentation of damage",
                        "Do not dispose of damaged materials until inspection"),
                "https://sandbox.guardian-claims.dev/track/" + claimNumber);
    }

    @Override
    protected CarrierStatusSnapshot doFetchStatus(String carrierClaimId) {
        SandboxClaim claim = claims.get(carrierClaimId);
        if (claim == null) {
            throw new CarrierException(CODE, "CLAIM_NOT_FOUND", "No sandbox claim " + carrierClaimId, false);
        }

        CarrierClaimStatus status = claim.advance();
        int step = PROGRESSION.indexOf(status);
        boolean approved = step >= PROGRESSION.indexOf(CarrierClaimStatus.APPROVED);
        boolean paid = step >= PROGRESSION.indexOf(CarrierClaimStatus.PAYMENT_ISSUED);
        boolean assigned = step >= PROGRESSION.indexOf(CarrierClaimStatus.ASSIGNED);
        boolean inspected = step >= PROGRESSION.indexOf(CarrierClaimStatus.INSPECTION_SCHEDULED);

        BigDecimal acv = claim.estimate.multiply(ACV_RATIO).setScale(2, RoundingMode.HALF_UP);
        return new CarrierStatusSnapshot(
                carrierClaimId,
                claim.claimNumber,
                status.code(),
                status,
                "Sandbox claim is " + status.code(),
                approved ? claim.estimate : null,
                approved ? acv : null,
                paid ? acv : null,
                assigned ? new AdjusterInfo("Jane Doe", "1-800-555-0124", "jdoe@sandbox.guardian-claims.dev",
                        "Sandbox Claims Services", LocalDate.now(clock)) : null,
                inspected ? LocalDate.now(clock).plusDays(2) : null,
                clock.instant());
    }

    @Override
    public boolean ping() {
        return true;
    }

    private static final class SandboxClaim {
        private final String claimNumber;
        private final BigDecimal estimate;
        private int step = 0;

        private SandboxClaim(String claimNumber, BigDecimal estimate) {
            this.claimNumber = claimNumber;
            this.estimate = estimate;
        }

        // First poll reports RECEIVED, then one step further per poll until CLOSED.
        private synchronized CarrierClaimStatus advance() {
            CarrierClaimStatus current = PROGRESSION.get(step);
            if (step < PROGRESSION.size() - 1) {
                step++;
            }
            return current;
        }
    }
}
