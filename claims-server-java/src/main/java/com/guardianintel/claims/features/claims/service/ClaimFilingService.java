package com.guardianintel.claims.features.claims.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.guardianintel.claims.aspect.AuditedClaimOperation;
import com.guardianintel.claims.exception.CarrierException;
import com.guardianintel.claims.exception.InvalidTransitionException;
import com.guardianintel.claims.exception.NotFoundException;
import com.guardianintel.claims.exception.ValidationException;
import com.guardianintel.claims.features.claims.lifecycle.ClaimStateMachine;
import com.guardianintel.claims.features.claims.model.AdjusterContact;
import com.guardianintel.claims.features.claims.model.ClaimStatus;
import com.guardianintel.claims.features.claims.model.InsuranceClaim;
import com.guardianintel.claims.features.customers.Customer;
import com.guardianintel.claims.features.customers.CustomerDirectory;
import com.guardianintel.claims.features.customers.Photo;
import com.guardianintel.claims.features.customers.PhotoDirectory;
import com.guardianintel.claims.integration.carrier.AdjusterInfo;
import com.guardianintel.claims.integration.carrier.CarrierAdapter;
import com.guardianintel.claims.integration.carrier.CarrierCapabilityRegistry;
import com.guardianintel.claims.integration.carrier.DamageArea;
import com.guardianintel.claims.integration.carrier.FilingRequest;
import com.guardianintel.claims.integration.carrier.FilingResult;
import com.guardianintel.claims.integration.carrier.PhotoReference;

import lombok.extern.slf4j.Slf4j;

/**
 * Submits a claim to its carrier. Nothing is written unless the carrier accepts
 * the filing; the engine never retries a filing on its own.
 */
@Service
@Slf4j
public class ClaimFilingService {

    private final ClaimStore store;
    private final ClaimLockManager lockManager;
    private final ClaimStateMachine stateMachine;
    private final CarrierCapabilityRegistry registry;
    private final CarrierCallRunner callRunner;
    private final CustomerDirectory customers;
    private final PhotoDirectory photos;

    public ClaimFilingService(ClaimStore store,
                              ClaimLockManager lockManager,
                              ClaimStateMachine stateMachine,
                              CarrierCapabilityRegistry registry,
                              CarrierCallRunner callRunner,
                              CustomerDirectory customers,
                              PhotoDirectory photos) {
        this.store = store;
        this.lockManager = lockManager;
        this.stateMachine = stateMachine;
        this.registry = registry;
        this.callRunner = callRunner;
        this.customers = customers;
        this.photos = photos;
    }

    /**
     * @throws com.guardianintel.claims.exception.UnsupportedCarrierOperationException carrier has no direct filing
     * @throws CarrierException carrier rejected the filing or could not be reached
     * @throws com.guardianintel.claims.exception.CarrierTimeoutException carrier did not answer in time
     */
    @AuditedClaimOperation("file")
    public FilingOutcome file(Long claimId, FileClaimCommand command, String actor) {
        if (command == null) {
            throw new ValidationException("filing details are required");
        }
        log.info("Entering file: claim={} actor={}", claimId, actor);

        try (ClaimLockManager.Handle ignored = lockManager.acquire(claimId)) {
            InsuranceClaim claim = store.load(claimId);
            ClaimStatus status = claim.getStatus();
            if (status != ClaimStatus.PENDING && status != ClaimStatus.FILED) {
                throw new InvalidTransitionException(
                        "Claim " + claimId + " is " + status.code() + " and can no longer be filed with its carrier");
            }

            Customer customer = customers.findById(claim.getCustomerId())
                    .orElseThrow(() -> new NotFoundException("Customer", claim.getCustomerId()));
            FilingRequest request = buildRequest(claim, customer, command);

            boolean refiled = claim.isFiledWithCarrier();
            if (refiled) {
                log.warn("Claim {} was already filed with {} as {}; filing again", claimId, claim.getCarrier(), claim.getClaimNumber());
            }

            CarrierAdapter adapter = registry.requireFiling(claim.getCarrier());
            FilingResult result = callRunner.call(claim.getCarrier(), "file", () -> adapter.file(request));

            String carrierClaimId = result.carrierClaimId() != null ? result.carrierClaimId() : result.claimNumber();
            if (carrierClaimId == null) {
                throw new CarrierException(claim.getCarrier(), "INVALID_RESPONSE",
                        "Carrier accepted the filing but returned no claim identifier", false);
            }

            InsuranceClaim next = stateMachine.recordFiling(claim, carrierClaimId, result.claimNumber(), actor,
                    filingNote(result, registry.displayName(claim.getCarrier()), refiled));
            if (result.status() != null) {
                next.setCarrierStatus(result.status().code());
            }
            if (result.assignedAdjuster() != null) {
                next.setAdjuster(toContact(result.assignedAdjuster()));
            }

            InsuranceClaim saved = store.save(next);
            log.info("Exiting file: claim={} carrierClaimNumber={} refiled={}", claimId, result.claimNumber(), refiled);
            return new FilingOutcome(saved, result, refiled);
        }
    }

    FilingRequest buildRequest(InsuranceClaim claim, Customer customer, FileClaimCommand command) {
        List<String> problems = new ArrayList<>();

        String policyNumber = hasText(command.policyNumber()) ? command.policyNumber().trim() : customer.policyNumber();
        if (!hasText(policyNumber)) {
            problems.add("policyNumber is required (none given and none on the customer record)");
        }
        if (command.causeOfLoss() == null) {
            problems.add("causeOfLoss is required");
        }
        if (!hasText(command.lossDescription())) {
            problems.add("lossDescription is required");
        }
        if (command.damageAreas().isEmpty()) {
            problems.add("at least one damage area is required");
        }
        for (int i = 0; i < command.damageAreas().size(); i++) {
            DamageArea area = command.damageAreas().get(i);
            if (area == null || !hasText(area.damageType()) || area.severity() == null) {
                problems.add("damageAreas[" + i + "] needs a damageType and a severity");
            }
        }
        BigDecimal emergencyCost = command.emergencyRepairCost();
        if (emergencyCost != null && emergencyCost.signum() < 0) {
            problems.add("emergencyRepairCost must not be negative");
        }
        if (claim.getDateOfLoss() == null) {
            problems.add("claim has no dateOfLoss");
        }

        List<PhotoReference> photoRefs = resolvePhotos(claim, command.photoIds(), problems);

        if (!problems.isEmpty()) {
            throw new ValidationException(String.join("; ", problems));
        }

        return new FilingRequest(
                claim.getId(),
                policyNumber,
                customer.fullName(),
                customer.propertyAddress(),
                claim.getDateOfLoss(),
                command.causeOfLoss(),
                command.lossDescription().trim(),
                command.damageAreas(),
                command.emergencyRepairsNeeded(),
                emergencyCost,
                claim.getInitialEstimate(),
                photoRefs);
    }

    private List<PhotoReference> resolvePhotos(InsuranceClaim claim, List<Long> photoIds, List<String> problems) {
        if (photoIds.contains(null)) {
            problems.add("photoIds must not contain null");
        }
        Set<Long> wanted = photoIds.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(LinkedHashSet::new));
        if (wanted.isEmpty()) {
            return List.of();
        }
        List<Photo> found = photos.findByIds(wanted);
        Set<Long> foundIds = found.stream().map(Photo::id).collect(Collectors.toSet());

        wanted.stream()
                .filter(id -> !foundIds.contains(id))
                .forEach(id -> problems.add("photo " + id + " does not exist"));
        found.stream()
                .filter(p -> !p.customerId().equals(claim.getCustomerId()))
                .forEach(p -> problems.add("photo " + p.id() + " belongs to another customer"));

        return found.stream()
                .map(p -> new PhotoReference(p.id(), p.url(), p.category(), p.description()))
                .toList();
    }

    private static String filingNote(FilingResult result, String carrierName, boolean refiled) {
        StringBuilder note = new StringBuilder(refiled ? "Re-filed with " : "Filed with ")
                .append(carrierName)
                .append(". Claim #").append(result.claimNumber() != null ? result.claimNumber() : result.carrierClaimId());
        if (result.estimatedResponseDate() != null) {
            note.append(". Expected response by ").append(result.estimatedResponseDate());
        }
        if (result.assignedAdjuster() != null) {
            note.append(". Adjuster: ").append(result.assignedAdjuster().name());
        }
        return note.toString();
    }

    static AdjusterContact toContact(AdjusterInfo info) {
        return new AdjusterContact(info.name(), info.phone(), info.email(), info.company());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
