package com.guardianintel.claims.features.claims.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import org.springframework.stereotype.Service;

import com.guardianintel.claims.aspect.AuditedClaimOperation;
import com.guardianintel.claims.exception.InvalidTransitionException;
import com.guardianintel.claims.exception.NotFoundException;
import com.guardianintel.claims.exception.ValidationException;
import com.guardianintel.claims.features.claims.lifecycle.ClaimStateMachine;
import com.guardianintel.claims.features.claims.lifecycle.FinancialReconciler;
import com.guardianintel.claims.features.claims.model.ClaimStatus;
import com.guardianintel.claims.features.claims.model.ClaimType;
import com.guardianintel.claims.features.claims.model.InsuranceClaim;
import com.guardianintel.claims.features.claims.repository.ClaimRepository;
import com.guardianintel.claims.features.customers.Customer;
import com.guardianintel.claims.features.customers.CustomerDirectory;
import com.guardianintel.claims.integration.carrier.CarrierCapabilityRegistry;

import lombok.extern.slf4j.Slf4j;

/**
 * Claim CRUD plus the manual lifecycle operations. Every mutation runs under the
 * claim's lock and is persisted as one aggregate save.
 */
@Service
@Slf4j
public class ClaimService {

    private final ClaimRepository repository;
    private final ClaimStore store;
    private final ClaimLockManager lockManager;
    private final ClaimStateMachine stateMachine;
    private final FinancialReconciler reconciler;
    private final CustomerDirectory customers;
    private final CarrierCapabilityRegistry carriers;
    private final Clock clock;

    public ClaimService(ClaimRepository repository,
                        ClaimStore store,
                        ClaimLockManager lockManager,
                        ClaimStateMachine stateMachine,
                        FinancialReconciler reconciler,
                        CustomerDirectory customers,
                        CarrierCapabilityRegistry carriers,
                        Clock clock) {
        this.repository = repository;
        this.store = store;
        this.lockManager = lockManager;
        this.stateMachine = stateMachine;
        this.reconciler = reconciler;
        this.customers = customers;
        this.carriers = carriers;
        this.clock = clock;
    }

    @AuditedClaimOperation("create")
    public InsuranceClaim create(CreateClaimCommand command, String actor) {
        if (command == null || command.customerId() == null) {
            throw new ValidationException("customerId is required");
        }
        Customer customer = customers.findById(command.customerId())
                .orElseThrow(() -> new NotFoundException("Customer", command.customerId()));

        String carrier = hasText(command.carrier()) ? command.carrier().trim() : customer.insuranceCarrier();
        if (!hasText(carrier)) {
            throw new ValidationException("carrier is required: none given and customer " + customer.id() + " has no insurance carrier on file");
        }
        validateDateOfLoss(command.dateOfLoss());
        if (carriers.describe(carrier).isEmpty()) {
            log.info("Carrier '{}' is not configured; claim will be tracked manually", carrier);
        }

        ClaimType type = command.claimType() != null ? command.claimType() : ClaimType.ROOF;
        InsuranceClaim claim = InsuranceClaim.open(customer.id(), carrier, type, command.dateOfLoss(),
                Instant.now(clock), actor);
        claim.setInitialEstimate(command.initialEstimate());
        claim.setApprovedValue(command.approvedValue());
        claim.setAcv(command.acv());
        claim.setDeductible(command.deductible() != null ? command.deductible() : customer.deductible());
        claim.setInspectionDate(command.inspectionDate());
        claim.setAdjuster(command.adjuster());
        claim.setScopeOfWork(command.scopeOfWork());
        claim.setNotes(command.notes());

        InsuranceClaim saved = store.save(reconciler.reconcile(claim));
        log.info("Created claim {} for customer {} with {}", saved.getId(), customer.fullName(), carrier);
        return saved;
    }

    public InsuranceClaim get(Long claimId) {
        return store.load(claimId);
    }

    public List<InsuranceClaim> listByCustomer(Long customerId) {
        return repository.findByCustomerIdOrderByCreatedAtDesc(customerId);
    }

    public List<InsuranceClaim> list(ClaimStatus status, String carrier) {
        if (status != null && hasText(carrier)) {
            return repository.findByStatusAndCarrierOrderByCreatedAtDesc(status, carrier);
        }
        if (status != null) {
            return repository.findByStatusOrderByCreatedAtDesc(status);
        }
        if (hasText(carrier)) {
            return repository.findByCarrierOrderByCreatedAtDesc(carrier);
        }
        return repository.findAllByOrderByCreatedAtDesc();
    }

    @AuditedClaimOperation("update")
    public InsuranceClaim update(Long claimId, UpdateClaimCommand command, String actor) {
        if (command == null) {
            throw new ValidationException("update body is required");
        }
        try (ClaimLockManager.Handle ignored = lockManager.acquire(claimId)) {
            InsuranceClaim current = store.load(claimId);
            InsuranceClaim next = current.copy();

            if (hasText(command.carrier()) && !command.carrier().trim().equals(current.getCarrier())) {
                if (current.isFiledWithCarrier()) {
                    throw new ValidationException("carrier cannot change after the claim was filed with " + current.getCarrier());
                }
                next.setCarrier(command.carrier().trim());
            }
            if (command.dateOfLoss() != null) {
                validateDateOfLoss(command.dateOfLoss());
                next.setDateOfLoss(command.dateOfLoss());
            }
            if (command.claimType() != null) next.setClaimType(command.claimType());
            if (command.inspectionDate() != null) next.setInspectionDate(command.inspectionDate());
            if (command.reinspectionDate() != null) next.setReinspectionDate(command.reinspectionDate());
            if (command.initialEstimate() != null) next.setInitialEstimate(command.initialEstimate());
            if (command.approvedValue() != null) next.setApprovedValue(command.approvedValue());
            if (command.acv() != null) next.setAcv(command.acv());
            if (command.deductible() != null) next.setDeductible(command.deductible());
            if (command.supplementValue() != null) next.setSupplementValue(command.supplementValue());
            if (command.totalPaid() != null) next.setTotalPaid(command.totalPaid());
            if (command.adjuster() != null) next.setAdjuster(command.adjuster());
            if (command.scopeOfWork() != null) next.setScopeOfWork(command.scopeOfWork());
            if (command.notes() != null) next.setNotes(command.notes());

            InsuranceClaim reconciled = reconciler.reconcile(next);
            reconciled.setUpdatedAt(Instant.now(clock));
            log.debug("Claim {} updated by {}", claimId, actor);
            return store.save(reconciled);
        }
    }

    @AuditedClaimOperation("transition")
    public InsuranceClaim transition(Long claimId, ClaimStatus target, String actor, String note) {
        if (target == null) {
            throw new ValidationException("target status is required");
        }
        try (ClaimLockManager.Handle ignored = lockManager.acquire(claimId)) {
            InsuranceClaim current = store.load(claimId);
            InsuranceClaim next = stateMachine.transition(current, target, actor, note);
            return next == current ? current : store.save(next);
        }
    }

    /**
     * Records an additional amount granted on top of the approved value. An
     * {@code approved} claim moves to {@code supplement}; a claim already in
     * {@code supplement} or {@code paid} keeps its status and gets a history note.
     */
    @AuditedClaimOperation("recordSupplement")
    public InsuranceClaim recordSupplement(Long claimId, BigDecimal amount, String reason, String actor) {
        if (amount == null || amount.signum() <= 0) {
            throw new ValidationException("supplement amount must be greater than zero");
        }
        try (ClaimLockManager.Handle ignored = lockManager.acquire(claimId)) {
            InsuranceClaim current = store.load(claimId);
            ClaimStatus status = current.getStatus();
            if (status != ClaimStatus.APPROVED && status != ClaimStatus.SUPPLEMENT && status != ClaimStatus.PAID) {
                throw new InvalidTransitionException(
                        "Supplements can only be recorded on approved, supplement or paid claims; claim " + claimId + " is " + status.code());
            }

            InsuranceClaim working = current.copy();
            BigDecimal previous = working.getSupplementValue() != null ? working.getSupplementValue() : BigDecimal.ZERO;
            working.setSupplementValue(previous.add(amount));
            working.setSupplementCount(working.getSupplementCount() + 1);
            working.setLastSupplementDate(LocalDate.now(clock));

            String note = "Supplement #" + working.getSupplementCount() + " of $" + amount.toPlainString()
                    + (hasText(reason) ? ": " + reason : "");
            InsuranceClaim next = status == ClaimStatus.APPROVED
                    ? stateMachine.transition(working, ClaimStatus.SUPPLEMENT, actor, note)
                    : stateMachine.annotate(working, actor, note);
            return store.save(next);
        }
    }

    @AuditedClaimOperation("delete")
    public void delete(Long claimId, String actor) {
        try (ClaimLockManager.Handle ignored = lockManager.acquire(claimId)) {
            InsuranceClaim claim = store.load(claimId);
            repository.delete(claim);
            log.info("Claim {} ({}, {}) deleted by {}", claimId, claim.getCarrier(), claim.getStatus().code(), actor);
        }
    }

    private void validateDateOfLoss(LocalDate dateOfLoss) {
        if (dateOfLoss == null) {
            throw new ValidationException("dateOfLoss is required");
        }
        if (dateOfLoss.isAfter(LocalDate.now(clock))) {
            throw new ValidationException("dateOfLoss " + dateOfLoss + " is in the future");
        }
    }

    static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
