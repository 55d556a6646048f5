package com.guardianintel.claims.features.claims.service;

import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;

import com.guardianintel.claims.exception.ConcurrencyConflictException;
import com.guardianintel.claims.exception.NotFoundException;
import com.guardianintel.claims.features.claims.model.InsuranceClaim;
import com.guardianintel.claims.features.claims.repository.ClaimRepository;

/**
 * Load and save for the claim aggregate. A save writes the claim row and its
 * status history together and fails on a stale {@code version}.
 */
@Component
public class ClaimStore {

    private final ClaimRepository repository;

    public ClaimStore(ClaimRepository repository) {
        this.repository = repository;
    }

    public InsuranceClaim load(Long claimId) {
        return repository.findById(claimId)
                .orElseThrow(() -> new NotFoundException("Claim", claimId));
    }

    public InsuranceClaim save(InsuranceClaim claim) {
        try {
            return repository.save(claim);
        } catch (OptimisticLockingFailureException e) {
            throw new ConcurrencyConflictException(claim.getId(), "claim was modified concurrently, reload and retry", e);
        }
    }
}
