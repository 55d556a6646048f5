package com.guardianintel.claims.features.claims.repository;

import java.util.Collection;
import java.util.List;

import org.springframework.data.repository.ListCrudRepository;

import com.guardianintel.claims.features.claims.model.ClaimStatus;
import com.guardianintel.claims.features.claims.model.InsuranceClaim;

public interface ClaimRepository extends ListCrudRepository<InsuranceClaim, Long> {

    List<InsuranceClaim> findByCustomerIdOrderByCreatedAtDesc(Long customerId);

    List<InsuranceClaim> findByStatusOrderByCreatedAtDesc(ClaimStatus status);

    List<InsuranceClaim> findByCarrierOrderByCreatedAtDesc(String carrier);

    List<InsuranceClaim> findByStatusAndCarrierOrderByCreatedAtDesc(ClaimStatus status, String carrier);

    List<InsuranceClaim> findAllByOrderByCreatedAtDesc();

    // Sweep candidates: filed with the carrier and still moving
    List<InsuranceClaim> findByFiledWithCarrierTrueAndStatusNotIn(Collection<ClaimStatus> statuses);
}
