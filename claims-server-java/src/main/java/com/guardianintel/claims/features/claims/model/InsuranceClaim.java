package com.guardianintel.claims.features.claims.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.relational.core.mapping.Embedded;
import org.springframework.data.relational.core.mapping.MappedCollection;
import org.springframework.data.relational.core.mapping.Table;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Aggregate root for one insurance claim. The status history is part of the
 * aggregate, so a save writes the claim row and its history in one transaction.
 *
 * <p>Lifecycle fields ({@code status}, {@code filedWithCarrier}, carrier ids) have
 * no public setters; only the state machine and the orchestrators change them.
 */
@Table("insurance_claims")
@Getter
@Setter
@NoArgsConstructor
public class InsuranceClaim {

    @Id
    private Long id;

    @Version
    private Long version;

    private Long customerId;

    private String carrier;
    private ClaimType claimType;

    @Setter(AccessLevel.NONE)
    private ClaimStatus status;

    @Setter(AccessLevel.NONE)
    private boolean filedWithCarrier;

    @Setter(AccessLevel.NONE)
    private String carrierClaimId;

    @Setter(AccessLevel.NONE)
    private String claimNumber;

    private String carrierStatus;
    private Instant carrierLastSync;
    private String lastSyncError;

    private LocalDate dateOfLoss;
    private LocalDate inspectionDate;
    private LocalDate reinspectionDate;
    private LocalDate lastSupplementDate;

    private BigDecimal initialEstimate;
    private BigDecimal approvedValue;
    private BigDecimal acv;
    private BigDecimal depreciation;
    private BigDecimal deductible;
    private BigDecimal supplementValue;
    private int supplementCount;
    private BigDecimal totalPaid;

    @Embedded.Nullable(prefix = "adjuster_")
    private AdjusterContact adjuster;

    private String scopeOfWork;
    private String notes;

    private Instant createdAt;
    private Instant updatedAt;

    @MappedCollection(idColumn = "claim_id", keyColumn = "entry_index")
    @Setter(AccessLevel.NONE)
    private List<StatusHistoryEntry> statusHistory = new ArrayList<>();

    public List<StatusHistoryEntry> getStatusHistory() {
        return Collections.unmodifiableList(statusHistory);
    }

    /** Starts a new claim in {@code pending} with its opening history entry. */
    public static InsuranceClaim open(Long customerId, String carrier, ClaimType claimType,
                                      LocalDate dateOfLoss, Instant now, String actor) {
        InsuranceClaim claim = new InsuranceClaim();
        claim.customerId = customerId;
        claim.carrier = carrier;
        claim.claimType = claimType;
        claim.dateOfLoss = dateOfLoss;
        claim.status = ClaimStatus.PENDING;
        claim.createdAt = now;
        claim.updatedAt = now;
        claim.statusHistory.add(new StatusHistoryEntry(now, ClaimStatus.PENDING, actor, "Claim created"));
        return claim;
    }

    /**
     * Detached working copy. Mutations happen on the copy so a rejected operation
     * never leaves a half-updated instance behind.
     */
    public InsuranceClaim copy() {
        InsuranceClaim c = new InsuranceClaim();
        c.id = id;
        c.version = version;
        c.customerId = customerId;
        c.carrier = carrier;
        c.claimType = claimType;
        c.status = status;
        c.filedWithCarrier = filedWithCarrier;
        c.carrierClaimId = carrierClaimId;
        c.claimNumber = claimNumber;
        c.carrierStatus = carrierStatus;
        c.carrierLastSync = carrierLastSync;
        c.lastSyncError = lastSyncError;
        c.dateOfLoss = dateOfLoss;
        c.inspectionDate = inspectionDate;
        c.reinspectionDate = reinspectionDate;
        c.lastSupplementDate = lastSupplementDate;
        c.initialEstimate = initialEstimate;
        c.approvedValue = approvedValue;
        c.acv = acv;
        c.depreciation = depreciation;
        c.deductible = deductible;
        c.supplementValue = supplementValue;
        c.supplementCount = supplementCount;
        c.totalPaid = totalPaid;
        c.adjuster = adjuster;
        c.scopeOfWork = scopeOfWork;
        c.notes = notes;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        c.statusHistory = new ArrayList<>(statusHistory);
        return c;
    }

    // Lifecycle mutators. Only ClaimStateMachine and the filing path call these.

    public void applyStatus(ClaimStatus next, StatusHistoryEntry entry) {
        this.status = next;
        this.statusHistory.add(entry);
        this.updatedAt = entry.occurredAt();
    }

    public void appendHistory(StatusHistoryEntry entry) {
        this.statusHistory.add(entry);
        this.updatedAt = entry.occurredAt();
    }

    public void markFiled(String carrierClaimId, String claimNumber) {
        this.filedWithCarrier = true;
        this.carrierClaimId = carrierClaimId;
        this.claimNumber = claimNumber;
    }
}
