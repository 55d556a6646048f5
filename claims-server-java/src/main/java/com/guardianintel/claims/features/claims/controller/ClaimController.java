package com.guardianintel.claims.features.claims.controller;

import java.math.BigDecimal;
import java.net.URI;
import java.security.Principal;
import java.util.List;

import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.guardianintel.claims.features.claims.model.ClaimStatus;
import com.guardianintel.claims.features.claims.model.InsuranceClaim;
import com.guardianintel.claims.features.claims.service.ClaimFilingService;
import com.guardianintel.claims.features.claims.service.ClaimService;
import com.guardianintel.claims.features.claims.service.ClaimStats;
import com.guardianintel.claims.features.claims.service.ClaimStatsService;
import com.guardianintel.claims.features.claims.service.ClaimSyncService;
import com.guardianintel.claims.features.claims.service.CreateClaimCommand;
import com.guardianintel.claims.features.claims.service.FileClaimCommand;
import com.guardianintel.claims.features.claims.service.FilingOutcome;
import com.guardianintel.claims.features.claims.service.SyncConflict;
import com.guardianintel.claims.features.claims.service.SyncOutcome;
import com.guardianintel.claims.features.claims.service.UpdateClaimCommand;
import com.guardianintel.claims.integration.carrier.FilingResult;

import lombok.extern.slf4j.Slf4j;

@RestController
@RequestMapping("/api/claims")
@Slf4j
public class ClaimController {

    private final ClaimService claimService;
    private final ClaimFilingService filingService;
    private final ClaimSyncService syncService;
    private final ClaimStatsService statsService;
    private final ClaimViewMapper mapper;

    public ClaimController(ClaimService claimService,
                           ClaimFilingService filingService,
                           ClaimSyncService syncService,
                           ClaimStatsService statsService,
                           ClaimViewMapper mapper) {
        this.claimService = claimService;
        this.filingService = filingService;
        this.syncService = syncService;
        this.statsService = statsService;
        this.mapper = mapper;
    }

    public record TransitionRequest(ClaimStatus status, String note) {}

    public record SupplementRequest(BigDecimal amount, String reason) {}

    public record FilingResponse(ClaimView claim, FilingResult carrierResponse, boolean refiled) {}

    public record SyncResponse(ClaimView claim, boolean timedOut, boolean statusChanged, String carrierStatus, SyncConflict conflict) {}

    @GetMapping
    public List<ClaimView> list(@RequestParam(required = false) String status,
                                @RequestParam(required = false) String carrier,
                                @RequestParam(required = false) Long customerId) {
        if (customerId != null) {
            return mapper.toViews(claimService.listByCustomer(customerId));
        }
        ClaimStatus filter = status != null && !status.isBlank() ? ClaimStatus.fromCode(status) : null;
        return mapper.toViews(claimService.list(filter, carrier));
    }

    @GetMapping("/stats")
    public ClaimStats stats() {
        return statsService.stats();
    }

    @GetMapping("/{id}")
    public ClaimView get(@PathVariable Long id) {
        return mapper.toView(claimService.get(id));
    }

    @PostMapping
    public ResponseEntity<ClaimView> create(@RequestBody CreateClaimCommand command, Principal principal) {
        InsuranceClaim created = claimService.create(command, actor(principal));
        return ResponseEntity.created(URI.create("/api/claims/" + created.getId())).body(mapper.toView(created));
    }

    @PatchMapping("/{id}")
    public ClaimView update(@PathVariable Long id, @RequestBody UpdateClaimCommand command, Principal principal) {
        return mapper.toView(claimService.update(id, command, actor(principal)));
    }

    @PostMapping("/{id}/transitions")
    public ClaimView transition(@PathVariable Long id, @RequestBody TransitionRequest request, Principal principal) {
        return mapper.toView(claimService.transition(id, request.status(), actor(principal), request.note()));
    }

    @PostMapping("/{id}/supplements")
    public ClaimView recordSupplement(@PathVariable Long id, @RequestBody SupplementRequest request, Principal principal) {
        return mapper.toView(claimService.recordSupplement(id, request.amount(), request.reason(), actor(principal)));
    }

    @PostMapping("/{id}/filing")
    public FilingResponse file(@PathVariable Long id, @RequestBody FileClaimCommand command, Principal principal) {
        FilingOutcome outcome = filingService.file(id, command, actor(principal));
        return new FilingResponse(mapper.toView(outcome.claim()), outcome.result(), outcome.refiled());
    }

    @PostMapping("/{id}/sync")
    public SyncResponse sync(@PathVariable Long id, Principal principal) {
        SyncOutcome outcome = syncService.sync(id, actor(principal));
        return new SyncResponse(
                mapper.toView(outcome.claim()),
                outcome.timedOut(),
                outcome.statusChanged(),
                outcome.snapshot() != null ? outcome.snapshot().rawStatus() : null,
                outcome.conflict());
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasAuthority('ROLE_ADMIN')")
    public ResponseEntity<Void> delete(@PathVariable Long id, Principal principal) {
        claimService.delete(id, actor(principal));
        return ResponseEntity.noContent().build();
    }

    static String actor(Principal principal) {
        return principal != null ? principal.getName() : "anonymous";
    }
}
