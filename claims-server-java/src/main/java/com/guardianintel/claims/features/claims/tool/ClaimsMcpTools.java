package com.guardianintel.claims.features.claims.tool;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springaicommunity.mcp.annotation.McpTool;
import org.springaicommunity.mcp.annotation.McpToolParam;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.guardianintel.claims.exception.ClaimsException;
import com.guardianintel.claims.features.claims.controller.ClaimViewMapper;
import com.guardianintel.claims.features.claims.model.ClaimStatus;
import com.guardianintel.claims.features.claims.model.InsuranceClaim;
import com.guardianintel.claims.features.claims.service.ClaimFilingService;
import com.guardianintel.claims.features.claims.service.ClaimService;
import com.guardianintel.claims.features.claims.service.ClaimStatsService;
import com.guardianintel.claims.features.claims.service.ClaimSyncService;
import com.guardianintel.claims.features.claims.service.CreateClaimCommand;
import com.guardianintel.claims.features.claims.service.FileClaimCommand;
import com.guardianintel.claims.features.claims.service.FilingOutcome;
import com.guardianintel.claims.features.claims.service.SyncOutcome;
import com.guardianintel.claims.integration.carrier.CarrierCapabilityRegistry;

import lombok.extern.slf4j.Slf4j;

/**
 * Claim operations for the dashboard's assistant. Every tool returns a JSON
 * string; failures come back as {@code {"success": false, ...}} rather than as
 * exceptions so the assistant can explain them to the user.
 */
@Service
@Slf4j
public class ClaimsMcpTools {

    private final ClaimService claimService;
    private final ClaimFilingService filingService;
    private final ClaimSyncService syncService;
    private final ClaimStatsService statsService;
    private final CarrierCapabilityRegistry registry;
    private final ClaimViewMapper mapper;
    private final ObjectMapper objectMapper;

    public ClaimsMcpTools(ClaimService claimService,
                          ClaimFilingService filingService,
                          ClaimSyncService syncService,
                          ClaimStatsService statsService,
                          CarrierCapabilityRegistry registry,
                          ClaimViewMapper mapper,
                          ObjectMapper objectMapper) {
        this.claimService = claimService;
        this.filingService = filingService;
        this.syncService = syncService;
        this.statsService = statsService;
        this.registry = registry;
        this.mapper = mapper;
        this.objectMapper = objectMapper;
    }

    @McpTool(name = "list_carriers",
             description = "Lists insurance carriers and whether each supports direct filing and status sync. Returns JSON.")
    public String listCarriers() {
        log.info("[TOOL] Entering list_carriers");
        try {
            String result = success(Map.of("carriers", registry.carriers()));
            log.info("[TOOL] Exiting list_carriers");
            return result;
        } catch (Exception e) {
            return handleError("listCarriers", e);
        }
    }

    @McpTool(name = "get_claim",
             description = "Returns one insurance claim with its status history, money summary and allowed next statuses.")
    public String getClaim(@McpToolParam(description = "Internal claim id") Long claimId) {
        log.info("[TOOL] Entering get_claim");
        log.debug("Input claimId: {}", claimId);
        try {
            return success(Map.of("claim", mapper.toView(claimService.get(claimId))));
        } catch (Exception e) {
            return handleError("getClaim", e);
        }
    }

    @McpTool(name = "list_claims",
             description = "Lists claims, optionally for one customer or filtered by status (pending, filed, adjuster-assigned, "
                         + "inspection-scheduled, approved, supplement, paid, closed, denied).")
    public String listClaims(@McpToolParam(description = "Optional: customer id", required = false) Long customerId,
                             @McpToolParam(description = "Optional: status code", required = false) String status) {
        log.info("[TOOL] Entering list_claims");
        log.debug("Input customerId: {}, status: {}", customerId, status);
        try {
            List<InsuranceClaim> claims = customerId != null
                    ? claimService.listByCustomer(customerId)
                    : claimService.list(status != null && !status.isBlank() ? ClaimStatus.fromCode(status) : null, null);
            return success(Map.of("count", claims.size(), "claims", mapper.toViews(claims)));
        } catch (Exception e) {
            return handleError("listClaims", e);
        }
    }

    @McpTool(name = "create_claim",
             description = "Opens a new insurance claim for a customer in pending status. Carrier and deductible default "
                         + "to the customer's policy on file. Dates are ISO yyyy-MM-dd.")
    public String createClaim(CreateClaimCommand request) {
        log.info("[TOOL] Entering create_claim");
        log.debug("Raw Input: {}", request);
        try {
            InsuranceClaim claim = claimService.create(request, currentActor());
            log.info("[TOOL] Exiting create_claim, claim {}", claim.getId());
            return success(Map.of("claim", mapper.toView(claim)));
        } catch (Exception e) {
            return handleError("createClaim", e);
        }
    }

    @McpTool(name = "transition_claim",
             description = "Moves a claim to the next status along the lifecycle. Only single allowed steps are accepted; "
                         + "get_claim lists the allowed next statuses.")
    public String transitionClaim(@McpToolParam(description = "Internal claim id") Long claimId,
                                  @McpToolParam(description = "Target status code, e.g. approved") String status,
                                  @McpToolParam(description = "Optional: note for the history", required = false) String note) {
        log.info("[TOOL] Entering transition_claim");
        log.debug("Input claimId: {}, status: {}", claimId, status);
        try {
            InsuranceClaim claim = claimService.transition(claimId, ClaimStatus.fromCode(status), currentActor(), note);
            return success(Map.of("claim", mapper.toView(claim)));
        } catch (Exception e) {
            return handleError("transitionClaim", e);
        }
    }

    @McpTool(name = "record_supplement",
             description = "Records an additional amount the carrier granted on an approved, supplement or paid claim.")
    public String recordSupplement(@McpToolParam(description = "Internal claim id") Long claimId,
                                   @McpToolParam(description = "Supplement amount in USD") BigDecimal amount,
                                   @McpToolParam(description = "Optional: reason", required = false) String reason) {
        log.info("[TOOL] Entering record_supplement");
        try {
            InsuranceClaim claim = claimService.recordSupplement(claimId, amount, reason, currentActor());
            return success(Map.of("claim", mapper.toView(claim)));
        } catch (Exception e) {
            return handleError("recordSupplement", e);
        }
    }

    @McpTool(name = "file_claim_with_carrier",
             description = "Submits a pending claim to the carrier's claims API. Requires cause of loss, a loss description "
                         + "and at least one damage area. Fails without side effects if the carrier rejects it.")
    public String fileClaimWithCarrier(@McpToolParam(description = "Internal claim id") Long claimId,
                                       FileClaimCommand request) {
        log.info("[TOOL] Entering file_claim_with_carrier");
        log.debug("Input claimId: {}, request: {}", claimId, request);
        try {
            FilingOutcome outcome = filingService.file(claimId, request, currentActor());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("claim", mapper.toView(outcome.claim()));
            body.put("carrier_response", outcome.result());
            body.put("refiled", outcome.refiled());
            log.info("[TOOL] Exiting file_claim_with_carrier, claim number {}", outcome.result().claimNumber());
            return success(body);
        } catch (Exception e) {
            return handleError("fileClaimWithCarrier", e);
        }
    }

    @McpTool(name = "sync_claim_status",
             description = "Pulls the latest status and amounts for a filed claim from its carrier.")
    public String syncClaimStatus(@McpToolParam(description = "Internal claim id") Long claimId) {
        log.info("[TOOL] Entering sync_claim_status");
        try {
            SyncOutcome outcome = syncService.sync(claimId, currentActor());
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("claim", mapper.toView(outcome.claim()));
            body.put("timed_out", outcome.timedOut());
            body.put("status_changed", outcome.statusChanged());
            if (outcome.conflict() != null) {
                body.put("warning", outcome.conflict().message());
            }
            return success(body);
        } catch (Exception e) {
            return handleError("syncClaimStatus", e);
        }
    }

    @McpTool(name = "claim_stats",
             description = "Dashboard statistics: counts by status, carrier and type, money totals, approval rate and at-risk claims.")
    public String claimStats() {
        log.info("[TOOL] Entering claim_stats");
        try {
            return success(Map.of("stats", statsService.stats()));
        } catch (Exception e) {
            return handleError("claimStats", e);
        }
    }

    // -------------------------------------------------------------------------
    //  HELPER METHODS
    // -------------------------------------------------------------------------

    private static String currentActor() {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        return auth != null ? auth.getName() : "assistant";
    }

    private String success(Map<String, ?> data) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("success", true);
        body.putAll(data);
        String json = toJson(body);
        log.debug("Return value (JSON): {}", json);
        return json;
    }

    private String toJson(Object data) {
        try {
            return objectMapper.writeValueAsString(data);
        } catch (JsonProcessingException e) {
            log.error("JSON Serialization Error", e);
            return "{\"success\":false,\"error\":\"JSON_ERROR\"}";
        }
    }

    private String handleError(String toolName, Exception e) {
        Map<String, Object> errorResponse = new HashMap<>();
        errorResponse.put("success", false);
        if (e instanceof ClaimsException ce) {
            log.warn("Tool [{}] rejected: {} {}", toolName, ce.getErrorCode(), ce.getMessage());
            errorResponse.put("status", "REJECTED");
            errorResponse.put("error_code", ce.getErrorCode());
            errorResponse.put("retryable", ce.isRetryable());
            errorResponse.put("message", ce.getMessage());
        } else if (e instanceof IllegalArgumentException) {
            log.warn("Tool [{}] bad input: {}", toolName, e.getMessage());
            errorResponse.put("status", "REJECTED");
            errorResponse.put("error_code", "VALIDATION_ERROR");
            errorResponse.put("message", e.getMessage());
        } else {
            log.error("CRITICAL ERROR in tool [{}]: {}", toolName, e.getMessage(), e);
            errorResponse.put("status", "FATAL_ERROR");
            errorResponse.put("error_code", "INTERNAL_ERROR");
            errorResponse.put("message", "System failure in " + toolName + ". " + e.getMessage());
        }
        return toJson(errorResponse);
    }
}
