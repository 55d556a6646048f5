package com.guardianintel.claims.integration.carrier.statefarm;

import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.guardianintel.claims.exception.CarrierException;
import com.guardianintel.claims.integration.carrier.AbstractCarrierAdapter;
import com.guardianintel.claims.integration.carrier.AdjusterInfo;
import com.guardianintel.claims.integration.carrier.CarrierClaimStatus;
import com.guardianintel.claims.integration.carrier.CarrierProperties;
import com.guardianintel.claims.integration.carrier.CarrierStatusSnapshot;
import com.guardianintel.claims.integration.carrier.DamageArea;
import com.guardianintel.claims.integration.carrier.FilingRequest;
import com.guardianintel.claims.integration.carrier.FilingResult;
import com.guardianintel.claims.integration.carrier.PhotoReference;

import lombok.extern.slf4j.Slf4j;

/**
 * State Farm claims API (REST/JSON). Requests and responses are handled as JSON
 * trees and translated here, so no State Farm field name leaks past this class.
 */
@Component
@Slf4j
public class StateFarmAdapter extends AbstractCarrierAdapter {

    public static final String CODE = "state-farm";

    private static final Map<String, CarrierClaimStatus> STATUS_LABELS = Map.ofEntries(
            Map.entry("RECEIVED", CarrierClaimStatus.RECEIVED),
            Map.entry("PENDING", CarrierClaimStatus.RECEIVED),
            Map.entry("ASSIGNED", CarrierClaimStatus.ASSIGNED),
            Map.entry("ADJUSTER_ASSIGNED", CarrierClaimStatus.ASSIGNED),
            Map.entry("INSPECTION_SCHEDULED", CarrierClaimStatus.INSPECTION_SCHEDULED),
            Map.entry("SCHEDULED", CarrierClaimStatus.INSPECTION_SCHEDULED),
            Map.entry("INSPECTION_COMPLETE", CarrierClaimStatus.INSPECTION_COMPLETE),
            Map.entry("INSPECTED", CarrierClaimStatus.INSPECTION_COMPLETE),
            Map.entry("UNDER_REVIEW", CarrierClaimStatus.UNDER_REVIEW),
            Map.entry("IN_REVIEW", CarrierClaimStatus.UNDER_REVIEW),
            Map.entry("APPROVED", CarrierClaimStatus.APPROVED),
            Map.entry("PARTIALLY_APPROVED", CarrierClaimStatus.PARTIALLY_APPROVED),
            Map.entry("DENIED", CarrierClaimStatus.DENIED),
            Map.entry("REJECTED", CarrierClaimStatus.DENIED),
            Map.entry("SUPPLEMENT_REQUESTED", CarrierClaimStatus.SUPPLEMENT_REQUESTED),
            Map.entry("SUPPLEMENT_PENDING", CarrierClaimStatus.SUPPLEMENT_REQUESTED),
            Map.entry("SUPPLEMENT_APPROVED", CarrierClaimStatus.SUPPLEMENT_APPROVED),
            Map.entry("PAYMENT_PENDING", CarrierClaimStatus.PAYMENT_PROCESSING),
            Map.entry("PROCESSING_PAYMENT", CarrierClaimStatus.PAYMENT_PROCESSING),
            Map.entry("PAYMENT_ISSUED", CarrierClaimStatus.PAYMENT_ISSUED),
            Map.entry("PAID", CarrierClaimStatus.PAYMENT_ISSUED),
            Map.entry("CLOSED", CarrierClaimStatus.CLOSED),
            Map.entry("COMPLETE", CarrierClaimStatus.CLOSED));

    private static final Map<String, String> CAUSE_CODES = Map.of(
            "water", "WATER_DAMAGE",
            "fallen-tree", "FALLING_OBJECTS");

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public StateFarmAdapter(@Qualifier("stateFarmRestClient") RestClient restClient,
                            ObjectMapper objectMapper,
                            CarrierProperties properties) {
        super(CODE, properties);
        this.restClient = restClient;
        this.objectMapper = objectMapper;
    }

    @Override
    protected FilingResult doFile(FilingRequest request) {
        ObjectNode payload = buildSubmission(request);
        log.debug("State Farm submission payload: {}", payload);

        JsonNode body = exchange("file", () -> restClient.post()
                .uri("/submit")
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(JsonNode.class));

        String claimNumber = text(body, "claimNumber");
        List<String> nextSteps = new ArrayList<>();
        JsonNode steps = body.path("nextSteps");
        if (steps.isArray()) {
            steps.forEach(step -> nextSteps.add(step.asText()));
        }

        return new FilingResult(
                text(body, "claimId"),
                claimNumber,
                mapStatus(text(body, "status")),
                text(body, "statusMessage"),
                adjuster(body.get("adjuster")),
                date(body, "estimatedResponseDate"),
                nextSteps,
                claimNumber != null ? "https://www.statefarm.com/claims/track/" + claimNumber : null);
    }

    @Override
    protected CarrierStatusSnapshot doFetchStatus(String carrierClaimId) {
        JsonNode body = exchange("fetchStatus", () -> restClient.get()
                .uri("/claims/{id}/status", carrierClaimId)
                .retrieve()
                .body(JsonNode.class));

        String rawStatus = text(body, "status");
        JsonNode inspection = body.get("inspection");
        return new CarrierStatusSnapshot(
                text(body, "claimId") != null ? text(body, "claimId") : carrierClaimId,
                text(body, "claimNumber"),
                rawStatus,
                mapStatus(rawStatus),
                text(body, "statusMessage"),
                amount(body, "approvedAmount") != null ? amount(body, "approvedAmount") : amount(body, "rcv"),
                amount(body, "acv"),
                amount(body, "paidAmount"),
                adjuster(body.get("adjuster")),
                date(inspection, "date"),
                instant(body, "lastUpdated"));
    }

    @Override
    public boolean ping() {
        try {
            restClient.get().uri("/health").retrieve().toBodilessEntity();
            return true;
        } catch (RestClientException e) {
            log.warn("State Farm health probe failed: {}", e.getMessage());
            return false;
        }
    }

    /** Unknown labels map to null; the engine then refreshes money only. */
    static CarrierClaimStatus mapStatus(String label) {
        if (label == null) {
            return null;
        }
        return STATUS_LABELS.get(label.trim().toUpperCase().replace('-', '_').replace(' ', '_'));
    }

    private ObjectNode buildSubmission(FilingRequest request) {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode claim = root.putObject("claim");

        ObjectNode policy = claim.putObject("policyInfo");
        policy.put("policyNumber", request.policyNumber());
        policy.put("insuredName", request.policyholderName());

        ObjectNode loss = claim.putObject("lossInfo");
        loss.put("dateOfLoss", request.dateOfLoss().format(DateTimeFormatter.ISO_LOCAL_DATE));
        loss.put("causeOfLoss", CAUSE_CODES.getOrDefault(request.causeOfLoss().code(), request.causeOfLoss().name()));
        loss.put("lossDescription", request.lossDescription());

        claim.putObject("propertyInfo").put("address", request.propertyAddress());

        ObjectNode damage = claim.putObject("damageInfo");
        ArrayNode areas = damage.putArray("areas");
        for (DamageArea area : request.damageAreas()) {
            ObjectNode node = areas.addObject();
            node.put("type", area.damageType().trim().toUpperCase().replace('-', '_'));
            node.put("severity", area.severity().code());
            if (area.description() != null) {
                node.put("description", area.description());
            }
        }
        damage.put("emergencyRepairs", request.emergencyRepairsNeeded());
        if (request.emergencyRepairCost() != null) {
            damage.put("emergencyRepairsCost", request.emergencyRepairCost());
        }

        if (request.initialEstimate() != null) {
            ObjectNode estimate = claim.putObject("estimate");
            estimate.put("amount", request.initialEstimate());
            estimate.put("currency", "USD");
        }

        if (!request.photos().isEmpty()) {
            ArrayNode photos = claim.putArray("photos");
            for (PhotoReference photo : request.photos()) {
                ObjectNode node = photos.addObject();
                node.put("url", photo.url());
                node.put("category", photo.category());
            }
        }

        claim.put("externalReference", String.valueOf(request.internalClaimId()));
        return root;
    }

    private static AdjusterInfo adjuster(JsonNode node) {
        if (node == null || node.isNull() || text(node, "name") == null) {
            return null;
        }
        String company = text(node, "company");
        return new AdjusterInfo(text(node, "name"), text(node, "phone"), text(node, "email"),
                company != null ? company : "State Farm", date(node, "assignedDate"));
    }

    /**
     * Runs one HTTP exchange and converts Spring's client exceptions into
     * {@link CarrierException}, keeping State Farm's own error code and message.
     */
    private JsonNode exchange(String operation, Supplier<JsonNode> call) {
        try {
            JsonNode body = call.get();
            if (body == null || body.isNull()) {
                throw new CarrierException(CODE, "EMPTY_RESPONSE", "State Farm returned an empty body for " + operation, true);
            }
            return body;
        } catch (RestClientResponseException e) {
            int status = e.getStatusCode().value();
            JsonNode error = parseError(e.getResponseBodyAsString());
            String code = firstNonNull(text(error.path("error"), "code"), text(error, "errorCode"), "HTTP_" + status);
            String message = firstNonNull(text(error.path("error"), "message"), text(error, "message"), e.getStatusText());
            log.error("State Farm {} rejected: {} {}", operation, code, message);
            throw new CarrierException(CODE, code, message, status >= 500 || status == 429, e);
        } catch (ResourceAccessException e) {
            log.error("State Farm {} unreachable", operation, e);
            throw new CarrierException(CODE, "NETWORK_ERROR", e.getMessage(), true, e);
        } catch (RestClientException e) {
            log.error("State Farm {} returned an unreadable response", operation, e);
            throw new CarrierException(CODE, "INVALID_RESPONSE", e.getMessage(), true, e);
        }
    }

    private JsonNode parseError(String body) {
        if (body == null || body.isBlank()) {
            return objectMapper.createObjectNode();
        }
        try {
            return objectMapper.readTree(body);
        } catch (Exception e) {
            log.debug("Non-JSON error body from State Farm: {}", body);
            return objectMapper.createObjectNode();
        }
    }

    private static String firstNonNull(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
