package com.guardianintel.claims.integration.carrier;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;

import com.fasterxml.jackson.databind.JsonNode;
import com.guardianintel.claims.exception.UnsupportedCarrierOperationException;

import lombok.extern.slf4j.Slf4j;

/**
 * Capability gate plus shared payload helpers. Subclasses implement the wire
 * calls; the public entry points refuse unsupported operations before any of
 * that code runs.
 */
@Slf4j
public abstract class AbstractCarrierAdapter implements CarrierAdapter {

    private final String carrierCode;
    private final CarrierCapabilities capabilities;

    protected AbstractCarrierAdapter(String carrierCode, CarrierProperties properties) {
        this.carrierCode = carrierCode;
        this.capabilities = properties.capabilitiesOf(carrierCode);
    }

    @Override
    public String carrierCode() {
        return carrierCode;
    }

    public CarrierCapabilities capabilities() {
        return capabilities;
    }

    @Override
    public final FilingResult file(FilingRequest request) {
        if (!capabilities.supportsDirectFiling()) {
            throw new UnsupportedCarrierOperationException(carrierCode, "direct filing");
        }
        log.info("[{}] Entering file for claim {}", carrierCode, request.internalClaimId());
        FilingResult result = doFile(request);
        log.info("[{}] Exiting file, carrier claim number {}", carrierCode, result.claimNumber());
        return result;
    }

    @Override
    public final CarrierStatusSnapshot fetchStatus(String carrierClaimId) {
        if (!capabilities.supportsStatusSync()) {
            throw new UnsupportedCarrierOperationException(carrierCode, "status sync");
        }
        log.debug("[{}] Fetching status for {}", carrierCode, carrierClaimId);
        return doFetchStatus(carrierClaimId);
    }

    protected abstract FilingResult doFile(FilingRequest request);

    protected abstract CarrierStatusSnapshot doFetchStatus(String carrierClaimId);

    // -------------------------------------------------------------------------
    //  Payload helpers for opaque JSON responses
    // -------------------------------------------------------------------------

    protected static String text(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /** Accepts numbers and formatted strings such as "$18,000.00". */
    protected static BigDecimal amount(JsonNode node, String field) {
        JsonNode value = node == null ? null : node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            return value.decimalValue();
        }
        String cleaned = value.asText().replaceAll("[^0-9.\\-]", "");
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(cleaned);
        } catch (NumberFormatException e) {
            log.warn("Ignoring unparseable amount '{}' in field {}", value.asText(), field);
            return null;
        }
    }

    protected static LocalDate date(JsonNode node, String field) {
        String raw = text(node, field);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return raw.length() > 10 ? LocalDate.parse(raw.substring(0, 10)) : LocalDate.parse(raw);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable date '{}' in field {}", raw, field);
            return null;
        }
    }

    protected static Instant instant(JsonNode node, String field) {
        String raw = text(node, field);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable timestamp '{}' in field {}", raw, field);
            return null;
        }
    }
}
