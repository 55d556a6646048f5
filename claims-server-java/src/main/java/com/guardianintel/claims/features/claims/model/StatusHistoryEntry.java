package com.guardianintel.claims.features.claims.model;

import java.time.Instant;

import org.springframework.data.relational.core.mapping.Table;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One lifecycle event. Entries are appended in apply order and never rewritten;
 * {@code status} is the claim status after the event.
 */
@Table("claim_status_history")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StatusHistoryEntry(
    Instant occurredAt,
    ClaimStatus status,
    String actor,
    String note
) {}
