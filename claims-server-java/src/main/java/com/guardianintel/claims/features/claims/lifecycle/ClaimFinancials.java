package com.guardianintel.claims.features.claims.lifecycle;

import java.math.BigDecimal;

/**
 * Read-side money view of a claim. Absent inputs are reported as zero.
 *
 * @param totalReceivable        RCV plus approved supplements
 * @param outstanding            what the carrier still owes: receivable minus paid
 * @param netInsurerObligation   receivable minus the homeowner's deductible
 */
public record ClaimFinancials(
    BigDecimal initialEstimate,
    BigDecimal rcv,
    BigDecimal acv,
    BigDecimal depreciation,
    BigDecimal deductible,
    BigDecimal supplementValue,
    int supplementCount,
    BigDecimal totalPaid,
    BigDecimal totalReceivable,
    BigDecimal outstanding,
    BigDecimal netInsurerObligation
) {}
