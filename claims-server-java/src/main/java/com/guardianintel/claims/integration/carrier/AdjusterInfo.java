package com.guardianintel.claims.integration.carrier;

import java.time.LocalDate;

public record AdjusterInfo(
    String name,
    String phone,
    String email,
    String company,
    LocalDate assignedDate
) {}
