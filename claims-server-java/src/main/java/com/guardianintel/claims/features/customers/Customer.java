package com.guardianintel.claims.features.customers;

import java.math.BigDecimal;

/**
 * Read-only view of a customer record, limited to what claims need.
 */
public record Customer(
    Long id,
    String firstName,
    String lastName,
    String email,
    String phone,
    String address,
    String city,
    String state,
    String zipCode,
    String insuranceCarrier,
    String policyNumber,
    BigDecimal deductible
) {

    public String fullName() {
        return (firstName + " " + lastName).trim();
    }

    public String propertyAddress() {
        return address + ", " + city + ", " + state + " " + zipCode;
    }
}
