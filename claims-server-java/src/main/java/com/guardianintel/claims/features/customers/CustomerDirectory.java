package com.guardianintel.claims.features.customers;

import java.util.Optional;

/** Customer records owned by the CRM side of the dashboard. Read-only here. */
public interface CustomerDirectory {

    Optional<Customer> findById(Long customerId);
}
