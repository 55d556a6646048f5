package com.guardianintel.claims.features.customers;

import java.util.List;
import java.util.Optional;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcCustomerDirectory implements CustomerDirectory {

    private static final String SELECT_BY_ID = """
        SELECT id, first_name, last_name, email, phone, address, city, state, zip_code,
               insurance_carrier, policy_number, deductible
          FROM customers
         WHERE id = ?
        """;

    private static final RowMapper<Customer> MAPPER = (rs, rowNum) -> new Customer(
            rs.getLong("id"),
            rs.getString("first_name"),
            rs.getString("last_name"),
            rs.getString("email"),
            rs.getString("phone"),
            rs.getString("address"),
            rs.getString("city"),
            rs.getString("state"),
            rs.getString("zip_code"),
            rs.getString("insurance_carrier"),
            rs.getString("policy_number"),
            rs.getBigDecimal("deductible"));

    private final JdbcTemplate jdbcTemplate;

    public JdbcCustomerDirectory(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public Optional<Customer> findById(Long customerId) {
        if (customerId == null) {
            return Optional.empty();
        }
        List<Customer> rows = jdbcTemplate.query(SELECT_BY_ID, MAPPER, customerId);
        return rows.stream().findFirst();
    }
}
