package com.guardianintel.claims.features.customers;

import java.util.Collection;
import java.util.List;
import java.util.Map;

import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
public class JdbcPhotoDirectory implements PhotoDirectory {

    private static final String SELECT_BY_IDS = """
        SELECT id, customer_id, url, category, description
          FROM photos
         WHERE id IN (:ids)
         ORDER BY id
        """;

    private final NamedParameterJdbcTemplate jdbcTemplate;

    public JdbcPhotoDirectory(NamedParameterJdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public List<Photo> findByIds(Collection<Long> photoIds) {
        if (photoIds == null || photoIds.isEmpty()) {
            return List.of();
        }
        return jdbcTemplate.query(SELECT_BY_IDS, Map.of("ids", photoIds), (rs, rowNum) -> new Photo(
                rs.getLong("id"),
                rs.getLong("customer_id"),
                rs.getString("url"),
                rs.getString("category"),
                rs.getString("description")));
    }
}
