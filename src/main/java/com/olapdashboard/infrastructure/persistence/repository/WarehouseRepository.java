package com.olapdashboard.infrastructure.persistence.repository;

import com.olapdashboard.domain.model.CompiledQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;

/**
 * Read-only access to the warehouse.
 *
 * Connections come from the pool per call and are released by JdbcTemplate on
 * success or failure. Statement timeout is spring.jdbc.template.query-timeout.
 * Failures surface as Spring's DataAccessException hierarchy.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class WarehouseRepository {

    private final JdbcTemplate jdbcTemplate;

    /**
     * Rollup rows as column name -> value, in the order the store returns them.
     */
    public List<Map<String, Object>> queryRows(CompiledQuery query) {
        log.debug("Executing rollup {}: {} with {}", query.getSpec().getKey(), query.getSql(), query.getParameters());
        return jdbcTemplate.queryForList(query.getSql(), query.parameterArray());
    }

    /**
     * Single-column string result, e.g. distinct dimension labels.
     */
    public List<String> queryValues(CompiledQuery query) {
        log.debug("Executing value lookup for {}: {}", query.getSpec().getKey(), query.getSql());
        return jdbcTemplate.queryForList(query.getSql(), String.class, query.parameterArray());
    }
}
