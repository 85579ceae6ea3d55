package com.olapdashboard.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Request model for rollup queries.
 *
 * filters holds the raw query-string values keyed by parameter name;
 * unknown names and "All ..." values are dropped during resolution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RollupQueryRequest {

    private String rollupKey;
    private Map<String, String> filters;

    public Map<String, String> getFilters() {
        if (filters == null) {
            return Map.of();
        }
        return filters;
    }
}
