package com.olapdashboard.domain.service;

import com.olapdashboard.domain.model.FilterPredicate;
import com.olapdashboard.domain.model.GroupingDimension;
import com.olapdashboard.domain.model.RollupSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns raw query-string values into the canonical filter list of a rollup.
 *
 * Permissive: the same request parameters may be sent to rollups with
 * different dimension sets, so names a rollup does not declare are ignored.
 * A missing, blank or "All ..." value means no filter on that dimension.
 * Resolution never fails.
 */
@Slf4j
@Component
public class DimensionFilterResolver {

    public List<FilterPredicate> resolve(RollupSpec spec, Map<String, String> rawParameters) {
        List<FilterPredicate> filters = new ArrayList<>();
        if (rawParameters == null || rawParameters.isEmpty()) {
            return filters;
        }

        for (GroupingDimension dimension : spec.getDimensions()) {
            String raw = rawParameters.get(dimension.getParameter());
            if (raw == null) {
                continue;
            }
            String trimmed = raw.trim();
            if (trimmed.isEmpty() || trimmed.equalsIgnoreCase(dimension.filterSentinel())) {
                continue;
            }
            filters.add(new FilterPredicate(dimension, trimmed.toLowerCase(Locale.ROOT)));
        }

        log.debug("Resolved filters for {}: {}", spec.getKey(), filters);
        return filters;
    }
}
