package com.olapdashboard.domain.service;

import com.olapdashboard.domain.model.FilterPredicate;
import com.olapdashboard.domain.model.GroupingDimension;
import com.olapdashboard.domain.model.GroupingLevel;
import com.olapdashboard.domain.model.MeasureSpec;
import com.olapdashboard.domain.model.RollupRow;
import com.olapdashboard.domain.model.RollupSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns raw rollup tuples into labelled rows.
 *
 * Totaled dimensions get their "ALL ..." label, detail dimensions get the
 * display-formatted value. Measures are passed through as returned (already
 * rounded by the query); a null measure stays null.
 *
 * A level whose first totaled dimension is filtered to one value repeats the
 * next finer level row for row, so those tuples are dropped. Levels whose first
 * totaled dimension is unfiltered are kept even when an inner dimension is
 * filtered (month=03 still yields the ALL COUNTRIES, ALL MONTHS total).
 * Everything else keeps the store's order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RollupResultNormalizer {

    private final GroupingIndicatorDecoder decoder;

    public List<RollupRow> normalize(RollupSpec spec, List<FilterPredicate> filters, List<Map<String, Object>> rawRows) {
        Set<String> filtered = filters.stream()
                .map(FilterPredicate::getDimensionKey)
                .collect(Collectors.toSet());

        List<RollupRow> rows = new ArrayList<>(rawRows.size());
        for (Map<String, Object> raw : rawRows) {
            RollupRow row = normalizeRow(spec, raw);
            if (!repeatsFilteredLevel(spec, row, filtered)) {
                rows.add(row);
            }
        }

        if (rows.size() < rawRows.size()) {
            log.debug("Rollup {}: dropped {} rows totaling filtered dimensions {}",
                    spec.getKey(), rawRows.size() - rows.size(), filtered);
        }
        return rows;
    }

    private RollupRow normalizeRow(RollupSpec spec, Map<String, Object> raw) {
        List<GroupingDimension> dimensions = spec.getDimensions();
        List<GroupingLevel> levels = decoder.decode(
                raw.get(RollupQueryCompiler.GROUPING_COLUMN), dimensions.size());

        Map<String, String> labels = new LinkedHashMap<>();
        for (int i = 0; i < dimensions.size(); i++) {
            GroupingDimension dimension = dimensions.get(i);
            labels.put(dimension.getKey(), label(dimension, levels.get(i), raw.get(dimension.getKey())));
        }

        Map<String, Object> measures = new LinkedHashMap<>();
        for (MeasureSpec measure : spec.getMeasures()) {
            measures.put(measure.getKey(), raw.get(measure.getKey()));
        }

        return new RollupRow(labels, measures, levels);
    }

    private String label(GroupingDimension dimension, GroupingLevel level, Object value) {
        if (level == GroupingLevel.SUBTOTAL) {
            return dimension.totalLabel();
        }
        // a NULL attribute in the warehouse is still a detail value
        return value == null ? null : dimension.getDisplayFormat().format(value);
    }

    private boolean repeatsFilteredLevel(RollupSpec spec, RollupRow row, Set<String> filtered) {
        int firstTotaled = row.getLevels().indexOf(GroupingLevel.SUBTOTAL);
        return firstTotaled >= 0 && filtered.contains(spec.getDimensions().get(firstTotaled).getKey());
    }
}
