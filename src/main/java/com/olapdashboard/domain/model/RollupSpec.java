package com.olapdashboard.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Declarative description of one aggregate view.
 *
 * Dimension order is rollup order: the first dimension is the outermost
 * subtotal, so N dimensions yield N+1 aggregation levels.
 *
 * prelude    - optional static CTEs (no parameters), referenced by fromClause
 * fromClause - FROM/JOIN text over the warehouse, without the FROM keyword
 */
@Getter
@ToString
public class RollupSpec {

    /**
     * GROUPING(...) is returned as a 32-bit integer bitmask.
     */
    public static final int MAX_DIMENSIONS = 31;

    private final String key;
    private final String title;
    private final String prelude;
    private final String fromClause;
    private final List<GroupingDimension> dimensions;
    private final List<MeasureSpec> measures;

    @Builder
    private RollupSpec(String key,
                       String title,
                       String prelude,
                       String fromClause,
                       @Singular List<GroupingDimension> dimensions,
                       @Singular List<MeasureSpec> measures) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Rollup key is required");
        }
        if (fromClause == null || fromClause.isBlank()) {
            throw new IllegalArgumentException("Rollup " + key + " needs a FROM clause");
        }
        if (dimensions.isEmpty() || dimensions.size() > MAX_DIMENSIONS) {
            throw new IllegalArgumentException(String.format(
                    "Rollup %s must declare between 1 and %d dimensions, got %d",
                    key, MAX_DIMENSIONS, dimensions.size()));
        }
        if (measures.isEmpty()) {
            throw new IllegalArgumentException("Rollup " + key + " must declare at least one measure");
        }

        Set<String> columns = new HashSet<>();
        columns.add("grouping_id");
        for (GroupingDimension dimension : dimensions) {
            if (!columns.add(dimension.getKey())) {
                throw new IllegalArgumentException("Duplicate column in rollup " + key + ": " + dimension.getKey());
            }
        }
        for (MeasureSpec measure : measures) {
            if (!columns.add(measure.getKey())) {
                throw new IllegalArgumentException("Duplicate column in rollup " + key + ": " + measure.getKey());
            }
        }

        this.key = key;
        this.title = title != null ? title : key;
        this.prelude = prelude;
        this.fromClause = fromClause;
        this.dimensions = dimensions;
        this.measures = measures;
    }

    public Optional<GroupingDimension> findDimensionByParameter(String parameter) {
        return dimensions.stream()
                .filter(d -> d.getParameter().equals(parameter))
                .findFirst();
    }

    public boolean hasPrelude() {
        return prelude != null && !prelude.isBlank();
    }
}
