package com.olapdashboard.domain.service;

import com.olapdashboard.domain.model.CompiledQuery;
import com.olapdashboard.domain.model.FilterPredicate;
import com.olapdashboard.domain.model.GroupingDimension;
import com.olapdashboard.domain.model.MeasureSpec;
import com.olapdashboard.domain.model.RollupSpec;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Compiles a rollup spec and its filters into one aggregate query.
 *
 * Query shape:
 * <pre>
 * WITH [prelude,]
 * rollup_base AS (
 *   SELECT &lt;dimension expr&gt; AS &lt;dim&gt;, ..., &lt;measure expr&gt; AS &lt;measure&gt;_src, ...
 *   FROM &lt;from clause&gt;
 *   WHERE LOWER(&lt;label expr&gt;) = ? AND ...
 * )
 * SELECT GROUPING(d1, ..., dn) AS grouping_id, d1, ..., dn, &lt;aggregates&gt;
 * FROM rollup_base
 * GROUP BY ROLLUP (d1, ..., dn)
 * ORDER BY d1, ..., dn
 * </pre>
 *
 * Derived buckets are evaluated in rollup_base, so the rollup groups by the
 * band label. Filters are applied there too, i.e. before aggregation.
 * ROLLUP yields the N+1 nested levels only, not every grouping set.
 */
@Component
public class RollupQueryCompiler {

    public static final String GROUPING_COLUMN = "grouping_id";

    private static final String BASE_RELATION = "rollup_base";

    public CompiledQuery compile(RollupSpec spec, List<FilterPredicate> filters) {
        WhereClauseBuilder where = WhereClauseBuilder.where();
        for (FilterPredicate filter : filters) {
            where.equalsIgnoreCase(filter.getDimension().labelExpression(), filter.getValue());
        }
        WhereClauseBuilder.WhereClause whereClause = where.build();

        List<String> baseColumns = new ArrayList<>();
        for (GroupingDimension dimension : spec.getDimensions()) {
            baseColumns.add(dimension.selectExpression() + " AS " + dimension.getKey());
        }
        for (MeasureSpec measure : spec.getMeasures()) {
            baseColumns.add(measure.getSourceExpression() + " AS " + measure.sourceAlias());
        }

        String dimensionList = spec.getDimensions().stream()
                .map(GroupingDimension::getKey)
                .collect(Collectors.joining(", "));
        String measureList = spec.getMeasures().stream()
                .map(MeasureSpec::toSql)
                .collect(Collectors.joining(",\n  "));

        StringBuilder sql = new StringBuilder("WITH ");
        if (spec.hasPrelude()) {
            sql.append(spec.getPrelude()).append(",\n");
        }
        sql.append(BASE_RELATION).append(" AS (\n")
                .append("  SELECT ").append(String.join(", ", baseColumns)).append('\n')
                .append("  FROM ").append(spec.getFromClause()).append('\n');
        if (!whereClause.isEmpty()) {
            sql.append("  ").append(whereClause.getSql()).append('\n');
        }
        sql.append(")\n")
                .append("SELECT\n")
                .append("  GROUPING(").append(dimensionList).append(") AS ").append(GROUPING_COLUMN).append(",\n")
                .append("  ").append(dimensionList).append(",\n")
                .append("  ").append(measureList).append('\n')
                .append("FROM ").append(BASE_RELATION).append('\n')
                .append("GROUP BY ROLLUP (").append(dimensionList).append(")\n")
                .append("ORDER BY ").append(dimensionList);

        return new CompiledQuery(sql.toString(), whereClause.getParameters(), spec);
    }

    /**
     * Distinct non-null labels of one dimension, sorted, as offered in filter controls.
     */
    public CompiledQuery compileDimensionValues(RollupSpec spec, GroupingDimension dimension) {
        WhereClauseBuilder.WhereClause whereClause = WhereClauseBuilder.where()
                .isNotNull(dimension.selectExpression())
                .build();

        StringBuilder sql = new StringBuilder();
        if (spec.hasPrelude()) {
            sql.append("WITH ").append(spec.getPrelude()).append('\n');
        }
        sql.append("SELECT DISTINCT ").append(dimension.labelExpression()).append(" AS value\n")
                .append("FROM ").append(spec.getFromClause()).append('\n')
                .append(whereClause.getSql()).append('\n')
                .append("ORDER BY value");

        return new CompiledQuery(sql.toString(), whereClause.getParameters(), spec);
    }
}
