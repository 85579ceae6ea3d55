package com.olapdashboard.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * A named aggregate over a fact column.
 *
 * Scale is the rounding precision applied in the query:
 * counts use 0, rates and averages of percentages use 2.
 */
@Value
@Builder
public class MeasureSpec {

    String key;
    AggregateFunction function;
    String sourceExpression;

    @Builder.Default
    int scale = 2;

    /**
     * Column name of the measure input in the pre-aggregation projection.
     */
    public String sourceAlias() {
        return key + "_src";
    }

    public String toSql() {
        return function.render(sourceAlias(), scale) + " AS " + key;
    }

    public static MeasureSpec avg(String key, String sourceExpression, int scale) {
        return new MeasureSpec(key, AggregateFunction.AVG, sourceExpression, scale);
    }

    public static MeasureSpec sum(String key, String sourceExpression, int scale) {
        return new MeasureSpec(key, AggregateFunction.SUM, sourceExpression, scale);
    }

    public static MeasureSpec countDistinct(String key, String sourceExpression) {
        return new MeasureSpec(key, AggregateFunction.COUNT_DISTINCT, sourceExpression, 0);
    }
}
