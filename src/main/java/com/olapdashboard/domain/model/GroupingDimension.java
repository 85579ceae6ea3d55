package com.olapdashboard.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Locale;

/**
 * A warehouse attribute a rollup can group and filter by.
 *
 * key             - output column and JSON key (e.g. "country_name")
 * parameter       - query-string name used for filtering (e.g. "country")
 * pluralName      - drives both sentinels: "All Countries" / "ALL COUNTRIES"
 * sourceExpression- SQL over the rollup's FROM clause
 * derivedBucket   - optional banding applied to sourceExpression
 */
@Value
@Builder
public class GroupingDimension {

    String key;
    String parameter;
    String pluralName;
    String sourceExpression;

    @Builder.Default
    DisplayFormat displayFormat = DisplayFormat.TEXT;

    DerivedBucket derivedBucket;

    /**
     * Filter value that means "no filter on this dimension".
     */
    public String filterSentinel() {
        return "All " + pluralName;
    }

    /**
     * Label carried by rows where this dimension is totaled.
     */
    public String totalLabel() {
        return "ALL " + pluralName.toUpperCase(Locale.ROOT);
    }

    /**
     * Expression projected before aggregation (banded if derived).
     */
    public String selectExpression() {
        return derivedBucket != null ? derivedBucket.toSql(sourceExpression) : sourceExpression;
    }

    /**
     * Expression whose text equals the label shown to clients.
     */
    public String labelExpression() {
        return displayFormat.labelSql(selectExpression());
    }

    public boolean isDerived() {
        return derivedBucket != null;
    }
}
