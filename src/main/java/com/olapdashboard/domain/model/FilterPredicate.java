package com.olapdashboard.domain.model;

import lombok.Value;

/**
 * Equality filter on one dimension. The value is already trimmed and lower-cased.
 */
@Value
public class FilterPredicate {

    GroupingDimension dimension;
    String value;

    public String getDimensionKey() {
        return dimension.getKey();
    }
}
