package com.olapdashboard.domain.model;

/**
 * Whether a dimension carries a concrete value on a row or is totaled.
 */
public enum GroupingLevel {
    DETAIL,
    SUBTOTAL
}
