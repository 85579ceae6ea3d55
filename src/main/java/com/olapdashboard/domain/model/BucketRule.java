package com.olapdashboard.domain.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * One "value >= threshold" branch of a derived bucket.
 */
@Value
public class BucketRule {

    BigDecimal threshold;
    String label;

    public static BucketRule atLeast(String threshold, String label) {
        return new BucketRule(new BigDecimal(threshold), label);
    }
}
