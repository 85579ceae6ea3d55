package com.olapdashboard.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Bucketing of a continuous score into labelled bands.
 *
 * Rendered as a CASE expression in the pre-aggregation projection, so the
 * rollup groups by the band label rather than the raw score.
 *
 * Evaluation order:
 * 1. NULL score -> nullLabel
 * 2. Rules in declared order, first "score >= threshold" wins
 * 3. Anything else -> otherwiseLabel
 */
@Value
@Builder
public class DerivedBucket {

    @Singular
    List<BucketRule> rules;
    String nullLabel;
    String otherwiseLabel;

    public String toSql(String expression) {
        StringBuilder sql = new StringBuilder("CASE");
        sql.append(" WHEN ").append(expression).append(" IS NULL THEN ").append(quote(nullLabel));
        for (BucketRule rule : rules) {
            sql.append(" WHEN ").append(expression)
                    .append(" >= ").append(rule.getThreshold().toPlainString())
                    .append(" THEN ").append(quote(rule.getLabel()));
        }
        sql.append(" ELSE ").append(quote(otherwiseLabel)).append(" END");
        return sql.toString();
    }

    private static String quote(String label) {
        return "'" + label.replace("'", "''") + "'";
    }
}
