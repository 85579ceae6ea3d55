package com.olapdashboard.domain.service;

import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds a WHERE clause out of positional predicates.
 *
 * Values only ever travel as bound parameters; the SQL text holds "?" placeholders.
 * Parameters are returned in the order predicates were added.
 */
public class WhereClauseBuilder {

    private final List<String> predicates = new ArrayList<>();
    private final List<Object> parameters = new ArrayList<>();

    public static WhereClauseBuilder where() {
        return new WhereClauseBuilder();
    }

    /**
     * LOWER(expression) = ? with the value bound lower-cased by the caller.
     */
    public WhereClauseBuilder equalsIgnoreCase(String expression, String value) {
        predicates.add("LOWER(" + expression + ") = ?");
        parameters.add(value);
        return this;
    }

    public WhereClauseBuilder isNotNull(String expression) {
        predicates.add(expression + " IS NOT NULL");
        return this;
    }

    public WhereClause build() {
        if (predicates.isEmpty()) {
            return new WhereClause("", List.of());
        }
        return new WhereClause(
                "WHERE " + String.join(" AND ", predicates),
                Collections.unmodifiableList(new ArrayList<>(parameters)));
    }

    @Value
    public static class WhereClause {
        String sql;
        List<Object> parameters;

        public boolean isEmpty() {
            return sql.isEmpty();
        }
    }
}
