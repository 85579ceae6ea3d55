package com.olapdashboard.domain.service;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WhereClauseBuilderTest {

    @Test
    void testBuild_NoPredicates() {
        WhereClauseBuilder.WhereClause clause = WhereClauseBuilder.where().build();

        assertTrue(clause.isEmpty());
        assertEquals("", clause.getSql());
        assertTrue(clause.getParameters().isEmpty());
    }

    @Test
    void testBuild_PositionalParametersInOrder() {
        WhereClauseBuilder.WhereClause clause = WhereClauseBuilder.where()
                .equalsIgnoreCase("c.country_name", "japan")
                .equalsIgnoreCase("a.listing_type", "entire home")
                .build();

        assertEquals("WHERE LOWER(c.country_name) = ? AND LOWER(a.listing_type) = ?", clause.getSql());
        assertEquals(List.of("japan", "entire home"), clause.getParameters());
    }

    @Test
    void testBuild_ValuesNeverReachSqlText() {
        String hostile = "x' OR '1'='1";

        WhereClauseBuilder.WhereClause clause = WhereClauseBuilder.where()
                .equalsIgnoreCase("c.country_name", hostile)
                .build();

        assertFalse(clause.getSql().contains(hostile));
        assertEquals(List.of(hostile), clause.getParameters());
    }

    @Test
    void testBuild_IsNotNullBindsNothing() {
        WhereClauseBuilder.WhereClause clause = WhereClauseBuilder.where()
                .isNotNull("d.month")
                .build();

        assertEquals("WHERE d.month IS NOT NULL", clause.getSql());
        assertTrue(clause.getParameters().isEmpty());
    }
}
