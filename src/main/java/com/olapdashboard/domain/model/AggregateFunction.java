package com.olapdashboard.domain.model;

/**
 * Aggregates supported by measures.
 */
public enum AggregateFunction {

    AVG {
        @Override
        public String render(String column, int scale) {
            return "ROUND(CAST(AVG(" + column + ") AS NUMERIC), " + scale + ")";
        }
    },

    SUM {
        @Override
        public String render(String column, int scale) {
            return "ROUND(CAST(SUM(" + column + ") AS NUMERIC), " + scale + ")";
        }
    },

    // Always integral, scale is ignored
    COUNT_DISTINCT {
        @Override
        public String render(String column, int scale) {
            return "COUNT(DISTINCT " + column + ")";
        }
    };

    public abstract String render(String column, int scale);
}
