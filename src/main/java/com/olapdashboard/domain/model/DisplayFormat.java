package com.olapdashboard.domain.model;

import java.math.BigDecimal;

/**
 * How a raw dimension value is rendered for the client.
 *
 * Each format also knows the SQL text of its label, so filters compare
 * against exactly what the client sees (e.g. month "03", not 3).
 */
public enum DisplayFormat {

    TEXT {
        @Override
        public String format(Object raw) {
            return raw.toString();
        }

        @Override
        public String labelSql(String expression) {
            return expression;
        }
    },

    NUMBER {
        @Override
        public String format(Object raw) {
            if (raw instanceof BigDecimal) {
                return ((BigDecimal) raw).stripTrailingZeros().toPlainString();
            }
            return raw.toString();
        }

        @Override
        public String labelSql(String expression) {
            return "CAST(" + expression + " AS TEXT)";
        }
    },

    ZERO_PADDED_MONTH {
        @Override
        public String format(Object raw) {
            int month = raw instanceof Number
                    ? ((Number) raw).intValue()
                    : Integer.parseInt(raw.toString().trim());
            return String.format("%02d", month);
        }

        @Override
        public String labelSql(String expression) {
            return "LPAD(CAST(" + expression + " AS TEXT), 2, '0')";
        }
    };

    /**
     * Render a non-null raw value from the store.
     */
    public abstract String format(Object raw);

    /**
     * SQL expression producing the same text as {@link #format(Object)}.
     */
    public abstract String labelSql(String expression);
}
