package com.olapdashboard.domain.model;

import lombok.Value;

import java.util.List;

/**
 * SQL text plus its positional parameters, in binding order.
 */
@Value
public class CompiledQuery {

    String sql;
    List<Object> parameters;
    RollupSpec spec;

    public Object[] parameterArray() {
        return parameters.toArray();
    }
}
