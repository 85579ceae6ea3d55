package com.olapdashboard.domain.service;

/**
 * Terminal failure of a rollup request: the store rejected or failed the query,
 * or returned rows that cannot be decoded. Never retried.
 */
public class RollupExecutionException extends RuntimeException {

    public RollupExecutionException(String message) {
        super(message);
    }

    public RollupExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
