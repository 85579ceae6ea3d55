package com.olapdashboard.domain.service;

/**
 * Thrown when a request names a rollup or dimension the catalog does not declare.
 */
public class UnknownRollupException extends RuntimeException {

    public UnknownRollupException(String message) {
        super(message);
    }
}
