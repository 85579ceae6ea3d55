package com.olapdashboard.api;

import com.olapdashboard.domain.service.RollupExecutionException;
import com.olapdashboard.domain.service.UnknownRollupException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps domain failures to {"error": message} bodies.
 *
 * Store failures are a generic 500 carrying the store's diagnostic.
 * The dashboard treats any non-array body as "no data".
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(RollupExecutionException.class)
    public ResponseEntity<Map<String, String>> handleRollupFailure(RollupExecutionException e) {
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", String.valueOf(e.getMessage())));
    }

    @ExceptionHandler(UnknownRollupException.class)
    public ResponseEntity<Map<String, String>> handleUnknownRollup(UnknownRollupException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", e.getMessage()));
    }
}
