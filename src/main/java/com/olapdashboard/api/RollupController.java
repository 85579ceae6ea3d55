package com.olapdashboard.api;

import com.olapdashboard.domain.model.RollupDescriptor;
import com.olapdashboard.domain.model.RollupQueryRequest;
import com.olapdashboard.domain.model.RollupRow;
import com.olapdashboard.domain.service.RollupQueryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST API for dashboard rollups.
 *
 * Endpoints:
 * - GET /api/{rollupKey} - Rollup rows, e.g. /api/occupancy-by-country?country=Philippines
 * - GET /api/rollups - Available rollups with their dimensions and filter sentinels
 * - GET /api/rollups/{rollupKey}/dimensions/{parameter}/values - Filter values for a dimension
 * - GET /api/health - Health check
 */
@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class RollupController {

    private final RollupQueryService rollupQueryService;

    /**
     * Full rollup of one view.
     *
     * GET /api/occupancy-by-type?country=Japan&listing_type=All%20Types
     *
     * Query Parameters:
     * - one optional filter per dimension parameter of the rollup
     * - "All <Dimension>" (e.g. "All Countries") or an empty value means no filter
     * - parameters the rollup does not declare are ignored
     *
     * Response: JSON array, one object per row, dimension labels then measures.
     * Totaled dimensions read "ALL COUNTRIES", "ALL MONTHS", ...; measures with no
     * underlying facts are null.
     */
    @GetMapping("/{rollupKey}")
    public ResponseEntity<List<RollupRow>> rollup(
            @PathVariable String rollupKey,
            @RequestParam Map<String, String> parameters) {

        log.info("Rollup request: {} {}", rollupKey, parameters);

        RollupQueryRequest request = RollupQueryRequest.builder()
                .rollupKey(rollupKey)
                .filters(parameters)
                .build();

        return ResponseEntity.ok(rollupQueryService.runRollup(request));
    }

    @GetMapping("/rollups")
    public ResponseEntity<List<RollupDescriptor>> listRollups() {
        return ResponseEntity.ok(rollupQueryService.listRollups());
    }

    /**
     * Distinct labels of a dimension, sorted.
     *
     * GET /api/rollups/occupancy-by-country/dimensions/country/values
     */
    @GetMapping("/rollups/{rollupKey}/dimensions/{parameter}/values")
    public ResponseEntity<List<String>> dimensionValues(
            @PathVariable String rollupKey,
            @PathVariable String parameter) {

        log.info("Dimension values request: {}/{}", rollupKey, parameter);

        return ResponseEntity.ok(rollupQueryService.dimensionValues(rollupKey, parameter));
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
