package com.olapdashboard.domain.service;

import com.olapdashboard.domain.catalog.RollupCatalog;
import com.olapdashboard.domain.model.CompiledQuery;
import com.olapdashboard.domain.model.FilterPredicate;
import com.olapdashboard.domain.model.GroupingDimension;
import com.olapdashboard.domain.model.RollupDescriptor;
import com.olapdashboard.domain.model.RollupQueryRequest;
import com.olapdashboard.domain.model.RollupRow;
import com.olapdashboard.domain.model.RollupSpec;
import com.olapdashboard.infrastructure.persistence.repository.WarehouseRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Rollup service for the dashboard.
 *
 * Query Flow:
 * 1. Look up the rollup spec in the catalog
 * 2. Resolve request filters (drops "All ..." and unknown parameters)
 * 3. Compile one ROLLUP query with positional parameters
 * 4. Execute against the warehouse
 * 5. Decode grouping indicators into labelled rows
 *
 * Every request is recomputed from the warehouse; nothing is cached.
 * A store failure fails the whole request: no retry, no partial rows.
 * Connections are taken per statement by JdbcTemplate, so an unreachable
 * store surfaces as a DataAccessException inside the try block.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RollupQueryService {

    private final RollupCatalog rollupCatalog;
    private final DimensionFilterResolver filterResolver;
    private final RollupQueryCompiler queryCompiler;
    private final RollupResultNormalizer resultNormalizer;
    private final WarehouseRepository warehouseRepository;
    private final MeterRegistry meterRegistry;

    /**
     * Compute a full rollup for the given filters.
     */
    public List<RollupRow> runRollup(RollupQueryRequest request) {
        RollupSpec spec = rollupCatalog.get(request.getRollupKey());
        Timer.Sample sample = Timer.start(meterRegistry);

        try {
            List<FilterPredicate> filters = filterResolver.resolve(spec, request.getFilters());
            CompiledQuery query = queryCompiler.compile(spec, filters);

            long startTime = System.currentTimeMillis();
            List<Map<String, Object>> rawRows = warehouseRepository.queryRows(query);
            List<RollupRow> rows = resultNormalizer.normalize(spec, filters, rawRows);
            long queryTime = System.currentTimeMillis() - startTime;

            record(spec, sample, "success");
            log.info("Rollup {} executed: {} rows, {} filters, {} ms",
                    spec.getKey(), rows.size(), filters.size(), queryTime);

            return rows;

        } catch (DataAccessException e) {
            String diagnostic = storeMessage(e);
            log.error("Error executing rollup {}: {}", spec.getKey(), diagnostic, e);
            record(spec, sample, "error");
            throw new RollupExecutionException(diagnostic, e);

        } catch (RollupExecutionException e) {
            log.error("Error decoding rollup {}: {}", spec.getKey(), e.getMessage(), e);
            record(spec, sample, "error");
            throw e;
        }
    }

    /**
     * Distinct labels of one dimension, for filter dropdowns.
     */
    public List<String> dimensionValues(String rollupKey, String parameter) {
        RollupSpec spec = rollupCatalog.get(rollupKey);
        GroupingDimension dimension = spec.findDimensionByParameter(parameter)
                .orElseThrow(() -> new UnknownRollupException(
                        "Unknown dimension " + parameter + " for rollup " + rollupKey));

        try {
            List<String> values = warehouseRepository.queryValues(
                    queryCompiler.compileDimensionValues(spec, dimension));
            log.info("Dimension values {}/{}: {} values", rollupKey, parameter, values.size());
            return values;

        } catch (DataAccessException e) {
            String diagnostic = storeMessage(e);
            log.error("Error loading values for {}/{}: {}", rollupKey, parameter, diagnostic, e);
            throw new RollupExecutionException(diagnostic, e);
        }
    }

    public List<RollupDescriptor> listRollups() {
        return rollupCatalog.all().stream()
                .map(RollupDescriptor::of)
                .collect(Collectors.toList());
    }

    private void record(RollupSpec spec, Timer.Sample sample, String result) {
        sample.stop(Timer.builder("rollup.query.latency")
                .tag("rollup", spec.getKey())
                .tag("result", result)
                .register(meterRegistry));

        Counter.builder("rollup.query.executed")
                .tag("rollup", spec.getKey())
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }

    private static String storeMessage(DataAccessException e) {
        String message = e.getMostSpecificCause().getMessage();
        return message != null ? message : e.getMessage();
    }
}
