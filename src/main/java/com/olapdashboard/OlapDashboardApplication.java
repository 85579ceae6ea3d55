package com.olapdashboard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * OLAP Dashboard Backend
 *
 * Serves rollup statistics (occupancy, tourism arrivals, ratings) from the
 * tourism warehouse for the dashboard charts.
 *
 * Architecture:
 * - One GET endpoint per rollup in the catalog
 * - Each request compiles a single GROUP BY ROLLUP query over PostgreSQL
 * - Grouping indicators decoded into "ALL ..." labelled subtotal rows
 * - Stateless: the warehouse is read-only, nothing is cached or persisted
 */
@SpringBootApplication
public class OlapDashboardApplication {

    public static void main(String[] args) {
        SpringApplication.run(OlapDashboardApplication.class, args);
    }
}
