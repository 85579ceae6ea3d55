package com.olapdashboard.domain.catalog;

import com.olapdashboard.domain.model.BucketRule;
import com.olapdashboard.domain.model.DerivedBucket;
import com.olapdashboard.domain.model.GroupingDimension;
import com.olapdashboard.domain.model.MeasureSpec;
import com.olapdashboard.domain.model.RollupSpec;
import com.olapdashboard.domain.service.UnknownRollupException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RollupCatalogTest {

    private final RollupCatalog catalog = new RollupCatalog();

    @Test
    void testGet_KnownRollups() {
        assertSame(RollupCatalog.OCCUPANCY_BY_COUNTRY, catalog.get("occupancy-by-country"));
        assertSame(RollupCatalog.TOURISM_ROLLUP, catalog.get("tourism-rollup"));
        assertEquals(5, catalog.all().size());
    }

    @Test
    void testGet_UnknownRollup() {
        UnknownRollupException e = assertThrows(UnknownRollupException.class, () -> catalog.get("seasonal-patterns"));
        assertEquals("Unknown rollup: seasonal-patterns", e.getMessage());
    }

    @Test
    void testSentinels() {
        assertEquals("All Countries", DimensionCatalog.COUNTRY.filterSentinel());
        assertEquals("ALL COUNTRIES", DimensionCatalog.COUNTRY.totalLabel());
        assertEquals("ALL MONTHS", DimensionCatalog.MONTH.totalLabel());
        assertEquals("ALL YEARS", DimensionCatalog.YEAR.totalLabel());
        assertEquals("ALL TYPES", DimensionCatalog.LISTING_TYPE.totalLabel());
        assertEquals("All Room Types", DimensionCatalog.ROOM_TYPE.filterSentinel());
        assertEquals("ALL ROOM TYPES", DimensionCatalog.ROOM_TYPE.totalLabel());
        assertEquals("ALL RATING GROUPS", DimensionCatalog.RATING_GROUP.totalLabel());
    }

    @Test
    void testRatingBands_NullCheckedFirstAndThresholdsInclusive() {
        String sql = DimensionCatalog.RATING_GROUP.selectExpression();

        assertEquals("CASE"
                + " WHEN a.rating_overall IS NULL THEN 'Unrated'"
                + " WHEN a.rating_overall >= 4.5 THEN 'Excellent (4.5–5.0)'"
                + " WHEN a.rating_overall >= 4.0 THEN 'Good (4.0–4.49)'"
                + " WHEN a.rating_overall >= 3.0 THEN 'Average (3.0–3.99)'"
                + " ELSE 'Low (<3.0)' END", sql);
        assertTrue(DimensionCatalog.RATING_GROUP.isDerived());
    }

    /**
     * Boundary cases of the rating bands: 4.5 is Excellent, 4.49999 is Good,
     * null is Unrated. Checked by walking the declared rules in CASE order;
     * PostgreSQL's own evaluation of the CASE is not exercised here.
     */
    @Test
    void testRatingBands_BoundaryValues() {
        assertEquals("Excellent (4.5–5.0)", band(new BigDecimal("5.0")));
        assertEquals("Excellent (4.5–5.0)", band(new BigDecimal("4.5")));
        assertEquals("Good (4.0–4.49)", band(new BigDecimal("4.49999")));
        assertEquals("Good (4.0–4.49)", band(new BigDecimal("4.0")));
        assertEquals("Average (3.0–3.99)", band(new BigDecimal("3.0")));
        assertEquals("Low (<3.0)", band(new BigDecimal("2.99")));
        assertEquals("Unrated", band(null));
    }

    @Test
    void testOccupancyVsArrivals_YearlyOccupancyRoundedBeforeRollup() {
        assertEquals("yearly_occupancy AS ("
                + "SELECT m.country_id, d.year, ROUND(CAST(AVG(m.occupancy) AS NUMERIC), 2) AS avg_occupancy "
                + "FROM monthly_airbnb m "
                + "JOIN date d ON m.date_id = d.date_id "
                + "GROUP BY m.country_id, d.year)", RollupCatalog.OCCUPANCY_VS_ARRIVALS.getPrelude());
    }

    @Test
    void testMeasureScales() {
        assertEquals(List.of(2, 0), scales(RollupCatalog.OCCUPANCY_VS_ARRIVALS));
        assertEquals(List.of(2, 0), scales(RollupCatalog.OCCUPANCY_BY_TYPE));
        assertEquals(List.of(0, 0, 0, 0), scales(RollupCatalog.TOURISM_ROLLUP));
    }

    @Test
    void testSpecValidation() {
        assertThrows(IllegalArgumentException.class, () -> RollupSpec.builder()
                .key("no-dimensions")
                .fromClause("tourism t")
                .measure(MeasureSpec.sum("total_arrivals", "t.total_arrivals", 0))
                .build());

        assertThrows(IllegalArgumentException.class, () -> RollupSpec.builder()
                .key("no-measures")
                .fromClause("tourism t")
                .dimension(DimensionCatalog.YEAR)
                .build());

        assertThrows(IllegalArgumentException.class, () -> RollupSpec.builder()
                .key("duplicate")
                .fromClause("tourism t JOIN country c ON t.country_id = c.country_id")
                .dimension(DimensionCatalog.COUNTRY)
                .dimension(DimensionCatalog.COUNTRY)
                .measure(MeasureSpec.sum("total_arrivals", "t.total_arrivals", 0))
                .build());

        assertThrows(IllegalArgumentException.class,
                () -> new RollupCatalog(List.of(RollupCatalog.TOURISM_ROLLUP, RollupCatalog.TOURISM_ROLLUP)));
    }

    @Test
    void testFindDimensionByParameter() {
        GroupingDimension type = RollupCatalog.OCCUPANCY_BY_TYPE.findDimensionByParameter("listing_type").orElseThrow();

        assertEquals("listing_type", type.getKey());
        assertTrue(RollupCatalog.OCCUPANCY_BY_TYPE.findDimensionByParameter("room_type").isEmpty());
    }

    private static String band(BigDecimal rating) {
        DerivedBucket bucket = DimensionCatalog.RATING_GROUP.getDerivedBucket();
        if (rating == null) {
            return bucket.getNullLabel();
        }
        for (BucketRule rule : bucket.getRules()) {
            if (rating.compareTo(rule.getThreshold()) >= 0) {
                return rule.getLabel();
            }
        }
        return bucket.getOtherwiseLabel();
    }

    private static List<Integer> scales(RollupSpec spec) {
        return spec.getMeasures().stream().map(MeasureSpec::getScale).toList();
    }
}
