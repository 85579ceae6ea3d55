package com.olapdashboard.domain.catalog;

import com.olapdashboard.domain.model.MeasureSpec;
import com.olapdashboard.domain.model.RollupSpec;
import com.olapdashboard.domain.service.UnknownRollupException;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.olapdashboard.domain.catalog.DimensionCatalog.COUNTRY;
import static com.olapdashboard.domain.catalog.DimensionCatalog.LISTING_TYPE;
import static com.olapdashboard.domain.catalog.DimensionCatalog.MONTH;
import static com.olapdashboard.domain.catalog.DimensionCatalog.RATING_GROUP;
import static com.olapdashboard.domain.catalog.DimensionCatalog.ROOM_TYPE;
import static com.olapdashboard.domain.catalog.DimensionCatalog.YEAR;

/**
 * The rollups served by the dashboard, keyed by endpoint name.
 *
 * Each entry is GET /api/{key}. Adding a view means adding a spec here,
 * not writing another handler.
 */
@Component
public class RollupCatalog {

    public static final RollupSpec OCCUPANCY_BY_COUNTRY = RollupSpec.builder()
            .key("occupancy-by-country")
            .title("Occupancy by country and month")
            .fromClause("monthly_airbnb m "
                    + "JOIN date d ON m.date_id = d.date_id "
                    + "JOIN country c ON m.country_id = c.country_id")
            .dimension(COUNTRY)
            .dimension(MONTH)
            .measure(MeasureSpec.avg("avg_occupancy", "m.occupancy", 2))
            .build();

    // Occupancy is monthly; it is averaged per (country, year) first so it can sit
    // next to the yearly tourism facts. The yearly averages are rounded to 2
    // decimals before the rollup averages them again.
    public static final RollupSpec OCCUPANCY_VS_ARRIVALS = RollupSpec.builder()
            .key("occupancy-vs-arrivals")
            .title("Occupancy vs tourism arrivals by country and year")
            .prelude("yearly_occupancy AS ("
                    + "SELECT m.country_id, d.year, ROUND(CAST(AVG(m.occupancy) AS NUMERIC), 2) AS avg_occupancy "
                    + "FROM monthly_airbnb m "
                    + "JOIN date d ON m.date_id = d.date_id "
                    + "GROUP BY m.country_id, d.year)")
            .fromClause("tourism t "
                    + "JOIN country c ON t.country_id = c.country_id "
                    + "LEFT JOIN yearly_occupancy y ON y.country_id = t.country_id AND y.year = t.year")
            .dimension(COUNTRY)
            .dimension(YEAR)
            .measure(MeasureSpec.avg("avg_occupancy", "y.avg_occupancy", 2))
            .measure(MeasureSpec.avg("avg_arrivals", "t.total_arrivals", 0))
            .build();

    public static final RollupSpec OCCUPANCY_BY_TYPE = RollupSpec.builder()
            .key("occupancy-by-type")
            .title("Occupancy by country and listing type")
            .fromClause("monthly_airbnb m "
                    + "JOIN airbnb_listing a ON m.listing_id = a.listing_id "
                    + "JOIN country c ON m.country_id = c.country_id")
            .dimension(COUNTRY)
            .dimension(LISTING_TYPE)
            .measure(MeasureSpec.avg("avg_occupancy", "m.occupancy", 2))
            .measure(MeasureSpec.countDistinct("listing_count", "m.listing_id"))
            .build();

    public static final RollupSpec OCCUPANCY_BY_RATING = RollupSpec.builder()
            .key("occupancy-by-rating")
            .title("Occupancy by rating band, country and room type")
            .fromClause("monthly_airbnb m "
                    + "JOIN airbnb_listing a ON m.listing_id = a.listing_id "
                    + "JOIN country c ON m.country_id = c.country_id")
            .dimension(RATING_GROUP)
            .dimension(COUNTRY)
            .dimension(ROOM_TYPE)
            .measure(MeasureSpec.avg("avg_occupancy", "m.occupancy", 2))
            .measure(MeasureSpec.countDistinct("listing_count", "m.listing_id"))
            .build();

    public static final RollupSpec TOURISM_ROLLUP = RollupSpec.builder()
            .key("tourism-rollup")
            .title("Tourism arrivals and departures by country and year")
            .fromClause("tourism t "
                    + "JOIN country c ON t.country_id = c.country_id")
            .dimension(COUNTRY)
            .dimension(YEAR)
            .measure(MeasureSpec.sum("total_arrivals", "t.total_arrivals", 0))
            .measure(MeasureSpec.sum("total_departures", "t.total_departures", 0))
            .measure(MeasureSpec.avg("avg_personal_arrivals", "t.arrivals_personal", 0))
            .measure(MeasureSpec.avg("avg_business_arrivals", "t.arrivals_business", 0))
            .build();

    private final Map<String, RollupSpec> specs;

    public RollupCatalog() {
        this(List.of(OCCUPANCY_BY_COUNTRY, OCCUPANCY_VS_ARRIVALS, OCCUPANCY_BY_TYPE,
                OCCUPANCY_BY_RATING, TOURISM_ROLLUP));
    }

    public RollupCatalog(List<RollupSpec> specs) {
        Map<String, RollupSpec> byKey = new LinkedHashMap<>();
        for (RollupSpec spec : specs) {
            if (byKey.putIfAbsent(spec.getKey(), spec) != null) {
                throw new IllegalArgumentException("Duplicate rollup key: " + spec.getKey());
            }
        }
        this.specs = Collections.unmodifiableMap(byKey);
    }

    public RollupSpec get(String key) {
        RollupSpec spec = specs.get(key);
        if (spec == null) {
            throw new UnknownRollupException("Unknown rollup: " + key);
        }
        return spec;
    }

    public Collection<RollupSpec> all() {
        return specs.values();
    }
}
