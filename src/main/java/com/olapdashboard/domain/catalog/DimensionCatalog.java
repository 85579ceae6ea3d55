package com.olapdashboard.domain.catalog;

import com.olapdashboard.domain.model.BucketRule;
import com.olapdashboard.domain.model.DerivedBucket;
import com.olapdashboard.domain.model.DisplayFormat;
import com.olapdashboard.domain.model.GroupingDimension;

/**
 * Dimensions of the tourism/occupancy warehouse.
 *
 * Source expressions use the table aliases shared by every rollup:
 * c = country, d = date, t = tourism, a = airbnb_listing, m = monthly_airbnb.
 */
public final class DimensionCatalog {

    public static final GroupingDimension COUNTRY = GroupingDimension.builder()
            .key("country_name")
            .parameter("country")
            .pluralName("Countries")
            .sourceExpression("c.country_name")
            .build();

    public static final GroupingDimension MONTH = GroupingDimension.builder()
            .key("month")
            .parameter("month")
            .pluralName("Months")
            .sourceExpression("d.month")
            .displayFormat(DisplayFormat.ZERO_PADDED_MONTH)
            .build();

    public static final GroupingDimension YEAR = GroupingDimension.builder()
            .key("year")
            .parameter("year")
            .pluralName("Years")
            .sourceExpression("t.year")
            .displayFormat(DisplayFormat.NUMBER)
            .build();

    public static final GroupingDimension LISTING_TYPE = GroupingDimension.builder()
            .key("listing_type")
            .parameter("listing_type")
            .pluralName("Types")
            .sourceExpression("a.listing_type")
            .build();

    public static final GroupingDimension ROOM_TYPE = GroupingDimension.builder()
            .key("room_type")
            .parameter("room_type")
            .pluralName("Room Types")
            .sourceExpression("a.room_type")
            .build();

    // Null is checked before the thresholds: unrated listings never fall under "Low".
    public static final DerivedBucket RATING_BANDS = DerivedBucket.builder()
            .rule(BucketRule.atLeast("4.5", "Excellent (4.5–5.0)"))
            .rule(BucketRule.atLeast("4.0", "Good (4.0–4.49)"))
            .rule(BucketRule.atLeast("3.0", "Average (3.0–3.99)"))
            .nullLabel("Unrated")
            .otherwiseLabel("Low (<3.0)")
            .build();

    public static final GroupingDimension RATING_GROUP = GroupingDimension.builder()
            .key("rating_group")
            .parameter("rating_group")
            .pluralName("Rating Groups")
            .sourceExpression("a.rating_overall")
            .derivedBucket(RATING_BANDS)
            .build();

    private DimensionCatalog() {
    }
}
