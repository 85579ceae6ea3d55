package com.olapdashboard.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Public description of a rollup, so a renderer can build its filter controls.
 */
@Value
@Builder
public class RollupDescriptor {

    String key;
    String title;
    String path;
    @Singular
    List<Dimension> dimensions;
    @Singular
    List<String> measures;

    @Value
    public static class Dimension {
        String key;
        String parameter;
        String filterSentinel;
        String totalLabel;
    }

    public static RollupDescriptor of(RollupSpec spec) {
        RollupDescriptorBuilder builder = RollupDescriptor.builder()
                .key(spec.getKey())
                .title(spec.getTitle())
                .path("/api/" + spec.getKey());
        for (GroupingDimension dimension : spec.getDimensions()) {
            builder.dimension(new Dimension(
                    dimension.getKey(),
                    dimension.getParameter(),
                    dimension.filterSentinel(),
                    dimension.totalLabel()));
        }
        for (MeasureSpec measure : spec.getMeasures()) {
            builder.measure(measure.getKey());
        }
        return builder.build();
    }
}
