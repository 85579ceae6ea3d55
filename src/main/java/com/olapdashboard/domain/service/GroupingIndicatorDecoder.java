package com.olapdashboard.domain.service;

import com.olapdashboard.domain.model.GroupingLevel;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decodes the store's GROUPING(d1, ..., dn) bitmask into one level per dimension.
 *
 * Bit (n - 1 - i) belongs to dimension i, so the first dimension is the most
 * significant bit; a set bit means the dimension is totaled on that row.
 * Under ROLLUP the decoded levels are always a run of DETAIL followed by a run
 * of SUBTOTAL; anything else means the row did not come from a rollup.
 */
@Component
public class GroupingIndicatorDecoder {

    public List<GroupingLevel> decode(Object indicator, int dimensionCount) {
        if (!(indicator instanceof Number)) {
            throw new RollupExecutionException("Missing or non-numeric grouping indicator: " + indicator);
        }
        long mask = ((Number) indicator).longValue();
        if (mask < 0 || mask >= (1L << dimensionCount)) {
            throw new RollupExecutionException(String.format(
                    "Grouping indicator %d out of range for %d dimensions", mask, dimensionCount));
        }

        List<GroupingLevel> levels = new ArrayList<>(dimensionCount);
        boolean totaled = false;
        for (int i = 0; i < dimensionCount; i++) {
            boolean bit = ((mask >> (dimensionCount - 1 - i)) & 1L) == 1L;
            if (totaled && !bit) {
                throw new RollupExecutionException(String.format(
                        "Grouping indicator %d is not a rollup level for %d dimensions", mask, dimensionCount));
            }
            totaled = bit;
            levels.add(bit ? GroupingLevel.SUBTOTAL : GroupingLevel.DETAIL);
        }
        return levels;
    }
}
