package com.olapdashboard.domain.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One labelled row of a rollup.
 *
 * Serialized as a flat JSON object: dimension labels first (in rollup order),
 * then measures. Null measures are kept as null ("no data", not zero).
 */
public class RollupRow {

    private final Map<String, String> labels;
    private final Map<String, Object> measures;
    private final List<GroupingLevel> levels;

    public RollupRow(Map<String, String> labels, Map<String, Object> measures, List<GroupingLevel> levels) {
        this.labels = Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        this.measures = Collections.unmodifiableMap(new LinkedHashMap<>(measures));
        this.levels = List.copyOf(levels);
    }

    @JsonAnyGetter
    public Map<String, Object> values() {
        Map<String, Object> values = new LinkedHashMap<>(labels);
        values.putAll(measures);
        return values;
    }

    @JsonIgnore
    public Map<String, String> getLabels() {
        return labels;
    }

    @JsonIgnore
    public Map<String, Object> getMeasures() {
        return measures;
    }

    @JsonIgnore
    public List<GroupingLevel> getLevels() {
        return levels;
    }

    public String label(String dimensionKey) {
        return labels.get(dimensionKey);
    }

    public Object measure(String measureKey) {
        return measures.get(measureKey);
    }

    /**
     * Number of dimensions totaled on this row; 0 for detail rows.
     */
    @JsonIgnore
    public int getDepth() {
        return (int) levels.stream().filter(level -> level == GroupingLevel.SUBTOTAL).count();
    }

    @JsonIgnore
    public boolean isGrandTotal() {
        return getDepth() == levels.size();
    }

    @Override
    public String toString() {
        return "RollupRow" + values();
    }
}
