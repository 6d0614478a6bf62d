package com.shlawgathon.specmerge.backend.engine;

import com.shlawgathon.specmerge.backend.model.MergeStrategy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Every known parameter resolved under one strategy, keyed and ordered by parameter.
 * Both the merged and the grouped presentation are derived from this one value.
 */
public record MasterProjection(MergeStrategy strategy, SortedMap<String, MergedRecord> records) {

    public MasterProjection {
        records = Collections.unmodifiableSortedMap(new TreeMap<>(records));
    }

    /**
     * Parameter to chosen-then-alternatives, in parameter order.
     */
    public Map<String, List<SpecValue>> groups() {
        Map<String, List<SpecValue>> groups = new LinkedHashMap<>();
        records.forEach((parameter, record) -> groups.put(parameter, record.entries()));
        return groups;
    }

    public int size() {
        return records.size();
    }
}
