package com.shlawgathon.specmerge.backend.engine;

import com.shlawgathon.specmerge.backend.model.SpecVariant;

import java.util.ArrayList;
import java.util.List;

/**
 * Resolver output for one parameter under one strategy.
 *
 * @param alternatives every variant not chosen, in the strategy's order; with an override
 *                     this is the full variant set
 */
public record MergedRecord(
        String parameter,
        SpecValue chosen,
        List<SpecVariant> alternatives,
        boolean overridden) {

    public MergedRecord {
        alternatives = List.copyOf(alternatives);
    }

    /**
     * Chosen value followed by the alternatives: the grouped shape of this record.
     */
    public List<SpecValue> entries() {
        List<SpecValue> entries = new ArrayList<>(alternatives.size() + 1);
        entries.add(chosen);
        alternatives.forEach(variant -> entries.add(SpecValue.of(variant)));
        return entries;
    }
}
