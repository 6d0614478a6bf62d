package com.shlawgathon.specmerge.backend.engine;

import com.shlawgathon.specmerge.backend.model.RepairDecision;
import com.shlawgathon.specmerge.backend.model.SourceType;

import java.math.BigDecimal;

/**
 * One governing comparison, kept for display next to the decision.
 * {@code limit} and {@code measured} are in {@code canonicalUnit}; both are null for flag rules.
 */
public record SpecComparison(
        String parameter,
        String specValue,
        String specUnit,
        SourceType sourceType,
        BigDecimal limit,
        BigDecimal measured,
        String canonicalUnit,
        RepairDecision outcome) {
}
