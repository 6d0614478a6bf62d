package com.shlawgathon.specmerge.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Rule set for picking one authoritative variant among many.
 */
public enum MergeStrategy {
    PRIORITY,
    LATEST,
    /**
     * Grouped inspection view. Wherever a single value is needed programmatically
     * this resolves exactly like {@link #PRIORITY}.
     */
    ALL;

    @JsonValue
    public String paramValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Strategy actually used to pick a chosen value.
     */
    public MergeStrategy effective() {
        return this == ALL ? PRIORITY : this;
    }

    public static MergeStrategy fromParam(String value) {
        if (value == null || value.isBlank()) {
            return PRIORITY;
        }
        for (MergeStrategy strategy : values()) {
            if (strategy.name().equalsIgnoreCase(value.trim())) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("Unknown strategy: " + value);
    }
}
