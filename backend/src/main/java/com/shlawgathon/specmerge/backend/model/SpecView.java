package com.shlawgathon.specmerge.backend.model;

import java.util.Locale;

/**
 * Requested presentation of the master projection.
 */
public enum SpecView {
    MERGED,
    RAW;

    public static SpecView fromParam(String value) {
        if (value == null || value.isBlank()) {
            return MERGED;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown view: " + value);
        }
    }
}
