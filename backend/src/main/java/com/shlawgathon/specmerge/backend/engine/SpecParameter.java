package com.shlawgathon.specmerge.backend.engine;

import java.math.BigDecimal;
import java.util.List;

/**
 * Entry of the controlled parameter vocabulary.
 *
 * @param serviceableRatio fraction of the limit at or below which a measurement is
 *                         Repairable; null when no threshold rule uses the parameter
 */
public record SpecParameter(
        String key,
        String displayName,
        String canonicalUnit,
        List<String> aliases,
        BigDecimal serviceableRatio) {

    public SpecParameter {
        canonicalUnit = canonicalUnit == null ? "" : canonicalUnit.trim();
        aliases = aliases == null ? List.of() : List.copyOf(aliases);
        displayName = displayName == null || displayName.isBlank() ? key : displayName;
    }
}
