package com.shlawgathon.specmerge.backend.engine;

/**
 * Resolution was requested for a parameter with neither variants nor an override.
 * Always a caller bug.
 */
public class EmptyVariantSetException extends IllegalStateException {

    public EmptyVariantSetException(String parameter) {
        super("No variants and no override for parameter: " + parameter);
    }
}
