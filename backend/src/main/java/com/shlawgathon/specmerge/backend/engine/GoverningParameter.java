package com.shlawgathon.specmerge.backend.engine;

/**
 * @param parameter   canonical parameter key
 * @param measurement metadata key of the measurement compared against it, or null for
 *                    the defect's own measured value
 */
public record GoverningParameter(String parameter, String measurement) {

    public boolean usesMeasuredValue() {
        return measurement == null || measurement.isBlank();
    }
}
