package com.shlawgathon.specmerge.backend.engine;

import com.shlawgathon.specmerge.backend.model.ClassificationStatus;

/**
 * The defect record lacks a usable measurement for a governing comparison.
 */
public class InvalidMeasurementException extends ClassificationException {

    public InvalidMeasurementException(String message) {
        super(message);
    }

    @Override
    public ClassificationStatus status() {
        return ClassificationStatus.INVALID_MEASUREMENT;
    }
}
