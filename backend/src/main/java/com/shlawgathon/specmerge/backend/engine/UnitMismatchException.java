package com.shlawgathon.specmerge.backend.engine;

import com.shlawgathon.specmerge.backend.model.ClassificationStatus;

/**
 * Two values cannot be compared without a conversion that is not defined.
 */
public class UnitMismatchException extends ClassificationException {

    public UnitMismatchException(String message) {
        super(message);
    }

    @Override
    public ClassificationStatus status() {
        return ClassificationStatus.UNIT_MISMATCH;
    }
}
