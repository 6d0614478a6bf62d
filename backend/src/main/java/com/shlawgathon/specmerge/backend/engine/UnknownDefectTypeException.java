package com.shlawgathon.specmerge.backend.engine;

import com.shlawgathon.specmerge.backend.model.ClassificationStatus;

public class UnknownDefectTypeException extends ClassificationException {

    public UnknownDefectTypeException(String defectType) {
        super("No defect rule for type: " + defectType);
    }

    @Override
    public ClassificationStatus status() {
        return ClassificationStatus.UNKNOWN_DEFECT_TYPE;
    }
}
