package com.shlawgathon.specmerge.backend.model;

/**
 * Per-row outcome of a classification batch.
 */
public enum ClassificationStatus {
    DECIDED,
    UNRESOLVED_SPEC,
    UNIT_MISMATCH,
    UNKNOWN_DEFECT_TYPE,
    INVALID_MEASUREMENT
}
