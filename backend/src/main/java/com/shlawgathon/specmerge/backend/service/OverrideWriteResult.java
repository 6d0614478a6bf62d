package com.shlawgathon.specmerge.backend.service;

/**
 * Outcome of a single override write.
 */
public enum OverrideWriteResult {
    APPLIED,
    // A newer override for the parameter is already stored
    STALE
}
