package com.shlawgathon.specmerge.backend.model;

/**
 * How a defect rule turns governing parameters into a decision.
 */
public enum RuleMode {
    THRESHOLD,
    ALWAYS_NOT_REPAIRABLE,
    FLAG,
    MATCH
}
