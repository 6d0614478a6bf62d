package com.shlawgathon.specmerge.backend.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classifier output label. Declared from best to worst; {@link #worse} relies on it.
 */
public enum RepairDecision {
    REPAIRABLE("Repairable"),
    SERVICEABLE("Serviceable"),
    NOT_REPAIRABLE("Not Repairable");

    private final String label;

    RepairDecision(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public RepairDecision worse(RepairDecision other) {
        return other.ordinal() > ordinal() ? other : this;
    }
}
