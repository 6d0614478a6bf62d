package com.shlawgathon.specmerge.backend.model;

/**
 * Provenance of a spec value.
 * Document types carry a priority rank (DOCX > PDF > IMAGE); USER marks an override
 * and never takes part in ranking.
 */
public enum SourceType {
    DOCX(3),
    PDF(2),
    IMAGE(1), // OCR provenance
    USER(0);

    private final int priorityRank;

    SourceType(int priorityRank) {
        this.priorityRank = priorityRank;
    }

    public int priorityRank() {
        return priorityRank;
    }

    public boolean isDocument() {
        return this != USER;
    }
}
