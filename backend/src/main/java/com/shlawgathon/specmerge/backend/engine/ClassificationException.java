package com.shlawgathon.specmerge.backend.engine;

import com.shlawgathon.specmerge.backend.model.ClassificationStatus;

/**
 * A defect could not be judged. Never a decision in itself.
 */
public abstract class ClassificationException extends RuntimeException {

    protected ClassificationException(String message) {
        super(message);
    }

    public abstract ClassificationStatus status();
}
