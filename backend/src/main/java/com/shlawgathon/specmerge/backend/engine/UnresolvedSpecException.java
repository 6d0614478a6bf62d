package com.shlawgathon.specmerge.backend.engine;

import com.shlawgathon.specmerge.backend.model.ClassificationStatus;

/**
 * The governing parameter has no resolved value to compare against.
 */
public class UnresolvedSpecException extends ClassificationException {

    private final String parameter;

    public UnresolvedSpecException(String parameter) {
        super("No resolved spec value for parameter: " + parameter);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }

    @Override
    public ClassificationStatus status() {
        return ClassificationStatus.UNRESOLVED_SPEC;
    }
}
