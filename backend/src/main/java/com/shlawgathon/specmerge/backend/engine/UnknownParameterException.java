package com.shlawgathon.specmerge.backend.engine;

/**
 * A name outside the controlled parameter vocabulary.
 */
public class UnknownParameterException extends IllegalArgumentException {

    private final String parameter;

    public UnknownParameterException(String parameter) {
        super("Unknown parameter: " + parameter);
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }
}
