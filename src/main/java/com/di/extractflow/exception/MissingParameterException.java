package com.di.extractflow.exception;

public class MissingParameterException extends InvariantViolationException {

    public MissingParameterException(String parameterSet, String parameter) {
        super("Parameter set '" + parameterSet + "' has no reference named '" + parameter + "'");
    }
}
