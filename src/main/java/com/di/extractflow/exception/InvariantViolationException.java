package com.di.extractflow.exception;

/**
 * A structural guarantee of the pipeline does not hold. Fatal to the step and never retried.
 */
public class InvariantViolationException extends ExtractFlowException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
