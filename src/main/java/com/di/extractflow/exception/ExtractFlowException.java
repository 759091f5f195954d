package com.di.extractflow.exception;

/**
 * Root of all domain exceptions. Unchecked; always carries the underlying cause when there is one.
 */
public class ExtractFlowException extends RuntimeException {

    public ExtractFlowException(String message) {
        super(message);
    }

    public ExtractFlowException(String message, Throwable cause) {
        super(message, cause);
    }
}
