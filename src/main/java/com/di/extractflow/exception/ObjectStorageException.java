package com.di.extractflow.exception;

/**
 * A list/get/put/head call against object storage failed.
 */
public class ObjectStorageException extends ExtractFlowException {

    public ObjectStorageException(String message) {
        super(message);
    }

    public ObjectStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
