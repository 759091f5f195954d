package com.di.extractflow.exception;

import lombok.Getter;

/**
 * Two partitions of the same step would upload to the same output key.
 */
@Getter
public class OutputKeyCollisionException extends InvariantViolationException {

    private final String outputKey;

    public OutputKeyCollisionException(String outputKey, String firstPartition, String secondPartition) {
        super("Output key " + outputKey + " is produced by both " + firstPartition + " and " + secondPartition);
        this.outputKey = outputKey;
    }
}
