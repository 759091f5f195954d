package com.di.extractflow.exception;

import lombok.Getter;

import java.util.List;

/**
 * A step could not be completed because some of its worker invocations failed.
 */
@Getter
public class StepExecutionException extends ExtractFlowException {

    private final String stepName;
    private final List<String> failedPartitions;

    public StepExecutionException(String stepName, List<String> failedPartitions, Throwable cause) {
        super("Step '" + stepName + "' failed for " + failedPartitions.size()
                + " partition(s): " + failedPartitions, cause);
        this.stepName = stepName;
        this.failedPartitions = List.copyOf(failedPartitions);
    }
}
