package com.di.extractflow.exception;

import lombok.Getter;

import java.util.List;

/**
 * One or more tasks of a bounded parallel phase failed. Raised only after every task of the phase was drained.
 */
@Getter
public class ParallelPhaseException extends ExtractFlowException {

    private final String phase;
    private final List<String> failures;

    public ParallelPhaseException(String phase, int total, List<String> failures) {
        super(String.format("%s failed: %d/%d task(s) → %s",
                phase, failures.size(), total, String.join(" | ", failures)));
        this.phase = phase;
        this.failures = List.copyOf(failures);
    }

    public ParallelPhaseException(String phase, String message, Throwable cause) {
        super(phase + ": " + message, cause);
        this.phase = phase;
        this.failures = List.of();
    }
}
