package com.di.extractflow.execution;

import java.time.Duration;
import java.time.Instant;

/**
 * Timestamps the execution service recorded for one invocation. {@code workerStart}/{@code workerEnd}
 * are null until the worker actually started/finished.
 */
public record InvocationStats(Instant submitted, Instant workerStart, Instant workerEnd) {

    public long durationMs() {
        if (workerStart == null || workerEnd == null) {
            return 0L;
        }
        return Duration.between(workerStart, workerEnd).toMillis();
    }
}
