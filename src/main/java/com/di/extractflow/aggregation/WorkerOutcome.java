package com.di.extractflow.aggregation;

import com.di.extractflow.execution.InvocationStats;
import com.di.extractflow.profiling.WorkerProfile;

import java.util.Map;

/**
 * One worker's result joined with the executor's own timestamps for that invocation.
 *
 * @param ingested input key → bytes the worker reported downloading for it
 */
public record WorkerOutcome(String invocationId,
                            String partitionKey,
                            Map<String, Long> ingested,
                            boolean complete,
                            WorkerProfile profile,
                            String environment,
                            String instanceType,
                            InvocationStats stats) {

    public long ingestedBytes() {
        return ingested.values().stream().mapToLong(Long::longValue).sum();
    }
}
