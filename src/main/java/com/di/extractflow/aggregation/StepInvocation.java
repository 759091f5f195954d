package com.di.extractflow.aggregation;

import java.time.Instant;
import java.util.Map;

/**
 * Facts about a step invocation known to the runner rather than to any worker.
 *
 * @param listedSizes input keys listed before dispatch → their size at listing time
 */
public record StepInvocation(String stepName,
                             int memoryMb,
                             int cpusPerWorker,
                             Map<String, Long> listedSizes,
                             Instant startTime,
                             Instant endTime) {

    public long listedBytes() {
        return listedSizes.values().stream().mapToLong(Long::longValue).sum();
    }
}
