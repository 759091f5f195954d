package com.di.extractflow.profiling;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Everything profiled for one worker: the monitor's metric streams plus the worker's phase timers.
 * Immutable once built, like the {@code CompletedStep} it ends up in.
 */
@Value
@Builder
@Jacksonized
public class WorkerProfile {

    @Singular
    List<CpuMetric> cpuMetrics;
    @Singular
    List<MemoryMetric> memoryMetrics;
    @Singular
    List<DiskMetric> diskMetrics;
    @Singular
    List<NetworkMetric> networkMetrics;
    @Singular
    List<FunctionTimer> functionTimers;

    /** False when the monitor did not hand back its metrics in time (or profiling was off). */
    boolean metricsAvailable;

    public double peakMemoryMb() {
        return memoryMetrics.stream().mapToDouble(MemoryMetric::memoryUsageMb).max().orElse(0.0);
    }
}
