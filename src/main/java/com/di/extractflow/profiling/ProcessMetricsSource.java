package com.di.extractflow.profiling;

import java.util.List;
import java.util.Optional;

/**
 * Where the monitor reads process and network counters from.
 */
public interface ProcessMetricsSource {

    /** Live pids of the given roots and all their descendants; recomputed on every call. */
    List<Long> processTree(List<Long> rootPids);

    /** Empty once the process has exited. */
    Optional<ProcessSample> sample(long pid);

    NetworkCounters network();
}
