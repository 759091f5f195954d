package com.di.extractflow.profiling;

/**
 * Lifecycle of one {@link ProfilingSession}: {@code IDLE → MONITORING → STOPPING → REPORTED}.
 */
public enum ProfilerState {
    IDLE,
    MONITORING,
    STOPPING,
    REPORTED
}
