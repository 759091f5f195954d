package com.di.extractflow.profiling;

/** CPU utilisation of one process; 100 = one core fully busy. Timestamps are epoch seconds. */
public record CpuMetric(double timestamp, long collectionId, long pid, double cpuUsage) {}
