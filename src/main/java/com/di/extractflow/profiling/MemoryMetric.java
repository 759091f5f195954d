package com.di.extractflow.profiling;

/** Resident set size of one process in MB. */
public record MemoryMetric(double timestamp, long collectionId, long pid, double memoryUsageMb) {}
