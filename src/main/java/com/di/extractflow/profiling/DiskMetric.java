package com.di.extractflow.profiling;

/** Cumulative disk traffic of one process in MB, with rates in MB/s against its previous sample. */
public record DiskMetric(double timestamp, long collectionId, long pid,
                         double readMb, double writeMb, double readRate, double writeRate) {}
