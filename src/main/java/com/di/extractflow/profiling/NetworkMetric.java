package com.di.extractflow.profiling;

/** Node-wide network counters in MB (received as read, sent as write), with rates in MB/s. */
public record NetworkMetric(double timestamp, long collectionId,
                            double readMb, double writeMb, double readRate, double writeRate) {}
