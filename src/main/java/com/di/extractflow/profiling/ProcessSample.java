package com.di.extractflow.profiling;

/** Raw counters of one live process at one instant. */
public record ProcessSample(long pid, long cpuTimeNanos, long rssBytes, long readBytes, long writeBytes) {}
