package com.di.extractflow.aggregation;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Immutable per-step summary: cost, duration and size of one step invocation, plus one
 * {@link WorkerSummary} per worker. Persisted to a {@link JobCollection} under its step name.
 */
@Value
@Builder
@Jacksonized
public class CompletedStep {

    String jobId;
    String stepName;
    double costUsd;
    long ingestedBytes;
    int memoryMb;
    int cpusPerWorker;
    int workerCount;
    /** Mean listed input size per worker, in MB. */
    double chunkSizeMb;
    Instant startTime;
    Instant endTime;
    long durationMs;
    String environment;
    String instanceType;
    int incompleteWorkers;
    @Singular
    List<WorkerSummary> workers;
}
