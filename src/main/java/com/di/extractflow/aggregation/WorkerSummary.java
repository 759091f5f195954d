package com.di.extractflow.aggregation;

import com.di.extractflow.profiling.WorkerProfile;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class WorkerSummary {

    String invocationId;
    String partitionKey;
    Instant workerStart;
    Instant workerEnd;
    long durationMs;
    double costUsd;
    long ingestedBytes;
    boolean complete;
    String environment;
    String instanceType;
    WorkerProfile profile;
}
