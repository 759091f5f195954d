package com.di.extractflow.pipeline;

import com.di.extractflow.aggregation.CompletedStep;
import com.di.extractflow.partition.PartitionResult;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Step-by-step account of a pipeline run.
 */
@Value
@Builder
public class PipelineReport {

    String runId;
    PartitionResult partitioning;
    long partitioningMs;
    @Singular
    List<CompletedStep> steps;
    long totalDurationMs;

    public double totalCostUsd() {
        return steps.stream().mapToDouble(CompletedStep::getCostUsd).sum();
    }

    public int incompleteWorkers() {
        return steps.stream().mapToInt(CompletedStep::getIncompleteWorkers).sum();
    }
}
