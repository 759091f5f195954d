package com.di.extractflow.controller.dto;

import com.di.extractflow.pipeline.PipelineReport;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineRunResponse {
    private String runId;
    private String partitionLocation;
    private boolean partitionsCreated;
    private long partitioningMs;
    private List<StepLine> steps;
    private long totalDurationMs;
    private double totalCostUsd;

    @Data
    @AllArgsConstructor
    @NoArgsConstructor
    public static class StepLine {
        private String step;
        private int workers;
        private int incompleteWorkers;
        private long durationMs;
        private double costUsd;
        private long ingestedBytes;
    }

    public static PipelineRunResponse from(PipelineReport report) {
        return PipelineRunResponse.builder()
                .runId(report.getRunId())
                .partitionLocation(report.getPartitioning().getContainer() + "/" + report.getPartitioning().getLocation())
                .partitionsCreated(report.getPartitioning().isCreated())
                .partitioningMs(report.getPartitioningMs())
                .steps(report.getSteps().stream()
                        .map(s -> new StepLine(s.getStepName(), s.getWorkerCount(), s.getIncompleteWorkers(),
                                s.getDurationMs(), s.getCostUsd(), s.getIngestedBytes()))
                        .toList())
                .totalDurationMs(report.getTotalDurationMs())
                .totalCostUsd(report.totalCostUsd())
                .build();
    }
}
