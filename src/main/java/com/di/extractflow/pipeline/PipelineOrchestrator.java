package com.di.extractflow.pipeline;

import com.di.extractflow.aggregation.CompletedStep;
import com.di.extractflow.aggregation.JobCollectionStore;
import com.di.extractflow.partition.PartitionResult;
import com.di.extractflow.partition.PartitioningEngine;
import com.di.extractflow.reference.ReferencePath;
import com.di.extractflow.step.ImagingRequest;
import com.di.extractflow.step.ImagingStepRunner;
import com.di.extractflow.step.ParameterSet;
import com.di.extractflow.step.StepRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs a whole pipeline: partition the source dataset, then each step in order.
 *
 * <p>The partition location is fed into the first step's designated input; later steps name
 * their inputs explicitly (usually the previous step's outputs). Every completed step is
 * recorded in the job collection before the next one starts, so a failed run still leaves
 * its finished steps available for analysis.
 */
@Slf4j
@RequiredArgsConstructor
public class PipelineOrchestrator {

    private final PartitioningEngine partitioningEngine;
    private final StepRunner stepRunner;
    private final ImagingStepRunner imagingStepRunner;
    private final JobCollectionStore jobStore;

    /**
     * @param imaging optional final imaging step; null to stop after the last parameter-set step
     * @param limit   caps the partitions each step runs over; null for all
     */
    public PipelineReport run(RunContext run,
                              ReferencePath source,
                              int partitionCount,
                              ReferencePath destination,
                              List<PipelineStep> steps,
                              ImagingRequest imaging,
                              Integer limit) {
        MDC.put("runId", run.runId());
        long pipelineStart = System.currentTimeMillis();
        try {
            log.info("[PIPELINE] run {} started: {} partition(s) of {}, {} step(s){}",
                     run.runId(), partitionCount, source, steps.size(), imaging != null ? " + imaging" : "");

            long partitionStart = System.currentTimeMillis();
            PartitionResult partitions = partitioningEngine.partition(source, partitionCount, destination);
            long partitionMs = System.currentTimeMillis() - partitionStart;
            log.info("[PIPELINE] partitioning {} in {}ms → {}/{}",
                     partitions.isCreated() ? "completed" : "reused", partitionMs,
                     partitions.getContainer(), partitions.getLocation());

            PipelineReport.PipelineReportBuilder report = PipelineReport.builder()
                    .runId(run.runId())
                    .partitioning(partitions)
                    .partitioningMs(partitionMs);

            for (int i = 0; i < steps.size(); i++) {
                PipelineStep step = steps.get(i);
                List<ParameterSet> parameterSets = i == 0
                        ? feedPartitions(step.parameterSets(), partitions.asInput())
                        : step.parameterSets();
                CompletedStep completed = stepRunner.run(step.name(), parameterSets, limit);
                jobStore.record(completed);
                report.step(completed);
                log.info("[PIPELINE] step {}/{} '{}' done in {}ms (cost ${})", i + 1, steps.size(), step.name(),
                         completed.getDurationMs(), String.format("%.6f", completed.getCostUsd()));
            }

            if (imaging != null) {
                CompletedStep completed = imagingStepRunner.run(imaging, limit);
                jobStore.record(completed);
                report.step(completed);
                log.info("[PIPELINE] imaging done in {}ms", completed.getDurationMs());
            }

            PipelineReport result = report.totalDurationMs(System.currentTimeMillis() - pipelineStart).build();
            log.info("[PIPELINE] run {} finished in {}ms, total cost ${}, incomplete workers {}",
                     run.runId(), result.getTotalDurationMs(), String.format("%.6f", result.totalCostUsd()),
                     result.incompleteWorkers());
            return result;
        } finally {
            MDC.remove("runId");
        }
    }

    private static List<ParameterSet> feedPartitions(List<ParameterSet> parameterSets, ReferencePath location) {
        List<ParameterSet> fed = new ArrayList<>(parameterSets);
        fed.set(0, fed.get(0).withDesignatedInput(location));
        return fed;
    }
}
