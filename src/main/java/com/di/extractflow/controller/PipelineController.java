package com.di.extractflow.controller;

import com.di.extractflow.aggregation.CompletedStep;
import com.di.extractflow.aggregation.JobCollectionStore;
import com.di.extractflow.aggregation.StepAnalysis;
import com.di.extractflow.controller.dto.PartitionRequest;
import com.di.extractflow.controller.dto.PipelineRunRequest;
import com.di.extractflow.controller.dto.PipelineRunResponse;
import com.di.extractflow.partition.PartitionResult;
import com.di.extractflow.partition.PartitioningEngine;
import com.di.extractflow.pipeline.PipelineOrchestrator;
import com.di.extractflow.pipeline.PipelineReport;
import com.di.extractflow.pipeline.PipelineTemplates;
import com.di.extractflow.pipeline.RunContext;
import com.di.extractflow.reference.ReferencePath;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST surface over partitioning, pipeline runs and the persisted job collection.
 *
 * <pre>
 * POST /api/pipeline/partition         → partition a dataset (idempotent)
 * POST /api/pipeline/run               → partition + standard steps (+ imaging)
 * GET  /api/jobs                       → every completed step, by step name
 * GET  /api/jobs/{step}                → completed runs of one step
 * GET  /api/jobs/{step}/analysis       → per-configuration stats, Pareto frontier, speed-ups
 * </pre>
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class PipelineController {

    private final PartitioningEngine partitioningEngine;
    private final PipelineOrchestrator orchestrator;
    private final JobCollectionStore jobStore;

    // ------------------------------------------------------------------ //
    // Pipeline                                                            //
    // ------------------------------------------------------------------ //

    @PostMapping(path = "/api/pipeline/partition",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PartitionResult> partition(@Valid @RequestBody PartitionRequest request) {
        log.info("[PIPELINE-CTRL] POST /partition {}/{} into {}", request.getContainer(), request.getSourceKey(),
                 request.getPartitions());
        PartitionResult result = partitioningEngine.partition(
                ReferencePath.input(request.getContainer(), request.getSourceKey()),
                request.getPartitions(),
                ReferencePath.output(request.getContainer(), request.getDestinationKey(), null));
        return ResponseEntity.ok(result);
    }

    @PostMapping(path = "/api/pipeline/run",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PipelineRunResponse> run(@Valid @RequestBody PipelineRunRequest request) {
        RunContext run = request.getRunId() == null ? RunContext.create() : new RunContext(request.getRunId());
        log.info("[PIPELINE-CTRL] POST /run runId={} source={}/{}", run.runId(), request.getContainer(),
                 request.getSourceKey());
        String container = request.getContainer();
        PipelineReport report = orchestrator.run(run,
                ReferencePath.input(container, request.getSourceKey()),
                request.getPartitions(),
                ReferencePath.output(container, request.getDestinationKey(), null),
                // the first step's designated input is replaced by the partition location
                PipelineTemplates.standardSteps(run, container, ReferencePath.input(container, request.getDestinationKey())),
                request.isImaging() ? PipelineTemplates.imaging(run, container) : null,
                request.getLimit());
        return ResponseEntity.ok(PipelineRunResponse.from(report));
    }

    // ------------------------------------------------------------------ //
    // Jobs                                                                //
    // ------------------------------------------------------------------ //

    @GetMapping(path = "/api/jobs", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, List<CompletedStep>>> jobs() {
        return ResponseEntity.ok(jobStore.load().asMap());
    }

    @GetMapping(path = "/api/jobs/{step}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<CompletedStep>> jobs(@PathVariable("step") String step) {
        List<CompletedStep> runs = jobStore.load().get(step);
        return runs.isEmpty() ? ResponseEntity.notFound().build() : ResponseEntity.ok(runs);
    }

    /**
     * Baseline is optional; all three of memory, cpus and workers must be given for speed-ups.
     *
     * <pre>{@code
     * GET /api/jobs/rebinning/analysis?baselineMemoryMb=2048&baselineCpus=2&baselineWorkers=4
     * }</pre>
     */
    @GetMapping(path = "/api/jobs/{step}/analysis", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<StepAnalysis.Report> analysis(
            @PathVariable("step") String step,
            @RequestParam(required = false) Integer baselineMemoryMb,
            @RequestParam(required = false) Integer baselineCpus,
            @RequestParam(required = false) Integer baselineWorkers) {
        StepAnalysis.ConfigurationKey baseline = baselineMemoryMb != null && baselineCpus != null && baselineWorkers != null
                ? new StepAnalysis.ConfigurationKey(baselineMemoryMb, baselineCpus, baselineWorkers)
                : null;
        return ResponseEntity.ok(StepAnalysis.analyze(step, jobStore.load().get(step), baseline));
    }
}
