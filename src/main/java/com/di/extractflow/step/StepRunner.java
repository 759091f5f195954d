package com.di.extractflow.step;

import com.di.extractflow.aggregation.CompletedStep;
import com.di.extractflow.aggregation.JobAggregator;
import com.di.extractflow.aggregation.StepInvocation;
import com.di.extractflow.aggregation.WorkerOutcome;
import com.di.extractflow.exception.StepExecutionException;
import com.di.extractflow.execution.FunctionExecutor;
import com.di.extractflow.execution.InvocationFuture;
import com.di.extractflow.execution.PartialFailureException;
import com.di.extractflow.util.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs one pipeline step: list the partitions, plan one invocation per partition, map the plans
 * over workers and aggregate their results into a {@link CompletedStep}.
 *
 * <pre>
 *   listInputs ─► plan ─► executor.map(StepWorker) ─► getResult ─► JobAggregator.finalizeStep
 * </pre>
 *
 * A raised invocation fails the step only after every other invocation finished; the
 * {@link StepExecutionException} names the partitions whose workers raised.
 */
@Slf4j
public class StepRunner {

    private final FunctionExecutor executor;
    private final ExecutionPlanner planner;
    private final StepWorker worker;
    private final JobAggregator aggregator;
    private final PipelineMetrics metrics;
    private final Map<String, String> extraEnv;
    private final boolean profilingEnabled;

    public StepRunner(FunctionExecutor executor, ExecutionPlanner planner, StepWorker worker,
                      JobAggregator aggregator, PipelineMetrics metrics,
                      Map<String, String> extraEnv, boolean profilingEnabled) {
        this.executor = executor;
        this.planner = planner;
        this.worker = worker;
        this.aggregator = aggregator;
        this.metrics = metrics;
        this.extraEnv = extraEnv == null ? Map.of() : Map.copyOf(extraEnv);
        this.profilingEnabled = profilingEnabled;
    }

    public CompletedStep run(String stepName, List<ParameterSet> parameterSets) {
        return run(stepName, parameterSets, null);
    }

    /**
     * @param limit caps the number of listed partitions (and so workers); null or ≤ 0 for all
     * @throws StepExecutionException when at least one worker raised
     */
    public CompletedStep run(String stepName, List<ParameterSet> parameterSets, Integer limit) {
        MDC.put("step", stepName);
        Instant start = Instant.now();
        try {
            ListedInputs listed = planner.listInputs(parameterSets, limit);
            List<ExecutionPlan> plans = planner.plan(parameterSets, listed.keys());
            log.info("[STEP] '{}' dispatching {} worker(s) over {}/{} ({} bytes)",
                     stepName, plans.size(), listed.container(), listed.prefix(), listed.totalBytes());

            List<InvocationFuture<WorkerResult>> futures = executor.map(worker, plans, extraEnv);
            List<WorkerResult> results = collect(stepName, futures, plans);

            List<WorkerOutcome> outcomes = new ArrayList<>(results.size());
            for (int i = 0; i < results.size(); i++) {
                outcomes.add(toOutcome(results.get(i), futures.get(i)));
            }

            StepInvocation invocation = new StepInvocation(stepName, executor.getRuntimeMemoryMb(),
                    executor.getCpusPerWorker(), listed.sizes(), start, Instant.now());
            CompletedStep completed = aggregator.finalizeStep(outcomes, invocation);
            metrics.recordStepDuration(stepName, completed.getDurationMs());
            log.info("[STEP] '{}' completed in {}ms: workers={} incomplete={} cost=${}",
                     stepName, completed.getDurationMs(), completed.getWorkerCount(),
                     completed.getIncompleteWorkers(), String.format("%.6f", completed.getCostUsd()));
            return completed;
        } finally {
            MDC.remove("step");
        }
    }

    /* ------------------------------------------------------------------ */

    private List<WorkerResult> collect(String stepName, List<InvocationFuture<WorkerResult>> futures,
                                       List<ExecutionPlan> plans) {
        try {
            List<WorkerResult> results = executor.getResult(futures);
            results.forEach(r -> metrics.recordWorker(false, r.complete()));
            return results;
        } catch (PartialFailureException e) {
            List<String> failed = e.getFailures().keySet().stream()
                    .map(i -> plans.get(i).partitionKey())
                    .toList();
            e.getFailures().forEach((i, cause) -> {
                metrics.recordWorker(true, false);
                log.error("[STEP] '{}' worker for {} raised: {}", stepName, plans.get(i).partitionKey(), cause.toString());
            });
            throw new StepExecutionException(stepName, failed, e);
        }
    }

    WorkerOutcome toOutcome(WorkerResult result, InvocationFuture<WorkerResult> future) {
        if (profilingEnabled && !result.profile().isMetricsAvailable()) {
            metrics.recordProfilerTimeout();
        }
        return new WorkerOutcome(result.invocationId(), result.partitionKey(), result.ingested(),
                result.complete(), result.profile(), result.environment(), result.instanceType(),
                future.stats());
    }
}
