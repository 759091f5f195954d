package com.di.extractflow.aggregation;

import com.di.extractflow.exception.IngestedSizeMismatchException;
import com.di.extractflow.execution.InvocationStats;
import com.di.extractflow.util.PipelineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Folds per-worker outcomes into a {@link CompletedStep}.
 *
 * <p>Worker durations come from the executor's timestamps, never from the worker's own clock.
 * The step is rejected when the bytes the workers ingested do not add up to the bytes listed
 * before dispatch: a worker that skipped or double-processed a key must not go unnoticed.
 */
@Slf4j
@RequiredArgsConstructor
public class JobAggregator {

    private static final double BYTES_PER_MB = 1024.0 * 1024.0;

    private final CostModel costModel;
    private final PipelineMetrics metrics;

    /**
     * @throws IngestedSizeMismatchException when Σ ingested differs from the listed input size,
     *                                       or any key is missing, duplicated or size-mismatched
     */
    public CompletedStep finalizeStep(List<WorkerOutcome> outcomes, StepInvocation invocation) {
        verifyIngested(outcomes, invocation);

        CompletedStep.CompletedStepBuilder step = CompletedStep.builder()
                .jobId(UUID.randomUUID().toString())
                .stepName(invocation.stepName())
                .memoryMb(invocation.memoryMb())
                .cpusPerWorker(invocation.cpusPerWorker())
                .workerCount(outcomes.size())
                .startTime(invocation.startTime())
                .endTime(invocation.endTime())
                .durationMs(Duration.between(invocation.startTime(), invocation.endTime()).toMillis());

        double totalCost = 0.0;
        long totalIngested = 0L;
        int incomplete = 0;
        String environment = null;
        String instanceType = null;

        for (WorkerOutcome outcome : outcomes) {
            InvocationStats stats = outcome.stats();
            long durationMs = stats.durationMs();
            double cost = costModel.cost(durationMs, invocation.memoryMb());
            totalCost += cost;
            totalIngested += outcome.ingestedBytes();
            if (!outcome.complete()) {
                incomplete++;
            }
            if (environment == null) {
                environment = outcome.environment();
                instanceType = outcome.instanceType();
            }
            metrics.recordWorkerCost(cost);

            step.worker(WorkerSummary.builder()
                    .invocationId(outcome.invocationId())
                    .partitionKey(outcome.partitionKey())
                    .workerStart(stats.workerStart())
                    .workerEnd(stats.workerEnd())
                    .durationMs(durationMs)
                    .costUsd(cost)
                    .ingestedBytes(outcome.ingestedBytes())
                    .complete(outcome.complete())
                    .environment(outcome.environment())
                    .instanceType(outcome.instanceType())
                    .profile(outcome.profile())
                    .build());
        }

        double chunkSizeMb = outcomes.isEmpty() ? 0.0 : invocation.listedBytes() / BYTES_PER_MB / outcomes.size();
        CompletedStep completed = step
                .costUsd(totalCost)
                .ingestedBytes(totalIngested)
                .incompleteWorkers(incomplete)
                .chunkSizeMb(chunkSizeMb)
                .environment(environment)
                .instanceType(instanceType)
                .build();

        log.info("[AGGREGATE] step '{}' workers={} incomplete={} ingested={}B cost=${} duration={}ms",
                 completed.getStepName(), completed.getWorkerCount(), incomplete, totalIngested,
                 String.format("%.6f", totalCost), completed.getDurationMs());
        return completed;
    }

    private void verifyIngested(List<WorkerOutcome> outcomes, StepInvocation invocation) {
        Map<String, Long> listed = invocation.listedSizes();
        Map<String, Long> reported = new LinkedHashMap<>();
        Map<String, Integer> seen = new HashMap<>();
        long actual = 0L;

        for (WorkerOutcome outcome : outcomes) {
            for (Map.Entry<String, Long> e : outcome.ingested().entrySet()) {
                seen.merge(e.getKey(), 1, Integer::sum);
                reported.merge(e.getKey(), e.getValue(), Long::sum);
                actual += e.getValue();
            }
        }

        List<String> missing = new ArrayList<>();
        List<String> mismatched = new ArrayList<>();
        for (Map.Entry<String, Long> e : listed.entrySet()) {
            Long got = reported.get(e.getKey());
            if (got == null) {
                missing.add(e.getKey());
            } else if (seen.get(e.getKey()) == 1 && got.longValue() != e.getValue()) {
                mismatched.add(e.getKey());
            }
        }
        List<String> duplicate = seen.entrySet().stream()
                .filter(e -> e.getValue() > 1)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();
        reported.keySet().stream()
                .filter(k -> !listed.containsKey(k))
                .forEach(mismatched::add);

        long expected = invocation.listedBytes();
        if (actual != expected || !missing.isEmpty() || !duplicate.isEmpty() || !mismatched.isEmpty()) {
            log.error("[AGGREGATE] step '{}' ingested {}B, listed {}B (missing={} duplicate={} mismatched={})",
                      invocation.stepName(), actual, expected, missing, duplicate, mismatched);
            throw new IngestedSizeMismatchException(invocation.stepName(), expected, actual,
                    missing, duplicate, mismatched);
        }
    }
}
