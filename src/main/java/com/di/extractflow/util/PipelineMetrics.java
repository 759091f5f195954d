package com.di.extractflow.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for partitioning, worker invocations and profiling.
 */
@Slf4j
@Component
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;

    // Partitioning
    private final Counter partitionsCreatedCounter;
    private final Counter partitionCacheHitCounter;

    // Workers
    private final Counter workerSuccessCounter;
    private final Counter workerIncompleteCounter;
    private final Counter workerFailureCounter;
    private final DistributionSummary workerCostDistribution;

    // Profiling
    private final Counter profilerHandbackTimeoutCounter;

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.partitionsCreatedCounter = Counter.builder("extractflow.partition.created")
                .description("Partition archives created and uploaded")
                .register(meterRegistry);

        this.partitionCacheHitCounter = Counter.builder("extractflow.partition.cache.hits")
                .description("Partitioning requests answered from an existing location")
                .register(meterRegistry);

        this.workerSuccessCounter = Counter.builder("extractflow.worker.invocations")
                .description("Worker invocations that completed every stage")
                .tag("status", "success")
                .register(meterRegistry);

        this.workerIncompleteCounter = Counter.builder("extractflow.worker.invocations")
                .description("Worker invocations with a tolerated subprocess failure")
                .tag("status", "incomplete")
                .register(meterRegistry);

        this.workerFailureCounter = Counter.builder("extractflow.worker.invocations")
                .description("Worker invocations that raised")
                .tag("status", "error")
                .register(meterRegistry);

        this.workerCostDistribution = DistributionSummary.builder("extractflow.worker.cost")
                .description("Estimated cost per worker invocation")
                .baseUnit("usd")
                .register(meterRegistry);

        this.profilerHandbackTimeoutCounter = Counter.builder("extractflow.profiler.handback.timeouts")
                .description("Monitors that did not hand back metrics within the timeout")
                .register(meterRegistry);
    }

    public void recordPartitionsCreated(int count) {
        partitionsCreatedCounter.increment(count);
    }

    public void recordPartitionCacheHit() {
        partitionCacheHitCounter.increment();
    }

    public void recordWorker(boolean raised, boolean complete) {
        if (raised) {
            workerFailureCounter.increment();
        } else if (complete) {
            workerSuccessCounter.increment();
        } else {
            workerIncompleteCounter.increment();
        }
    }

    public void recordWorkerCost(double costUsd) {
        workerCostDistribution.record(costUsd);
    }

    public void recordProfilerTimeout() {
        profilerHandbackTimeoutCounter.increment();
        log.debug("Recorded profiler hand-back timeout");
    }

    /**
     * Records the wall-clock duration of a step, tagged by step name.
     */
    public void recordStepDuration(String stepName, long durationMs) {
        Timer.builder("extractflow.step.duration")
                .description("Wall-clock duration of a pipeline step")
                .tag("step", stepName)
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
    }
}
