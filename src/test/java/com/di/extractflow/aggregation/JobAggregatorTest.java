package com.di.extractflow.aggregation;

import com.di.extractflow.exception.IngestedSizeMismatchException;
import com.di.extractflow.execution.InvocationStats;
import com.di.extractflow.profiling.WorkerProfile;
import com.di.extractflow.util.PipelineMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JobAggregator Tests")
class JobAggregatorTest {

    private static final double RATE = 0.0000000167;
    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private SimpleMeterRegistry registry;
    private JobAggregator aggregator;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        aggregator = new JobAggregator(new CostModel(RATE), new PipelineMetrics(registry));
    }

    private static Map<String, Long> listed(int partitions) {
        Map<String, Long> sizes = new LinkedHashMap<>();
        for (int i = 0; i < partitions; i++) {
            sizes.put("partitions/id/partition_" + i + ".ms.zip", 1000L * (i + 1));
        }
        return sizes;
    }

    private static WorkerOutcome outcome(String key, long bytes, long durationMs, boolean complete) {
        InvocationStats stats = new InvocationStats(T0, T0.plusMillis(10), T0.plusMillis(10 + durationMs));
        return new WorkerOutcome("inv-" + key.hashCode(), key, Map.of(key, bytes), complete,
                WorkerProfile.builder().build(), "linux", "unknown", stats);
    }

    private static List<WorkerOutcome> outcomes(Map<String, Long> sizes) {
        List<WorkerOutcome> outcomes = new ArrayList<>();
        sizes.forEach((key, size) -> outcomes.add(outcome(key, size, 2000L, true)));
        return outcomes;
    }

    private static StepInvocation invocation(Map<String, Long> sizes) {
        return new StepInvocation("rebinning", 4096, 2, sizes, T0, T0.plusSeconds(5));
    }

    // ============================================================================
    // Summary
    // ============================================================================

    @Test
    @DisplayName("Builds the step summary from worker outcomes")
    void testFinalize() {
        Map<String, Long> sizes = listed(4);

        CompletedStep step = aggregator.finalizeStep(outcomes(sizes), invocation(sizes));

        assertNotNull(step.getJobId());
        assertEquals("rebinning", step.getStepName());
        assertEquals(4, step.getWorkerCount());
        assertEquals(10_000L, step.getIngestedBytes());
        assertEquals(5000L, step.getDurationMs());
        assertEquals(4096, step.getMemoryMb());
        assertEquals(2, step.getCpusPerWorker());
        assertEquals(10_000.0 / (1024 * 1024) / 4, step.getChunkSizeMb(), 1e-12);
        assertEquals(0, step.getIncompleteWorkers());
        assertEquals("linux", step.getEnvironment());
        assertEquals(4, step.getWorkers().size());
        assertEquals(2000L, step.getWorkers().get(0).getDurationMs());
    }

    @Test
    @DisplayName("Cost is duration × rate × memory in GB, summed over workers")
    void testCost() {
        Map<String, Long> sizes = listed(2);

        CompletedStep step = aggregator.finalizeStep(outcomes(sizes), invocation(sizes));

        double perWorker = 2000 * RATE * 4.0;
        assertEquals(perWorker, step.getWorkers().get(0).getCostUsd(), 1e-15);
        assertEquals(2 * perWorker, step.getCostUsd(), 1e-15);
        assertEquals(2, registry.get("extractflow.worker.cost").summary().count());
    }

    @Test
    @DisplayName("Incomplete workers are counted, not rejected")
    void testIncomplete() {
        Map<String, Long> sizes = listed(2);
        List<WorkerOutcome> outcomes = List.of(
                outcome("partitions/id/partition_0.ms.zip", 1000L, 100L, true),
                outcome("partitions/id/partition_1.ms.zip", 2000L, 100L, false));

        CompletedStep step = aggregator.finalizeStep(outcomes, invocation(sizes));

        assertEquals(1, step.getIncompleteWorkers());
        assertFalse(step.getWorkers().get(1).isComplete());
    }

    @Test
    @DisplayName("A worker that never started costs nothing")
    void testMissingTimestamps() {
        Map<String, Long> sizes = listed(1);
        String key = sizes.keySet().iterator().next();
        WorkerOutcome outcome = new WorkerOutcome("inv", key, Map.of(key, 1000L), true,
                WorkerProfile.builder().build(), "linux", "unknown", new InvocationStats(T0, null, null));

        CompletedStep step = aggregator.finalizeStep(List.of(outcome), invocation(sizes));

        assertEquals(0.0, step.getCostUsd());
        assertEquals(0L, step.getWorkers().get(0).getDurationMs());
    }

    // ============================================================================
    // Ingested size check
    // ============================================================================

    @Test
    @DisplayName("Dropping a worker's result is detected")
    void testDroppedWorker() {
        Map<String, Long> sizes = listed(3);
        List<WorkerOutcome> outcomes = outcomes(sizes).subList(0, 2);

        IngestedSizeMismatchException ex = assertThrows(IngestedSizeMismatchException.class,
                () -> aggregator.finalizeStep(outcomes, invocation(sizes)));

        assertEquals(6000L, ex.getExpectedBytes());
        assertEquals(3000L, ex.getActualBytes());
        assertEquals(List.of("partitions/id/partition_2.ms.zip"), ex.getMissingKeys());
    }

    @Test
    @DisplayName("A key processed twice is detected even when the totals agree")
    void testDuplicateKey() {
        Map<String, Long> sizes = new LinkedHashMap<>();
        sizes.put("a.zip", 500L);
        sizes.put("b.zip", 1000L);
        List<WorkerOutcome> outcomes = List.of(
                outcome("a.zip", 500L, 10L, true),
                outcome("a.zip", 500L, 10L, true));

        IngestedSizeMismatchException ex = assertThrows(IngestedSizeMismatchException.class,
                () -> aggregator.finalizeStep(outcomes, invocation(sizes)));

        assertEquals(List.of("a.zip"), ex.getDuplicateKeys());
        assertEquals(List.of("b.zip"), ex.getMissingKeys());
    }

    @Test
    @DisplayName("A size that differs from the listing is detected")
    void testSizeMismatch() {
        Map<String, Long> sizes = listed(1);
        String key = sizes.keySet().iterator().next();

        IngestedSizeMismatchException ex = assertThrows(IngestedSizeMismatchException.class,
                () -> aggregator.finalizeStep(List.of(outcome(key, 999L, 10L, true)), invocation(sizes)));

        assertEquals(List.of(key), ex.getMismatchedKeys());
    }

    @Test
    @DisplayName("A key that was never listed is detected")
    void testUnlistedKey() {
        Map<String, Long> sizes = Map.of("a.zip", 100L);
        List<WorkerOutcome> outcomes = List.of(outcome("a.zip", 100L, 10L, true), outcome("b.zip", 0L, 10L, true));

        IngestedSizeMismatchException ex = assertThrows(IngestedSizeMismatchException.class,
                () -> aggregator.finalizeStep(outcomes, invocation(sizes)));

        assertEquals(List.of("b.zip"), ex.getMismatchedKeys());
    }

    @Test
    @DisplayName("CostModel rejects negative rates")
    void testCostModel() {
        assertThrows(IllegalArgumentException.class, () -> new CostModel(-1.0));
        assertEquals(0.0, new CostModel(1.0).cost(-5L, 1024));
        assertEquals(2.0, new CostModel(1.0).cost(1L, 2048), 1e-12);
    }
}
