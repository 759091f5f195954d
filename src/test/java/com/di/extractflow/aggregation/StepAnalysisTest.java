package com.di.extractflow.aggregation;

import com.di.extractflow.aggregation.StepAnalysis.ConfigurationKey;
import com.di.extractflow.aggregation.StepAnalysis.ConfigurationStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StepAnalysis Tests")
class StepAnalysisTest {

    private static CompletedStep run(int memoryMb, long durationMs, double cost) {
        return CompletedStep.builder()
                .jobId("j" + memoryMb + "-" + durationMs)
                .stepName("rebinning")
                .memoryMb(memoryMb)
                .cpusPerWorker(2)
                .workerCount(4)
                .durationMs(durationMs)
                .costUsd(cost)
                .build();
    }

    private static final List<CompletedStep> RUNS = List.of(
            run(2000, 10_000L, 0.010),
            run(2000, 12_000L, 0.012),
            run(2000, 20_000L, 0.011),
            run(4000, 6_000L, 0.015),
            run(4000, 6_000L, 0.015),
            run(8000, 6_500L, 0.030),
            run(8000, 0L, 0.0));

    @Test
    @DisplayName("Runs are grouped by configuration with mean and median")
    void testSummarize() {
        List<ConfigurationStats> stats = StepAnalysis.summarize(RUNS);

        assertEquals(3, stats.size());
        ConfigurationStats small = stats.get(0);
        assertEquals(new ConfigurationKey(2000, 2, 4), small.configuration());
        assertEquals(3, small.runs());
        assertEquals(14_000.0, small.meanDurationMs(), 1e-9);
        assertEquals(12_000.0, small.medianDurationMs(), 1e-9);
        assertEquals(0.011, small.medianCostUsd(), 1e-12);
        assertEquals(1, stats.get(2).runs());
    }

    @Test
    @DisplayName("The frontier holds only non-dominated configurations, cheapest first")
    void testParetoFrontier() {
        List<ConfigurationStats> frontier = StepAnalysis.paretoFrontier(StepAnalysis.summarize(RUNS));

        assertEquals(List.of(2000, 4000), frontier.stream().map(s -> s.configuration().memoryMb()).toList());
    }

    @Test
    @DisplayName("Speed-ups are relative to the baseline's median duration")
    void testSpeedUps() {
        StepAnalysis.Report report = StepAnalysis.analyze("rebinning", RUNS, new ConfigurationKey(2000, 2, 4));

        assertEquals(3, report.speedUps().size());
        assertEquals(1.0, report.speedUps().get(0).speedUp(), 1e-9);
        assertEquals(2.0, report.speedUps().get(1).speedUp(), 1e-9);
    }

    @Test
    @DisplayName("A baseline without data yields no speed-ups")
    void testMissingBaseline() {
        assertTrue(StepAnalysis.analyze("rebinning", RUNS, new ConfigurationKey(512, 1, 1)).speedUps().isEmpty());
        assertTrue(StepAnalysis.analyze("rebinning", RUNS, null).speedUps().isEmpty());
        assertTrue(StepAnalysis.analyze("rebinning", List.of(), null).configurations().isEmpty());
    }

    @Test
    @DisplayName("Median of an even count averages the middle pair")
    void testMedian() {
        assertEquals(2.5, StepAnalysis.median(new double[]{4, 1, 3, 2}), 1e-12);
        assertEquals(0.0, StepAnalysis.median(new double[0]));
        assertEquals(0.0, StepAnalysis.mean(new double[0]));
    }
}
