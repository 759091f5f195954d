package com.di.extractflow.aggregation;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cross-run analysis of one step's completed invocations, grouped by worker configuration.
 *
 * <p>Analysis only: runs without usable data are skipped and a baseline that was never run
 * yields no speed-ups. Nothing here throws on missing data.
 */
@Slf4j
public final class StepAnalysis {

    public record ConfigurationKey(int memoryMb, int cpus, int workers) {}

    public record ConfigurationStats(ConfigurationKey configuration,
                                     int runs,
                                     double meanDurationMs,
                                     double medianDurationMs,
                                     double meanCostUsd,
                                     double medianCostUsd) {}

    public record SpeedUp(ConfigurationKey configuration, double speedUp) {}

    public record Report(String stepName,
                         List<ConfigurationStats> configurations,
                         List<ConfigurationStats> paretoFrontier,
                         List<SpeedUp> speedUps) {}

    private StepAnalysis() {
    }

    public static List<ConfigurationStats> summarize(List<CompletedStep> runs) {
        Map<ConfigurationKey, List<CompletedStep>> grouped = new LinkedHashMap<>();
        for (CompletedStep run : runs) {
            if (!usable(run)) {
                log.debug("[AGGREGATE] skipping job {} without usable timing", run.getJobId());
                continue;
            }
            grouped.computeIfAbsent(keyOf(run), k -> new ArrayList<>()).add(run);
        }

        List<ConfigurationStats> stats = new ArrayList<>();
        grouped.forEach((key, group) -> {
            double[] durations = group.stream().mapToDouble(CompletedStep::getDurationMs).toArray();
            double[] costs = group.stream().mapToDouble(CompletedStep::getCostUsd).toArray();
            stats.add(new ConfigurationStats(key, group.size(),
                    mean(durations), median(durations), mean(costs), median(costs)));
        });
        stats.sort(Comparator.comparingInt((ConfigurationStats s) -> s.configuration().memoryMb())
                .thenComparingInt(s -> s.configuration().cpus())
                .thenComparingInt(s -> s.configuration().workers()));
        return stats;
    }

    /** Configurations not dominated on (median cost, median duration), cheapest first. */
    public static List<ConfigurationStats> paretoFrontier(List<ConfigurationStats> stats) {
        List<ConfigurationStats> frontier = new ArrayList<>();
        for (ConfigurationStats candidate : stats) {
            boolean dominated = stats.stream().anyMatch(other -> other != candidate
                    && other.medianCostUsd() <= candidate.medianCostUsd()
                    && other.medianDurationMs() <= candidate.medianDurationMs()
                    && (other.medianCostUsd() < candidate.medianCostUsd()
                        || other.medianDurationMs() < candidate.medianDurationMs()));
            if (!dominated) {
                frontier.add(candidate);
            }
        }
        frontier.sort(Comparator.comparingDouble(ConfigurationStats::medianCostUsd));
        return frontier;
    }

    /** Baseline median duration divided by each configuration's; empty when the baseline is absent. */
    public static List<SpeedUp> speedUps(List<ConfigurationStats> stats, ConfigurationKey baseline) {
        Optional<ConfigurationStats> base = stats.stream()
                .filter(s -> s.configuration().equals(baseline))
                .findFirst();
        if (base.isEmpty() || base.get().medianDurationMs() <= 0) {
            log.debug("[AGGREGATE] baseline {} has no data; no speed-ups", baseline);
            return List.of();
        }
        double reference = base.get().medianDurationMs();
        return stats.stream()
                .filter(s -> s.medianDurationMs() > 0)
                .map(s -> new SpeedUp(s.configuration(), reference / s.medianDurationMs()))
                .toList();
    }

    public static Report analyze(String stepName, List<CompletedStep> runs, ConfigurationKey baseline) {
        List<ConfigurationStats> stats = summarize(runs);
        List<SpeedUp> speedUps = baseline == null ? List.of() : speedUps(stats, baseline);
        return new Report(stepName, stats, paretoFrontier(stats), speedUps);
    }

    /* ------------------------------------------------------------------ */

    static ConfigurationKey keyOf(CompletedStep run) {
        return new ConfigurationKey(run.getMemoryMb(), run.getCpusPerWorker(), run.getWorkerCount());
    }

    private static boolean usable(CompletedStep run) {
        return run.getDurationMs() > 0 && run.getWorkerCount() > 0;
    }

    static double mean(double[] values) {
        double sum = 0.0;
        for (double v : values) {
            sum += v;
        }
        return values.length == 0 ? 0.0 : sum / values.length;
    }

    static double median(double[] values) {
        if (values.length == 0) {
            return 0.0;
        }
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int mid = sorted.length / 2;
        return sorted.length % 2 == 1 ? sorted[mid] : (sorted[mid - 1] + sorted[mid]) / 2.0;
    }
}
