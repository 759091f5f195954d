package com.di.extractflow.profiling;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-kind metric lists of one monitored process tree, filled by {@link #collectAll}.
 *
 * <p>Not thread-safe: owned by the monitor while sampling, then handed to the parent as a whole.
 */
@Slf4j
public class MetricCollector {

    private static final double MB = 1024.0 * 1024.0;
    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    private final ProcessMetricsSource source;

    @Getter
    private final List<CpuMetric> cpuMetrics = new ArrayList<>();
    @Getter
    private final List<MemoryMetric> memoryMetrics = new ArrayList<>();
    @Getter
    private final List<DiskMetric> diskMetrics = new ArrayList<>();
    @Getter
    private final List<NetworkMetric> networkMetrics = new ArrayList<>();

    private final Map<Long, ProcessSample> previousSamples = new HashMap<>();
    private final Map<Long, Double> previousTimestamps = new HashMap<>();
    private NetworkCounters previousNetwork;
    private double previousNetworkTs;

    public MetricCollector(ProcessMetricsSource source) {
        this.source = source;
    }

    /** A collector with no source: only a merge target. */
    public static MetricCollector empty() {
        return new MetricCollector(null);
    }

    /**
     * Samples every live process of the tree rooted at {@code rootPids}, then the network counters.
     * Processes that exit between discovery and sampling are skipped.
     */
    public void collectAll(List<Long> rootPids, long collectionId, double timestamp) {
        if (source == null) {
            throw new IllegalStateException("Collector has no metrics source");
        }
        for (long pid : source.processTree(rootPids)) {
            Optional<ProcessSample> sample = source.sample(pid);
            sample.ifPresent(s -> record(s, collectionId, timestamp));
        }
        recordNetwork(source.network(), collectionId, timestamp);
    }

    /** Appends every metric of {@code other}, kind by kind. */
    public void merge(MetricCollector other) {
        cpuMetrics.addAll(other.cpuMetrics);
        memoryMetrics.addAll(other.memoryMetrics);
        diskMetrics.addAll(other.diskMetrics);
        networkMetrics.addAll(other.networkMetrics);
    }

    public int size() {
        return cpuMetrics.size() + memoryMetrics.size() + diskMetrics.size() + networkMetrics.size();
    }

    public WorkerProfile toProfile(List<FunctionTimer> timers, boolean metricsAvailable) {
        return WorkerProfile.builder()
                .cpuMetrics(cpuMetrics)
                .memoryMetrics(memoryMetrics)
                .diskMetrics(diskMetrics)
                .networkMetrics(networkMetrics)
                .functionTimers(timers)
                .metricsAvailable(metricsAvailable)
                .build();
    }

    /* ------------------------------------------------------------------ */

    private void record(ProcessSample s, long collectionId, double ts) {
        long pid = s.pid();
        ProcessSample prev = previousSamples.get(pid);
        double prevTs = previousTimestamps.getOrDefault(pid, ts);

        double readMb = s.readBytes() / MB;
        double writeMb = s.writeBytes() / MB;
        double cpu = 0.0;
        double readRate = 0.0;
        double writeRate = 0.0;
        if (prev != null) {
            cpu = 100.0 * RateCalculator.rate(prev.cpuTimeNanos() / NANOS_PER_SECOND, prevTs,
                    s.cpuTimeNanos() / NANOS_PER_SECOND, ts);
            readRate = RateCalculator.rate(prev.readBytes() / MB, prevTs, readMb, ts);
            writeRate = RateCalculator.rate(prev.writeBytes() / MB, prevTs, writeMb, ts);
        }

        cpuMetrics.add(new CpuMetric(ts, collectionId, pid, Math.max(0.0, cpu)));
        memoryMetrics.add(new MemoryMetric(ts, collectionId, pid, s.rssBytes() / MB));
        diskMetrics.add(new DiskMetric(ts, collectionId, pid, readMb, writeMb, readRate, writeRate));

        previousSamples.put(pid, s);
        previousTimestamps.put(pid, ts);
    }

    private void recordNetwork(NetworkCounters counters, long collectionId, double ts) {
        double readMb = counters.receivedBytes() / MB;
        double writeMb = counters.sentBytes() / MB;
        double readRate = 0.0;
        double writeRate = 0.0;
        if (previousNetwork != null) {
            readRate = RateCalculator.rate(previousNetwork.receivedBytes() / MB, previousNetworkTs, readMb, ts);
            writeRate = RateCalculator.rate(previousNetwork.sentBytes() / MB, previousNetworkTs, writeMb, ts);
        }
        networkMetrics.add(new NetworkMetric(ts, collectionId, readMb, writeMb, readRate, writeRate));
        previousNetwork = counters;
        previousNetworkTs = ts;
    }
}
