package com.di.extractflow.profiling;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Linux {@code /proc} reader. Process discovery and CPU time go through {@link ProcessHandle};
 * RSS comes from {@code /proc/<pid>/status}, disk counters from {@code /proc/<pid>/io} and
 * network counters from {@code /proc/net/dev}. Counters that cannot be read are reported as 0.
 */
@Slf4j
public class ProcFsMetricsSource implements ProcessMetricsSource {

    private final Path procRoot;

    public ProcFsMetricsSource() {
        this(Paths.get("/proc"));
    }

    public ProcFsMetricsSource(Path procRoot) {
        this.procRoot = procRoot;
    }

    @Override
    public List<Long> processTree(List<Long> rootPids) {
        Set<Long> pids = new LinkedHashSet<>();
        for (long root : rootPids) {
            ProcessHandle.of(root).filter(ProcessHandle::isAlive).ifPresent(h -> {
                pids.add(h.pid());
                h.descendants().filter(ProcessHandle::isAlive).forEach(d -> pids.add(d.pid()));
            });
        }
        return new ArrayList<>(pids);
    }

    @Override
    public Optional<ProcessSample> sample(long pid) {
        Optional<ProcessHandle> handle = ProcessHandle.of(pid).filter(ProcessHandle::isAlive);
        if (handle.isEmpty()) {
            return Optional.empty();
        }
        long cpuNanos = handle.get().info().totalCpuDuration().map(Duration::toNanos).orElse(0L);
        Path pidDir = procRoot.resolve(Long.toString(pid));
        long rssBytes = readField(pidDir.resolve("status"), "VmRSS:") * 1024L;
        long readBytes = readField(pidDir.resolve("io"), "read_bytes:");
        long writeBytes = readField(pidDir.resolve("io"), "write_bytes:");
        return Optional.of(new ProcessSample(pid, cpuNanos, rssBytes, readBytes, writeBytes));
    }

    @Override
    public NetworkCounters network() {
        Path dev = procRoot.resolve("net").resolve("dev");
        if (!Files.isReadable(dev)) {
            return NetworkCounters.ZERO;
        }
        try {
            return parseNetDev(Files.readAllLines(dev, StandardCharsets.US_ASCII));
        } catch (IOException e) {
            log.debug("[PROFILER] cannot read {}: {}", dev, e.getMessage());
            return NetworkCounters.ZERO;
        }
    }

    /**
     * Sums received/sent bytes over every interface. The first two lines are headers; each
     * following line is {@code iface: rx_bytes rx_packets ... (8 rx fields) tx_bytes ...}.
     */
    static NetworkCounters parseNetDev(List<String> lines) {
        long rx = 0;
        long tx = 0;
        for (int i = 2; i < lines.size(); i++) {
            String line = lines.get(i);
            int colon = line.indexOf(':');
            if (colon < 0) continue;
            String[] fields = line.substring(colon + 1).trim().split("\\s+");
            if (fields.length < 9) continue;
            rx += Long.parseLong(fields[0]);
            tx += Long.parseLong(fields[8]);
        }
        return new NetworkCounters(rx, tx);
    }

    /** First numeric token after {@code label} in a {@code label value [unit]} file; 0 if absent or unreadable. */
    static long readField(Path file, String label) {
        if (!Files.isReadable(file)) {
            return 0L;
        }
        try {
            for (String line : Files.readAllLines(file, StandardCharsets.US_ASCII)) {
                if (line.startsWith(label)) {
                    String[] parts = line.substring(label.length()).trim().split("\\s+");
                    return Long.parseLong(parts[0]);
                }
            }
        } catch (IOException | NumberFormatException e) {
            // the process may exit between the readability check and the read
            log.trace("[PROFILER] cannot read {} from {}: {}", label, file, e.getMessage());
        }
        return 0L;
    }
}
