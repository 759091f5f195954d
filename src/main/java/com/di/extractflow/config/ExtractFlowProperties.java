package com.di.extractflow.config;

import com.di.extractflow.step.SubprocessFailurePolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single binding for all ExtractFlow configuration.
 *
 * <pre>
 * extractflow:
 *   work-dir: /tmp/extractflow
 *   storage:
 *     type: local            # or gcs
 *   executor:
 *     runtime-memory-mb: 4000
 *     cpus-per-worker: 2
 *   profiler:
 *     sample-interval: 1s
 *     handback-timeout: 10s
 *   step:
 *     failure-policy: TOLERATE
 * </pre>
 */
@Data
@Component
@ConfigurationProperties(prefix = "extractflow")
public class ExtractFlowProperties {

    /** Local scratch directory; each worker resolves references below it. */
    private String workDir = "/tmp/extractflow";

    /** Name of the numeric column partitions are windowed on. */
    private String timeColumn = "TIME";

    private StorageSettings storage = new StorageSettings();
    private ExecutorSettings executor = new ExecutorSettings();
    private PartitionSettings partition = new PartitionSettings();
    private TransferSettings transfer = new TransferSettings();
    private ProfilerSettings profiler = new ProfilerSettings();
    private CostSettings cost = new CostSettings();
    private StepSettings step = new StepSettings();
    private JobsSettings jobs = new JobsSettings();

    // ------------------------------------------------------------------ //

    @Data
    public static class StorageSettings {
        /** {@code local} (filesystem rooted at {@link #localRoot}) or {@code gcs}. */
        private String type = "local";
        private String localRoot = "/tmp/extractflow-storage";
    }

    @Data
    public static class ExecutorSettings {
        private int runtimeMemoryMb = 4000;
        private int cpusPerWorker = 2;
        /** Upper bound on concurrently running worker invocations. */
        private int maxWorkers = 16;
        private Duration resultTimeout = Duration.ofHours(4);
        private Map<String, String> extraEnv = new LinkedHashMap<>(Map.of(
                "HOME", "/tmp",
                "OPENBLAS_NUM_THREADS", "1"));
    }

    @Data
    public static class PartitionSettings {
        private int maxConcurrent = 8;
        /** Row file inside every dataset directory (one JSON object per line). */
        private String tableFile = "table.jsonl";
        /** Directory suffix of produced partitions: {@code partition_<i>.<extension>}. */
        private String extension = "ms";
    }

    @Data
    public static class TransferSettings {
        private int maxConcurrent = 8;
    }

    @Data
    public static class ProfilerSettings {
        private boolean enabled = true;
        private Duration sampleInterval = Duration.ofSeconds(1);
        private Duration handbackTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class CostSettings {
        /** USD per millisecond of worker time per GB of configured memory. */
        private double perMsPerGb = 0.0000000167;
    }

    @Data
    public static class StepSettings {
        private SubprocessFailurePolicy failurePolicy = SubprocessFailurePolicy.TOLERATE;
    }

    @Data
    public static class JobsSettings {
        private String collectionFile = "/tmp/extractflow/jobs.json";
    }
}
