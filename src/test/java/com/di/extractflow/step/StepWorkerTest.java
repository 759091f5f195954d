package com.di.extractflow.step;

import com.di.extractflow.config.ExtractFlowProperties;
import com.di.extractflow.exception.SubprocessFailedException;
import com.di.extractflow.execution.InvocationContext;
import com.di.extractflow.partition.DatasetFixtures;
import com.di.extractflow.profiling.FunctionTimer;
import com.di.extractflow.profiling.NetworkCounters;
import com.di.extractflow.profiling.ProcessMetricsSource;
import com.di.extractflow.profiling.ProcessSample;
import com.di.extractflow.reference.ReferencePath;
import com.di.extractflow.storage.LocalObjectStorageClient;
import com.di.extractflow.storage.StorageTransfer;
import com.di.extractflow.util.ArchiveUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StepWorker Tests")
class StepWorkerTest {

    private static final String CONTAINER = "extract";
    private static final String PARTITION_KEY = "partitions/id/partition_0.ms.zip";

    @TempDir
    Path tmp;

    private LocalObjectStorageClient storage;
    private ExtractFlowProperties properties;
    private FakeBinaryRunner runner;
    private long archiveBytes;

    @BeforeEach
    void setUp() throws IOException {
        storage = new LocalObjectStorageClient(tmp.resolve("storage"));
        properties = new ExtractFlowProperties();
        properties.setWorkDir(tmp.resolve("work").toString());
        properties.getProfiler().setEnabled(false);
        runner = new FakeBinaryRunner();

        Path dataset = DatasetFixtures.writeDataset(tmp.resolve("scratch"), "partition_0.ms", 10, 0.0, false);
        Path zip = ArchiveUtils.zipWithoutCompression(dataset);
        archiveBytes = Files.size(zip);
        storage.put(CONTAINER, PARTITION_KEY, zip);
    }

    private StepWorker worker(ProcessMetricsSource source) {
        StorageTransfer transfer = new StorageTransfer(storage, 2, Duration.ofMinutes(1));
        return new StepWorker(transfer, runner, source, properties);
    }

    private static ParameterSet.ParameterSetBuilder rebin() {
        return ParameterSet.builder()
                .name("rebin")
                .value("msin", ReferencePath.input(CONTAINER, "partitions/id"))
                .value("msout", ReferencePath.output(CONTAINER, "out/ms", "ms"))
                .value("steps", List.of("avg"));
    }

    private static ExecutionPlan planOf(ParameterSet... sets) {
        List<ParameterSet> resolved = Arrays.stream(sets).map(ps -> ps.resolveFor(PARTITION_KEY)).toList();
        return new ExecutionPlan(0, PARTITION_KEY, "partition_0", resolved);
    }

    private static InvocationContext invocation() {
        return new InvocationContext("inv1", 0, Map.of(), 4000, 2);
    }

    private static long countTimers(List<FunctionTimer> timers, String label) {
        return timers.stream().filter(t -> t.label().equals(label)).count();
    }

    // ============================================================================
    // Happy path
    // ============================================================================

    @Test
    @DisplayName("Should download, run, archive and upload the output")
    void testSingleStage() throws Exception {
        WorkerResult result = worker(null).apply(planOf(rebin().build()), invocation());

        assertTrue(result.complete());
        assertEquals("inv1", result.invocationId());
        assertEquals(Map.of(PARTITION_KEY, archiveBytes), result.ingested());
        assertEquals(List.of("out/ms/partition_0.ms.zip"), result.stages().get(0).uploadedKeys());
        assertTrue(storage.head(CONTAINER, "out/ms/partition_0.ms.zip").isPresent());
        assertEquals(1, runner.invocations.get());
        assertEquals("[avg]", runner.parsets.get(0).get("steps"));
    }

    @Test
    @DisplayName("Every phase is timed")
    void testFunctionTimers() throws Exception {
        WorkerResult result = worker(null).apply(planOf(rebin().build()), invocation());

        List<FunctionTimer> timers = result.profile().getFunctionTimers();
        for (String label : List.of("download", "unzip", "execute", "zip", "upload")) {
            assertEquals(1, countTimers(timers, label), label);
        }
        assertFalse(result.profile().isMetricsAvailable());
    }

    @Test
    @DisplayName("A later stage reuses the artifact an earlier stage uploaded")
    void testArtifactReuse() throws Exception {
        ParameterSet second = ParameterSet.builder()
                .name("applycal")
                .value("msin", ReferencePath.input(CONTAINER, "out/ms"))
                .value("msout", ReferencePath.output(CONTAINER, "out/final", "ms"))
                .build();

        WorkerResult result = worker(null).apply(planOf(rebin().build(), second), invocation());

        assertTrue(result.complete());
        assertEquals(1, countTimers(result.profile().getFunctionTimers(), "download"));
        assertEquals(0L, result.stages().get(1).designatedInputBytes());
        assertTrue(storage.head(CONTAINER, "out/final/partition_0.ms.zip").isPresent());
        assertEquals(archiveBytes, result.ingested().get(PARTITION_KEY));
    }

    @Test
    @DisplayName("Overrides are appended after the parset path")
    void testOverrides() throws Exception {
        ParameterSet ps = rebin().override("avg.freqstep=8").build();

        worker(null).apply(planOf(ps), invocation());

        List<String> command = runner.commands.get(0);
        assertEquals("DP3", command.get(0));
        assertTrue(command.get(1).endsWith("rebin.parset"));
        assertEquals("avg.freqstep=8", command.get(2));
    }

    // ============================================================================
    // Outputs
    // ============================================================================

    @Test
    @DisplayName("The captured output is uploaded to the log reference")
    void testLogOutput() throws Exception {
        ParameterSet ps = rebin().logOutput(ReferencePath.output(CONTAINER, "logs/rebin", "log")).build();

        WorkerResult result = worker(null).apply(planOf(ps), invocation());

        assertEquals("logs/rebin/partition_0.log", result.stages().get(0).logKey());
        Path fetched = tmp.resolve("fetched.log");
        storage.get(CONTAINER, "logs/rebin/partition_0.log", fetched);
        assertTrue(Files.readString(fetched).startsWith("ok"));
    }

    @Test
    @DisplayName("An overwrite key redirects the upload")
    void testOverwriteKey() throws Exception {
        ParameterSet ps = rebin()
                .value("msout", ReferencePath.output(CONTAINER, "out/ms", "ms").withOverwriteKey("final"))
                .build();

        WorkerResult result = worker(null).apply(planOf(ps), invocation());

        assertEquals(List.of("final/partition_0.ms.zip"), result.stages().get(0).uploadedKeys());
        assertTrue(storage.head(CONTAINER, "final/partition_0.ms.zip").isPresent());
    }

    @Test
    @DisplayName("An output the binary did not produce is skipped")
    void testMissingOutput() throws Exception {
        ParameterSet ps = rebin().value("extra", ReferencePath.output(CONTAINER, "out/never", "h5")).build();

        WorkerResult result = worker(null).apply(planOf(ps), invocation());

        assertTrue(result.complete());
        assertEquals(List.of("out/ms/partition_0.ms.zip"), result.stages().get(0).uploadedKeys());
        assertTrue(storage.head(CONTAINER, "out/never/partition_0.h5").isEmpty());
    }

    @Test
    @DisplayName("The scratch directory is removed afterwards")
    void testCleanup() throws Exception {
        worker(null).apply(planOf(rebin().build()), invocation());

        assertFalse(Files.exists(tmp.resolve("work").resolve("workers").resolve("inv1")));
    }

    // ============================================================================
    // Failure policy
    // ============================================================================

    @Test
    @DisplayName("TOLERATE: a failed stage marks the partition incomplete and skips the rest")
    void testTolerate() throws Exception {
        ParameterSet failing = rebin().value("fail", true).build();
        ParameterSet second = ParameterSet.builder()
                .name("applycal")
                .value("msin", ReferencePath.input(CONTAINER, "out/ms"))
                .build();

        WorkerResult result = worker(null).apply(planOf(failing, second), invocation());

        assertFalse(result.complete());
        assertFalse(result.stages().get(0).complete());
        assertEquals(1, result.stages().get(0).exitCode());
        assertTrue(result.stages().get(1).skipped());
        assertEquals(1, runner.invocations.get());
    }

    @Test
    @DisplayName("FAIL_FAST: a failed stage raises with the exit code and stderr")
    void testFailFast() {
        properties.getStep().setFailurePolicy(SubprocessFailurePolicy.FAIL_FAST);
        ParameterSet failing = rebin().value("fail", true).build();

        SubprocessFailedException ex = assertThrows(SubprocessFailedException.class,
                () -> worker(null).apply(planOf(failing), invocation()));
        assertEquals(1, ex.getExitCode());
        assertEquals("boom", ex.getStderr());
        assertEquals("DP3", ex.getBinary());
        assertFalse(Files.exists(tmp.resolve("work").resolve("workers").resolve("inv1")));
    }

    // ============================================================================
    // Profiling
    // ============================================================================

    @Test
    @DisplayName("With profiling on, the tracked subprocess is sampled")
    void testProfiling() throws Exception {
        properties.getProfiler().setEnabled(true);
        properties.getProfiler().setSampleInterval(Duration.ofMillis(10));
        properties.getProfiler().setHandbackTimeout(Duration.ofSeconds(5));
        ProcessMetricsSource source = new ProcessMetricsSource() {
            @Override
            public List<Long> processTree(List<Long> rootPids) {
                return rootPids;
            }

            @Override
            public Optional<ProcessSample> sample(long pid) {
                return Optional.of(new ProcessSample(pid, 1_000_000L, 64L * 1024 * 1024, 0L, 0L));
            }

            @Override
            public NetworkCounters network() {
                return NetworkCounters.ZERO;
            }
        };

        WorkerResult result = worker(source).apply(planOf(rebin().build()), invocation());

        assertTrue(result.profile().isMetricsAvailable());
        assertFalse(result.profile().getMemoryMetrics().isEmpty());
        assertFalse(result.profile().getNetworkMetrics().isEmpty());
        assertEquals(FakeBinaryRunner.FAKE_PID, result.profile().getMemoryMetrics().get(0).pid());
        assertEquals(64.0, result.profile().peakMemoryMb(), 1e-9);
    }

    @Test
    @DisplayName("FAIL_FAST with profiling on: the monitor stops before the failure propagates")
    void testFailFastStopsProfiler() throws Exception {
        properties.getStep().setFailurePolicy(SubprocessFailurePolicy.FAIL_FAST);
        properties.getProfiler().setEnabled(true);
        properties.getProfiler().setSampleInterval(Duration.ofMillis(5));
        properties.getProfiler().setHandbackTimeout(Duration.ofSeconds(5));
        AtomicInteger ticks = new AtomicInteger();
        Set<Long> sampled = ConcurrentHashMap.newKeySet();
        ProcessMetricsSource source = new ProcessMetricsSource() {
            @Override
            public List<Long> processTree(List<Long> rootPids) {
                ticks.incrementAndGet();
                return rootPids;
            }

            @Override
            public Optional<ProcessSample> sample(long pid) {
                sampled.add(pid);
                return Optional.of(new ProcessSample(pid, 0L, 0L, 0L, 0L));
            }

            @Override
            public NetworkCounters network() {
                return NetworkCounters.ZERO;
            }
        };
        ParameterSet failing = rebin().value("fail", true).build();

        assertThrows(SubprocessFailedException.class, () -> worker(source).apply(planOf(failing), invocation()));

        assertTrue(ticks.get() >= 2);
        assertTrue(sampled.contains(FakeBinaryRunner.FAKE_PID));
        int afterFailure = ticks.get();
        Thread.sleep(30);
        assertEquals(afterFailure, ticks.get());
    }
}
