package com.di.extractflow.step;

import com.di.extractflow.aggregation.CompletedStep;
import com.di.extractflow.aggregation.JobAggregator;
import com.di.extractflow.aggregation.StepInvocation;
import com.di.extractflow.aggregation.WorkerOutcome;
import com.di.extractflow.config.ExtractFlowProperties;
import com.di.extractflow.exception.StepExecutionException;
import com.di.extractflow.exception.SubprocessFailedException;
import com.di.extractflow.execution.FunctionExecutor;
import com.di.extractflow.execution.InvocationContext;
import com.di.extractflow.execution.InvocationFuture;
import com.di.extractflow.execution.PartialFailureException;
import com.di.extractflow.profiling.FunctionTimer;
import com.di.extractflow.profiling.FunctionTimers;
import com.di.extractflow.profiling.MetricCollector;
import com.di.extractflow.profiling.ProcessMetricsSource;
import com.di.extractflow.profiling.ProcessScope;
import com.di.extractflow.profiling.ProfilingSession;
import com.di.extractflow.profiling.RuntimeEnvironment;
import com.di.extractflow.storage.ObjectHead;
import com.di.extractflow.storage.StorageTransfer;
import com.di.extractflow.util.ArchiveUtils;
import com.di.extractflow.util.PipelineMetrics;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Imaging over all partitions at once: one invocation downloads every partition archive and runs
 * the imager with the partitions appended to its argument list.
 *
 * <pre>
 *   wsclean [arguments, -name rewritten to a local prefix] partition_0.ms partition_1.ms ...
 * </pre>
 *
 * Every {@code *-image.fits} written next to the local prefix is uploaded under the same key
 * directory. The result is aggregated like any other step, with a single worker.
 */
@Slf4j
public class ImagingStepRunner {

    static final String NAME_FLAG = "-name";
    static final String IMAGE_SUFFIX = "-image.fits";

    record ImagingPlan(ImagingRequest request, List<ObjectHead> partitions) {}

    private final FunctionExecutor executor;
    private final ExecutionPlanner planner;
    private final StorageTransfer transfer;
    private final CommandRunner commandRunner;
    private final ProcessMetricsSource metricsSource;
    private final JobAggregator aggregator;
    private final PipelineMetrics metrics;
    private final ExtractFlowProperties properties;

    public ImagingStepRunner(FunctionExecutor executor, ExecutionPlanner planner, StorageTransfer transfer,
                             CommandRunner commandRunner, ProcessMetricsSource metricsSource,
                             JobAggregator aggregator, PipelineMetrics metrics, ExtractFlowProperties properties) {
        this.executor = executor;
        this.planner = planner;
        this.transfer = transfer;
        this.commandRunner = commandRunner;
        this.metricsSource = metricsSource;
        this.aggregator = aggregator;
        this.metrics = metrics;
        this.properties = properties;
    }

    public CompletedStep run(ImagingRequest request, Integer limit) {
        nameIndex(request.getArguments());
        MDC.put("step", request.getStepName());
        Instant start = Instant.now();
        try {
            ListedInputs listed = planner.listInputs(request.getInput(), limit);
            log.info("[STEP] '{}' imaging {} partition(s) in one invocation", request.getStepName(), listed.objects().size());

            InvocationFuture<WorkerResult> future = executor.callAsync(this::image,
                    new ImagingPlan(request, listed.objects()), properties.getExecutor().getExtraEnv());
            WorkerResult result;
            try {
                result = executor.getResult(List.of(future)).get(0);
            } catch (PartialFailureException e) {
                metrics.recordWorker(true, false);
                throw new StepExecutionException(request.getStepName(), listed.keys(), e);
            }
            metrics.recordWorker(false, result.complete());

            WorkerOutcome outcome = new WorkerOutcome(result.invocationId(), result.partitionKey(), result.ingested(),
                    result.complete(), result.profile(), result.environment(), result.instanceType(), future.stats());
            StepInvocation invocation = new StepInvocation(request.getStepName(), executor.getRuntimeMemoryMb(),
                    executor.getCpusPerWorker(), listed.sizes(), start, Instant.now());
            CompletedStep completed = aggregator.finalizeStep(List.of(outcome), invocation);
            metrics.recordStepDuration(request.getStepName(), completed.getDurationMs());
            return completed;
        } finally {
            MDC.remove("step");
        }
    }

    /* ------------------------------------------------------------------ */
    /* Worker side                                                          */
    /* ------------------------------------------------------------------ */

    WorkerResult image(ImagingPlan plan, InvocationContext invocation) throws IOException {
        ImagingRequest request = plan.request();
        Path workDir = Paths.get(properties.getWorkDir(), "workers", invocation.invocationId());
        ProcessScope scope = ProcessScope.tracking();
        List<FunctionTimer> timers = new ArrayList<>();
        Map<String, Long> ingested = new LinkedHashMap<>();
        List<String> uploaded = new ArrayList<>();
        CommandResult result;

        List<String> arguments = new ArrayList<>(request.getArguments());
        int nameAt = nameIndex(arguments) + 1;
        String nameKey = arguments.get(nameAt);
        Path localPrefix = workDir.resolve(request.getOutputContainer()).resolve(nameKey);
        arguments.set(nameAt, localPrefix.toString());

        ProfilingSession session = StepWorker.openSession(scope, metricsSource, properties.getProfiler());
        try (session) {
            Files.createDirectories(localPrefix.getParent());
            List<String> command = new ArrayList<>();
            command.add(request.getBinary());
            command.addAll(arguments);
            for (ObjectHead partition : plan.partitions()) {
                Path local = workDir.resolve(partition.container()).resolve(partition.key());
                long bytes = FunctionTimers.time("download", timers,
                        () -> transfer.download(partition.container(), partition.key(), local));
                ingested.put(partition.key(), bytes);
                Path unpacked = local.getFileName().toString().endsWith(ArchiveUtils.ZIP_SUFFIX)
                        ? FunctionTimers.time("unzip", timers, () -> ArchiveUtils.unzip(local))
                        : local;
                command.add(unpacked.toString());
            }

            log.info("[WORKER] imaging: {}", command);
            result = FunctionTimers.time("execute", timers,
                    () -> commandRunner.run(command, invocation.env(), workDir, scope::track));
            log.info("[WORKER] imaging exit={} stdout:\n{}", result.exitCode(), result.stdout());
            if (!result.stderr().isEmpty()) {
                log.info("[WORKER] imaging stderr:\n{}", result.stderr());
            }
            if (!result.succeeded()) {
                if (properties.getStep().getFailurePolicy() == SubprocessFailurePolicy.FAIL_FAST) {
                    throw new SubprocessFailedException(request.getBinary(), result.exitCode(), result.stderr());
                }
                log.warn("[WORKER] imaging failed with exit code {}", result.exitCode());
            }

            String keyDir = nameKey.contains("/") ? nameKey.substring(0, nameKey.lastIndexOf('/') + 1) : "";
            for (Path image : images(localPrefix.getParent())) {
                String key = keyDir + image.getFileName();
                FunctionTimers.run("upload", timers, () -> transfer.upload(request.getOutputContainer(), key, image));
                uploaded.add(key);
            }
            if (uploaded.isEmpty()) {
                log.warn("[WORKER] imaging produced no {} under {}", IMAGE_SUFFIX, localPrefix.getParent());
            }
        } finally {
            try {
                ArchiveUtils.deleteRecursively(workDir);
            } catch (IOException e) {
                log.warn("[WORKER] could not clean up {}: {}", workDir, e.getMessage());
            }
        }

        MetricCollector collected = session.result().orElseGet(MetricCollector::empty);
        StageResult stage = new StageResult(request.getStepName(), request.getBinary(), result.exitCode(),
                result.succeeded(), false, ingested.values().stream().mapToLong(Long::longValue).sum(),
                List.copyOf(uploaded), null);
        return new WorkerResult(invocation.invocationId(), request.getInput().fullKey(), ingested, List.of(stage),
                result.succeeded(), collected.toProfile(timers, session.result().isPresent()),
                RuntimeEnvironment.detect(), RuntimeEnvironment.instanceType());
    }

    static int nameIndex(List<String> arguments) {
        int at = arguments.indexOf(NAME_FLAG);
        if (at < 0 || at == arguments.size() - 1) {
            throw new IllegalArgumentException("Imaging arguments must contain '" + NAME_FLAG + " <key>'");
        }
        return at;
    }

    private static List<Path> images(Path dir) throws IOException {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(dir)) {
            return files.filter(p -> p.getFileName().toString().endsWith(IMAGE_SUFFIX)).sorted().toList();
        }
    }
}
