package com.di.extractflow.step;

import com.di.extractflow.config.ExtractFlowProperties;
import com.di.extractflow.exception.SubprocessFailedException;
import com.di.extractflow.execution.InvocationContext;
import com.di.extractflow.execution.WorkerFunction;
import com.di.extractflow.profiling.FunctionTimers;
import com.di.extractflow.profiling.MetricCollector;
import com.di.extractflow.profiling.ProcessMetricsSource;
import com.di.extractflow.profiling.ProcessScope;
import com.di.extractflow.profiling.ProfilingSession;
import com.di.extractflow.profiling.RuntimeEnvironment;
import com.di.extractflow.profiling.WorkerProfile;
import com.di.extractflow.reference.ReferencePath;
import com.di.extractflow.reference.ReferenceResolver;
import com.di.extractflow.storage.StorageTransfer;
import com.di.extractflow.util.ArchiveUtils;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one partition through every parameter set of its plan, inside a profiling session.
 *
 * <h3>Per stage</h3>
 * <pre>
 *   inputs   → download (or reuse a local artifact), unzip archives, substitute local path
 *   outputs  → allocate workDir/container/key, substitute path
 *   parset   → write, run {@code binary parset [override=value ...]}, capture stdout/stderr
 *   outputs  → directories archived (STORED) and uploaded as key.zip, files uploaded as-is
 * </pre>
 *
 * A non-zero exit is handled by the configured {@link SubprocessFailurePolicy}.
 */
@Slf4j
public class StepWorker implements WorkerFunction<ExecutionPlan, WorkerResult> {

    private final StorageTransfer transfer;
    private final CommandRunner commandRunner;
    private final ProcessMetricsSource metricsSource;
    private final ExtractFlowProperties properties;

    public StepWorker(StorageTransfer transfer, CommandRunner commandRunner,
                      ProcessMetricsSource metricsSource, ExtractFlowProperties properties) {
        this.transfer = transfer;
        this.commandRunner = commandRunner;
        this.metricsSource = metricsSource;
        this.properties = properties;
    }

    @Override
    public WorkerResult apply(ExecutionPlan plan, InvocationContext invocation) throws IOException {
        MDC.put("partition", plan.partitionBaseName());
        Path workDir = Paths.get(properties.getWorkDir(), "workers", invocation.invocationId());
        ProcessScope scope = ProcessScope.tracking();
        StageContext ctx = new StageContext(workDir, invocation.env(), scope);
        List<StageResult> stages = new ArrayList<>();
        long ingested = 0L;
        boolean complete = true;

        log.info("[WORKER] {} started partition={} stages={} memory={}MB cpus={} cgroupMemoryGb={} cgroupCpus={}",
                 invocation.invocationId(), plan.partitionKey(), plan.parameterSets().size(),
                 invocation.memoryMb(), invocation.cpus(),
                 RuntimeEnvironment.memoryLimitGb(), RuntimeEnvironment.cpuLimit());

        ProfilingSession session = openSession(scope, metricsSource, properties.getProfiler());
        try (session) {
            for (int i = 0; i < plan.parameterSets().size(); i++) {
                ParameterSet ps = plan.parameterSets().get(i);
                if (!complete) {
                    log.info("[WORKER] skipping stage '{}' after an earlier failure", ps.getName());
                    stages.add(StageResult.skipped(ps));
                    continue;
                }
                StageResult stage = runStage(ps, ctx);
                if (i == 0) {
                    ingested = stage.designatedInputBytes();
                }
                stages.add(stage);
                complete = stage.complete();
            }
        } finally {
            MDC.remove("partition");
            try {
                ArchiveUtils.deleteRecursively(workDir);
            } catch (IOException e) {
                log.warn("[WORKER] could not clean up {}: {}", workDir, e.getMessage());
            }
        }

        MetricCollector metrics = session.result().orElseGet(MetricCollector::empty);
        WorkerProfile profile = metrics.toProfile(ctx.getTimers(), session.result().isPresent());
        log.info("[WORKER] {} finished partition={} complete={} ingested={}B metrics={}",
                 invocation.invocationId(), plan.partitionKey(), complete, ingested, metrics.size());

        return new WorkerResult(invocation.invocationId(), plan.partitionKey(),
                Map.of(plan.partitionKey(), ingested), List.copyOf(stages), complete, profile,
                RuntimeEnvironment.detect(), RuntimeEnvironment.instanceType());
    }

    /**
     * Runs one parameter set: localize references, execute the binary, upload outputs.
     *
     * @throws SubprocessFailedException on a non-zero exit under {@link SubprocessFailurePolicy#FAIL_FAST}
     */
    public StageResult runStage(ParameterSet ps, StageContext ctx) throws IOException {
        List<ReferencePath> outputs = new ArrayList<>();
        long[] designatedBytes = {0L};
        Map<String, Object> localValues = localize(ps.getValues(), ps.getInputName(), ctx, outputs, designatedBytes);

        Path parset = ParsetWriter.write(localValues, ctx.getWorkDir().resolve("parsets").resolve(ps.getName() + ".parset"));
        List<String> command = new ArrayList<>();
        command.add(ps.getBinary());
        command.add(parset.toString());
        command.addAll(ps.getOverrides());

        log.info("[WORKER] stage '{}' running {}", ps.getName(), command);
        CommandResult result = FunctionTimers.time("execute", ctx.getTimers(),
                () -> commandRunner.run(command, ctx.getEnv(), ctx.getWorkDir(), ctx.getScope()::track));
        log.info("[WORKER] stage '{}' exit={} duration={}ms stdout:\n{}", ps.getName(), result.exitCode(),
                 result.durationMs(), result.stdout().isEmpty() ? "(no output)" : result.stdout());
        if (!result.stderr().isEmpty()) {
            log.info("[WORKER] stage '{}' stderr:\n{}", ps.getName(), result.stderr());
        }

        String logKey = ps.getLogOutput() == null ? null : uploadLog(ps.getLogOutput(), result, ctx);

        if (!result.succeeded()) {
            if (properties.getStep().getFailurePolicy() == SubprocessFailurePolicy.FAIL_FAST) {
                throw new SubprocessFailedException(ps.getBinary(), result.exitCode(), result.stderr());
            }
            log.warn("[WORKER] stage '{}' failed with exit code {}; marking partition incomplete",
                     ps.getName(), result.exitCode());
        }

        List<String> uploaded = uploadOutputs(outputs, ctx);
        return new StageResult(ps.getName(), ps.getBinary(), result.exitCode(), result.succeeded(), false,
                designatedBytes[0], List.copyOf(uploaded), logKey);
    }

    /* ------------------------------------------------------------------ */
    /* Private: inputs                                                      */
    /* ------------------------------------------------------------------ */

    private Map<String, Object> localize(Map<String, Object> values, String inputName, StageContext ctx,
                                         List<ReferencePath> outputs, long[] designatedBytes) throws IOException {
        Map<String, Object> local = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : values.entrySet()) {
            Object value = e.getValue();
            if (value instanceof ReferencePath ref && ref.isOutput()) {
                Path path = ReferenceResolver.localPath(ref, ctx.getWorkDir());
                Files.createDirectories(path.getParent());
                outputs.add(ref);
                local.put(e.getKey(), path.toString());
            } else if (value instanceof ReferencePath ref) {
                long[] bytes = {0L};
                Path path = fetch(ref, ctx, bytes);
                if (e.getKey().equals(inputName)) {
                    designatedBytes[0] = bytes[0];
                }
                local.put(e.getKey(), path.toString());
            } else if (value instanceof Map<?, ?> group) {
                @SuppressWarnings("unchecked")
                Map<String, Object> nested = (Map<String, Object>) group;
                local.put(e.getKey(), localize(nested, null, ctx, outputs, designatedBytes));
            } else {
                local.put(e.getKey(), value);
            }
        }
        return local;
    }

    private Path fetch(ReferencePath ref, StageContext ctx, long[] downloadedBytes) throws IOException {
        var cached = ctx.artifact(ref.getContainer(), ref.fullKey());
        if (cached.isPresent() && Files.exists(cached.get())) {
            log.debug("[WORKER] reusing local artifact {} for {}", cached.get(), ref);
            return cached.get();
        }

        Path local = ReferenceResolver.localPath(ref, ctx.getWorkDir());
        downloadedBytes[0] = FunctionTimers.time("download", ctx.getTimers(),
                () -> transfer.download(ref.getContainer(), ref.fullKey(), local));
        if (Files.isRegularFile(local) && local.getFileName().toString().endsWith(ArchiveUtils.ZIP_SUFFIX)) {
            return FunctionTimers.time("unzip", ctx.getTimers(), () -> ArchiveUtils.unzip(local));
        }
        return local;
    }

    /* ------------------------------------------------------------------ */
    /* Private: outputs                                                     */
    /* ------------------------------------------------------------------ */

    private List<String> uploadOutputs(List<ReferencePath> outputs, StageContext ctx) throws IOException {
        List<String> uploaded = new ArrayList<>();
        for (ReferencePath out : outputs) {
            Path local = ReferenceResolver.localPath(out, ctx.getWorkDir());
            if (!Files.exists(local)) {
                log.warn("[WORKER] output {} was not produced at {}; skipping upload", out, local);
                continue;
            }
            boolean directory = Files.isDirectory(local);
            String key = ReferenceResolver.uploadKey(out, directory);
            Path payload = directory
                    ? FunctionTimers.time("zip", ctx.getTimers(), () -> ArchiveUtils.zipWithoutCompression(local))
                    : local;
            FunctionTimers.run("upload", ctx.getTimers(), () -> transfer.upload(out.getContainer(), key, payload));
            if (directory) {
                Files.deleteIfExists(payload);
            }
            ctx.rememberArtifact(out.getContainer(), key, local);
            uploaded.add(key);
            log.info("[WORKER] uploaded {} → {}/{}", local.getFileName(), out.getContainer(), key);
        }
        return uploaded;
    }

    private String uploadLog(ReferencePath logOutput, CommandResult result, StageContext ctx) throws IOException {
        Path local = ReferenceResolver.localPath(logOutput, ctx.getWorkDir());
        Files.createDirectories(local.getParent());
        String content = result.stdout() + "\n----- stderr -----\n" + result.stderr();
        Files.writeString(local, content, StandardCharsets.UTF_8);
        String key = ReferenceResolver.uploadKey(logOutput, false);
        FunctionTimers.run("upload", ctx.getTimers(), () -> transfer.upload(logOutput.getContainer(), key, local));
        return key;
    }

    static ProfilingSession openSession(ProcessScope scope, ProcessMetricsSource source,
                                        ExtractFlowProperties.ProfilerSettings profiler) {
        if (!profiler.isEnabled() || source == null) {
            return ProfilingSession.disabled(scope);
        }
        return ProfilingSession.start(scope, source, profiler.getSampleInterval(), profiler.getHandbackTimeout());
    }
}
