package com.di.extractflow.profiling;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Where a worker is running and what it was given: cgroup v2 limits plus a coarse
 * environment / instance-type guess recorded on every worker result.
 */
@Slf4j
public final class RuntimeEnvironment {

    private static final Path CGROUP_ROOT = Paths.get("/sys/fs/cgroup");

    private RuntimeEnvironment() {}

    /** Returns "aws-lambda", "gcp", "aws", "kubernetes", "mac", "windows", or "linux". */
    public static String detect() {
        return detect(System.getenv(), System.getProperty("os.name", ""));
    }

    static String detect(Map<String, String> env, String osName) {
        if (env.containsKey("AWS_LAMBDA_FUNCTION_NAME") || env.containsKey("LAMBDA_TASK_ROOT"))
            return "aws-lambda";
        if (env.containsKey("K_SERVICE") || env.containsKey("GOOGLE_CLOUD_PROJECT") || env.containsKey("GCP_PROJECT"))
            return "gcp";
        if (env.containsKey("AWS_EXECUTION_ENV") || env.containsKey("ECS_CONTAINER_METADATA_URI"))
            return "aws";
        if (env.containsKey("KUBERNETES_SERVICE_HOST"))
            return "kubernetes";

        String os = osName.toLowerCase(Locale.ROOT);
        if (os.contains("mac")) return "mac";
        if (os.contains("win")) return "windows";
        return "linux";
    }

    /** Instance type from {@code INSTANCE_TYPE} (or the Lambda memory size), else "unknown". */
    public static String instanceType() {
        Map<String, String> env = System.getenv();
        String explicit = env.get("INSTANCE_TYPE");
        if (explicit != null && !explicit.isBlank()) return explicit;
        String lambdaMemory = env.get("AWS_LAMBDA_FUNCTION_MEMORY_SIZE");
        if (lambdaMemory != null && !lambdaMemory.isBlank()) return "lambda-" + lambdaMemory + "mb";
        return "unknown";
    }

    /** cgroup v2 memory limit in GB; empty when unlimited or not readable. */
    public static OptionalDouble memoryLimitGb() {
        return memoryLimitGb(CGROUP_ROOT);
    }

    static OptionalDouble memoryLimitGb(Path cgroupRoot) {
        String raw = read(cgroupRoot.resolve("memory.max"));
        if (raw == null || raw.equals("max")) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Long.parseLong(raw) / (1024.0 * 1024.0 * 1024.0));
        } catch (NumberFormatException e) {
            log.debug("[RUNTIME] unparseable memory.max '{}'", raw);
            return OptionalDouble.empty();
        }
    }

    /** cgroup v2 CPU limit as quota/period; empty when unlimited or not readable. */
    public static OptionalDouble cpuLimit() {
        return cpuLimit(CGROUP_ROOT);
    }

    static OptionalDouble cpuLimit(Path cgroupRoot) {
        String raw = read(cgroupRoot.resolve("cpu.max"));
        if (raw == null) {
            return OptionalDouble.empty();
        }
        String[] parts = raw.split("\\s+");
        if (parts.length != 2 || parts[0].equals("max") || parts[0].equals("-1")) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(parts[0]) / Double.parseDouble(parts[1]));
        } catch (NumberFormatException e) {
            log.debug("[RUNTIME] unparseable cpu.max '{}'", raw);
            return OptionalDouble.empty();
        }
    }

    private static String read(Path file) {
        if (!Files.isReadable(file)) {
            return null;
        }
        try {
            return Files.readString(file, StandardCharsets.US_ASCII).trim();
        } catch (IOException e) {
            log.debug("[RUNTIME] cannot read {}: {}", file, e.getMessage());
            return null;
        }
    }
}
