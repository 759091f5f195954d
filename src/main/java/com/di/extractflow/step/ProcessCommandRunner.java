package com.di.extractflow.step;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongConsumer;

/**
 * {@link CommandRunner} over {@link ProcessBuilder}. Stdout and stderr are drained concurrently
 * so a chatty binary cannot block on a full pipe.
 */
@Slf4j
public class ProcessCommandRunner implements CommandRunner {

    @Override
    public CommandResult run(List<String> command, Map<String, String> env, Path workingDir, LongConsumer onStart)
            throws IOException {
        ProcessBuilder pb = new ProcessBuilder(command);
        if (workingDir != null) {
            Files.createDirectories(workingDir);
            pb.directory(workingDir.toFile());
        }
        if (env != null) {
            pb.environment().putAll(env);
        }

        long startMs = System.currentTimeMillis();
        Process process = pb.start();
        if (onStart != null) {
            onStart.accept(process.pid());
        }
        log.debug("[COMMAND] started pid={} {}", process.pid(), command);

        AtomicReference<String> stderr = new AtomicReference<>("");
        Thread stderrReader = new Thread(() -> stderr.set(drain(process.getErrorStream())), "stderr-" + process.pid());
        stderrReader.setDaemon(true);
        stderrReader.start();

        try {
            String stdout = drain(process.getInputStream());
            int exitCode = process.waitFor();
            stderrReader.join();
            return new CommandResult(exitCode, stdout, stderr.get(), System.currentTimeMillis() - startMs);
        } catch (UncheckedIOException e) {
            process.destroyForcibly();
            throw e.getCause();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while waiting for " + command.get(0));
        }
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
