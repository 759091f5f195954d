package com.di.extractflow.step;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.LongConsumer;

/**
 * Runs an external program to completion and captures its output in full.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * @param onStart receives the pid as soon as the process exists, so it can be profiled
     * @throws java.io.InterruptedIOException if interrupted while waiting; the process is destroyed
     */
    CommandResult run(List<String> command, Map<String, String> env, Path workingDir, LongConsumer onStart)
            throws IOException;
}
