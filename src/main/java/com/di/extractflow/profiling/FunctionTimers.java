package com.di.extractflow.profiling;

import java.time.Instant;
import java.util.List;

/**
 * Times a block and appends a {@link FunctionTimer} to a sink, whether the block returns or throws.
 */
public final class FunctionTimers {

    private FunctionTimers() {}

    @FunctionalInterface
    public interface TimedCall<T, E extends Exception> {
        T call() throws E;
    }

    @FunctionalInterface
    public interface TimedRun<E extends Exception> {
        void run() throws E;
    }

    public static <T, E extends Exception> T time(String label, List<FunctionTimer> sink, TimedCall<T, E> body) throws E {
        Instant start = Instant.now();
        try {
            return body.call();
        } finally {
            sink.add(FunctionTimer.of(label, start, Instant.now()));
        }
    }

    public static <E extends Exception> void run(String label, List<FunctionTimer> sink, TimedRun<E> body) throws E {
        time(label, sink, () -> {
            body.run();
            return null;
        });
    }
}
