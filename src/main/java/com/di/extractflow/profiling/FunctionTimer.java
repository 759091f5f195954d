package com.di.extractflow.profiling;

import java.time.Duration;
import java.time.Instant;

/**
 * Wall-clock span of one labelled phase of a worker ({@code download}, {@code unzip},
 * {@code execute}, {@code zip}, {@code upload}).
 */
public record FunctionTimer(String label, Instant start, Instant end, long durationMs) {

    public static FunctionTimer of(String label, Instant start, Instant end) {
        return new FunctionTimer(label, start, end, Duration.between(start, end).toMillis());
    }
}
