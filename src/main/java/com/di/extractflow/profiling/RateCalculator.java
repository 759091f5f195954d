package com.di.extractflow.profiling;

/**
 * Per-second rate between two cumulative readings.
 */
public final class RateCalculator {

    private RateCalculator() {}

    /**
     * @return {@code (current - previous) / (currentTs - previousTs)}, or 0 when the time delta is not positive
     */
    public static double rate(double previous, double previousTs, double current, double currentTs) {
        double dt = currentTs - previousTs;
        if (dt <= 0) {
            return 0.0;
        }
        return (current - previous) / dt;
    }
}
