package com.di.extractflow.aggregation;

/**
 * Pay-per-use worker pricing: billed milliseconds scaled by configured memory.
 */
public final class CostModel {

    private final double perMsPerGb;

    public CostModel(double perMsPerGb) {
        if (perMsPerGb < 0) {
            throw new IllegalArgumentException("perMsPerGb must be >= 0, got " + perMsPerGb);
        }
        this.perMsPerGb = perMsPerGb;
    }

    /** {@code durationMs × perMsPerGb × memoryMb / 1024}; negative durations cost nothing. */
    public double cost(long durationMs, int memoryMb) {
        if (durationMs <= 0) {
            return 0.0;
        }
        return durationMs * perMsPerGb * (memoryMb / 1024.0);
    }

    public double getPerMsPerGb() {
        return perMsPerGb;
    }
}
