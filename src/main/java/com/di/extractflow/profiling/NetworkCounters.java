package com.di.extractflow.profiling;

public record NetworkCounters(long receivedBytes, long sentBytes) {

    public static final NetworkCounters ZERO = new NetworkCounters(0L, 0L);
}
