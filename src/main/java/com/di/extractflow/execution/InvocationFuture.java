package com.di.extractflow.execution;

import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Handle on a submitted invocation: its eventual result plus the service-side timestamps.
 */
public final class InvocationFuture<R> {

    @Getter
    private final String invocationId;
    @Getter
    private final int index;
    private final Instant submitted;
    private volatile Instant workerStart;
    private volatile Instant workerEnd;
    private final CompletableFuture<R> result = new CompletableFuture<>();

    InvocationFuture(String invocationId, int index) {
        this.invocationId = invocationId;
        this.index = index;
        this.submitted = Instant.now();
    }

    public InvocationStats stats() {
        return new InvocationStats(submitted, workerStart, workerEnd);
    }

    public boolean isDone() {
        return result.isDone();
    }

    CompletableFuture<R> completion() {
        return result;
    }

    void markStarted() {
        workerStart = Instant.now();
    }

    void complete(R value) {
        workerEnd = Instant.now();
        result.complete(value);
    }

    void fail(Throwable error) {
        workerEnd = Instant.now();
        result.completeExceptionally(error);
    }
}
