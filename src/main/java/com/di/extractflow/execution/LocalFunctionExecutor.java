package com.di.extractflow.execution;

import com.di.extractflow.exception.ExtractFlowException;
import com.di.extractflow.util.MdcPropagation;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link FunctionExecutor} backed by a bounded pool of worker threads on this node.
 *
 * <p>Invocations do not share state: each gets its own {@link InvocationContext} and the MDC of
 * the submitting thread plus an {@code invocation} key.
 */
@Slf4j
public class LocalFunctionExecutor implements FunctionExecutor, AutoCloseable {

    private final ExecutorService pool;
    @Getter
    private final int runtimeMemoryMb;
    @Getter
    private final int cpusPerWorker;
    private final Duration resultTimeout;

    public LocalFunctionExecutor(int maxWorkers, int runtimeMemoryMb, int cpusPerWorker, Duration resultTimeout) {
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            var t = new Thread(r, "fn-worker-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.pool = Executors.newFixedThreadPool(Math.max(1, maxWorkers), tf);
        this.runtimeMemoryMb = runtimeMemoryMb;
        this.cpusPerWorker = cpusPerWorker;
        this.resultTimeout = resultTimeout;
    }

    @Override
    public <T, R> List<InvocationFuture<R>> map(WorkerFunction<T, R> fn, List<T> items, Map<String, String> extraEnv) {
        List<InvocationFuture<R>> futures = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            futures.add(submit(fn, items.get(i), i, extraEnv));
        }
        log.info("[EXECUTOR] mapped {} invocation(s) (memory={}MB cpus={})", items.size(), runtimeMemoryMb, cpusPerWorker);
        return futures;
    }

    @Override
    public <T, R> InvocationFuture<R> callAsync(WorkerFunction<T, R> fn, T item, Map<String, String> extraEnv) {
        return submit(fn, item, 0, extraEnv);
    }

    @Override
    public <R> List<R> getResult(List<InvocationFuture<R>> futures) {
        CompletableFuture<?>[] all = futures.stream().map(InvocationFuture::completion).toArray(CompletableFuture[]::new);
        try {
            // failures are inspected per future below, so only completion matters here
            CompletableFuture.allOf(all).handle((v, ex) -> null).get(resultTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new ExtractFlowException("Invocations did not complete within " + resultTimeout, e);
        } catch (ExecutionException e) {
            throw new ExtractFlowException("Invocation wait failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractFlowException("Interrupted while waiting for invocations", e);
        }

        List<R> results = new ArrayList<>(futures.size());
        Map<Integer, Throwable> failures = new LinkedHashMap<>();
        for (InvocationFuture<R> f : futures) {
            try {
                results.add(f.completion().join());
            } catch (RuntimeException e) {
                failures.put(f.getIndex(), e.getCause() != null ? e.getCause() : e);
            }
        }
        if (!failures.isEmpty()) {
            throw new PartialFailureException(futures.size(), failures);
        }
        return results;
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }

    /* ------------------------------------------------------------------ */

    private <T, R> InvocationFuture<R> submit(WorkerFunction<T, R> fn, T item, int index, Map<String, String> extraEnv) {
        String invocationId = UUID.randomUUID().toString().substring(0, 8);
        InvocationFuture<R> future = new InvocationFuture<>(invocationId, index);
        Map<String, String> env = extraEnv == null ? Map.of() : Map.copyOf(extraEnv);
        InvocationContext context = new InvocationContext(invocationId, index, env, runtimeMemoryMb, cpusPerWorker);
        Map<String, String> mdc = new HashMap<>(MdcPropagation.copyMdc());
        mdc.put("invocation", invocationId);

        pool.execute(() -> {
            future.markStarted();
            try {
                R value = MdcPropagation.callWithMdcContext(mdc, () -> fn.apply(item, context));
                future.complete(value);
            } catch (Exception e) {
                log.error("[EXECUTOR] invocation {} (#{}) failed: {}", invocationId, index, e.getMessage());
                future.fail(e);
            } catch (Error e) {
                future.fail(e);
                throw e;
            }
        });
        return future;
    }
}
