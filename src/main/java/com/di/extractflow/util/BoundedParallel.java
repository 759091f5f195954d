package com.di.extractflow.util;

import com.di.extractflow.exception.ParallelPhaseException;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Node-local bounded fan-out used for partition creation and file transfers.
 *
 * <h3>Concurrency</h3>
 * A {@code FixedThreadPool(min(items, maxConcurrent))} is the sole concurrency limit.
 *
 * <h3>Error handling</h3>
 * Each future uses {@code exceptionally} to record its failure while the remaining tasks keep
 * running. All collected errors are surfaced in a single {@link ParallelPhaseException} after
 * {@code allOf} returns, so no task is abandoned mid-flight.
 */
@Slf4j
public final class BoundedParallel {

    private BoundedParallel() {
    }

    public static <T> void runAll(String phase,
                                  List<T> items,
                                  int maxConcurrent,
                                  Duration timeout,
                                  Function<T, String> labeler,
                                  Consumer<T> action) {
        if (items.isEmpty()) {
            return;
        }
        int poolSize = Math.max(1, Math.min(items.size(), maxConcurrent));
        AtomicInteger seq = new AtomicInteger();
        ThreadFactory tf = r -> {
            var t = new Thread(r, phase + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        ExecutorService executor = Executors.newFixedThreadPool(poolSize, tf);

        ConcurrentLinkedQueue<String> errors = new ConcurrentLinkedQueue<>();
        List<CompletableFuture<Void>> futures = new ArrayList<>(items.size());

        for (T item : items) {
            CompletableFuture<Void> f = CompletableFuture
                    .runAsync(MdcPropagation.wrapRunnable(() -> action.accept(item)), executor)
                    // converts failure into normal completion so allOf() waits for every task
                    .exceptionally(ex -> {
                        Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                        String msg = labeler.apply(item) + ": " + cause.getMessage();
                        errors.add(msg);
                        log.error("[{}] {} FAILED", phase, labeler.apply(item), cause);
                        return null;
                    });
            futures.add(f);
        }

        try {
            CompletableFuture.allOf(futures.toArray(CompletableFuture[]::new))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new ParallelPhaseException(phase, "timed out after " + timeout, e);
        } catch (ExecutionException e) {
            throw new ParallelPhaseException(phase, "execution error", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ParallelPhaseException(phase, "interrupted", e);
        } finally {
            executor.shutdown();
        }

        if (!errors.isEmpty()) {
            throw new ParallelPhaseException(phase, items.size(), new ArrayList<>(errors));
        }
    }
}
