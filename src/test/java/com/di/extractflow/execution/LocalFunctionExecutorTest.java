package com.di.extractflow.execution;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LocalFunctionExecutor Tests")
class LocalFunctionExecutorTest {

    private LocalFunctionExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new LocalFunctionExecutor(3, 4000, 2, Duration.ofSeconds(30));
    }

    @AfterEach
    void tearDown() {
        executor.close();
        MDC.clear();
    }

    @Test
    @DisplayName("Results come back in input order")
    void testMapPreservesOrder() {
        List<InvocationFuture<Integer>> futures = executor.map((x, ctx) -> {
            Thread.sleep(10L * (5 - x));
            return x * x;
        }, List.of(1, 2, 3, 4), Map.of());

        assertEquals(List.of(1, 4, 9, 16), executor.getResult(futures));
        assertTrue(futures.stream().allMatch(InvocationFuture::isDone));
    }

    @Test
    @DisplayName("Each invocation gets its own id, index and the configured resources")
    void testInvocationContext() {
        List<InvocationFuture<InvocationContext>> futures =
                executor.map((x, ctx) -> ctx, List.of("a", "b", "c"), Map.of("HOME", "/tmp"));

        List<InvocationContext> contexts = executor.getResult(futures);

        assertEquals(List.of(0, 1, 2), contexts.stream().map(InvocationContext::index).collect(Collectors.toList()));
        assertEquals(3, contexts.stream().map(InvocationContext::invocationId).distinct().count());
        assertTrue(contexts.stream().allMatch(c -> c.invocationId().length() == 8));
        assertTrue(contexts.stream().allMatch(c -> c.memoryMb() == 4000 && c.cpus() == 2));
        assertEquals("/tmp", contexts.get(0).env().get("HOME"));
        assertEquals(futures.get(1).getInvocationId(), contexts.get(1).invocationId());
    }

    @Test
    @DisplayName("Stats carry the worker's start and end")
    void testStats() {
        InvocationFuture<String> future = executor.callAsync((x, ctx) -> {
            Thread.sleep(20);
            return x;
        }, "x", Map.of());

        executor.getResult(List.of(future));

        InvocationStats stats = future.stats();
        assertNotNull(stats.submitted());
        assertNotNull(stats.workerStart());
        assertNotNull(stats.workerEnd());
        assertFalse(stats.workerEnd().isBefore(stats.workerStart()));
        assertTrue(stats.durationMs() >= 20);
    }

    @Test
    @DisplayName("Should not start more invocations than there are workers")
    void testBoundedConcurrency() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        List<InvocationFuture<Integer>> futures = executor.map((x, ctx) -> {
            int now = running.incrementAndGet();
            peak.accumulateAndGet(now, Math::max);
            Thread.sleep(30);
            running.decrementAndGet();
            return x;
        }, List.of(1, 2, 3, 4, 5, 6, 7, 8), Map.of());

        executor.getResult(futures);
        assertTrue(peak.get() <= 3, "peak " + peak.get());
    }

    @Test
    @DisplayName("Failures are reported after every invocation finished")
    void testPartialFailure() {
        Set<Integer> finished = ConcurrentHashMap.newKeySet();
        List<InvocationFuture<Integer>> futures = executor.map((x, ctx) -> {
            if (x % 2 == 0) {
                throw new IllegalStateException("even " + x);
            }
            Thread.sleep(20);
            finished.add(x);
            return x;
        }, List.of(1, 2, 3, 4, 5), Map.of());

        PartialFailureException ex = assertThrows(PartialFailureException.class, () -> executor.getResult(futures));

        assertEquals(5, ex.getTotal());
        assertEquals(Set.of(1, 3), ex.getFailures().keySet());
        assertEquals("even 2", ex.getFailures().get(1).getMessage());
        assertEquals(Set.of(1, 3, 5), finished);
    }

    @Test
    @DisplayName("The submitter's MDC reaches the worker with the invocation id added")
    void testMdcPropagation() {
        MDC.put("runId", "run42");

        InvocationFuture<String> future = executor.callAsync(
                (x, ctx) -> MDC.get("runId") + "/" + MDC.get("invocation").equals(ctx.invocationId()), "x", Map.of());

        assertEquals(List.of("run42/true"), executor.getResult(List.of(future)));
    }
}
