package com.di.extractflow.profiling;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ProfilingSession Tests")
class ProfilingSessionTest {

    private static ProcessMetricsSource fixedSource() {
        return new ProcessMetricsSource() {
            @Override
            public List<Long> processTree(List<Long> rootPids) {
                return rootPids;
            }

            @Override
            public Optional<ProcessSample> sample(long pid) {
                return Optional.of(new ProcessSample(pid, 0L, 1024L * 1024L, 0L, 0L));
            }

            @Override
            public NetworkCounters network() {
                return NetworkCounters.ZERO;
            }
        };
    }

    @Test
    @DisplayName("Close stops the monitor and hands back its metrics")
    void testHandback() throws Exception {
        ProcessScope scope = ProcessScope.tracking();
        scope.track(77L);

        ProfilingSession session = ProfilingSession.start(scope, fixedSource(), Duration.ofMillis(5), Duration.ofSeconds(5));
        assertEquals(ProfilerState.MONITORING, session.state());
        Thread.sleep(30);
        session.close();

        assertEquals(ProfilerState.REPORTED, session.state());
        assertFalse(session.isTimedOut());
        MetricCollector metrics = session.result().orElseThrow();
        assertTrue(metrics.getMemoryMetrics().size() >= 2);
        assertTrue(metrics.getMemoryMetrics().stream().allMatch(m -> m.pid() == 77L));
    }

    @Test
    @DisplayName("Every tick carries the next sample index, shared by all metrics of that tick")
    void testCollectionIdsAreMonotonic() throws Exception {
        ProcessScope scope = ProcessScope.tracking();
        scope.track(77L);
        scope.track(78L);

        ProfilingSession session = ProfilingSession.start(scope, fixedSource(), Duration.ofMillis(5), Duration.ofSeconds(5));
        Thread.sleep(40);
        session.close();

        MetricCollector metrics = session.result().orElseThrow();
        List<NetworkMetric> network = metrics.getNetworkMetrics();
        assertTrue(network.size() >= 2);
        for (int i = 0; i < network.size(); i++) {
            assertEquals(i, network.get(i).collectionId());
        }
        List<MemoryMetric> memory = metrics.getMemoryMetrics();
        assertEquals(2 * network.size(), memory.size());
        for (int i = 0; i < memory.size(); i++) {
            assertEquals(i / 2, memory.get(i).collectionId());
        }
    }

    @Test
    @DisplayName("An exception inside the session block still stops and reaps the monitor")
    void testCloseOnException() throws Exception {
        AtomicInteger ticks = new AtomicInteger();
        ProcessMetricsSource counting = new ProcessMetricsSource() {
            @Override
            public List<Long> processTree(List<Long> rootPids) {
                ticks.incrementAndGet();
                return rootPids;
            }

            @Override
            public Optional<ProcessSample> sample(long pid) {
                return Optional.of(new ProcessSample(pid, 0L, 0L, 0L, 0L));
            }

            @Override
            public NetworkCounters network() {
                return NetworkCounters.ZERO;
            }
        };
        ProcessScope scope = ProcessScope.tracking();
        scope.track(77L);
        ProfilingSession session = ProfilingSession.start(scope, counting, Duration.ofMillis(5), Duration.ofSeconds(5));

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> {
            try (session) {
                Thread.sleep(20);
                throw new IllegalStateException("worker failed");
            }
        });

        assertEquals("worker failed", thrown.getMessage());
        assertEquals(ProfilerState.REPORTED, session.state());
        assertFalse(session.isTimedOut());
        assertTrue(session.result().orElseThrow().size() > 0);

        int afterClose = ticks.get();
        Thread.sleep(30);
        assertEquals(afterClose, ticks.get());
    }

    @Test
    @DisplayName("Closing twice is harmless")
    void testIdempotentClose() {
        ProfilingSession session = ProfilingSession.start(ProcessScope.tracking(), fixedSource(),
                Duration.ofMillis(5), Duration.ofSeconds(5));
        session.close();
        int size = session.result().orElseThrow().size();

        session.close();

        assertEquals(size, session.result().orElseThrow().size());
        assertEquals(ProfilerState.REPORTED, session.state());
    }

    @Test
    @DisplayName("A monitor that cannot hand back in time leaves the session without metrics")
    void testHandbackTimeout() throws Exception {
        CountDownLatch sampling = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ProcessMetricsSource stuck = new ProcessMetricsSource() {
            @Override
            public List<Long> processTree(List<Long> rootPids) {
                sampling.countDown();
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return List.of();
            }

            @Override
            public Optional<ProcessSample> sample(long pid) {
                return Optional.empty();
            }

            @Override
            public NetworkCounters network() {
                return NetworkCounters.ZERO;
            }
        };

        ProfilingSession session = ProfilingSession.start(ProcessScope.tracking(), stuck,
                Duration.ofMillis(5), Duration.ofMillis(50));
        assertTrue(sampling.await(5, TimeUnit.SECONDS));
        try (session) {
            // close() must return despite the blocked monitor
        }

        assertTrue(session.isTimedOut());
        assertTrue(session.result().isEmpty());
        assertEquals(ProfilerState.REPORTED, session.state());
        release.countDown();
    }

    @Test
    @DisplayName("A disabled session reports immediately without metrics")
    void testDisabled() {
        ProcessScope scope = ProcessScope.tracking();
        scope.track(ProcessHandle.current().pid());
        ProfilingSession session = ProfilingSession.disabled(scope);
        session.close();

        assertEquals(ProfilerState.REPORTED, session.state());
        assertTrue(session.result().isEmpty());
        assertFalse(session.isTimedOut());
        assertEquals(List.of(ProcessHandle.current().pid()), session.scope().rootPids());
    }

    @Test
    @DisplayName("A failing source still hands back what was collected")
    void testSamplingFailure() {
        ProcessMetricsSource failing = new ProcessMetricsSource() {
            @Override
            public List<Long> processTree(List<Long> rootPids) {
                throw new IllegalStateException("proc unavailable");
            }

            @Override
            public Optional<ProcessSample> sample(long pid) {
                return Optional.empty();
            }

            @Override
            public NetworkCounters network() {
                return NetworkCounters.ZERO;
            }
        };

        ProfilingSession session = ProfilingSession.start(ProcessScope.tracking(), failing,
                Duration.ofMillis(5), Duration.ofSeconds(5));
        session.close();

        assertFalse(session.isTimedOut());
        assertEquals(0, session.result().orElseThrow().size());
    }
}
