package com.di.extractflow.profiling;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Samples a process tree on a dedicated monitor thread while a worker runs.
 *
 * <p>The monitor shares nothing with the worker: it receives the stop signal on a one-slot
 * channel and hands its {@link MetricCollector} back on another. {@link #close()} drives the
 * handshake, so a try-with-resources block guarantees the monitor is stopped and reaped on every
 * exit path:
 * <pre>{@code
 * try (ProfilingSession session = ProfilingSession.start(scope, source, interval, timeout)) {
 *     runWorker();
 * }
 * session.result();   // empty when the hand-back timed out
 * }</pre>
 *
 * <p>A hand-back that does not arrive within the timeout is logged and leaves the session
 * without metrics; it never fails the worker.
 */
@Slf4j
public final class ProfilingSession implements AutoCloseable {

    private enum Signal { STOP }

    private static final long REAP_TIMEOUT_MS = 1_000L;

    private final BlockingQueue<Signal> stopChannel = new ArrayBlockingQueue<>(1);
    private final BlockingQueue<MetricCollector> handback = new ArrayBlockingQueue<>(1);
    private final AtomicReference<ProfilerState> state = new AtomicReference<>(ProfilerState.IDLE);
    private final ProcessScope scope;
    private final ProcessMetricsSource source;
    private final Duration interval;
    private final Duration handbackTimeout;
    private final Thread monitor;
    private MetricCollector collected;
    private boolean timedOut;

    private ProfilingSession(ProcessScope scope, ProcessMetricsSource source, Duration interval, Duration handbackTimeout) {
        this.scope = scope;
        this.source = source;
        this.interval = interval;
        this.handbackTimeout = handbackTimeout;
        this.monitor = source == null ? null : new Thread(this::monitorLoop, "profiler-monitor");
    }

    public static ProfilingSession start(ProcessScope scope, ProcessMetricsSource source,
                                         Duration interval, Duration handbackTimeout) {
        ProfilingSession session = new ProfilingSession(scope, source, interval, handbackTimeout);
        session.monitor.setDaemon(true);
        session.state.set(ProfilerState.MONITORING);
        session.monitor.start();
        return session;
    }

    /** A session that never samples; closes straight to {@code REPORTED} without metrics. */
    public static ProfilingSession disabled(ProcessScope scope) {
        return new ProfilingSession(scope, null, Duration.ZERO, Duration.ZERO);
    }

    public ProcessScope scope() {
        return scope;
    }

    public ProfilerState state() {
        return state.get();
    }

    public boolean isTimedOut() {
        return timedOut;
    }

    /** The handed-back metrics, once {@link #close()} returned; empty on timeout or when disabled. */
    public Optional<MetricCollector> result() {
        return Optional.ofNullable(collected);
    }

    @Override
    public void close() {
        if (monitor == null) {
            state.set(ProfilerState.REPORTED);
            return;
        }
        if (!state.compareAndSet(ProfilerState.MONITORING, ProfilerState.STOPPING)) {
            return;
        }
        stopChannel.offer(Signal.STOP);

        MetricCollector received = null;
        try {
            received = handback.poll(handbackTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (received == null) {
            timedOut = true;
            log.warn("[PROFILER] monitor did not hand back metrics within {}; continuing without them", handbackTimeout);
        } else {
            MetricCollector merged = MetricCollector.empty();
            merged.merge(received);
            collected = merged;
            log.debug("[PROFILER] received {} metric(s) from monitor", merged.size());
        }

        if (monitor.isAlive()) {
            monitor.interrupt();
            try {
                monitor.join(REAP_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        state.set(ProfilerState.REPORTED);
    }

    /* ------------------------------------------------------------------ */
    /* Monitor thread                                                       */
    /* ------------------------------------------------------------------ */

    private void monitorLoop() {
        MetricCollector collector = new MetricCollector(source);
        long sampleIndex = 0;
        try {
            while (true) {
                sample(collector, sampleIndex++);
                Signal signal = stopChannel.poll(interval.toMillis(), TimeUnit.MILLISECONDS);
                if (signal == Signal.STOP) {
                    sample(collector, sampleIndex);
                    handback.offer(collector);
                    return;
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (RuntimeException e) {
            log.warn("[PROFILER] sampling failed, handing back {} metric(s) collected so far", collector.size(), e);
            handback.offer(collector);
        }
    }

    /** One tick; every metric of the tick carries {@code sampleIndex}. */
    private void sample(MetricCollector collector, long sampleIndex) {
        List<Long> roots = scope.rootPids();
        double now = System.currentTimeMillis() / 1000.0;
        collector.collectAll(roots, sampleIndex, now);
    }
}
