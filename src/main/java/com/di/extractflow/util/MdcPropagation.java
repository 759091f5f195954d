package com.di.extractflow.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Carries SLF4J MDC ({@code runId}, {@code step}, {@code partition}) into pool threads and worker
 * invocations so that their logs correlate with the run that scheduled them.
 * <p>
 * Usage:
 * <ul>
 *   <li>Wrap before submitting: {@code CompletableFuture.runAsync(MdcPropagation.wrapRunnable(() -> work()), pool);}</li>
 *   <li>Restore a captured context: {@code MdcPropagation.callWithMdcContext(saved, () -> process(item));}</li>
 * </ul>
 */
public final class MdcPropagation {

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Runnable that sets it for the duration of the task.
     */
    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                task.run();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Runs the callable with {@code contextMap} set in MDC; only those keys are removed afterwards.
     *
     * @throws Exception if the callable throws
     */
    public static <T> T callWithMdcContext(Map<String, String> contextMap, Callable<T> task) throws Exception {
        setMdc(contextMap);
        try {
            return task.call();
        } finally {
            clearMdc(contextMap);
        }
    }

    /** Copy of the current thread's MDC; never null. */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach(MDC::put);
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }
}
