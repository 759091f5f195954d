package com.di.extractflow.profiling;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Root processes a monitor samples; descendants are discovered on every tick.
 *
 * <p>Workers share the service JVM, so a scope starts empty and each worker registers the
 * subprocesses it starts.
 */
public final class ProcessScope {

    private final List<Long> roots = new CopyOnWriteArrayList<>();

    private ProcessScope() {}

    public static ProcessScope tracking() {
        return new ProcessScope();
    }

    public void track(long pid) {
        roots.add(pid);
    }

    public List<Long> rootPids() {
        return List.copyOf(roots);
    }
}
