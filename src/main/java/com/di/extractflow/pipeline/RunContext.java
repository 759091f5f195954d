package com.di.extractflow.pipeline;

import java.util.UUID;

/**
 * Identity of one pipeline run. Every key the run writes is scoped below {@link #runId()}, so
 * concurrent or repeated runs never overwrite each other's intermediates.
 */
public record RunContext(String runId) {

    public RunContext {
        if (runId == null || runId.isBlank() || runId.contains("/")) {
            throw new IllegalArgumentException("runId must be a non-empty key segment, got '" + runId + "'");
        }
    }

    public static RunContext create() {
        return new RunContext(UUID.randomUUID().toString().replace("-", "").substring(0, 8));
    }

    /** {@code runId/key}. */
    public String scopedKey(String key) {
        return runId + "/" + key;
    }
}
