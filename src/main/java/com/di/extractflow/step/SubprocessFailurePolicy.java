package com.di.extractflow.step;

/**
 * What a worker does when a domain binary exits non-zero.
 */
public enum SubprocessFailurePolicy {
    /** Log the captured output, mark the stage and worker incomplete, skip the partition's later stages. */
    TOLERATE,
    /** Raise {@link com.di.extractflow.exception.SubprocessFailedException}; the invocation fails. */
    FAIL_FAST
}
