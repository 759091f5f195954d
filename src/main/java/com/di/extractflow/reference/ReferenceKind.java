package com.di.extractflow.reference;

public enum ReferenceKind {
    /** Fetched before the binary runs; the local path is substituted. */
    INPUT,
    /** An input whose key is suffixed with the partition base name before use. */
    DYNAMIC_INPUT,
    /** Local path allocated before the binary runs, uploaded after it exits. */
    OUTPUT
}
