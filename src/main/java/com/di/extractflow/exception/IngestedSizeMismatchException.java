package com.di.extractflow.exception;

import lombok.Getter;

import java.util.List;

/**
 * Sum of bytes ingested by the workers of a step differs from the listed input size.
 */
@Getter
public class IngestedSizeMismatchException extends InvariantViolationException {

    private final long expectedBytes;
    private final long actualBytes;
    private final List<String> missingKeys;
    private final List<String> duplicateKeys;
    private final List<String> mismatchedKeys;

    public IngestedSizeMismatchException(String stepName,
                                         long expectedBytes,
                                         long actualBytes,
                                         List<String> missingKeys,
                                         List<String> duplicateKeys,
                                         List<String> mismatchedKeys) {
        super(String.format(
                "Step '%s' ingested %,d bytes but %,d were listed (missing=%s duplicate=%s mismatched=%s)",
                stepName, actualBytes, expectedBytes, missingKeys, duplicateKeys, mismatchedKeys));
        this.expectedBytes = expectedBytes;
        this.actualBytes = actualBytes;
        this.missingKeys = List.copyOf(missingKeys);
        this.duplicateKeys = List.copyOf(duplicateKeys);
        this.mismatchedKeys = List.copyOf(mismatchedKeys);
    }
}
