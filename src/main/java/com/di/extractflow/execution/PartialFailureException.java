package com.di.extractflow.execution;

import com.di.extractflow.exception.ExtractFlowException;
import lombok.Getter;

import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Some invocations of a {@code map} raised. Holds the failure of every invocation that did, keyed by
 * input index; raised only after every invocation finished.
 */
@Getter
public class PartialFailureException extends ExtractFlowException {

    private final int total;
    private final Map<Integer, Throwable> failures;

    public PartialFailureException(int total, Map<Integer, Throwable> failures) {
        super(String.format("%d/%d invocation(s) failed: %s", failures.size(), total,
                new TreeMap<>(failures).entrySet().stream()
                        .map(e -> "#" + e.getKey() + " " + e.getValue().getMessage())
                        .collect(Collectors.joining(" | "))),
                failures.values().iterator().next());
        this.total = total;
        this.failures = new TreeMap<>(failures);
    }
}
