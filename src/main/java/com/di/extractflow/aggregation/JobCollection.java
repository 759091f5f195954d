package com.di.extractflow.aggregation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Completed steps grouped by step name, across runs. Serialized as a plain JSON object
 * {@code {"<step>": [CompletedStep, ...]}}.
 */
public class JobCollection {

    private final Map<String, List<CompletedStep>> steps;

    public JobCollection() {
        this.steps = new LinkedHashMap<>();
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public JobCollection(Map<String, List<CompletedStep>> steps) {
        this.steps = new LinkedHashMap<>();
        if (steps != null) {
            steps.forEach((name, list) -> this.steps.put(name, new ArrayList<>(list)));
        }
    }

    public synchronized void add(CompletedStep step) {
        steps.computeIfAbsent(step.getStepName(), k -> new ArrayList<>()).add(step);
    }

    public synchronized List<CompletedStep> get(String stepName) {
        return List.copyOf(steps.getOrDefault(stepName, List.of()));
    }

    public synchronized Set<String> stepNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(steps.keySet()));
    }

    public synchronized int size() {
        return steps.values().stream().mapToInt(List::size).sum();
    }

    @JsonValue
    public synchronized Map<String, List<CompletedStep>> asMap() {
        Map<String, List<CompletedStep>> copy = new LinkedHashMap<>();
        steps.forEach((name, list) -> copy.put(name, List.copyOf(list)));
        return Collections.unmodifiableMap(copy);
    }
}
