package com.di.extractflow.pipeline;

import com.di.extractflow.step.ParameterSet;

import java.util.List;

/** A named step and the parameter sets each of its workers runs in order. */
public record PipelineStep(String name, List<ParameterSet> parameterSets) {

    public PipelineStep {
        if (parameterSets == null || parameterSets.isEmpty()) {
            throw new IllegalArgumentException("Step '" + name + "' needs at least one parameter set");
        }
        parameterSets = List.copyOf(parameterSets);
    }
}
