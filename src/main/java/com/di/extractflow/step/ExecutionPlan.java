package com.di.extractflow.step;

import java.util.List;

/**
 * Everything one worker needs: the partition it owns and the parameter sets resolved for it,
 * in the order they run.
 */
public record ExecutionPlan(int workerIndex, String partitionKey, String partitionBaseName, List<ParameterSet> parameterSets) {}
