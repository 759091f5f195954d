package com.di.extractflow.step;

import com.di.extractflow.profiling.WorkerProfile;

import java.util.List;
import java.util.Map;

/**
 * What one worker hands back to the step runner.
 *
 * @param ingested listed input key → bytes this worker downloaded for it
 * @param complete false when any stage failed under the tolerate policy
 */
public record WorkerResult(String invocationId,
                           String partitionKey,
                           Map<String, Long> ingested,
                           List<StageResult> stages,
                           boolean complete,
                           WorkerProfile profile,
                           String environment,
                           String instanceType) {
}
