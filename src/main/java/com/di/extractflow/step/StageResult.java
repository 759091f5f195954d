package com.di.extractflow.step;

import java.util.List;

/**
 * Outcome of running one parameter set for one partition.
 *
 * @param designatedInputBytes bytes downloaded for the designated input (0 when reused locally)
 * @param uploadedKeys         keys of the outputs uploaded after the binary exited
 * @param logKey               key of the uploaded stdout/stderr capture, or null
 */
public record StageResult(String parameterSet,
                          String binary,
                          int exitCode,
                          boolean complete,
                          boolean skipped,
                          long designatedInputBytes,
                          List<String> uploadedKeys,
                          String logKey) {

    public static StageResult skipped(ParameterSet ps) {
        return new StageResult(ps.getName(), ps.getBinary(), -1, false, true, 0L, List.of(), null);
    }
}
