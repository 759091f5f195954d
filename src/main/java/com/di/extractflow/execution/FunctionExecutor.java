package com.di.extractflow.execution;

import java.util.List;
import java.util.Map;

/**
 * Function-execution service: runs independent invocations of a {@link WorkerFunction} on
 * provisioned workers and hands back their results.
 */
public interface FunctionExecutor {

    /** One invocation per item; the returned futures are in item order. */
    <T, R> List<InvocationFuture<R>> map(WorkerFunction<T, R> fn, List<T> items, Map<String, String> extraEnv);

    <T, R> InvocationFuture<R> callAsync(WorkerFunction<T, R> fn, T item, Map<String, String> extraEnv);

    /**
     * Blocks until every future completed and returns the results in order.
     *
     * @throws PartialFailureException when at least one invocation raised
     */
    <R> List<R> getResult(List<InvocationFuture<R>> futures);

    int getRuntimeMemoryMb();

    int getCpusPerWorker();
}
